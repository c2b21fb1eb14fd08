// This file is part of PipeQL.
// Copyright (C) 2018-2020  The PipeQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pipeql.execute;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;

/**
 * The table builders of one dataset keyed by group key, each with its 
 * trigger. Iteration is in key order. Owned by a single transformation
 * and not thread safe.
 * 
 * @since 1.0
 */
public class TableBuilderCache {
  private final Allocator allocator;
  private final Map<GroupKey, Entry> tables;
  
  public TableBuilderCache(final Allocator allocator) {
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null.");
    }
    this.allocator = allocator;
    tables = Maps.newTreeMap();
  }
  
  /**
   * Returns the builder for the key, creating it if missing.
   * @param key A non-null key.
   * @return The builder.
   */
  public TableBuilder tableBuilder(final GroupKey key) {
    Entry entry = tables.get(key);
    if (entry == null) {
      entry = new Entry(new ColListTableBuilder(key, allocator), 
          new AfterWatermarkTrigger());
      tables.put(key, entry);
    }
    return entry.builder;
  }
  
  /** @return Whether a builder exists for the key. */
  public boolean hasTable(final GroupKey key) {
    return tables.containsKey(key);
  }
  
  /**
   * @param key A key.
   * @return A snapshot of the builder's rows or null if no builder.
   */
  public Table table(final GroupKey key) {
    final Entry entry = tables.get(key);
    return entry == null ? null : entry.builder.table();
  }
  
  /** @return The keys in order. */
  public List<GroupKey> keys() {
    return Lists.newArrayList(tables.keySet());
  }
  
  Trigger trigger(final GroupKey key) {
    final Entry entry = tables.get(key);
    return entry == null ? null : entry.trigger;
  }
  
  TableBuilder builder(final GroupKey key) {
    final Entry entry = tables.get(key);
    return entry == null ? null : entry.builder;
  }
  
  /** Clears the rows of the builder but keeps it. */
  public void discardTable(final GroupKey key) {
    final Entry entry = tables.get(key);
    if (entry != null) {
      entry.builder.clearData();
    }
  }
  
  /** Removes the builder and releases its memory. */
  public void expireTable(final GroupKey key) {
    final Entry entry = tables.remove(key);
    if (entry != null) {
      entry.builder.release();
    }
  }
  
  public int size() {
    return tables.size();
  }
  
  public Allocator allocator() {
    return allocator;
  }
  
  private static class Entry {
    final TableBuilder builder;
    final Trigger trigger;
    
    Entry(final TableBuilder builder, final Trigger trigger) {
      this.builder = builder;
      this.trigger = trigger;
    }
  }
}
