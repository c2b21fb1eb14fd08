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
package net.pipeql.storage;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.data.ColMeta;
import net.pipeql.data.DataType;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.execute.Aggregates;
import net.pipeql.execute.Allocator;
import net.pipeql.execute.ColListTableBuilder;
import net.pipeql.execute.DefaultGroupKey;
import net.pipeql.execute.ExecuteConstants;
import net.pipeql.execute.TableBuilder;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * A simple in-memory store of series per bucket. Series are identified by
 * their tags, including {@code _measurement} and {@code _field}, and hold
 * either integer or float points. Meant for tests and local runs.
 * 
 * @since 1.0
 */
public class MemoryStorageReader implements StorageReader {
  private static final Logger LOG = LoggerFactory.getLogger(
      MemoryStorageReader.class);
  
  /** The super inefficient in-memory db, guarded by this. */
  private final Map<String, Map<SortedMap<String, String>, Series>> database;
  
  public MemoryStorageReader() {
    database = Maps.newHashMap();
  }
  
  /**
   * Writes a float point.
   * @param bucket The non-null bucket.
   * @param measurement The non-null measurement.
   * @param field The non-null field.
   * @param tags Optional tags, may be null.
   * @param time The point time in epoch nanoseconds.
   * @param value The value.
   * @throws IllegalArgumentException if the series holds integers.
   */
  public synchronized void write(final String bucket, 
                    final String measurement, 
                    final String field, 
                    final Map<String, String> tags, 
                    final long time, 
                    final double value) {
    series(bucket, measurement, field, tags, DataType.FLOAT)
      .points.put(time, Values.newFloat(value));
  }
  
  /**
   * Writes an integer point.
   * @throws IllegalArgumentException if the series holds floats.
   * @see #write(String, String, String, Map, long, double)
   */
  public synchronized void write(final String bucket, 
                    final String measurement, 
                    final String field, 
                    final Map<String, String> tags, 
                    final long time, 
                    final long value) {
    series(bucket, measurement, field, tags, DataType.INT)
      .points.put(time, Values.newInt(value));
  }
  
  @Override
  public synchronized List<Table> read(final ReadSpec spec, 
                                       final Allocator allocator) {
    final Map<SortedMap<String, String>, Series> bucket = 
        database.get(spec.bucket());
    if (bucket == null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("No such bucket for read: " + spec);
      }
      return Collections.emptyList();
    }
    
    final List<Table> tables = Lists.newArrayList();
    for (final Series series : bucket.values()) {
      final NavigableMap<Long, Value> points = 
          series.points.subMap(spec.start(), true, spec.stop(), false);
      if (points.isEmpty()) {
        continue;
      }
      final GroupKey key = key(spec, series.tags);
      final TableBuilder builder = new ColListTableBuilder(key, allocator);
      try {
        for (final ColMeta col : key.cols()) {
          builder.addCol(col);
        }
        final int time_idx = builder.addCol(
            new ColMeta(ExecuteConstants.DEFAULT_TIME_LABEL, DataType.TIME));
        final int value_idx = builder.addCol(
            new ColMeta(ExecuteConstants.DEFAULT_VALUE_LABEL, series.type));
        for (final Map.Entry<Long, Value> point : points.entrySet()) {
          builder.appendTime(time_idx, point.getKey());
          builder.appendValue(value_idx, point.getValue());
        }
        for (int k = 0; k < key.cols().size(); k++) {
          for (int i = 0; i < points.size(); i++) {
            builder.appendValue(k, key.values().get(k));
          }
        }
        final Table raw = builder.table();
        tables.add(spec.aggregate() == null ? raw 
            : aggregate(spec.aggregate(), raw, allocator));
      } finally {
        builder.release();
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Read " + tables.size() + " tables for " + spec);
    }
    return tables;
  }
  
  private Table aggregate(final Aggregates aggregate, 
                          final Table raw, 
                          final Allocator allocator) {
    final int value_idx = raw.colIdx(ExecuteConstants.DEFAULT_VALUE_LABEL);
    final DataType type = aggregate.outputType(
        raw.cols().get(value_idx).type());
    final TableBuilder builder = new ColListTableBuilder(raw.key(), 
        allocator);
    try {
      for (final ColMeta col : raw.key().cols()) {
        builder.addCol(col);
      }
      final int idx = builder.addCol(
          new ColMeta(ExecuteConstants.DEFAULT_VALUE_LABEL, type));
      for (int k = 0; k < raw.key().cols().size(); k++) {
        builder.appendValue(k, raw.key().values().get(k));
      }
      final Value v = aggregate.aggregate(raw, value_idx);
      if (v == null) {
        builder.appendNil(idx);
      } else {
        builder.appendValue(idx, v);
      }
      return builder.table();
    } finally {
      builder.release();
    }
  }
  
  private static GroupKey key(final ReadSpec spec, 
                              final SortedMap<String, String> tags) {
    final List<ColMeta> cols = Lists.newArrayList();
    final List<Value> values = Lists.newArrayList();
    cols.add(new ColMeta(ExecuteConstants.DEFAULT_START_LABEL, DataType.TIME));
    values.add(Values.newTime(spec.start()));
    cols.add(new ColMeta(ExecuteConstants.DEFAULT_STOP_LABEL, DataType.TIME));
    values.add(Values.newTime(spec.stop()));
    for (final Map.Entry<String, String> tag : tags.entrySet()) {
      cols.add(new ColMeta(tag.getKey(), DataType.STRING));
      values.add(Values.newString(tag.getValue()));
    }
    return new DefaultGroupKey(cols, values);
  }
  
  private synchronized Series series(final String bucket, 
                                     final String measurement, 
                                     final String field, 
                                     final Map<String, String> tags, 
                                     final DataType type) {
    if (Strings.isNullOrEmpty(bucket)) {
      throw new IllegalArgumentException("Bucket cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(measurement)) {
      throw new IllegalArgumentException("Measurement cannot be null or "
          + "empty.");
    }
    if (Strings.isNullOrEmpty(field)) {
      throw new IllegalArgumentException("Field cannot be null or empty.");
    }
    final ImmutableSortedMap.Builder<String, String> builder = 
        ImmutableSortedMap.naturalOrder();
    if (tags != null) {
      builder.putAll(tags);
    }
    builder.put(ExecuteConstants.DEFAULT_MEASUREMENT_LABEL, measurement);
    builder.put(ExecuteConstants.DEFAULT_FIELD_LABEL, field);
    final SortedMap<String, String> id = builder.build();
    
    Map<SortedMap<String, String>, Series> series = database.get(bucket);
    if (series == null) {
      series = Maps.newLinkedHashMap();
      database.put(bucket, series);
    }
    Series s = series.get(id);
    if (s == null) {
      s = new Series(id, type);
      series.put(id, s);
    } else if (s.type != type) {
      throw new IllegalArgumentException("Series " + id + " holds " 
          + s.type + " values, cannot write " + type);
    }
    return s;
  }
  
  private static class Series {
    final SortedMap<String, String> tags;
    final DataType type;
    final NavigableMap<Long, Value> points;
    
    Series(final SortedMap<String, String> tags, final DataType type) {
      this.tags = tags;
      this.type = type;
      points = Maps.newTreeMap();
    }
  }
}
