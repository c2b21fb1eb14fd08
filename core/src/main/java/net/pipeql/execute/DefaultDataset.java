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

import com.google.common.collect.Lists;

import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;

/**
 * A dataset backed by a {@link TableBuilderCache}. Tables are emitted 
 * when their trigger fires on a watermark update, and all remaining 
 * tables are emitted when the dataset finishes successfully.
 * 
 * @since 1.0
 */
public class DefaultDataset implements Dataset {
  private final DatasetID id;
  private final TableBuilderCache cache;
  private final List<Transformation> transformations;
  private long watermark;
  private long processing_time;
  
  /**
   * Default ctor.
   * @param id A non-null dataset ID.
   * @param mode The accumulation mode, must be discarding.
   * @param cache A non-null cache the transformation writes to.
   */
  public DefaultDataset(final DatasetID id, 
                        final AccumulationMode mode, 
                        final TableBuilderCache cache) {
    if (id == null) {
      throw new IllegalArgumentException("ID cannot be null.");
    }
    if (mode != AccumulationMode.DISCARDING) {
      throw new IllegalArgumentException("Unsupported accumulation mode: " 
          + mode);
    }
    if (cache == null) {
      throw new IllegalArgumentException("Cache cannot be null.");
    }
    this.id = id;
    this.cache = cache;
    transformations = Lists.newArrayList();
  }
  
  @Override
  public DatasetID id() {
    return id;
  }
  
  @Override
  public void addTransformation(final Transformation t) {
    transformations.add(t);
  }
  
  @Override
  public void retractTable(final GroupKey key) {
    cache.discardTable(key);
    for (final Transformation t : transformations) {
      t.retractTable(id, key);
    }
  }
  
  @Override
  public void updateWatermark(final long time) {
    watermark = time;
    evalTriggers();
    for (final Transformation t : transformations) {
      t.updateWatermark(id, time);
    }
  }
  
  @Override
  public void updateProcessingTime(final long time) {
    processing_time = time;
    evalTriggers();
    for (final Transformation t : transformations) {
      t.updateProcessingTime(id, time);
    }
  }
  
  @Override
  public void finish(final Throwable error) {
    if (error == null) {
      for (final GroupKey key : cache.keys()) {
        triggerTable(key);
        cache.expireTable(key);
      }
    } else {
      for (final GroupKey key : cache.keys()) {
        cache.expireTable(key);
      }
    }
    for (final Transformation t : transformations) {
      t.finish(id, error);
    }
  }
  
  private void evalTriggers() {
    for (final GroupKey key : cache.keys()) {
      final Trigger trigger = cache.trigger(key);
      if (trigger.triggered(cache.builder(key), watermark, processing_time)) {
        triggerTable(key);
      }
      if (trigger.finished()) {
        cache.expireTable(key);
      }
    }
  }
  
  private void triggerTable(final GroupKey key) {
    final Table table = cache.table(key);
    if (table == null) {
      return;
    }
    for (final Transformation t : transformations) {
      t.process(id, table);
    }
    cache.discardTable(key);
  }
}
