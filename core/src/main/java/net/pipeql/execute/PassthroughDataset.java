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
 * A dataset without a cache for transformations that emit tables as 
 * they go, e.g. filters and sources.
 * 
 * @since 1.0
 */
public class PassthroughDataset implements Dataset {
  private final DatasetID id;
  private final List<Transformation> transformations;
  
  public PassthroughDataset(final DatasetID id) {
    this.id = id;
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
  
  /** Emits the table to every consumer. */
  public void process(final Table table) {
    for (final Transformation t : transformations) {
      t.process(id, table);
    }
  }
  
  @Override
  public void retractTable(final GroupKey key) {
    for (final Transformation t : transformations) {
      t.retractTable(id, key);
    }
  }
  
  @Override
  public void updateWatermark(final long time) {
    for (final Transformation t : transformations) {
      t.updateWatermark(id, time);
    }
  }
  
  @Override
  public void updateProcessingTime(final long time) {
    for (final Transformation t : transformations) {
      t.updateProcessingTime(id, time);
    }
  }
  
  @Override
  public void finish(final Throwable error) {
    for (final Transformation t : transformations) {
      t.finish(id, error);
    }
  }
}
