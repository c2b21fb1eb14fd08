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

import net.pipeql.data.GroupKey;
import net.pipeql.exceptions.QueryExecutionException;

/**
 * Base for transformations writing into a cache-backed dataset. Window
 * events are forwarded to the dataset as is.
 * 
 * @since 1.0
 */
public abstract class AbstractTransformation implements Transformation {
  protected final Dataset dataset;
  protected final TableBuilderCache cache;
  
  protected AbstractTransformation(final Dataset dataset, 
                                   final TableBuilderCache cache) {
    this.dataset = dataset;
    this.cache = cache;
  }
  
  @Override
  public void retractTable(final DatasetID id, final GroupKey key) {
    dataset.retractTable(key);
  }
  
  @Override
  public void updateWatermark(final DatasetID id, final long time) {
    dataset.updateWatermark(time);
  }
  
  @Override
  public void updateProcessingTime(final DatasetID id, final long time) {
    dataset.updateProcessingTime(time);
  }
  
  @Override
  public void finish(final DatasetID id, final Throwable error) {
    dataset.finish(error);
  }
  
  /**
   * Returns a new builder for the key.
   * @throws net.pipeql.exceptions.QueryExecutionException if a table
   * with the key was already built.
   */
  protected TableBuilder newBuilder(final GroupKey key, final String name) {
    if (cache.hasTable(key)) {
      throw new QueryExecutionException(name 
          + " found duplicate table with key: " + key, 500);
    }
    return cache.tableBuilder(key);
  }
}
