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
import net.pipeql.data.Table;

/**
 * Consumes the tables of one or more parent datasets. Calls for one 
 * transformation are never concurrent. After {@link #finish} for a
 * parent no further calls arrive for that parent.
 * <p>
 * Errors are thrown as unchecked exceptions and cause the transformation
 * and everything downstream to finish with the error.
 * 
 * @since 1.0
 */
public interface Transformation {

  /** Invalidates a table previously processed for the key. */
  public void retractTable(final DatasetID id, final GroupKey key);
  
  /**
   * Consumes an immutable table.
   * @param id The parent dataset.
   * @param table The non-null table.
   */
  public void process(final DatasetID id, final Table table);
  
  /** @param time Unix epoch nanoseconds, monotonic per parent. */
  public void updateWatermark(final DatasetID id, final long time);
  
  /** @param time Processing time in nanoseconds, monotonic per parent. */
  public void updateProcessingTime(final DatasetID id, final long time);
  
  /**
   * Signals the parent is done.
   * @param id The parent dataset.
   * @param error The error if the parent failed, null on success.
   */
  public void finish(final DatasetID id, final Throwable error);
  
}
