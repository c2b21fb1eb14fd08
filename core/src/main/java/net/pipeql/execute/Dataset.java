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

/**
 * The output side of a transformation. Forwards tables, watermarks and 
 * completion to the transformations downstream.
 * 
 * @since 1.0
 */
public interface Dataset extends Node {

  public DatasetID id();
  
  public void retractTable(final GroupKey key);
  
  public void updateWatermark(final long time);
  
  public void updateProcessingTime(final long time);
  
  /**
   * Flushes remaining tables on success then finishes every consumer.
   * @param error The error or null.
   */
  public void finish(final Throwable error);
  
}
