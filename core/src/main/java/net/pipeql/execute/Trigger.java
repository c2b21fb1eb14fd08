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

/**
 * Decides when a buffered table is emitted downstream.
 * 
 * @since 1.0
 */
public interface Trigger {

  /**
   * @param builder The table being buffered.
   * @param watermark The dataset watermark in Unix epoch nanoseconds.
   * @param processing_time The processing time in nanoseconds.
   * @return Whether the table should be emitted now.
   */
  public boolean triggered(final TableBuilder builder, 
                           final long watermark, 
                           final long processing_time);
  
  /** @return Whether the trigger will never fire again. */
  public boolean finished();
  
}
