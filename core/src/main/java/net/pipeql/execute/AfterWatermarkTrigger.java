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

import net.pipeql.semantic.Kind;
import net.pipeql.values.Value;

/**
 * Fires once the watermark passes the table's {@code _stop} key value.
 * Tables without a time stop in their key only fire when the dataset
 * finishes.
 * 
 * @since 1.0
 */
public class AfterWatermarkTrigger implements Trigger {
  private boolean finished;
  
  @Override
  public boolean triggered(final TableBuilder builder, 
                           final long watermark, 
                           final long processing_time) {
    final Value stop = builder.key().labelValue(ExecuteConstants.DEFAULT_STOP_LABEL);
    if (stop == null || stop.type().kind() != Kind.TIME) {
      return false;
    }
    if (watermark >= stop.time()) {
      finished = true;
      return true;
    }
    return false;
  }
  
  @Override
  public boolean finished() {
    return finished;
  }
}
