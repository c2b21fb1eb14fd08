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
package net.pipeql.functions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import net.pipeql.exceptions.CompileException;
import net.pipeql.query.OperationSpec;
import net.pipeql.query.QueryTime;

/**
 * Restricts a table stream to {@code [start, stop)}.
 * 
 * @since 1.0
 */
public class RangeOpSpec implements OperationSpec {
  public static final String KIND = "range";
  
  private final QueryTime start;
  private final QueryTime stop;
  
  /**
   * @param start The non-null start.
   * @param stop The stop, null meaning now.
   */
  @JsonCreator
  public RangeOpSpec(@JsonProperty("start") final QueryTime start, 
                     @JsonProperty("stop") final QueryTime stop) {
    if (start == null) {
      throw new CompileException("range requires a start");
    }
    this.start = start;
    this.stop = stop == null ? QueryTime.NOW : stop;
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("start")
  public QueryTime start() {
    return start;
  }
  
  @JsonProperty("stop")
  public QueryTime stop() {
    return stop;
  }
}
