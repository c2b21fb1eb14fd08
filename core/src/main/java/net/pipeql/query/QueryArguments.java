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
package net.pipeql.query;

import java.time.Instant;

import net.pipeql.exceptions.CompileException;
import net.pipeql.interpreter.Arguments;
import net.pipeql.utils.DateTime;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;

/**
 * Arguments with query specific accessors.
 * 
 * @since 1.0
 */
public class QueryArguments extends Arguments {

  public QueryArguments(final ObjectValue args) {
    super(args);
  }
  
  /**
   * Reads a time argument. Times are absolute, durations are relative to
   * now and integers are Unix epoch seconds.
   * @param name The argument name.
   * @return The time or null if absent.
   * @throws CompileException if the argument is of another kind.
   */
  public QueryTime getTime(final String name) {
    final Value v = get(name);
    return v == null ? null : toQueryTime(name, v);
  }
  
  public QueryTime getRequiredTime(final String name) {
    return toQueryTime(name, getRequired(name));
  }
  
  static QueryTime toQueryTime(final String name, final Value v) {
    switch (v.type().kind()) {
    case TIME:
      return QueryTime.absolute(DateTime.fromNanos(v.time()));
    case DURATION:
      return QueryTime.relative(v.duration());
    case INT:
      return QueryTime.absolute(Instant.ofEpochSecond(v.integer()));
    default:
      throw new CompileException("keyword argument \"" + name 
          + "\" should be a time or duration, but got " 
          + v.type().kind().name().toLowerCase());
    }
  }
}
