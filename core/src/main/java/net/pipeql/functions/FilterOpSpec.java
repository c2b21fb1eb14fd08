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
import net.pipeql.values.FunctionValue;

/**
 * Keeps the rows for which the predicate {@code fn(r)} is true.
 * 
 * @since 1.0
 */
public class FilterOpSpec implements OperationSpec {
  public static final String KIND = "filter";
  
  private final FunctionValue fn;
  
  public FilterOpSpec(final FunctionValue fn) {
    if (fn == null) {
      throw new CompileException("filter requires a function");
    }
    this.fn = fn;
  }
  
  @JsonCreator
  public static FilterOpSpec fromJson(@JsonProperty("fn") final String fn) {
    return new FilterOpSpec(Functions.compile(fn));
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  public FunctionValue fn() {
    return fn;
  }
  
  @JsonProperty("fn")
  public String fnSource() {
    return Functions.source(fn);
  }
}
