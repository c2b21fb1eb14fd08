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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import net.pipeql.exceptions.CompileException;
import net.pipeql.values.FunctionValue;

/**
 * Removes the named columns, or those matching the predicate.
 * 
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DropOpSpec implements SchemaMutation {
  public static final String KIND = "drop";
  
  private final List<String> columns;
  private final FunctionValue fn;
  
  public DropOpSpec(final List<String> columns, final FunctionValue fn) {
    if ((columns == null) == (fn == null)) {
      throw new CompileException("drop requires exactly one of columns or fn");
    }
    this.columns = columns == null ? null : ImmutableList.copyOf(columns);
    this.fn = fn;
  }
  
  @JsonCreator
  public static DropOpSpec fromJson(
      @JsonProperty("columns") final List<String> columns, 
      @JsonProperty("fn") final String fn) {
    return new DropOpSpec(columns, Functions.compile(fn));
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("columns")
  public List<String> columns() {
    return columns;
  }
  
  public FunctionValue fn() {
    return fn;
  }
  
  @JsonProperty("fn")
  public String fnSource() {
    return Functions.source(fn);
  }
  
  @Override
  public SchemaMutator mutator() {
    return new DropKeepMutator(KIND, columns, fn, false);
  }
}
