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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.semantic.FunctionType;
import net.pipeql.semantic.Kind;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * A user function of exactly one parameter, e.g. the row predicate of
 * {@code filter} or the column mapper of {@code rename}.
 * 
 * @since 1.0
 */
public class SingleArgFunction {
  private final FunctionValue fn;
  private final String param;
  private final Kind returns;
  
  /**
   * @param fn The non-null function.
   * @param returns The kind the function must return.
   * @throws QueryExecutionException if the function does not have exactly
   * one parameter.
   */
  public SingleArgFunction(final FunctionValue fn, final Kind returns) {
    if (fn == null) {
      throw new IllegalArgumentException("Function cannot be null.");
    }
    final Map<String, ?> params = 
        ((FunctionType) fn.type()).signature().params();
    if (params.size() != 1) {
      throw new QueryExecutionException("function should only have a single "
          + "parameter, got " + params.keySet(), 400);
    }
    this.fn = fn;
    param = params.keySet().iterator().next();
    this.returns = returns;
  }
  
  /**
   * @param arg The argument.
   * @return The result, checked against the expected kind.
   * @throws QueryExecutionException if the result is of the wrong kind.
   */
  public Value call(final Value arg) {
    final Value result = fn.call(Values.newObject(
        ImmutableMap.<String, Value>of(param, arg)));
    if (result == null || result.type().kind() != returns) {
      throw new QueryExecutionException("function " + fn + " should return " 
          + returns.name().toLowerCase() + ", got " 
          + (result == null ? "null" : result.type()), 400);
    }
    return result;
  }
}
