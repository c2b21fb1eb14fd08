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

import java.util.Collections;

import net.pipeql.exceptions.CompileException;
import net.pipeql.interpreter.InterpretedFunction;
import net.pipeql.interpreter.Interpreter;
import net.pipeql.interpreter.Scope;
import net.pipeql.parser.Parser;
import net.pipeql.semantic.Kind;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.Value;

/**
 * Helpers for operation specs carrying function arguments. Functions are
 * written to JSON as their source text and compiled again on read in an
 * empty scope.
 * 
 * @since 1.0
 */
public final class Functions {
  private static final String BINDING = "fn";
  
  private Functions() { }
  
  /**
   * @param fn A function or null.
   * @return The source text of the function, null if fn was null.
   * @throws IllegalStateException if the function was not written in the
   * script language.
   */
  public static String source(final FunctionValue fn) {
    if (fn == null) {
      return null;
    }
    if (!(fn instanceof InterpretedFunction)) {
      throw new IllegalStateException("Builtin function " + fn 
          + " cannot be serialized.");
    }
    return ((InterpretedFunction) fn).source();
  }
  
  /**
   * @param source The source of a function expression, may be null.
   * @return The compiled function or null if the source was null or empty.
   * @throws CompileException if the source is not a function expression.
   */
  public static FunctionValue compile(final String source) {
    if (source == null || source.isEmpty()) {
      return null;
    }
    final Scope scope = new Scope(null);
    final Interpreter interpreter = new Interpreter(
        Collections.<String, Value>emptyMap(), scope);
    interpreter.eval(Parser.parse(BINDING + " = " + source));
    final Value fn = scope.lookup(BINDING);
    if (fn == null || fn.type().kind() != Kind.FUNCTION) {
      throw new CompileException("expected a function but got: " + source);
    }
    return fn.function();
  }
}
