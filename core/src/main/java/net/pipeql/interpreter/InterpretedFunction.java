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
package net.pipeql.interpreter;

import net.pipeql.ast.Expression;
import net.pipeql.exceptions.CompileException;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.semantic.FunctionType;
import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;
import net.pipeql.values.AbstractValue;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;

/**
 * A function literal closed over the scope it was defined in.
 * 
 * @since 1.0
 */
public class InterpretedFunction extends AbstractValue implements FunctionValue {
  private final Expression.FunctionExpression expression;
  private final Scope scope;
  private final Interpreter interpreter;
  private final FunctionType type;
  
  InterpretedFunction(final Expression.FunctionExpression expression, 
                      final Scope scope, 
                      final Interpreter interpreter) {
    this.expression = expression;
    this.scope = scope;
    this.interpreter = interpreter;
    final FunctionSignature.Builder builder = FunctionSignature.newBuilder();
    for (final Expression.Parameter param : expression.params()) {
      builder.addParam(param.name(), Types.ANY);
      if (param.isPipe()) {
        builder.setPipeArgument(param.name());
      }
    }
    type = new FunctionType(builder.build());
  }
  
  @Override
  public Type type() {
    return type;
  }
  
  @Override
  public FunctionValue function() {
    return this;
  }

  @Override
  public Value call(final ObjectValue args) {
    for (final String key : args.keys()) {
      if (!type.signature().params().containsKey(key)) {
        throw new CompileException("unknown argument \"" + key 
            + "\" to function at " + expression.position());
      }
    }
    final Scope local = scope.nest();
    for (final Expression.Parameter param : expression.params()) {
      Value v = args.get(param.name());
      if (v == null) {
        if (param.isPipe()) {
          throw new CompileException("missing pipe argument \"" 
              + param.name() + "\" to function at " + expression.position());
        }
        if (param.defaultValue() == null) {
          throw new CompileException("missing required argument \"" 
              + param.name() + "\" to function at " + expression.position());
        }
        v = interpreter.evaluate(param.defaultValue(), scope);
      }
      local.set(param.name(), v);
    }
    return interpreter.evaluateBody(expression.body(), local);
  }

  @Override
  public boolean hasSideEffect() {
    return false;
  }
  
  /** @return The literal source of the function. */
  public String source() {
    return expression.source();
  }
  
  /** @return The syntax tree. */
  public Expression.FunctionExpression expression() {
    return expression;
  }
  
  @Override
  public String toString() {
    return expression.source();
  }
}
