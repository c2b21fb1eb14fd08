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

import java.util.List;
import java.util.Map;

import net.pipeql.exceptions.CompileException;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.semantic.FunctionType;
import net.pipeql.semantic.Kind;
import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;
import net.pipeql.values.AbstractValue;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;

/**
 * A registered function that produces a {@link TableObject} when called.
 * 
 * @since 1.0
 */
public class BuiltinFunction extends AbstractValue implements FunctionValue {
  private final String name;
  private final FunctionType type;
  private final CreateOperationSpec create;
  private final boolean side_effect;
  
  public BuiltinFunction(final String name, 
                         final FunctionSignature signature, 
                         final CreateOperationSpec create, 
                         final boolean side_effect) {
    this.name = name;
    type = new FunctionType(signature);
    this.create = create;
    this.side_effect = side_effect;
  }
  
  public String name() {
    return name;
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
    final Map<String, Type> params = type.signature().params();
    for (final String key : args.keys()) {
      final Type declared = params.get(key);
      if (declared == null || declared.kind() == Kind.ANY) {
        continue;
      }
      final Type actual = args.get(key).type();
      if (!Types.isAssignable(declared, actual)) {
        throw new CompileException("keyword argument \"" + key + "\" to " 
            + name + " should be of type " + declared + ", but got " + actual);
      }
    }
    final QueryArguments arguments = new QueryArguments(args);
    final Administration administration = new Administration(arguments);
    final OperationSpec spec = create.create(arguments, administration);
    final List<String> unused = arguments.listUnused();
    if (!unused.isEmpty()) {
      throw new CompileException("unused arguments " + unused 
          + " in call to " + name);
    }
    return new TableObject(spec, administration.parents(), args);
  }
  
  @Override
  public boolean hasSideEffect() {
    return side_effect;
  }
  
  @Override
  public String toString() {
    return "builtin(" + name + ")";
  }
}
