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
package net.pipeql.values;

import java.util.regex.Pattern;

import net.pipeql.semantic.Kind;

/**
 * Base that fails every accessor. Implementations override the one 
 * matching their kind.
 * 
 * @since 1.0
 */
public abstract class AbstractValue implements Value {

  @Override
  public String str() {
    throw new UnexpectedKindException(Kind.STRING, type().kind());
  }

  @Override
  public long integer() {
    throw new UnexpectedKindException(Kind.INT, type().kind());
  }

  @Override
  public long uinteger() {
    throw new UnexpectedKindException(Kind.UINT, type().kind());
  }

  @Override
  public double floatValue() {
    throw new UnexpectedKindException(Kind.FLOAT, type().kind());
  }

  @Override
  public boolean bool() {
    throw new UnexpectedKindException(Kind.BOOL, type().kind());
  }

  @Override
  public long time() {
    throw new UnexpectedKindException(Kind.TIME, type().kind());
  }

  @Override
  public long duration() {
    throw new UnexpectedKindException(Kind.DURATION, type().kind());
  }

  @Override
  public Pattern regexp() {
    throw new UnexpectedKindException(Kind.REGEXP, type().kind());
  }

  @Override
  public ArrayValue array() {
    throw new UnexpectedKindException(Kind.ARRAY, type().kind());
  }

  @Override
  public ObjectValue object() {
    throw new UnexpectedKindException(Kind.OBJECT, type().kind());
  }

  @Override
  public FunctionValue function() {
    throw new UnexpectedKindException(Kind.FUNCTION, type().kind());
  }
  
}
