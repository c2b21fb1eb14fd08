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

import net.pipeql.semantic.Type;

/**
 * A runtime value. Exactly one accessor is valid for a given value, the
 * one matching {@link Type#kind()}; the others throw 
 * {@link UnexpectedKindException}.
 * 
 * @since 1.0
 */
public interface Value {

  /** @return The non-null structural type. */
  public Type type();
  
  public String str();
  
  public long integer();
  
  /** @return The unsigned value in a long, compare with 
   * {@link Long#compareUnsigned(long, long)}. */
  public long uinteger();
  
  public double floatValue();
  
  public boolean bool();
  
  /** @return Unix epoch nanoseconds. */
  public long time();
  
  /** @return The duration in nanoseconds. */
  public long duration();
  
  public Pattern regexp();
  
  public ArrayValue array();
  
  public ObjectValue object();
  
  public FunctionValue function();
  
}
