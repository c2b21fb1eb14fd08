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
package net.pipeql.semantic;

/**
 * The type of a callable value.
 * 
 * @since 1.0
 */
public class FunctionType implements Type {
  private final FunctionSignature signature;
  
  public FunctionType(final FunctionSignature signature) {
    if (signature == null) {
      throw new IllegalArgumentException("Signature cannot be null.");
    }
    this.signature = signature;
  }
  
  @Override
  public Kind kind() {
    return Kind.FUNCTION;
  }
  
  public FunctionSignature signature() {
    return signature;
  }
  
  @Override
  public String toString() {
    return "function" + signature.params().keySet();
  }
}
