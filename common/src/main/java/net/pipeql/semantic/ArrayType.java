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

import java.util.Objects;

/**
 * An array of a single element type.
 * 
 * @since 1.0
 */
public class ArrayType implements Type {
  private final Type element_type;
  
  public ArrayType(final Type element_type) {
    if (element_type == null) {
      throw new IllegalArgumentException("Element type cannot be null.");
    }
    this.element_type = element_type;
  }
  
  @Override
  public Kind kind() {
    return Kind.ARRAY;
  }
  
  public Type elementType() {
    return element_type;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ArrayType)) {
      return false;
    }
    return kindEquals(element_type, ((ArrayType) o).element_type);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(Kind.ARRAY, element_type.kind());
  }
  
  @Override
  public String toString() {
    return "[" + element_type + "]";
  }
  
  static boolean kindEquals(final Type a, final Type b) {
    return a == b || a.equals(b) || 
        (a.kind() == b.kind() && a.kind() != Kind.ARRAY 
          && a.kind() != Kind.OBJECT && a.kind() != Kind.FUNCTION);
  }
}
