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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * The basic types and assignability rules.
 * 
 * @since 1.0
 */
public final class Types {

  public static final Type STRING = new BasicType(Kind.STRING);
  public static final Type INT = new BasicType(Kind.INT);
  public static final Type UINT = new BasicType(Kind.UINT);
  public static final Type FLOAT = new BasicType(Kind.FLOAT);
  public static final Type BOOL = new BasicType(Kind.BOOL);
  public static final Type TIME = new BasicType(Kind.TIME);
  public static final Type DURATION = new BasicType(Kind.DURATION);
  public static final Type REGEXP = new BasicType(Kind.REGEXP);
  public static final Type ANY = new BasicType(Kind.ANY);
  
  /** An object with no declared properties, assignable from any object. */
  public static final ObjectType EMPTY_OBJECT = 
      new ObjectType(ImmutableMap.<String, Type>of());
  
  /** The type of a lazy table operation. */
  public static final ObjectType TABLE = new ObjectType(
      ImmutableMap.<String, Type>of(
          "kind", STRING, 
          "parents", new ArrayType(ANY)));
  
  private Types() { }
  
  /**
   * Whether or not a value of type {@code actual} may be used where
   * {@code declared} is expected.
   * @param declared The declared type, non-null.
   * @param actual The actual type, non-null.
   * @return True if assignable.
   */
  public static boolean isAssignable(final Type declared, final Type actual) {
    if (declared.kind() == Kind.ANY) {
      return true;
    }
    if (declared.kind() != actual.kind()) {
      return false;
    }
    switch (declared.kind()) {
    case ARRAY:
      return isAssignable(((ArrayType) declared).elementType(), 
          ((ArrayType) actual).elementType()) ||
          // empty literals are typed as ANY.
          ((ArrayType) actual).elementType().kind() == Kind.ANY;
    case OBJECT:
      final Map<String, Type> props = ((ObjectType) actual).properties();
      for (final Map.Entry<String, Type> entry : 
          ((ObjectType) declared).properties().entrySet()) {
        final Type a = props.get(entry.getKey());
        if (a == null || !isAssignable(entry.getValue(), a)) {
          return false;
        }
      }
      return true;
    default:
      // functions are checked when they are called.
      return true;
    }
  }
  
  static class BasicType implements Type {
    private final Kind kind;
    
    BasicType(final Kind kind) {
      this.kind = kind;
    }
    
    @Override
    public Kind kind() {
      return kind;
    }
    
    @Override
    public String toString() {
      return kind.name().toLowerCase();
    }
  }
}
