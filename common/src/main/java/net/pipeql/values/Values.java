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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.pipeql.semantic.ArrayType;
import net.pipeql.semantic.Kind;
import net.pipeql.semantic.ObjectType;
import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;

/**
 * Factories for the basic values and value equality.
 * 
 * @since 1.0
 */
public final class Values {

  private Values() { }
  
  public static Value newString(final String v) {
    if (v == null) {
      throw new IllegalArgumentException("String cannot be null.");
    }
    return new Basic(Types.STRING, v);
  }
  
  public static Value newInt(final long v) {
    return new Basic(Types.INT, v);
  }
  
  public static Value newUInt(final long v) {
    return new Basic(Types.UINT, v);
  }
  
  public static Value newFloat(final double v) {
    return new Basic(Types.FLOAT, v);
  }
  
  public static Value newBool(final boolean v) {
    return new Basic(Types.BOOL, v);
  }
  
  /** @param nanos Unix epoch nanoseconds. */
  public static Value newTime(final long nanos) {
    return new Basic(Types.TIME, nanos);
  }
  
  /** @param nanos A duration in nanoseconds. */
  public static Value newDuration(final long nanos) {
    return new Basic(Types.DURATION, nanos);
  }
  
  public static Value newRegexp(final Pattern v) {
    if (v == null) {
      throw new IllegalArgumentException("Pattern cannot be null.");
    }
    return new Basic(Types.REGEXP, v);
  }
  
  /**
   * @param element_type The element type.
   * @param elements A non-null list, copied.
   * @return An immutable array.
   */
  public static ArrayValue newArray(final Type element_type, 
                                    final List<Value> elements) {
    return new DefaultArray(new ArrayType(element_type), elements);
  }
  
  /**
   * @param properties A non-null map, copied in iteration order.
   * @return An immutable object.
   */
  public static ObjectValue newObject(final Map<String, Value> properties) {
    return new DefaultObject(properties);
  }
  
  /** @return An empty object. */
  public static ObjectValue emptyObject() {
    return new DefaultObject(ImmutableMap.<String, Value>of());
  }
  
  /**
   * Equality for any pair of values. Mismatched kinds are never equal.
   * Functions compare by identity.
   * @param a A value, may be null.
   * @param b A value, may be null.
   * @return True if equal.
   */
  public static boolean equal(final Value a, final Value b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    if (a.type().kind() != b.type().kind()) {
      return false;
    }
    switch (a.type().kind()) {
    case STRING:
      return a.str().equals(b.str());
    case INT:
      return a.integer() == b.integer();
    case UINT:
      return a.uinteger() == b.uinteger();
    case FLOAT:
      return Double.compare(a.floatValue(), b.floatValue()) == 0;
    case BOOL:
      return a.bool() == b.bool();
    case TIME:
      return a.time() == b.time();
    case DURATION:
      return a.duration() == b.duration();
    case REGEXP:
      return a.regexp().pattern().equals(b.regexp().pattern());
    case ARRAY:
      final ArrayValue x = a.array();
      final ArrayValue y = b.array();
      if (x.len() != y.len()) {
        return false;
      }
      for (int i = 0; i < x.len(); i++) {
        if (!equal(x.get(i), y.get(i))) {
          return false;
        }
      }
      return true;
    case OBJECT:
      final ObjectValue l = a.object();
      final ObjectValue r = b.object();
      if (!l.keys().equals(r.keys())) {
        return false;
      }
      for (final String key : l.keys()) {
        if (!equal(l.get(key), r.get(key))) {
          return false;
        }
      }
      return true;
    default:
      return false;
    }
  }
  
  /** A scalar value. */
  static class Basic extends AbstractValue {
    private final Type type;
    private final Object v;
    
    Basic(final Type type, final Object v) {
      this.type = type;
      this.v = v;
    }
    
    @Override
    public Type type() {
      return type;
    }
    
    @Override
    public String str() {
      check(Kind.STRING);
      return (String) v;
    }
    
    @Override
    public long integer() {
      check(Kind.INT);
      return (Long) v;
    }
    
    @Override
    public long uinteger() {
      check(Kind.UINT);
      return (Long) v;
    }
    
    @Override
    public double floatValue() {
      check(Kind.FLOAT);
      return (Double) v;
    }
    
    @Override
    public boolean bool() {
      check(Kind.BOOL);
      return (Boolean) v;
    }
    
    @Override
    public long time() {
      check(Kind.TIME);
      return (Long) v;
    }
    
    @Override
    public long duration() {
      check(Kind.DURATION);
      return (Long) v;
    }
    
    @Override
    public Pattern regexp() {
      check(Kind.REGEXP);
      return (Pattern) v;
    }
    
    @Override
    public boolean equals(final Object o) {
      return o instanceof Value && equal(this, (Value) o);
    }
    
    @Override
    public int hashCode() {
      return type.kind() == Kind.REGEXP ? 
          ((Pattern) v).pattern().hashCode() : v.hashCode();
    }
    
    @Override
    public String toString() {
      if (type.kind() == Kind.UINT) {
        return Long.toUnsignedString((Long) v);
      }
      return String.valueOf(v);
    }
    
    private void check(final Kind kind) {
      if (type.kind() != kind) {
        throw new UnexpectedKindException(kind, type.kind());
      }
    }
  }
  
  static class DefaultArray extends AbstractValue implements ArrayValue {
    private final ArrayType type;
    private final List<Value> elements;
    
    DefaultArray(final ArrayType type, final List<Value> elements) {
      if (elements == null) {
        throw new IllegalArgumentException("Elements cannot be null.");
      }
      this.type = type;
      this.elements = ImmutableList.copyOf(elements);
    }
    
    @Override
    public Type type() {
      return type;
    }
    
    @Override
    public ArrayValue array() {
      return this;
    }
    
    @Override
    public int len() {
      return elements.size();
    }
    
    @Override
    public Value get(final int i) {
      return elements.get(i);
    }
    
    @Override
    public void range(final BiConsumer<Integer, Value> consumer) {
      for (int i = 0; i < elements.size(); i++) {
        consumer.accept(i, elements.get(i));
      }
    }
    
    @Override
    public boolean equals(final Object o) {
      return o instanceof Value && equal(this, (Value) o);
    }
    
    @Override
    public int hashCode() {
      return Arrays.hashCode(elements.toArray());
    }
    
    @Override
    public String toString() {
      return elements.toString();
    }
  }
  
  static class DefaultObject extends AbstractValue implements ObjectValue {
    private final Map<String, Value> properties;
    private final ObjectType type;
    
    DefaultObject(final Map<String, Value> properties) {
      if (properties == null) {
        throw new IllegalArgumentException("Properties cannot be null.");
      }
      this.properties = ImmutableMap.copyOf(properties);
      final Map<String, Type> types = Maps.newLinkedHashMap();
      for (final Map.Entry<String, Value> entry : this.properties.entrySet()) {
        types.put(entry.getKey(), entry.getValue().type());
      }
      type = new ObjectType(types);
    }
    
    @Override
    public Type type() {
      return type;
    }
    
    @Override
    public ObjectValue object() {
      return this;
    }
    
    @Override
    public Value get(final String name) {
      return properties.get(name);
    }
    
    @Override
    public int len() {
      return properties.size();
    }
    
    @Override
    public Set<String> keys() {
      return properties.keySet();
    }
    
    @Override
    public void range(final BiConsumer<String, Value> consumer) {
      for (final Map.Entry<String, Value> entry : properties.entrySet()) {
        consumer.accept(entry.getKey(), entry.getValue());
      }
    }
    
    @Override
    public boolean equals(final Object o) {
      return o instanceof Value && equal(this, (Value) o);
    }
    
    @Override
    public int hashCode() {
      return properties.keySet().hashCode();
    }
    
    @Override
    public String toString() {
      return properties.toString();
    }
  }
}
