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

import java.util.List;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.pipeql.exceptions.CompileException;
import net.pipeql.semantic.Kind;
import net.pipeql.values.ArrayValue;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;

/**
 * Typed access to the keyword arguments of a call. Every argument read
 * is marked as used so callers can reject arguments nobody consumed.
 * 
 * @since 1.0
 */
public class Arguments {
  protected final ObjectValue args;
  protected final Set<String> used;
  
  public Arguments(final ObjectValue args) {
    if (args == null) {
      throw new IllegalArgumentException("Arguments cannot be null.");
    }
    this.args = args;
    used = Sets.newHashSet();
  }
  
  /** @return The raw arguments. */
  public ObjectValue object() {
    return args;
  }
  
  /**
   * @param name The argument name.
   * @return The value or null if absent.
   */
  public Value get(final String name) {
    used.add(name);
    return args.get(name);
  }
  
  /**
   * @param name The argument name.
   * @return The non-null value.
   * @throws CompileException if missing.
   */
  public Value getRequired(final String name) {
    final Value v = get(name);
    if (v == null) {
      throw new CompileException("missing required keyword argument \"" 
          + name + "\"");
    }
    return v;
  }
  
  public String getString(final String name) {
    final Value v = get(name, Kind.STRING);
    return v == null ? null : v.str();
  }
  
  public String getRequiredString(final String name) {
    return getRequired(name, Kind.STRING).str();
  }
  
  /** @return The integer or null if absent. */
  public Long getInt(final String name) {
    final Value v = get(name, Kind.INT);
    return v == null ? null : v.integer();
  }
  
  public long getRequiredInt(final String name) {
    return getRequired(name, Kind.INT).integer();
  }
  
  /** @return The float or null if absent. Integers are widened. */
  public Double getFloat(final String name) {
    final Value v = get(name);
    if (v == null) {
      return null;
    }
    if (v.type().kind() == Kind.INT) {
      return (double) v.integer();
    }
    check(name, v, Kind.FLOAT);
    return v.floatValue();
  }
  
  /** @return The boolean or null if absent. */
  public Boolean getBool(final String name) {
    final Value v = get(name, Kind.BOOL);
    return v == null ? null : v.bool();
  }
  
  /** @return The duration in nanoseconds or null if absent. */
  public Long getDuration(final String name) {
    final Value v = get(name, Kind.DURATION);
    return v == null ? null : v.duration();
  }
  
  public ArrayValue getArray(final String name) {
    final Value v = get(name, Kind.ARRAY);
    return v == null ? null : v.array();
  }
  
  public ArrayValue getRequiredArray(final String name) {
    return getRequired(name, Kind.ARRAY).array();
  }
  
  /**
   * Reads an array of strings.
   * @return The strings or null if absent.
   * @throws CompileException if an element is not a string.
   */
  public List<String> getStrings(final String name) {
    final ArrayValue array = getArray(name);
    if (array == null) {
      return null;
    }
    final List<String> strings = Lists.newArrayListWithCapacity(array.len());
    for (int i = 0; i < array.len(); i++) {
      final Value v = array.get(i);
      if (v.type().kind() != Kind.STRING) {
        throw new CompileException("keyword argument \"" + name 
            + "\" should be an array of strings, but element " + i 
            + " is " + kindName(v.type().kind()));
      }
      strings.add(v.str());
    }
    return strings;
  }
  
  public ObjectValue getObject(final String name) {
    final Value v = get(name, Kind.OBJECT);
    return v == null ? null : v.object();
  }
  
  public ObjectValue getRequiredObject(final String name) {
    return getRequired(name, Kind.OBJECT).object();
  }
  
  public FunctionValue getFunction(final String name) {
    final Value v = get(name, Kind.FUNCTION);
    return v == null ? null : v.function();
  }
  
  public FunctionValue getRequiredFunction(final String name) {
    return getRequired(name, Kind.FUNCTION).function();
  }
  
  /** @return The argument names that were never read, in order. */
  public List<String> listUnused() {
    final List<String> unused = Lists.newArrayList();
    for (final String key : args.keys()) {
      if (!used.contains(key)) {
        unused.add(key);
      }
    }
    return unused;
  }
  
  protected Value get(final String name, final Kind kind) {
    final Value v = get(name);
    if (v != null) {
      check(name, v, kind);
    }
    return v;
  }
  
  protected Value getRequired(final String name, final Kind kind) {
    final Value v = getRequired(name);
    check(name, v, kind);
    return v;
  }
  
  protected static void check(final String name, 
                              final Value v, 
                              final Kind kind) {
    if (v.type().kind() != kind) {
      throw new CompileException("keyword argument \"" + name 
          + "\" should be of kind " + kindName(kind) + ", but got " 
          + kindName(v.type().kind()));
    }
  }
  
  static String kindName(final Kind kind) {
    return kind.name().toLowerCase();
  }
}
