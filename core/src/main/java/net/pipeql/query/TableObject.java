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
import java.util.Set;
import java.util.function.BiConsumer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;
import net.pipeql.values.AbstractValue;
import net.pipeql.values.ArrayValue;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * A lazy operation produced by calling a builtin. Table objects link to
 * their parents and are deduplicated by identity when the spec is 
 * built, never by value. Immutable.
 * 
 * @since 1.0
 */
public class TableObject extends AbstractValue implements ObjectValue {
  public static final String KIND_PROPERTY = "kind";
  public static final String PARENTS_PROPERTY = "parents";
  
  private final String kind;
  private final OperationSpec spec;
  private final List<TableObject> parents;
  private final ObjectValue args;
  
  /**
   * @param spec The non-null operation spec.
   * @param parents The parents in argument order.
   * @param args The call arguments.
   */
  public TableObject(final OperationSpec spec, 
                     final List<TableObject> parents, 
                     final ObjectValue args) {
    if (spec == null) {
      throw new IllegalArgumentException("Spec cannot be null.");
    }
    kind = spec.kind();
    this.spec = spec;
    this.parents = parents == null ? ImmutableList.<TableObject>of() 
        : ImmutableList.copyOf(parents);
    this.args = args == null ? Values.emptyObject() : args;
  }
  
  public String kind() {
    return kind;
  }
  
  public OperationSpec spec() {
    return spec;
  }
  
  public List<TableObject> parents() {
    return parents;
  }
  
  public ObjectValue args() {
    return args;
  }
  
  @Override
  public Type type() {
    return Types.TABLE;
  }
  
  @Override
  public ObjectValue object() {
    return this;
  }
  
  @Override
  public Value get(final String name) {
    if (KIND_PROPERTY.equals(name)) {
      return Values.newString(kind);
    }
    if (PARENTS_PROPERTY.equals(name)) {
      return parentsArray();
    }
    return args.get(name);
  }
  
  @Override
  public int len() {
    return keys().size();
  }
  
  @Override
  public Set<String> keys() {
    return ImmutableSet.<String>builder()
        .add(KIND_PROPERTY)
        .add(PARENTS_PROPERTY)
        .addAll(args.keys())
        .build();
  }
  
  @Override
  public void range(final BiConsumer<String, Value> consumer) {
    for (final String key : keys()) {
      consumer.accept(key, get(key));
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    return this == o;
  }
  
  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }
  
  @Override
  public String toString() {
    return kind + "(" + args.keys() + ")";
  }
  
  private ArrayValue parentsArray() {
    return Values.newArray(Types.TABLE, ImmutableList.<Value>copyOf(parents));
  }
}
