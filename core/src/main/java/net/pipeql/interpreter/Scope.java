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

import java.util.Map;

import com.google.common.collect.Maps;

import net.pipeql.values.Value;

/**
 * Lexical scope of identifiers. Lookups fall through to the parent.
 * 
 * @since 1.0
 */
public class Scope {
  private final Scope parent;
  private final Map<String, Value> values;
  
  public Scope(final Scope parent) {
    this.parent = parent;
    values = Maps.newLinkedHashMap();
  }
  
  /**
   * @param name A non-null name.
   * @return The value bound here or in a parent, null if unbound.
   */
  public Value lookup(final String name) {
    final Value v = values.get(name);
    if (v != null || parent == null) {
      return v;
    }
    return parent.lookup(name);
  }
  
  /**
   * Binds the name in this scope, shadowing any parent binding.
   * @param name A non-null name.
   * @param value A non-null value.
   */
  public void set(final String name, final Value value) {
    values.put(name, value);
  }
  
  /** @return A child scope. */
  public Scope nest() {
    return new Scope(this);
  }
  
  /** @return The bindings local to this scope. */
  public Map<String, Value> locals() {
    return values;
  }
}
