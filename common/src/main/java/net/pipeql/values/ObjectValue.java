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

import java.util.Set;
import java.util.function.BiConsumer;

/**
 * An immutable set of named values kept in insertion order.
 * 
 * @since 1.0
 */
public interface ObjectValue extends Value {

  /**
   * @param name A non-null property name.
   * @return The value or null if not present.
   */
  public Value get(final String name);
  
  public int len();
  
  /** @return The property names in order. */
  public Set<String> keys();
  
  /**
   * Iterates over the properties in order.
   * @param consumer A non-null consumer of name and value.
   */
  public void range(final BiConsumer<String, Value> consumer);
  
}
