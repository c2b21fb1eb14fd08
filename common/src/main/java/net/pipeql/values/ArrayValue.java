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

import java.util.function.BiConsumer;

/**
 * An immutable, indexed sequence of values of one element type.
 * 
 * @since 1.0
 */
public interface ArrayValue extends Value {

  public int len();
  
  /**
   * @param i An index from 0 to {@link #len()} exclusive.
   * @return The value at the index.
   * @throws IndexOutOfBoundsException if out of range.
   */
  public Value get(final int i);
  
  /**
   * Iterates over the elements in order.
   * @param consumer A non-null consumer of index and value.
   */
  public void range(final BiConsumer<Integer, Value> consumer);
  
}
