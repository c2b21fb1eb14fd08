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
package net.pipeql.data;

import java.util.List;

import net.pipeql.values.Value;

/**
 * The key columns of a table and their values. Every row of the table
 * has the same values for these columns. Keys are ordered so that 
 * builders can be iterated deterministically.
 * 
 * @since 1.0
 */
public interface GroupKey extends Comparable<GroupKey> {

  /** @return The non-null, possibly empty, key columns. */
  public List<ColMeta> cols();
  
  /** @return The values in column order. */
  public List<Value> values();
  
  /**
   * @param label A non-null label.
   * @return Whether or not the label is part of the key.
   */
  public boolean hasCol(final String label);
  
  /**
   * @param label A non-null label.
   * @return The value or null if the column is not part of the key.
   */
  public Value labelValue(final String label);
  
}
