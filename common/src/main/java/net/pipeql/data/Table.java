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
 * An immutable, columnar block of rows sharing one {@link GroupKey}.
 * Typed getters take a column index and a row index and throw an
 * {@link IllegalStateException} when the column has a different type.
 * 
 * @since 1.0
 */
public interface Table {

  public GroupKey key();
  
  public List<ColMeta> cols();
  
  /** @return The number of rows. */
  public int len();
  
  public boolean isNull(final int col, final int row);
  
  public boolean getBool(final int col, final int row);
  
  public long getInt(final int col, final int row);
  
  public long getUInt(final int col, final int row);
  
  public double getFloat(final int col, final int row);
  
  public String getString(final int col, final int row);
  
  /** @return Unix epoch nanoseconds. */
  public long getTime(final int col, final int row);
  
  /**
   * @return The cell as a value or null if the cell is null.
   */
  public Value getValue(final int col, final int row);
  
  /**
   * @param label A non-null label.
   * @return The index of the column or -1 if not present.
   */
  public int colIdx(final String label);
  
}
