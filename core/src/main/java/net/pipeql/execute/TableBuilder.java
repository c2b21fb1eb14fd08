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
package net.pipeql.execute;

import java.util.List;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.values.Value;

/**
 * Accumulates rows for one group key. Columns are appended to 
 * independently; a table is only valid to build once every column has
 * the same number of rows.
 * 
 * @since 1.0
 */
public interface TableBuilder {

  public GroupKey key();
  
  public List<ColMeta> cols();
  
  /** @return The number of rows, taken from the first column. */
  public int nrows();
  
  /**
   * Adds a column.
   * @return The index of the new column.
   * @throws net.pipeql.exceptions.QueryExecutionException if a column 
   * with the label exists.
   */
  public int addCol(final ColMeta col);
  
  /**
   * Adds the column unless one with the same label and type exists.
   * @return The index of the column.
   * @throws net.pipeql.exceptions.QueryExecutionException if the label 
   * exists with another type.
   */
  public int ensureCol(final ColMeta col);
  
  /** @return The column index or -1 if missing. */
  public int colIdx(final String label);
  
  public void appendBool(final int col, final boolean v);
  
  public void appendInt(final int col, final long v);
  
  public void appendUInt(final int col, final long v);
  
  public void appendFloat(final int col, final double v);
  
  public void appendString(final int col, final String v);
  
  /** @param v Unix epoch nanoseconds. */
  public void appendTime(final int col, final long v);
  
  public void appendNil(final int col);
  
  /**
   * Appends a value of the column's type.
   * @param v The value, null appends a null.
   * @throws net.pipeql.exceptions.QueryExecutionException on a type 
   * mismatch.
   */
  public void appendValue(final int col, final Value v);
  
  /**
   * @return An immutable snapshot of the rows.
   * @throws net.pipeql.exceptions.QueryExecutionException if the columns
   * have different lengths.
   */
  public Table table();
  
  /** Drops the rows but keeps the columns. */
  public void clearData();
  
  /** Drops the rows and releases the memory accounted for them. */
  public void release();
  
}
