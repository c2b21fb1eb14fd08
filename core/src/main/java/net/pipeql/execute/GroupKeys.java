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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.values.Value;

/**
 * Helpers for building group keys and copying between tables.
 * 
 * @since 1.0
 */
public final class GroupKeys {
  
  /** The key with no columns. */
  public static final GroupKey EMPTY = new DefaultGroupKey(
      ImmutableList.<ColMeta>of(), ImmutableList.<Value>of());
  
  private GroupKeys() { }
  
  /**
   * @param label A label.
   * @param cols The columns to search.
   * @return The index of the column or -1 if not present.
   */
  public static int colIdx(final String label, final List<ColMeta> cols) {
    for (int i = 0; i < cols.size(); i++) {
      if (cols.get(i).label().equals(label)) {
        return i;
      }
    }
    return -1;
  }
  
  /**
   * Builds the key of a row from the named columns.
   * @param labels The key column labels, each must exist in the table.
   * @param table The table.
   * @param row The row index.
   * @return The key.
   */
  public static GroupKey keyForRow(final List<String> labels, 
                                   final Table table, 
                                   final int row) {
    final List<ColMeta> cols = Lists.newArrayListWithCapacity(labels.size());
    final List<Value> values = Lists.newArrayListWithCapacity(labels.size());
    for (final String label : labels) {
      final int idx = table.colIdx(label);
      cols.add(table.cols().get(idx));
      values.add(table.getValue(idx, row));
    }
    return new DefaultGroupKey(cols, values);
  }
  
  /**
   * Adds every column of the table to the builder if missing.
   * @throws net.pipeql.exceptions.QueryExecutionException if a column
   * exists with another type.
   */
  public static void addTableCols(final Table table, 
                                  final TableBuilder builder) {
    for (final ColMeta col : table.cols()) {
      builder.ensureCol(col);
    }
  }
  
  /**
   * Appends every row of the table, matching columns by label.
   * @param table The source.
   * @param builder The destination with all of the table's columns.
   */
  public static void appendTable(final Table table, 
                                 final TableBuilder builder) {
    final int[] idx = new int[table.cols().size()];
    for (int c = 0; c < idx.length; c++) {
      idx[c] = builder.colIdx(table.cols().get(c).label());
    }
    for (int row = 0; row < table.len(); row++) {
      for (int c = 0; c < idx.length; c++) {
        builder.appendValue(idx[c], table.getValue(c, row));
      }
    }
  }
  
  /**
   * Appends the key values of the builder's key columns for each of n 
   * rows, for columns the builder has but the rows were not given.
   */
  public static void appendKeyValues(final GroupKey key, 
                                     final TableBuilder builder, 
                                     final int rows) {
    for (int k = 0; k < key.cols().size(); k++) {
      final int idx = builder.colIdx(key.cols().get(k).label());
      for (int i = 0; i < rows; i++) {
        builder.appendValue(idx, key.values().get(k));
      }
    }
  }
  
  /** Orders values of the same kind, nulls first. */
  static int compareValues(final Value a, final Value b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    final int kinds = a.type().kind().compareTo(b.type().kind());
    if (kinds != 0) {
      return kinds;
    }
    switch (a.type().kind()) {
    case STRING:
      return a.str().compareTo(b.str());
    case INT:
      return Long.compare(a.integer(), b.integer());
    case UINT:
      return Long.compareUnsigned(a.uinteger(), b.uinteger());
    case FLOAT:
      return Double.compare(a.floatValue(), b.floatValue());
    case BOOL:
      return Boolean.compare(a.bool(), b.bool());
    case TIME:
      return Long.compare(a.time(), b.time());
    case DURATION:
      return Long.compare(a.duration(), b.duration());
    default:
      return 0;
    }
  }
}
