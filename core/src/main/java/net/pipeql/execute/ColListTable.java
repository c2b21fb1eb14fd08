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
import net.pipeql.data.DataType;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.utils.DateTime;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * The immutable table built by a {@link ColListTableBuilder}.
 * 
 * @since 1.0
 */
public class ColListTable implements Table {
  private final GroupKey key;
  private final List<ColMeta> cols;
  private final List<ColListTableBuilder.Column> columns;
  private final int rows;
  
  ColListTable(final GroupKey key, 
               final List<ColMeta> cols, 
               final List<ColListTableBuilder.Column> columns, 
               final int rows) {
    this.key = key;
    this.cols = cols;
    this.columns = columns;
    this.rows = rows;
  }
  
  @Override
  public GroupKey key() {
    return key;
  }
  
  @Override
  public List<ColMeta> cols() {
    return cols;
  }
  
  @Override
  public int len() {
    return rows;
  }
  
  @Override
  public boolean isNull(final int col, final int row) {
    return columns.get(col).nulls.get(checkRow(row));
  }
  
  @Override
  public boolean getBool(final int col, final int row) {
    return column(col, DataType.BOOL).longs[checkRow(row)] != 0;
  }
  
  @Override
  public long getInt(final int col, final int row) {
    return column(col, DataType.INT).longs[checkRow(row)];
  }
  
  @Override
  public long getUInt(final int col, final int row) {
    return column(col, DataType.UINT).longs[checkRow(row)];
  }
  
  @Override
  public double getFloat(final int col, final int row) {
    return column(col, DataType.FLOAT).doubles[checkRow(row)];
  }
  
  @Override
  public String getString(final int col, final int row) {
    return column(col, DataType.STRING).strings[checkRow(row)];
  }
  
  @Override
  public long getTime(final int col, final int row) {
    return column(col, DataType.TIME).longs[checkRow(row)];
  }
  
  @Override
  public Value getValue(final int col, final int row) {
    if (isNull(col, row)) {
      return null;
    }
    switch (cols.get(col).type()) {
    case BOOL:
      return Values.newBool(getBool(col, row));
    case INT:
      return Values.newInt(getInt(col, row));
    case UINT:
      return Values.newUInt(getUInt(col, row));
    case FLOAT:
      return Values.newFloat(getFloat(col, row));
    case STRING:
      return Values.newString(getString(col, row));
    case TIME:
      return Values.newTime(getTime(col, row));
    default:
      throw new IllegalStateException("Unsupported column type: " 
          + cols.get(col).type());
    }
  }
  
  @Override
  public int colIdx(final String label) {
    return GroupKeys.colIdx(label, cols);
  }
  
  private ColListTableBuilder.Column column(final int col, 
                                            final DataType type) {
    final ColListTableBuilder.Column column = columns.get(col);
    if (column.type != type) {
      throw new IllegalStateException("Column \"" + cols.get(col).label() 
          + "\" is of type " + column.type + ", not " + type);
    }
    return column;
  }
  
  private int checkRow(final int row) {
    if (row < 0 || row >= rows) {
      throw new IndexOutOfBoundsException("Row " + row + " out of bounds [0, " 
          + rows + ")");
    }
    return row;
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("table ")
        .append(key)
        .append("\n");
    for (int c = 0; c < cols.size(); c++) {
      buf.append(c > 0 ? "," : "").append(cols.get(c).label());
    }
    buf.append("\n");
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols.size(); c++) {
        final Value v = getValue(c, r);
        buf.append(c > 0 ? "," : "");
        if (v != null && cols.get(c).type() == DataType.TIME) {
          buf.append(DateTime.fromNanos(v.time()));
        } else {
          buf.append(v);
        }
      }
      buf.append("\n");
    }
    return buf.toString();
  }
}
