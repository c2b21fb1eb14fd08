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

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.DataType;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.values.Value;

/**
 * A table builder storing each column in a growable primitive array with
 * a null bitmap. Not thread safe.
 * 
 * @since 1.0
 */
public class ColListTableBuilder implements TableBuilder {
  private final GroupKey key;
  private final Allocator allocator;
  private final List<ColMeta> cols;
  private final List<Column> columns;
  
  public ColListTableBuilder(final GroupKey key, final Allocator allocator) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null.");
    }
    this.key = key;
    this.allocator = allocator;
    cols = Lists.newArrayList();
    columns = Lists.newArrayList();
  }
  
  @Override
  public GroupKey key() {
    return key;
  }
  
  @Override
  public List<ColMeta> cols() {
    return ImmutableList.copyOf(cols);
  }
  
  @Override
  public int nrows() {
    return columns.isEmpty() ? 0 : columns.get(0).size;
  }
  
  @Override
  public int addCol(final ColMeta col) {
    if (colIdx(col.label()) >= 0) {
      throw new QueryExecutionException("table builder already has column \"" 
          + col.label() + "\"", 500);
    }
    cols.add(col);
    columns.add(new Column(col.type()));
    return cols.size() - 1;
  }
  
  @Override
  public int ensureCol(final ColMeta col) {
    final int idx = colIdx(col.label());
    if (idx < 0) {
      return addCol(col);
    }
    if (cols.get(idx).type() != col.type()) {
      throw new QueryExecutionException("schema collision on column \"" 
          + col.label() + "\": " + cols.get(idx).type() + " vs " 
          + col.type(), 500);
    }
    return idx;
  }
  
  @Override
  public int colIdx(final String label) {
    return GroupKeys.colIdx(label, cols);
  }
  
  @Override
  public void appendBool(final int col, final boolean v) {
    column(col, DataType.BOOL).appendLong(v ? 1 : 0, Allocator.BOOL_SIZE);
  }
  
  @Override
  public void appendInt(final int col, final long v) {
    column(col, DataType.INT).appendLong(v, Allocator.INT64_SIZE);
  }
  
  @Override
  public void appendUInt(final int col, final long v) {
    column(col, DataType.UINT).appendLong(v, Allocator.INT64_SIZE);
  }
  
  @Override
  public void appendFloat(final int col, final double v) {
    column(col, DataType.FLOAT).appendDouble(v);
  }
  
  @Override
  public void appendString(final int col, final String v) {
    column(col, DataType.STRING).appendString(v);
  }
  
  @Override
  public void appendTime(final int col, final long v) {
    column(col, DataType.TIME).appendLong(v, Allocator.INT64_SIZE);
  }
  
  @Override
  public void appendNil(final int col) {
    columns.get(col).appendNil();
  }
  
  @Override
  public void appendValue(final int col, final Value v) {
    if (v == null) {
      appendNil(col);
      return;
    }
    switch (cols.get(col).type()) {
    case BOOL:
      appendBool(col, checked(col, v).bool());
      break;
    case INT:
      appendInt(col, checked(col, v).integer());
      break;
    case UINT:
      appendUInt(col, checked(col, v).uinteger());
      break;
    case FLOAT:
      appendFloat(col, checked(col, v).floatValue());
      break;
    case STRING:
      appendString(col, checked(col, v).str());
      break;
    case TIME:
      appendTime(col, checked(col, v).time());
      break;
    default:
      throw new QueryExecutionException("unsupported column type " 
          + cols.get(col).type(), 500);
    }
  }
  
  @Override
  public Table table() {
    final int rows = nrows();
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).size != rows) {
        throw new QueryExecutionException("column \"" + cols.get(i).label() 
            + "\" has " + columns.get(i).size + " rows, expected " + rows, 500);
      }
    }
    final List<Column> snapshot = Lists.newArrayListWithCapacity(columns.size());
    for (final Column column : columns) {
      snapshot.add(column.copy());
    }
    return new ColListTable(key, ImmutableList.copyOf(cols), snapshot, rows);
  }
  
  @Override
  public void clearData() {
    release();
  }
  
  @Override
  public void release() {
    for (final Column column : columns) {
      allocator.free(column.bytes);
      column.clear();
    }
  }
  
  private Column column(final int col, final DataType type) {
    final Column column = columns.get(col);
    if (column.type != type) {
      throw new QueryExecutionException("column \"" + cols.get(col).label() 
          + "\" is of type " + column.type + ", not " + type, 500);
    }
    return column;
  }
  
  private Value checked(final int col, final Value v) {
    if (v.type().kind() != cols.get(col).type().valueType().kind()) {
      throw new QueryExecutionException("cannot append a " 
          + v.type().kind().name().toLowerCase() + " to column \"" 
          + cols.get(col).label() + "\" of type " + cols.get(col).type(), 500);
    }
    return v;
  }
  
  /** Storage for one column. Longs hold ints, uints, times and bools. */
  class Column {
    final DataType type;
    long[] longs;
    double[] doubles;
    String[] strings;
    final BitSet nulls;
    int size;
    long bytes;
    
    Column(final DataType type) {
      this.type = type;
      nulls = new BitSet();
      switch (type) {
      case FLOAT:
        doubles = new double[8];
        break;
      case STRING:
        strings = new String[8];
        break;
      default:
        longs = new long[8];
      }
    }
    
    void appendLong(final long v, final int size_bytes) {
      charge(size_bytes);
      if (size == longs.length) {
        longs = Arrays.copyOf(longs, size * 2);
      }
      longs[size++] = v;
    }
    
    void appendDouble(final double v) {
      charge(Allocator.FLOAT64_SIZE);
      if (size == doubles.length) {
        doubles = Arrays.copyOf(doubles, size * 2);
      }
      doubles[size++] = v;
    }
    
    void appendString(final String v) {
      charge(Allocator.stringSize(v));
      if (size == strings.length) {
        strings = Arrays.copyOf(strings, size * 2);
      }
      if (v == null) {
        nulls.set(size);
      }
      strings[size++] = v;
    }
    
    void appendNil() {
      nulls.set(size);
      switch (type) {
      case FLOAT:
        appendDouble(0);
        break;
      case STRING:
        appendString(null);
        break;
      default:
        appendLong(0, Allocator.INT64_SIZE);
      }
    }
    
    private void charge(final long size_bytes) {
      allocator.account(size_bytes);
      bytes += size_bytes;
    }
    
    void clear() {
      size = 0;
      bytes = 0;
      nulls.clear();
    }
    
    Column copy() {
      final Column copy = new Column(type);
      copy.size = size;
      if (longs != null) {
        copy.longs = Arrays.copyOf(longs, Math.max(size, 1));
      }
      if (doubles != null) {
        copy.doubles = Arrays.copyOf(doubles, Math.max(size, 1));
      }
      if (strings != null) {
        copy.strings = Arrays.copyOf(strings, Math.max(size, 1));
      }
      copy.nulls.or(nulls);
      return copy;
    }
  }
}
