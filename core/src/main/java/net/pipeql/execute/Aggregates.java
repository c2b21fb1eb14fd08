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

import net.pipeql.data.DataType;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Aggregations over one column of a table, shared by the aggregate 
 * transformations and storage readers that aggregate on read.
 * 
 * @since 1.0
 */
public enum Aggregates {
  COUNT("count") {
    @Override
    public DataType outputType(final DataType input) {
      return DataType.INT;
    }
    
    @Override
    public Value aggregate(final Table table, final int col) {
      long count = 0;
      for (int row = 0; row < table.len(); row++) {
        if (!table.isNull(col, row)) {
          count++;
        }
      }
      return Values.newInt(count);
    }
  },
  SUM("sum") {
    @Override
    public DataType outputType(final DataType input) {
      checkNumeric(input, name);
      return input;
    }
    
    @Override
    public Value aggregate(final Table table, final int col) {
      final DataType type = table.cols().get(col).type();
      checkNumeric(type, name);
      long l = 0;
      double d = 0;
      for (int row = 0; row < table.len(); row++) {
        if (table.isNull(col, row)) {
          continue;
        }
        switch (type) {
        case INT:
          l += table.getInt(col, row);
          break;
        case UINT:
          l += table.getUInt(col, row);
          break;
        default:
          d += table.getFloat(col, row);
        }
      }
      switch (type) {
      case INT:
        return Values.newInt(l);
      case UINT:
        return Values.newUInt(l);
      default:
        return Values.newFloat(d);
      }
    }
  },
  MEAN("mean") {
    @Override
    public DataType outputType(final DataType input) {
      checkNumeric(input, name);
      return DataType.FLOAT;
    }
    
    @Override
    public Value aggregate(final Table table, final int col) {
      final DataType type = table.cols().get(col).type();
      checkNumeric(type, name);
      long count = 0;
      double sum = 0;
      for (int row = 0; row < table.len(); row++) {
        if (table.isNull(col, row)) {
          continue;
        }
        count++;
        switch (type) {
        case INT:
          sum += table.getInt(col, row);
          break;
        case UINT:
          sum += Double.parseDouble(
              Long.toUnsignedString(table.getUInt(col, row)));
          break;
        default:
          sum += table.getFloat(col, row);
        }
      }
      // no values yields a null
      return count == 0 ? null : Values.newFloat(sum / count);
    }
  };
  
  protected final String name;
  
  private Aggregates(final String name) {
    this.name = name;
  }
  
  /** @return The method name used in specs and storage requests. */
  public String methodName() {
    return name;
  }
  
  /**
   * @param input The column type.
   * @return The type of the aggregate.
   * @throws QueryExecutionException if the type is not supported.
   */
  public abstract DataType outputType(final DataType input);
  
  /**
   * @param table The table.
   * @param col The column index.
   * @return The aggregate, null when there is nothing to aggregate.
   */
  public abstract Value aggregate(final Table table, final int col);
  
  /**
   * @param method A method name.
   * @return The aggregate or null if unknown.
   */
  public static Aggregates fromMethod(final String method) {
    for (final Aggregates aggregate : values()) {
      if (aggregate.name.equals(method)) {
        return aggregate;
      }
    }
    return null;
  }
  
  static void checkNumeric(final DataType type, final String name) {
    if (type != DataType.INT && type != DataType.UINT 
        && type != DataType.FLOAT) {
      throw new QueryExecutionException("unsupported aggregate column type " 
          + type.name().toLowerCase() + " for " + name, 400);
    }
  }
}
