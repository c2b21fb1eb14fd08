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
package net.pipeql.functions;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.pipeql.exceptions.CompileException;
import net.pipeql.query.OperationSpec;

/**
 * Turns the values of the column key columns into new columns, one row 
 * per distinct row key.
 * 
 * @since 1.0
 */
public class PivotOpSpec implements OperationSpec {
  public static final String KIND = "pivot";
  
  private final List<String> row_key;
  private final List<String> col_key;
  private final String value_col;
  
  @JsonCreator
  public PivotOpSpec(@JsonProperty("row_key") final List<String> row_key, 
                     @JsonProperty("col_key") final List<String> col_key, 
                     @JsonProperty("value_col") final String value_col) {
    if (row_key == null || row_key.isEmpty()) {
      throw new CompileException("pivot requires at least one row key column");
    }
    if (col_key == null || col_key.isEmpty()) {
      throw new CompileException("pivot requires at least one column key "
          + "column");
    }
    if (Strings.isNullOrEmpty(value_col)) {
      throw new CompileException("pivot requires a value column");
    }
    this.row_key = ImmutableList.copyOf(row_key);
    this.col_key = ImmutableList.copyOf(col_key);
    this.value_col = value_col;
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("row_key")
  public List<String> rowKey() {
    return row_key;
  }
  
  @JsonProperty("col_key")
  public List<String> colKey() {
    return col_key;
  }
  
  @JsonProperty("value_col")
  public String valueCol() {
    return value_col;
  }
}
