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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import net.pipeql.exceptions.CompileException;
import net.pipeql.execute.ExecuteConstants;
import net.pipeql.query.OperationSpec;

/**
 * Base for the operations reducing each table to one row per column.
 * 
 * @since 1.0
 */
public abstract class AggregateOpSpec implements OperationSpec {
  private final List<String> columns;
  
  /**
   * @param columns The columns to aggregate, null or empty for 
   * {@code _value}.
   */
  protected AggregateOpSpec(final List<String> columns) {
    if (columns == null || columns.isEmpty()) {
      this.columns = ImmutableList.of(ExecuteConstants.DEFAULT_VALUE_LABEL);
    } else {
      for (final String column : columns) {
        if (column == null || column.isEmpty()) {
          throw new CompileException(kind() 
              + " columns cannot contain null or empty names");
        }
      }
      this.columns = ImmutableList.copyOf(columns);
    }
  }
  
  @JsonProperty("columns")
  public List<String> columns() {
    return columns;
  }
}
