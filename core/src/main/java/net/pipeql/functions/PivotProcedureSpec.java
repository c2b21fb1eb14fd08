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

import net.pipeql.plan.ProcedureSpec;

public class PivotProcedureSpec implements ProcedureSpec {
  private final List<String> row_key;
  private final List<String> col_key;
  private final String value_col;
  
  public PivotProcedureSpec(final List<String> row_key, 
                            final List<String> col_key, 
                            final String value_col) {
    this.row_key = row_key;
    this.col_key = col_key;
    this.value_col = value_col;
  }
  
  @Override
  public String kind() {
    return PivotOpSpec.KIND;
  }
  
  public List<String> rowKey() {
    return row_key;
  }
  
  public List<String> colKey() {
    return col_key;
  }
  
  public String valueCol() {
    return value_col;
  }
  
  @Override
  public ProcedureSpec copy() {
    return new PivotProcedureSpec(row_key, col_key, value_col);
  }
}
