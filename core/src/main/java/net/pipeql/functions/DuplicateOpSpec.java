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
import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.DefaultGroupKey;
import net.pipeql.execute.GroupKeys;
import net.pipeql.values.Value;

/**
 * Copies a column under a new name. The copy joins the group key when the
 * original is part of it.
 * 
 * @since 1.0
 */
public class DuplicateOpSpec implements SchemaMutation {
  public static final String KIND = "duplicate";
  
  private final String column;
  private final String as;
  
  @JsonCreator
  public DuplicateOpSpec(@JsonProperty("column") final String column, 
                         @JsonProperty("as") final String as) {
    if (Strings.isNullOrEmpty(column)) {
      throw new CompileException("duplicate requires a column");
    }
    if (Strings.isNullOrEmpty(as)) {
      throw new CompileException("duplicate requires a name for the copy");
    }
    this.column = column;
    this.as = as;
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("column")
  public String column() {
    return column;
  }
  
  @JsonProperty("as")
  public String as() {
    return as;
  }
  
  @Override
  public SchemaMutator mutator() {
    return new SchemaMutator() {
      @Override
      public void mutate(final BuilderContext context) {
        final int idx = GroupKeys.colIdx(column, context.cols());
        if (idx < 0) {
          throw new QueryExecutionException("duplicate error: column \"" 
              + column + "\" doesn't exist", 400);
        }
        if (GroupKeys.colIdx(as, context.cols()) >= 0) {
          throw new QueryExecutionException("duplicate error: column \"" 
              + as + "\" already exists", 400);
        }
        final ColMeta copy = new ColMeta(as, context.cols().get(idx).type());
        final List<ColMeta> cols = Lists.newArrayList(context.cols());
        cols.add(copy);
        final List<Integer> col_map = Lists.newArrayList(context.colMap());
        col_map.add(context.colMap().get(idx));
        
        GroupKey key = context.key();
        final Value key_value = key.labelValue(column);
        if (key.hasCol(column)) {
          final List<ColMeta> key_cols = Lists.newArrayList(key.cols());
          final List<Value> key_values = Lists.newArrayList(key.values());
          key_cols.add(copy);
          key_values.add(key_value);
          key = new DefaultGroupKey(key_cols, key_values);
        }
        context.update(cols, key, col_map);
      }
    };
  }
}
