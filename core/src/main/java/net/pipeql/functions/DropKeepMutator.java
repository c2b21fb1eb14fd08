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
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.DefaultGroupKey;
import net.pipeql.execute.GroupKeys;
import net.pipeql.semantic.Kind;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Drops columns by name or predicate. Keeping is dropping every other 
 * column, or dropping where the predicate is false.
 * 
 * @since 1.0
 */
class DropKeepMutator implements SchemaMutator {
  private final String name;
  private final Set<String> columns;
  private final SingleArgFunction predicate;
  private final boolean keep;
  
  DropKeepMutator(final String name, 
                  final List<String> columns, 
                  final FunctionValue predicate, 
                  final boolean keep) {
    this.name = name;
    this.columns = columns == null ? null : ImmutableSet.copyOf(columns);
    this.predicate = predicate == null ? null 
        : new SingleArgFunction(predicate, Kind.BOOL);
    this.keep = keep;
  }
  
  @Override
  public void mutate(final BuilderContext context) {
    if (columns != null) {
      for (final String column : columns) {
        if (GroupKeys.colIdx(column, context.cols()) < 0) {
          throw new QueryExecutionException(name + " error: column \"" 
              + column + "\" doesn't exist", 400);
        }
      }
    }
    
    final GroupKey key = context.key();
    final List<ColMeta> cols = Lists.newArrayList();
    final List<Integer> col_map = Lists.newArrayList();
    final List<ColMeta> key_cols = Lists.newArrayList();
    final List<Value> key_values = Lists.newArrayList();
    for (int i = 0; i < context.cols().size(); i++) {
      final ColMeta col = context.cols().get(i);
      if (shouldDrop(col.label())) {
        continue;
      }
      cols.add(col);
      col_map.add(context.colMap().get(i));
      final int key_idx = GroupKeys.colIdx(col.label(), key.cols());
      if (key_idx >= 0) {
        key_cols.add(col);
        key_values.add(key.values().get(key_idx));
      }
    }
    context.update(cols, new DefaultGroupKey(key_cols, key_values), col_map);
  }
  
  private boolean shouldDrop(final String label) {
    if (columns != null) {
      return columns.contains(label) != keep;
    }
    return predicate.call(Values.newString(label)).bool() != keep;
  }
}
