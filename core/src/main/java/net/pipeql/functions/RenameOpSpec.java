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
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.DefaultGroupKey;
import net.pipeql.execute.GroupKeys;
import net.pipeql.semantic.Kind;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Renames columns with either a fixed mapping or a function from the old
 * label to the new one.
 * 
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenameOpSpec implements SchemaMutation {
  public static final String KIND = "rename";
  
  private final Map<String, String> columns;
  private final FunctionValue fn;
  
  public RenameOpSpec(final Map<String, String> columns, 
                      final FunctionValue fn) {
    if ((columns == null) == (fn == null)) {
      throw new CompileException("rename requires exactly one of columns "
          + "or fn");
    }
    this.columns = columns == null ? null : ImmutableMap.copyOf(columns);
    this.fn = fn;
  }
  
  @JsonCreator
  public static RenameOpSpec fromJson(
      @JsonProperty("columns") final Map<String, String> columns, 
      @JsonProperty("fn") final String fn) {
    return new RenameOpSpec(columns, Functions.compile(fn));
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("columns")
  public Map<String, String> columns() {
    return columns;
  }
  
  public FunctionValue fn() {
    return fn;
  }
  
  @JsonProperty("fn")
  public String fnSource() {
    return Functions.source(fn);
  }
  
  @Override
  public SchemaMutator mutator() {
    return new Mutator(columns, 
        fn == null ? null : new SingleArgFunction(fn, Kind.STRING));
  }
  
  private static class Mutator implements SchemaMutator {
    private final Map<String, String> columns;
    private final SingleArgFunction fn;
    
    Mutator(final Map<String, String> columns, final SingleArgFunction fn) {
      this.columns = columns;
      this.fn = fn;
    }
    
    @Override
    public void mutate(final BuilderContext context) {
      if (columns != null) {
        for (final String column : columns.keySet()) {
          if (GroupKeys.colIdx(column, context.cols()) < 0) {
            throw new QueryExecutionException("rename error: column \"" 
                + column + "\" doesn't exist", 400);
          }
        }
      }
      
      final GroupKey key = context.key();
      final List<ColMeta> cols = Lists.newArrayListWithCapacity(
          context.cols().size());
      final List<ColMeta> key_cols = Lists.newArrayList();
      final List<Value> key_values = Lists.newArrayList();
      final Set<String> labels = Sets.newHashSet();
      for (final ColMeta col : context.cols()) {
        final ColMeta renamed = new ColMeta(rename(col.label()), col.type());
        if (!labels.add(renamed.label())) {
          throw new QueryExecutionException("rename error: duplicate column \"" 
              + renamed.label() + "\"", 400);
        }
        cols.add(renamed);
        final int key_idx = GroupKeys.colIdx(col.label(), key.cols());
        if (key_idx >= 0) {
          key_cols.add(renamed);
          key_values.add(key.values().get(key_idx));
        }
      }
      context.update(cols, new DefaultGroupKey(key_cols, key_values), 
          context.colMap());
    }
    
    private String rename(final String label) {
      if (columns != null) {
        final String name = columns.get(label);
        return name == null ? label : name;
      }
      return fn.call(Values.newString(label)).str();
    }
  }
}
