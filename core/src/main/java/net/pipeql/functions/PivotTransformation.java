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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.pipeql.data.ColMeta;
import net.pipeql.data.DataType;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AbstractTransformation;
import net.pipeql.execute.AccumulationMode;
import net.pipeql.execute.CreateTransformation;
import net.pipeql.execute.Dataset;
import net.pipeql.execute.DatasetID;
import net.pipeql.execute.DefaultDataset;
import net.pipeql.execute.DefaultGroupKey;
import net.pipeql.execute.ExecutionAdministration;
import net.pipeql.execute.TableBuilder;
import net.pipeql.execute.TableBuilderCache;
import net.pipeql.execute.Transformation;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.semantic.Kind;
import net.pipeql.utils.Pair;
import net.pipeql.values.Value;

/**
 * Pivots each table on its own. The column key and value columns leave 
 * the group key, so two input tables that only differ by those columns
 * would collide and fail the query.
 * 
 * @since 1.0
 */
public class PivotTransformation extends AbstractTransformation {
  private static final Joiner JOINER = Joiner.on('_');
  
  private final PivotProcedureSpec spec;
  
  PivotTransformation(final Dataset dataset, 
                      final TableBuilderCache cache, 
                      final PivotProcedureSpec spec) {
    super(dataset, cache);
    this.spec = spec;
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    final int[] row_idx = indices(table, spec.rowKey());
    final int[] col_idx = indices(table, spec.colKey());
    final int value_idx = indices(table, 
        Lists.newArrayList(spec.valueCol()))[0];
    
    final List<ColMeta> key_cols = Lists.newArrayList();
    final List<Value> key_values = Lists.newArrayList();
    for (int i = 0; i < table.key().cols().size(); i++) {
      final ColMeta col = table.key().cols().get(i);
      if (spec.colKey().contains(col.label()) || 
          col.label().equals(spec.valueCol())) {
        continue;
      }
      key_cols.add(col);
      key_values.add(table.key().values().get(i));
    }
    final GroupKey key = new DefaultGroupKey(key_cols, key_values);
    
    // row key values to pivoted values, both in order of appearance
    final Map<List<Value>, Map<String, Value>> rows = Maps.newLinkedHashMap();
    final List<String> columns = Lists.newArrayList();
    for (int row = 0; row < table.len(); row++) {
      final List<Value> row_key = Lists.newArrayListWithCapacity(
          row_idx.length);
      for (final int idx : row_idx) {
        row_key.add(table.getValue(idx, row));
      }
      final List<String> names = Lists.newArrayListWithCapacity(
          col_idx.length);
      for (final int idx : col_idx) {
        names.add(label(table.getValue(idx, row)));
      }
      final String column = JOINER.join(names);
      if (!columns.contains(column)) {
        columns.add(column);
      }
      Map<String, Value> values = rows.get(row_key);
      if (values == null) {
        values = Maps.newHashMap();
        rows.put(row_key, values);
      }
      values.put(column, table.getValue(value_idx, row));
    }
    
    // the output schema is checked before anything reaches the cache
    final Set<String> labels = Sets.newHashSet();
    for (final ColMeta col : key_cols) {
      labels.add(col.label());
    }
    for (final int idx : row_idx) {
      labels.add(table.cols().get(idx).label());
    }
    for (final String column : columns) {
      if (labels.contains(column)) {
        throw new QueryExecutionException("pivot error: pivoted column \"" 
            + column + "\" conflicts with an existing column", 400);
      }
    }
    
    final TableBuilder builder = newBuilder(key, PivotOpSpec.KIND);
    for (final ColMeta col : key_cols) {
      builder.addCol(col);
    }
    // row key columns that are also key columns are filled from the key
    final int[] out_row_idx = new int[row_idx.length];
    for (int i = 0; i < row_idx.length; i++) {
      final ColMeta col = table.cols().get(row_idx[i]);
      out_row_idx[i] = key.hasCol(col.label()) ? -1 : builder.ensureCol(col);
    }
    final DataType value_type = table.cols().get(value_idx).type();
    final int[] out_col_idx = new int[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      out_col_idx[i] = builder.addCol(new ColMeta(columns.get(i), value_type));
    }
    
    for (final Map.Entry<List<Value>, Map<String, Value>> entry : 
        rows.entrySet()) {
      for (int k = 0; k < key_cols.size(); k++) {
        builder.appendValue(k, key_values.get(k));
      }
      for (int i = 0; i < out_row_idx.length; i++) {
        if (out_row_idx[i] >= 0) {
          builder.appendValue(out_row_idx[i], entry.getKey().get(i));
        }
      }
      for (int i = 0; i < out_col_idx.length; i++) {
        builder.appendValue(out_col_idx[i], 
            entry.getValue().get(columns.get(i)));
      }
    }
  }
  
  private static int[] indices(final Table table, final List<String> labels) {
    final int[] idx = new int[labels.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = table.colIdx(labels.get(i));
      if (idx[i] < 0) {
        throw new QueryExecutionException("pivot error: column \"" 
            + labels.get(i) + "\" doesn't exist", 400);
      }
    }
    return idx;
  }
  
  private static String label(final Value value) {
    if (value == null) {
      return "null";
    }
    return value.type().kind() == Kind.STRING ? value.str() 
        : value.toString();
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof PivotProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final TableBuilderCache cache = new TableBuilderCache(
          administration.allocator());
      final Dataset dataset = new DefaultDataset(id, mode, cache);
      return new Pair<Transformation, Dataset>(new PivotTransformation(
          dataset, cache, (PivotProcedureSpec) spec), dataset);
    }
  }
}
