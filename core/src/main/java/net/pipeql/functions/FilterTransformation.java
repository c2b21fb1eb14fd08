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

import java.util.Map;

import com.google.common.collect.Maps;

import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AbstractTransformation;
import net.pipeql.execute.AccumulationMode;
import net.pipeql.execute.CreateTransformation;
import net.pipeql.execute.Dataset;
import net.pipeql.execute.DatasetID;
import net.pipeql.execute.DefaultDataset;
import net.pipeql.execute.ExecutionAdministration;
import net.pipeql.execute.GroupKeys;
import net.pipeql.execute.TableBuilder;
import net.pipeql.execute.TableBuilderCache;
import net.pipeql.execute.Transformation;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.semantic.Kind;
import net.pipeql.utils.Pair;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Evaluates the predicate against each row as a record of its non-null
 * columns. Tables keep their key, even when every row is dropped.
 * 
 * @since 1.0
 */
public class FilterTransformation extends AbstractTransformation {
  private final SingleArgFunction fn;
  
  FilterTransformation(final Dataset dataset, 
                       final TableBuilderCache cache, 
                       final SingleArgFunction fn) {
    super(dataset, cache);
    this.fn = fn;
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    final TableBuilder builder = newBuilder(table.key(), FilterOpSpec.KIND);
    GroupKeys.addTableCols(table, builder);
    final int[] idx = new int[table.cols().size()];
    for (int c = 0; c < idx.length; c++) {
      idx[c] = builder.colIdx(table.cols().get(c).label());
    }
    
    for (int row = 0; row < table.len(); row++) {
      if (!fn.call(record(table, row)).bool()) {
        continue;
      }
      for (int c = 0; c < idx.length; c++) {
        builder.appendValue(idx[c], table.getValue(c, row));
      }
    }
  }
  
  static Value record(final Table table, final int row) {
    final Map<String, Value> record = Maps.newLinkedHashMap();
    for (int c = 0; c < table.cols().size(); c++) {
      final Value v = table.getValue(c, row);
      if (v != null) {
        record.put(table.cols().get(c).label(), v);
      }
    }
    return Values.newObject(record);
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof FilterProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final SingleArgFunction fn = new SingleArgFunction(
          ((FilterProcedureSpec) spec).fn(), Kind.BOOL);
      final TableBuilderCache cache = new TableBuilderCache(
          administration.allocator());
      final Dataset dataset = new DefaultDataset(id, mode, cache);
      return new Pair<Transformation, Dataset>(
          new FilterTransformation(dataset, cache, fn), dataset);
    }
  }
}
