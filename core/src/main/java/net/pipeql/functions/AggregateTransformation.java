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

import net.pipeql.data.ColMeta;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AbstractTransformation;
import net.pipeql.execute.AccumulationMode;
import net.pipeql.execute.Aggregates;
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
import net.pipeql.utils.Pair;

/**
 * Reduces each table to a single row holding the key columns and one 
 * aggregate per requested column.
 * 
 * @since 1.0
 */
public class AggregateTransformation extends AbstractTransformation {
  private final String name;
  private final Aggregates aggregate;
  private final List<String> columns;
  
  AggregateTransformation(final Dataset dataset, 
                          final TableBuilderCache cache, 
                          final String name, 
                          final Aggregates aggregate, 
                          final List<String> columns) {
    super(dataset, cache);
    this.name = name;
    this.aggregate = aggregate;
    this.columns = columns;
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    final TableBuilder builder = newBuilder(table.key(), name);
    for (final ColMeta col : table.key().cols()) {
      builder.addCol(col);
    }
    GroupKeys.appendKeyValues(table.key(), builder, 1);
    
    for (final String column : columns) {
      final int idx = table.colIdx(column);
      if (idx < 0) {
        throw new QueryExecutionException(name + " error: column \"" 
            + column + "\" does not exist", 400);
      }
      final int out = builder.addCol(new ColMeta(column, 
          aggregate.outputType(table.cols().get(idx).type())));
      builder.appendValue(out, aggregate.aggregate(table, idx));
    }
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof SimpleAggregateProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final SimpleAggregateProcedureSpec agg = 
          (SimpleAggregateProcedureSpec) spec;
      final TableBuilderCache cache = new TableBuilderCache(
          administration.allocator());
      final Dataset dataset = new DefaultDataset(id, mode, cache);
      return new Pair<Transformation, Dataset>(new AggregateTransformation(
          dataset, cache, agg.kind(), agg.aggregate(), agg.columns()), 
          dataset);
    }
  }
}
