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

import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AbstractTransformation;
import net.pipeql.execute.AccumulationMode;
import net.pipeql.execute.CreateTransformation;
import net.pipeql.execute.Dataset;
import net.pipeql.execute.DatasetID;
import net.pipeql.execute.DefaultDataset;
import net.pipeql.execute.ExecutionAdministration;
import net.pipeql.execute.TableBuilder;
import net.pipeql.execute.TableBuilderCache;
import net.pipeql.execute.Transformation;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.utils.Pair;

/**
 * Runs the mutators over the schema of each table, then copies the rows
 * through the resulting column map.
 * 
 * @since 1.0
 */
public class SchemaMutationTransformation extends AbstractTransformation {
  private final List<SchemaMutator> mutators;
  
  SchemaMutationTransformation(final Dataset dataset, 
                               final TableBuilderCache cache, 
                               final List<SchemaMutator> mutators) {
    super(dataset, cache);
    this.mutators = mutators;
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    final BuilderContext context = new BuilderContext(table);
    for (final SchemaMutator mutator : mutators) {
      mutator.mutate(context);
    }
    
    final TableBuilder builder = newBuilder(context.key(), 
        SchemaMutationProcedureSpec.KIND);
    for (final ColMeta col : context.cols()) {
      builder.addCol(col);
    }
    final List<Integer> col_map = context.colMap();
    for (int row = 0; row < table.len(); row++) {
      for (int c = 0; c < col_map.size(); c++) {
        builder.appendValue(c, table.getValue(col_map.get(c), row));
      }
    }
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof SchemaMutationProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final List<SchemaMutator> mutators = Lists.newArrayList();
      for (final SchemaMutation mutation : 
          ((SchemaMutationProcedureSpec) spec).mutations()) {
        mutators.add(mutation.mutator());
      }
      final TableBuilderCache cache = new TableBuilderCache(
          administration.allocator());
      final Dataset dataset = new DefaultDataset(id, mode, cache);
      return new Pair<Transformation, Dataset>(
          new SchemaMutationTransformation(dataset, cache, mutators), 
          dataset);
    }
  }
}
