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

import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AccumulationMode;
import net.pipeql.execute.CreateTransformation;
import net.pipeql.execute.Dataset;
import net.pipeql.execute.DatasetID;
import net.pipeql.execute.ExecutionAdministration;
import net.pipeql.execute.PassthroughDataset;
import net.pipeql.execute.Transformation;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.utils.Pair;

/** Forwards every table and event unchanged. */
public class YieldTransformation implements Transformation {
  private final PassthroughDataset dataset;
  
  YieldTransformation(final PassthroughDataset dataset) {
    this.dataset = dataset;
  }
  
  @Override
  public void retractTable(final DatasetID id, final GroupKey key) {
    dataset.retractTable(key);
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    dataset.process(table);
  }
  
  @Override
  public void updateWatermark(final DatasetID id, final long time) {
    dataset.updateWatermark(time);
  }
  
  @Override
  public void updateProcessingTime(final DatasetID id, final long time) {
    dataset.updateProcessingTime(time);
  }
  
  @Override
  public void finish(final DatasetID id, final Throwable error) {
    dataset.finish(error);
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof NamedYieldProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final PassthroughDataset dataset = new PassthroughDataset(id);
      return new Pair<Transformation, Dataset>(
          new YieldTransformation(dataset), dataset);
    }
  }
}
