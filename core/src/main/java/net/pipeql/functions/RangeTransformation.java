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
import net.pipeql.execute.ExecuteConstants;
import net.pipeql.execute.ExecutionAdministration;
import net.pipeql.execute.GroupKeys;
import net.pipeql.execute.TableBuilder;
import net.pipeql.execute.TableBuilderCache;
import net.pipeql.execute.Transformation;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.utils.DateTime;
import net.pipeql.utils.Pair;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Drops rows outside of {@code [start, stop)} and truncates the 
 * {@code _start} and {@code _stop} columns to the range. Only runs when the
 * range could not be pushed into storage.
 * 
 * @since 1.0
 */
public class RangeTransformation extends AbstractTransformation {
  private final long start;
  private final long stop;
  
  RangeTransformation(final Dataset dataset, 
                      final TableBuilderCache cache, 
                      final long start, 
                      final long stop) {
    super(dataset, cache);
    this.start = start;
    this.stop = stop;
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    final int time_idx = table.colIdx(ExecuteConstants.DEFAULT_TIME_LABEL);
    if (time_idx < 0) {
      throw new QueryExecutionException("range error: missing time column \"" 
          + ExecuteConstants.DEFAULT_TIME_LABEL + "\"", 400);
    }
    final GroupKey key = truncateKey(table.key());
    final TableBuilder builder = newBuilder(key, RangeOpSpec.KIND);
    GroupKeys.addTableCols(table, builder);
    
    final int start_idx = table.colIdx(ExecuteConstants.DEFAULT_START_LABEL);
    final int stop_idx = table.colIdx(ExecuteConstants.DEFAULT_STOP_LABEL);
    for (int row = 0; row < table.len(); row++) {
      if (table.isNull(time_idx, row)) {
        continue;
      }
      final long time = table.getTime(time_idx, row);
      if (time < start || time >= stop) {
        continue;
      }
      for (int c = 0; c < table.cols().size(); c++) {
        final int idx = builder.colIdx(table.cols().get(c).label());
        if ((c == start_idx || c == stop_idx) && !table.isNull(c, row)) {
          builder.appendTime(idx, truncate(c == start_idx, 
              table.getTime(c, row)));
        } else {
          builder.appendValue(idx, table.getValue(c, row));
        }
      }
    }
  }
  
  private GroupKey truncateKey(final GroupKey key) {
    final List<Value> values = Lists.newArrayListWithCapacity(
        key.values().size());
    for (int i = 0; i < key.cols().size(); i++) {
      final ColMeta col = key.cols().get(i);
      final Value v = key.values().get(i);
      if (v != null && col.type() == DataType.TIME && 
          (col.label().equals(ExecuteConstants.DEFAULT_START_LABEL) || 
           col.label().equals(ExecuteConstants.DEFAULT_STOP_LABEL))) {
        values.add(Values.newTime(truncate(
            col.label().equals(ExecuteConstants.DEFAULT_START_LABEL), 
            v.time())));
      } else {
        values.add(v);
      }
    }
    return new DefaultGroupKey(key.cols(), values);
  }
  
  private long truncate(final boolean is_start, final long time) {
    return is_start ? Math.max(time, start) : Math.min(time, stop);
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof RangeProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final RangeProcedureSpec range = (RangeProcedureSpec) spec;
      final long start = administration.resolveTime(
          range.timeBounds().start());
      final long stop = range.timeBounds().stop().isZero() 
          ? DateTime.toNanos(administration.now()) 
          : administration.resolveTime(range.timeBounds().stop());
      final TableBuilderCache cache = new TableBuilderCache(
          administration.allocator());
      final Dataset dataset = new DefaultDataset(id, mode, cache);
      return new Pair<Transformation, Dataset>(
          new RangeTransformation(dataset, cache, start, stop), dataset);
    }
  }
}
