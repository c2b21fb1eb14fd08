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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
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
import net.pipeql.plan.ProcedureID;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.utils.Pair;
import net.pipeql.values.Value;

/**
 * Buffers the tables of both parents and joins them once both finished.
 * Join and key columns appear once; other columns are suffixed with the
 * name of their table, e.g. {@code _value_a}.
 * 
 * @since 1.0
 */
public class MergeJoinTransformation extends AbstractTransformation {
  private static final Logger LOG = LoggerFactory.getLogger(
      MergeJoinTransformation.class);
  
  private final List<String> on;
  private final DatasetID left;
  private final DatasetID right;
  private final Map<DatasetID, String> names;
  private final Map<DatasetID, Map<GroupKey, Table>> buffers;
  private final Set<DatasetID> finished;
  private boolean done;
  
  MergeJoinTransformation(final Dataset dataset, 
                          final TableBuilderCache cache, 
                          final List<String> on, 
                          final DatasetID left, 
                          final DatasetID right, 
                          final Map<DatasetID, String> names) {
    super(dataset, cache);
    this.on = on;
    this.left = left;
    this.right = right;
    this.names = names;
    buffers = Maps.newHashMap();
    buffers.put(left, Maps.<GroupKey, Table>newTreeMap());
    buffers.put(right, Maps.<GroupKey, Table>newTreeMap());
    finished = Sets.newHashSet();
  }
  
  @Override
  public void process(final DatasetID id, final Table table) {
    final Map<GroupKey, Table> buffer = buffers.get(id);
    if (buffer == null) {
      throw new QueryExecutionException("join received a table from an "
          + "unknown parent " + id, 500);
    }
    if (buffer.containsKey(table.key())) {
      throw new QueryExecutionException("join found duplicate table with " 
          + "key: " + table.key(), 500);
    }
    buffer.put(table.key(), table);
  }
  
  @Override
  public void retractTable(final DatasetID id, final GroupKey key) {
    final Map<GroupKey, Table> buffer = buffers.get(id);
    if (buffer != null) {
      buffer.remove(key);
    }
  }
  
  @Override
  public void updateWatermark(final DatasetID id, final long time) {
    // output is only complete once both parents finished
  }
  
  @Override
  public void updateProcessingTime(final DatasetID id, final long time) {
    // see updateWatermark
  }
  
  @Override
  public void finish(final DatasetID id, final Throwable error) {
    if (done) {
      return;
    }
    if (error != null) {
      done = true;
      dataset.finish(error);
      return;
    }
    finished.add(id);
    if (finished.size() < buffers.size()) {
      return;
    }
    done = true;
    try {
      join();
    } catch (RuntimeException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Join failed", e);
      }
      dataset.finish(e);
      return;
    }
    dataset.finish(null);
  }
  
  private void join() {
    final Map<GroupKey, Table> lefts = buffers.get(left);
    final Map<GroupKey, Table> rights = buffers.get(right);
    for (final Map.Entry<GroupKey, Table> entry : lefts.entrySet()) {
      final Table r = rights.get(entry.getKey());
      if (r != null) {
        join(entry.getKey(), entry.getValue(), r);
      }
    }
  }
  
  private void join(final GroupKey key, final Table l, final Table r) {
    final int[] l_on = onIndices(l, names.get(left));
    final int[] r_on = onIndices(r, names.get(right));
    
    final TableBuilder builder = newBuilder(key, JoinOpSpec.KIND);
    final int[] l_out = new int[l.cols().size()];
    for (int c = 0; c < l_out.length; c++) {
      l_out[c] = builder.addCol(output(l.cols().get(c), key, 
          names.get(left)));
    }
    final int[] r_out = new int[r.cols().size()];
    for (int c = 0; c < r_out.length; c++) {
      final ColMeta col = r.cols().get(c);
      if (shared(col.label(), key)) {
        // already added from the left side
        r_out[c] = -1;
        continue;
      }
      r_out[c] = builder.addCol(output(col, key, names.get(right)));
    }
    
    // index the right rows by their join values
    final Map<List<Value>, List<Integer>> index = Maps.newHashMap();
    for (int row = 0; row < r.len(); row++) {
      final List<Value> values = joinValues(r, r_on, row);
      if (values == null) {
        continue;
      }
      List<Integer> rows = index.get(values);
      if (rows == null) {
        rows = Lists.newArrayList();
        index.put(values, rows);
      }
      rows.add(row);
    }
    
    for (int row = 0; row < l.len(); row++) {
      final List<Value> values = joinValues(l, l_on, row);
      final List<Integer> matches = values == null ? null : index.get(values);
      if (matches == null) {
        continue;
      }
      for (final int r_row : matches) {
        for (int c = 0; c < l_out.length; c++) {
          builder.appendValue(l_out[c], l.getValue(c, row));
        }
        for (int c = 0; c < r_out.length; c++) {
          if (r_out[c] >= 0) {
            builder.appendValue(r_out[c], r.getValue(c, r_row));
          }
        }
      }
    }
  }
  
  private int[] onIndices(final Table table, final String name) {
    final int[] idx = new int[on.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = table.colIdx(on.get(i));
      if (idx[i] < 0) {
        throw new QueryExecutionException("join error: column \"" 
            + on.get(i) + "\" doesn't exist in table " + name, 400);
      }
    }
    return idx;
  }
  
  /** @return The join values of the row or null if any is null. */
  private static List<Value> joinValues(final Table table, 
                                        final int[] idx, 
                                        final int row) {
    final List<Value> values = Lists.newArrayListWithCapacity(idx.length);
    for (final int i : idx) {
      final Value v = table.getValue(i, row);
      if (v == null) {
        return null;
      }
      values.add(v);
    }
    return values;
  }
  
  private boolean shared(final String label, final GroupKey key) {
    return on.contains(label) || key.hasCol(label);
  }
  
  private ColMeta output(final ColMeta col, 
                         final GroupKey key, 
                         final String name) {
    if (shared(col.label(), key)) {
      return col;
    }
    return new ColMeta(col.label() + "_" + name, col.type());
  }
  
  public static class Create implements CreateTransformation {
    @Override
    public Pair<Transformation, Dataset> create(final DatasetID id, 
        final AccumulationMode mode, 
        final ProcedureSpec spec, 
        final ExecutionAdministration administration) {
      if (!(spec instanceof MergeJoinProcedureSpec)) {
        throw new QueryExecutionException("invalid spec type " 
            + spec.getClass().getName(), 400);
      }
      final MergeJoinProcedureSpec join = (MergeJoinProcedureSpec) spec;
      final Map<DatasetID, String> names = Maps.newHashMap();
      for (final Map.Entry<ProcedureID, String> entry : 
          join.tableNames().entrySet()) {
        names.put(administration.convertID(entry.getKey()), entry.getValue());
      }
      final List<DatasetID> parents = administration.parents();
      if (parents.size() != 2) {
        throw new QueryExecutionException("join requires exactly two "
            + "parents, got " + parents.size(), 400);
      }
      for (final DatasetID parent : parents) {
        if (!names.containsKey(parent)) {
          throw new QueryExecutionException("join has no table name for " 
              + "parent " + parent, 500);
        }
      }
      final TableBuilderCache cache = new TableBuilderCache(
          administration.allocator());
      final Dataset dataset = new DefaultDataset(id, mode, cache);
      return new Pair<Transformation, Dataset>(new MergeJoinTransformation(
          dataset, cache, join.on(), parents.get(0), parents.get(1), names), 
          dataset);
    }
  }
}
