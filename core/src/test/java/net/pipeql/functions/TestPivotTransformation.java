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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.DataType;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.AccumulationMode;
import net.pipeql.execute.Allocator;
import net.pipeql.execute.ColListTableBuilder;
import net.pipeql.execute.DatasetID;
import net.pipeql.execute.DefaultDataset;
import net.pipeql.execute.DefaultGroupKey;
import net.pipeql.execute.TableBuilderCache;
import net.pipeql.plan.ProcedureID;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

public class TestPivotTransformation {
  private static final DatasetID ID = DatasetID.fromProcedureID(
      ProcedureID.fromOperationID("pivot0"));

  private Allocator allocator;
  private TableBuilderCache cache;
  private PivotTransformation pivot;

  @Before
  public void before() throws Exception {
    allocator = new Allocator(0);
    cache = new TableBuilderCache(allocator);
    pivot = new PivotTransformation(
        new DefaultDataset(ID, AccumulationMode.DISCARDING, cache), cache,
        new PivotProcedureSpec(Lists.newArrayList("_time"),
            Lists.newArrayList("_field"), "_value"));
  }

  @Test
  public void process() throws Exception {
    pivot.process(ID, table("usage", "web01", 1.5));
    assertEquals(1, cache.size());
    final GroupKey key = cache.keys().get(0);
    assertEquals(1, key.cols().size());
    assertEquals("web01", key.labelValue("host").str());

    final Table out = cache.table(key);
    assertEquals(1, out.len());
    assertEquals(1.5, out.getFloat(out.colIdx("usage"), 0), 0.0001);
    assertEquals(1000, out.getTime(out.colIdx("_time"), 0));
  }

  @Test
  public void duplicateKeyLeavesFirstTable() throws Exception {
    pivot.process(ID, table("usage", "web01", 1.5));
    try {
      pivot.process(ID, table("idle", "web01", 98.5));
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertTrue(e.getMessage().contains("duplicate table with key"));
      assertTrue(e.getMessage().contains("host=web01"));
    }
    assertEquals(1, cache.size());
    final Table out = cache.table(cache.keys().get(0));
    assertEquals(1, out.len());
    assertTrue(out.colIdx("idle") < 0);
  }

  @Test
  public void conflictLeavesCacheUntouched() throws Exception {
    try {
      pivot.process(ID, table("host", "web01", 1.5));
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
      assertTrue(e.getMessage().contains("\"host\""));
    }
    assertEquals(0, cache.size());
    assertEquals(0, allocator.allocated());

    // the key is still free for a valid table
    pivot.process(ID, table("usage", "web01", 1.5));
    assertEquals(1, cache.size());
  }

  private static Table table(final String field, final String host,
                             final double value) {
    final GroupKey key = new DefaultGroupKey(
        Lists.newArrayList(new ColMeta("_field", DataType.STRING),
            new ColMeta("host", DataType.STRING)),
        Lists.<Value>newArrayList(Values.newString(field),
            Values.newString(host)));
    // inputs are accounted apart from the pivot's output
    final ColListTableBuilder builder =
        new ColListTableBuilder(key, new Allocator(0));
    final int field_idx = builder.addCol(
        new ColMeta("_field", DataType.STRING));
    final int host_idx = builder.addCol(new ColMeta("host", DataType.STRING));
    final int time_idx = builder.addCol(new ColMeta("_time", DataType.TIME));
    final int value_idx = builder.addCol(
        new ColMeta("_value", DataType.FLOAT));
    builder.appendString(field_idx, field);
    builder.appendString(host_idx, host);
    builder.appendTime(time_idx, 1000);
    builder.appendFloat(value_idx, value);
    return builder.table();
  }
}
