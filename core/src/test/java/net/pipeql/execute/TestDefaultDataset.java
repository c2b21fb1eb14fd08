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
package net.pipeql.execute;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.DataType;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.plan.ProcedureID;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

public class TestDefaultDataset {
  private static final DatasetID ID = DatasetID.fromProcedureID(
      ProcedureID.fromOperationID("filter0"));
  private static final DatasetID PARENT = DatasetID.fromProcedureID(
      ProcedureID.fromOperationID("from0"));

  private Allocator allocator;
  private TableBuilderCache cache;
  private DefaultDataset dataset;
  private RecordingTransformation downstream;

  @Before
  public void before() throws Exception {
    allocator = new Allocator(0);
    cache = new TableBuilderCache(allocator);
    dataset = new DefaultDataset(ID, AccumulationMode.DISCARDING, cache);
    downstream = new RecordingTransformation();
    dataset.addTransformation(downstream);
  }

  @Test
  public void ctor() throws Exception {
    assertSame(ID, dataset.id());

    try {
      new DefaultDataset(null, AccumulationMode.DISCARDING, cache);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new DefaultDataset(ID, null, cache);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new DefaultDataset(ID, AccumulationMode.DISCARDING, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void cacheBuilders() throws Exception {
    final GroupKey web02 = key(100, "web02");
    final GroupKey web01 = key(100, "web01");
    final TableBuilder builder = cache.tableBuilder(web02);
    assertSame(builder, cache.tableBuilder(web02));
    cache.tableBuilder(web01);
    assertEquals(2, cache.size());
    assertEquals(Lists.newArrayList(web01, web02), cache.keys());

    append(web01, 42);
    assertTrue(allocator.allocated() > 0);
    cache.discardTable(web01);
    assertTrue(cache.hasTable(web01));
    assertEquals(0, cache.table(web01).len());
    cache.expireTable(web01);
    cache.expireTable(web02);
    assertFalse(cache.hasTable(web01));
    assertNull(cache.table(web01));
    assertEquals(0, allocator.allocated());
  }

  @Test
  public void watermarkFiresTables() throws Exception {
    append(key(100, "web01"), 1);
    append(key(200, "web02"), 2);

    dataset.updateWatermark(50);
    assertTrue(downstream.tables.isEmpty());
    assertEquals(Lists.newArrayList(50L), downstream.watermarks);

    dataset.updateWatermark(100);
    assertEquals(1, downstream.tables.size());
    assertEquals("web01", host(downstream.tables.get(0)));
    assertEquals(1, value(downstream.tables.get(0), 0));
    assertFalse(cache.hasTable(key(100, "web01")));
    assertEquals(1, cache.size());

    dataset.updateWatermark(250);
    assertEquals(2, downstream.tables.size());
    assertEquals("web02", host(downstream.tables.get(1)));
    assertEquals(0, cache.size());
    assertEquals(0, allocator.allocated());

    // nothing left to flush
    dataset.finish(null);
    assertEquals(2, downstream.tables.size());
    assertEquals(1, downstream.finishes);
    assertNull(downstream.error);
  }

  @Test
  public void finishFlushesTablesWithoutStop() throws Exception {
    final GroupKey key = new DefaultGroupKey(
        Lists.newArrayList(new ColMeta("host", DataType.STRING)),
        Lists.<Value>newArrayList(Values.newString("web01")));
    append(key, 1);
    append(key, 2);

    dataset.updateWatermark(Long.MAX_VALUE);
    assertTrue(downstream.tables.isEmpty());

    dataset.finish(null);
    assertEquals(1, downstream.tables.size());
    assertEquals(2, downstream.tables.get(0).len());
    assertEquals(0, cache.size());
    assertEquals(0, allocator.allocated());
    assertEquals(1, downstream.finishes);
  }

  @Test
  public void finishWithErrorDropsTables() throws Exception {
    append(key(100, "web01"), 1);
    final QueryExecutionException ex =
        new QueryExecutionException("boom", 500);
    dataset.finish(ex);
    assertTrue(downstream.tables.isEmpty());
    assertSame(ex, downstream.error);
    assertEquals(0, cache.size());
    assertEquals(0, allocator.allocated());
  }

  @Test
  public void retractThenReprocess() throws Exception {
    final GroupKey key = key(1000, "web01");
    append(key, 1);

    dataset.retractTable(key);
    assertEquals(Lists.newArrayList(key), downstream.retracted);
    assertEquals(0, cache.table(key).len());

    append(key, 2);
    dataset.finish(null);
    assertEquals(1, downstream.tables.size());
    final Table table = downstream.tables.get(0);
    assertEquals(1, table.len());
    assertEquals(2, value(table, 0));
  }

  @Test
  public void transportPropagatesErrors() throws Exception {
    final FailingTransformation failing =
        new FailingTransformation(dataset, cache);
    final ConsecutiveTransport transport = new ConsecutiveTransport(failing);
    final Table table = new ColListTableBuilder(key(100, "web01"), allocator)
        .table();

    transport.process(PARENT, table);
    assertEquals(1, failing.calls);
    assertSame(failing.ex, downstream.error);
    assertEquals(1, downstream.finishes);

    // dropped once failed
    transport.process(PARENT, table);
    transport.updateWatermark(PARENT, 100);
    transport.finish(PARENT, null);
    assertEquals(1, failing.calls);
    assertEquals(1, downstream.finishes);
    assertTrue(downstream.watermarks.isEmpty());
  }

  @Test
  public void transportForwardsInOrder() throws Exception {
    final RecordingTransformation recording = new RecordingTransformation();
    final ConsecutiveTransport transport =
        new ConsecutiveTransport(recording);
    final GroupKey key = key(100, "web01");
    final Table table = new ColListTableBuilder(key, allocator).table();
    transport.process(PARENT, table);
    transport.retractTable(PARENT, key);
    transport.updateWatermark(PARENT, 100);
    transport.finish(PARENT, null);

    assertSame(table, recording.tables.get(0));
    assertEquals(Lists.newArrayList(key), recording.retracted);
    assertEquals(Lists.newArrayList(100L), recording.watermarks);
    assertEquals(1, recording.finishes);
    assertNull(recording.error);
  }

  private void append(final GroupKey key, final long value) {
    final TableBuilder builder = cache.tableBuilder(key);
    final int col = builder.ensureCol(new ColMeta("_value", DataType.INT));
    builder.appendInt(col, value);
  }

  private static GroupKey key(final long stop, final String host) {
    return new DefaultGroupKey(
        Lists.newArrayList(new ColMeta("_stop", DataType.TIME),
            new ColMeta("host", DataType.STRING)),
        Lists.<Value>newArrayList(Values.newTime(stop),
            Values.newString(host)));
  }

  private static String host(final Table table) {
    return table.key().labelValue("host").str();
  }

  private static long value(final Table table, final int row) {
    return table.getInt(table.colIdx("_value"), row);
  }

  /** Records everything it receives. */
  static class RecordingTransformation implements Transformation {
    final List<Table> tables = Lists.newArrayList();
    final List<GroupKey> retracted = Lists.newArrayList();
    final List<Long> watermarks = Lists.newArrayList();
    int finishes;
    Throwable error;

    @Override
    public void retractTable(final DatasetID id, final GroupKey key) {
      retracted.add(key);
    }

    @Override
    public void process(final DatasetID id, final Table table) {
      tables.add(table);
    }

    @Override
    public void updateWatermark(final DatasetID id, final long time) {
      watermarks.add(time);
    }

    @Override
    public void updateProcessingTime(final DatasetID id, final long time) { }

    @Override
    public void finish(final DatasetID id, final Throwable error) {
      finishes++;
      this.error = error;
    }
  }

  /** Fails every table. */
  static class FailingTransformation extends AbstractTransformation {
    final QueryExecutionException ex =
        new QueryExecutionException("bad table", 500);
    int calls;

    FailingTransformation(final Dataset dataset,
                          final TableBuilderCache cache) {
      super(dataset, cache);
    }

    @Override
    public void process(final DatasetID id, final Table table) {
      calls++;
      throw ex;
    }
  }
}
