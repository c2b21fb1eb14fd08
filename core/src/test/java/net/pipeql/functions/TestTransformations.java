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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.pipeql.configuration.UnitTestConfiguration;
import net.pipeql.control.Controller;
import net.pipeql.control.DefaultRegistry;
import net.pipeql.data.DataType;
import net.pipeql.data.Table;
import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.ScriptTextCompiler;
import net.pipeql.storage.MemoryStorageReader;
import net.pipeql.storage.StorageReader;

public class TestTransformations {
  private static final Instant NOW = Instant.parse("2018-05-22T19:53:26Z");
  private static final long NOW_NANOS = NOW.getEpochSecond() * 1000000000L;
  private static final long MINUTE = 60 * 1000000000L;

  private static DefaultRegistry REGISTRY;

  private Controller controller;

  @BeforeClass
  public static void beforeClass() throws Exception {
    REGISTRY = new DefaultRegistry();
  }

  @Before
  public void before() throws Exception {
    final MemoryStorageReader storage = new MemoryStorageReader();
    for (final String bucket : new String[] { "a", "b" }) {
      for (int i = 1; i <= 3; i++) {
        storage.write(bucket, "cpu", "usage",
            ImmutableMap.of("host", "web01"), NOW_NANOS - i * 10 * MINUTE,
            bucket.equals("a") ? (long) i : (long) i * 100);
      }
    }
    storage.write("a", "cpu", "usage", ImmutableMap.of("host", "web02"),
        NOW_NANOS - 10 * MINUTE, 42L);
    // two fields of one series
    storage.write("d", "cpu", "usage", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 10 * MINUTE, 1L);
    storage.write("d", "cpu", "idle", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 10 * MINUTE, 99L);
    // a measurement named after a tag
    storage.write("c", "host", "usage", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 10 * MINUTE, 1.5);

    final Map<String, Object> deps = Maps.newHashMap();
    deps.put(StorageReader.DEPENDENCY, storage);
    controller = new Controller(UnitTestConfiguration.getConfiguration(),
        REGISTRY, deps);
  }

  @After
  public void after() throws Exception {
    controller.shutdown();
  }

  @Test(timeout = 10000)
  public void filter() throws Exception {
    final Map<String, Table> tables = byHost(run(
        "from(bucket:\"a\") |> range(start:-1h) "
        + "|> filter(fn: (r) => r._value > 1 and r._field == \"usage\")"));
    assertEquals(2, tables.size());
    final Table web01 = tables.get("web01");
    assertEquals(2, web01.len());
    for (int i = 0; i < web01.len(); i++) {
      assertTrue(web01.getInt(web01.colIdx("_value"), i) > 1);
    }
    assertEquals(1, tables.get("web02").len());
  }

  @Test(timeout = 10000)
  public void filterDropsEveryRow() throws Exception {
    final Map<String, Table> tables = byHost(run(
        "from(bucket:\"a\") |> range(start:-1h) "
        + "|> filter(fn: (r) => r._value > 1000)"));
    assertEquals(2, tables.size());
    assertEquals(0, tables.get("web01").len());
  }

  @Test(timeout = 10000)
  public void filterMustReturnBool() throws Exception {
    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> filter(fn: (r) => r._value)");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }

  @Test(timeout = 10000)
  public void aggregates() throws Exception {
    final Map<String, Result> results = results(
        "a = from(bucket:\"a\") |> range(start:-1h)\n"
        + "a |> sum() |> yield(name:\"sum\")\n"
        + "a |> count() |> yield(name:\"count\")\n"
        + "a |> mean() |> yield(name:\"mean\")");
    final Table sum = byHost(results.get("sum").tables()).get("web01");
    assertEquals(DataType.INT, sum.cols().get(sum.colIdx("_value")).type());
    assertEquals(6, sum.getInt(sum.colIdx("_value"), 0));
    final Table count = byHost(results.get("count").tables()).get("web02");
    assertEquals(1, count.getInt(count.colIdx("_value"), 0));
    final Table mean = byHost(results.get("mean").tables()).get("web01");
    assertEquals(DataType.FLOAT, mean.cols().get(mean.colIdx("_value")).type());
    assertEquals(2.0, mean.getFloat(mean.colIdx("_value"), 0), 0.0001);
    // aggregates drop the time column
    assertTrue(mean.colIdx("_time") < 0);
  }

  @Test(timeout = 10000)
  public void aggregateAfterFilter() throws Exception {
    final Table mean = byHost(run(
        "from(bucket:\"a\") |> range(start:-1h) "
        + "|> filter(fn: (r) => r._value >= 2) |> mean()")).get("web01");
    assertEquals(2.5, mean.getFloat(mean.colIdx("_value"), 0), 0.0001);
  }

  @Test(timeout = 10000)
  public void pivot() throws Exception {
    final Map<String, Table> tables = byHost(run(
        "from(bucket:\"a\") |> range(start:-1h) "
        + "|> pivot(rowKey:[\"_time\"], colKey:[\"_field\"], "
        + "valueCol:\"_value\")"));
    final Table web01 = tables.get("web01");
    assertEquals(3, web01.len());
    assertTrue(web01.colIdx("usage") >= 0);
    assertTrue(web01.colIdx("_time") >= 0);
    assertTrue(web01.colIdx("_field") < 0);
    assertTrue(web01.colIdx("_value") < 0);
    assertFalse(web01.key().hasCol("_field"));
    long total = 0;
    for (int i = 0; i < web01.len(); i++) {
      total += web01.getInt(web01.colIdx("usage"), i);
    }
    assertEquals(6, total);
  }

  @Test(timeout = 10000)
  public void pivotConflict() throws Exception {
    try {
      run("from(bucket:\"c\") |> range(start:-1h) "
          + "|> pivot(rowKey:[\"_time\"], colKey:[\"_measurement\"], "
          + "valueCol:\"_value\")");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
      assertTrue(e.getMessage().contains("host"));
    }
  }

  @Test(timeout = 10000)
  public void pivotDuplicateKey() throws Exception {
    try {
      run("from(bucket:\"d\") |> range(start:-1h) "
          + "|> pivot(rowKey:[\"_time\"], colKey:[\"_field\"], "
          + "valueCol:\"_value\")");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertTrue(e.getMessage().contains("pivot found duplicate table with key"));
      assertTrue(e.getMessage().contains("_measurement=cpu"));
      assertTrue(e.getMessage().contains("host=web01"));
    }
  }

  @Test(timeout = 10000)
  public void pivotMissingColumn() throws Exception {
    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> pivot(rowKey:[\"nope\"], colKey:[\"_field\"], "
          + "valueCol:\"_value\")");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }

  @Test(timeout = 10000)
  public void rename() throws Exception {
    Table table = run("from(bucket:\"a\") |> range(start:-1h) "
        + "|> rename(columns:{_value:\"v\", host:\"server\"})").get(0);
    assertTrue(table.colIdx("v") >= 0);
    assertTrue(table.colIdx("_value") < 0);
    assertTrue(table.key().hasCol("server"));
    assertFalse(table.key().hasCol("host"));

    final List<Table> tables = run("from(bucket:\"a\") |> range(start:-1h) "
        + "|> rename(fn: (column) => column + \"_x\")");
    table = tables.get(0);
    assertTrue(table.colIdx("_value_x") >= 0);
    assertTrue(table.colIdx("_time_x") >= 0);
    assertTrue(table.key().hasCol("host_x"));
  }

  @Test(timeout = 10000)
  public void renameErrors() throws Exception {
    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> rename(columns:{nope:\"x\"})");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }

    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> rename(columns:{_value:\"_time\"})");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }

    try {
      run("from(bucket:\"a\") |> range(start:-1h) |> rename()");
      fail("Expected CompileException");
    } catch (CompileException e) { }

    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> rename(columns:{_value:\"v\"}, fn: (c) => c)");
      fail("Expected CompileException");
    } catch (CompileException e) { }
  }

  @Test(timeout = 10000)
  public void dropAndKeep() throws Exception {
    Table table = byHost(run("from(bucket:\"a\") |> range(start:-1h) "
        + "|> drop(columns:[\"_measurement\"])")).get("web01");
    assertTrue(table.colIdx("_measurement") < 0);
    assertFalse(table.key().hasCol("_measurement"));
    assertEquals(3, table.len());

    table = byHost(run("from(bucket:\"a\") |> range(start:-1h) "
        + "|> drop(fn: (column) => column =~ /^_st/)")).get("web01");
    assertTrue(table.colIdx("_start") < 0);
    assertTrue(table.colIdx("_stop") < 0);
    assertTrue(table.colIdx("_value") >= 0);

    final Map<String, Table> kept = byHost(run(
        "from(bucket:\"a\") |> range(start:-1h) "
        + "|> keep(columns:[\"_time\", \"_value\", \"host\"])"));
    assertEquals(2, kept.size());
    table = kept.get("web01");
    assertEquals(3, table.cols().size());
    assertEquals(1, table.key().cols().size());

    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> drop(columns:[\"nope\"])");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }

  @Test(timeout = 10000)
  public void duplicate() throws Exception {
    final Table table = byHost(run("from(bucket:\"a\") |> range(start:-1h) "
        + "|> duplicate(column:\"host\", as:\"server\")")).get("web01");
    assertTrue(table.key().hasCol("server"));
    assertEquals("web01", table.key().labelValue("server").str());
    assertEquals("web01", table.getString(table.colIdx("server"), 0));

    try {
      run("from(bucket:\"a\") |> range(start:-1h) "
          + "|> duplicate(column:\"host\", as:\"_value\")");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }

  @Test(timeout = 10000)
  public void join() throws Exception {
    final List<Table> tables = run(
        "a = from(bucket:\"a\") |> range(start:-1h)\n"
        + "b = from(bucket:\"b\") |> range(start:-1h)\n"
        + "join(tables:{a:a, b:b}, on:[\"_time\"])");
    // web02 only exists on one side
    assertEquals(1, tables.size());
    final Table joined = tables.get(0);
    assertEquals(3, joined.len());
    final int a = joined.colIdx("_value_a");
    final int b = joined.colIdx("_value_b");
    assertTrue(a >= 0);
    assertTrue(b >= 0);
    assertTrue(joined.colIdx("_value") < 0);
    assertTrue(joined.colIdx("_time") >= 0);
    for (int i = 0; i < joined.len(); i++) {
      assertEquals(joined.getInt(a, i) * 100, joined.getInt(b, i));
    }
  }

  @Test(timeout = 10000)
  public void joinErrors() throws Exception {
    try {
      run("a = from(bucket:\"a\") |> range(start:-1h)\n"
          + "join(tables:{a:a}, on:[\"_time\"])");
      fail("Expected CompileException");
    } catch (CompileException e) { }

    try {
      run("a = from(bucket:\"a\") |> range(start:-1h)\n"
          + "b = from(bucket:\"b\") |> range(start:-1h)\n"
          + "join(tables:{a:a, b:b}, on:[\"nope\"])");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }

  @Test(timeout = 10000)
  public void yields() throws Exception {
    final Map<String, Result> results = results(
        "from(bucket:\"a\") |> range(start:-1h) |> yield(name:\"raw\")");
    assertEquals(1, results.size());
    assertEquals("raw", results.get("raw").name());
    assertNull(results.get("_result"));
  }

  private List<Table> run(final String script) throws Exception {
    final Map<String, Result> results = results(script);
    assertEquals(1, results.size());
    return results.values().iterator().next().tables();
  }

  private Map<String, Result> results(final String script) throws Exception {
    final Query query = controller.query(QueryContext.background(),
        new Request("org", new ScriptTextCompiler(script, NOW)));
    try {
      return query.ready().join();
    } finally {
      query.done();
    }
  }

  /** @return The tables keyed by their host. */
  private static Map<String, Table> byHost(final List<Table> tables) {
    final Map<String, Table> map = Maps.newHashMap();
    for (final Table table : tables) {
      map.put(table.key().labelValue("host").str(), table);
    }
    return map;
  }
}
