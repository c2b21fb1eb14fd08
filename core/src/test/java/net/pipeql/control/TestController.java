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
package net.pipeql.control;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.pipeql.configuration.UnitTestConfiguration;
import net.pipeql.data.Table;
import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.QueryExecutionCanceled;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.Allocator;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.ResultIterator;
import net.pipeql.query.ScriptTextCompiler;
import net.pipeql.query.Statistics;
import net.pipeql.storage.MemoryStorageReader;
import net.pipeql.storage.ReadSpec;
import net.pipeql.storage.StorageReader;

public class TestController {
  private static final Instant NOW = Instant.parse("2018-05-22T19:53:26Z");
  private static final long NOW_NANOS = NOW.getEpochSecond() * 1000000000L;
  private static final long MINUTE = 60 * 1000000000L;

  private static DefaultRegistry REGISTRY;

  private MemoryStorageReader storage;
  private Controller controller;

  @BeforeClass
  public static void beforeClass() throws Exception {
    REGISTRY = new DefaultRegistry();
  }

  @Before
  public void before() throws Exception {
    storage = new MemoryStorageReader();
    storage.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 30 * MINUTE, 1L);
    storage.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 20 * MINUTE, 2L);
    storage.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 10 * MINUTE, 3L);
    // outside of an hour
    storage.write("b", "cpu", "usage", ImmutableMap.of("host", "web01"),
        NOW_NANOS - 90 * MINUTE, 100L);
    storage.write("b", "cpu", "usage", ImmutableMap.of("host", "web02"),
        NOW_NANOS - 5 * MINUTE, 42.5);
    controller = newController(UnitTestConfiguration.getConfiguration(),
        storage);
  }

  @After
  public void after() throws Exception {
    controller.shutdown();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new Controller(null, REGISTRY, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new Controller(UnitTestConfiguration.getConfiguration(), null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test(timeout = 10000)
  public void mean() throws Exception {
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h) |> mean()"));
    final Map<String, Result> results = query.ready().join();
    assertEquals(1, results.size());
    final Result result = results.get("_result");
    assertEquals("_result", result.name());

    final Map<String, Double> means = means(result.tables());
    assertEquals(2, means.size());
    assertEquals(2.0, means.get("web01"), 0.0001);
    assertEquals(42.5, means.get("web02"), 0.0001);
    assertNull(query.err());

    assertEquals(1, controller.activeQueries());
    query.done();
    assertEquals(0, controller.activeQueries());
  }

  @Test(timeout = 10000)
  public void filterAndYields() throws Exception {
    final Query query = controller.query(QueryContext.background(),
        request("a = from(bucket:\"b\") |> range(start:-1h)\n"
            + "a |> filter(fn: (r) => r.host == \"web01\") "
            + "|> sum() |> yield(name:\"sum\")\n"
            + "a |> count() |> yield(name:\"count\")"));
    final Map<String, Result> results = query.ready().join();
    assertEquals(2, results.size());

    // filtered tables keep their key so web02 comes through empty
    boolean found = false;
    for (final Table sum : results.get("sum").tables()) {
      if ("web01".equals(sum.key().labelValue("host").str())) {
        assertEquals(1, sum.len());
        assertEquals(6, sum.getInt(sum.colIdx("_value"), 0));
        found = true;
      }
    }
    assertTrue(found);

    final List<Table> counts = results.get("count").tables();
    assertEquals(2, counts.size());
    for (final Table count : counts) {
      final long expected = "web01".equals(count.key().labelValue("host")
          .str()) ? 3 : 1;
      assertEquals(expected, count.getInt(count.colIdx("_value"), 0));
    }
    query.done();
  }

  @Test(timeout = 10000)
  public void emptyBucket() throws Exception {
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"nope\") |> range(start:-1h)"));
    final Map<String, Result> results = query.ready().join();
    assertTrue(results.get("_result").tables().isEmpty());
    query.done();
  }

  @Test(timeout = 10000)
  public void compileError() throws Exception {
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> nosuchfunc()"));
    try {
      query.ready().join();
      fail("Expected CompileException");
    } catch (CompileException e) { }
    assertTrue(query.err() instanceof CompileException);
    // a resolved query answers again with the same error
    try {
      query.ready().join();
      fail("Expected CompileException");
    } catch (CompileException e) { }
    query.done();
    assertEquals(0, controller.activeQueries());
  }

  @Test(timeout = 10000)
  public void memoryLimit() throws Exception {
    controller.shutdown();
    final UnitTestConfiguration config =
        UnitTestConfiguration.getConfiguration(ImmutableMap.of(
            Controller.MEMORY_LIMIT_KEY, "16"));
    controller = newController(config, storage);
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h)"));
    try {
      query.ready().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(Allocator.LIMIT_EXCEEDED, e.getStatusCode());
    }
    query.done();
  }

  @Test(timeout = 10000)
  public void cancel() throws Exception {
    final BlockingReader reader = new BlockingReader();
    controller.shutdown();
    controller = newController(UnitTestConfiguration.getConfiguration(),
        reader);
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h)"));
    reader.reading.await();
    query.cancel();
    try {
      query.ready().join();
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    reader.release.countDown();
    query.done();
    assertEquals(0, controller.activeQueries());
  }

  @Test(timeout = 10000)
  public void parentContextCanceled() throws Exception {
    final BlockingReader reader = new BlockingReader();
    controller.shutdown();
    controller = newController(UnitTestConfiguration.getConfiguration(),
        reader);
    final QueryContext parent = QueryContext.withCancel(
        QueryContext.background());
    final Query query = controller.query(parent,
        request("from(bucket:\"b\") |> range(start:-1h)"));
    reader.reading.await();
    parent.cancel();
    try {
      query.ready().join();
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    reader.release.countDown();
    query.done();
  }

  @Test(timeout = 10000)
  public void doneBeforeCompletionCancels() throws Exception {
    final BlockingReader reader = new BlockingReader();
    controller.shutdown();
    controller = newController(UnitTestConfiguration.getConfiguration(),
        reader);
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h)"));
    reader.reading.await();
    query.done();
    assertEquals(0, controller.activeQueries());
    assertTrue(query.err() instanceof QueryExecutionCanceled);
    reader.release.countDown();
  }

  @Test(timeout = 10000)
  public void shutdown() throws Exception {
    final BlockingReader reader = new BlockingReader();
    controller.shutdown();
    controller = newController(UnitTestConfiguration.getConfiguration(),
        reader);
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h)"));
    reader.reading.await();
    assertNull(controller.shutdown().join());
    try {
      query.ready().join();
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    reader.release.countDown();

    try {
      controller.query(QueryContext.background(),
          request("from(bucket:\"b\") |> range(start:-1h)"));
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(503, e.getStatusCode());
    }
  }

  @Test(timeout = 10000)
  public void doneReleasesContext() throws Exception {
    final CountingContext parent = new CountingContext();
    for (int i = 0; i < 3; i++) {
      final Query query = controller.query(parent,
          request("from(bucket:\"b\") |> range(start:-1h) |> count()"));
      assertEquals(1, query.ready().join().size());
      query.done();
      assertNull(query.err());
    }
    assertEquals(0, parent.listenerCount());
    assertFalse(parent.isDone());
  }

  @Test(timeout = 10000)
  public void queryWithCompile() throws Exception {
    final Query query = controller.queryWithCompile(QueryContext.background(),
        "org", "from(bucket:\"b\") |> range(start:-1h) |> count()");
    final Map<String, Result> results = query.ready().join();
    assertEquals(1, results.size());
    assertTrue(query.statistics().compileDuration() > 0);
    query.done();

    try {
      controller.queryWithCompile(QueryContext.background(), "org", "from(");
      fail("Expected CompileException");
    } catch (CompileException e) { }
  }

  @Test(timeout = 10000)
  public void statistics() throws Exception {
    final Query query = controller.query(QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h)"));
    query.ready().join();
    query.done();
    final Statistics stats = query.statistics();
    assertTrue(stats.compileDuration() > 0);
    assertTrue(stats.planDuration() > 0);
    assertTrue(stats.totalDuration() >= stats.compileDuration());
    assertTrue(stats.maxAllocated() > 0);
    // frozen once done
    assertEquals(stats.totalDuration(), query.statistics().totalDuration());
  }

  @Test(timeout = 10000)
  public void bridge() throws Exception {
    final QueryServiceBridge bridge = new QueryServiceBridge(controller);
    final ResultIterator iterator = bridge.query(
        QueryContext.background(),
        request("from(bucket:\"b\") |> range(start:-1h) |> mean()"));
    assertTrue(iterator.more());
    final Result result = iterator.next();
    assertEquals("_result", result.name());
    assertFalse(iterator.more());
    assertNull(iterator.err());
    assertEquals(0, controller.activeQueries());
  }

  private static Controller newController(final UnitTestConfiguration config,
                                          final StorageReader reader) {
    final Map<String, Object> deps = Maps.newHashMap();
    deps.put(StorageReader.DEPENDENCY, reader);
    return new Controller(config, REGISTRY, deps);
  }

  private static Request request(final String script) {
    return new Request("org", new ScriptTextCompiler(script, NOW));
  }

  /** @return The first value of each table by host. */
  private static Map<String, Double> means(final List<Table> tables) {
    final Map<String, Double> means = Maps.newHashMap();
    for (final Table table : tables) {
      assertEquals(1, table.len());
      means.put(table.key().labelValue("host").str(),
          table.getFloat(table.colIdx("_value"), 0));
    }
    return means;
  }

  /** A root context exposing how many children listen on it. */
  static class CountingContext extends QueryContext {
    CountingContext() {
      super(null, null);
    }

    int listenerCount() {
      synchronized (this) {
        return listeners.size();
      }
    }
  }

  /** Blocks reads until released. */
  static class BlockingReader implements StorageReader {
    final CountDownLatch reading = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);

    @Override
    public List<Table> read(final ReadSpec spec, final Allocator allocator) {
      reading.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return Collections.emptyList();
    }
  }
}
