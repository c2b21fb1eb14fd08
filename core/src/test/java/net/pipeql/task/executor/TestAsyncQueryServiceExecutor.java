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
package net.pipeql.task.executor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import net.pipeql.configuration.UnitTestConfiguration;
import net.pipeql.control.DefaultRegistry;
import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.QueryContext;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.query.SpecCompiler;
import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.RunCanceledException;
import net.pipeql.task.backend.RunResult;
import net.pipeql.task.executor.AsyncQueryServiceExecutor.AsyncRunPromise;
import net.pipeql.task.executor.FakeAsyncQueryService.FakeQuery;
import net.pipeql.task.store.InMemStore;

public class TestAsyncQueryServiceExecutor {
  static final String SCRIPT = "option task = {name: \"a task\", "
      + "cron: \"* * * * *\"}\n\n"
      + "from(bucket:\"test\") |> range(start:-1h)";

  private static ScriptCompiler COMPILER;

  private FakeAsyncQueryService service;
  private InMemStore store;
  private AsyncQueryServiceExecutor executor;
  private QueryContext ctx;

  @BeforeClass
  public static void beforeClass() throws Exception {
    COMPILER = new DefaultRegistry().compiler();
  }

  @Before
  public void before() throws Exception {
    service = new FakeAsyncQueryService();
    store = new InMemStore(UnitTestConfiguration.getConfiguration(),
        COMPILER);
    executor = new AsyncQueryServiceExecutor(service, store, COMPILER);
    ctx = QueryContext.background();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new AsyncQueryServiceExecutor(null, store, COMPILER);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new AsyncQueryServiceExecutor(service, null, COMPILER);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new AsyncQueryServiceExecutor(service, store, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void success() throws Exception {
    final QueuedRun run = newRun();
    final AsyncRunPromise promise = executor.execute(ctx, run);
    assertSame(run, promise.run());
    assertFalse(promise.isFinished());

    final FakeQuery query = service.waitForQueryLive();
    assertEquals("org", query.request.organizationID());
    // the run time is the evaluation instant
    assertEquals(run.now(), ((SpecCompiler) query.request.compiler())
        .spec().now().getEpochSecond());

    query.succeed();
    final RunResult result = promise.await();
    assertNull(result.err());
    assertFalse(result.isRetryable());
    assertSame(result, promise.await());
    assertTrue(promise.isFinished());
    assertTrue(query.done);
    assertFalse(query.canceled);
  }

  @Test
  public void queryFailure() throws Exception {
    final AsyncRunPromise promise = executor.execute(ctx, newRun());
    final FakeQuery query = service.waitForQueryLive();
    final QueryExecutionException e =
        new QueryExecutionException("boom", 500);
    query.fail(e);

    final RunResult result = promise.await();
    assertSame(e, result.err());
    assertTrue(query.done);
  }

  @Test
  public void cancel() throws Exception {
    final AsyncRunPromise promise = executor.execute(ctx, newRun());
    final FakeQuery query = service.waitForQueryLive();
    promise.cancel();

    try {
      promise.await();
      fail("Expected RunCanceledException");
    } catch (RunCanceledException e) { }
    assertTrue(query.canceled);
    // released once the query reported its cancellation
    assertTrue(query.done);

    // late outcomes are dropped
    query.succeed();
    try {
      promise.await();
      fail("Expected RunCanceledException");
    } catch (RunCanceledException e) { }
  }

  @Test
  public void parentCanceled() throws Exception {
    final QueryContext parent = QueryContext.withCancel(ctx);
    final AsyncRunPromise promise = executor.execute(parent, newRun());
    final FakeQuery query = service.waitForQueryLive();
    parent.cancel();

    final RunResult result = promise.await();
    assertTrue(query.canceled);
    assertTrue(result.err() instanceof QueryExecutionException);
  }

  @Test
  public void missingTask() throws Exception {
    try {
      executor.execute(ctx, new QueuedRun("00000000000000ff", "run", 1));
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(404, e.getStatusCode());
    }
  }

  @Test
  public void compileFailure() throws Exception {
    final String id = store.createTask(ctx, "org", "user",
        "option task = {name: \"t\", every: 1m}\n"
        + "from(db:\"test\") |> range(start:-1h)");
    try {
      executor.execute(ctx, store.createRun(ctx, id, 1527018806));
      fail("Expected CompileException");
    } catch (CompileException e) { }
  }

  @Test
  public void serviceFailure() throws Exception {
    service.throw_on_query = new QueryExecutionException("shut down", 503);
    try {
      executor.execute(ctx, newRun());
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(503, e.getStatusCode());
    }
  }

  private QueuedRun newRun() {
    final String id = store.createTask(ctx, "org", "user", SCRIPT);
    return store.createRun(ctx, id, 1527018806);
  }
}
