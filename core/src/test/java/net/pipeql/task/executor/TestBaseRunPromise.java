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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.RunCanceledException;
import net.pipeql.task.backend.RunResult;

public class TestBaseRunPromise {
  private static final QueuedRun RUN =
      new QueuedRun("0000000000000001", "0000000000000002", 1527018806);

  @Test
  public void ctor() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    assertSame(RUN, promise.run());
    assertFalse(promise.isFinished());
    assertEquals(0, promise.released);

    try {
      new CountingPromise(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void finishResult() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    final RunResult result = new DefaultRunResult(null, false);
    assertTrue(promise.finish(result, null));
    assertTrue(promise.isFinished());
    assertSame(result, promise.await());
    assertSame(result, promise.await());
    assertEquals(1, promise.released);
  }

  @Test
  public void finishResultWithError() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    final QueryExecutionException ex =
        new QueryExecutionException("boom", 500);
    final RunResult result = new DefaultRunResult(ex, true);
    assertTrue(promise.finish(result, null));
    assertSame(result, promise.await());
    assertSame(ex, promise.await().err());
    assertTrue(promise.await().isRetryable());
  }

  @Test
  public void finishError() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    final QueryExecutionException ex =
        new QueryExecutionException("boom", 500);
    assertTrue(promise.finish(null, ex));
    try {
      promise.await();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertSame(ex, e);
    }
    assertEquals(1, promise.released);
  }

  @Test
  public void firstFinishWins() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    final RunResult result = new DefaultRunResult(null, false);
    assertTrue(promise.finish(result, null));
    assertFalse(promise.finish(null,
        new QueryExecutionException("late", 500)));
    assertFalse(promise.finish(new DefaultRunResult(null, true), null));
    promise.cancel();

    assertSame(result, promise.await());
    assertEquals(1, promise.released);
  }

  @Test
  public void cancel() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    promise.cancel();
    assertTrue(promise.isFinished());
    try {
      promise.await();
      fail("Expected RunCanceledException");
    } catch (RunCanceledException e) { }

    promise.cancel();
    assertFalse(promise.finish(new DefaultRunResult(null, false), null));
    assertEquals(1, promise.released);
  }

  @Test
  public void concurrentFinish() throws Exception {
    final CountingPromise promise = new CountingPromise(RUN);
    final Thread[] threads = new Thread[8];
    for (int i = 0; i < threads.length; i++) {
      threads[i] = new Thread(new Runnable() {
        @Override
        public void run() {
          promise.finish(new DefaultRunResult(null, false), null);
        }
      });
    }
    for (final Thread thread : threads) {
      thread.start();
    }
    for (final Thread thread : threads) {
      thread.join();
    }
    assertTrue(promise.isFinished());
    assertEquals(1, promise.released);
  }

  /** Counts the releases. */
  static class CountingPromise extends BaseRunPromise {
    volatile int released;

    CountingPromise(final QueuedRun run) {
      super(run);
    }

    @Override
    protected synchronized void release() {
      released++;
    }
  }
}
