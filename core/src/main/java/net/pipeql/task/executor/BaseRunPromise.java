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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Deferred;

import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.RunCanceledException;
import net.pipeql.task.backend.RunPromise;
import net.pipeql.task.backend.RunResult;
import net.pipeql.utils.DateTime;

/**
 * The single assignment half of a run promise. The first call to 
 * {@link #finish(RunResult, Exception)} wins, releases the promise's
 * resources and then logs and resolves the outcome. Later calls are
 * dropped.
 * 
 * @since 1.0
 */
public abstract class BaseRunPromise implements RunPromise {
  private static final Logger LOG = LoggerFactory.getLogger(
      BaseRunPromise.class);
  
  protected final QueuedRun run;
  private final long start;
  private final AtomicBoolean finished;
  private final Deferred<RunResult> deferred;
  
  protected BaseRunPromise(final QueuedRun run) {
    if (run == null) {
      throw new IllegalArgumentException("Run cannot be null.");
    }
    this.run = run;
    start = DateTime.nanoTime();
    finished = new AtomicBoolean();
    deferred = new Deferred<RunResult>();
  }
  
  @Override
  public QueuedRun run() {
    return run;
  }
  
  @Override
  public RunResult await() throws Exception {
    return deferred.join();
  }
  
  @Override
  public void cancel() {
    finish(null, new RunCanceledException());
  }
  
  /** @return Whether or not the promise has resolved. */
  public boolean isFinished() {
    return finished.get();
  }
  
  /**
   * Resolves the promise if it has not resolved yet.
   * @param result The result when the query was evaluated.
   * @param error The error when no result could be produced. 
   * @return True if this call resolved the promise.
   */
  protected boolean finish(final RunResult result, final Exception error) {
    if (!finished.compareAndSet(false, true)) {
      return false;
    }
    // resources go before waiters wake up
    try {
      release();
    } finally {
      resolve(result, error);
    }
    return true;
  }
  
  private void resolve(final RunResult result, final Exception error) {
    if (error != null) {
      LOG.info("Execution failed to get result for " + run + " after " 
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms: " 
          + error.getMessage());
      deferred.callback(error);
    } else if (result.err() != null) {
      LOG.info("Got result with error for " + run + " after " 
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms: " 
          + result.err().getMessage());
      deferred.callback(result);
    } else {
      LOG.info("Completed successfully " + run + " in " 
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
      deferred.callback(result);
    }
  }
  
  /** Called exactly once, before waiters on the promise resume. */
  protected abstract void release();
  
}
