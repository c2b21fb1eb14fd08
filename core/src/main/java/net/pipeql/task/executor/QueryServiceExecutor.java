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

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;

import io.netty.util.HashedWheelTimer;
import net.pipeql.configuration.Configuration;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.QueryContext;
import net.pipeql.query.QueryService;
import net.pipeql.query.Request;
import net.pipeql.query.ResultIterator;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.query.Spec;
import net.pipeql.query.SpecCompiler;
import net.pipeql.task.backend.Executor;
import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.Store;
import net.pipeql.task.backend.StoreTask;
import net.pipeql.utils.Threads;

/**
 * An {@link Executor} over a blocking {@link QueryService}. Each run
 * compiles, submits and drains its query on the executor's pool while
 * the run's context is observed for cancellation. A run's context is
 * a child of the caller's, with a deadline when 
 * {@link #RUN_TIMEOUT_KEY} is positive.
 * <p>
 * Prefer the {@link AsyncQueryServiceExecutor} where an async service
 * is available.
 * 
 * @since 1.0
 */
public class QueryServiceExecutor implements Executor {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryServiceExecutor.class);
  
  public static final String THREADS_KEY = "task.executor.threads";
  public static final String RUN_TIMEOUT_KEY = "task.executor.run_timeout";
  
  private final QueryService service;
  private final Store store;
  private final ScriptCompiler compiler;
  private final ExecutorService pool;
  private final long run_timeout;
  private final HashedWheelTimer timer;
  
  /**
   * Default ctor.
   * @param config The non-null config. Keys are registered if missing.
   * @param service The non-null query service.
   * @param store The non-null store tasks are read from.
   * @param compiler The non-null compiler for task scripts.
   */
  public QueryServiceExecutor(final Configuration config, 
                              final QueryService service, 
                              final Store store, 
                              final ScriptCompiler compiler) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (service == null) {
      throw new IllegalArgumentException("Service cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (compiler == null) {
      throw new IllegalArgumentException("Compiler cannot be null.");
    }
    if (!config.hasProperty(THREADS_KEY)) {
      config.register(THREADS_KEY, 4, false, 
          "The number of threads running task queries.");
    }
    if (!config.hasProperty(RUN_TIMEOUT_KEY)) {
      config.register(RUN_TIMEOUT_KEY, 0L, true, 
          "How long a task run may take in milliseconds. Zero disables "
          + "the deadline.");
    }
    this.service = service;
    this.store = store;
    this.compiler = compiler;
    pool = Threads.newPool(config.getInt(THREADS_KEY), "TaskExecutor");
    run_timeout = config.getLong(RUN_TIMEOUT_KEY);
    if (run_timeout > 0) {
      timer = Threads.newTimer("TaskExecutor");
      timer.start();
    } else {
      timer = null;
    }
  }
  
  @Override
  public SyncRunPromise execute(final QueryContext ctx, final QueuedRun run) {
    if (ctx == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (run == null) {
      throw new IllegalArgumentException("Run cannot be null.");
    }
    final StoreTask task = store.findTaskByID(ctx, run.taskID());
    if (task == null) {
      throw new QueryExecutionException("task not found: " 
          + run.taskID(), 404);
    }
    final SyncRunPromise promise = new SyncRunPromise(ctx, run, task);
    promise.start();
    return promise;
  }
  
  /** Stops the pool and the deadline timer. */
  public void shutdown() {
    pool.shutdown();
    if (timer != null) {
      timer.stop();
    }
  }
  
  /** A promise resolved by the query driver or the context observer. */
  public class SyncRunPromise extends BaseRunPromise {
    private final StoreTask task;
    private final QueryContext context;
    
    SyncRunPromise(final QueryContext parent, 
                   final QueuedRun run, 
                   final StoreTask task) {
      super(run);
      this.task = task;
      context = run_timeout > 0 
          ? QueryContext.withTimeout(parent, timer, run_timeout) 
          : QueryContext.withCancel(parent);
    }
    
    void start() {
      class ContextCB implements Callback<Object, Object> {
        @Override
        public Object call(final Object ignored) throws Exception {
          final Throwable cause = context.err();
          finish(null, cause instanceof Exception ? (Exception) cause 
              : new QueryExecutionException(cause.getMessage(), 500, cause));
          return null;
        }
      }
      context.done().addCallback(new ContextCB());
      if (isFinished()) {
        return;
      }
      
      try {
        pool.submit(new Runnable() {
          @Override
          public void run() {
            doQuery();
          }
        });
      } catch (RejectedExecutionException e) {
        LOG.warn("Failed to schedule " + run, e);
        finish(null, new QueryExecutionException(
            "failed to schedule run: " + e.getMessage(), 503, e));
      }
    }
    
    void doQuery() {
      final ResultIterator iterator;
      try {
        context.throwIfDone();
        final Spec spec = compiler.compile(context, task.script(), 
            Instant.ofEpochSecond(run.now()));
        iterator = service.query(context, 
            new Request(task.org(), new SpecCompiler(spec)));
      } catch (Exception e) {
        finish(null, e);
        return;
      }
      
      try {
        while (iterator.more()) {
          iterator.next();
        }
      } catch (RuntimeException e) {
        iterator.cancel();
        finish(null, e);
        return;
      }
      finish(new DefaultRunResult(iterator.err(), false), null);
    }
    
    @Override
    protected void release() {
      // interrupts the query if it is still in flight
      context.cancel();
    }
  }
}
