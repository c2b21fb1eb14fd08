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
import java.util.Map;

import com.stumbleupon.async.Callback;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.AsyncQueryService;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.query.Spec;
import net.pipeql.query.SpecCompiler;
import net.pipeql.task.backend.Executor;
import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.Store;
import net.pipeql.task.backend.StoreTask;

/**
 * An {@link Executor} over an {@link AsyncQueryService}. The task is
 * compiled and submitted before {@link #execute(QueryContext, QueuedRun)}
 * returns so compile and submission failures are thrown to the caller.
 * 
 * @since 1.0
 */
public class AsyncQueryServiceExecutor implements Executor {
  private final AsyncQueryService service;
  private final Store store;
  private final ScriptCompiler compiler;
  
  /**
   * @param service The non-null query service.
   * @param store The non-null store tasks are read from.
   * @param compiler The non-null compiler for task scripts.
   */
  public AsyncQueryServiceExecutor(final AsyncQueryService service, 
                                   final Store store, 
                                   final ScriptCompiler compiler) {
    if (service == null) {
      throw new IllegalArgumentException("Service cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (compiler == null) {
      throw new IllegalArgumentException("Compiler cannot be null.");
    }
    this.service = service;
    this.store = store;
    this.compiler = compiler;
  }
  
  @Override
  public AsyncRunPromise execute(final QueryContext ctx, final QueuedRun run) {
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
    final Spec spec = compiler.compile(ctx, task.script(), 
        Instant.ofEpochSecond(run.now()));
    final Query query = service.query(ctx, 
        new Request(task.org(), new SpecCompiler(spec)));
    final AsyncRunPromise promise = new AsyncRunPromise(run, query);
    promise.follow();
    return promise;
  }
  
  /** A promise following a submitted query. */
  public static class AsyncRunPromise extends BaseRunPromise {
    private final Query query;
    
    AsyncRunPromise(final QueuedRun run, final Query query) {
      super(run);
      this.query = query;
    }
    
    /**
     * Resolves on the query outcome. The query is marked done only 
     * after it reported, even when the promise was cancelled first.
     */
    void follow() {
      class ReadyCB implements Callback<Object, Map<String, Result>> {
        @Override
        public Object call(final Map<String, Result> results) 
            throws Exception {
          try {
            finish(new DefaultRunResult(null, false), null);
          } finally {
            query.done();
          }
          return null;
        }
      }
      
      class ErrorCB implements Callback<Object, Exception> {
        @Override
        public Object call(final Exception e) throws Exception {
          try {
            finish(new DefaultRunResult(e, false), null);
          } finally {
            query.done();
          }
          return null;
        }
      }
      
      query.ready().addCallbacks(new ReadyCB(), new ErrorCB());
    }
    
    @Override
    public void cancel() {
      super.cancel();
      query.cancel();
    }
    
    @Override
    protected void release() {
      // the query is released once it reports
    }
  }
}
