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

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.pipeql.exceptions.QueryExecutionCanceled;
import net.pipeql.query.AsyncQueryService;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.ScriptTextCompiler;
import net.pipeql.query.Statistics;

/**
 * An async service whose queries are resolved by the test. Queries are
 * cancelled when the context they were submitted with is.
 */
public class FakeAsyncQueryService implements AsyncQueryService {
  private final BlockingQueue<FakeQuery> live =
      new LinkedBlockingQueue<FakeQuery>();

  volatile RuntimeException throw_on_query;

  @Override
  public Query query(final QueryContext context, final Request request) {
    if (throw_on_query != null) {
      throw throw_on_query;
    }
    final FakeQuery query = new FakeQuery(request);
    class CancelCB implements Callback<Object, Object> {
      @Override
      public Object call(final Object ignored) throws Exception {
        query.cancel();
        return null;
      }
    }
    context.done().addCallback(new CancelCB());
    live.add(query);
    return query;
  }

  @Override
  public Query queryWithCompile(final QueryContext context,
                                final String org,
                                final String script) {
    return query(context, new Request(org,
        new ScriptTextCompiler(script, null)));
  }

  /**
   * Waits for the next submitted query.
   * @return The query.
   * @throws IllegalStateException if nothing was submitted in time.
   */
  FakeQuery waitForQueryLive() throws InterruptedException {
    final FakeQuery query = live.poll(5, TimeUnit.SECONDS);
    if (query == null) {
      throw new IllegalStateException("No query was submitted.");
    }
    return query;
  }

  static class FakeQuery implements Query {
    final Request request;
    private final List<Deferred<Map<String, Result>>> listeners =
        Lists.newArrayList();
    private boolean resolved;
    private Exception error;
    volatile boolean canceled;
    volatile boolean done;

    FakeQuery(final Request request) {
      this.request = request;
    }

    void succeed() {
      resolve(null);
    }

    void fail(final Exception e) {
      resolve(e);
    }

    private void resolve(final Exception e) {
      final List<Deferred<Map<String, Result>>> to_call;
      synchronized (this) {
        if (resolved) {
          return;
        }
        resolved = true;
        error = e;
        to_call = Lists.newArrayList(listeners);
        listeners.clear();
      }
      for (final Deferred<Map<String, Result>> deferred : to_call) {
        if (e == null) {
          deferred.callback(Maps.<String, Result>newHashMap());
        } else {
          deferred.callback(e);
        }
      }
    }

    @Override
    public Deferred<Map<String, Result>> ready() {
      synchronized (this) {
        if (!resolved) {
          final Deferred<Map<String, Result>> deferred =
              new Deferred<Map<String, Result>>();
          listeners.add(deferred);
          return deferred;
        }
      }
      if (error != null) {
        return Deferred.fromError(error);
      }
      return Deferred.fromResult(
          (Map<String, Result>) Maps.<String, Result>newHashMap());
    }

    @Override
    public synchronized Throwable err() {
      return error;
    }

    @Override
    public void cancel() {
      canceled = true;
      fail(new QueryExecutionCanceled("query canceled",
          QueryExecutionCanceled.CANCELED));
    }

    @Override
    public void done() {
      done = true;
    }

    @Override
    public Statistics statistics() {
      return Statistics.newBuilder().build();
    }
  }
}
