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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.pipeql.configuration.Configuration;
import net.pipeql.exceptions.QueryExecutionCanceled;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.execute.Allocator;
import net.pipeql.execute.DefaultExecutor;
import net.pipeql.plan.DefaultPlanner;
import net.pipeql.plan.PlanSpec;
import net.pipeql.query.AsyncQueryService;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.Spec;
import net.pipeql.query.SpecCompiler;
import net.pipeql.query.Statistics;
import net.pipeql.utils.DateTime;
import net.pipeql.utils.JSON;
import net.pipeql.utils.Threads;

/**
 * Runs queries through compile, plan and execute. Compilation and
 * planning happen on the controller's pool, sources run on the
 * executor's pool. Every query gets a child context and its own
 * {@link Allocator} bounded by {@link #MEMORY_LIMIT_KEY}.
 * <p>
 * Queries stay registered as active until the caller marks them
 * {@link Query#done()}.
 *
 * @since 1.0
 */
public class Controller implements AsyncQueryService {
  private static final Logger LOG = LoggerFactory.getLogger(Controller.class);

  public static final String VERBOSE_KEY = "query.compile.verbose";
  public static final String THREADS_KEY = "query.controller.threads";
  public static final String EXECUTOR_THREADS_KEY = "query.executor.threads";
  public static final String MEMORY_LIMIT_KEY = "query.memory.limit";

  private final Configuration config;
  private final DefaultRegistry registry;
  private final DefaultPlanner planner;
  private final DefaultExecutor executor;
  private final ExecutorService pool;
  private final ExecutorService source_pool;
  private final Map<Long, ControlledQuery> queries;
  private final AtomicLong ids;
  private volatile boolean shutdown;

  /**
   * Default ctor.
   * @param config The non-null config. Keys are registered if missing.
   * @param registry The non-null frozen registries.
   * @param dependencies Dependencies for sources and transformations,
   * e.g. the {@link net.pipeql.storage.StorageReader}. May be null.
   */
  public Controller(final Configuration config,
                    final DefaultRegistry registry,
                    final Map<String, Object> dependencies) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.config = config;
    this.registry = registry;
    registerConfigs(config);

    planner = new DefaultPlanner(registry.procedures());
    pool = Threads.newPool(config.getInt(THREADS_KEY), "Controller");
    source_pool = Threads.newPool(config.getInt(EXECUTOR_THREADS_KEY),
        "Executor");
    executor = new DefaultExecutor(registry.transformations(), source_pool,
        dependencies);
    queries = new ConcurrentHashMap<Long, ControlledQuery>();
    ids = new AtomicLong();
  }

  @Override
  public Query query(final QueryContext context, final Request request) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    return submit(context, request, 0);
  }

  @Override
  public Query queryWithCompile(final QueryContext context,
                                final String org,
                                final String script) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    final long start = DateTime.nanoTime();
    final Spec spec = registry.compiler().compile(context, script,
        Instant.ofEpochMilli(DateTime.currentTimeMillis()),
        config.getBoolean(VERBOSE_KEY));
    return submit(context, new Request(org, new SpecCompiler(spec)),
        DateTime.nanoTime() - start);
  }

  /**
   * Stops accepting queries and cancels the active ones.
   * @return A deferred resolving to null once the pools are shut down.
   */
  public Deferred<Object> shutdown() {
    shutdown = true;
    final List<ControlledQuery> active =
        Lists.newArrayList(queries.values());
    if (!active.isEmpty()) {
      LOG.info("Cancelling " + active.size() + " active queries.");
    }
    for (final ControlledQuery query : active) {
      query.context.cancel(new QueryExecutionCanceled(
          "query controller shut down", QueryExecutionCanceled.CANCELED));
    }
    pool.shutdown();
    source_pool.shutdown();
    return Deferred.fromResult(null);
  }

  /** @return The number of queries not yet marked done. */
  public int activeQueries() {
    return queries.size();
  }

  private Query submit(final QueryContext context,
                       final Request request,
                       final long compile_duration) {
    if (shutdown) {
      throw new QueryExecutionException("query controller is shut down", 503);
    }
    final ControlledQuery query = new ControlledQuery(ids.incrementAndGet(),
        context, request, compile_duration);
    queries.put(query.id, query);
    try {
      pool.submit(new Runnable() {
        @Override
        public void run() {
          query.run();
        }
      });
    } catch (RejectedExecutionException e) {
      LOG.warn("Failed to schedule query " + query.id, e);
      query.complete(null, new QueryExecutionException(
          "failed to schedule query: " + e.getMessage(), 503, e));
    }
    return query;
  }

  /** Registers the controller keys if they aren't already. */
  static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(VERBOSE_KEY)) {
      config.register(VERBOSE_KEY, false, true,
          "Whether or not to log the compiled spec of each query.");
    }
    if (!config.hasProperty(THREADS_KEY)) {
      config.register(THREADS_KEY, 4, false,
          "The number of threads compiling and planning queries.");
    }
    if (!config.hasProperty(EXECUTOR_THREADS_KEY)) {
      config.register(EXECUTOR_THREADS_KEY, 4, false,
          "The number of threads running query sources.");
    }
    if (!config.hasProperty(MEMORY_LIMIT_KEY)) {
      config.register(MEMORY_LIMIT_KEY, 1073741824L, true,
          "The max bytes a single query may hold. Zero or less for "
          + "unlimited.");
    }
  }

  /** A query owned by this controller. */
  private class ControlledQuery implements Query {
    private final long id;
    private final Request request;
    private final QueryContext context;
    private final Allocator allocator;
    private final long start;
    private final AtomicBoolean completed;
    private final AtomicBoolean released;
    private final List<Deferred<Map<String, Result>>> listeners;

    private volatile long compile_duration;
    private volatile long plan_duration;
    private volatile long execute_start;
    private volatile long execute_duration;
    private volatile long total_duration;

    /** Guarded by this. */
    private boolean resolved;
    private Map<String, Result> results;
    private Throwable error;

    ControlledQuery(final long id,
                    final QueryContext parent,
                    final Request request,
                    final long compile_duration) {
      this.id = id;
      this.request = request;
      this.compile_duration = compile_duration;
      context = QueryContext.withCancel(parent);
      allocator = new Allocator(config.getLong(MEMORY_LIMIT_KEY));
      start = DateTime.nanoTime();
      completed = new AtomicBoolean();
      released = new AtomicBoolean();
      listeners = Lists.newArrayList();

      class CancelCB implements Callback<Object, Object> {
        @Override
        public Object call(final Object ignored) throws Exception {
          complete(null, context.err());
          return null;
        }
      }
      context.done().addCallback(new CancelCB());
    }

    void run() {
      try {
        context.throwIfDone();
        long ts = DateTime.nanoTime();
        final Spec spec = request.compiler().compile(context,
            registry.compiler());
        if (!(request.compiler() instanceof SpecCompiler)) {
          compile_duration = DateTime.nanoTime() - ts;
          if (config.getBoolean(VERBOSE_KEY)) {
            LOG.info("Compiled query spec for query " + id + ":\n"
                + JSON.serializeToPrettyString(spec));
          }
        }

        ts = DateTime.nanoTime();
        spec.validate();
        final PlanSpec plan = planner.plan(spec);
        plan_duration = DateTime.nanoTime() - ts;
        context.throwIfDone();

        class SuccessCB implements Callback<Object, Map<String, Result>> {
          @Override
          public Object call(final Map<String, Result> results)
              throws Exception {
            complete(results, null);
            return null;
          }
        }

        class ErrorCB implements Callback<Object, Exception> {
          @Override
          public Object call(final Exception e) throws Exception {
            complete(null, e);
            return null;
          }
        }

        execute_start = DateTime.nanoTime();
        executor.execute(context, request.organizationID(), plan, allocator)
            .addCallbacks(new SuccessCB(), new ErrorCB());
      } catch (RuntimeException e) {
        complete(null, e);
      }
    }

    void complete(final Map<String, Result> results, final Throwable error) {
      if (!completed.compareAndSet(false, true)) {
        return;
      }
      if (execute_start > 0) {
        execute_duration = DateTime.nanoTime() - execute_start;
      }
      final List<Deferred<Map<String, Result>>> to_call;
      synchronized (this) {
        this.results = results;
        this.error = error;
        resolved = true;
        to_call = Lists.newArrayList(listeners);
        listeners.clear();
      }

      if (error == null) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Query " + id + " completed with " + results.size()
              + " results in " + DateTime.msFromNanoDiff(
                  DateTime.nanoTime(), start) + "ms");
        }
        for (final Deferred<Map<String, Result>> listener : to_call) {
          listener.callback(results);
        }
      } else {
        if (error instanceof QueryExecutionCanceled) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Query " + id + " canceled: " + error.getMessage());
          }
        } else {
          LOG.warn("Query " + id + " failed", error);
        }
        final Exception e = asException(error);
        for (final Deferred<Map<String, Result>> listener : to_call) {
          listener.callback(e);
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
        return Deferred.fromError(asException(error));
      }
      return Deferred.fromResult(results);
    }

    @Override
    public Throwable err() {
      synchronized (this) {
        return error;
      }
    }

    @Override
    public void cancel() {
      context.cancel(new QueryExecutionCanceled("query canceled",
          QueryExecutionCanceled.CANCELED));
    }

    @Override
    public void done() {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      total_duration = DateTime.nanoTime() - start;
      // cancels an unfinished query and detaches the context from the parent
      cancel();
      queries.remove(id);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Released query " + id + ": " + statistics());
      }
    }

    @Override
    public Statistics statistics() {
      return Statistics.newBuilder()
          .setCompileDuration(compile_duration)
          .setPlanDuration(plan_duration)
          .setExecuteDuration(execute_duration)
          .setTotalDuration(released.get() ? total_duration
              : DateTime.nanoTime() - start)
          .setMaxAllocated(allocator.maxAllocated())
          .build();
    }

    @Override
    public String toString() {
      return "ControlledQuery{id=" + id + ", request=" + request + "}";
    }
  }

  private static Exception asException(final Throwable t) {
    if (t instanceof Exception) {
      return (Exception) t;
    }
    return new QueryExecutionException(t.getMessage(), 500, t);
  }
}
