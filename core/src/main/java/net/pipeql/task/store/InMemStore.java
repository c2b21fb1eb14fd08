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
package net.pipeql.task.store;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.pipeql.configuration.Configuration;
import net.pipeql.exceptions.CompileException;
import net.pipeql.query.QueryContext;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.Store;
import net.pipeql.task.backend.StoreTask;
import net.pipeql.task.backend.TaskSearchParams;
import net.pipeql.task.options.TaskOptions;

/**
 * A {@link Store} held in memory. Task and run IDs are 16 hex digit
 * strings from monotonic counters so listing in ID order is listing in
 * creation order.
 *
 * @since 1.0
 */
public class InMemStore implements Store {
  private static final Logger LOG = LoggerFactory.getLogger(InMemStore.class);

  public static final String MAX_PAGE_SIZE_KEY = "task.store.max_page_size";
  public static final String DEFAULT_PAGE_SIZE_KEY =
      "task.store.default_page_size";

  private final ScriptCompiler compiler;
  private final int max_page_size;
  private final int default_page_size;

  /** Guarded by this. */
  private final NavigableMap<String, StoreTask> tasks;
  private final Map<String, Long> max_concurrency;
  private final Map<String, Set<String>> runs;
  private long last_task_id;
  private long last_run_id;

  /**
   * Default ctor.
   * @param config The non-null config. Keys are registered if missing.
   * @param compiler The non-null compiler used to read task options.
   */
  public InMemStore(final Configuration config,
                    final ScriptCompiler compiler) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (compiler == null) {
      throw new IllegalArgumentException("Compiler cannot be null.");
    }
    if (!config.hasProperty(MAX_PAGE_SIZE_KEY)) {
      config.register(MAX_PAGE_SIZE_KEY, 500, false,
          "The largest page of tasks a list call may request.");
    }
    if (!config.hasProperty(DEFAULT_PAGE_SIZE_KEY)) {
      config.register(DEFAULT_PAGE_SIZE_KEY, 100, false,
          "The page size used when a list call does not give one.");
    }
    this.compiler = compiler;
    max_page_size = config.getInt(MAX_PAGE_SIZE_KEY);
    default_page_size = config.getInt(DEFAULT_PAGE_SIZE_KEY);
    if (default_page_size < 1 || default_page_size > max_page_size) {
      throw new IllegalArgumentException("The default page size "
          + default_page_size + " must be between 1 and " + max_page_size);
    }
    tasks = Maps.newTreeMap();
    max_concurrency = Maps.newHashMap();
    runs = Maps.newHashMap();
  }

  @Override
  public synchronized String createTask(final QueryContext ctx,
                                        final String org,
                                        final String user,
                                        final String script) {
    checkContext(ctx);
    if (Strings.isNullOrEmpty(org)) {
      throw new IllegalArgumentException("Org cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(user)) {
      throw new IllegalArgumentException("User cannot be null or empty.");
    }
    final TaskOptions options = parseOptions(script);

    final String id = formatID(++last_task_id);
    tasks.put(id, new StoreTask(id, org, user, options.name(), script));
    max_concurrency.put(id, options.concurrency());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Created task " + id + " for org " + org + ": " + options);
    }
    return id;
  }

  @Override
  public synchronized void modifyTask(final QueryContext ctx,
                                      final String id,
                                      final String script) {
    checkContext(ctx);
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    final StoreTask existing = tasks.get(id);
    if (existing == null) {
      throw new IllegalArgumentException("No task found for ID: " + id);
    }
    final TaskOptions options = parseOptions(script);
    tasks.put(id, new StoreTask(id, existing.org(), existing.user(),
        options.name(), script));
    max_concurrency.put(id, options.concurrency());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Modified task " + id + ": " + options);
    }
  }

  @Override
  public synchronized List<StoreTask> listTasks(
      final QueryContext ctx,
      final TaskSearchParams params) {
    checkContext(ctx);
    if (params == null) {
      throw new IllegalArgumentException("Params cannot be null.");
    }
    if (params.org() != null && params.user() != null) {
      throw new IllegalArgumentException("Only one of org or user may be "
          + "set when listing tasks.");
    }
    if (params.pageSize() < 0) {
      throw new IllegalArgumentException("Page size cannot be negative: "
          + params.pageSize());
    }
    if (params.pageSize() > max_page_size) {
      throw new IllegalArgumentException("Page size " + params.pageSize()
          + " exceeds the maximum of " + max_page_size);
    }
    final int limit = params.pageSize() == 0 ? default_page_size
        : params.pageSize();

    final Map<String, StoreTask> candidates = params.after() == null
        ? tasks : tasks.tailMap(params.after(), false);
    final List<StoreTask> results = Lists.newArrayList();
    for (final StoreTask task : candidates.values()) {
      if (params.org() != null && !params.org().equals(task.org())) {
        continue;
      }
      if (params.user() != null && !params.user().equals(task.user())) {
        continue;
      }
      results.add(task);
      if (results.size() >= limit) {
        break;
      }
    }
    return Collections.unmodifiableList(results);
  }

  @Override
  public synchronized StoreTask findTaskByID(final QueryContext ctx,
                                             final String id) {
    checkContext(ctx);
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    return tasks.get(id);
  }

  @Override
  public synchronized boolean deleteTask(final QueryContext ctx,
                                         final String id) {
    checkContext(ctx);
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    max_concurrency.remove(id);
    runs.remove(id);
    return tasks.remove(id) != null;
  }

  @Override
  public synchronized QueuedRun createRun(final QueryContext ctx,
                                          final String task_id,
                                          final long now) {
    checkContext(ctx);
    if (Strings.isNullOrEmpty(task_id)) {
      throw new IllegalArgumentException("Task ID cannot be null or empty.");
    }
    if (!tasks.containsKey(task_id)) {
      throw new IllegalArgumentException("No task found for ID: " + task_id);
    }
    Set<String> in_flight = runs.get(task_id);
    if (in_flight == null) {
      in_flight = Sets.newHashSet();
      runs.put(task_id, in_flight);
    }
    final long limit = max_concurrency.get(task_id);
    if (in_flight.size() >= limit) {
      throw new IllegalStateException("Task " + task_id
          + " is already running at its MaxConcurrency of " + limit);
    }
    final String run_id = formatID(++last_run_id);
    in_flight.add(run_id);
    return new QueuedRun(task_id, run_id, now);
  }

  @Override
  public synchronized boolean finishRun(final QueryContext ctx,
                                        final String task_id,
                                        final String run_id) {
    checkContext(ctx);
    final Set<String> in_flight = runs.get(task_id);
    if (in_flight == null) {
      return false;
    }
    return in_flight.remove(run_id);
  }

  @Override
  public synchronized void close() throws IOException {
    tasks.clear();
    max_concurrency.clear();
    runs.clear();
  }

  /**
   * Reads the task options, converting compile failures to argument
   * errors.
   */
  private TaskOptions parseOptions(final String script) {
    if (Strings.isNullOrEmpty(script)) {
      throw new IllegalArgumentException("Script cannot be null or empty.");
    }
    try {
      return TaskOptions.fromScript(compiler, script);
    } catch (CompileException e) {
      throw new IllegalArgumentException("Invalid task script: "
          + e.getMessage(), e);
    }
  }

  private static void checkContext(final QueryContext ctx) {
    if (ctx != null) {
      ctx.throwIfDone();
    }
  }

  static String formatID(final long id) {
    return String.format("%016x", id);
  }
}
