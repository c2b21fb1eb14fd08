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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import net.pipeql.configuration.UnitTestConfiguration;
import net.pipeql.control.DefaultRegistry;
import net.pipeql.exceptions.QueryExecutionCanceled;
import net.pipeql.query.QueryContext;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.task.backend.QueuedRun;
import net.pipeql.task.backend.StoreTask;
import net.pipeql.task.backend.TaskSearchParams;

public class TestInMemStore {
  private static ScriptCompiler COMPILER;

  private InMemStore store;
  private QueryContext ctx;

  @BeforeClass
  public static void beforeClass() throws Exception {
    COMPILER = new DefaultRegistry().compiler();
  }

  @Before
  public void before() throws Exception {
    store = new InMemStore(UnitTestConfiguration.getConfiguration(),
        COMPILER);
    ctx = QueryContext.background();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new InMemStore(null, COMPILER);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new InMemStore(UnitTestConfiguration.getConfiguration(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final UnitTestConfiguration config =
        UnitTestConfiguration.getConfiguration();
    config.register(InMemStore.MAX_PAGE_SIZE_KEY, 10, false, "UT");
    config.register(InMemStore.DEFAULT_PAGE_SIZE_KEY, 20, false, "UT");
    try {
      new InMemStore(config, COMPILER);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void createTask() throws Exception {
    final String id = store.createTask(ctx, "org", "user", script("a task"));
    assertEquals("0000000000000001", id);

    final StoreTask task = store.findTaskByID(ctx, id);
    assertEquals(id, task.id());
    assertEquals("org", task.org());
    assertEquals("user", task.user());
    assertEquals("a task", task.name());
    assertEquals(script("a task"), task.script());

    assertNotEquals(id, store.createTask(ctx, "org", "user", script("b")));
  }

  @Test
  public void createTaskErrors() throws Exception {
    assertCreateFails(null, "user", script("t"));
    assertCreateFails("", "user", script("t"));
    assertCreateFails("org", null, script("t"));
    assertCreateFails("org", "", script("t"));
    assertCreateFails("org", "user", null);
    assertCreateFails("org", "user", "");
    // missing name
    assertCreateFails("org", "user",
        "option task = {cron: \"* * * * *\"}\n\n"
        + "from(bucket:\"test\") |> range(start:-1h)");
    // unparseable
    assertCreateFails("org", "user", "option task = {name: \"t\"");
  }

  @Test
  public void modifyTask() throws Exception {
    final String id = store.createTask(ctx, "org", "user", script("a task"));
    store.modifyTask(ctx, id, script("renamed"));
    final StoreTask task = store.findTaskByID(ctx, id);
    assertEquals("renamed", task.name());
    assertEquals(script("renamed"), task.script());
    assertEquals("org", task.org());
    assertEquals("user", task.user());

    try {
      store.modifyTask(ctx, null, script("x"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      store.modifyTask(ctx, "00000000000000ff", script("x"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      store.modifyTask(ctx, id, "");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      store.modifyTask(ctx, id, "option task = {cron: \"* * * * *\"}");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    // failed modifications leave the task alone
    assertEquals("renamed", store.findTaskByID(ctx, id).name());
  }

  @Test
  public void listTasks() throws Exception {
    final String a = store.createTask(ctx, "org1", "user1", script("a"));
    final String b = store.createTask(ctx, "org1", "user2", script("b"));
    final String c = store.createTask(ctx, "org2", "user1", script("c"));

    List<StoreTask> tasks = store.listTasks(ctx,
        TaskSearchParams.newBuilder().build());
    assertEquals(3, tasks.size());
    assertEquals(a, tasks.get(0).id());
    assertEquals(b, tasks.get(1).id());
    assertEquals(c, tasks.get(2).id());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setOrg("org1").build());
    assertEquals(2, tasks.size());
    assertEquals(a, tasks.get(0).id());
    assertEquals(b, tasks.get(1).id());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setUser("user1").build());
    assertEquals(2, tasks.size());
    assertEquals(a, tasks.get(0).id());
    assertEquals(c, tasks.get(1).id());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setOrg("nosuchorg").build());
    assertTrue(tasks.isEmpty());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setAfter(a).setPageSize(1).build());
    assertEquals(1, tasks.size());
    assertEquals(b, tasks.get(0).id());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setAfter(c).build());
    assertTrue(tasks.isEmpty());
  }

  @Test
  public void listTasksPaging() throws Exception {
    for (int i = 0; i < 150; i++) {
      store.createTask(ctx, "org", "user", script("task " + i));
    }
    List<StoreTask> tasks = store.listTasks(ctx,
        TaskSearchParams.newBuilder().build());
    assertEquals(100, tasks.size());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setAfter(tasks.get(99).id()).build());
    assertEquals(50, tasks.size());
    assertEquals("task 100", tasks.get(0).name());

    tasks = store.listTasks(ctx, TaskSearchParams.newBuilder()
        .setPageSize(500).build());
    assertEquals(150, tasks.size());
  }

  @Test
  public void listTasksErrors() throws Exception {
    assertListFails(TaskSearchParams.newBuilder()
        .setOrg("org").setUser("user").build());
    assertListFails(TaskSearchParams.newBuilder().setPageSize(-1).build());
    assertListFails(TaskSearchParams.newBuilder()
        .setPageSize(Integer.MAX_VALUE).build());
    assertListFails(null);
  }

  @Test
  public void deleteTask() throws Exception {
    final String id = store.createTask(ctx, "org", "user", script("a task"));
    assertTrue(store.deleteTask(ctx, id));
    assertNull(store.findTaskByID(ctx, id));
    assertFalse(store.deleteTask(ctx, id));
    assertTrue(store.listTasks(ctx,
        TaskSearchParams.newBuilder().build()).isEmpty());

    try {
      store.deleteTask(ctx, "");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void runs() throws Exception {
    final String id = store.createTask(ctx, "org", "user", script("a task"));
    final QueuedRun run = store.createRun(ctx, id, 1);
    assertEquals(id, run.taskID());
    assertEquals(1, run.now());

    try {
      store.createRun(ctx, id, 2);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("MaxConcurrency"));
    }

    assertTrue(store.finishRun(ctx, id, run.runID()));
    assertFalse(store.finishRun(ctx, id, run.runID()));
    assertFalse(store.finishRun(ctx, "nosuchtask", run.runID()));

    final QueuedRun next = store.createRun(ctx, id, 2);
    assertNotEquals(run.runID(), next.runID());
    assertEquals(2, next.now());

    try {
      store.createRun(ctx, "00000000000000ff", 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void runsWithConcurrency() throws Exception {
    final String id = store.createTask(ctx, "org", "user",
        "option task = {name: \"t\", every: 1m, concurrency: 2}\n"
        + "from(bucket:\"test\") |> range(start:-1h)");
    store.createRun(ctx, id, 1);
    store.createRun(ctx, id, 2);
    try {
      store.createRun(ctx, id, 3);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void canceledContext() throws Exception {
    final QueryContext canceled = QueryContext.withCancel(
        QueryContext.background());
    canceled.cancel();
    try {
      store.createTask(canceled, "org", "user", script("a task"));
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
  }

  @Test
  public void close() throws Exception {
    final String id = store.createTask(ctx, "org", "user", script("a task"));
    store.close();
    assertNull(store.findTaskByID(ctx, id));
  }

  private void assertCreateFails(final String org,
                                 final String user,
                                 final String script) {
    try {
      store.createTask(ctx, org, user, script);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private void assertListFails(final TaskSearchParams params) {
    try {
      store.listTasks(ctx, params);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private static String script(final String name) {
    return "option task = {name: \"" + name + "\", cron: \"* * * * *\"}\n\n"
        + "from(bucket:\"test\") |> range(start:-1h)";
  }
}
