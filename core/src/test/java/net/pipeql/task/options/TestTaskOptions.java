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
package net.pipeql.task.options;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import net.pipeql.control.DefaultRegistry;
import net.pipeql.exceptions.CompileException;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.utils.DateTime;

public class TestTaskOptions {
  private static ScriptCompiler COMPILER;

  @BeforeClass
  public static void beforeClass() throws Exception {
    COMPILER = new DefaultRegistry().compiler();
  }

  @Test
  public void cron() throws Exception {
    final TaskOptions options = TaskOptions.fromScript(COMPILER,
        "option task = {name: \"a task\", cron: \"* * * * *\"}\n\n"
        + "from(bucket:\"test\") |> range(start:-1h)");
    assertEquals("a task", options.name());
    assertEquals("* * * * *", options.cron());
    assertEquals(0, options.every());
    assertEquals(0, options.delay());
    assertEquals(1, options.concurrency());
    assertEquals(1, options.retry());
  }

  @Test
  public void every() throws Exception {
    final TaskOptions options = TaskOptions.fromScript(COMPILER,
        "option task = {\n"
        + "  name: \"every\",\n"
        + "  every: 1h,\n"
        + "  delay: 10m,\n"
        + "  concurrency: 3,\n"
        + "  retry: 0\n"
        + "}\n"
        + "from(bucket:\"test\") |> range(start:-task.every)");
    assertEquals("every", options.name());
    assertNull(options.cron());
    assertEquals(DateTime.parseDuration("1h"), options.every());
    assertEquals(DateTime.parseDuration("10m"), options.delay());
    assertEquals(3, options.concurrency());
    assertEquals(0, options.retry());
  }

  @Test
  public void queryDoesNotNeedToCompile() throws Exception {
    // only the options are evaluated
    final TaskOptions options = TaskOptions.fromScript(COMPILER,
        "option task = {name: \"t\", every: 5m}\n"
        + "from(db:\"test\") |> nosuchfunc()");
    assertEquals("t", options.name());
  }

  @Test
  public void errors() throws Exception {
    assertInvalid("from(bucket:\"test\") |> range(start:-1h)");
    assertInvalid("option task = 42");
    assertInvalid("option task = {cron: \"* * * * *\"}");
    assertInvalid("option task = {name: \"\", cron: \"* * * * *\"}");
    assertInvalid("option task = {name: \"t\"}");
    assertInvalid("option task = {name: \"t\", every: 1h, cron: \"* * * * *\"}");
    assertInvalid("option task = {name: \"t\", every: -1h}");
    assertInvalid("option task = {name: \"t\", every: 1h, concurrency: 0}");
    assertInvalid("option task = {name: \"t\", every: 1h, retry: -1}");
    assertInvalid("option task = {name: \"t\", every: 1h, nope: 1}");
    assertInvalid("option task = {name: \"t\", every: 1h");
  }

  private static void assertInvalid(final String script) {
    try {
      TaskOptions.fromScript(COMPILER, script);
      fail("Expected CompileException for: " + script);
    } catch (CompileException e) { }
  }
}
