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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.pipeql.ast.Program;
import net.pipeql.ast.Statement;
import net.pipeql.exceptions.CompileException;
import net.pipeql.interpreter.Interpreter;
import net.pipeql.parser.Parser;
import net.pipeql.query.QueryArguments;
import net.pipeql.query.ScriptCompiler;
import net.pipeql.semantic.Kind;
import net.pipeql.values.Value;

/**
 * The scheduling options of a task script, read from its 
 * {@code option task = {...}} statement. Only option statements are 
 * evaluated so the query itself does not need to compile.
 * 
 * @since 1.0
 */
public class TaskOptions {
  public static final String TASK_OPTION = "task";
  
  private final String name;
  private final String cron;
  private final long every;
  private final long delay;
  private final long concurrency;
  private final long retry;
  
  private TaskOptions(final String name, 
                      final String cron, 
                      final long every, 
                      final long delay, 
                      final long concurrency, 
                      final long retry) {
    this.name = name;
    this.cron = cron;
    this.every = every;
    this.delay = delay;
    this.concurrency = concurrency;
    this.retry = retry;
  }
  
  /**
   * Parses the task options out of a script.
   * @param compiler The compiler whose builtins the options may reference.
   * @param script The non-null script.
   * @return The options.
   * @throws CompileException if the script does not parse, the task
   * option is missing or a field is invalid.
   */
  public static TaskOptions fromScript(final ScriptCompiler compiler, 
                                       final String script) {
    final Program program = Parser.parse(script);
    final List<Statement> options = Lists.newArrayList();
    for (final Statement statement : program.body()) {
      if (statement instanceof Statement.Option) {
        options.add(statement);
      }
    }
    final Interpreter interpreter = compiler.newInterpreter();
    interpreter.eval(new Program(options));
    final Value task = interpreter.option(TASK_OPTION);
    if (task == null) {
      throw new CompileException("missing required option: \"" 
          + TASK_OPTION + "\"");
    }
    if (task.type().kind() != Kind.OBJECT) {
      throw new CompileException("option \"" + TASK_OPTION 
          + "\" must be an object");
    }
    
    final QueryArguments args = new QueryArguments(task.object());
    final String name = args.getString("name");
    if (Strings.isNullOrEmpty(name)) {
      throw new CompileException("missing name in task options");
    }
    final String cron = args.getString("cron");
    final Long every = args.getDuration("every");
    if (cron == null && every == null) {
      throw new CompileException("must specify one of cron or every "
          + "in task options");
    }
    if (cron != null && every != null) {
      throw new CompileException("cannot use both cron and every "
          + "in task options");
    }
    if (every != null && every <= 0) {
      throw new CompileException("every must be positive in task options");
    }
    final Long delay = args.getDuration("delay");
    final Long concurrency = args.getInt("concurrency");
    if (concurrency != null && concurrency < 1) {
      throw new CompileException("concurrency must be at least 1 "
          + "in task options");
    }
    final Long retry = args.getInt("retry");
    if (retry != null && retry < 0) {
      throw new CompileException("retry cannot be negative in task options");
    }
    final List<String> unused = args.listUnused();
    if (!unused.isEmpty()) {
      throw new CompileException("unknown task options " + unused);
    }
    return new TaskOptions(name, cron, 
        every == null ? 0 : every, 
        delay == null ? 0 : delay, 
        concurrency == null ? 1 : concurrency, 
        retry == null ? 1 : retry);
  }
  
  public String name() {
    return name;
  }
  
  /** @return The cron expression or null if the task runs on an interval. */
  public String cron() {
    return cron;
  }
  
  /** @return The interval in nanoseconds, 0 when scheduled by cron. */
  public long every() {
    return every;
  }
  
  /** @return The delay in nanoseconds. */
  public long delay() {
    return delay;
  }
  
  /** @return The max number of concurrent runs, 1 by default. */
  public long concurrency() {
    return concurrency;
  }
  
  public long retry() {
    return retry;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("cron", cron)
        .add("every", every)
        .add("delay", delay)
        .add("concurrency", concurrency)
        .add("retry", retry)
        .toString();
  }
}
