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
package net.pipeql.query;

import java.time.Instant;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import io.opentracing.Span;
import io.opentracing.Tracer;
import io.opentracing.tag.Tags;
import net.pipeql.ast.Program;
import net.pipeql.exceptions.CompileException;
import net.pipeql.interpreter.Interpreter;
import net.pipeql.parser.Parser;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.semantic.FunctionType;
import net.pipeql.semantic.Kind;
import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;
import net.pipeql.utils.DateTime;
import net.pipeql.utils.JSON;
import net.pipeql.values.AbstractValue;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Compiles script text into a {@link Spec} against a frozen 
 * {@link BuiltinRegistry}. Thread safe; every compilation gets its own
 * interpreter.
 * 
 * @since 1.0
 */
public class ScriptCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(
      ScriptCompiler.class);
  
  /** The option holding the function that returns the evaluation time. */
  public static final String NOW_OPTION = "now";
  
  private final BuiltinRegistry registry;
  
  public ScriptCompiler(final BuiltinRegistry registry) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.registry = registry;
  }
  
  public BuiltinRegistry registry() {
    return registry;
  }
  
  /**
   * Compiles without logging the spec.
   * @see #compile(QueryContext, String, Instant, boolean)
   */
  public Spec compile(final QueryContext context, 
                      final String script, 
                      final Instant now) {
    return compile(context, script, now, false);
  }
  
  /**
   * Parses and evaluates the script, then builds a spec from its side 
   * effects.
   * @param context A non-null context. Spans are recorded if it carries
   * a tracer.
   * @param script The non-null script.
   * @param now The evaluation instant.
   * @param verbose Whether or not to log the resulting spec.
   * @return The spec.
   * @throws CompileException if the script fails to parse or evaluate.
   */
  public Spec compile(final QueryContext context, 
                      final String script, 
                      final Instant now, 
                      final boolean verbose) {
    if (script == null) {
      throw new IllegalArgumentException("Script cannot be null.");
    }
    final Tracer tracer = context == null ? null : context.tracer();
    
    Span span = tracer == null ? null : tracer.buildSpan("parse").start();
    final Program program;
    try {
      program = Parser.parse(script);
    } catch (CompileException e) {
      markError(span, e);
      throw e;
    } finally {
      if (span != null) {
        span.finish();
      }
    }
    
    span = tracer == null ? null : tracer.buildSpan("compile").start();
    try {
      final Interpreter interpreter = newInterpreter();
      interpreter.setOption(NOW_OPTION, new NowFunction(now));
      interpreter.eval(program);
      final Spec spec = toSpec(interpreter, interpreter.sideEffects());
      if (verbose) {
        LOG.info("Compiled query spec:\n" + JSON.serializeToPrettyString(spec));
      }
      if (span != null) {
        span.setTag("operations", spec.getOperations().size());
      }
      return spec;
    } catch (CompileException e) {
      markError(span, e);
      throw e;
    } finally {
      if (span != null) {
        span.finish();
      }
    }
  }
  
  /**
   * Evaluates the script without building a spec.
   * @param script The non-null script.
   * @return The interpreter after evaluation, for its scope and options.
   * @throws CompileException if the script fails to parse or evaluate.
   */
  public Interpreter eval(final String script) {
    final Interpreter interpreter = newInterpreter();
    interpreter.eval(Parser.parse(script));
    return interpreter;
  }
  
  /** @return An interpreter over the registry's builtins and options. */
  public Interpreter newInterpreter() {
    return new Interpreter(registry.options(), registry.newScope());
  }
  
  /**
   * Builds a spec from the table objects among the given values. Every
   * distinct table object reachable from them becomes one operation, 
   * parents first, with one edge per parent and child pair.
   * @param interpreter The interpreter holding the {@value #NOW_OPTION} 
   * option.
   * @param values Side effect values. Values other than tables are 
   * ignored.
   * @return The spec.
   * @throws CompileException if the now option is missing or invalid.
   */
  public static Spec toSpec(final Interpreter interpreter, 
                            final List<Value> values) {
    final SpecBuilder builder = new SpecBuilder();
    for (final Value v : values) {
      if (v instanceof TableObject) {
        builder.visit((TableObject) v);
      }
    }
    
    final Value now_option = interpreter.option(NOW_OPTION);
    if (now_option == null) {
      throw new CompileException("undeclared option \"" + NOW_OPTION + "\"");
    }
    if (now_option.type().kind() != Kind.FUNCTION) {
      throw new CompileException("option \"" + NOW_OPTION 
          + "\" must be a function");
    }
    final Value now = now_option.function().call(Values.emptyObject());
    if (now.type().kind() != Kind.TIME) {
      throw new CompileException("option \"" + NOW_OPTION 
          + "\" must return a time, got " + now.type());
    }
    return new Spec(builder.operations, builder.edges, 
        DateTime.fromNanos(now.time()));
  }
  
  /**
   * Assigns IDs over an arena of table objects. Each distinct object
   * gets a dense index the first time it is seen, visits are tracked by
   * index.
   */
  private static class SpecBuilder implements IDer {
    private final IdentityHashMap<TableObject, Integer> index = 
        new IdentityHashMap<TableObject, Integer>();
    private final List<String> ids = Lists.newArrayList();
    private final BitSet visited = new BitSet();
    private final Map<String, Integer> counters = Maps.newHashMap();
    private final List<Operation> operations = Lists.newArrayList();
    private final List<Edge> edges = Lists.newArrayList();
    
    private int indexOf(final TableObject t) {
      Integer i = index.get(t);
      if (i == null) {
        i = ids.size();
        index.put(t, i);
        ids.add(null);
      }
      return i;
    }
    
    @Override
    public String id(final TableObject t) {
      final int i = indexOf(t);
      String id = ids.get(i);
      if (id == null) {
        final Integer count = counters.get(t.kind());
        final int n = count == null ? 0 : count;
        counters.put(t.kind(), n + 1);
        id = t.kind() + n;
        ids.set(i, id);
      }
      return id;
    }
    
    void visit(final TableObject t) {
      final int i = indexOf(t);
      if (visited.get(i)) {
        return;
      }
      visited.set(i);
      for (final TableObject parent : t.parents()) {
        visit(parent);
      }
      final String id = id(t);
      for (final TableObject parent : t.parents()) {
        edges.add(new Edge(id(parent), id));
      }
      if (t.spec() instanceof IDerOperationSpec) {
        ((IDerOperationSpec) t.spec()).idOperations(this);
      }
      operations.add(new Operation(id, t.spec()));
    }
  }
  
  /**
   * The {@value #NOW_OPTION} option. Returns a fixed instant or, when
   * created without one, the current time on every call.
   */
  public static class NowFunction extends AbstractValue 
      implements FunctionValue {
    private static final FunctionType TYPE = new FunctionType(
        FunctionSignature.newBuilder().setReturnType(Types.TIME).build());
    
    private final Instant now;
    
    /** @param now A fixed instant or null for the system clock. */
    public NowFunction(final Instant now) {
      this.now = now;
    }
    
    @Override
    public Type type() {
      return TYPE;
    }
    
    @Override
    public FunctionValue function() {
      return this;
    }
    
    @Override
    public Value call(final ObjectValue args) {
      if (now != null) {
        return Values.newTime(DateTime.toNanos(now));
      }
      return Values.newTime(DateTime.toNanos(
          Instant.ofEpochMilli(DateTime.currentTimeMillis())));
    }
    
    @Override
    public boolean hasSideEffect() {
      return false;
    }
  }
  
  private static void markError(final Span span, final Exception e) {
    if (span == null) {
      return;
    }
    Tags.ERROR.set(span, true);
    span.setTag("message", e.getMessage());
  }
}
