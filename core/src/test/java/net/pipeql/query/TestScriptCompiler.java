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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import io.opentracing.mock.MockSpan;
import io.opentracing.mock.MockTracer;
import net.pipeql.control.DefaultRegistry;
import net.pipeql.exceptions.CompileException;
import net.pipeql.functions.FromOpSpec;
import net.pipeql.functions.MeanOpSpec;
import net.pipeql.functions.RangeOpSpec;
import net.pipeql.values.Value;

public class TestScriptCompiler {
  private static final Instant NOW = Instant.parse("2018-05-22T19:53:26Z");

  private static DefaultRegistry REGISTRY;

  @BeforeClass
  public static void beforeClass() throws Exception {
    REGISTRY = new DefaultRegistry();
  }

  @Test
  public void fromRangeMean() throws Exception {
    final Spec spec = REGISTRY.compiler().compile(QueryContext.background(),
        "from(bucket:\"b\") |> range(start:-1h) |> mean()", NOW);

    assertEquals(3, spec.getOperations().size());
    assertEquals("from0", spec.getOperations().get(0).getId());
    assertEquals("range0", spec.getOperations().get(1).getId());
    assertEquals("mean0", spec.getOperations().get(2).getId());

    final FromOpSpec from = (FromOpSpec) spec.getOperations().get(0).getSpec();
    assertEquals("b", from.bucket());
    final RangeOpSpec range =
        (RangeOpSpec) spec.getOperations().get(1).getSpec();
    assertEquals(QueryTime.parse("-1h"), range.start());
    assertEquals(QueryTime.NOW, range.stop());
    final MeanOpSpec mean = (MeanOpSpec) spec.getOperations().get(2).getSpec();
    assertEquals(Collections.singletonList("_value"), mean.columns());

    assertEquals(2, spec.getEdges().size());
    assertEquals(new Edge("from0", "range0"), spec.getEdges().get(0));
    assertEquals(new Edge("range0", "mean0"), spec.getEdges().get(1));
    assertEquals(NOW, spec.now());
    spec.validate();
  }

  @Test
  public void sharedParentVisitedOnce() throws Exception {
    final Spec spec = REGISTRY.compiler().compile(QueryContext.background(),
        "a = from(bucket:\"b\")\n"
        + "a |> range(start:-1h)\n"
        + "a |> range(start:-2h)", NOW);

    assertEquals(3, spec.getOperations().size());
    assertEquals("from0", spec.getOperations().get(0).getId());
    assertEquals("range0", spec.getOperations().get(1).getId());
    assertEquals("range1", spec.getOperations().get(2).getId());
    assertEquals(2, spec.getEdges().size());
    assertEquals(new Edge("from0", "range0"), spec.getEdges().get(0));
    assertEquals(new Edge("from0", "range1"), spec.getEdges().get(1));
    assertEquals(2, spec.children("from0").size());
    assertEquals(Collections.singletonList("from0"), spec.parents("range1"));
  }

  @Test
  public void idsAreDeterministic() throws Exception {
    final String script = "a = from(bucket:\"b\") |> range(start:-1h)\n"
        + "a |> mean() |> yield(name:\"mean\")\n"
        + "a |> count() |> yield(name:\"count\")";
    final String first = SpecJson.encode(REGISTRY.compiler().compile(
        QueryContext.background(), script, NOW));
    final String second = SpecJson.encode(REGISTRY.compiler().compile(
        QueryContext.background(), script, NOW));
    assertEquals(first, second);
    assertTrue(first.contains("\"id\":\"yield0\""));
    assertTrue(first.contains("\"id\":\"yield1\""));
  }

  @Test
  public void nonTableExpressionsIgnored() throws Exception {
    final Spec spec = REGISTRY.compiler().compile(QueryContext.background(),
        "x = 1 + 2\nx * 2", NOW);
    assertTrue(spec.getOperations().isEmpty());
    assertTrue(spec.getEdges().isEmpty());
  }

  @Test
  public void builtinScript() throws Exception {
    final Spec spec = REGISTRY.compiler().compile(QueryContext.background(),
        "from(bucket:\"b\") |> meanSince(start:-5m)", NOW);
    assertEquals(3, spec.getOperations().size());
    assertEquals("mean0", spec.getOperations().get(2).getId());
    final RangeOpSpec range =
        (RangeOpSpec) spec.getOperations().get(1).getSpec();
    assertEquals(QueryTime.parse("-5m"), range.start());
  }

  @Test
  public void compileErrors() throws Exception {
    try {
      REGISTRY.compiler().compile(QueryContext.background(),
          "from(bucket:\"b\"", NOW);
      fail("Expected CompileException");
    } catch (CompileException e) { }

    try {
      REGISTRY.compiler().compile(QueryContext.background(),
          "nosuchfunc(bucket:\"b\")", NOW);
      fail("Expected CompileException");
    } catch (CompileException e) {
      assertTrue(e.getMessage().contains("nosuchfunc"));
    }

    // unused argument
    try {
      REGISTRY.compiler().compile(QueryContext.background(),
          "from(bucket:\"b\", nope:1)", NOW);
      fail("Expected CompileException");
    } catch (CompileException e) { }

    // missing required argument
    try {
      REGISTRY.compiler().compile(QueryContext.background(),
          "from(bucket:\"b\") |> range()", NOW);
      fail("Expected CompileException");
    } catch (CompileException e) { }

    try {
      REGISTRY.compiler().compile(QueryContext.background(), null, NOW);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void missingNowOption() throws Exception {
    final BuiltinRegistry registry = new BuiltinRegistry();
    registry.freeze();
    final ScriptCompiler compiler = new ScriptCompiler(registry);
    try {
      ScriptCompiler.toSpec(compiler.newInterpreter(),
          Collections.<Value>emptyList());
      fail("Expected CompileException");
    } catch (CompileException e) {
      assertTrue(e.getMessage().contains("now"));
    }
  }

  @Test
  public void tracing() throws Exception {
    final MockTracer tracer = new MockTracer();
    final QueryContext context = QueryContext.withTracer(
        QueryContext.background(), tracer);
    REGISTRY.compiler().compile(context,
        "from(bucket:\"b\") |> range(start:-1h)", NOW);

    List<MockSpan> spans = tracer.finishedSpans();
    assertEquals(2, spans.size());
    assertEquals("parse", spans.get(0).operationName());
    assertEquals("compile", spans.get(1).operationName());
    assertEquals(2, spans.get(1).tags().get("operations"));

    tracer.reset();
    try {
      REGISTRY.compiler().compile(context, "from(", NOW);
      fail("Expected CompileException");
    } catch (CompileException e) { }
    spans = tracer.finishedSpans();
    assertEquals(1, spans.size());
    assertEquals(true, spans.get(0).tags().get("error"));
  }
}
