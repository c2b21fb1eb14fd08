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
package net.pipeql.plan;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.pipeql.control.DefaultRegistry;
import net.pipeql.exceptions.PlanException;
import net.pipeql.exceptions.RegistryException;
import net.pipeql.execute.Aggregates;
import net.pipeql.functions.FromOpSpec;
import net.pipeql.functions.FromProcedureSpec;
import net.pipeql.functions.NamedYieldProcedureSpec;
import net.pipeql.functions.SimpleAggregateProcedureSpec;
import net.pipeql.query.Edge;
import net.pipeql.query.Operation;
import net.pipeql.query.OperationSpec;
import net.pipeql.query.QueryContext;
import net.pipeql.query.QueryTime;
import net.pipeql.query.Spec;

public class TestDefaultPlanner {
  private static final Instant NOW = Instant.parse("2018-05-22T19:53:26Z");

  private static DefaultRegistry REGISTRY;

  @BeforeClass
  public static void beforeClass() throws Exception {
    REGISTRY = new DefaultRegistry();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new DefaultPlanner(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void rangePushedIntoFrom() throws Exception {
    final PlanSpec plan = plan("from(bucket:\"b\") |> range(start:-1h)");

    assertEquals(1, plan.procedures().size());
    final Procedure from = plan.procedure(id("from0"));
    final FromProcedureSpec spec = (FromProcedureSpec) from.spec();
    assertTrue(spec.boundsSet());
    assertFalse(spec.aggregateSet());
    assertEquals(bounds("-1h", "now"), spec.bounds());
    assertEquals(bounds("-1h", "now"), from.bounds());
    assertNull(plan.procedure(id("range0")));

    assertEquals(1, plan.results().size());
    assertEquals(id("from0"), plan.results().get(PlanSpec.DEFAULT_YIELD_NAME));
    assertEquals(bounds("-1h", "now"), plan.bounds());
  }

  @Test
  public void aggregatePushedIntoFrom() throws Exception {
    final PlanSpec plan = plan(
        "from(bucket:\"b\") |> range(start:-1h) |> mean()");

    assertEquals(2, plan.procedures().size());
    final FromProcedureSpec from =
        (FromProcedureSpec) plan.procedure(id("from0")).spec();
    assertTrue(from.aggregateSet());
    assertEquals(Aggregates.MEAN.methodName(), from.aggregateMethod());

    final Procedure mean = plan.procedure(id("mean0"));
    assertEquals(Collections.singletonList(id("from0")), mean.parents());
    assertEquals("mean", mean.spec().kind());
    assertEquals(bounds("-1h", "now"), mean.bounds());
    assertEquals(Lists.newArrayList(id("from0"), id("mean0")), plan.order());
    assertEquals(id("mean0"), plan.results().get(PlanSpec.DEFAULT_YIELD_NAME));
  }

  @Test
  public void countReAggregatesWithSum() throws Exception {
    final PlanSpec plan = plan(
        "from(bucket:\"b\") |> range(start:-1h) |> count()");
    final Procedure count = plan.procedure(id("count0"));
    assertEquals("sum", count.spec().kind());
    assertEquals(Aggregates.SUM,
        ((SimpleAggregateProcedureSpec) count.spec()).aggregate());
    final FromProcedureSpec from =
        (FromProcedureSpec) plan.procedure(id("from0")).spec();
    assertEquals(Aggregates.COUNT.methodName(), from.aggregateMethod());
  }

  @Test
  public void aggregateNotPushedWithoutBounds() throws Exception {
    final PlanSpec plan = plan("from(bucket:\"b\") |> mean()");
    assertEquals(2, plan.procedures().size());
    final FromProcedureSpec from =
        (FromProcedureSpec) plan.procedure(id("from0")).spec();
    assertFalse(from.boundsSet());
    assertFalse(from.aggregateSet());
    assertTrue(plan.bounds().isZero());
  }

  @Test
  public void aggregateOnOtherColumnsNotPushed() throws Exception {
    final PlanSpec plan = plan("from(bucket:\"b\") |> range(start:-1h) "
        + "|> mean(columns:[\"other\"])");
    final FromProcedureSpec from =
        (FromProcedureSpec) plan.procedure(id("from0")).spec();
    assertTrue(from.boundsSet());
    assertFalse(from.aggregateSet());
  }

  @Test
  public void rangePushedThroughFilter() throws Exception {
    final PlanSpec plan = plan("from(bucket:\"b\") "
        + "|> filter(fn: (r) => r._value > 1) |> range(start:-2h)");
    assertEquals(2, plan.procedures().size());
    final FromProcedureSpec from =
        (FromProcedureSpec) plan.procedure(id("from0")).spec();
    assertEquals(bounds("-2h", "now"), from.bounds());
    final Procedure filter = plan.procedure(id("filter0"));
    assertTrue(filter.children().isEmpty());
    assertEquals(bounds("-2h", "now"), filter.bounds());
    assertEquals(id("filter0"),
        plan.results().get(PlanSpec.DEFAULT_YIELD_NAME));
  }

  @Test
  public void sharedFromIsDuplicated() throws Exception {
    final PlanSpec plan = plan("a = from(bucket:\"b\")\n"
        + "a |> range(start:-1h) |> yield(name:\"one\")\n"
        + "a |> range(start:-2h) |> yield(name:\"two\")");

    assertEquals(4, plan.procedures().size());
    final Procedure one = plan.procedure(plan.results().get("one"));
    final Procedure two = plan.procedure(plan.results().get("two"));
    assertTrue(one.spec() instanceof NamedYieldProcedureSpec);
    assertTrue(two.spec() instanceof NamedYieldProcedureSpec);

    final Procedure from_one = plan.procedure(one.parents().get(0));
    final Procedure from_two = plan.procedure(two.parents().get(0));
    assertFalse(from_one.id().equals(from_two.id()));
    assertEquals(bounds("-1h", "now"),
        ((FromProcedureSpec) from_one.spec()).bounds());
    assertEquals(bounds("-2h", "now"),
        ((FromProcedureSpec) from_two.spec()).bounds());
    assertEquals(2, plan.roots().size());
    assertEquals(bounds("-2h", "now"), plan.bounds());
  }

  @Test
  public void duplicateDefaultResults() throws Exception {
    try {
      plan("a = from(bucket:\"b\")\n"
          + "a |> range(start:-1h)\n"
          + "a |> range(start:-2h)");
      fail("Expected PlanException");
    } catch (PlanException e) {
      assertTrue(e.getMessage().contains(PlanSpec.DEFAULT_YIELD_NAME));
    }
  }

  @Test
  public void duplicateYieldNames() throws Exception {
    try {
      plan("a = from(bucket:\"b\") |> range(start:-1h)\n"
          + "a |> mean() |> yield(name:\"x\")\n"
          + "a |> count() |> yield(name:\"x\")");
      fail("Expected PlanException");
    } catch (PlanException e) { }
  }

  @Test
  public void unknownKind() throws Exception {
    final Spec spec = new Spec(Lists.newArrayList(
        new Operation("from0", new FromOpSpec("b"))),
        Lists.<Edge>newArrayList(), NOW);
    final ProcedureRegistry empty = new ProcedureRegistry();
    empty.freeze();
    try {
      new DefaultPlanner(empty).plan(spec);
      fail("Expected PlanException");
    } catch (PlanException e) { }
  }

  @Test
  public void danglingEdge() throws Exception {
    final Spec spec = new Spec(Lists.newArrayList(
        new Operation("from0", new FromOpSpec("b"))),
        Lists.newArrayList(new Edge("from0", "range0")), NOW);
    try {
      new DefaultPlanner(REGISTRY.procedures()).plan(spec);
      fail("Expected PlanException");
    } catch (PlanException e) { }
  }

  @Test
  public void registryFreeze() throws Exception {
    final ProcedureRegistry registry = new ProcedureRegistry();
    final CreateProcedureSpec create = new CreateProcedureSpec() {
      @Override
      public ProcedureSpec create(final OperationSpec spec,
                                  final PlanAdministration administration) {
        return new FromProcedureSpec("b");
      }
    };
    registry.registerProcedureSpec("from", create, "from");
    assertEquals(1, registry.forOperation("from").size());
    try {
      registry.registerProcedureSpec("from", create, "from");
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    registry.freeze();
    try {
      registry.registerProcedureSpec("other", create, "other");
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
  }

  private static PlanSpec plan(final String script) {
    final Spec spec = REGISTRY.compiler().compile(QueryContext.background(),
        script, NOW);
    return new DefaultPlanner(REGISTRY.procedures()).plan(spec);
  }

  private static ProcedureID id(final String operation_id) {
    return ProcedureID.fromOperationID(operation_id);
  }

  private static BoundsSpec bounds(final String start, final String stop) {
    return new BoundsSpec(QueryTime.parse(start), QueryTime.parse(stop));
  }
}
