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
package net.pipeql.interpreter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import net.pipeql.control.DefaultRegistry;
import net.pipeql.exceptions.CompileException;
import net.pipeql.parser.Parser;
import net.pipeql.query.TableObject;
import net.pipeql.semantic.Kind;
import net.pipeql.utils.DateTime;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

public class TestInterpreter {
  private static DefaultRegistry REGISTRY;

  @BeforeClass
  public static void beforeClass() throws Exception {
    REGISTRY = new DefaultRegistry();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new Interpreter(null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void arithmetic() throws Exception {
    final Scope scope = eval("a = 1 + 2 * 3\n"
        + "b = 7 / 2\n"
        + "c = 1.5 + 1\n"
        + "d = -a\n"
        + "e = \"pipe\" + \"ql\"");
    assertEquals(7, scope.lookup("a").integer());
    assertEquals(3, scope.lookup("b").integer());
    assertEquals(Kind.FLOAT, scope.lookup("c").type().kind());
    assertEquals(2.5, scope.lookup("c").floatValue(), 0.0001);
    assertEquals(-7, scope.lookup("d").integer());
    assertEquals("pipeql", scope.lookup("e").str());
  }

  @Test
  public void timeAndDuration() throws Exception {
    final Scope scope = eval("t = 2018-05-22T19:53:26Z\n"
        + "d = 1h30m\n"
        + "later = t + d\n"
        + "diff = later - t\n"
        + "neg = -5m\n"
        + "twice = d * 2");
    final long t = DateTime.parseDateTime("2018-05-22T19:53:26Z");
    assertEquals(t, scope.lookup("t").time());
    assertEquals(90 * DateTime.NANOS_PER_MINUTE,
        scope.lookup("d").duration());
    assertEquals(t + 90 * DateTime.NANOS_PER_MINUTE,
        scope.lookup("later").time());
    assertEquals(90 * DateTime.NANOS_PER_MINUTE,
        scope.lookup("diff").duration());
    assertEquals(-5 * DateTime.NANOS_PER_MINUTE,
        scope.lookup("neg").duration());
    assertEquals(180 * DateTime.NANOS_PER_MINUTE,
        scope.lookup("twice").duration());
  }

  @Test
  public void comparisonsAndLogic() throws Exception {
    final Scope scope = eval("a = 1 < 2 and 2.5 >= 2\n"
        + "b = \"web01\" =~ /web\\d+/\n"
        + "c = \"db01\" !~ /web/\n"
        + "d = not (1 == 1) or false\n"
        + "e = \"a\" != \"b\"");
    assertTrue(scope.lookup("a").bool());
    assertTrue(scope.lookup("b").bool());
    assertTrue(scope.lookup("c").bool());
    assertFalse(scope.lookup("d").bool());
    assertTrue(scope.lookup("e").bool());
  }

  @Test
  public void shortCircuit() throws Exception {
    // the right side would fail to evaluate
    final Scope scope = eval("a = false and nope\nb = true or nope");
    assertFalse(scope.lookup("a").bool());
    assertTrue(scope.lookup("b").bool());
  }

  @Test
  public void objectsAndArrays() throws Exception {
    final Scope scope = eval("o = {a: 1, \"b\": [10, 20, 30]}\n"
        + "x = o.a\n"
        + "y = o[\"b\"][2]\n"
        + "n = [\"a\", \"b\"]");
    assertEquals(1, scope.lookup("x").integer());
    assertEquals(30, scope.lookup("y").integer());
    assertEquals(2, scope.lookup("n").array().len());
    assertEquals(Kind.STRING, scope.lookup("n").array().get(1).type().kind());
  }

  @Test
  public void functions() throws Exception {
    final Scope scope = eval("add = (a, b=10) => a + b\n"
        + "x = add(a:1)\n"
        + "y = add(a:1, b:2)\n"
        + "block = (n) => {\n"
        + "  m = n * 2\n"
        + "  return m + 1\n"
        + "}\n"
        + "z = block(n:4)\n"
        + "inc = (v=<-) => v + 1\n"
        + "p = 1 |> inc()");
    assertEquals(11, scope.lookup("x").integer());
    assertEquals(3, scope.lookup("y").integer());
    assertEquals(9, scope.lookup("z").integer());
    assertEquals(2, scope.lookup("p").integer());
    // block locals don't leak
    assertEquals(null, scope.lookup("m"));

    final InterpretedFunction add = (InterpretedFunction) scope.lookup("add");
    assertEquals("(a, b=10) => a + b", add.source());
  }

  @Test
  public void closures() throws Exception {
    final Scope scope = eval("x = 5\n"
        + "f = (y) => x + y\n"
        + "x = 100\n"
        + "r = f(y:1)\n"
        + "adder = (n) => (m) => n + m\n"
        + "add2 = adder(n:2)\n"
        + "s = add2(m:3)");
    // the closure reads the scope, not a snapshot
    assertEquals(101, scope.lookup("r").integer());
    assertEquals(5, scope.lookup("s").integer());
  }

  @Test
  public void options() throws Exception {
    final Interpreter interpreter = new Interpreter(null, new Scope(null));
    interpreter.setOption("limit", Values.newInt(3));
    interpreter.eval(Parser.parse("option task = {name: \"t\"}\n"
        + "x = limit * 2"));
    assertEquals("t", interpreter.option("task").object().get("name").str());
    assertEquals(6, interpreter.globalScope().lookup("x").integer());
    assertEquals(2, interpreter.options().size());
  }

  @Test
  public void sideEffects() throws Exception {
    Interpreter interpreter = REGISTRY.compiler().eval(
        "a = from(bucket:\"b\")\n"
        + "x = 1\n"
        + "a |> range(start:-1h)\n"
        + "1 + 1");
    assertEquals(1, interpreter.sideEffects().size());
    assertTrue(interpreter.sideEffects().get(0) instanceof TableObject);

    interpreter = REGISTRY.compiler().eval(
        "a = from(bucket:\"b\") |> yield(name:\"one\")\n"
        + "a |> yield(name:\"two\")");
    assertEquals(2, interpreter.sideEffects().size());

    // the same table is collected once
    interpreter = REGISTRY.compiler().eval(
        "a = from(bucket:\"b\")\na\na");
    assertEquals(1, interpreter.sideEffects().size());
    final Value a = interpreter.globalScope().lookup("a");
    assertSame(a, interpreter.sideEffects().get(0));
  }

  @Test
  public void errors() throws Exception {
    final String[] invalid = new String[] {
        "x = nope",
        "x = 1 + \"a\"",
        "x = 1 / 0",
        "x = 1 and true",
        "x = -\"a\"",
        "x = [1, \"a\"]",
        "x = {a: 1}.b",
        "x = 1.a",
        "x = [1, 2][2]",
        "x = [1, 2][\"a\" + \"b\"]",
        "x = 1(a:1)",
        "f = (a) => a\nx = f()",
        "f = (a) => a\nx = f(a:1, b:2)",
        "f = (a) => { b = a }\nx = f(a:1)",
        "f = (a) => a\nx = 1 |> f()",
        "f = (a=<-) => a\nx = 1 |> f(a:2)",
        "x = \"a\" =~ \"a\"",
        "x = 1 < \"a\""
    };
    for (final String script : invalid) {
      try {
        eval(script);
        fail("Expected CompileException for " + script);
      } catch (CompileException e) { }
    }
  }

  private static Scope eval(final String script) {
    final Interpreter interpreter = new Interpreter(null, new Scope(null));
    interpreter.eval(Parser.parse(script));
    return interpreter.globalScope();
  }
}
