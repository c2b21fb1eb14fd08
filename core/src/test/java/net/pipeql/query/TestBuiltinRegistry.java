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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import net.pipeql.exceptions.CompileException;
import net.pipeql.exceptions.RegistryException;
import net.pipeql.functions.FilterOpSpec;
import net.pipeql.functions.RangeOpSpec;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.values.Values;

public class TestBuiltinRegistry {
  private static final FunctionSignature SIGNATURE =
      FunctionSignature.newTransformationBuilder().build();
  private static final CreateOperationSpec CREATE = new CreateOperationSpec() {
    @Override
    public OperationSpec create(final QueryArguments args,
                                final Administration administration) {
      throw new UnsupportedOperationException();
    }
  };

  private BuiltinRegistry registry;

  @Before
  public void before() throws Exception {
    registry = new BuiltinRegistry();
  }

  @Test
  public void registerFunction() throws Exception {
    registry.registerFunction("myfunc", CREATE, SIGNATURE);
    registry.registerFunctionWithSideEffect("myyield", CREATE, SIGNATURE);
    assertFalse(registry.builtin("myfunc").function().hasSideEffect());
    assertTrue(registry.builtin("myyield").function().hasSideEffect());
    assertNull(registry.builtin("nope"));

    try {
      registry.registerFunction("myfunc", CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) {
      assertTrue(e.getMessage().contains("myfunc"));
    }

    try {
      registry.registerFunctionWithSideEffect("myyield", CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    // functions and values share a namespace
    try {
      registry.registerFunctionWithSideEffect("myfunc", CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltInValue("myfunc", Values.newInt(1));
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
  }

  @Test
  public void registerFunctionBadArgs() throws Exception {
    try {
      registry.registerFunction(null, CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerFunction("", CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerFunction("myfunc", null, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerFunction("myfunc", CREATE, null);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
  }

  @Test
  public void registerValuesAndOptions() throws Exception {
    registry.registerBuiltInValue("answer", Values.newInt(42));
    registry.registerBuiltInOption("limit", Values.newInt(10));
    assertEquals(42, registry.builtin("answer").integer());
    assertEquals(10, registry.options().get("limit").integer());

    try {
      registry.registerBuiltInValue("answer", Values.newInt(1));
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltInOption("limit", Values.newInt(1));
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltInValue("nothing", null);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.options().put("other", Values.newInt(1));
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void registerOperationSpec() throws Exception {
    registry.registerOperationSpec(FilterOpSpec.KIND, FilterOpSpec.class);
    assertSame(FilterOpSpec.class,
        registry.operationSpec(FilterOpSpec.KIND));
    assertNull(registry.operationSpec(RangeOpSpec.KIND));

    try {
      registry.registerOperationSpec(FilterOpSpec.KIND, RangeOpSpec.class);
      fail("Expected RegistryException");
    } catch (RegistryException e) {
      assertTrue(e.getMessage().contains(FilterOpSpec.KIND));
    }

    try {
      registry.registerOperationSpec(RangeOpSpec.KIND, null);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
  }

  @Test
  public void freeze() throws Exception {
    registry.registerBuiltInValue("base", Values.newInt(2));
    registry.registerBuiltIn("helpers", "double = (v) => v * base\n"
        + "four = double(v: 2)");
    assertNull(registry.builtin("four"));
    assertFalse(registry.isFrozen());

    registry.freeze();
    assertTrue(registry.isFrozen());
    assertEquals(4, registry.builtin("four").integer());
    assertNotNull(registry.builtin("double").function());
    assertEquals(4, registry.newScope().lookup("four").integer());

    try {
      registry.freeze();
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
  }

  @Test
  public void registerAfterFreeze() throws Exception {
    registry.freeze();

    try {
      registry.registerFunction("myfunc", CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerFunctionWithSideEffect("myyield", CREATE, SIGNATURE);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltInValue("answer", Values.newInt(42));
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltInOption("limit", Values.newInt(10));
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltIn("helpers", "x = 1");
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerOperationSpec(FilterOpSpec.KIND, FilterOpSpec.class);
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
    assertNull(registry.builtin("answer"));
  }

  @Test
  public void freezeFailingScript() throws Exception {
    registry.registerBuiltIn("broken", "x = nope");
    try {
      registry.freeze();
      fail("Expected RegistryException");
    } catch (RegistryException e) {
      assertTrue(e.getMessage().contains("broken"));
      assertTrue(e.getCause() instanceof CompileException);
    }
    assertFalse(registry.isFrozen());

    registry = new BuiltinRegistry();
    registry.registerBuiltIn("unparsable", "x = (");
    try {
      registry.freeze();
      fail("Expected RegistryException");
    } catch (RegistryException e) {
      assertTrue(e.getCause() instanceof CompileException);
    }
  }

  @Test
  public void freezeScriptRedefinesBuiltin() throws Exception {
    registry.registerBuiltInValue("answer", Values.newInt(42));
    registry.registerBuiltIn("clash", "answer = 1");
    try {
      registry.freeze();
      fail("Expected RegistryException");
    } catch (RegistryException e) {
      assertTrue(e.getMessage().contains("answer"));
    }
  }

  @Test
  public void registerBuiltInScriptBadArgs() throws Exception {
    registry.registerBuiltIn("helpers", "x = 1");
    try {
      registry.registerBuiltIn("helpers", "y = 2");
      fail("Expected RegistryException");
    } catch (RegistryException e) { }

    try {
      registry.registerBuiltIn("empty", "");
      fail("Expected RegistryException");
    } catch (RegistryException e) { }
  }
}
