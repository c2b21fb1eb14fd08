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
package net.pipeql.semantic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.Maps;

public class TestTypes {

  @Test
  public void basics() throws Exception {
    assertTrue(Types.isAssignable(Types.INT, Types.INT));
    assertFalse(Types.isAssignable(Types.INT, Types.FLOAT));
    assertFalse(Types.isAssignable(Types.TIME, Types.DURATION));
    assertTrue(Types.isAssignable(Types.ANY, Types.STRING));
    assertFalse(Types.isAssignable(Types.STRING, Types.ANY));
  }
  
  @Test
  public void arrays() throws Exception {
    final ArrayType strings = new ArrayType(Types.STRING);
    assertTrue(Types.isAssignable(strings, new ArrayType(Types.STRING)));
    assertFalse(Types.isAssignable(strings, new ArrayType(Types.INT)));
    // empty literals
    assertTrue(Types.isAssignable(strings, new ArrayType(Types.ANY)));
    assertTrue(Types.isAssignable(new ArrayType(Types.ANY), strings));
    assertFalse(Types.isAssignable(strings, Types.STRING));
    assertEquals(strings, new ArrayType(Types.STRING));
  }
  
  @Test
  public void objects() throws Exception {
    final Map<String, Type> declared = Maps.newHashMap();
    declared.put("name", Types.STRING);
    final Map<String, Type> actual = Maps.newHashMap();
    actual.put("name", Types.STRING);
    actual.put("every", Types.DURATION);
    
    assertTrue(Types.isAssignable(new ObjectType(declared), 
        new ObjectType(actual)));
    assertFalse(Types.isAssignable(new ObjectType(actual), 
        new ObjectType(declared)));
    assertTrue(Types.isAssignable(Types.EMPTY_OBJECT, new ObjectType(actual)));
    
    actual.put("name", Types.INT);
    assertFalse(Types.isAssignable(new ObjectType(declared), 
        new ObjectType(actual)));
  }
}
