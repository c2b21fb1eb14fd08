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
package net.pipeql.configuration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.configuration.provider.EnvironmentProvider;
import net.pipeql.configuration.provider.Provider;

public class TestConfiguration {

  @Test
  public void registerAndDefaults() throws Exception {
    try (final Configuration config = UnitTestConfiguration.getConfiguration()) {
      config.register("my.string", "foo", false, "A string.");
      config.register("my.int", 42, false, "An int.");
      config.register("my.long", 1073741824L, false, "A long.");
      config.register("my.bool", true, false, "A bool.");
      
      assertTrue(config.hasProperty("my.string"));
      assertFalse(config.hasProperty("my.nope"));
      assertEquals("foo", config.getString("my.string"));
      assertEquals(42, config.getInt("my.int"));
      assertEquals(1073741824L, config.getLong("my.long"));
      assertTrue(config.getBoolean("my.bool"));
      assertEquals("42", config.getString("my.int"));
    }
  }
  
  @Test
  public void registerDuplicate() throws Exception {
    try (final Configuration config = UnitTestConfiguration.getConfiguration()) {
      config.register("my.int", 42, false, "An int.");
      try {
        config.register("my.int", 24, false, "An int.");
        fail("Expected ConfigurationException");
      } catch (ConfigurationException e) { }
      assertEquals(42, config.getInt("my.int"));
    }
  }
  
  @Test
  public void registerBadArgs() throws Exception {
    try (final Configuration config = UnitTestConfiguration.getConfiguration()) {
      try {
        config.register(null, 42, false, "An int.");
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
      
      try {
        config.register("my.int", 42, false, "");
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
    }
  }
  
  @Test
  public void unregisteredKey() throws Exception {
    try (final Configuration config = UnitTestConfiguration.getConfiguration()) {
      try {
        config.getString("nope");
        fail("Expected ConfigurationException");
      } catch (ConfigurationException e) { }
      
      try {
        config.getString(null);
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
    }
  }
  
  @Test
  public void providerValuesWin() throws Exception {
    final Map<String, String> settings = Maps.newHashMap();
    settings.put("my.int", "8");
    settings.put("my.bool", "yes");
    try (final Configuration config = 
        UnitTestConfiguration.getConfiguration(settings)) {
      config.register("my.int", 42, false, "An int.");
      config.register("my.bool", false, false, "A bool.");
      assertEquals(8, config.getInt("my.int"));
      assertTrue(config.getBoolean("my.bool"));
    }
  }
  
  @Test
  public void providerOrder() throws Exception {
    final Provider first = new MapProvider("first", "my.int", "1");
    final Provider second = new MapProvider("second", "my.int", "2");
    try (final Configuration config = new Configuration(
        Lists.<Provider>newArrayList(first, second))) {
      config.register("my.int", 42, false, "An int.");
      assertEquals(1, config.getInt("my.int"));
    }
  }
  
  @Test
  public void overrides() throws Exception {
    try (final Configuration config = UnitTestConfiguration.getConfiguration()) {
      config.register("my.dynamic", 42, true, "A dynamic int.");
      config.register("my.static", 42, false, "A static int.");
      
      config.addOverride("my.dynamic", "24");
      assertEquals(24, config.getInt("my.dynamic"));
      
      try {
        config.addOverride("my.static", "24");
        fail("Expected ConfigurationException");
      } catch (ConfigurationException e) { }
      assertEquals(42, config.getInt("my.static"));
      
      try {
        config.addOverride("my.dynamic", "not a number");
        fail("Expected ConfigurationException");
      } catch (ConfigurationException e) { }
      assertEquals(24, config.getInt("my.dynamic"));
      
      assertTrue(config.removeRuntimeOverride("my.dynamic"));
      assertEquals(42, config.getInt("my.dynamic"));
      assertFalse(config.removeRuntimeOverride("my.dynamic"));
    }
  }
  
  @Test
  public void unitTestOverride() throws Exception {
    try (final UnitTestConfiguration config = 
        UnitTestConfiguration.getConfiguration()) {
      config.register("my.string", "foo", false, "A string.");
      config.override("my.string", "bar");
      assertEquals("bar", config.getString("my.string"));
      config.override("my.string", null);
      assertNull(config.getString("my.string"));
      
      try {
        config.override("nope", "bar");
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
    }
  }
  
  @Test
  public void notANumber() throws Exception {
    try (final Configuration config = UnitTestConfiguration.getConfiguration()) {
      config.register("my.string", "foo", false, "A string.");
      try {
        config.getInt("my.string");
        fail("Expected ConfigurationException");
      } catch (ConfigurationException e) { }
    }
  }
  
  @Test
  public void environmentKey() throws Exception {
    assertEquals("TASK_EXECUTOR_THREADS", 
        EnvironmentProvider.toEnvironmentKey("task.executor.threads"));
  }
  
  static class MapProvider implements Provider {
    private final String name;
    private final Map<String, String> values = Maps.newHashMap();
    
    MapProvider(final String name, final String key, final String value) {
      this.name = name;
      values.put(key, value);
    }
    
    @Override
    public String getSetting(final String key) {
      return values.get(key);
    }

    @Override
    public String source() {
      return name;
    }

    @Override
    public void close() { }
  }
}
