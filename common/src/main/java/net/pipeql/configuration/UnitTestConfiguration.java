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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Lists;

import net.pipeql.configuration.provider.Provider;

/**
 * A helper for unit testing configuration consumers. The real 
 * {@link Configuration} is used but system properties and the 
 * environment are ignored in favor of the given map.
 * 
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  private UnitTestConfiguration(final UnitTestProvider provider) {
    super(Lists.<Provider>newArrayList(provider));
  }
  
  /** @return A config with no values other than registered defaults. */
  public static UnitTestConfiguration getConfiguration() {
    return getConfiguration(Collections.<String, String>emptyMap());
  }
  
  /**
   * Returns a config that loads values from the given map. The map is
   * read at registration so it may be populated before components 
   * register their keys.
   * 
   * @param settings A non-null map of key values to load.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    return new UnitTestConfiguration(new UnitTestProvider(settings));
  }

  /**
   * Injects a value for a registered key regardless of whether it is
   * dynamic.
   * 
   * @param key A non-null and non-empty key.
   * @param value A value to inject.
   * @throws IllegalArgumentException if the key was not registered.
   */
  public void override(final String key, final Object value) {
    final ConfigurationEntrySchema schema = schemas.get(key);
    if (schema == null) {
      throw new IllegalArgumentException("Register this config first!");
    }
    if (value == null) {
      loaded.remove(key);
      schema.default_value = null;
    } else {
      loaded.put(key, schema.parse(value.toString()));
    }
  }
  
  static class UnitTestProvider implements Provider {
    private final Map<String, String> kvs;
    
    UnitTestProvider(final Map<String, String> kvs) {
      this.kvs = kvs;
    }

    @Override
    public String getSetting(final String key) {
      return kvs.get(key);
    }

    @Override
    public String source() {
      return getClass().getSimpleName();
    }

    @Override
    public void close() {
      // no-op
    }
    
  }
}
