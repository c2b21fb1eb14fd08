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
package net.pipeql.configuration.provider;

import java.util.Map;

import com.google.common.collect.Maps;

import net.pipeql.configuration.Configuration;

/**
 * A simple map that lets the application set values at runtime through
 * {@link Configuration#addOverride(String, String)}. Only keys 
 * registered as dynamic are honored.
 * 
 * @since 1.0
 */
public class RuntimeOverrideProvider implements Provider {
  public static final String SOURCE = 
      RuntimeOverrideProvider.class.getSimpleName();
  
  /** The overrides. */
  private final Map<String, String> overrides = Maps.newConcurrentMap();
  
  @Override
  public String getSetting(final String key) {
    return overrides.get(key);
  }

  /**
   * @param key A non-null key.
   * @param value A non-null value.
   */
  public void put(final String key, final String value) {
    overrides.put(key, value);
  }
  
  /**
   * @param key A non-null key.
   * @return True if an override was present.
   */
  public boolean remove(final String key) {
    return overrides.remove(key) != null;
  }
  
  @Override
  public String source() {
    return SOURCE;
  }

  @Override
  public void close() {
    overrides.clear();
  }
  
}
