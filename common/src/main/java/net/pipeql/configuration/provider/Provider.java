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

import java.io.Closeable;

import net.pipeql.configuration.Configuration;

/**
 * A source of raw configuration values for the {@link Configuration}.
 * Providers are consulted in priority order and the first non-null
 * value wins.
 * 
 * @since 1.0
 */
public interface Provider extends Closeable {
  
  /**
   * Called by the {@link Configuration} class to load the current value 
   * for the given key.
   * @param key A non-null and non-empty key.
   * @return The raw value if present, null if the provider had no data.
   */
  public String getSetting(final String key);
  
  /**
   * The name of this provider.
   * @return A non-null string.
   */
  public String source();
  
}
