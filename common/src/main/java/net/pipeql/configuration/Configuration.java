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

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.configuration.provider.EnvironmentProvider;
import net.pipeql.configuration.provider.Provider;
import net.pipeql.configuration.provider.RuntimeOverrideProvider;
import net.pipeql.configuration.provider.SystemPropertiesProvider;

/**
 * The configuration for a PipeQL process. Components register the keys
 * they need with a default, a type and a description, then read them 
 * through the typed getters. Plugins and services that may be built
 * more than once should guard with {@link #hasProperty(String)}:
 * <pre>
 * if (!config.hasProperty(KEY)) {
 *   config.register(KEY, 4, false, "The number of worker threads.");
 * }
 * </pre>
 * <p>
 * Values are resolved from providers in order. The first is always the
 * {@link RuntimeOverrideProvider}, which is only honored for dynamic 
 * keys, followed by system properties and then the environment. If no
 * provider has a value the schema default is returned.
 * 
 * @since 1.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);
  
  /** The registered schemas. */
  protected final Map<String, ConfigurationEntrySchema> schemas;
  
  /** Values loaded from static providers at registration time. */
  protected final Map<String, Object> loaded;
  
  /** Runtime overrides. */
  protected final RuntimeOverrideProvider overrides;
  
  /** Static providers in priority order. */
  protected final List<Provider> providers;
  
  /**
   * Default ctor that reads from system properties and the environment.
   */
  public Configuration() {
    this(Lists.newArrayList(
        new SystemPropertiesProvider(), 
        new EnvironmentProvider()));
  }
  
  /**
   * Ctor with a custom list of static providers.
   * @param providers A non-null, possibly empty, list of providers in
   * priority order.
   * @throws IllegalArgumentException if the providers were null.
   */
  public Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    schemas = Maps.newConcurrentMap();
    loaded = Maps.newConcurrentMap();
    overrides = new RuntimeOverrideProvider();
    this.providers = ImmutableList.copyOf(providers);
  }
  
  /**
   * Registers the config schema with the configuration and loads the
   * current value from the providers.
   * 
   * @param schema A non-null schema fully configured.
   * @throws IllegalArgumentException if the given schema was null.
   * @throws ConfigurationException if the schema was already registered.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    final ConfigurationEntrySchema extant = 
        schemas.putIfAbsent(schema.getKey(), schema);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + schema.getKey());
    }
    
    for (final Provider provider : providers) {
      final String raw = provider.getSetting(schema.getKey());
      if (raw != null) {
        loaded.put(schema.getKey(), schema.parse(raw));
        if (LOG.isDebugEnabled()) {
          LOG.debug("Loaded [" + schema.getKey() + "] from " 
              + provider.source());
        }
        break;
      }
    }
  }
  
  /**
   * Registers a string key.
   * 
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final String default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, String.class, default_value, is_dynamic, description);
  }
  
  /**
   * Registers an integer key. See {@link #register(String, String, boolean, String)}.
   */
  public void register(final String key, 
                       final int default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, Integer.class, default_value, is_dynamic, description);
  }
  
  /**
   * Registers a long key. See {@link #register(String, String, boolean, String)}.
   */
  public void register(final String key, 
                       final long default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, Long.class, default_value, is_dynamic, description);
  }
  
  /**
   * Registers a boolean key. See {@link #register(String, String, boolean, String)}.
   */
  public void register(final String key, 
                       final boolean default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, Boolean.class, default_value, is_dynamic, description);
  }
  
  /**
   * Sets a runtime override for a dynamic key.
   * 
   * @param key A non-null and non-empty key that was registered.
   * @param value The raw value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered, was 
   * not dynamic or the value did not parse.
   */
  public void addOverride(final String key, final String value) {
    final ConfigurationEntrySchema schema = schema(key);
    if (!schema.isDynamic()) {
      throw new ConfigurationException("Key [" + key 
          + "] is not dynamic and cannot be overridden.");
    }
    // validate before storing
    schema.parse(value);
    overrides.put(key, value);
  }
  
  /**
   * Removes a runtime override.
   * @param key A non-null and non-empty key.
   * @return True if an override was removed.
   */
  public boolean removeRuntimeOverride(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return overrides.remove(key);
  }
  
  /**
   * Returns the value as a string. Numbers are converted.
   * 
   * @param key The non-null and non-empty config key entry.
   * @return A String if the entry had a value, null if it was null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public String getString(final String key) {
    final Object value = resolve(key);
    return value == null ? null : value.toString();
  }
  
  /**
   * Returns the value as an integer.
   * 
   * @param key A non-null and non-empty key.
   * @return An integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or was not numeric.
   */
  public int getInt(final String key) {
    final Object value = resolve(key);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    throw new ConfigurationException("Value for key [" + key 
        + "] is not a number: " + value);
  }
  
  /**
   * Returns the value as a long.
   * 
   * @param key A non-null and non-empty key.
   * @return A long integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or was not numeric.
   */
  public long getLong(final String key) {
    final Object value = resolve(key);
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    throw new ConfigurationException("Value for key [" + key 
        + "] is not a number: " + value);
  }
  
  /**
   * Checks to see if the value of the key is true or false. Nulls count
   * as false and only the values in the set [true, 1, yes] count as 
   * true (cast to lower case in string form).
   * 
   * @param key A non-null and non-empty key.
   * @return A boolean value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public boolean getBoolean(final String key) {
    final Object value = resolve(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    final String bool = value.toString().toLowerCase().trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }
  
  /**
   * Determines if the given key has been registered.
   * 
   * @param key A non-null and no-empty key.
   * @return True if the key was registered, false if not and calls
   * to read methods would throw an exception.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return schemas.containsKey(key);
  }
  
  /** @return An unmodifiable view of the registered schemas. */
  public Map<String, ConfigurationEntrySchema> schemas() {
    return Collections.unmodifiableMap(schemas);
  }
  
  @Override
  public void close() throws IOException {
    IOException first = null;
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.error("Failed to close provider: " + provider.source(), e);
        if (first == null) {
          first = e;
        }
      }
    }
    overrides.close();
    if (first != null) {
      throw first;
    }
  }
  
  private void register(final String key,
                        final Class<?> type,
                        final Object default_value,
                        final boolean is_dynamic,
                        final String description) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    final ConfigurationEntrySchema.Builder builder = 
        ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(type)
        .setDefaultValue(default_value)
        .setSource(callerClassName())
        .setDescription(description);
    if (is_dynamic) {
      builder.isDynamic();
    }
    register(builder.build());
  }
  
  private ConfigurationEntrySchema schema(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntrySchema schema = schemas.get(key);
    if (schema == null) {
      throw new ConfigurationException("No schema registered for key: " 
          + key);
    }
    return schema;
  }
  
  private Object resolve(final String key) {
    final ConfigurationEntrySchema schema = schema(key);
    if (schema.isDynamic()) {
      final String override = overrides.getSetting(key);
      if (override != null) {
        return schema.parse(override);
      }
    }
    if (loaded.containsKey(key)) {
      return loaded.get(key);
    }
    return schema.getDefaultValue();
  }
  
  private static String callerClassName() {
    final StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // 0 = getStackTrace, 1 = here, 2 = private register, 3 = public 
    // register, 4 = caller
    return stack.length > 4 ? stack[4].getClassName() : "unknown";
  }
}
