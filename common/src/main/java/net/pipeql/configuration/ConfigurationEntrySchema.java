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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * The schema for a configuration key: its type, default and whether it
 * may be changed at runtime. Values from providers are parsed against
 * the {@link #getType()}.
 * 
 * @since 1.0
 */
public class ConfigurationEntrySchema {

  /** The key. */
  protected final String key;
  
  /** The class of the value. One of String, Integer, Long or Boolean. */
  protected final Class<?> type;
  
  /** The default, may be null. */
  protected Object default_value;
  
  /** Whether or not runtime overrides are honored. */
  protected final boolean is_dynamic;
  
  /** What registered the key. */
  protected final String source;
  
  /** A help string. */
  protected final String description;
  
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    key = builder.key;
    type = builder.type;
    default_value = builder.default_value;
    is_dynamic = builder.is_dynamic;
    source = builder.source;
    description = builder.description;
  }
  
  public String getKey() {
    return key;
  }
  
  public Class<?> getType() {
    return type;
  }
  
  public Object getDefaultValue() {
    return default_value;
  }
  
  public boolean isDynamic() {
    return is_dynamic;
  }
  
  public String getSource() {
    return source;
  }
  
  public String getDescription() {
    return description;
  }
  
  /**
   * Parses a raw provider string into the schema type.
   * @param raw The raw value, may be null.
   * @return The parsed value or null if the raw value was null.
   * @throws ConfigurationException if the value could not be parsed.
   */
  public Object parse(final String raw) {
    if (raw == null) {
      return null;
    }
    final String trimmed = raw.trim();
    try {
      if (type == Integer.class) {
        return Integer.parseInt(trimmed);
      } else if (type == Long.class) {
        return Long.parseLong(trimmed);
      } else if (type == Boolean.class) {
        final String lc = trimmed.toLowerCase();
        return lc.equals("true") || lc.equals("1") || lc.equals("yes");
      }
      return raw;
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Unable to parse value [" + raw 
          + "] for key [" + key + "] as a " + type.getSimpleName(), e);
    }
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("type", type.getSimpleName())
        .add("default", default_value)
        .add("dynamic", is_dynamic)
        .add("source", source)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String key;
    private Class<?> type;
    private Object default_value;
    private boolean is_dynamic;
    private String source;
    private String description;
    
    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }
    
    public Builder setType(final Class<?> type) {
      this.type = type;
      return this;
    }
    
    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }
    
    public Builder isDynamic() {
      is_dynamic = true;
      return this;
    }
    
    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }
    
    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }
    
    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
