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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * An object with named, typed properties.
 * 
 * @since 1.0
 */
public class ObjectType implements Type {
  private final Map<String, Type> properties;
  
  public ObjectType(final Map<String, Type> properties) {
    if (properties == null) {
      throw new IllegalArgumentException("Properties cannot be null.");
    }
    this.properties = ImmutableMap.copyOf(properties);
  }
  
  @Override
  public Kind kind() {
    return Kind.OBJECT;
  }
  
  /** @return The immutable property map in declaration order. */
  public Map<String, Type> properties() {
    return properties;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ObjectType)) {
      return false;
    }
    final ObjectType other = (ObjectType) o;
    if (!properties.keySet().equals(other.properties.keySet())) {
      return false;
    }
    for (final Map.Entry<String, Type> entry : properties.entrySet()) {
      if (!ArrayType.kindEquals(entry.getValue(), 
          other.properties.get(entry.getKey()))) {
        return false;
      }
    }
    return true;
  }
  
  @Override
  public int hashCode() {
    return properties.keySet().hashCode();
  }
  
  @Override
  public String toString() {
    return properties.toString();
  }
}
