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
package net.pipeql.utils;

/**
 * Simple key/value pair class where either of the values may be null.
 * Used where a method returns two values, e.g. a table builder and 
 * whether or not it was just created.
 *
 * @param <K> Object type for the key
 * @param <V> Object type for the value
 */
public class Pair<K, V> {

  /** The key or left hand value */
  protected K key;
  
  /** The value or right hand value */
  protected V value;
  
  /**
   * Default ctor that leaves the key and value objects as null
   */
  public Pair() {
  }
  
  /**
   * Ctor that stores references to the objects
   * @param key The key or left hand value to store
   * @param value The value or right hand value to store
   */
  public Pair(final K key, final V value) {
    this.key = key;
    this.value = value;
  }
  
  @Override
  public int hashCode() {
    return (key == null ? 0 : key.hashCode()) ^
           (value == null ? 0 : value.hashCode());
  }
  
  @Override
  public String toString() {
    return new StringBuilder().append("key=")
      .append(key).append(", value=").append(value).toString();
  }
  
  @Override
  public boolean equals(final Object object) {
    if (object == this) {
      return true;
    }
    if (object instanceof Pair<?, ?>) {
      final Pair<?, ?> other_pair = (Pair<?, ?>)object;
      return
        (key == null ? other_pair.getKey() == null : 
          key.equals(other_pair.key))
        && (value == null ? other_pair.getValue() == null : 
          value.equals(other_pair.value));
    }
    return false;
  }
  
  /** @return The stored key/left value, may be null */
  public K getKey() {
    return key;
  }
  
  /** @return The stored value/right value, may be null */
  public V getValue() {
    return value;
  }
}
