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
package net.pipeql.data;

import java.util.Objects;

import com.google.common.base.Strings;

/**
 * A column label and type.
 * 
 * @since 1.0
 */
public class ColMeta {
  private final String label;
  private final DataType type;
  
  public ColMeta(final String label, final DataType type) {
    if (Strings.isNullOrEmpty(label)) {
      throw new IllegalArgumentException("Label cannot be null or empty.");
    }
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    this.label = label;
    this.type = type;
  }
  
  public String label() {
    return label;
  }
  
  public DataType type() {
    return type;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColMeta)) {
      return false;
    }
    final ColMeta other = (ColMeta) o;
    return label.equals(other.label) && type == other.type;
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(label, type);
  }
  
  @Override
  public String toString() {
    return label + ":" + type.name().toLowerCase();
  }
}
