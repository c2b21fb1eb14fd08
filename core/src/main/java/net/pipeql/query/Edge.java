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
package net.pipeql.query;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A directed edge from a parent operation to a child that consumes it.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "parent", "child" })
public class Edge {
  private final String parent;
  private final String child;
  
  @JsonCreator
  public Edge(@JsonProperty("parent") final String parent, 
              @JsonProperty("child") final String child) {
    if (parent == null || child == null) {
      throw new IllegalArgumentException("Parent and child cannot be null.");
    }
    this.parent = parent;
    this.child = child;
  }
  
  @JsonProperty("parent")
  public String getParent() {
    return parent;
  }
  
  @JsonProperty("child")
  public String getChild() {
    return child;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Edge)) {
      return false;
    }
    final Edge other = (Edge) o;
    return parent.equals(other.parent) && child.equals(other.child);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(parent, child);
  }
  
  @Override
  public String toString() {
    return parent + "->" + child;
  }
}
