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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Strings;

/**
 * An operation ID with its spec.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "kind", "id", "spec" })
public class Operation {
  private final String id;
  private final OperationSpec spec;
  
  public Operation(final String id, final OperationSpec spec) {
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    if (spec == null) {
      throw new IllegalArgumentException("Spec cannot be null.");
    }
    this.id = id;
    this.spec = spec;
  }
  
  @JsonProperty("id")
  public String getId() {
    return id;
  }
  
  @JsonProperty("kind")
  public String getKind() {
    return spec.kind();
  }
  
  @JsonProperty("spec")
  public OperationSpec getSpec() {
    return spec;
  }
  
  @Override
  public String toString() {
    return id;
  }
}
