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
package net.pipeql.functions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

import net.pipeql.plan.PlanSpec;
import net.pipeql.query.OperationSpec;

/**
 * Names a result of the query. Always a side effect.
 * 
 * @since 1.0
 */
public class YieldOpSpec implements OperationSpec {
  public static final String KIND = "yield";
  
  private final String name;
  
  /** @param name The result name, null or empty for the default. */
  @JsonCreator
  public YieldOpSpec(@JsonProperty("name") final String name) {
    this.name = Strings.isNullOrEmpty(name) 
        ? PlanSpec.DEFAULT_YIELD_NAME : name;
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("name")
  public String name() {
    return name;
  }
}
