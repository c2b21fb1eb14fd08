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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.pipeql.plan.ProcedureSpec;

/**
 * The procedure shared by {@code rename}, {@code drop}, {@code keep} and
 * {@code duplicate}.
 * 
 * @since 1.0
 */
public class SchemaMutationProcedureSpec implements ProcedureSpec {
  public static final String KIND = "SchemaMutation";
  
  private final List<SchemaMutation> mutations;
  
  public SchemaMutationProcedureSpec(final List<SchemaMutation> mutations) {
    this.mutations = ImmutableList.copyOf(mutations);
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  /** @return The mutations, applied in order. */
  public List<SchemaMutation> mutations() {
    return mutations;
  }
  
  @Override
  public ProcedureSpec copy() {
    return new SchemaMutationProcedureSpec(mutations);
  }
}
