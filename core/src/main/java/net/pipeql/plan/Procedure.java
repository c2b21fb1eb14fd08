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
package net.pipeql.plan;

import java.util.List;

import com.google.common.collect.Lists;

/**
 * A node of the physical plan. Parents and children are referenced by 
 * ID and resolved through the owning {@link PlanSpec}.
 * 
 * @since 1.0
 */
public class Procedure {
  PlanSpec plan;
  private final ProcedureID id;
  private final List<ProcedureID> parents;
  private final List<ProcedureID> children;
  private ProcedureSpec spec;
  private BoundsSpec bounds;
  
  public Procedure(final ProcedureID id, final ProcedureSpec spec) {
    if (id == null) {
      throw new IllegalArgumentException("ID cannot be null.");
    }
    if (spec == null) {
      throw new IllegalArgumentException("Spec cannot be null.");
    }
    this.id = id;
    this.spec = spec;
    parents = Lists.newArrayList();
    children = Lists.newArrayList();
    bounds = BoundsSpec.ZERO;
  }
  
  public ProcedureID id() {
    return id;
  }
  
  /** @return The mutable list of parent IDs. */
  public List<ProcedureID> parents() {
    return parents;
  }
  
  /** @return The mutable list of child IDs. */
  public List<ProcedureID> children() {
    return children;
  }
  
  public ProcedureSpec spec() {
    return spec;
  }
  
  public void setSpec(final ProcedureSpec spec) {
    this.spec = spec;
  }
  
  public BoundsSpec bounds() {
    return bounds;
  }
  
  public void setBounds(final BoundsSpec bounds) {
    this.bounds = bounds;
  }
  
  /** @return The plan this procedure belongs to. */
  public PlanSpec plan() {
    return plan;
  }
  
  /** @return The child at the index. */
  public Procedure child(final int i) {
    return plan.procedure(children.get(i));
  }
  
  /**
   * Copies the procedure under a new ID with a deep copy of the spec. 
   * The copy belongs to the same plan but is not registered with it.
   * @param new_id The non-null ID of the copy.
   * @return The copy.
   */
  public Procedure copy(final ProcedureID new_id) {
    final Procedure copy = new Procedure(new_id, spec.copy());
    copy.plan = plan;
    copy.parents.addAll(parents);
    copy.children.addAll(children);
    copy.bounds = bounds;
    return copy;
  }
  
  @Override
  public String toString() {
    return spec.kind() + "(" + id + ")";
  }
}
