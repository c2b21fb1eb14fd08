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
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;

import net.pipeql.plan.BoundedProcedureSpec;
import net.pipeql.plan.BoundsSpec;
import net.pipeql.plan.Procedure;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.plan.PushDownProcedureSpec;
import net.pipeql.plan.PushDownRule;

/**
 * Pushes its bounds into the {@code from} above it, passing through 
 * filters. A {@code from} already bounded by another range is duplicated.
 * 
 * @since 1.0
 */
public class RangeProcedureSpec implements BoundedProcedureSpec, 
    PushDownProcedureSpec {
  private static final List<PushDownRule> RULES = ImmutableList.of(
      new PushDownRule(FromOpSpec.KIND, 
          ImmutableList.of(FilterOpSpec.KIND), null));
  
  private final BoundsSpec bounds;
  
  public RangeProcedureSpec(final BoundsSpec bounds) {
    this.bounds = bounds;
  }
  
  @Override
  public String kind() {
    return RangeOpSpec.KIND;
  }
  
  @Override
  public BoundsSpec timeBounds() {
    return bounds;
  }
  
  @Override
  public List<PushDownRule> pushDownRules() {
    return RULES;
  }
  
  @Override
  public void pushDown(final Procedure root, final Supplier<Procedure> dup) {
    FromProcedureSpec from = (FromProcedureSpec) root.spec();
    if (from.boundsSet()) {
      from = (FromProcedureSpec) dup.get().spec();
      from.reset();
    }
    from.setBounds(bounds);
  }
  
  @Override
  public ProcedureSpec copy() {
    return new RangeProcedureSpec(bounds);
  }
  
  @Override
  public String toString() {
    return "range" + bounds;
  }
}
