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

import com.google.common.base.MoreObjects;

import net.pipeql.plan.BoundedProcedureSpec;
import net.pipeql.plan.BoundsSpec;
import net.pipeql.plan.ProcedureSpec;

/**
 * The source procedure. Ranges and aggregates push themselves into it 
 * during planning so storage can do the work.
 * 
 * @since 1.0
 */
public class FromProcedureSpec implements BoundedProcedureSpec {
  private final String bucket;
  private boolean bounds_set;
  private BoundsSpec bounds;
  private boolean aggregate_set;
  private String aggregate_method;
  
  public FromProcedureSpec(final String bucket) {
    this.bucket = bucket;
    bounds = BoundsSpec.ZERO;
  }
  
  @Override
  public String kind() {
    return FromOpSpec.KIND;
  }
  
  public String bucket() {
    return bucket;
  }
  
  public boolean boundsSet() {
    return bounds_set;
  }
  
  public BoundsSpec bounds() {
    return bounds;
  }
  
  public void setBounds(final BoundsSpec bounds) {
    this.bounds = bounds == null ? BoundsSpec.ZERO : bounds;
    bounds_set = bounds != null;
  }
  
  public boolean aggregateSet() {
    return aggregate_set;
  }
  
  public String aggregateMethod() {
    return aggregate_method;
  }
  
  public void setAggregateMethod(final String aggregate_method) {
    this.aggregate_method = aggregate_method;
    aggregate_set = aggregate_method != null;
  }
  
  /** Clears pushed bounds and aggregates, used on duplicates. */
  public void reset() {
    setBounds(null);
    setAggregateMethod(null);
  }
  
  @Override
  public BoundsSpec timeBounds() {
    return bounds;
  }
  
  @Override
  public ProcedureSpec copy() {
    final FromProcedureSpec copy = new FromProcedureSpec(bucket);
    copy.bounds_set = bounds_set;
    copy.bounds = bounds;
    copy.aggregate_set = aggregate_set;
    copy.aggregate_method = aggregate_method;
    return copy;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("bucket", bucket)
        .add("bounds", bounds_set ? bounds : null)
        .add("aggregate", aggregate_method)
        .toString();
  }
}
