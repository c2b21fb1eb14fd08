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
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.pipeql.execute.Aggregates;
import net.pipeql.execute.ExecuteConstants;
import net.pipeql.plan.AggregateProcedureSpec;
import net.pipeql.plan.Procedure;
import net.pipeql.plan.ProcedureSpec;
import net.pipeql.plan.PushDownRule;

/**
 * The procedure of {@code mean}, {@code count} and {@code sum}. When only
 * {@code _value} is aggregated, the aggregate is pushed into a bounded 
 * {@code from} and replaced with its re-aggregation over the per series
 * results.
 * 
 * @since 1.0
 */
public class SimpleAggregateProcedureSpec implements AggregateProcedureSpec {
  private static final List<String> PUSHABLE_COLUMNS = 
      ImmutableList.of(ExecuteConstants.DEFAULT_VALUE_LABEL);
  
  private final String kind;
  private final Aggregates aggregate;
  private final List<String> columns;
  
  public SimpleAggregateProcedureSpec(final String kind, 
                                      final Aggregates aggregate, 
                                      final List<String> columns) {
    this.kind = kind;
    this.aggregate = aggregate;
    this.columns = ImmutableList.copyOf(columns);
  }
  
  @Override
  public String kind() {
    return kind;
  }
  
  public Aggregates aggregate() {
    return aggregate;
  }
  
  public List<String> columns() {
    return columns;
  }
  
  @Override
  public List<PushDownRule> pushDownRules() {
    if (!columns.equals(PUSHABLE_COLUMNS)) {
      return ImmutableList.of();
    }
    return ImmutableList.of(new PushDownRule(FromOpSpec.KIND, null, 
        new Predicate<ProcedureSpec>() {
          @Override
          public boolean test(final ProcedureSpec spec) {
            final FromProcedureSpec from = (FromProcedureSpec) spec;
            return from.boundsSet() && !from.aggregateSet();
          }
        }));
  }
  
  @Override
  public void pushDown(final Procedure root, final Supplier<Procedure> dup) {
    FromProcedureSpec from = (FromProcedureSpec) root.spec();
    if (root.children().size() > 1) {
      // other branches must keep reading raw data
      from = (FromProcedureSpec) dup.get().spec();
    }
    from.setAggregateMethod(aggregate.methodName());
  }
  
  @Override
  public String aggregateMethod() {
    return aggregate.methodName();
  }
  
  @Override
  public ProcedureSpec reAggregateSpec() {
    switch (aggregate) {
    case COUNT:
      return new SimpleAggregateProcedureSpec(SumOpSpec.KIND, 
          Aggregates.SUM, columns);
    default:
      return copy();
    }
  }
  
  @Override
  public ProcedureSpec copy() {
    return new SimpleAggregateProcedureSpec(kind, aggregate, columns);
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("columns", columns)
        .toString();
  }
}
