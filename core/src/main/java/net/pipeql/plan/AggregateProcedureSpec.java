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

/**
 * An aggregation that storage may compute per series. Once pushed down,
 * the planner swaps the procedure for its re-aggregation so the partial
 * results from storage are combined.
 * 
 * @since 1.0
 */
public interface AggregateProcedureSpec extends PushDownProcedureSpec {

  /** @return The method name handed to storage, e.g. "count". */
  public String aggregateMethod();
  
  /** @return The spec that combines storage results. */
  public ProcedureSpec reAggregateSpec();
  
}
