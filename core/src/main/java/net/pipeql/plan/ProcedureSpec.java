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
 * The physical parameters of a procedure. Optional planner behavior is
 * declared by also implementing one of the capability interfaces:
 * {@link PushDownProcedureSpec}, {@link BoundedProcedureSpec}, 
 * {@link YieldProcedureSpec}, {@link AggregateProcedureSpec} or 
 * {@link ParentAwareProcedureSpec}.
 * 
 * @since 1.0
 */
public interface ProcedureSpec {

  /** @return The procedure kind, used to look up the transformation. */
  public String kind();
  
  /** @return A deep copy that may be mutated independently. */
  public ProcedureSpec copy();
  
}
