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
 * Planner services available while creating procedure specs.
 * 
 * @since 1.0
 */
public interface PlanAdministration {

  /**
   * @param operation_id A non-null operation ID.
   * @return The ID of the procedure planned for the operation.
   */
  public ProcedureID convertID(final String operation_id);
  
}
