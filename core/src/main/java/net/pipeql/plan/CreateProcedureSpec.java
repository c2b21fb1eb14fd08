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

import net.pipeql.query.OperationSpec;

/**
 * Converts an operation spec into a procedure spec.
 * 
 * @since 1.0
 */
public interface CreateProcedureSpec {

  /**
   * @param spec The non-null operation spec.
   * @param administration Converts operation IDs to procedure IDs.
   * @return The procedure spec.
   * @throws net.pipeql.exceptions.PlanException if the spec is of the 
   * wrong type or invalid.
   */
  public ProcedureSpec create(final OperationSpec spec, 
                              final PlanAdministration administration);
  
}
