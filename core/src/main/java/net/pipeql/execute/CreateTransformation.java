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
package net.pipeql.execute;

import net.pipeql.plan.ProcedureSpec;
import net.pipeql.utils.Pair;

/**
 * Builds the transformation for a procedure and the dataset it writes to.
 * 
 * @since 1.0
 */
public interface CreateTransformation {

  /**
   * @param id The ID of the output dataset.
   * @param mode The accumulation mode for the dataset.
   * @param spec The procedure spec.
   * @param administration Execution services.
   * @return The transformation and its dataset.
   * @throws net.pipeql.exceptions.QueryExecutionException if the spec is
   * invalid.
   */
  public Pair<Transformation, Dataset> create(final DatasetID id, 
      final AccumulationMode mode, 
      final ProcedureSpec spec, 
      final ExecutionAdministration administration);
  
}
