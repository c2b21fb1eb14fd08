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

import net.pipeql.query.QueryContext;

/**
 * Produces the tables at the root of the execution graph. A source runs 
 * once, on a worker thread, and must finish its consumers exactly once
 * whether it succeeds, fails or is cancelled.
 * 
 * @since 1.0
 */
public interface Source extends Node {

  public DatasetID id();
  
  /**
   * Produces every table then finishes. Checks the context between 
   * tables and finishes with its error once cancelled.
   * @param context The non-null query context.
   */
  public void run(final QueryContext context);
  
}
