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
package net.pipeql.task.backend;

import net.pipeql.query.QueryContext;

/**
 * Runs queued task runs.
 * 
 * @since 1.0
 */
public interface Executor {

  /**
   * Starts the run.
   * @param ctx A non-null context. Cancelling it resolves the promise 
   * with the context's error.
   * @param run The non-null run.
   * @return A non-null promise.
   * @throws net.pipeql.exceptions.QueryExecutionException if the run 
   * could not be submitted. Implementations that submit in the 
   * background report these through the promise instead.
   */
  public RunPromise execute(final QueryContext ctx, final QueuedRun run);
  
}
