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

/**
 * A single-assignment handle on an executing run. The promise resolves
 * exactly once, either naturally or through {@link #cancel()}, and every
 * later call to {@link #await()} observes the same outcome.
 * 
 * @since 1.0
 */
public interface RunPromise {

  /** @return The run this promise is for. */
  public QueuedRun run();
  
  /**
   * Blocks until the promise resolves.
   * @return The result if the query was evaluated. Errors raised inside
   * the query are carried by {@link RunResult#err()}.
   * @throws RunCanceledException if the promise was cancelled.
   * @throws Exception if the run failed before a result could exist.
   */
  public RunResult await() throws Exception;
  
  /**
   * Resolves the promise with a {@link RunCanceledException} if it has 
   * not resolved yet. Idempotent.
   */
  public void cancel();
  
}
