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
 * The terminal outcome of a run whose query was submitted.
 * 
 * @since 1.0
 */
public interface RunResult {

  /** @return The error raised while evaluating the query or null. */
  public Throwable err();
  
  /** @return Whether or not a scheduler may retry the run. */
  public boolean isRetryable();
  
}
