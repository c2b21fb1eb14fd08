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

import net.pipeql.exceptions.QueryExecutionCanceled;

/**
 * The error a {@link RunPromise} resolves with when cancelled.
 * 
 * @since 1.0
 */
public class RunCanceledException extends QueryExecutionCanceled {
  private static final long serialVersionUID = 3370583612734522281L;

  public RunCanceledException() {
    super("run canceled", CANCELED);
  }
}
