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
package net.pipeql.task.executor;

import com.google.common.base.MoreObjects;

import net.pipeql.task.backend.RunResult;

/**
 * The result of a run whose query was submitted.
 * 
 * @since 1.0
 */
public class DefaultRunResult implements RunResult {
  private final Throwable err;
  private final boolean retryable;
  
  /**
   * @param err The query error or null on success.
   * @param retryable Whether or not the run may be retried.
   */
  public DefaultRunResult(final Throwable err, final boolean retryable) {
    this.err = err;
    this.retryable = retryable;
  }
  
  @Override
  public Throwable err() {
    return err;
  }
  
  @Override
  public boolean isRetryable() {
    return retryable;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("err", err == null ? null : err.getMessage())
        .add("retryable", retryable)
        .toString();
  }
}
