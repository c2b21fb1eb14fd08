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

import com.google.common.base.MoreObjects;

/**
 * A request to run a task once.
 * 
 * @since 1.0
 */
public class QueuedRun {
  private final String task_id;
  private final String run_id;
  private final long now;
  
  /**
   * @param task_id A non-null task ID.
   * @param run_id A non-null run ID.
   * @param now The Unix epoch seconds the run is executed for.
   */
  public QueuedRun(final String task_id, final String run_id, final long now) {
    if (task_id == null) {
      throw new IllegalArgumentException("Task ID cannot be null.");
    }
    if (run_id == null) {
      throw new IllegalArgumentException("Run ID cannot be null.");
    }
    this.task_id = task_id;
    this.run_id = run_id;
    this.now = now;
  }
  
  public String taskID() {
    return task_id;
  }
  
  public String runID() {
    return run_id;
  }
  
  /** @return Unix epoch seconds. */
  public long now() {
    return now;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("task", task_id)
        .add("run", run_id)
        .add("now", now)
        .toString();
  }
}
