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

import java.io.Closeable;
import java.util.List;

import net.pipeql.query.QueryContext;

/**
 * Persistence for tasks and their in-flight runs. Bad arguments raise
 * {@link IllegalArgumentException}.
 * 
 * @since 1.0
 */
public interface Store extends Closeable {

  /**
   * Creates a task. The script must declare {@code option task} with at
   * least a name.
   * @return The new task ID.
   */
  public String createTask(final QueryContext ctx, 
                           final String org, 
                           final String user, 
                           final String script);
  
  /**
   * Replaces the script of a task.
   * @throws IllegalArgumentException if the task does not exist or the 
   * script is invalid.
   */
  public void modifyTask(final QueryContext ctx, 
                         final String id, 
                         final String script);
  
  /**
   * Lists tasks ordered by ID.
   * @throws IllegalArgumentException if both org and user are set or the
   * page size is out of bounds.
   */
  public List<StoreTask> listTasks(final QueryContext ctx, 
                                   final TaskSearchParams params);
  
  /** @return The task or null if not found. */
  public StoreTask findTaskByID(final QueryContext ctx, final String id);
  
  /** @return True if the task existed and was deleted. */
  public boolean deleteTask(final QueryContext ctx, final String id);
  
  /**
   * Records a new in-flight run.
   * @param now The Unix epoch seconds the run is for.
   * @throws IllegalStateException if the task's max concurrency would 
   * be exceeded.
   */
  public QueuedRun createRun(final QueryContext ctx, 
                             final String task_id, 
                             final long now);
  
  /** @return True if the run was in flight and is now finished. */
  public boolean finishRun(final QueryContext ctx, 
                           final String task_id, 
                           final String run_id);
  
}
