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

import java.time.Instant;
import java.util.List;
import java.util.Map;

import net.pipeql.plan.ProcedureID;
import net.pipeql.query.QueryContext;
import net.pipeql.query.QueryTime;

/**
 * Execution services available while creating transformations and 
 * sources.
 * 
 * @since 1.0
 */
public interface ExecutionAdministration {

  public String organizationID();
  
  public QueryContext context();
  
  /** @return The evaluation instant of the plan. */
  public Instant now();
  
  /**
   * @param time A non-null time.
   * @return The time resolved against now, in Unix epoch nanoseconds.
   */
  public long resolveTime(final QueryTime time);
  
  /** @return The query's allocator. */
  public Allocator allocator();
  
  /** @return The parent datasets of the node being created, in order. */
  public List<DatasetID> parents();
  
  public DatasetID convertID(final ProcedureID id);
  
  /** @return Opaque dependencies by name, e.g. the storage reader. */
  public Map<String, Object> dependencies();
  
}
