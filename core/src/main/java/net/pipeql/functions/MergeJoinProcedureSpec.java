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
package net.pipeql.functions;

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;

import net.pipeql.plan.ParentAwareProcedureSpec;
import net.pipeql.plan.ProcedureID;
import net.pipeql.plan.ProcedureSpec;

/**
 * The join procedure, tracking the name of each parent across planner 
 * rewrites.
 * 
 * @since 1.0
 */
public class MergeJoinProcedureSpec implements ParentAwareProcedureSpec {
  private final List<String> on;
  private final Map<ProcedureID, String> table_names;
  
  public MergeJoinProcedureSpec(final List<String> on, 
                                final Map<ProcedureID, String> table_names) {
    this.on = on;
    this.table_names = Maps.newLinkedHashMap(table_names);
  }
  
  @Override
  public String kind() {
    return JoinOpSpec.KIND;
  }
  
  public List<String> on() {
    return on;
  }
  
  public Map<ProcedureID, String> tableNames() {
    return table_names;
  }
  
  @Override
  public void parentChanged(final ProcedureID old_id, 
                            final ProcedureID new_id) {
    final String name = table_names.remove(old_id);
    if (name != null) {
      table_names.put(new_id, name);
    }
  }
  
  @Override
  public ProcedureSpec copy() {
    return new MergeJoinProcedureSpec(on, table_names);
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("on", on)
        .add("tables", table_names)
        .toString();
  }
}
