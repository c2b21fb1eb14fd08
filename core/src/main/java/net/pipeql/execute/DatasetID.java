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

import net.pipeql.plan.ProcedureID;

/**
 * Identifies the output of one transformation or source.
 * 
 * @since 1.0
 */
public final class DatasetID {
  private final String id;
  
  private DatasetID(final String id) {
    this.id = id;
  }
  
  /**
   * @param id A non-null procedure ID.
   * @return The dataset ID of the procedure's output.
   */
  public static DatasetID fromProcedureID(final ProcedureID id) {
    if (id == null) {
      throw new IllegalArgumentException("Procedure ID cannot be null.");
    }
    return new DatasetID(id.toString());
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetID)) {
      return false;
    }
    return id.equals(((DatasetID) o).id);
  }
  
  @Override
  public int hashCode() {
    return id.hashCode();
  }
  
  @Override
  public String toString() {
    return id;
  }
}
