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
package net.pipeql.plan;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Identifies a procedure within a plan. IDs are name based UUIDs derived 
 * from the operation ID, or from another procedure ID for duplicates, so
 * planning the same spec twice yields the same IDs.
 * 
 * @since 1.0
 */
public final class ProcedureID {
  private final UUID id;
  
  private ProcedureID(final UUID id) {
    this.id = id;
  }
  
  /**
   * @param operation_id A non-null operation ID.
   * @return The procedure ID.
   */
  public static ProcedureID fromOperationID(final String operation_id) {
    if (operation_id == null) {
      throw new IllegalArgumentException("Operation ID cannot be null.");
    }
    return new ProcedureID(UUID.nameUUIDFromBytes(
        operation_id.getBytes(StandardCharsets.UTF_8)));
  }
  
  /**
   * @param id The non-null ID of the procedure being duplicated.
   * @return A new ID for the duplicate.
   */
  public static ProcedureID forDuplicate(final ProcedureID id) {
    return new ProcedureID(UUID.nameUUIDFromBytes(
        ("dup:" + id.id).getBytes(StandardCharsets.UTF_8)));
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProcedureID)) {
      return false;
    }
    return id.equals(((ProcedureID) o).id);
  }
  
  @Override
  public int hashCode() {
    return id.hashCode();
  }
  
  @Override
  public String toString() {
    return id.toString();
  }
}
