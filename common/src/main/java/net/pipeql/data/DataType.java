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
package net.pipeql.data;

import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;

/**
 * The column types a table may carry.
 * 
 * @since 1.0
 */
public enum DataType {
  BOOL(Types.BOOL),
  INT(Types.INT),
  UINT(Types.UINT),
  FLOAT(Types.FLOAT),
  STRING(Types.STRING),
  TIME(Types.TIME);
  
  private final Type type;
  
  private DataType(final Type type) {
    this.type = type;
  }
  
  /** @return The value type of cells in a column of this type. */
  public Type valueType() {
    return type;
  }
  
  /**
   * @param type A non-null value type.
   * @return The column type or null if the value kind cannot be stored.
   */
  public static DataType fromType(final Type type) {
    for (final DataType dt : values()) {
      if (dt.type.kind() == type.kind()) {
        return dt;
      }
    }
    return null;
  }
}
