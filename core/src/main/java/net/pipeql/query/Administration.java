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
package net.pipeql.query;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.pipeql.exceptions.CompileException;
import net.pipeql.semantic.FunctionSignature;
import net.pipeql.values.Value;

/**
 * Collects the parents of the table object a builtin is about to create.
 * Parents are deduplicated by identity so a table passed twice yields a
 * single edge.
 * 
 * @since 1.0
 */
public class Administration {
  private final QueryArguments args;
  private final List<TableObject> parents;
  
  public Administration(final QueryArguments args) {
    this.args = args;
    parents = Lists.newArrayList();
  }
  
  /**
   * Adds the piped table argument, {@link FunctionSignature#TABLES_PARAM},
   * as a parent.
   * @param required Whether a missing table is an error.
   * @throws CompileException if required and missing or not a table.
   */
  public void addParentFromArgs(final boolean required) {
    final Value v = required ? args.getRequired(FunctionSignature.TABLES_PARAM) 
        : args.get(FunctionSignature.TABLES_PARAM);
    if (v == null) {
      return;
    }
    if (!(v instanceof TableObject)) {
      throw new CompileException("argument \"" 
          + FunctionSignature.TABLES_PARAM + "\" must be a table, got " 
          + v.type());
    }
    addParent((TableObject) v);
  }
  
  /**
   * Adds a parent if it was not already added.
   * @param parent A non-null table object.
   */
  public void addParent(final TableObject parent) {
    for (final TableObject extant : parents) {
      if (extant == parent) {
        return;
      }
    }
    parents.add(parent);
  }
  
  public List<TableObject> parents() {
    return Collections.unmodifiableList(parents);
  }
}
