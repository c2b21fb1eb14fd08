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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.pipeql.exceptions.CompileException;
import net.pipeql.query.IDer;
import net.pipeql.query.IDerOperationSpec;
import net.pipeql.query.TableObject;

/**
 * Inner joins two named table streams on equal values of the {@code on}
 * columns, within each group key. The names are only known as table 
 * objects until the operations are given IDs.
 * 
 * @since 1.0
 */
public class JoinOpSpec implements IDerOperationSpec {
  public static final String KIND = "join";
  
  private final List<String> on;
  
  /** Operation ID to the name of its table. */
  private final Map<String, String> table_names;
  
  /** Name to table, only set when built from a script. */
  private final Map<String, TableObject> tables;
  
  /**
   * @param tables The non-null tables by name, exactly two.
   * @param on The non-empty columns to join on.
   */
  public JoinOpSpec(final Map<String, TableObject> tables, 
                    final List<String> on) {
    if (tables == null || tables.size() != 2) {
      throw new CompileException("join requires exactly two tables");
    }
    checkOn(on);
    this.on = ImmutableList.copyOf(on);
    this.tables = Maps.newTreeMap();
    this.tables.putAll(tables);
    table_names = Maps.newTreeMap();
  }
  
  @JsonCreator
  public JoinOpSpec(@JsonProperty("on") final List<String> on, 
      @JsonProperty("table_names") final Map<String, String> table_names) {
    if (table_names == null || table_names.size() != 2) {
      throw new CompileException("join requires exactly two tables");
    }
    checkOn(on);
    this.on = ImmutableList.copyOf(on);
    this.table_names = Maps.newTreeMap();
    this.table_names.putAll(table_names);
    tables = null;
  }
  
  @Override
  public String kind() {
    return KIND;
  }
  
  @JsonProperty("on")
  public List<String> on() {
    return on;
  }
  
  @JsonProperty("table_names")
  public Map<String, String> tableNames() {
    return table_names;
  }
  
  @Override
  public void idOperations(final IDer ider) {
    if (tables == null) {
      return;
    }
    for (final Map.Entry<String, TableObject> entry : tables.entrySet()) {
      table_names.put(ider.id(entry.getValue()), entry.getKey());
    }
  }
  
  private static void checkOn(final List<String> on) {
    if (on == null || on.isEmpty()) {
      throw new CompileException("join requires at least one column to "
          + "join on");
    }
  }
}
