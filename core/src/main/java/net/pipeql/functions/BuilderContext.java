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

import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;

/**
 * The output schema of a table under construction by schema mutators: 
 * the columns, the key, and for each output column the input column it
 * copies.
 * 
 * @since 1.0
 */
public class BuilderContext {
  private List<ColMeta> cols;
  private GroupKey key;
  private List<Integer> col_map;
  
  public BuilderContext(final Table table) {
    cols = Lists.newArrayList(table.cols());
    key = table.key();
    col_map = Lists.newArrayListWithCapacity(cols.size());
    for (int i = 0; i < cols.size(); i++) {
      col_map.add(i);
    }
  }
  
  public List<ColMeta> cols() {
    return cols;
  }
  
  public GroupKey key() {
    return key;
  }
  
  /** @return The input column index of each output column. */
  public List<Integer> colMap() {
    return col_map;
  }
  
  void update(final List<ColMeta> cols, 
              final GroupKey key, 
              final List<Integer> col_map) {
    this.cols = cols;
    this.key = key;
    this.col_map = col_map;
  }
}
