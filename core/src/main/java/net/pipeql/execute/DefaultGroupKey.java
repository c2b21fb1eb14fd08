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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.pipeql.data.ColMeta;
import net.pipeql.data.GroupKey;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * An immutable group key.
 * 
 * @since 1.0
 */
public class DefaultGroupKey implements GroupKey {
  private final List<ColMeta> cols;
  private final List<Value> values;
  
  /**
   * @param cols The non-null key columns.
   * @param values The values, one per column.
   */
  public DefaultGroupKey(final List<ColMeta> cols, final List<Value> values) {
    if (cols == null || values == null) {
      throw new IllegalArgumentException("Columns and values cannot be null.");
    }
    if (cols.size() != values.size()) {
      throw new IllegalArgumentException("Key has " + cols.size() 
          + " columns but " + values.size() + " values.");
    }
    this.cols = ImmutableList.copyOf(cols);
    this.values = Collections.unmodifiableList(Lists.newArrayList(values));
  }
  
  @Override
  public List<ColMeta> cols() {
    return cols;
  }
  
  @Override
  public List<Value> values() {
    return values;
  }
  
  @Override
  public boolean hasCol(final String label) {
    return GroupKeys.colIdx(label, cols) >= 0;
  }
  
  @Override
  public Value labelValue(final String label) {
    final int idx = GroupKeys.colIdx(label, cols);
    return idx < 0 ? null : values.get(idx);
  }
  
  @Override
  public int compareTo(final GroupKey o) {
    final int n = Math.min(cols.size(), o.cols().size());
    for (int i = 0; i < n; i++) {
      final int c = ComparisonChain.start()
          .compare(cols.get(i).label(), o.cols().get(i).label())
          .compare(cols.get(i).type(), o.cols().get(i).type())
          .result();
      if (c != 0) {
        return c;
      }
      final int v = GroupKeys.compareValues(values.get(i), o.values().get(i));
      if (v != 0) {
        return v;
      }
    }
    return Integer.compare(cols.size(), o.cols().size());
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    final GroupKey other = (GroupKey) o;
    if (!cols.equals(other.cols())) {
      return false;
    }
    for (int i = 0; i < values.size(); i++) {
      if (!Values.equal(values.get(i), other.values().get(i))) {
        return false;
      }
    }
    return true;
  }
  
  @Override
  public int hashCode() {
    return cols.hashCode();
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    for (int i = 0; i < cols.size(); i++) {
      if (i > 0) {
        buf.append(",");
      }
      buf.append(cols.get(i).label())
         .append("=")
         .append(values.get(i));
    }
    return buf.append("}").toString();
  }
}
