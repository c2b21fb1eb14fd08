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

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.pipeql.data.GroupKey;
import net.pipeql.data.Table;
import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.Result;

/**
 * Collects the tables of one named result. The deferred is called back
 * with this result when the producing dataset finishes, or with the 
 * error it finished with.
 * 
 * @since 1.0
 */
public class ExecutionResult implements Result, Transformation {
  private final String name;
  private final List<Table> tables;
  private final Deferred<Result> deferred;
  private volatile boolean finished;
  
  public ExecutionResult(final String name) {
    this.name = name;
    tables = Lists.newArrayList();
    deferred = new Deferred<Result>();
  }
  
  @Override
  public String name() {
    return name;
  }
  
  @Override
  public synchronized List<Table> tables() {
    return ImmutableList.copyOf(tables);
  }
  
  /** @return Called back once the result is complete. */
  public Deferred<Result> deferred() {
    return deferred;
  }
  
  public boolean isFinished() {
    return finished;
  }
  
  @Override
  public synchronized void retractTable(final DatasetID id, final GroupKey key) {
    final Iterator<Table> iterator = tables.iterator();
    while (iterator.hasNext()) {
      if (iterator.next().key().equals(key)) {
        iterator.remove();
      }
    }
  }
  
  @Override
  public synchronized void process(final DatasetID id, final Table table) {
    tables.add(table);
  }
  
  @Override
  public void updateWatermark(final DatasetID id, final long time) {
    // nothing buffered by time.
  }
  
  @Override
  public void updateProcessingTime(final DatasetID id, final long time) {
    // nothing buffered by time.
  }
  
  @Override
  public void finish(final DatasetID id, final Throwable error) {
    synchronized (this) {
      if (finished) {
        return;
      }
      finished = true;
    }
    if (error == null) {
      deferred.callback(this);
    } else if (error instanceof Exception) {
      deferred.callback(error);
    } else {
      deferred.callback(new QueryExecutionException(error.getMessage(), 500, 
          error));
    }
  }
  
  @Override
  public String toString() {
    return "result(" + name + ")";
  }
}
