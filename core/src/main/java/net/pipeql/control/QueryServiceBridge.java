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
package net.pipeql.control;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.AsyncQueryService;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.QueryService;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.ResultIterator;

/**
 * Exposes an {@link AsyncQueryService} as a blocking 
 * {@link QueryService}.
 * 
 * @since 1.0
 */
public class QueryServiceBridge implements QueryService {
  private final AsyncQueryService service;
  
  public QueryServiceBridge(final AsyncQueryService service) {
    if (service == null) {
      throw new IllegalArgumentException("Service cannot be null.");
    }
    this.service = service;
  }
  
  @Override
  public ResultIterator query(final QueryContext context, 
                              final Request request) {
    return new BridgedIterator(service.query(context, request));
  }
  
  /** Waits on the query the first time results are requested. */
  static class BridgedIterator implements ResultIterator {
    private final Query query;
    private Iterator<Result> iterator;
    private Throwable error;
    private boolean released;
    
    BridgedIterator(final Query query) {
      this.query = query;
    }
    
    @Override
    public synchronized boolean more() {
      if (released) {
        return iterator != null && iterator.hasNext();
      }
      if (iterator == null) {
        try {
          final Map<String, Result> results = query.ready().join();
          iterator = results.values().iterator();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          error = new QueryExecutionException("interrupted waiting on "
              + "query results", 500, e);
          query.cancel();
        } catch (Exception e) {
          error = e;
        }
      }
      if (iterator != null && iterator.hasNext()) {
        return true;
      }
      release();
      return false;
    }
    
    @Override
    public synchronized Result next() {
      if (iterator == null || !iterator.hasNext()) {
        throw new NoSuchElementException("No more results.");
      }
      return iterator.next();
    }
    
    @Override
    public synchronized Throwable err() {
      return error;
    }
    
    @Override
    public void cancel() {
      // unblocks a waiting more() before taking the lock
      query.cancel();
      synchronized (this) {
        release();
      }
    }
    
    private void release() {
      if (!released) {
        released = true;
        query.done();
      }
    }
  }
}
