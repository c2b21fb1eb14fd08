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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.pipeql.exceptions.QueryExecutionException;
import net.pipeql.query.AsyncQueryService;
import net.pipeql.query.Query;
import net.pipeql.query.QueryContext;
import net.pipeql.query.Request;
import net.pipeql.query.Result;
import net.pipeql.query.ResultIterator;

public class TestQueryServiceBridge {
  private AsyncQueryService service;
  private Query query;
  private Request request;

  @Before
  public void before() throws Exception {
    service = mock(AsyncQueryService.class);
    query = mock(Query.class);
    request = mock(Request.class);
    when(service.query(any(QueryContext.class), any(Request.class)))
        .thenReturn(query);
  }

  @Test
  public void ctor() throws Exception {
    try {
      new QueryServiceBridge(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void results() throws Exception {
    final Result a = mock(Result.class);
    final Result b = mock(Result.class);
    final Map<String, Result> results = Maps.newLinkedHashMap();
    results.put("a", a);
    results.put("b", b);
    when(query.ready()).thenReturn(Deferred.fromResult(results));

    final ResultIterator iterator = new QueryServiceBridge(service)
        .query(QueryContext.background(), request);
    assertTrue(iterator.more());
    assertSame(a, iterator.next());
    assertTrue(iterator.more());
    assertSame(b, iterator.next());
    verify(query, times(0)).done();

    assertFalse(iterator.more());
    assertFalse(iterator.more());
    assertNull(iterator.err());
    verify(query, times(1)).done();
    try {
      iterator.next();
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }
  }

  @Test
  public void noResults() throws Exception {
    when(query.ready()).thenReturn(
        Deferred.fromResult(Maps.<String, Result>newHashMap()));
    final ResultIterator iterator = new QueryServiceBridge(service)
        .query(QueryContext.background(), request);
    assertFalse(iterator.more());
    assertNull(iterator.err());
    verify(query, times(1)).done();
  }

  @Test
  public void error() throws Exception {
    final QueryExecutionException ex =
        new QueryExecutionException("boom", 500);
    when(query.ready()).thenReturn(
        Deferred.<Map<String, Result>>fromError(ex));
    final ResultIterator iterator = new QueryServiceBridge(service)
        .query(QueryContext.background(), request);
    assertFalse(iterator.more());
    assertSame(ex, iterator.err());
    verify(query, times(1)).done();
  }

  @Test
  public void cancel() throws Exception {
    when(query.ready()).thenReturn(new Deferred<Map<String, Result>>());
    final ResultIterator iterator = new QueryServiceBridge(service)
        .query(QueryContext.background(), request);
    iterator.cancel();
    iterator.cancel();
    verify(query, times(2)).cancel();
    verify(query, times(1)).done();
    assertFalse(iterator.more());
    assertEquals(null, iterator.err());
  }
}
