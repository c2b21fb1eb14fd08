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

import java.util.concurrent.atomic.AtomicLong;

import net.pipeql.exceptions.QueryExecutionException;

/**
 * Tracks the bytes buffered by a query's table builders against a limit.
 * Thread safe.
 * 
 * @since 1.0
 */
public class Allocator {
  /** Status code when a query exceeds its memory limit. */
  public static final int LIMIT_EXCEEDED = 413;
  
  public static final int BOOL_SIZE = 1;
  public static final int INT64_SIZE = 8;
  public static final int FLOAT64_SIZE = 8;
  
  private final long limit;
  private final AtomicLong allocated;
  private final AtomicLong max_allocated;
  
  /** @param limit The max bytes, zero or less for unlimited. */
  public Allocator(final long limit) {
    this.limit = limit;
    allocated = new AtomicLong();
    max_allocated = new AtomicLong();
  }
  
  /**
   * Accounts for the bytes.
   * @param bytes The number of bytes, may be negative to release.
   * @throws QueryExecutionException if the limit would be exceeded.
   */
  public void account(final long bytes) {
    final long total = allocated.addAndGet(bytes);
    if (limit > 0 && bytes > 0 && total > limit) {
      allocated.addAndGet(-bytes);
      throw new QueryExecutionException("query exceeded the memory limit of " 
          + limit + " bytes", LIMIT_EXCEEDED);
    }
    long max = max_allocated.get();
    while (total > max && !max_allocated.compareAndSet(max, total)) {
      max = max_allocated.get();
    }
  }
  
  /** Releases bytes. */
  public void free(final long bytes) {
    account(-bytes);
  }
  
  /** @return The bytes currently accounted for. */
  public long allocated() {
    return allocated.get();
  }
  
  /** @return The high water mark. */
  public long maxAllocated() {
    return max_allocated.get();
  }
  
  public long limit() {
    return limit;
  }
  
  /** @return The bytes charged for a string. */
  public static long stringSize(final String s) {
    return s == null ? 0 : 16 + s.length() * 2L;
  }
}
