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
package net.pipeql.exceptions;

/**
 * Exception bubbled up when a query is canceled or its deadline passes.
 * 
 * @since 1.0
 */
public class QueryExecutionCanceled extends QueryExecutionException {
  private static final long serialVersionUID = -2225712915698705683L;

  /** Status for a caller cancellation. */
  public static final int CANCELED = 499;
  
  /** Status for an elapsed deadline. */
  public static final int DEADLINE_EXCEEDED = 504;
  
  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   */
  public QueryExecutionCanceled(final String msg, final int status_code) {
    super(msg, status_code);
  }
  
  /**
   * Ctor that sets a descriptive message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionCanceled(final String msg, 
                                final int status_code, 
                                final Throwable t) {
    super(msg, status_code, t);
  }

  /** @return True if this was raised by an elapsed deadline. */
  public boolean isDeadlineExceeded() {
    return status_code == DEADLINE_EXCEEDED;
  }
}
