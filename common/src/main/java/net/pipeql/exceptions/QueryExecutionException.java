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

import java.util.Collections;
import java.util.List;

/**
 * High level exception that should be thrown by any portion of a query 
 * pipeline to bubble up to the end user. The status code follows HTTP
 * semantics, e.g. 400 for a bad script and 500 for a runtime failure.
 * 
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = 6338254902243113267L;

  /** A status code associated with the exception. */
  protected final int status_code;
  
  /** An optional list of exceptions thrown. */
  protected final List<Throwable> exceptions;
  
  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, (Throwable) null);
  }
  
  /**
   * Ctor that sets a descriptive message, status code and the list of 
   * exceptions that caused this one.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param exceptions An optional list of exceptions. May be null or empty.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code,
                                 final List<Throwable> exceptions) {
    super(msg);
    this.status_code = status_code;
    this.exceptions = exceptions;
  }
  
  /**
   * Ctor that sets a descriptive message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code,
                                 final Throwable t) {
    super(msg, t);
    this.status_code = status_code;
    exceptions = null;
  }
  
  /** @return A status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return A list of exceptions that triggered this or an empty list. */
  public List<Throwable> getExceptions() {
    return exceptions == null ? Collections.<Throwable>emptyList() : 
      Collections.<Throwable>unmodifiableList(exceptions);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (exceptions != null) {
      buf.append(" subExceptions[");
      for (int i = 0; i < exceptions.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(exceptions.get(i).toString());
      }
      buf.append("]");
    }
    return buf.toString();
  }
}
