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
package net.pipeql.utils;

import com.stumbleupon.async.DeferredGroupException;

import net.pipeql.exceptions.QueryExecutionException;

/**
 * Helpers for unwrapping and converting exceptions.
 * 
 * @since 1.0
 */
public class Exceptions {

  /**
   * Iterates through the causes of a deferred group exception looking for
   * the first one that isn't another group.
   * @param e A DeferredGroupException to parse
   * @return The root cause of the exception if found. 
   */
  public static Throwable getCause(final DeferredGroupException e) {
    Throwable ex = e;
    while (ex.getClass().equals(DeferredGroupException.class)) {
      if (ex.getCause() == null) {
        break;
      } else {
        ex = ex.getCause();
      }
    }
    return ex;
  }
  
  /**
   * Unwraps group exceptions and wraps anything that isn't already a 
   * {@link QueryExecutionException} in one with a 500 status.
   * @param t A non-null throwable.
   * @return A query exception.
   */
  public static QueryExecutionException toQueryException(final Throwable t) {
    final Throwable cause = t instanceof DeferredGroupException ? 
        getCause((DeferredGroupException) t) : t;
    if (cause instanceof QueryExecutionException) {
      return (QueryExecutionException) cause;
    }
    return new QueryExecutionException(String.valueOf(cause.getMessage()), 
        500, cause);
  }
}
