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
 * Thrown when a script fails to parse or evaluate into a query spec,
 * e.g. an undeclared identifier, a bad argument type or an unused 
 * argument.
 * 
 * @since 1.0
 */
public class CompileException extends QueryExecutionException {
  private static final long serialVersionUID = -4617356823617541982L;

  /**
   * @param msg A non-null message to be given.
   */
  public CompileException(final String msg) {
    super(msg, 400);
  }
  
  /**
   * @param msg A non-null message to be given.
   * @param t The cause.
   */
  public CompileException(final String msg, final Throwable t) {
    super(msg, 400, t);
  }
}
