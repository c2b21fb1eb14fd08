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
package net.pipeql.query;

/**
 * A query service that returns as soon as the query is submitted.
 * 
 * @since 1.0
 */
public interface AsyncQueryService {

  /**
   * Submits the request.
   * @param context The non-null context. Cancelling it cancels the query.
   * @param request The non-null request.
   * @return The submitted query.
   * @throws net.pipeql.exceptions.QueryExecutionException if the query 
   * could not be submitted.
   */
  public Query query(final QueryContext context, final Request request);
  
  /**
   * Compiles the script now, failing fast on compile errors, then 
   * submits it.
   * @param context The non-null context.
   * @param org The non-null organization.
   * @param script The non-null script.
   * @return The submitted query.
   * @throws net.pipeql.exceptions.CompileException if the script does 
   * not compile.
   */
  public Query queryWithCompile(final QueryContext context, 
                                final String org, 
                                final String script);
  
}
