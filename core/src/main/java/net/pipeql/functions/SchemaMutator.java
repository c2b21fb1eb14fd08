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
package net.pipeql.functions;

/**
 * Rewrites the schema of a table in a {@link BuilderContext}.
 * 
 * @since 1.0
 */
public interface SchemaMutator {
  
  /**
   * @param context The non-null context to rewrite.
   * @throws net.pipeql.exceptions.QueryExecutionException if the mutation
   * references missing columns or its function fails.
   */
  public void mutate(final BuilderContext context);
  
}
