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
 * Iterates the results of a query. {@link #more()} blocks until the
 * query completes. Once it returns false {@link #err()} holds the 
 * error, if any, and the query's resources have been released.
 * 
 * @since 1.0
 */
public interface ResultIterator {

  /** @return Whether or not {@link #next()} has a result. */
  public boolean more();
  
  /** @return The next result. */
  public Result next();
  
  /** @return The query error or null. */
  public Throwable err();
  
  /** Cancels the query and releases its resources. */
  public void cancel();
  
}
