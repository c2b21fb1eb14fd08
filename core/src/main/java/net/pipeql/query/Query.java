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

import java.util.Map;

import com.stumbleupon.async.Deferred;

/**
 * A query submitted to an {@link AsyncQueryService}. Callers must call
 * {@link #done()} once they are finished with the results, whether the
 * query succeeded, failed or was cancelled.
 * 
 * @since 1.0
 */
public interface Query {

  /**
   * Returns a new deferred for the outcome. Every call gets its own 
   * deferred so callers may attach callbacks independently.
   * @return A deferred called back with the results by yield name or 
   * with the query's error.
   */
  public Deferred<Map<String, Result>> ready();
  
  /** @return The error the query failed with, null while running or on
   * success. */
  public Throwable err();
  
  /** Cancels the query if it has not completed. Idempotent. */
  public void cancel();
  
  /** Releases the query's resources. Idempotent. */
  public void done();
  
  /** @return Statistics so far. Complete once {@link #done()} is called. */
  public Statistics statistics();
  
}
