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
package net.pipeql.storage;

import java.util.List;

import net.pipeql.data.Table;
import net.pipeql.execute.Allocator;

/**
 * Reads series out of a store for the {@code from} source. Implementations
 * are handed to the executor as the {@link #DEPENDENCY} dependency.
 * 
 * @since 1.0
 */
public interface StorageReader {
  
  /** The key the reader is registered under in the executor dependencies. */
  public static final String DEPENDENCY = "storage.reader";
  
  /**
   * Reads one table per series with points in the range. Each table is 
   * keyed by {@code _start}, {@code _stop} and the series tags.
   * @param spec The non-null read request.
   * @param allocator The query's allocator to charge while building.
   * @return The tables in key order, possibly empty.
   * @throws net.pipeql.exceptions.QueryExecutionException if the read 
   * fails.
   */
  public List<Table> read(final ReadSpec spec, final Allocator allocator);
  
}
