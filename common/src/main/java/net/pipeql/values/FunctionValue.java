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
package net.pipeql.values;

/**
 * A callable value.
 * 
 * @since 1.0
 */
public interface FunctionValue extends Value {

  /**
   * Invokes the function with keyword arguments. The piped value, if
   * any, is present under the signature's pipe argument name.
   * 
   * @param args A non-null object of arguments.
   * @return The non-null result.
   * @throws net.pipeql.exceptions.QueryExecutionException on bad 
   * arguments or a failure in the body.
   */
  public Value call(final ObjectValue args);
  
  /** @return Whether or not calls are recorded as side effects. */
  public boolean hasSideEffect();
  
}
