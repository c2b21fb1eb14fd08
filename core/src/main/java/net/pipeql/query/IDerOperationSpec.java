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
 * An operation spec that refers to other table objects, e.g. a join's
 * named inputs, and needs their operation IDs once they are assigned.
 * 
 * @since 1.0
 */
public interface IDerOperationSpec extends OperationSpec {

  /**
   * Called once, after the IDs of all parents have been assigned.
   * @param ider A non-null IDer.
   */
  public void idOperations(final IDer ider);
  
}
