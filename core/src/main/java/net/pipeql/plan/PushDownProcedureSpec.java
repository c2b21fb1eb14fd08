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
package net.pipeql.plan;

import java.util.List;
import java.util.function.Supplier;

/**
 * A procedure that can merge itself into an ancestor, e.g. a range into 
 * a storage read.
 * 
 * @since 1.0
 */
public interface PushDownProcedureSpec extends ProcedureSpec {

  /** @return The rules, tried in order. */
  public List<PushDownRule> pushDownRules();
  
  /**
   * Merges this spec into the root. If the root cannot absorb it without
   * affecting other children, call {@code dup} and modify the returned
   * copy instead.
   * @param root The matched root procedure.
   * @param dup Duplicates the root for this branch of the plan.
   */
  public void pushDown(final Procedure root, final Supplier<Procedure> dup);
  
}
