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
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;

/**
 * Describes where a procedure may push itself into an ancestor: the 
 * ancestor's kind, the kinds it may pass through on the way up, and an
 * optional predicate on the ancestor's spec.
 * 
 * @since 1.0
 */
public class PushDownRule {
  private final String root;
  private final List<String> through;
  private final Predicate<ProcedureSpec> match;
  
  /**
   * @param root The non-null root kind.
   * @param through Kinds that may sit between, may be null.
   * @param match A predicate on the root spec, null to always match.
   */
  public PushDownRule(final String root, 
                      final List<String> through, 
                      final Predicate<ProcedureSpec> match) {
    if (root == null) {
      throw new IllegalArgumentException("Root kind cannot be null.");
    }
    this.root = root;
    this.through = through == null ? ImmutableList.<String>of() 
        : ImmutableList.copyOf(through);
    this.match = match;
  }
  
  public String root() {
    return root;
  }
  
  public List<String> through() {
    return through;
  }
  
  /**
   * @param spec The candidate root spec.
   * @return Whether the push down applies.
   */
  public boolean matches(final ProcedureSpec spec) {
    return match == null || match.test(spec);
  }
}
