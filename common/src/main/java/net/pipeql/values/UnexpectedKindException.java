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

import net.pipeql.semantic.Kind;

/**
 * Thrown when a value accessor is called for the wrong variant. This is
 * a programming error and is fatal.
 * 
 * @since 1.0
 */
public class UnexpectedKindException extends IllegalStateException {
  private static final long serialVersionUID = 8417262361837491740L;

  /**
   * @param expected The kind the accessor reads.
   * @param actual The kind of the value.
   */
  public UnexpectedKindException(final Kind expected, final Kind actual) {
    super("unexpected kind: got \"" + actual.name().toLowerCase() 
        + "\" expected \"" + expected.name().toLowerCase() + "\"");
  }
}
