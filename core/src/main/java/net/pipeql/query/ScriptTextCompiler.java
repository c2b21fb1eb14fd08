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

import java.time.Instant;

import net.pipeql.utils.DateTime;

/**
 * A compiler for a request carrying script text. The script is compiled
 * when the request is served.
 * 
 * @since 1.0
 */
public class ScriptTextCompiler implements QueryCompiler {
  private final String script;
  private final Instant now;
  
  /**
   * @param script The non-null script.
   * @param now The evaluation time or null to use the time the request
   * is compiled.
   */
  public ScriptTextCompiler(final String script, final Instant now) {
    if (script == null) {
      throw new IllegalArgumentException("Script cannot be null.");
    }
    this.script = script;
    this.now = now;
  }
  
  public String script() {
    return script;
  }
  
  @Override
  public Spec compile(final QueryContext context, 
                      final ScriptCompiler compiler) {
    return compiler.compile(context, script, now != null ? now : 
        Instant.ofEpochMilli(DateTime.currentTimeMillis()));
  }
}
