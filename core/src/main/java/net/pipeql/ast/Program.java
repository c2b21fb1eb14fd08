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
package net.pipeql.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A parsed script.
 * 
 * @since 1.0
 */
public class Program extends Node {
  private final List<Statement> body;
  
  public Program(final List<Statement> body) {
    super(1, 1);
    this.body = ImmutableList.copyOf(body);
  }
  
  public List<Statement> body() {
    return body;
  }
}
