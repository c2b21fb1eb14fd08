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

/**
 * Base of the syntax tree. Every node records where it started in the
 * script for error messages.
 * 
 * @since 1.0
 */
public abstract class Node {
  /** 1 based line. */
  protected final int line;
  
  /** 1 based column. */
  protected final int column;
  
  protected Node(final int line, final int column) {
    this.line = line;
    this.column = column;
  }
  
  public int line() {
    return line;
  }
  
  public int column() {
    return column;
  }
  
  /** @return The position as {@code line:column}. */
  public String position() {
    return line + ":" + column;
  }
}
