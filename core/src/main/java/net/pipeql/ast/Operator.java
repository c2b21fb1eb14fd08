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
 * Unary, binary and logical operators.
 * 
 * @since 1.0
 */
public enum Operator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS_THAN("<"),
  LESS_THAN_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_THAN_EQUAL(">="),
  REGEX_MATCH("=~"),
  REGEX_NOT_MATCH("!~"),
  AND("and"),
  OR("or"),
  NOT("not");
  
  private final String symbol;
  
  private Operator(final String symbol) {
    this.symbol = symbol;
  }
  
  public String symbol() {
    return symbol;
  }
}
