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
 * Statements of a program or function block.
 * 
 * @since 1.0
 */
public abstract class Statement extends Node {

  protected Statement(final int line, final int column) {
    super(line, column);
  }
  
  /** {@code option name = init} */
  public static class Option extends Statement {
    private final String name;
    private final Expression init;
    
    public Option(final int line, final int column, 
                  final String name, final Expression init) {
      super(line, column);
      this.name = name;
      this.init = init;
    }
    
    public String name() {
      return name;
    }
    
    public Expression init() {
      return init;
    }
  }
  
  /** {@code name = init} */
  public static class Variable extends Statement {
    private final String name;
    private final Expression init;
    
    public Variable(final int line, final int column, 
                    final String name, final Expression init) {
      super(line, column);
      this.name = name;
      this.init = init;
    }
    
    public String name() {
      return name;
    }
    
    public Expression init() {
      return init;
    }
  }
  
  /** A bare expression. */
  public static class ExpressionStatement extends Statement {
    private final Expression expression;
    
    public ExpressionStatement(final Expression expression) {
      super(expression.line(), expression.column());
      this.expression = expression;
    }
    
    public Expression expression() {
      return expression;
    }
  }
  
  /** {@code return argument}, only valid in a function block. */
  public static class Return extends Statement {
    private final Expression argument;
    
    public Return(final int line, final int column, final Expression argument) {
      super(line, column);
      this.argument = argument;
    }
    
    public Expression argument() {
      return argument;
    }
  }
  
  /** A function body in braces. */
  public static class Block extends Statement {
    private final List<Statement> body;
    
    public Block(final int line, final int column, final List<Statement> body) {
      super(line, column);
      this.body = ImmutableList.copyOf(body);
    }
    
    public List<Statement> body() {
      return body;
    }
  }
}
