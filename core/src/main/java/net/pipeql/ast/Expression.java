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
import java.util.Map;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Expressions. Literals carry their parsed value, durations and times
 * in nanoseconds.
 * 
 * @since 1.0
 */
public abstract class Expression extends Node {

  protected Expression(final int line, final int column) {
    super(line, column);
  }
  
  public static class Identifier extends Expression {
    private final String name;
    
    public Identifier(final int line, final int column, final String name) {
      super(line, column);
      this.name = name;
    }
    
    public String name() {
      return name;
    }
  }
  
  public static class StringLiteral extends Expression {
    private final String value;
    
    public StringLiteral(final int line, final int column, final String value) {
      super(line, column);
      this.value = value;
    }
    
    public String value() {
      return value;
    }
  }
  
  public static class IntegerLiteral extends Expression {
    private final long value;
    
    public IntegerLiteral(final int line, final int column, final long value) {
      super(line, column);
      this.value = value;
    }
    
    public long value() {
      return value;
    }
  }
  
  public static class FloatLiteral extends Expression {
    private final double value;
    
    public FloatLiteral(final int line, final int column, final double value) {
      super(line, column);
      this.value = value;
    }
    
    public double value() {
      return value;
    }
  }
  
  public static class BooleanLiteral extends Expression {
    private final boolean value;
    
    public BooleanLiteral(final int line, final int column, final boolean value) {
      super(line, column);
      this.value = value;
    }
    
    public boolean value() {
      return value;
    }
  }
  
  public static class DurationLiteral extends Expression {
    private final long nanos;
    
    public DurationLiteral(final int line, final int column, final long nanos) {
      super(line, column);
      this.nanos = nanos;
    }
    
    public long nanos() {
      return nanos;
    }
  }
  
  public static class DateTimeLiteral extends Expression {
    private final long nanos;
    
    public DateTimeLiteral(final int line, final int column, final long nanos) {
      super(line, column);
      this.nanos = nanos;
    }
    
    /** @return Unix epoch nanoseconds. */
    public long nanos() {
      return nanos;
    }
  }
  
  public static class RegexpLiteral extends Expression {
    private final Pattern value;
    
    public RegexpLiteral(final int line, final int column, final Pattern value) {
      super(line, column);
      this.value = value;
    }
    
    public Pattern value() {
      return value;
    }
  }
  
  public static class ArrayExpression extends Expression {
    private final List<Expression> elements;
    
    public ArrayExpression(final int line, 
                           final int column, 
                           final List<Expression> elements) {
      super(line, column);
      this.elements = ImmutableList.copyOf(elements);
    }
    
    public List<Expression> elements() {
      return elements;
    }
  }
  
  /** An object literal or the keyword arguments of a call. */
  public static class ObjectExpression extends Expression {
    private final Map<String, Expression> properties;
    
    public ObjectExpression(final int line, 
                            final int column, 
                            final Map<String, Expression> properties) {
      super(line, column);
      this.properties = ImmutableMap.copyOf(properties);
    }
    
    public Map<String, Expression> properties() {
      return properties;
    }
  }
  
  public static class MemberExpression extends Expression {
    private final Expression object;
    private final String property;
    
    public MemberExpression(final int line, 
                            final int column, 
                            final Expression object, 
                            final String property) {
      super(line, column);
      this.object = object;
      this.property = property;
    }
    
    public Expression object() {
      return object;
    }
    
    public String property() {
      return property;
    }
  }
  
  public static class IndexExpression extends Expression {
    private final Expression array;
    private final Expression index;
    
    public IndexExpression(final int line, 
                           final int column, 
                           final Expression array, 
                           final Expression index) {
      super(line, column);
      this.array = array;
      this.index = index;
    }
    
    public Expression array() {
      return array;
    }
    
    public Expression index() {
      return index;
    }
  }
  
  public static class CallExpression extends Expression {
    private final Expression callee;
    private final ObjectExpression arguments;
    
    public CallExpression(final int line, 
                          final int column, 
                          final Expression callee, 
                          final ObjectExpression arguments) {
      super(line, column);
      this.callee = callee;
      this.arguments = arguments;
    }
    
    public Expression callee() {
      return callee;
    }
    
    public ObjectExpression arguments() {
      return arguments;
    }
  }
  
  /** {@code argument |> call} */
  public static class PipeExpression extends Expression {
    private final Expression argument;
    private final CallExpression call;
    
    public PipeExpression(final int line, 
                          final int column, 
                          final Expression argument, 
                          final CallExpression call) {
      super(line, column);
      this.argument = argument;
      this.call = call;
    }
    
    public Expression argument() {
      return argument;
    }
    
    public CallExpression call() {
      return call;
    }
  }
  
  public static class BinaryExpression extends Expression {
    private final Operator operator;
    private final Expression left;
    private final Expression right;
    
    public BinaryExpression(final int line, 
                            final int column, 
                            final Operator operator,
                            final Expression left, 
                            final Expression right) {
      super(line, column);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }
    
    public Operator operator() {
      return operator;
    }
    
    public Expression left() {
      return left;
    }
    
    public Expression right() {
      return right;
    }
  }
  
  /** {@code and} and {@code or}, evaluated with short circuit. */
  public static class LogicalExpression extends BinaryExpression {
    
    public LogicalExpression(final int line, 
                             final int column, 
                             final Operator operator,
                             final Expression left, 
                             final Expression right) {
      super(line, column, operator, left, right);
    }
  }
  
  public static class UnaryExpression extends Expression {
    private final Operator operator;
    private final Expression argument;
    
    public UnaryExpression(final int line, 
                           final int column, 
                           final Operator operator, 
                           final Expression argument) {
      super(line, column);
      this.operator = operator;
      this.argument = argument;
    }
    
    public Operator operator() {
      return operator;
    }
    
    public Expression argument() {
      return argument;
    }
  }
  
  /** A parameter of a function literal. */
  public static class Parameter {
    private final String name;
    private final Expression default_value;
    private final boolean pipe;
    
    /**
     * @param name The non-null name.
     * @param default_value An optional default.
     * @param pipe Whether the parameter receives the piped value 
     * ({@code name=<-}).
     */
    public Parameter(final String name, 
                     final Expression default_value, 
                     final boolean pipe) {
      this.name = name;
      this.default_value = default_value;
      this.pipe = pipe;
    }
    
    public String name() {
      return name;
    }
    
    public Expression defaultValue() {
      return default_value;
    }
    
    public boolean isPipe() {
      return pipe;
    }
  }
  
  /** {@code (params) => body}. The body is an expression or a block. */
  public static class FunctionExpression extends Expression {
    private final List<Parameter> params;
    private final Node body;
    private final String source;
    
    public FunctionExpression(final int line, 
                              final int column, 
                              final List<Parameter> params, 
                              final Node body,
                              final String source) {
      super(line, column);
      this.params = ImmutableList.copyOf(params);
      this.body = body;
      this.source = source;
    }
    
    public List<Parameter> params() {
      return params;
    }
    
    /** @return An {@link Expression} or a {@link Statement.Block}. */
    public Node body() {
      return body;
    }
    
    /** @return The literal text of the function in the script. */
    public String source() {
      return source;
    }
  }
}
