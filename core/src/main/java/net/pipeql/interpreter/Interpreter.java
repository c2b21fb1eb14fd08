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
package net.pipeql.interpreter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.ast.Expression;
import net.pipeql.ast.Node;
import net.pipeql.ast.Operator;
import net.pipeql.ast.Program;
import net.pipeql.ast.Statement;
import net.pipeql.exceptions.CompileException;
import net.pipeql.semantic.FunctionType;
import net.pipeql.semantic.Kind;
import net.pipeql.semantic.Type;
import net.pipeql.semantic.Types;
import net.pipeql.values.ArrayValue;
import net.pipeql.values.FunctionValue;
import net.pipeql.values.ObjectValue;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Evaluates programs into values. Calls to functions marked with side
 * effects, and top level expression statements that evaluate to a 
 * table, are collected as side effects for the compiler to turn into a
 * query spec.
 * <p>
 * Not thread safe. Use one interpreter per compilation.
 * 
 * @since 1.0
 */
public class Interpreter {
  
  private final Map<String, Value> options;
  private final Scope globals;
  private final List<Value> side_effects;
  
  /**
   * Default ctor.
   * @param options Initial option values, copied. May be null.
   * @param globals The scope top level statements bind into, non-null.
   */
  public Interpreter(final Map<String, Value> options, final Scope globals) {
    if (globals == null) {
      throw new IllegalArgumentException("Globals cannot be null.");
    }
    this.options = options == null ? Maps.<String, Value>newLinkedHashMap() 
        : Maps.newLinkedHashMap(options);
    this.globals = globals;
    side_effects = Lists.newArrayList();
  }
  
  /**
   * Evaluates every statement of the program in order.
   * @param program A non-null program.
   * @throws CompileException on an evaluation error.
   */
  public void eval(final Program program) {
    for (final Statement statement : program.body()) {
      if (statement instanceof Statement.Return) {
        throw new CompileException("return is only valid in a function "
            + "block at " + statement.position());
      }
      execute(statement, globals, true);
    }
  }
  
  /**
   * @param name A non-null option name.
   * @return The value or null if not set.
   */
  public Value option(final String name) {
    return options.get(name);
  }
  
  public void setOption(final String name, final Value value) {
    options.put(name, value);
  }
  
  /** @return An unmodifiable view of the options. */
  public Map<String, Value> options() {
    return Collections.unmodifiableMap(options);
  }
  
  public Scope globalScope() {
    return globals;
  }
  
  /** @return The side effects in evaluation order. */
  public List<Value> sideEffects() {
    return Collections.unmodifiableList(side_effects);
  }
  
  /** @return The value of the statement, null for declarations. */
  Value execute(final Statement statement, 
                final Scope scope, 
                final boolean top_level) {
    if (statement instanceof Statement.Option) {
      final Statement.Option option = (Statement.Option) statement;
      options.put(option.name(), evaluate(option.init(), scope));
      return null;
    } else if (statement instanceof Statement.Variable) {
      final Statement.Variable variable = (Statement.Variable) statement;
      scope.set(variable.name(), evaluate(variable.init(), scope));
      return null;
    } else if (statement instanceof Statement.ExpressionStatement) {
      final Value v = evaluate(
          ((Statement.ExpressionStatement) statement).expression(), scope);
      if (top_level && v.type() == Types.TABLE) {
        addSideEffect(v);
      }
      return v;
    } else if (statement instanceof Statement.Return) {
      return evaluate(((Statement.Return) statement).argument(), scope);
    }
    throw new CompileException("unsupported statement at " 
        + statement.position());
  }
  
  /** Evaluates a function body, either an expression or a block. */
  Value evaluateBody(final Node body, final Scope scope) {
    if (body instanceof Expression) {
      return evaluate((Expression) body, scope);
    }
    for (final Statement statement : ((Statement.Block) body).body()) {
      final Value v = execute(statement, scope, false);
      if (statement instanceof Statement.Return) {
        return v;
      }
    }
    throw new CompileException("function block at " + body.position() 
        + " has no return statement");
  }
  
  Value evaluate(final Expression expr, final Scope scope) {
    if (expr instanceof Expression.Identifier) {
      final String name = ((Expression.Identifier) expr).name();
      Value v = scope.lookup(name);
      if (v == null) {
        v = options.get(name);
      }
      if (v == null) {
        throw new CompileException("undeclared identifier \"" + name 
            + "\" at " + expr.position());
      }
      return v;
    } else if (expr instanceof Expression.StringLiteral) {
      return Values.newString(((Expression.StringLiteral) expr).value());
    } else if (expr instanceof Expression.IntegerLiteral) {
      return Values.newInt(((Expression.IntegerLiteral) expr).value());
    } else if (expr instanceof Expression.FloatLiteral) {
      return Values.newFloat(((Expression.FloatLiteral) expr).value());
    } else if (expr instanceof Expression.BooleanLiteral) {
      return Values.newBool(((Expression.BooleanLiteral) expr).value());
    } else if (expr instanceof Expression.DurationLiteral) {
      return Values.newDuration(((Expression.DurationLiteral) expr).nanos());
    } else if (expr instanceof Expression.DateTimeLiteral) {
      return Values.newTime(((Expression.DateTimeLiteral) expr).nanos());
    } else if (expr instanceof Expression.RegexpLiteral) {
      return Values.newRegexp(((Expression.RegexpLiteral) expr).value());
    } else if (expr instanceof Expression.ArrayExpression) {
      return array((Expression.ArrayExpression) expr, scope);
    } else if (expr instanceof Expression.ObjectExpression) {
      return object((Expression.ObjectExpression) expr, scope);
    } else if (expr instanceof Expression.MemberExpression) {
      return member((Expression.MemberExpression) expr, scope);
    } else if (expr instanceof Expression.IndexExpression) {
      return index((Expression.IndexExpression) expr, scope);
    } else if (expr instanceof Expression.PipeExpression) {
      final Expression.PipeExpression pipe = (Expression.PipeExpression) expr;
      return call(pipe.call(), evaluate(pipe.argument(), scope), scope);
    } else if (expr instanceof Expression.CallExpression) {
      return call((Expression.CallExpression) expr, null, scope);
    } else if (expr instanceof Expression.LogicalExpression) {
      return logical((Expression.LogicalExpression) expr, scope);
    } else if (expr instanceof Expression.BinaryExpression) {
      final Expression.BinaryExpression binary = 
          (Expression.BinaryExpression) expr;
      return BinaryOperations.apply(binary.operator(), 
          evaluate(binary.left(), scope), 
          evaluate(binary.right(), scope), 
          binary.position());
    } else if (expr instanceof Expression.UnaryExpression) {
      return unary((Expression.UnaryExpression) expr, scope);
    } else if (expr instanceof Expression.FunctionExpression) {
      return new InterpretedFunction((Expression.FunctionExpression) expr, 
          scope, this);
    }
    throw new CompileException("unsupported expression at " + expr.position());
  }
  
  private Value array(final Expression.ArrayExpression expr, 
                      final Scope scope) {
    final List<Value> elements = 
        Lists.newArrayListWithCapacity(expr.elements().size());
    Type element_type = Types.ANY;
    for (final Expression element : expr.elements()) {
      final Value v = evaluate(element, scope);
      if (elements.isEmpty()) {
        element_type = v.type();
      } else if (element_type.kind() != v.type().kind()) {
        throw new CompileException("array elements must all be of kind " 
            + element_type.kind().name().toLowerCase() + " at " 
            + element.position());
      }
      elements.add(v);
    }
    return Values.newArray(element_type, elements);
  }
  
  private ObjectValue object(final Expression.ObjectExpression expr, 
                             final Scope scope) {
    final Map<String, Value> properties = Maps.newLinkedHashMap();
    for (final Map.Entry<String, Expression> entry : 
        expr.properties().entrySet()) {
      properties.put(entry.getKey(), evaluate(entry.getValue(), scope));
    }
    return Values.newObject(properties);
  }
  
  private Value member(final Expression.MemberExpression expr, 
                       final Scope scope) {
    final Value object = evaluate(expr.object(), scope);
    if (object.type().kind() != Kind.OBJECT) {
      throw new CompileException("cannot access property \"" 
          + expr.property() + "\" of a " 
          + object.type().kind().name().toLowerCase() + " at " 
          + expr.position());
    }
    final Value v = object.object().get(expr.property());
    if (v == null) {
      throw new CompileException("property \"" + expr.property() 
          + "\" not found at " + expr.position());
    }
    return v;
  }
  
  private Value index(final Expression.IndexExpression expr, 
                      final Scope scope) {
    final Value array = evaluate(expr.array(), scope);
    final Value index = evaluate(expr.index(), scope);
    if (array.type().kind() != Kind.ARRAY) {
      throw new CompileException("cannot index into a " 
          + array.type().kind().name().toLowerCase() + " at " 
          + expr.position());
    }
    if (index.type().kind() != Kind.INT) {
      throw new CompileException("array index must be an int at " 
          + expr.position());
    }
    final ArrayValue values = array.array();
    final long i = index.integer();
    if (i < 0 || i >= values.len()) {
      throw new CompileException("array index " + i + " out of bounds [0, " 
          + values.len() + ") at " + expr.position());
    }
    return values.get((int) i);
  }
  
  private Value call(final Expression.CallExpression expr, 
                     final Value piped, 
                     final Scope scope) {
    final Value callee = evaluate(expr.callee(), scope);
    if (callee.type().kind() != Kind.FUNCTION) {
      throw new CompileException("cannot call a " 
          + callee.type().kind().name().toLowerCase() + " at " 
          + expr.position());
    }
    final FunctionValue function = callee.function();
    final Map<String, Value> args = Maps.newLinkedHashMap();
    for (final Map.Entry<String, Expression> entry : 
        expr.arguments().properties().entrySet()) {
      args.put(entry.getKey(), evaluate(entry.getValue(), scope));
    }
    if (piped != null) {
      final String pipe_argument = 
          ((FunctionType) function.type()).signature().pipeArgument();
      if (pipe_argument == null) {
        throw new CompileException("function does not take a pipe argument "
            + "at " + expr.position());
      }
      if (args.containsKey(pipe_argument)) {
        throw new CompileException("pipe argument \"" + pipe_argument 
            + "\" was also passed explicitly at " + expr.position());
      }
      args.put(pipe_argument, piped);
    }
    final Value result;
    try {
      result = function.call(Values.newObject(args));
    } catch (CompileException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      throw new CompileException(e.getMessage() + " at " + expr.position(), e);
    }
    if (function.hasSideEffect()) {
      addSideEffect(result);
    }
    return result;
  }
  
  private Value logical(final Expression.LogicalExpression expr, 
                        final Scope scope) {
    final boolean left = bool(evaluate(expr.left(), scope), expr);
    if (expr.operator() == Operator.AND && !left) {
      return Values.newBool(false);
    }
    if (expr.operator() == Operator.OR && left) {
      return Values.newBool(true);
    }
    return Values.newBool(bool(evaluate(expr.right(), scope), expr));
  }
  
  private Value unary(final Expression.UnaryExpression expr, 
                      final Scope scope) {
    final Value v = evaluate(expr.argument(), scope);
    switch (expr.operator()) {
    case NOT:
      return Values.newBool(!bool(v, expr));
    case ADD:
      return v;
    case SUBTRACT:
      switch (v.type().kind()) {
      case INT:
        return Values.newInt(-v.integer());
      case FLOAT:
        return Values.newFloat(-v.floatValue());
      case DURATION:
        return Values.newDuration(-v.duration());
      default:
        break;
      }
      break;
    default:
      break;
    }
    throw new CompileException("invalid operand of kind " 
        + v.type().kind().name().toLowerCase() + " for unary " 
        + expr.operator().symbol() + " at " + expr.position());
  }
  
  private void addSideEffect(final Value v) {
    for (final Value extant : side_effects) {
      if (extant == v) {
        return;
      }
    }
    side_effects.add(v);
  }
  
  private static boolean bool(final Value v, final Node node) {
    if (v.type().kind() != Kind.BOOL) {
      throw new CompileException("expected a bool but got " 
          + v.type().kind().name().toLowerCase() + " at " + node.position());
    }
    return v.bool();
  }
}
