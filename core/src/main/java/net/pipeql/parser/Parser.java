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
package net.pipeql.parser;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.pipeql.ast.Expression;
import net.pipeql.ast.Node;
import net.pipeql.ast.Operator;
import net.pipeql.ast.Program;
import net.pipeql.ast.Statement;
import net.pipeql.exceptions.CompileException;
import net.pipeql.utils.DateTime;

/**
 * Recursive descent parser for the pipe language. Precedence from 
 * lowest to highest:
 * <ol>
 * <li>{@code or}</li>
 * <li>{@code and}</li>
 * <li>{@code not}</li>
 * <li>comparison: {@code == != < <= > >= =~ !~}</li>
 * <li>additive: {@code + -}</li>
 * <li>multiplicative: {@code * /}</li>
 * <li>pipe: {@code |>}</li>
 * <li>unary: {@code - +}</li>
 * <li>postfix: call, member and index access</li>
 * </ol>
 * 
 * @since 1.0
 */
public class Parser {

  private final String source;
  private final List<Token> tokens;
  private int idx;
  
  private Parser(final String source) {
    this.source = source;
    tokens = Lexer.tokenize(source);
  }
  
  /**
   * Parses the script.
   * @param source A non-null script.
   * @return The program.
   * @throws CompileException on a syntax error.
   */
  public static Program parse(final String source) {
    final Parser parser = new Parser(source);
    final List<Statement> body = Lists.newArrayList();
    while (parser.peek().type != Token.Type.EOF) {
      body.add(parser.statement(false));
    }
    return new Program(body);
  }
  
  private Statement statement(final boolean in_block) {
    final Token t = peek();
    switch (t.type) {
    case OPTION:
      next();
      final Token name = expect(Token.Type.IDENT);
      expect(Token.Type.ASSIGN);
      return new Statement.Option(t.line, t.column, name.text, expression());
    case RETURN:
      if (!in_block) {
        throw error(t, "return is only valid in a function block");
      }
      next();
      return new Statement.Return(t.line, t.column, expression());
    case IDENT:
      if (peek(1).type == Token.Type.ASSIGN) {
        next();
        next();
        return new Statement.Variable(t.line, t.column, t.text, expression());
      }
      break;
    default:
      break;
    }
    return new Statement.ExpressionStatement(expression());
  }
  
  private Expression expression() {
    return logicalOr();
  }
  
  private Expression logicalOr() {
    Expression left = logicalAnd();
    while (peek().type == Token.Type.OR) {
      final Token op = next();
      left = new Expression.LogicalExpression(op.line, op.column, 
          Operator.OR, left, logicalAnd());
    }
    return left;
  }
  
  private Expression logicalAnd() {
    Expression left = logicalNot();
    while (peek().type == Token.Type.AND) {
      final Token op = next();
      left = new Expression.LogicalExpression(op.line, op.column, 
          Operator.AND, left, logicalNot());
    }
    return left;
  }
  
  private Expression logicalNot() {
    if (peek().type == Token.Type.NOT) {
      final Token op = next();
      return new Expression.UnaryExpression(op.line, op.column, 
          Operator.NOT, logicalNot());
    }
    return comparison();
  }
  
  private Expression comparison() {
    Expression left = additive();
    while (true) {
      final Operator op;
      switch (peek().type) {
      case EQ:
        op = Operator.EQUAL;
        break;
      case NEQ:
        op = Operator.NOT_EQUAL;
        break;
      case LT:
        op = Operator.LESS_THAN;
        break;
      case LTE:
        op = Operator.LESS_THAN_EQUAL;
        break;
      case GT:
        op = Operator.GREATER_THAN;
        break;
      case GTE:
        op = Operator.GREATER_THAN_EQUAL;
        break;
      case REGEXEQ:
        op = Operator.REGEX_MATCH;
        break;
      case REGEXNEQ:
        op = Operator.REGEX_NOT_MATCH;
        break;
      default:
        return left;
      }
      final Token t = next();
      left = new Expression.BinaryExpression(t.line, t.column, op, left, 
          additive());
    }
  }
  
  private Expression additive() {
    Expression left = multiplicative();
    while (peek().type == Token.Type.ADD || peek().type == Token.Type.SUB) {
      final Token t = next();
      left = new Expression.BinaryExpression(t.line, t.column, 
          t.type == Token.Type.ADD ? Operator.ADD : Operator.SUBTRACT, 
          left, multiplicative());
    }
    return left;
  }
  
  private Expression multiplicative() {
    Expression left = pipe();
    while (peek().type == Token.Type.MUL || peek().type == Token.Type.DIV) {
      final Token t = next();
      left = new Expression.BinaryExpression(t.line, t.column, 
          t.type == Token.Type.MUL ? Operator.MULTIPLY : Operator.DIVIDE, 
          left, pipe());
    }
    return left;
  }
  
  private Expression pipe() {
    Expression left = unary();
    while (peek().type == Token.Type.PIPE_FORWARD) {
      final Token t = next();
      final Expression call = postfix();
      if (!(call instanceof Expression.CallExpression)) {
        throw error(t, "pipe destination must be a function call");
      }
      left = new Expression.PipeExpression(t.line, t.column, left, 
          (Expression.CallExpression) call);
    }
    return left;
  }
  
  private Expression unary() {
    final Token t = peek();
    if (t.type == Token.Type.SUB || t.type == Token.Type.ADD) {
      next();
      final Expression argument = unary();
      return new Expression.UnaryExpression(t.line, t.column, 
          t.type == Token.Type.SUB ? Operator.SUBTRACT : Operator.ADD, 
          argument);
    }
    return postfix();
  }
  
  private Expression postfix() {
    Expression expr = primary();
    while (true) {
      final Token t = peek();
      if (t.type == Token.Type.LPAREN) {
        next();
        final Expression.ObjectExpression args = properties(t, 
            Token.Type.RPAREN);
        expr = new Expression.CallExpression(t.line, t.column, expr, args);
      } else if (t.type == Token.Type.DOT) {
        next();
        final Token name = expect(Token.Type.IDENT);
        expr = new Expression.MemberExpression(t.line, t.column, expr, 
            name.text);
      } else if (t.type == Token.Type.LBRACK) {
        next();
        final Expression index = expression();
        expect(Token.Type.RBRACK);
        if (index instanceof Expression.StringLiteral) {
          expr = new Expression.MemberExpression(t.line, t.column, expr, 
              ((Expression.StringLiteral) index).value());
        } else {
          expr = new Expression.IndexExpression(t.line, t.column, expr, index);
        }
      } else {
        return expr;
      }
    }
  }
  
  private Expression primary() {
    final Token t = peek();
    switch (t.type) {
    case IDENT:
      next();
      return new Expression.Identifier(t.line, t.column, t.text);
    case INT:
      next();
      try {
        return new Expression.IntegerLiteral(t.line, t.column, 
            Long.parseLong(t.text));
      } catch (NumberFormatException e) {
        throw error(t, "integer literal out of range: " + t.text);
      }
    case FLOAT:
      next();
      return new Expression.FloatLiteral(t.line, t.column, 
          Double.parseDouble(t.text));
    case STRING:
      next();
      return new Expression.StringLiteral(t.line, t.column, t.text);
    case TRUE:
    case FALSE:
      next();
      return new Expression.BooleanLiteral(t.line, t.column, 
          t.type == Token.Type.TRUE);
    case DURATION:
      next();
      try {
        return new Expression.DurationLiteral(t.line, t.column, 
            DateTime.parseDuration(t.text));
      } catch (IllegalArgumentException e) {
        throw error(t, e.getMessage());
      }
    case TIME:
      next();
      try {
        return new Expression.DateTimeLiteral(t.line, t.column, 
            DateTime.parseDateTime(t.text));
      } catch (IllegalArgumentException e) {
        throw error(t, e.getMessage());
      }
    case REGEX:
      next();
      try {
        return new Expression.RegexpLiteral(t.line, t.column, 
            Pattern.compile(t.text));
      } catch (PatternSyntaxException e) {
        throw error(t, "invalid regular expression: " + e.getDescription());
      }
    case LBRACK:
      next();
      final List<Expression> elements = Lists.newArrayList();
      while (peek().type != Token.Type.RBRACK) {
        elements.add(expression());
        if (peek().type != Token.Type.COMMA) {
          break;
        }
        next();
      }
      expect(Token.Type.RBRACK);
      return new Expression.ArrayExpression(t.line, t.column, elements);
    case LBRACE:
      next();
      return properties(t, Token.Type.RBRACE);
    case LPAREN:
      if (isFunctionStart()) {
        return function();
      }
      next();
      final Expression inner = expression();
      expect(Token.Type.RPAREN);
      return inner;
    default:
      throw error(t, "unexpected token " + t);
    }
  }
  
  /** Parses {@code key: expr, ...} up to the closing token. */
  private Expression.ObjectExpression properties(final Token open, 
                                                 final Token.Type close) {
    final Map<String, Expression> properties = Maps.newLinkedHashMap();
    while (peek().type != close) {
      final Token key = next();
      if (key.type != Token.Type.IDENT && key.type != Token.Type.STRING) {
        throw error(key, "expected a property name but got " + key);
      }
      expect(Token.Type.COLON);
      if (properties.put(key.text, expression()) != null) {
        throw error(key, "duplicate property \"" + key.text + "\"");
      }
      if (peek().type != Token.Type.COMMA) {
        break;
      }
      next();
    }
    expect(close);
    return new Expression.ObjectExpression(open.line, open.column, properties);
  }
  
  /** Scans to the matching paren and checks for a following arrow. */
  private boolean isFunctionStart() {
    int depth = 0;
    for (int i = idx; i < tokens.size(); i++) {
      final Token.Type type = tokens.get(i).type;
      if (type == Token.Type.LPAREN) {
        depth++;
      } else if (type == Token.Type.RPAREN) {
        depth--;
        if (depth == 0) {
          return i + 1 < tokens.size() 
              && tokens.get(i + 1).type == Token.Type.ARROW;
        }
      } else if (type == Token.Type.EOF) {
        return false;
      }
    }
    return false;
  }
  
  private Expression function() {
    final Token open = expect(Token.Type.LPAREN);
    final List<Expression.Parameter> params = Lists.newArrayList();
    while (peek().type != Token.Type.RPAREN) {
      final Token name = expect(Token.Type.IDENT);
      Expression default_value = null;
      boolean pipe = false;
      if (peek().type == Token.Type.ASSIGN) {
        next();
        if (peek().type == Token.Type.PIPE_RECEIVE) {
          next();
          pipe = true;
        } else {
          default_value = expression();
        }
      }
      params.add(new Expression.Parameter(name.text, default_value, pipe));
      if (peek().type != Token.Type.COMMA) {
        break;
      }
      next();
    }
    expect(Token.Type.RPAREN);
    expect(Token.Type.ARROW);
    final Node body;
    if (peek().type == Token.Type.LBRACE) {
      final Token brace = next();
      final List<Statement> statements = Lists.newArrayList();
      while (peek().type != Token.Type.RBRACE) {
        if (peek().type == Token.Type.EOF) {
          throw error(peek(), "unterminated function block");
        }
        statements.add(statement(true));
      }
      next();
      body = new Statement.Block(brace.line, brace.column, statements);
    } else {
      body = expression();
    }
    final int end = tokens.get(idx - 1).end;
    return new Expression.FunctionExpression(open.line, open.column, params, 
        body, source.substring(open.start, end));
  }
  
  private Token peek() {
    return tokens.get(idx);
  }
  
  private Token peek(final int ahead) {
    return tokens.get(Math.min(idx + ahead, tokens.size() - 1));
  }
  
  private Token next() {
    final Token t = tokens.get(idx);
    if (t.type != Token.Type.EOF) {
      idx++;
    }
    return t;
  }
  
  private Token expect(final Token.Type type) {
    final Token t = peek();
    if (t.type != type) {
      throw error(t, "expected " + type + " but got " + t);
    }
    return next();
  }
  
  private static CompileException error(final Token t, final String msg) {
    return new CompileException("error at " + t.line + ":" + t.column 
        + ": " + msg);
  }
}
