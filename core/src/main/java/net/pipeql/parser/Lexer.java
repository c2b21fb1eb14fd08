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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.pipeql.exceptions.CompileException;

/**
 * Splits a script into tokens. Whether a {@code /} starts a regular
 * expression or is a division is decided from the previous token.
 * 
 * @since 1.0
 */
public class Lexer {
  private static final Map<String, Token.Type> KEYWORDS = 
      ImmutableMap.<String, Token.Type>builder()
        .put("option", Token.Type.OPTION)
        .put("return", Token.Type.RETURN)
        .put("true", Token.Type.TRUE)
        .put("false", Token.Type.FALSE)
        .put("and", Token.Type.AND)
        .put("or", Token.Type.OR)
        .put("not", Token.Type.NOT)
        .build();
  
  private static final Pattern DATE_TIME = Pattern.compile(
      "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?(Z|[+-]\\d{2}:\\d{2})");
  
  private static final Pattern DURATION = Pattern.compile(
      "(\\d+(ns|us|µs|ms|s|m|h|d|w))+");
  
  private final String source;
  private final List<Token> tokens;
  private int pos;
  private int line;
  private int line_start;
  
  private Lexer(final String source) {
    this.source = source;
    tokens = Lists.newArrayList();
    line = 1;
  }
  
  /**
   * Tokenizes the script.
   * @param source A non-null script.
   * @return The tokens ending with an EOF token.
   * @throws CompileException on an invalid character or unterminated 
   * literal.
   */
  public static List<Token> tokenize(final String source) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    final Lexer lexer = new Lexer(source);
    lexer.run();
    return lexer.tokens;
  }
  
  private void run() {
    while (true) {
      skipWhitespaceAndComments();
      if (pos >= source.length()) {
        tokens.add(new Token(Token.Type.EOF, "", pos, pos, line, 
            pos - line_start + 1));
        return;
      }
      final char c = source.charAt(pos);
      if (Character.isLetter(c) || c == '_') {
        identifier();
      } else if (Character.isDigit(c)) {
        number();
      } else if (c == '"') {
        string();
      } else if (c == '/' && !previousEndsOperand()) {
        regex();
      } else {
        operator(c);
      }
    }
  }
  
  private void skipWhitespaceAndComments() {
    while (pos < source.length()) {
      final char c = source.charAt(pos);
      if (c == '\n') {
        pos++;
        line++;
        line_start = pos;
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '/' && pos + 1 < source.length() 
          && source.charAt(pos + 1) == '/') {
        while (pos < source.length() && source.charAt(pos) != '\n') {
          pos++;
        }
      } else {
        return;
      }
    }
  }
  
  private boolean previousEndsOperand() {
    return !tokens.isEmpty() && tokens.get(tokens.size() - 1).endsOperand();
  }
  
  private void identifier() {
    final int start = pos;
    while (pos < source.length() && (Character.isLetterOrDigit(
        source.charAt(pos)) || source.charAt(pos) == '_')) {
      pos++;
    }
    final String text = source.substring(start, pos);
    final Token.Type keyword = KEYWORDS.get(text);
    add(keyword == null ? Token.Type.IDENT : keyword, text, start);
  }
  
  private void number() {
    final int start = pos;
    Matcher matcher = DATE_TIME.matcher(source).region(pos, source.length());
    if (matcher.lookingAt()) {
      pos = matcher.end();
      add(Token.Type.TIME, source.substring(start, pos), start);
      return;
    }
    matcher = DURATION.matcher(source).region(pos, source.length());
    if (matcher.lookingAt() && (matcher.end() >= source.length() 
        || !Character.isLetterOrDigit(source.charAt(matcher.end())))) {
      pos = matcher.end();
      add(Token.Type.DURATION, source.substring(start, pos), start);
      return;
    }
    while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
      pos++;
    }
    if (pos + 1 < source.length() && source.charAt(pos) == '.' 
        && Character.isDigit(source.charAt(pos + 1))) {
      pos++;
      while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
        pos++;
      }
      add(Token.Type.FLOAT, source.substring(start, pos), start);
      return;
    }
    add(Token.Type.INT, source.substring(start, pos), start);
  }
  
  private void string() {
    final int start = pos;
    final int start_line = line;
    final int start_col = pos - line_start + 1;
    pos++;
    final StringBuilder buf = new StringBuilder();
    while (true) {
      if (pos >= source.length()) {
        throw new CompileException("unterminated string literal at " 
            + start_line + ":" + start_col);
      }
      final char c = source.charAt(pos++);
      if (c == '"') {
        break;
      }
      if (c == '\n') {
        line++;
        line_start = pos;
      }
      if (c == '\\' && pos < source.length()) {
        final char e = source.charAt(pos++);
        switch (e) {
        case 'n':
          buf.append('\n');
          break;
        case 't':
          buf.append('\t');
          break;
        case 'r':
          buf.append('\r');
          break;
        case '"':
        case '\\':
          buf.append(e);
          break;
        default:
          throw new CompileException("invalid escape sequence \\" + e 
              + " at " + line + ":" + (pos - line_start));
        }
      } else {
        buf.append(c);
      }
    }
    tokens.add(new Token(Token.Type.STRING, buf.toString(), start, pos, 
        start_line, start_col));
  }
  
  private void regex() {
    final int start = pos;
    pos++;
    final StringBuilder buf = new StringBuilder();
    while (true) {
      if (pos >= source.length() || source.charAt(pos) == '\n') {
        throw new CompileException("unterminated regular expression at " 
            + line + ":" + (start - line_start + 1));
      }
      final char c = source.charAt(pos++);
      if (c == '/') {
        break;
      }
      if (c == '\\' && pos < source.length() && source.charAt(pos) == '/') {
        buf.append('/');
        pos++;
      } else {
        buf.append(c);
      }
    }
    add(Token.Type.REGEX, buf.toString(), start);
  }
  
  private void operator(final char c) {
    final int start = pos;
    final char next = pos + 1 < source.length() ? source.charAt(pos + 1) : 0;
    switch (c) {
    case '(':
      single(Token.Type.LPAREN, start);
      return;
    case ')':
      single(Token.Type.RPAREN, start);
      return;
    case '{':
      single(Token.Type.LBRACE, start);
      return;
    case '}':
      single(Token.Type.RBRACE, start);
      return;
    case '[':
      single(Token.Type.LBRACK, start);
      return;
    case ']':
      single(Token.Type.RBRACK, start);
      return;
    case ',':
      single(Token.Type.COMMA, start);
      return;
    case ':':
      single(Token.Type.COLON, start);
      return;
    case '.':
      single(Token.Type.DOT, start);
      return;
    case '+':
      single(Token.Type.ADD, start);
      return;
    case '-':
      single(Token.Type.SUB, start);
      return;
    case '*':
      single(Token.Type.MUL, start);
      return;
    case '/':
      single(Token.Type.DIV, start);
      return;
    case '|':
      if (next == '>') {
        pair(Token.Type.PIPE_FORWARD, start);
        return;
      }
      break;
    case '<':
      if (next == '-') {
        pair(Token.Type.PIPE_RECEIVE, start);
      } else if (next == '=') {
        pair(Token.Type.LTE, start);
      } else {
        single(Token.Type.LT, start);
      }
      return;
    case '>':
      if (next == '=') {
        pair(Token.Type.GTE, start);
      } else {
        single(Token.Type.GT, start);
      }
      return;
    case '=':
      if (next == '>') {
        pair(Token.Type.ARROW, start);
      } else if (next == '=') {
        pair(Token.Type.EQ, start);
      } else if (next == '~') {
        pair(Token.Type.REGEXEQ, start);
      } else {
        single(Token.Type.ASSIGN, start);
      }
      return;
    case '!':
      if (next == '=') {
        pair(Token.Type.NEQ, start);
        return;
      } else if (next == '~') {
        pair(Token.Type.REGEXNEQ, start);
        return;
      }
      break;
    default:
      break;
    }
    throw new CompileException("invalid character '" + c + "' at " + line 
        + ":" + (start - line_start + 1));
  }
  
  private void single(final Token.Type type, final int start) {
    pos++;
    add(type, source.substring(start, pos), start);
  }
  
  private void pair(final Token.Type type, final int start) {
    pos += 2;
    add(type, source.substring(start, pos), start);
  }
  
  private void add(final Token.Type type, final String text, final int start) {
    tokens.add(new Token(type, text, start, pos, line, 
        start - line_start + 1));
  }
}
