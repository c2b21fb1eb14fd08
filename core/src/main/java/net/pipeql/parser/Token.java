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

/**
 * A lexed token with its offsets into the script.
 * 
 * @since 1.0
 */
public class Token {
  
  public enum Type {
    IDENT,
    INT,
    FLOAT,
    STRING,
    DURATION,
    TIME,
    REGEX,
    OPTION,
    RETURN,
    TRUE,
    FALSE,
    AND,
    OR,
    NOT,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACK,
    RBRACK,
    COMMA,
    COLON,
    DOT,
    ASSIGN,
    PIPE_FORWARD,
    PIPE_RECEIVE,
    ARROW,
    ADD,
    SUB,
    MUL,
    DIV,
    EQ,
    NEQ,
    LT,
    LTE,
    GT,
    GTE,
    REGEXEQ,
    REGEXNEQ,
    EOF;
  }
  
  final Type type;
  
  /** The literal text, unescaped for strings and regexes. */
  final String text;
  
  final int start;
  final int end;
  final int line;
  final int column;
  
  Token(final Type type, 
        final String text, 
        final int start, 
        final int end, 
        final int line, 
        final int column) {
    this.type = type;
    this.text = text;
    this.start = start;
    this.end = end;
    this.line = line;
    this.column = column;
  }
  
  /** @return Whether a {@code /} after this token is a division. */
  boolean endsOperand() {
    switch (type) {
    case IDENT:
    case INT:
    case FLOAT:
    case STRING:
    case DURATION:
    case TIME:
    case REGEX:
    case TRUE:
    case FALSE:
    case RPAREN:
    case RBRACK:
    case RBRACE:
      return true;
    default:
      return false;
    }
  }
  
  @Override
  public String toString() {
    return type == Type.EOF ? "EOF" : type + "(" + text + ")";
  }
}
