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

import net.pipeql.ast.Operator;
import net.pipeql.exceptions.CompileException;
import net.pipeql.semantic.Kind;
import net.pipeql.values.Value;
import net.pipeql.values.Values;

/**
 * Arithmetic, comparison and regex operators over values. Ints and 
 * floats mix by widening to float.
 * 
 * @since 1.0
 */
final class BinaryOperations {
  
  private BinaryOperations() { }
  
  static Value apply(final Operator op, 
                     final Value l, 
                     final Value r, 
                     final String position) {
    final Kind lk = l.type().kind();
    final Kind rk = r.type().kind();
    switch (op) {
    case EQUAL:
      return Values.newBool(equal(l, r));
    case NOT_EQUAL:
      return Values.newBool(!equal(l, r));
    case LESS_THAN:
      return Values.newBool(compare(l, r, op, position) < 0);
    case LESS_THAN_EQUAL:
      return Values.newBool(compare(l, r, op, position) <= 0);
    case GREATER_THAN:
      return Values.newBool(compare(l, r, op, position) > 0);
    case GREATER_THAN_EQUAL:
      return Values.newBool(compare(l, r, op, position) >= 0);
    case REGEX_MATCH:
    case REGEX_NOT_MATCH:
      if (lk != Kind.STRING || rk != Kind.REGEXP) {
        throw invalid(op, l, r, position);
      }
      final boolean found = r.regexp().matcher(l.str()).find();
      return Values.newBool(op == Operator.REGEX_MATCH ? found : !found);
    case ADD:
      if (lk == Kind.STRING && rk == Kind.STRING) {
        return Values.newString(l.str() + r.str());
      }
      if (lk == Kind.TIME && rk == Kind.DURATION) {
        return Values.newTime(l.time() + r.duration());
      }
      if (lk == Kind.DURATION && rk == Kind.TIME) {
        return Values.newTime(r.time() + l.duration());
      }
      if (lk == Kind.DURATION && rk == Kind.DURATION) {
        return Values.newDuration(l.duration() + r.duration());
      }
      return numeric(op, l, r, position);
    case SUBTRACT:
      if (lk == Kind.TIME && rk == Kind.DURATION) {
        return Values.newTime(l.time() - r.duration());
      }
      if (lk == Kind.TIME && rk == Kind.TIME) {
        return Values.newDuration(l.time() - r.time());
      }
      if (lk == Kind.DURATION && rk == Kind.DURATION) {
        return Values.newDuration(l.duration() - r.duration());
      }
      return numeric(op, l, r, position);
    case MULTIPLY:
      if (lk == Kind.DURATION && rk == Kind.INT) {
        return Values.newDuration(l.duration() * r.integer());
      }
      return numeric(op, l, r, position);
    case DIVIDE:
      return numeric(op, l, r, position);
    default:
      throw invalid(op, l, r, position);
    }
  }
  
  private static boolean equal(final Value l, final Value r) {
    if (isNumber(l) && isNumber(r) && l.type().kind() != r.type().kind()) {
      return Double.compare(toDouble(l), toDouble(r)) == 0;
    }
    return Values.equal(l, r);
  }
  
  private static int compare(final Value l, 
                             final Value r, 
                             final Operator op, 
                             final String position) {
    final Kind lk = l.type().kind();
    final Kind rk = r.type().kind();
    if (lk == rk) {
      switch (lk) {
      case INT:
        return Long.compare(l.integer(), r.integer());
      case UINT:
        return Long.compareUnsigned(l.uinteger(), r.uinteger());
      case FLOAT:
        return Double.compare(l.floatValue(), r.floatValue());
      case STRING:
        return l.str().compareTo(r.str());
      case TIME:
        return Long.compare(l.time(), r.time());
      case DURATION:
        return Long.compare(l.duration(), r.duration());
      default:
        break;
      }
    } else if (isNumber(l) && isNumber(r)) {
      return Double.compare(toDouble(l), toDouble(r));
    }
    throw invalid(op, l, r, position);
  }
  
  private static Value numeric(final Operator op, 
                               final Value l, 
                               final Value r, 
                               final String position) {
    final Kind lk = l.type().kind();
    final Kind rk = r.type().kind();
    if (lk == Kind.INT && rk == Kind.INT) {
      final long a = l.integer();
      final long b = r.integer();
      switch (op) {
      case ADD:
        return Values.newInt(a + b);
      case SUBTRACT:
        return Values.newInt(a - b);
      case MULTIPLY:
        return Values.newInt(a * b);
      default:
        if (b == 0) {
          throw new CompileException("division by zero at " + position);
        }
        return Values.newInt(a / b);
      }
    }
    if (lk == Kind.UINT && rk == Kind.UINT) {
      final long a = l.uinteger();
      final long b = r.uinteger();
      switch (op) {
      case ADD:
        return Values.newUInt(a + b);
      case SUBTRACT:
        return Values.newUInt(a - b);
      case MULTIPLY:
        return Values.newUInt(a * b);
      default:
        if (b == 0) {
          throw new CompileException("division by zero at " + position);
        }
        return Values.newUInt(Long.divideUnsigned(a, b));
      }
    }
    if (!isNumber(l) || !isNumber(r)) {
      throw invalid(op, l, r, position);
    }
    final double a = toDouble(l);
    final double b = toDouble(r);
    switch (op) {
    case ADD:
      return Values.newFloat(a + b);
    case SUBTRACT:
      return Values.newFloat(a - b);
    case MULTIPLY:
      return Values.newFloat(a * b);
    default:
      return Values.newFloat(a / b);
    }
  }
  
  private static boolean isNumber(final Value v) {
    final Kind k = v.type().kind();
    return k == Kind.INT || k == Kind.FLOAT;
  }
  
  private static double toDouble(final Value v) {
    return v.type().kind() == Kind.INT ? v.integer() : v.floatValue();
  }
  
  private static CompileException invalid(final Operator op, 
                                          final Value l, 
                                          final Value r, 
                                          final String position) {
    return new CompileException("invalid operands " 
        + l.type().kind().name().toLowerCase() + " " + op.symbol() + " " 
        + r.type().kind().name().toLowerCase() + " at " + position);
  }
}
