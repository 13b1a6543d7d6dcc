/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.fixpoint.ast;

/** Sub-types of {@link Expr}. */
public enum Op {
  // identifiers
  VAR(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),

  // unknown predicate, "$k[x:=e]"
  KVAR(true),

  // calls
  APPLY(" ", 10),
  CAST(" : ", 0),
  NEGATE("-", 9),
  TIMES(" * ", 8),
  DIVIDE(" / ", 8),
  MOD(" mod ", 8),
  PLUS(" + ", 7),
  MINUS(" - ", 7),

  // relations
  EQ(" = ", 6),
  NE(" != ", 6),
  LT(" < ", 6),
  LE(" <= ", 6),
  GT(" > ", 6),
  GE(" >= ", 6),
  UEQ(" ~~ ", 6),
  UNE(" !~ ", 6),

  // connectives
  NOT("not ", 5),
  AND(" && ", 4),
  OR(" || ", 3),
  IMPLIES(" => ", 2, false),
  IFF(" <=> ", 1, false),
  IF;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Whether this is an arithmetic operator, such as "+". */
  public boolean isArithmetic() {
    switch (this) {
      case TIMES:
      case DIVIDE:
      case MOD:
      case PLUS:
      case MINUS:
        return true;
      default:
        return false;
    }
  }

  /** Whether this is a relational operator, such as "&lt;=". */
  public boolean isRelational() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case UEQ:
      case UNE:
        return true;
      default:
        return false;
    }
  }

  /** Whether this is an operator that {@link Expr.Binary} can hold. */
  public boolean isBinary() {
    return isArithmetic() || isRelational() || this == IMPLIES || this == IFF;
  }
}

// End Op.java
