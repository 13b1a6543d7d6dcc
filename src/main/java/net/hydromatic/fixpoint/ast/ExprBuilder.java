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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.fixpoint.type.Sort;

/** Builds expressions. */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  private final Expr.Literal trueLiteral =
      new Expr.Literal(Op.BOOL_LITERAL, Boolean.TRUE);

  private final Expr.Literal falseLiteral =
      new Expr.Literal(Op.BOOL_LITERAL, Boolean.FALSE);

  /** Creates a reference to a variable. */
  public Expr.Var var(Symbol symbol) {
    return new Expr.Var(symbol);
  }

  /** Creates a reference to a variable with a given name and ordinal 0. */
  public Expr.Var var(String name) {
    return var(Symbol.of(name));
  }

  /** Creates a {@code boolean} literal. */
  public Expr.Literal boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates the literal {@code true}. */
  public Expr.Literal trueLiteral() {
    return trueLiteral;
  }

  /** Creates the literal {@code false}. */
  public Expr.Literal falseLiteral() {
    return falseLiteral;
  }

  /** Creates an integer literal. */
  public Expr.Literal intLiteral(long value) {
    return intLiteral(BigDecimal.valueOf(value));
  }

  /** Creates an integer literal. */
  public Expr.Literal intLiteral(BigDecimal value) {
    checkArgument(
        value.stripTrailingZeros().scale() <= 0, "not integer: %s", value);
    return new Expr.Literal(Op.INT_LITERAL, value);
  }

  /** Creates a real literal. */
  public Expr.Literal realLiteral(BigDecimal value) {
    return new Expr.Literal(Op.REAL_LITERAL, value);
  }

  /** Creates a string literal. */
  public Expr.Literal stringLiteral(String value) {
    return new Expr.Literal(Op.STRING_LITERAL, value);
  }

  /** Creates a function application. */
  public Expr.Apply apply(Expr fn, Expr... args) {
    return apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates a function application. */
  public Expr.Apply apply(Expr fn, List<? extends Expr> args) {
    return new Expr.Apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates an application of a named function. */
  public Expr.Apply apply(Symbol fn, Expr... args) {
    return apply(var(fn), args);
  }

  /** Creates a negation, "-e". */
  public Expr.Prefix negate(Expr e) {
    return new Expr.Prefix(Op.NEGATE, e);
  }

  /** Creates a call to a binary operator. */
  public Expr.Binary binary(Op op, Expr a0, Expr a1) {
    return new Expr.Binary(op, a0, a1);
  }

  /** Creates "a0 + a1". */
  public Expr.Binary plus(Expr a0, Expr a1) {
    return binary(Op.PLUS, a0, a1);
  }

  /** Creates "a0 - a1". */
  public Expr.Binary minus(Expr a0, Expr a1) {
    return binary(Op.MINUS, a0, a1);
  }

  /** Creates "a0 * a1". */
  public Expr.Binary times(Expr a0, Expr a1) {
    return binary(Op.TIMES, a0, a1);
  }

  /** Creates "a0 = a1". */
  public Expr.Binary eq(Expr a0, Expr a1) {
    return binary(Op.EQ, a0, a1);
  }

  /** Creates "a0 != a1". */
  public Expr.Binary ne(Expr a0, Expr a1) {
    return binary(Op.NE, a0, a1);
  }

  /** Creates "a0 &lt; a1". */
  public Expr.Binary lt(Expr a0, Expr a1) {
    return binary(Op.LT, a0, a1);
  }

  /** Creates "a0 &lt;= a1". */
  public Expr.Binary le(Expr a0, Expr a1) {
    return binary(Op.LE, a0, a1);
  }

  /** Creates "a0 &gt; a1". */
  public Expr.Binary gt(Expr a0, Expr a1) {
    return binary(Op.GT, a0, a1);
  }

  /** Creates "a0 &gt;= a1". */
  public Expr.Binary ge(Expr a0, Expr a1) {
    return binary(Op.GE, a0, a1);
  }

  /** Creates "a0 =&gt; a1". */
  public Expr.Binary implies(Expr a0, Expr a1) {
    return binary(Op.IMPLIES, a0, a1);
  }

  /** Creates "a0 &lt;=&gt; a1". */
  public Expr.Binary iff(Expr a0, Expr a1) {
    return binary(Op.IFF, a0, a1);
  }

  /** Creates a conjunction. With no arguments, it is {@code true}. */
  public Expr.Junction and(Expr... args) {
    return and(ImmutableList.copyOf(args));
  }

  /** Creates a conjunction. With no arguments, it is {@code true}. */
  public Expr.Junction and(List<? extends Expr> args) {
    return new Expr.Junction(Op.AND, ImmutableList.copyOf(args));
  }

  /** Creates a disjunction. With no arguments, it is {@code false}. */
  public Expr.Junction or(Expr... args) {
    return or(ImmutableList.copyOf(args));
  }

  /** Creates a disjunction. With no arguments, it is {@code false}. */
  public Expr.Junction or(List<? extends Expr> args) {
    return new Expr.Junction(Op.OR, ImmutableList.copyOf(args));
  }

  /** Creates "not e". */
  public Expr.Prefix not(Expr e) {
    return new Expr.Prefix(Op.NOT, e);
  }

  /** Creates "if c then a else b". */
  public Expr.If ifThenElse(Expr condition, Expr ifTrue, Expr ifFalse) {
    return new Expr.If(condition, ifTrue, ifFalse);
  }

  /** Creates "(e : s)". */
  public Expr.Cast cast(Expr e, Sort sort) {
    return new Expr.Cast(e, sort);
  }

  /** Creates a kvar application, "$k[x:=e]". */
  public Expr.KVar kvar(Symbol kvar, Map<Symbol, ? extends Expr> substitution) {
    return new Expr.KVar(kvar, ImmutableMap.copyOf(substitution));
  }
}

// End ExprBuilder.java
