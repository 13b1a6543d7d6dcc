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
package net.hydromatic.fixpoint.solver;

import static net.hydromatic.fixpoint.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.AxiomEnv;
import net.hydromatic.fixpoint.constraint.Equation;
import net.hydromatic.fixpoint.constraint.SortedReft;
import net.hydromatic.fixpoint.type.PrimitiveSort;
import net.hydromatic.fixpoint.type.Sort;
import org.junit.jupiter.api.Test;

/** Tests for {@link EnvironmentReductions}. */
public class EnvironmentReductionsTest {
  private static final Symbol V = Symbol.of("v");
  private static final Expr VV = expr.var(V);

  private final EnvironmentReduction standard =
      EnvironmentReductions.standard();
  private final EnvironmentReduction identity =
      EnvironmentReductions.identity();

  private static SortedReft sr(Sort sort, Symbol bind, Expr pred) {
    return SortedReft.of(sort, bind, pred);
  }

  private static SortedReft sr(Expr pred) {
    return SortedReft.of(PrimitiveSort.INT, V, pred);
  }

  /** Fluent builder for environments. */
  private static class EnvBuilder {
    final Map<Symbol, Binding> map = new LinkedHashMap<>();
    int id = 0;

    EnvBuilder add(String name, Expr pred) {
      return add(name, sr(pred));
    }

    EnvBuilder add(String name, SortedReft sortedReft) {
      map.put(Symbol.of(name), Binding.of(id++, sortedReft));
      return this;
    }

    Map<Symbol, Binding> build() {
      return ImmutableMap.copyOf(map);
    }

    Map<Symbol, SortedReft> buildSortedRefts() {
      final ImmutableMap.Builder<Symbol, SortedReft> b =
          ImmutableMap.builder();
      map.forEach((k, v) -> b.put(k, v.sortedReft));
      return b.build();
    }
  }

  @Test
  void testIdentityMerge() {
    final Symbol x = Symbol.of("x");
    final Symbol y = Symbol.of("y");
    final List<Map.Entry<Symbol, Binding>> env =
        ImmutableList.of(
            Maps.immutableEntry(
                x, Binding.of(0, sr(expr.gt(VV, expr.intLiteral(0))))),
            Maps.immutableEntry(y, Binding.of(1, sr(expr.trueLiteral()))),
            Maps.immutableEntry(
                x, Binding.of(2, sr(expr.lt(VV, expr.intLiteral(9))))));
    assertThat(
        identity.mergeDuplicatedBindings(env),
        hasToString("{x=[0, 2] {v : int | [v < 9]}, y=[1] {v : int | []}}"));
  }

  @Test
  void testIdentityPasses() {
    final Map<Symbol, Binding> env =
        new EnvBuilder().add("x", expr.eq(VV, expr.intLiteral(1))).build();
    assertThat(identity.undoAnf(5, env), anEmptyMap());
    assertThat(identity.simplifyBooleanRefts(env), anEmptyMap());
    final SortedReft lhs = sr(expr.eq(VV, expr.var("x")));
    assertThat(identity.inlineInSortedReft(100, env, lhs), sameInstance(lhs));
    final Map<Symbol, SortedReft> env2 =
        new EnvBuilder().add("x", expr.trueLiteral()).buildSortedRefts();
    assertThat(
        identity.dropLikelyIrrelevantBindings(
            ImmutableMap.of(), ImmutableSet.of(), env2),
        is(env2));
    assertThat(identity.axiomEnvSymbols(AxiomEnv.EMPTY), anEmptyMap());
  }

  /** Bindings of the same symbol are conjoined, after renaming their bound
   * variables to the first one's. */
  @Test
  void testMerge() {
    final Symbol x = Symbol.of("x");
    final Symbol v1 = Symbol.of("v##1");
    final Symbol v2 = Symbol.of("v##2");
    final Expr v1Pos = expr.gt(expr.var(v1), expr.intLiteral(0));
    final Expr v2Pos = expr.gt(expr.var(v2), expr.intLiteral(0));
    final Expr v2Small = expr.lt(expr.var(v2), expr.intLiteral(10));
    final List<Map.Entry<Symbol, Binding>> env =
        ImmutableList.of(
            Maps.immutableEntry(
                x, Binding.of(0, sr(PrimitiveSort.INT, v1, v1Pos))),
            Maps.immutableEntry(
                Symbol.of("y"), Binding.of(1, sr(expr.trueLiteral()))),
            Maps.immutableEntry(
                x,
                Binding.of(
                    2, sr(PrimitiveSort.INT, v2, expr.and(v2Small, v2Pos)))));
    final Map<Symbol, Binding> merged = standard.mergeDuplicatedBindings(env);
    assertThat(
        merged,
        hasToString("{x=[0, 2] {v##1 : int | [v##1 > 0; v##1 < 10]}, "
            + "y=[1] {v : int | []}}"));
  }

  @Test
  void testMergeDifferentSorts() {
    final Symbol x = Symbol.of("x");
    final List<Map.Entry<Symbol, Binding>> env =
        ImmutableList.of(
            Maps.immutableEntry(x, Binding.of(0, sr(expr.trueLiteral()))),
            Maps.immutableEntry(
                x,
                Binding.of(1, sr(PrimitiveSort.BOOL, V, expr.trueLiteral()))));
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> standard.mergeDuplicatedBindings(env));
    assertThat(
        e.getMessage(),
        is("cannot merge bindings of x with sorts int and bool"));
  }

  @Test
  void testUndoAnf() {
    final Expr xPlusOne = expr.plus(expr.var("x"), expr.intLiteral(1));
    final Expr anf2Times2 =
        expr.times(expr.var("lq_anf$##2"), expr.intLiteral(2));
    final Map<Symbol, Binding> env =
        new EnvBuilder()
            .add("lq_anf$##1", expr.eq(VV, xPlusOne))
            .add("lq_anf$##2", expr.eq(VV, expr.var("lq_anf$##1")))
            .add("y", expr.eq(VV, anf2Times2))
            .add("z", expr.gt(VV, expr.intLiteral(0)))
            .build();
    final Map<Symbol, Binding> undone = standard.undoAnf(5, env);
    assertThat(undone, aMapWithSize(1));
    assertThat(
        undone.get(Symbol.of("y")),
        hasToString("[2] {v : int | [v = (x + 1) * 2]}"));

    // With depth 1, only one level is inlined.
    assertThat(
        standard.undoAnf(1, env).get(Symbol.of("y")),
        hasToString("[2] {v : int | [v = lq_anf$##1 * 2]}"));
    assertThat(standard.undoAnf(0, env), anEmptyMap());

    // No ANF bindings, no change.
    final Map<Symbol, Binding> env2 =
        new EnvBuilder().add("y", expr.eq(VV, expr.var("z"))).build();
    assertThat(standard.undoAnf(5, env2), anEmptyMap());
  }

  @Test
  void testSimplifyBooleanRefts() {
    final Expr b = expr.var("b");
    final Expr t = expr.trueLiteral();
    final Expr f = expr.falseLiteral();
    final Expr positive = expr.gt(VV, expr.intLiteral(0));
    final Map<Symbol, Binding> env =
        new EnvBuilder()
            .add("a", sr(PrimitiveSort.BOOL, V, expr.iff(VV, t)))
            .add("b", expr.and(t, positive))
            .add("c", positive)
            .add("d", sr(PrimitiveSort.BOOL, V, expr.not(expr.not(VV))))
            .add("e", expr.or(expr.eq(b, b), f))
            .add("f", expr.implies(f, VV))
            .add("g", expr.implies(b, f))
            .add("h", expr.and(b, expr.or(f, f)))
            .build();
    final Map<Symbol, Binding> simplified = standard.simplifyBooleanRefts(env);
    assertThat(
        simplified.keySet(),
        containsInAnyOrder(
            Symbol.of("a"),
            Symbol.of("b"),
            Symbol.of("d"),
            Symbol.of("e"),
            Symbol.of("f"),
            Symbol.of("g"),
            Symbol.of("h")));
    assertThat(
        simplified.values(),
        hasToString("[[0] {v : bool | [v]}, "
            + "[1] {v : int | [v > 0]}, "
            + "[3] {v : bool | [v]}, "
            + "[4] {v : int | []}, "
            + "[5] {v : int | []}, "
            + "[6] {v : int | [not b]}, "
            + "[7] {v : int | [false]}]"));
  }

  @Test
  void testInlineInSortedReft() {
    final Map<Symbol, Binding> env =
        new EnvBuilder()
            .add("x", expr.eq(VV, expr.intLiteral(5)))
            .add("y", expr.eq(VV, expr.plus(expr.var("x"), expr.intLiteral(1))))
            .add("z", expr.gt(VV, expr.intLiteral(0)))
            .add("w", expr.eq(VV, expr.plus(expr.var("w"), expr.intLiteral(1))))
            .build();
    final SortedReft lhs =
        sr(expr.and(expr.eq(VV, expr.var("y")), expr.gt(VV, expr.var("w"))));
    assertThat(
        standard.inlineInSortedReft(100, env, lhs),
        hasToString("{v : int | [v = 5 + 1; v > w]}"));
    assertThat(
        standard.inlineInSortedReft(1, env, lhs),
        hasToString("{v : int | [v = x + 1; v > w]}"));

    // The bound variable is never replaced, even if it has a binding.
    final Map<Symbol, Binding> env2 =
        new EnvBuilder().add("v", expr.eq(VV, expr.intLiteral(3))).build();
    final SortedReft rhs = sr(expr.gt(VV, expr.intLiteral(0)));
    assertThat(standard.inlineInSortedReft(100, env2, rhs), sameInstance(rhs));
  }

  /** Mutually recursive definitions are unfolded only up to the depth. */
  @Test
  void testInlineCycle() {
    final Symbol w = Symbol.of("w");
    final Map<Symbol, Binding> env =
        new EnvBuilder()
            .add("a", expr.eq(VV, expr.var("b")))
            .add("b", expr.eq(VV, expr.var("a")))
            .build();
    final SortedReft lhs =
        sr(PrimitiveSort.INT, w, expr.eq(expr.var(w), expr.var("a")));
    assertThat(
        standard.inlineInSortedReft(100, env, lhs),
        hasToString("{w : int | [w = a]}"));
    assertThat(
        standard.inlineInSortedReft(3, env, lhs),
        hasToString("{w : int | [w = b]}"));
  }

  @Test
  void testDropLikelyIrrelevantBindings() {
    final Map<Symbol, SortedReft> env =
        new EnvBuilder()
            .add("x", expr.gt(VV, expr.var("y")))
            .add("y", expr.trueLiteral())
            .add("z", expr.eq(VV, expr.var("w")))
            .add("w", expr.trueLiteral())
            .add("p", expr.apply(Symbol.of("f"), VV))
            .add("q", expr.trueLiteral())
            .buildSortedRefts();
    final Map<Symbol, Set<Symbol>> axiomSymbols =
        ImmutableMap.of(Symbol.of("f"), ImmutableSet.of(Symbol.of("q")));
    final Set<Symbol> live = ImmutableSet.of(Symbol.of("x"), Symbol.of("f"));
    assertThat(
        standard.dropLikelyIrrelevantBindings(axiomSymbols, live, env).keySet(),
        hasToString("[x, y, q]"));
    assertThat(
        standard
            .dropLikelyIrrelevantBindings(ImmutableMap.of(), live, env)
            .keySet(),
        hasToString("[x, y]"));
  }

  @Test
  void testAxiomEnvSymbols() {
    final Symbol f = Symbol.of("f");
    final Symbol a = Symbol.of("a");
    final Symbol b = Symbol.of("b");
    final Expr body =
        expr.plus(
            expr.plus(expr.var(a), expr.var(b)),
            expr.apply(Symbol.of("g"), expr.var("c")));
    final AxiomEnv axiomEnv =
        new AxiomEnv(
            ImmutableList.of(
                new Equation(
                    f, ImmutableList.of(a, b), body, PrimitiveSort.INT)));
    final Map<Symbol, Set<Symbol>> map = standard.axiomEnvSymbols(axiomEnv);
    assertThat(map.keySet(), hasToString("[f]"));
    assertThat(map.get(f), containsInAnyOrder(Symbol.of("g"), Symbol.of("c")));
  }
}

// End EnvironmentReductionsTest.java
