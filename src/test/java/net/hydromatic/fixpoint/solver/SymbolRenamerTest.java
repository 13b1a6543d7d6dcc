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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.SortedReft;
import net.hydromatic.fixpoint.constraint.SubC;
import net.hydromatic.fixpoint.type.ObjSort;
import net.hydromatic.fixpoint.type.PrimitiveSort;
import net.hydromatic.fixpoint.type.Sort;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymbolRenamer} and {@link PrefixSuffixMap}. */
public class SymbolRenamerTest {
  private static List<Symbol> symbols(String... names) {
    final List<Symbol> list = new ArrayList<>();
    for (String name : names) {
      list.add(Symbol.of(name));
    }
    return list;
  }

  /** Renames symbols and returns the result as a string, in the order that
   * the symbols were given. */
  private static String rename(List<Symbol> symbols) {
    return SymbolRenamer.proposeRenamings(symbols).toString();
  }

  @Test
  void testPrefixSuffixMap() {
    final PrefixSuffixMap map =
        PrefixSuffixMap.of(symbols("x##a", "y", "x##b", "x##a##1", "z##"));
    assertThat(map, hasToString("{x={a=[x##a], b=[x##b], a##1=[x##a##1]}, "
        + "y={=[y]}, z={=[z##]}}"));
    assertThat(map.group("x").keySet(), hasSize(3));
    assertThat(map.group("w").isEmpty(), is(true));

    // Two symbols that print the same are in the same subgroup.
    final PrefixSuffixMap map2 =
        PrefixSuffixMap.builder()
            .add(Symbol.of("x##a"))
            .add(Symbol.of("x##a", 1))
            .build();
    assertThat(map2.group("x").get("a"), hasSize(2));
  }

  @Test
  void testDistinctSuffixesKeepSuffix() {
    assertThat(
        rename(symbols("x##a", "x##b", "y")),
        is("{x##a=x##a, x##b=x##b, y=y}"));
    assertThat(
        rename(symbols("x##a", "x##a_dup")),
        is("{x##a=x##a, x##a_dup=x##a_dup}"));
  }

  @Test
  void testAloneInPrefixGroup() {
    assertThat(
        rename(symbols("lq_tmp##x##12", "VV##F##3", "n")),
        is("{lq_tmp##x##12=lq_tmp, VV##F##3=VV, n=n}"));
  }

  /** Tests two distinct symbols that print the same; they are numbered. */
  @Test
  void testSameNameDifferentOrdinal() {
    final Symbol a0 = Symbol.of("x##a");
    final Symbol a1 = Symbol.of("x##a", 1);
    final Map<Symbol, Symbol> map =
        SymbolRenamer.proposeRenamings(ImmutableList.of(a0, a1));
    assertThat(map.get(a0), is(Symbol.of("x##a##1")));
    assertThat(map.get(a1), is(Symbol.of("x##a##2")));

    // The same, with empty suffix.
    final Symbol y0 = Symbol.of("y");
    final Symbol y1 = Symbol.of("y", 1);
    final Map<Symbol, Symbol> map2 =
        SymbolRenamer.proposeRenamings(ImmutableList.of(y0, y1));
    assertThat(map2, hasToString("{y=y##1, y=y##2}"));
  }

  /** Tests that numbering skips a name that a singleton subgroup has
   * already taken. */
  @Test
  void testNumberingSkipsTakenName() {
    final Symbol a0 = Symbol.of("x##a");
    final Symbol a1 = Symbol.of("x##a", 1);
    final Symbol a2 = Symbol.of("x##a##1");
    final Map<Symbol, Symbol> map =
        SymbolRenamer.proposeRenamings(ImmutableList.of(a0, a1, a2));
    assertThat(map.get(a2), is(a2));
    assertThat(map.get(a0), is(Symbol.of("x##a##2")));
    assertThat(map.get(a1), is(Symbol.of("x##a##3")));
  }

  @Test
  void testReserved() {
    final Map<Symbol, Symbol> map =
        SymbolRenamer.proposeRenamings(
            symbols("y##1", "z##a", "z##b"), ImmutableSet.of(Symbol.of("y")));
    assertThat(map, hasToString("{y##1=y##1, z##a=z##a, z##b=z##b}"));

    final Map<Symbol, Symbol> map2 =
        SymbolRenamer.proposeRenamings(
            symbols("z##a", "z##b"), ImmutableSet.of(Symbol.of("z##a")));
    assertThat(map2, hasToString("{z##a=z##a##1, z##b=z##b}"));

    // Bare prefix and full name are both reserved; fall back to a number.
    final Map<Symbol, Symbol> map3 =
        SymbolRenamer.proposeRenamings(
            symbols("y##1"),
            ImmutableSet.of(Symbol.of("y"), Symbol.of("y##1")));
    assertThat(map3, hasToString("{y##1=y##1##1}"));
  }

  @Test
  void testDuplicatesIgnored() {
    assertThat(rename(symbols("x##a", "x##a")), is("{x##a=x}"));
    assertThat(rename(ImmutableList.of()), is("{}"));
  }

  /** Checks prefix preservation, collision-freedom and minimality on
   * randomly generated sets of symbols. */
  @Test
  void testRandom() {
    final Random random = new Random(12345);
    final String[] prefixes = {"a", "b", "lq_tmp", "VV", ""};
    final String[] suffixes = {"", "x", "y", "x##1", "1", "x##2##1"};
    for (int i = 0; i < 500; i++) {
      final Set<Symbol> symbols = new LinkedHashSet<>();
      final int n = random.nextInt(12);
      for (int j = 0; j < n; j++) {
        final String prefix = prefixes[random.nextInt(prefixes.length)];
        final String suffix = suffixes[random.nextInt(suffixes.length)];
        final String name =
            suffix.isEmpty() ? prefix : prefix + Symbol.SEPARATOR + suffix;
        symbols.add(Symbol.of(name, random.nextInt(3)));
      }
      final Set<Symbol> reserved = new HashSet<>();
      if (random.nextBoolean()) {
        reserved.add(Symbol.of(prefixes[random.nextInt(prefixes.length)]));
        reserved.add(Symbol.of("a##x"));
      }
      checkRenamings(symbols, reserved);
    }
  }

  private static void checkRenamings(
      Set<Symbol> symbols, Set<Symbol> reserved) {
    final Map<Symbol, Symbol> map =
        SymbolRenamer.proposeRenamings(symbols, reserved);
    assertThat(map.keySet(), is(symbols));

    final Set<String> names = new HashSet<>();
    map.forEach(
        (symbol, symbol2) -> {
          // Prefix preservation
          assertThat(symbol2.prefix(), is(symbol.prefix()));
          // Collision-freedom
          assertThat(names.add(symbol2.name), is(true));
          assertThat(reserved.contains(Symbol.of(symbol2.name)), is(false));
        });

    // Minimality
    final PrefixSuffixMap groups = PrefixSuffixMap.of(symbols);
    groups.forEach(
        (prefix, group) -> {
          if (group.size() == 1 && group.values().iterator().next().size() == 1
              && !reserved.contains(Symbol.of(prefix))) {
            final Symbol symbol = group.values().iterator().next().get(0);
            assertThat(map.get(symbol), is(Symbol.of(prefix)));
          }
        });
  }

  /** Tests that a symbol is renamed consistently wherever it occurs: as the
   * key of a binding, in predicates, and in sorts. */
  @Test
  void testShortenVarNames() {
    final Symbol ax = Symbol.of("a##x");
    final Symbol by3 = Symbol.of("b##y##3");
    final Symbol bz = Symbol.of("b##z");
    final Symbol n = Symbol.of("n");
    final Symbol c1 = Symbol.of("c##1");
    final Symbol len = Symbol.of("len");
    final Sort aSort = ObjSort.of(ax);

    final Map<Symbol, SortedReft> env = new LinkedHashMap<>();
    final Symbol v1 = Symbol.of("v##1");
    final Symbol v2 = Symbol.of("v##2");
    final Symbol v3 = Symbol.of("v##3");
    env.put(
        ax,
        SortedReft.of(
            PrimitiveSort.INT,
            v1,
            expr.eq(
                expr.var(v1), expr.plus(expr.var(by3), expr.intLiteral(1)))));
    env.put(
        by3,
        SortedReft.of(
            PrimitiveSort.INT, v2, expr.gt(expr.var(v2), expr.var(n))));
    env.put(
        bz,
        SortedReft.of(
            PrimitiveSort.INT,
            v3,
            expr.eq(expr.var(v3), expr.apply(len, expr.var(c1)))));
    env.put(
        n,
        SortedReft.of(
            PrimitiveSort.INT, v3, expr.ge(expr.var(v3), expr.var(bz))));
    env.put(c1, SortedReft.of(aSort, v3, expr.trueLiteral()));

    final Symbol v4 = Symbol.of("v##4");
    final SubC c =
        SubC.of(
            ImmutableList.of(0, 1, 2, 3, 4),
            SortedReft.of(
                PrimitiveSort.INT, v4, expr.eq(expr.var(v4), expr.var(ax))),
            SortedReft.of(
                PrimitiveSort.INT, v4, expr.gt(expr.var(v4), expr.var(n))),
            7,
            ImmutableList.of(1),
            "info");

    final SymbolRenamer.Renamed renamed = SymbolRenamer.shortenVarNames(env, c);
    assertThat(
        renamed.env.toString(),
        is("[a={v : int | [v = b##y##3 + 1]}, "
            + "b##y##3={v : int | [v > n]}, "
            + "b##z={v : int | [v = len c]}, "
            + "n={v : int | [v >= b##z]}, "
            + "c={v : a | []}]"));
    assertThat(renamed.constraint.lhs, hasToString("{v : int | [v = a]}"));
    assertThat(renamed.constraint.rhs, hasToString("{v : int | [v > n]}"));
    assertThat(renamed.constraint.id, is(7));
    assertThat(renamed.constraint.envIds, is(c.envIds));

    // Every free symbol is a renamed key, a bound variable or "len", which is
    // not a binding.
    final Set<Symbol> keys = new HashSet<>();
    renamed.env.forEach(e -> keys.add(e.getKey()));
    final Set<Symbol> free = new HashSet<>();
    renamed.env.forEach(e -> free.addAll(e.getValue().symbols()));
    free.addAll(renamed.constraint.lhs.symbols());
    free.addAll(renamed.constraint.rhs.symbols());
    for (Symbol symbol : free) {
      assertThat(
          symbol.toString(),
          keys.contains(symbol)
              || symbol.equals(Symbol.of("v"))
              || symbol.equals(len),
          is(true));
    }
  }

  /** Tests that a binding is not renamed to the name of a free symbol that
   * is not a binding. */
  @Test
  void testShortenVarNamesAvoidsCapture() {
    final Symbol f = Symbol.of("f");
    final Symbol f1 = Symbol.of("f##1");
    final Symbol v = Symbol.of("v");
    final Map<Symbol, SortedReft> env =
        ImmutableMap.of(
            f1,
            SortedReft.of(
                PrimitiveSort.INT,
                v,
                expr.eq(expr.var(v), expr.apply(f, expr.var(v)))));
    final SubC c =
        SubC.of(
            ImmutableList.of(0),
            SortedReft.of(PrimitiveSort.INT, v, expr.var(f1)),
            SortedReft.of(PrimitiveSort.INT, v, expr.trueLiteral()),
            null,
            ImmutableList.of(),
            "");
    final SymbolRenamer.Renamed renamed = SymbolRenamer.shortenVarNames(env, c);
    assertThat(renamed.env.get(0).getKey(), not(f));
    assertThat(renamed.env.get(0).getKey(), is(f1));
    assertThat(renamed.constraint.lhs, hasToString("{v : int | [f##1]}"));

    // Nothing to rename; the constraint is unchanged.
    final SubC c2 =
        SubC.of(
            ImmutableList.of(),
            SortedReft.of(PrimitiveSort.INT, v, expr.trueLiteral()),
            SortedReft.of(PrimitiveSort.INT, v, expr.trueLiteral()),
            null,
            ImmutableList.of(),
            "");
    assertThat(
        SymbolRenamer.shortenVarNames(ImmutableMap.of(), c2).constraint,
        sameInstance(c2));
  }

  /** Tests that a binding is not renamed to the name that a bound variable
   * is displayed as. Otherwise "v##4 = v##k" would be displayed as
   * "v = v". */
  @Test
  void testShortenVarNamesAvoidsBoundVariable() {
    final Symbol vk = Symbol.of("v##k");
    final Symbol v4 = Symbol.of("v##4");
    final Symbol w = Symbol.of("w");
    final Map<Symbol, SortedReft> env =
        ImmutableMap.of(
            vk,
            SortedReft.of(
                PrimitiveSort.INT,
                w,
                expr.gt(expr.var(w), expr.intLiteral(0))));
    final SubC c =
        SubC.of(
            ImmutableList.of(0),
            SortedReft.of(
                PrimitiveSort.INT, v4, expr.eq(expr.var(v4), expr.var(vk))),
            SortedReft.of(PrimitiveSort.INT, v4, expr.trueLiteral()),
            null,
            ImmutableList.of(),
            "");
    final SymbolRenamer.Renamed renamed = SymbolRenamer.shortenVarNames(env, c);
    assertThat(renamed.env.get(0).getKey(), is(vk));
    assertThat(
        renamed.env.get(0).getValue(), hasToString("{w : int | [w > 0]}"));
    assertThat(
        renamed.constraint.lhs, hasToString("{v : int | [v = v##k]}"));
  }
}

// End SymbolRenamerTest.java
