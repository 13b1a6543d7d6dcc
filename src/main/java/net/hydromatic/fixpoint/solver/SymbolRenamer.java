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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.SortedReft;
import net.hydromatic.fixpoint.constraint.SubC;
import net.hydromatic.fixpoint.type.ObjSort;
import net.hydromatic.fixpoint.type.Sort;

/**
 * Invents short names for the symbols of an environment.
 *
 * <p>Generated symbols such as {@code lq_tmp##x##12} carry their origin in
 * their suffix. When an environment contains only one symbol that starts with
 * {@code lq_tmp}, that symbol can be displayed as {@code lq_tmp}; when several
 * do, we keep as much of the suffix as is needed to tell them apart, and
 * number the ones that remain ambiguous.
 */
public class SymbolRenamer {
  private SymbolRenamer() {}

  /**
   * Proposes a replacement for each of a collection of distinct symbols.
   *
   * <p>Each replacement starts with its symbol's prefix. Replacements are
   * distinct from each other and from the names of the reserved symbols.
   *
   * @param symbols Symbols to rename
   * @param reserved Symbols that are not being renamed, whose names
   *     replacements must avoid
   * @return Map from each symbol to its replacement, in the order that the
   *     symbols were given
   */
  public static Map<Symbol, Symbol> proposeRenamings(
      Collection<Symbol> symbols, Set<Symbol> reserved) {
    final Set<Symbol> distinctSymbols = new LinkedHashSet<>(symbols);
    final PrefixSuffixMap groups = PrefixSuffixMap.of(distinctSymbols);
    final Set<String> taken = new HashSet<>();
    reserved.forEach(symbol -> taken.add(symbol.name));
    final Map<Symbol, Symbol> renamings = new HashMap<>();

    // Symbols whose subgroup has one member get an undecorated name, if it
    // is free. A symbol alone in its prefix group prefers the bare prefix,
    // then prefix and suffix.
    groups.forEach(
        (prefix, group) ->
            group.forEach(
                (suffix, members) -> {
                  if (members.size() != 1) {
                    return;
                  }
                  final List<String> names = new ArrayList<>();
                  if (group.size() == 1 || suffix.isEmpty()) {
                    names.add(prefix);
                  }
                  if (!suffix.isEmpty()) {
                    names.add(prefix + Symbol.SEPARATOR + suffix);
                  }
                  for (String name : names) {
                    if (taken.add(name)) {
                      renamings.put(members.get(0), Symbol.of(name));
                      return;
                    }
                  }
                }));

    // The rest are numbered.
    groups.forEach(
        (prefix, group) ->
            group.forEach(
                (suffix, members) -> {
                  final String base =
                      suffix.isEmpty()
                          ? prefix
                          : prefix + Symbol.SEPARATOR + suffix;
                  int i = 1;
                  for (Symbol symbol : members) {
                    if (renamings.containsKey(symbol)) {
                      continue;
                    }
                    String name;
                    while (!taken.add(name = base + Symbol.SEPARATOR + i)) {
                      ++i;
                    }
                    renamings.put(symbol, Symbol.of(name));
                    ++i;
                  }
                }));

    final ImmutableMap.Builder<Symbol, Symbol> b = ImmutableMap.builder();
    for (Symbol symbol : distinctSymbols) {
      b.put(symbol, renamings.get(symbol));
    }
    return b.build();
  }

  /** As {@link #proposeRenamings(Collection, Set)}, reserving nothing. */
  public static Map<Symbol, Symbol> proposeRenamings(
      Collection<Symbol> symbols) {
    return proposeRenamings(symbols, ImmutableSet.of());
  }

  /**
   * Shortens the names of the bindings in an environment, and renames their
   * occurrences in the environment and in a constraint.
   *
   * <p>Free symbols that are not keys of the environment keep their names,
   * and no binding is renamed to one of them. The bound symbol of each
   * refinement becomes its prefix, so no binding is renamed to that prefix
   * either.
   */
  public static Renamed shortenVarNames(Map<Symbol, SortedReft> env, SubC c) {
    final Set<Symbol> reserved = new LinkedHashSet<>();
    final Set<Symbol> binds = new HashSet<>();
    final List<SortedReft> sortedRefts = new ArrayList<>(env.values());
    sortedRefts.add(c.lhs);
    sortedRefts.add(c.rhs);
    for (SortedReft sortedReft : sortedRefts) {
      reserved.addAll(sortedReft.symbols());
      binds.add(sortedReft.bind());
    }
    reserved.removeAll(env.keySet());
    reserved.removeAll(binds);
    binds.forEach(bind -> reserved.add(bind.prefixSymbol()));

    final Map<Symbol, Symbol> renamings =
        proposeRenamings(env.keySet(), reserved);
    final ImmutableList.Builder<Map.Entry<Symbol, SortedReft>> b =
        ImmutableList.builder();
    env.forEach(
        (symbol, sortedReft) ->
            b.add(
                Maps.immutableEntry(
                    rename(renamings, symbol),
                    renameSortedReft(renamings, sortedReft))));
    final SubC c2 =
        c.withSides(
            renameSortedReft(renamings, c.lhs),
            renameSortedReft(renamings, c.rhs));
    return new Renamed(b.build(), c2);
  }

  private static SortedReft renameSortedReft(
      Map<Symbol, Symbol> renamings, SortedReft sortedReft) {
    final Function<Symbol, Sort> sortSubst =
        symbol -> ObjSort.of(rename(renamings, symbol));
    final Symbol bind = sortedReft.bind();
    final Map<Symbol, Symbol> m = new LinkedHashMap<>(renamings);
    m.put(bind, bind.prefixSymbol());
    final Expr pred =
        sortedReft
            .pred()
            .substf(symbol -> expr.var(rename(m, symbol)))
            .substSort(sortSubst);
    return SortedReft.of(
        sortedReft.sort.substSort(sortSubst), bind.prefixSymbol(), pred);
  }

  private static Symbol rename(Map<Symbol, Symbol> renamings, Symbol symbol) {
    final Symbol symbol2 = renamings.get(symbol);
    return symbol2 != null ? symbol2 : symbol;
  }

  /** Result of {@link #shortenVarNames}: a renamed environment and a renamed
   * constraint. */
  public static class Renamed {
    /** Renamed bindings, in the order of the original environment. */
    public final ImmutableList<Map.Entry<Symbol, SortedReft>> env;
    public final SubC constraint;

    Renamed(ImmutableList<Map.Entry<Symbol, SortedReft>> env, SubC constraint) {
      this.env = env;
      this.constraint = constraint;
    }
  }
}

// End SymbolRenamer.java
