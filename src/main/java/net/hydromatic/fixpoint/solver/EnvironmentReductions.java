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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.fixpoint.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Op;
import net.hydromatic.fixpoint.ast.Shuttle;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.AxiomEnv;
import net.hydromatic.fixpoint.constraint.Equation;
import net.hydromatic.fixpoint.constraint.SortedReft;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link EnvironmentReduction}. */
public abstract class EnvironmentReductions {
  private EnvironmentReductions() {}

  /**
   * Prefix of the names of variables that the compiler introduces when it
   * converts a program to administrative normal form.
   */
  public static final String ANF_PREFIX = "lq_anf$";

  private static final EnvironmentReduction IDENTITY = new IdentityReduction();

  private static final EnvironmentReduction STANDARD = new StandardReduction();

  /**
   * Returns a reduction whose passes change nothing.
   *
   * <p>Its merge pass keeps the last binding of each symbol, but accumulates
   * the identifiers of all of them; it drops no bindings, and its axiom index
   * is empty.
   */
  public static EnvironmentReduction identity() {
    return IDENTITY;
  }

  /** Returns the standard reduction. */
  public static EnvironmentReduction standard() {
    return STANDARD;
  }

  /**
   * If {@code pred}, or one of its conjuncts, is "{@code v = e}" or "{@code e
   * = v}", where {@code e} does not reference {@code v}, returns {@code e};
   * otherwise null.
   */
  static @Nullable Expr definition(Symbol v, Expr pred) {
    for (Expr conjunct : pred.conjuncts()) {
      if (conjunct.op == Op.EQ) {
        final Expr.Binary eq = (Expr.Binary) conjunct;
        final Expr e;
        if (isVar(eq.a0, v)) {
          e = eq.a1;
        } else if (isVar(eq.a1, v)) {
          e = eq.a0;
        } else {
          continue;
        }
        if (!e.freeSymbols().contains(v)) {
          return e;
        }
      }
    }
    return null;
  }

  /** Returns the definition of the bound variable of a sorted refinement, or
   * null. */
  static @Nullable Expr definition(SortedReft sortedReft) {
    return definition(sortedReft.bind(), sortedReft.pred());
  }

  private static boolean isVar(Expr e, Symbol symbol) {
    return e.op == Op.VAR && ((Expr.Var) e).symbol.equals(symbol);
  }

  /**
   * Substitutes definitions into an expression repeatedly, until there is no
   * change or {@code depth} rounds have been applied.
   */
  static Expr inline(int depth, Map<Symbol, Expr> definitions, Expr e) {
    for (int i = 0; i < depth; i++) {
      final Expr e2 = e.subst(definitions);
      if (e2.equals(e)) {
        break;
      }
      e = e2;
    }
    return e;
  }

  /** Creates a conjunction, simplified if it has fewer than two terms. */
  static Expr and(List<Expr> conjuncts) {
    switch (conjuncts.size()) {
      case 0:
        return expr.trueLiteral();
      case 1:
        return conjuncts.get(0);
      default:
        return expr.and(conjuncts);
    }
  }

  /** Reduction that changes nothing. */
  private static class IdentityReduction implements EnvironmentReduction {
    @Override
    public Map<Symbol, Binding> mergeDuplicatedBindings(
        List<Map.Entry<Symbol, Binding>> env) {
      final Map<Symbol, Binding> map = new LinkedHashMap<>();
      env.forEach(
          entry ->
              map.merge(
                  entry.getKey(),
                  entry.getValue(),
                  (b0, b1) ->
                      Binding.of(
                          ImmutableList.<Integer>builder()
                              .addAll(b0.ids)
                              .addAll(b1.ids)
                              .build(),
                          b1.sortedReft)));
      return ImmutableMap.copyOf(map);
    }

    @Override
    public Map<Symbol, Binding> undoAnf(int depth, Map<Symbol, Binding> env) {
      return ImmutableMap.of();
    }

    @Override
    public Map<Symbol, Binding> simplifyBooleanRefts(Map<Symbol, Binding> env) {
      return ImmutableMap.of();
    }

    @Override
    public SortedReft inlineInSortedReft(
        int depth, Map<Symbol, Binding> env, SortedReft sortedReft) {
      return sortedReft;
    }

    @Override
    public Map<Symbol, SortedReft> dropLikelyIrrelevantBindings(
        Map<Symbol, Set<Symbol>> axiomSymbols,
        Set<Symbol> liveSymbols,
        Map<Symbol, SortedReft> env) {
      return ImmutableMap.copyOf(env);
    }

    @Override
    public Map<Symbol, Set<Symbol>> axiomEnvSymbols(AxiomEnv axiomEnv) {
      return ImmutableMap.of();
    }
  }

  /** Standard reduction. */
  private static class StandardReduction implements EnvironmentReduction {
    /**
     * {@inheritDoc}
     *
     * <p>The predicates of the bindings of a symbol are conjoined, after each
     * binding's bound variable is renamed to that of the first binding.
     * Duplicate conjuncts are removed. All bindings of a symbol must have the
     * same sort.
     */
    @Override
    public Map<Symbol, Binding> mergeDuplicatedBindings(
        List<Map.Entry<Symbol, Binding>> env) {
      final Map<Symbol, List<Binding>> groups = new LinkedHashMap<>();
      env.forEach(
          entry ->
              groups
                  .computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                  .add(entry.getValue()));

      final ImmutableMap.Builder<Symbol, Binding> b = ImmutableMap.builder();
      groups.forEach(
          (symbol, bindings) -> b.put(symbol, merge(symbol, bindings)));
      return b.build();
    }

    private static Binding merge(Symbol symbol, List<Binding> bindings) {
      final Binding first = bindings.get(0);
      if (bindings.size() == 1) {
        return first;
      }
      final SortedReft sortedReft = first.sortedReft;
      final Symbol v = sortedReft.bind();
      final ImmutableList.Builder<Integer> ids = ImmutableList.builder();
      final Set<Expr> conjuncts = new LinkedHashSet<>();
      for (Binding binding : bindings) {
        checkArgument(
            binding.sortedReft.sort.equals(sortedReft.sort),
            "cannot merge bindings of %s with sorts %s and %s",
            symbol,
            sortedReft.sort,
            binding.sortedReft.sort);
        ids.addAll(binding.ids);
        final Symbol v2 = binding.sortedReft.bind();
        final Expr pred =
            v2.equals(v)
                ? binding.sortedReft.pred()
                : binding.sortedReft.pred().subst(
                    ImmutableMap.of(v2, expr.var(v)));
        conjuncts.addAll(pred.conjuncts());
      }
      final Expr pred = and(ImmutableList.copyOf(conjuncts));
      return Binding.of(ids.build(), sortedReft.withPred(pred));
    }

    /**
     * {@inheritDoc}
     *
     * <p>A binding whose symbol starts with {@link #ANF_PREFIX} and whose
     * predicate is "{@code v = e}" defines its symbol as {@code e}. Those
     * definitions are substituted into the predicates of the other bindings.
     * Returns only the bindings that changed.
     */
    @Override
    public Map<Symbol, Binding> undoAnf(int depth, Map<Symbol, Binding> env) {
      final Map<Symbol, Expr> definitions = new LinkedHashMap<>();
      env.forEach(
          (symbol, binding) -> {
            if (symbol.startsWith(ANF_PREFIX)) {
              final Expr e = definition(binding.sortedReft);
              if (e != null) {
                definitions.put(symbol, e);
              }
            }
          });
      if (definitions.isEmpty()) {
        return ImmutableMap.of();
      }

      final ImmutableMap.Builder<Symbol, Binding> b = ImmutableMap.builder();
      env.forEach(
          (symbol, binding) -> {
            if (definitions.containsKey(symbol)) {
              return;
            }
            final SortedReft sortedReft = binding.sortedReft;
            final Expr pred = inline(depth, definitions, sortedReft.pred());
            if (!pred.equals(sortedReft.pred())) {
              b.put(symbol, binding.withSortedReft(sortedReft.withPred(pred)));
            }
          });
      return b.build();
    }

    @Override
    public Map<Symbol, Binding> simplifyBooleanRefts(Map<Symbol, Binding> env) {
      final ImmutableMap.Builder<Symbol, Binding> b = ImmutableMap.builder();
      env.forEach(
          (symbol, binding) -> {
            final SortedReft sortedReft = binding.sortedReft;
            final Expr pred = simplify(sortedReft.pred());
            if (!pred.equals(sortedReft.pred())) {
              b.put(symbol, binding.withSortedReft(sortedReft.withPred(pred)));
            }
          });
      return b.build();
    }

    /**
     * {@inheritDoc}
     *
     * <p>A binding whose predicate is "{@code v = e}" defines its symbol as
     * {@code e}, provided that {@code e} does not reference the symbol.
     */
    @Override
    public SortedReft inlineInSortedReft(
        int depth, Map<Symbol, Binding> env, SortedReft sortedReft) {
      final Map<Symbol, Expr> definitions = new LinkedHashMap<>();
      env.forEach(
          (symbol, binding) -> {
            final Expr e = definition(binding.sortedReft);
            if (e != null && !e.freeSymbols().contains(symbol)) {
              definitions.put(symbol, e);
            }
          });
      definitions.remove(sortedReft.bind());
      if (definitions.isEmpty()) {
        return sortedReft;
      }
      return sortedReft.withPred(
          inline(depth, definitions, sortedReft.pred()));
    }

    /**
     * {@inheritDoc}
     *
     * <p>Keeps the bindings reachable from the live symbols in a graph that
     * has an edge from each binding's symbol to the symbols of its sorted
     * refinement, and from each axiom to the symbols it references.
     */
    @Override
    public Map<Symbol, SortedReft> dropLikelyIrrelevantBindings(
        Map<Symbol, Set<Symbol>> axiomSymbols,
        Set<Symbol> liveSymbols,
        Map<Symbol, SortedReft> env) {
      final MutableGraph<Symbol> graph =
          GraphBuilder.directed().allowsSelfLoops(true).build();
      liveSymbols.forEach(graph::addNode);
      env.forEach(
          (symbol, sortedReft) -> {
            graph.addNode(symbol);
            sortedReft.symbols().forEach(s -> graph.putEdge(symbol, s));
          });
      axiomSymbols.forEach(
          (axiom, symbols) -> symbols.forEach(s -> graph.putEdge(axiom, s)));

      final Set<Symbol> reachable = new HashSet<>();
      for (Symbol symbol : liveSymbols) {
        if (!reachable.contains(symbol)) {
          reachable.addAll(Graphs.reachableNodes(graph, symbol));
        }
      }
      final ImmutableMap.Builder<Symbol, SortedReft> b = ImmutableMap.builder();
      env.forEach(
          (symbol, sortedReft) -> {
            if (reachable.contains(symbol)) {
              b.put(symbol, sortedReft);
            }
          });
      return b.build();
    }

    /**
     * {@inheritDoc}
     *
     * <p>The symbols of an equation are the free symbols of its body, other
     * than its parameters.
     */
    @Override
    public Map<Symbol, Set<Symbol>> axiomEnvSymbols(AxiomEnv axiomEnv) {
      final Map<Symbol, Set<Symbol>> map = new LinkedHashMap<>();
      for (Equation equation : axiomEnv.equations) {
        final Set<Symbol> symbols =
            Sets.difference(
                    equation.body.freeSymbols(),
                    ImmutableSet.copyOf(equation.params))
                .immutableCopy();
        map.merge(
            equation.name,
            symbols,
            (s0, s1) -> Sets.union(s0, s1).immutableCopy());
      }
      return ImmutableMap.copyOf(map);
    }
  }

  /** Simplifies a boolean expression by folding constants. */
  static Expr simplify(Expr e) {
    return e.accept(new BooleanSimplifier());
  }

  /** Shuttle that folds {@code true} and {@code false} through the boolean
   * connectives. */
  private static class BooleanSimplifier extends Shuttle {
    @Override
    protected Expr visit(Expr.Junction junction) {
      final Expr.Junction j = (Expr.Junction) super.visit(junction);
      final List<Expr> args = new ArrayList<>();
      if (j.op == Op.AND) {
        for (Expr arg : j.args) {
          if (arg.isContradiction()) {
            return expr.falseLiteral();
          }
          if (arg.op == Op.AND) {
            args.addAll(((Expr.Junction) arg).args);
          } else if (!arg.isTautology()) {
            args.add(arg);
          }
        }
        return and(args);
      } else {
        for (Expr arg : j.args) {
          if (arg.isTautology()) {
            return expr.trueLiteral();
          }
          if (arg.op == Op.OR) {
            args.addAll(((Expr.Junction) arg).args);
          } else if (!arg.isContradiction()) {
            args.add(arg);
          }
        }
        switch (args.size()) {
          case 0:
            return expr.falseLiteral();
          case 1:
            return args.get(0);
          default:
            return expr.or(args);
        }
      }
    }

    @Override
    protected Expr visit(Expr.Prefix prefix) {
      final Expr.Prefix p = (Expr.Prefix) super.visit(prefix);
      if (p.op != Op.NOT) {
        return p;
      }
      return not(p.exp);
    }

    @Override
    protected Expr visit(Expr.Binary binary) {
      final Expr.Binary b = (Expr.Binary) super.visit(binary);
      switch (b.op) {
        case EQ:
          return b.a0.equals(b.a1) ? expr.trueLiteral() : b;
        case IMPLIES:
          if (b.a0.isTautology()) {
            return b.a1;
          }
          if (b.a0.isContradiction() || b.a1.isTautology()) {
            return expr.trueLiteral();
          }
          if (b.a1.isContradiction()) {
            return not(b.a0);
          }
          return b;
        case IFF:
          if (b.a0.isTautology()) {
            return b.a1;
          }
          if (b.a1.isTautology()) {
            return b.a0;
          }
          if (b.a0.isContradiction()) {
            return not(b.a1);
          }
          if (b.a1.isContradiction()) {
            return not(b.a0);
          }
          return b;
        default:
          return b;
      }
    }

    private static Expr not(Expr e) {
      if (e.isTautology()) {
        return expr.falseLiteral();
      }
      if (e.isContradiction()) {
        return expr.trueLiteral();
      }
      if (e.op == Op.NOT) {
        return ((Expr.Prefix) e).exp;
      }
      return expr.not(e);
    }
  }
}

// End EnvironmentReductions.java
