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

import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.AxiomEnv;
import net.hydromatic.fixpoint.constraint.SortedReft;

/**
 * Passes that simplify the environment of a constraint.
 *
 * <p>Every pass is a total function without side effects. A pass that returns
 * an environment may return only the bindings it changed; {@link Prettify}
 * overlays the result on the pass's input.
 *
 * @see EnvironmentReductions
 */
public interface EnvironmentReduction {
  /**
   * Consolidates the bindings of each symbol into one binding, accumulating
   * the identifiers of all bindings that share the symbol.
   */
  Map<Symbol, Binding> mergeDuplicatedBindings(
      List<Map.Entry<Symbol, Binding>> env);

  /**
   * Inlines administrative let-bindings ({@code x = y}) into the other
   * bindings, up to {@code depth} levels.
   */
  Map<Symbol, Binding> undoAnf(int depth, Map<Symbol, Binding> env);

  /** Rewrites trivially true or false boolean refinements. */
  Map<Symbol, Binding> simplifyBooleanRefts(Map<Symbol, Binding> env);

  /**
   * Inlines the environment's bindings into a sorted refinement, up to {@code
   * depth} levels.
   */
  SortedReft inlineInSortedReft(
      int depth, Map<Symbol, Binding> env, SortedReft sortedReft);

  /**
   * Removes bindings that are unlikely to matter to a constraint whose sides
   * reference {@code liveSymbols}.
   *
   * @param axiomSymbols Symbols that each axiom references, as returned by
   *     {@link #axiomEnvSymbols}
   */
  Map<Symbol, SortedReft> dropLikelyIrrelevantBindings(
      Map<Symbol, Set<Symbol>> axiomSymbols,
      Set<Symbol> liveSymbols,
      Map<Symbol, SortedReft> env);

  /** Indexes the symbols that each axiom references, by axiom name. */
  Map<Symbol, Set<Symbol>> axiomEnvSymbols(AxiomEnv axiomEnv);
}

// End EnvironmentReduction.java
