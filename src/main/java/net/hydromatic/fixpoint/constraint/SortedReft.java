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
package net.hydromatic.fixpoint.constraint;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.Sets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.type.Sort;

/** Refinement paired with its sort, "{v : int | v > 0}". */
public class SortedReft {
  public final Sort sort;
  public final Reft reft;

  public SortedReft(Sort sort, Reft reft) {
    this.sort = requireNonNull(sort);
    this.reft = requireNonNull(reft);
  }

  /** Creates a sorted refinement. */
  public static SortedReft of(Sort sort, Symbol bind, Expr pred) {
    return new SortedReft(sort, new Reft(bind, pred));
  }

  @Override
  public int hashCode() {
    return Objects.hash(sort, reft);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SortedReft
            && ((SortedReft) o).sort.equals(sort)
            && ((SortedReft) o).reft.equals(reft);
  }

  /**
   * Returns this sorted refinement in fixpoint notation, for example "{@code
   * {v : int | [v > 0; v < 10]}}".
   */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    b.append(reft.bind).append(" : ");
    sort.describe(b).append(" | [");
    final List<Expr> conjuncts = reft.pred.conjuncts();
    for (int i = 0; i < conjuncts.size(); i++) {
      b.append(i > 0 ? "; " : "").append(conjuncts.get(i));
    }
    return b.append("]}").toString();
  }

  /** Returns the bound symbol. */
  public Symbol bind() {
    return reft.bind;
  }

  /** Returns the predicate. */
  public Expr pred() {
    return reft.pred;
  }

  /**
   * Returns the symbols referenced by the predicate and the object sorts of
   * the sort.
   */
  public Set<Symbol> symbols() {
    return Sets.union(sort.symbols(), reft.pred.freeSymbols()).immutableCopy();
  }

  /** Returns a sorted refinement with a different predicate. */
  public SortedReft withPred(Expr pred) {
    final Reft reft = this.reft.withPred(pred);
    return reft == this.reft ? this : new SortedReft(sort, reft);
  }
}

// End SortedReft.java
