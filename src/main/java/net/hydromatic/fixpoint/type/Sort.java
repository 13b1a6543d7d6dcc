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
package net.hydromatic.fixpoint.type;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import net.hydromatic.fixpoint.ast.Symbol;

/**
 * Sort (type annotation) of a refinement.
 *
 * <p>{@link #toString()} returns the sort in the solver's fixpoint notation,
 * for example "{@code int}", "{@code (Set_Set int)}", "{@code func(1, [@(0);
 * int])}".
 */
public interface Sort {
  /** Appends this sort in fixpoint notation to a buffer. */
  StringBuilder describe(StringBuilder buf);

  /**
   * Copies this sort, applying a given transform to component sorts, and
   * returning the original sort if the component sorts are unchanged.
   */
  Sort copy(UnaryOperator<Sort> transform);

  <R> R accept(SortVisitor<R> sortVisitor);

  /**
   * Returns a copy of this sort in which every object sort is replaced by the
   * sort that a function returns for its symbol.
   */
  default Sort substSort(Function<Symbol, Sort> f) {
    return accept(
        new SortShuttle() {
          @Override
          public Sort visit(ObjSort objSort) {
            return f.apply(objSort.symbol);
          }
        });
  }

  /** Returns the symbols of the object sorts in this sort. */
  default Set<Symbol> symbols() {
    final ImmutableSet.Builder<Symbol> b = ImmutableSet.builder();
    accept(
        new SortVisitor<Void>() {
          @Override
          public Void visit(ObjSort objSort) {
            b.add(objSort.symbol);
            return null;
          }
        });
    return b.build();
  }
}

// End Sort.java
