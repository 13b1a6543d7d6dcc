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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.SortedReft;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Hides the names of bindings that nothing refers to. */
public class BindingEraser {
  private BindingEraser() {}

  /**
   * Erases the names of bindings that are not used.
   *
   * <p>A binding is used if its symbol is live, or occurs free in the
   * predicate of any binding in the list. The latter includes bindings that
   * are themselves unused; we do not compute a transitive closure.
   *
   * <p>Erased bindings remain in the list, in the same position.
   */
  public static List<Entry> eraseUnusedBindings(
      Set<Symbol> liveSymbols, List<Map.Entry<Symbol, SortedReft>> env) {
    final Set<Symbol> used = new HashSet<>(liveSymbols);
    env.forEach(e -> used.addAll(e.getValue().pred().freeSymbols()));

    final ImmutableList.Builder<Entry> b = ImmutableList.builder();
    env.forEach(
        e -> {
          final Symbol key = e.getKey();
          b.add(
              new Entry(used.contains(key) ? key : null, key, e.getValue()));
        });
    return b.build();
  }

  /** Binding whose name may have been erased. */
  public static class Entry {
    /** Name, or null if erased. */
    public final @Nullable Symbol symbol;
    /** Name before erasure; not displayed. */
    public final Symbol key;
    public final SortedReft sortedReft;

    public Entry(@Nullable Symbol symbol, Symbol key, SortedReft sortedReft) {
      this.symbol = symbol;
      this.key = requireNonNull(key);
      this.sortedReft = requireNonNull(sortedReft);
    }

    /** Returns whether the name has been erased. */
    public boolean isErased() {
      return symbol == null;
    }

    @Override
    public int hashCode() {
      return Objects.hash(symbol, key, sortedReft);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Entry
              && Objects.equals(((Entry) o).symbol, symbol)
              && ((Entry) o).key.equals(key)
              && ((Entry) o).sortedReft.equals(sortedReft);
    }

    @Override
    public String toString() {
      return (symbol == null ? "_" : symbol.toString()) + " : " + sortedReft;
    }
  }
}

// End BindingEraser.java
