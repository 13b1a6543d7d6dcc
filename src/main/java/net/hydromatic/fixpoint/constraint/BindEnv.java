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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.fixpoint.ast.Symbol;

/**
 * Table of all bindings in a query, keyed by binding identifier.
 *
 * <p>Constraints refer to their environments as sets of binding identifiers.
 * Several identifiers may bind the same symbol.
 */
public class BindEnv {
  private final ImmutableSortedMap<Integer, Bind> map;

  private BindEnv(ImmutableSortedMap<Integer, Bind> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the binding with a given identifier.
   *
   * @throws IllegalArgumentException if the identifier is not bound
   */
  public Bind lookup(int id) {
    final Bind bind = map.get(id);
    checkArgument(bind != null, "binding %s not found in environment", id);
    return bind;
  }

  /** Binding of a symbol to a sorted refinement. */
  public static class Bind {
    public final int id;
    public final Symbol symbol;
    public final SortedReft sortedReft;

    Bind(int id, Symbol symbol, SortedReft sortedReft) {
      this.id = id;
      this.symbol = requireNonNull(symbol);
      this.sortedReft = requireNonNull(sortedReft);
    }

    @Override
    public String toString() {
      return id + ": " + symbol + " : " + sortedReft;
    }
  }

  /** Builder for {@link BindEnv}. */
  public static class Builder {
    private final SortedMap<Integer, Bind> map = new TreeMap<>();
    private int nextId = 0;

    /** Adds a binding and returns its identifier. */
    public int add(Symbol symbol, SortedReft sortedReft) {
      final int id = nextId;
      add(id, symbol, sortedReft);
      return id;
    }

    /** Adds a binding with a given identifier. */
    public Builder add(int id, Symbol symbol, SortedReft sortedReft) {
      checkArgument(!map.containsKey(id), "duplicate binding id %s", id);
      map.put(id, new Bind(id, symbol, sortedReft));
      nextId = Math.max(nextId, id + 1);
      return this;
    }

    public BindEnv build() {
      return new BindEnv(ImmutableSortedMap.copyOfSorted(map));
    }
  }
}

// End BindEnv.java
