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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.fixpoint.ast.Symbol;

/**
 * Symbols grouped by prefix, then by suffix.
 *
 * <p>Each symbol belongs to exactly one subgroup, the one whose prefix and
 * suffix are those of the symbol. Groups and subgroups are in the order in
 * which their first member was added.
 */
public class PrefixSuffixMap {
  public final ImmutableMap<String, ImmutableMap<String, ImmutableList<Symbol>>>
      map;

  private PrefixSuffixMap(
      ImmutableMap<String, ImmutableMap<String, ImmutableList<Symbol>>> map) {
    this.map = map;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Groups a collection of symbols. */
  public static PrefixSuffixMap of(Iterable<Symbol> symbols) {
    final Builder builder = builder();
    symbols.forEach(builder::add);
    return builder.build();
  }

  /** Returns the subgroups of a prefix, or an empty map. */
  public ImmutableMap<String, ImmutableList<Symbol>> group(String prefix) {
    final ImmutableMap<String, ImmutableList<Symbol>> group = map.get(prefix);
    return group == null ? ImmutableMap.of() : group;
  }

  /** Calls an action for each prefix group. */
  public void forEach(
      BiConsumer<String, ImmutableMap<String, ImmutableList<Symbol>>> action) {
    map.forEach(action);
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /** Builder for {@link PrefixSuffixMap}. */
  public static class Builder {
    private final Map<String, Map<String, List<Symbol>>> map =
        new LinkedHashMap<>();

    /** Adds a symbol to the subgroup of its prefix and suffix. */
    public Builder add(Symbol symbol) {
      map.computeIfAbsent(symbol.prefix(), p -> new LinkedHashMap<>())
          .computeIfAbsent(symbol.suffix(), s -> new ArrayList<>())
          .add(symbol);
      return this;
    }

    public PrefixSuffixMap build() {
      final ImmutableMap.Builder<
              String, ImmutableMap<String, ImmutableList<Symbol>>>
          b = ImmutableMap.builder();
      map.forEach(
          (prefix, group) -> {
            final ImmutableMap.Builder<String, ImmutableList<Symbol>> b2 =
                ImmutableMap.builder();
            group.forEach(
                (suffix, symbols) ->
                    b2.put(suffix, ImmutableList.copyOf(symbols)));
            b.put(prefix, b2.build());
          });
      return new PrefixSuffixMap(b.build());
    }
  }
}

// End PrefixSuffixMap.java
