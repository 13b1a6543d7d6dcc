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
package net.hydromatic.fixpoint.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }

    // Optimize by making the builder the same size as the collection.
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function to
   * each element.
   *
   * <p>More efficient than {@link #transformEager(Collection, Function)},
   * because we can avoid creating a builder for a singleton list.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
      case 0:
        return ImmutableList.of();

      case 1:
        return ImmutableList.of(mapper.apply(elements.get(0)));

      default:
        final ImmutableList.Builder<T> b =
            ImmutableList.builderWithExpectedSize(elements.size());
        elements.forEach(e -> b.add(mapper.apply(e)));
        return b.build();
    }
  }

  /**
   * Eagerly converts a List to an ImmutableList, keeping elements that pass a
   * predicate.
   */
  public static <E> ImmutableList<E> filterEager(
      List<? extends E> elements, Predicate<E> predicate) {
    // Do all the elements match?
    for (int i = 0; i < elements.size(); i++) {
      E element = elements.get(i);
      if (predicate.test(element)) {
        continue;
      }
      final ImmutableList.Builder<E> b =
          ImmutableList.builderWithExpectedSize(elements.size());
      // Add all elements before the first non-matching element.
      for (int j = 0; j < i; j++) {
        b.add(elements.get(j));
      }
      // Test and add all elements after the first non-matching element.
      for (int j = i + 1; j < elements.size(); j++) {
        E e = elements.get(j);
        if (predicate.test(e)) {
          b.add(e);
        }
      }
      return b.build();
    }
    // All elements match. We can just return the original list.
    return ImmutableList.copyOf(elements);
  }

  /**
   * Given a {@link Map}, returns an {@link ImmutableMap} with the same keys,
   * but with each value transformed by a mapping function.
   */
  public static <K, V, V2> ImmutableMap<K, V2> transformValuesEager(
      Map<K, V> map, Function<V, V2> mapper) {
    if (map.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableMap.of();
    }
    final ImmutableMap.Builder<K, V2> b =
        ImmutableMap.builderWithExpectedSize(map.size());
    map.forEach((k, v) -> b.put(k, mapper.apply(v)));
    return b.build();
  }

  /**
   * Returns a map that contains the entries of {@code overlay} and, for keys
   * not in {@code overlay}, the entries of {@code base}. Keys keep the order
   * of {@code base}, followed by keys that only {@code overlay} has.
   */
  public static <K, V> ImmutableMap<K, V> union(
      Map<K, ? extends V> overlay, Map<K, ? extends V> base) {
    if (overlay.isEmpty()) {
      return ImmutableMap.copyOf(base);
    }
    final ImmutableMap.Builder<K, V> b =
        ImmutableMap.builderWithExpectedSize(base.size() + overlay.size());
    base.forEach(
        (k, v) -> {
          final V v2 = overlay.get(k);
          b.put(k, v2 != null ? v2 : v);
        });
    overlay.forEach(
        (k, v) -> {
          if (!base.containsKey(k)) {
            b.put(k, v);
          }
        });
    return b.build();
  }

  /** Returns the union of a collection of sets. */
  public static <E> ImmutableSet<E> unions(
      Iterable<? extends Set<? extends E>> sets) {
    final ImmutableSet.Builder<E> b = ImmutableSet.builder();
    sets.forEach(b::addAll);
    return b.build();
  }

  /** Flushes a builder and returns its contents. */
  public static String str(StringBuilder b) {
    String s = b.toString();
    b.setLength(0);
    return s;
  }

  /** Appends {@code n} spaces to a builder. */
  public static StringBuilder spaces(StringBuilder b, int n) {
    for (int i = 0; i < n; i++) {
      b.append(' ');
    }
    return b;
  }
}

// End Static.java
