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
import java.util.List;
import java.util.Objects;
import net.hydromatic.fixpoint.constraint.SortedReft;

/**
 * Sorted refinement of a symbol in an environment, together with the
 * identifiers of the bindings it came from.
 *
 * <p>Used by {@link EnvironmentReduction}. After duplicate bindings of a
 * symbol are merged, there may be several identifiers.
 */
public class Binding {
  public final ImmutableList<Integer> ids;
  public final SortedReft sortedReft;

  private Binding(ImmutableList<Integer> ids, SortedReft sortedReft) {
    this.ids = requireNonNull(ids);
    this.sortedReft = requireNonNull(sortedReft);
  }

  public static Binding of(int id, SortedReft sortedReft) {
    return new Binding(ImmutableList.of(id), sortedReft);
  }

  public static Binding of(List<Integer> ids, SortedReft sortedReft) {
    return new Binding(ImmutableList.copyOf(ids), sortedReft);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ids, sortedReft);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof Binding
            && ids.equals(((Binding) o).ids)
            && sortedReft.equals(((Binding) o).sortedReft);
  }

  @Override
  public String toString() {
    return ids + " " + sortedReft;
  }

  /** Returns a binding with the same identifiers and a different sorted
   * refinement. */
  public Binding withSortedReft(SortedReft sortedReft) {
    return sortedReft.equals(this.sortedReft)
        ? this
        : new Binding(ids, sortedReft);
  }
}

// End Binding.java
