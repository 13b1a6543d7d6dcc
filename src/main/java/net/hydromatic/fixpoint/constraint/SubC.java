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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Subtyping constraint.
 *
 * <p>States that, in the environment formed by the bindings {@link #envIds},
 * the left-hand sorted refinement entails the right-hand one.
 */
public class SubC {
  /** Identifiers, in the query's {@link BindEnv}, of the bindings in scope. */
  public final ImmutableSortedSet<Integer> envIds;

  public final SortedReft lhs;
  public final SortedReft rhs;
  public final @Nullable Integer id;
  public final ImmutableList<Integer> tag;
  /** Metadata; opaque to the solver, printed using {@link #toString()}. */
  public final Object info;

  private SubC(
      ImmutableSortedSet<Integer> envIds,
      SortedReft lhs,
      SortedReft rhs,
      @Nullable Integer id,
      ImmutableList<Integer> tag,
      Object info) {
    this.envIds = requireNonNull(envIds);
    this.lhs = requireNonNull(lhs);
    this.rhs = requireNonNull(rhs);
    this.id = id;
    this.tag = requireNonNull(tag);
    this.info = requireNonNull(info);
  }

  /** Creates a constraint. */
  public static SubC of(
      Collection<Integer> envIds,
      SortedReft lhs,
      SortedReft rhs,
      @Nullable Integer id,
      List<Integer> tag,
      Object info) {
    return new SubC(
        ImmutableSortedSet.copyOf(envIds),
        lhs,
        rhs,
        id,
        ImmutableList.copyOf(tag),
        info);
  }

  @Override
  public String toString() {
    return "SubC{id=" + id + ", lhs=" + lhs + ", rhs=" + rhs + "}";
  }

  /** Returns a copy of this constraint with different sides. */
  public SubC withSides(SortedReft lhs, SortedReft rhs) {
    if (lhs.equals(this.lhs) && rhs.equals(this.rhs)) {
      return this;
    }
    return new SubC(envIds, lhs, rhs, id, tag, info);
  }
}

// End SubC.java
