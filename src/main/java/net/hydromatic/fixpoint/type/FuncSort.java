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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.fixpoint.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Function sort, "func(n, [s0; ...; sk])".
 *
 * <p>{@code n} is the number of sort variables that the function is generic
 * over; the last of the sorts is the result.
 */
public class FuncSort implements Sort {
  public final int typeVarCount;
  public final List<Sort> sorts;

  FuncSort(int typeVarCount, ImmutableList<Sort> sorts) {
    this.typeVarCount = typeVarCount;
    this.sorts = requireNonNull(sorts);
    checkArgument(typeVarCount >= 0);
    checkArgument(sorts.size() >= 2, "function needs argument and result");
  }

  /** Creates a function sort. */
  public static FuncSort of(int typeVarCount, List<? extends Sort> sorts) {
    return new FuncSort(typeVarCount, ImmutableList.copyOf(sorts));
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeVarCount, sorts);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FuncSort
            && ((FuncSort) o).typeVarCount == typeVarCount
            && ((FuncSort) o).sorts.equals(sorts);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("func(").append(typeVarCount).append(", [");
    for (int i = 0; i < sorts.size(); i++) {
      if (i > 0) {
        buf.append("; ");
      }
      sorts.get(i).describe(buf);
    }
    return buf.append("])");
  }

  @Override
  public FuncSort copy(UnaryOperator<Sort> transform) {
    final List<Sort> sorts = transformEager(this.sorts, transform);
    return sorts.equals(this.sorts) ? this : of(typeVarCount, sorts);
  }

  @Override
  public <R> R accept(SortVisitor<R> sortVisitor) {
    return sortVisitor.visit(this);
  }
}

// End FuncSort.java
