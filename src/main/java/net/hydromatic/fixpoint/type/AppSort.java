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

/** Application of a sort to arguments, "(Map_t int bool)". */
public class AppSort implements Sort {
  public final Sort sort;
  public final List<Sort> args;

  AppSort(Sort sort, ImmutableList<Sort> args) {
    this.sort = requireNonNull(sort);
    this.args = requireNonNull(args);
    checkArgument(!args.isEmpty(), "application has no arguments");
  }

  /** Creates a sort application. */
  public static AppSort of(Sort sort, List<? extends Sort> args) {
    return new AppSort(sort, ImmutableList.copyOf(args));
  }

  /** Creates a sort application. */
  public static AppSort of(Sort sort, Sort... args) {
    return of(sort, ImmutableList.copyOf(args));
  }

  @Override
  public int hashCode() {
    return Objects.hash(sort, args);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof AppSort
            && ((AppSort) o).sort.equals(sort)
            && ((AppSort) o).args.equals(args);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    sort.describe(buf);
    for (Sort arg : args) {
      arg.describe(buf.append(' '));
    }
    return buf.append(')');
  }

  @Override
  public AppSort copy(UnaryOperator<Sort> transform) {
    final Sort sort = transform.apply(this.sort);
    final List<Sort> args = transformEager(this.args, transform);
    return sort.equals(this.sort) && args.equals(this.args)
        ? this
        : of(sort, args);
  }

  @Override
  public <R> R accept(SortVisitor<R> sortVisitor) {
    return sortVisitor.visit(this);
  }
}

// End AppSort.java
