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

/**
 * Visitor over {@link Sort} objects.
 *
 * @param <R> return type from {@code visit} methods
 * @see Sort#accept(SortVisitor)
 */
public class SortVisitor<R> {
  /** Visits a {@link PrimitiveSort}. */
  public R visit(PrimitiveSort primitiveSort) {
    return null;
  }

  /** Visits an {@link ObjSort}. */
  public R visit(ObjSort objSort) {
    return null;
  }

  /** Visits a {@link VarSort}. */
  public R visit(VarSort varSort) {
    return null;
  }

  /** Visits a {@link TyConSort}. */
  public R visit(TyConSort tyConSort) {
    return null;
  }

  /** Visits a {@link FuncSort}. */
  public R visit(FuncSort funcSort) {
    R r = null;
    for (Sort sort : funcSort.sorts) {
      r = sort.accept(this);
    }
    return r;
  }

  /** Visits an {@link AppSort}. */
  public R visit(AppSort appSort) {
    R r = appSort.sort.accept(this);
    for (Sort sort : appSort.args) {
      r = sort.accept(this);
    }
    return r;
  }
}

// End SortVisitor.java
