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

import static java.util.Objects.requireNonNull;

import java.util.function.UnaryOperator;

/** Type constructor, such as "Set_Set" or "Map_t". */
public class TyConSort implements Sort {
  public final String name;

  TyConSort(String name) {
    this.name = requireNonNull(name);
  }

  /** Creates a type constructor. */
  public static TyConSort of(String name) {
    return new TyConSort(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TyConSort && ((TyConSort) o).name.equals(name);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(name);
  }

  @Override
  public TyConSort copy(UnaryOperator<Sort> transform) {
    return this;
  }

  @Override
  public <R> R accept(SortVisitor<R> sortVisitor) {
    return sortVisitor.visit(this);
  }
}

// End TyConSort.java
