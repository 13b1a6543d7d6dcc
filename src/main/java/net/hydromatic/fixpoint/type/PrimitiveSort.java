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

import java.util.function.UnaryOperator;

/** Built-in sorts that have no components. */
public enum PrimitiveSort implements Sort {
  INT("int"),
  REAL("real"),
  NUM("num"),
  FRAC("frac"),
  BOOL("bool"),
  STR("Str");

  /** The name in fixpoint notation, e.g. "int". */
  public final String moniker;

  PrimitiveSort(String moniker) {
    this.moniker = moniker;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(moniker);
  }

  @Override
  public PrimitiveSort copy(UnaryOperator<Sort> transform) {
    return this;
  }

  @Override
  public <R> R accept(SortVisitor<R> sortVisitor) {
    return sortVisitor.visit(this);
  }
}

// End PrimitiveSort.java
