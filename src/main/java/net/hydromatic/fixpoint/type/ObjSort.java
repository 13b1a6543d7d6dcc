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
import net.hydromatic.fixpoint.ast.Symbol;

/** Object sort, an uninterpreted sort named by a symbol. */
public class ObjSort implements Sort {
  public final Symbol symbol;

  ObjSort(Symbol symbol) {
    this.symbol = requireNonNull(symbol);
  }

  /** Creates an object sort. */
  public static ObjSort of(Symbol symbol) {
    return new ObjSort(symbol);
  }

  @Override
  public int hashCode() {
    return symbol.hashCode() + 7;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ObjSort && ((ObjSort) o).symbol.equals(symbol);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(symbol.name);
  }

  @Override
  public ObjSort copy(UnaryOperator<Sort> transform) {
    return this;
  }

  @Override
  public <R> R accept(SortVisitor<R> sortVisitor) {
    return sortVisitor.visit(this);
  }
}

// End ObjSort.java
