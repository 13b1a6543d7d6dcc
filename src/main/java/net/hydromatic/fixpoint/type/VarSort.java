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

import java.util.function.UnaryOperator;

/** Sort variable, "@(0)". */
public class VarSort implements Sort {
  public final int ordinal;

  VarSort(int ordinal) {
    checkArgument(ordinal >= 0);
    this.ordinal = ordinal;
  }

  /** Creates a sort variable. */
  public static VarSort of(int ordinal) {
    return new VarSort(ordinal);
  }

  @Override
  public int hashCode() {
    return ordinal;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof VarSort && ((VarSort) o).ordinal == ordinal;
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("@(").append(ordinal).append(')');
  }

  @Override
  public VarSort copy(UnaryOperator<Sort> transform) {
    return this;
  }

  @Override
  public <R> R accept(SortVisitor<R> sortVisitor) {
    return sortVisitor.visit(this);
  }
}

// End VarSort.java
