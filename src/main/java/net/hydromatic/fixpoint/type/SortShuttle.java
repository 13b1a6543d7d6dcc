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

/** Visitor over {@link Sort} objects that returns sorts. */
public class SortShuttle extends SortVisitor<Sort> {
  @Override
  public Sort visit(PrimitiveSort primitiveSort) {
    return primitiveSort;
  }

  @Override
  public Sort visit(ObjSort objSort) {
    return objSort;
  }

  @Override
  public Sort visit(VarSort varSort) {
    return varSort;
  }

  @Override
  public Sort visit(TyConSort tyConSort) {
    return tyConSort;
  }

  @Override
  public Sort visit(FuncSort funcSort) {
    return funcSort.copy(s -> s.accept(this));
  }

  @Override
  public Sort visit(AppSort appSort) {
    return appSort.copy(s -> s.accept(this));
  }
}

// End SortShuttle.java
