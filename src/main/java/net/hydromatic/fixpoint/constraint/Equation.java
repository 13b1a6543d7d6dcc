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
import java.util.List;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.type.Sort;

/**
 * Definition of a function that the solver may unfold, "define f(x, y) =
 * body".
 */
public class Equation {
  public final Symbol name;
  public final List<Symbol> params;
  public final Expr body;
  public final Sort sort;

  public Equation(Symbol name, List<Symbol> params, Expr body, Sort sort) {
    this.name = requireNonNull(name);
    this.params = ImmutableList.copyOf(params);
    this.body = requireNonNull(body);
    this.sort = requireNonNull(sort);
  }

  @Override
  public String toString() {
    return "define " + name + params + " : " + sort + " = " + body;
  }
}

// End Equation.java
