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
package net.hydromatic.fixpoint.ast;

import static net.hydromatic.fixpoint.util.Static.transformEager;

import com.google.common.collect.ImmutableMap;

/** Visits and transforms expression trees. */
public class Shuttle {
  protected Expr visit(Expr.Var var) {
    return var;
  }

  protected Expr visit(Expr.Literal literal) {
    return literal;
  }

  protected Expr visit(Expr.Apply apply) {
    return apply.copy(
        apply.fn.accept(this), transformEager(apply.args, e -> e.accept(this)));
  }

  protected Expr visit(Expr.Prefix prefix) {
    return prefix.copy(prefix.exp.accept(this));
  }

  protected Expr visit(Expr.Binary binary) {
    return binary.copy(binary.a0.accept(this), binary.a1.accept(this));
  }

  protected Expr visit(Expr.Junction junction) {
    return junction.copy(transformEager(junction.args, e -> e.accept(this)));
  }

  protected Expr visit(Expr.If anIf) {
    return anIf.copy(
        anIf.condition.accept(this),
        anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  protected Expr visit(Expr.Cast cast) {
    return cast.copy(cast.exp.accept(this), cast.sort);
  }

  /**
   * Visits a kvar application. Only the range of the substitution is
   * transformed; its domain names the kvar's parameters.
   */
  protected Expr visit(Expr.KVar kVar) {
    final ImmutableMap.Builder<Symbol, Expr> b = ImmutableMap.builder();
    kVar.substitution.forEach((k, e) -> b.put(k, e.accept(this)));
    return kVar.copy(b.build());
  }
}

// End Shuttle.java
