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

/** Visits expression trees. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Expr e) {
    e.accept(this);
  }

  protected void visit(Expr.Var var) {}

  protected void visit(Expr.Literal literal) {}

  protected void visit(Expr.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Expr.Prefix prefix) {
    prefix.exp.accept(this);
  }

  protected void visit(Expr.Binary binary) {
    binary.a0.accept(this);
    binary.a1.accept(this);
  }

  protected void visit(Expr.Junction junction) {
    junction.args.forEach(this::accept);
  }

  protected void visit(Expr.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Expr.Cast cast) {
    cast.exp.accept(this);
  }

  protected void visit(Expr.KVar kVar) {
    kVar.substitution.values().forEach(this::accept);
  }
}

// End Visitor.java
