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

import java.util.Objects;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Symbol;

/**
 * Refinement: a predicate over a bound symbol.
 *
 * <p>Within the predicate, the bound symbol stands for "this value". For
 * example, in {@code {v | v > 0}}, the bound symbol is {@code v}.
 */
public class Reft {
  public final Symbol bind;
  public final Expr pred;

  public Reft(Symbol bind, Expr pred) {
    this.bind = requireNonNull(bind);
    this.pred = requireNonNull(pred);
  }

  @Override
  public int hashCode() {
    return Objects.hash(bind, pred);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Reft
            && ((Reft) o).bind.equals(bind)
            && ((Reft) o).pred.equals(pred);
  }

  @Override
  public String toString() {
    return "{" + bind + " | " + pred + "}";
  }

  /** Returns a refinement with a different predicate. */
  public Reft withPred(Expr pred) {
    return pred.equals(this.pred) ? this : new Reft(bind, pred);
  }
}

// End Reft.java
