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

import java.util.List;

/** Context for writing an expression out in fixpoint notation. */
public class FixWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public FixWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier to the output. */
  public FixWriter id(Symbol symbol) {
    b.append(symbol.name);
    return this;
  }

  /** Appends an expression, parenthesized if precedence requires. */
  public FixWriter append(Expr e, int left, int right) {
    return e.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public FixWriter infix(int left, Expr a0, Op op, Expr a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a chain of calls to an associative infix operator. */
  public FixWriter infix(int left, List<Expr> args, Op op, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, args, op, 0).append(")");
    }
    for (int i = 0; i < args.size(); i++) {
      final Expr arg = args.get(i);
      if (i > 0) {
        append(op.padded);
      }
      arg.unparse(
          this,
          i == 0 ? left : op.right,
          i == args.size() - 1 ? right : op.left);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End FixWriter.java
