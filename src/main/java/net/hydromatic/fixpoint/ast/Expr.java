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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.fixpoint.type.Sort;

/**
 * Logical expression over symbols, literals and operators.
 *
 * <p>Predicates are expressions too; {@code true} is an empty conjunction and
 * {@code false} an empty disjunction.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * of the sub-classes short.
 */
public abstract class Expr {
  public final Op op;

  Expr(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this expression into a string in the solver's fixpoint notation.
   *
   * <p>Derived classes must not override; override {@link #unparse(FixWriter,
   * int, int)}, which inserts parentheses as necessary for operator
   * precedence.
   */
  @Override
  public final String toString() {
    return unparse(new FixWriter(), 0, 0).toString();
  }

  abstract FixWriter unparse(FixWriter w, int left, int right);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this node, and returning the result.
   */
  public abstract Expr accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate to
   * the type of this node.
   */
  public abstract void accept(Visitor visitor);

  /**
   * Returns the symbols referenced by this expression.
   *
   * <p>Includes the symbols in the range of a {@link KVar}'s substitution, but
   * not its domain or the name of the kvar itself.
   */
  public Set<Symbol> freeSymbols() {
    final ImmutableSet.Builder<Symbol> b = ImmutableSet.builder();
    accept(
        new Visitor() {
          @Override
          protected void visit(Var var) {
            b.add(var.symbol);
          }
        });
    return b.build();
  }

  /** Replaces every variable by the expression that a function returns. */
  public Expr substf(Function<Symbol, ? extends Expr> f) {
    return accept(
        new Shuttle() {
          @Override
          protected Expr visit(Var var) {
            return f.apply(var.symbol);
          }
        });
  }

  /** Replaces variables that are keys in a map. */
  public Expr subst(Map<Symbol, ? extends Expr> map) {
    if (map.isEmpty()) {
      return this;
    }
    return substf(
        symbol -> {
          final Expr e = map.get(symbol);
          return e != null ? e : ExprBuilder.expr.var(symbol);
        });
  }

  /** Replaces object sorts in casts. */
  public Expr substSort(Function<Symbol, Sort> f) {
    return accept(
        new Shuttle() {
          @Override
          protected Expr visit(Cast cast) {
            return cast.copy(cast.exp.accept(this), cast.sort.substSort(f));
          }
        });
  }

  /**
   * Returns the conjuncts of this predicate, flattening nested conjunctions
   * and removing tautologies.
   */
  public List<Expr> conjuncts() {
    final ImmutableList.Builder<Expr> b = ImmutableList.builder();
    addConjuncts(b, this);
    return b.build();
  }

  private static void addConjuncts(ImmutableList.Builder<Expr> b, Expr e) {
    if (e.op == Op.AND) {
      ((Junction) e).args.forEach(arg -> addConjuncts(b, arg));
    } else if (!e.isTautology()) {
      b.add(e);
    }
  }

  /** Returns whether this expression is trivially true. */
  public boolean isTautology() {
    switch (op) {
      case BOOL_LITERAL:
        return Boolean.TRUE.equals(((Literal) this).value);
      case AND:
        return ((Junction) this).args.stream().allMatch(Expr::isTautology);
      default:
        return false;
    }
  }

  /** Returns whether this expression is trivially false. */
  public boolean isContradiction() {
    switch (op) {
      case BOOL_LITERAL:
        return Boolean.FALSE.equals(((Literal) this).value);
      case OR:
        return ((Junction) this).args.stream()
            .allMatch(Expr::isContradiction);
      default:
        return false;
    }
  }

  /** Reference to a variable. */
  public static class Var extends Expr {
    public final Symbol symbol;

    Var(Symbol symbol) {
      super(Op.VAR);
      this.symbol = requireNonNull(symbol);
    }

    @Override
    public int hashCode() {
      return symbol.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).symbol.equals(symbol);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      return w.id(symbol);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal: boolean, integer, real or string. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Expr {
    public final Comparable value;

    Literal(Op op, Comparable value) {
      super(op);
      this.value = requireNonNull(value);
      checkArgument(
          op == Op.BOOL_LITERAL && value instanceof Boolean
              || op == Op.INT_LITERAL && value instanceof BigDecimal
              || op == Op.REAL_LITERAL && value instanceof BigDecimal
              || op == Op.STRING_LITERAL && value instanceof String,
          "bad literal %s %s",
          op,
          value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && ((Literal) o).op == op
              && ((Literal) o).value.equals(value);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      switch (op) {
        case STRING_LITERAL:
          return w.append("\"").append((String) value).append("\"");
        case INT_LITERAL:
        case REAL_LITERAL:
          final BigDecimal d = (BigDecimal) value;
          if (d.signum() < 0) {
            return w.append("(").append(d.toString()).append(")");
          }
          return w.append(d.toString());
        default:
          return w.append(value.toString());
      }
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Application of an uninterpreted or built-in function, "f x y". */
  public static class Apply extends Expr {
    public final Expr fn;
    public final List<Expr> args;

    Apply(Expr fn, ImmutableList<Expr> args) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "application has no arguments");
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && ((Apply) o).fn.equals(fn)
              && ((Apply) o).args.equals(args);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(fn, left, op.left);
      for (Expr arg : args) {
        w.append(op.padded).append(arg, op.right, op.right);
      }
      return w;
    }

    public Apply copy(Expr fn, List<Expr> args) {
      return fn == this.fn && args.equals(this.args)
          ? this
          : new Apply(fn, ImmutableList.copyOf(args));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a prefix operator, "-e" or "not p". */
  public static class Prefix extends Expr {
    public final Expr exp;

    Prefix(Op op, Expr exp) {
      super(op);
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.NEGATE || op == Op.NOT, "not prefix: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Prefix
              && ((Prefix) o).op == op
              && ((Prefix) o).exp.equals(exp);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(exp, op.right, right);
    }

    public Prefix copy(Expr exp) {
      return exp == this.exp ? this : new Prefix(op, exp);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Call to a binary operator: arithmetic ("x + y"), relational ("x &lt;
   * y"), implication or bi-implication.
   */
  public static class Binary extends Expr {
    public final Expr a0;
    public final Expr a1;

    Binary(Op op, Expr a0, Expr a1) {
      super(op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isBinary(), "not binary: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && ((Binary) o).op == op
              && ((Binary) o).a0.equals(a0)
              && ((Binary) o).a1.equals(a1);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    public Binary copy(Expr a0, Expr a1) {
      return a0 == this.a0 && a1 == this.a1 ? this : new Binary(op, a0, a1);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conjunction ("&amp;&amp;") or disjunction ("||") of zero or more terms. */
  public static class Junction extends Expr {
    public final List<Expr> args;

    Junction(Op op, ImmutableList<Expr> args) {
      super(op);
      this.args = requireNonNull(args);
      checkArgument(op == Op.AND || op == Op.OR, "not junction: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Junction
              && ((Junction) o).op == op
              && ((Junction) o).args.equals(args);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      switch (args.size()) {
        case 0:
          return w.append(op == Op.AND ? "true" : "false");
        case 1:
          return w.append(args.get(0), left, right);
        default:
          return w.infix(left, args, op, right);
      }
    }

    public Junction copy(List<Expr> args) {
      return args.equals(this.args)
          ? this
          : new Junction(op, ImmutableList.copyOf(args));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "if c then a else b". */
  public static class If extends Expr {
    public final Expr condition;
    public final Expr ifTrue;
    public final Expr ifFalse;

    If(Expr condition, Expr ifTrue, Expr ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && ((If) o).condition.equals(condition)
              && ((If) o).ifTrue.equals(ifTrue)
              && ((If) o).ifFalse.equals(ifFalse);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ")
          .append(condition, 0, 0)
          .append(" then ")
          .append(ifTrue, 0, 0)
          .append(" else ")
          .append(ifFalse, 0, 0);
    }

    public If copy(Expr condition, Expr ifTrue, Expr ifFalse) {
      return condition == this.condition
              && ifTrue == this.ifTrue
              && ifFalse == this.ifFalse
          ? this
          : new If(condition, ifTrue, ifFalse);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression annotated with a sort, "(e : s)". */
  public static class Cast extends Expr {
    public final Expr exp;
    public final Sort sort;

    Cast(Expr exp, Sort sort) {
      super(Op.CAST);
      this.exp = requireNonNull(exp);
      this.sort = requireNonNull(sort);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, sort);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Cast
              && ((Cast) o).exp.equals(exp)
              && ((Cast) o).sort.equals(sort);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      return w.append("(")
          .append(exp, 0, op.left)
          .append(op.padded)
          .append(sort.toString())
          .append(")");
    }

    public Cast copy(Expr exp, Sort sort) {
      return exp == this.exp && sort.equals(this.sort)
          ? this
          : new Cast(exp, sort);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Application of an unknown predicate (kvar) to a substitution, "$k[x:=e]".
   */
  public static class KVar extends Expr {
    public final Symbol kvar;
    public final ImmutableMap<Symbol, Expr> substitution;

    KVar(Symbol kvar, ImmutableMap<Symbol, Expr> substitution) {
      super(Op.KVAR);
      this.kvar = requireNonNull(kvar);
      this.substitution = requireNonNull(substitution);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kvar, substitution);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof KVar
              && ((KVar) o).kvar.equals(kvar)
              && ((KVar) o).substitution.equals(substitution);
    }

    @Override
    FixWriter unparse(FixWriter w, int left, int right) {
      w.append("$").id(kvar);
      substitution.forEach(
          (symbol, e) -> w.append("[").id(symbol).append(":=").append(e, 0, 0)
              .append("]"));
      return w;
    }

    public KVar copy(Map<Symbol, Expr> substitution) {
      return substitution.equals(this.substitution)
          ? this
          : new KVar(kvar, ImmutableMap.copyOf(substitution));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Expr.java
