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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import com.google.common.collect.Ordering;

/**
 * Name of a variable, binding, function, or object sort.
 *
 * <p>A symbol is a name plus an ordinal. Two symbols with the same name but
 * different ordinals are distinct, even though they print the same; this
 * happens when earlier stages of compilation generate the same name from
 * different origins.
 *
 * <p>Symbols are interned; call {@link #of(String)} or {@link #of(String,
 * int)} to create one.
 *
 * <p>Generated names use the separator {@link #SEPARATOR} to join parts. The
 * text before the first separator is the {@link #prefix() prefix}, the text
 * after it is the {@link #suffix() suffix}. For example, {@code
 * "lq_tmp##x##12"} has prefix {@code "lq_tmp"} and suffix {@code "x##12"}.
 */
public final class Symbol implements Comparable<Symbol> {
  /** Separator between the parts of a generated name. */
  public static final String SEPARATOR = "##";

  /** Ordering that compares symbols by their names, then by their ordinal. */
  public static final Ordering<Symbol> ORDERING = Ordering.natural();

  private static final Interner<Symbol> INTERNER = Interners.newWeakInterner();

  public final String name;
  public final int i;

  private Symbol(String name, int i) {
    this.name = requireNonNull(name, "name");
    this.i = i;
    checkArgument(i >= 0, "negative ordinal %s", i);
  }

  /** Creates a symbol with ordinal 0. */
  public static Symbol of(String name) {
    return of(name, 0);
  }

  /** Creates a symbol with a given ordinal. */
  public static Symbol of(String name, int i) {
    return INTERNER.intern(new Symbol(name, i));
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + i;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
            && ((Symbol) o).name.equals(name)
            && ((Symbol) o).i == i;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Collate first on name, then on ordinal.
   */
  @Override
  public int compareTo(Symbol o) {
    int c = name.compareTo(o.name);
    if (c != 0) {
      return c;
    }
    return Integer.compare(i, o.i);
  }

  /** Returns the name. The ordinal is not printed. */
  @Override
  public String toString() {
    return name;
  }

  /** Returns the text before the first separator, or the whole name. */
  public String prefix() {
    final int j = name.indexOf(SEPARATOR);
    return j < 0 ? name : name.substring(0, j);
  }

  /**
   * Returns the text after the first separator, or the empty string if this
   * symbol has no separator.
   */
  public String suffix() {
    final int j = name.indexOf(SEPARATOR);
    return j < 0 ? "" : name.substring(j + SEPARATOR.length());
  }

  /** Returns the symbol whose name is the prefix of this symbol's name. */
  public Symbol prefixSymbol() {
    final String prefix = prefix();
    return prefix.equals(name) && i == 0 ? this : of(prefix);
  }

  /** Returns a symbol consisting of this name, a separator, and a suffix. */
  public Symbol suffixSymbol(String suffix) {
    return of(name + SEPARATOR + suffix);
  }

  /** Returns whether this symbol's name starts with a given string. */
  public boolean startsWith(String s) {
    return name.startsWith(s);
  }
}

// End Symbol.java
