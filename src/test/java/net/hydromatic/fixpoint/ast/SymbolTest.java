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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link Symbol}. */
public class SymbolTest {
  @Test
  void testPrefixSuffix() {
    final Symbol s = Symbol.of("lq_tmp##x##12");
    assertThat(s.prefix(), is("lq_tmp"));
    assertThat(s.suffix(), is("x##12"));
    assertThat(s.prefixSymbol(), is(Symbol.of("lq_tmp")));
    assertThat(s, hasToString("lq_tmp##x##12"));

    final Symbol y = Symbol.of("y");
    assertThat(y.prefix(), is("y"));
    assertThat(y.suffix(), is(""));
    assertThat(y.prefixSymbol(), sameInstance(y));

    // A separator at the start gives an empty prefix.
    final Symbol z = Symbol.of("##z");
    assertThat(z.prefix(), is(""));
    assertThat(z.suffix(), is("z"));

    assertThat(y.suffixSymbol("1"), is(Symbol.of("y##1")));
    assertThat(s.suffixSymbol("1"), hasToString("lq_tmp##x##12##1"));
  }

  @Test
  void testIntern() {
    assertThat(Symbol.of("x"), sameInstance(Symbol.of("x")));
    assertThat(Symbol.of("x", 2), sameInstance(Symbol.of("x", 2)));

    // Same name, different ordinal: distinct, but print the same.
    final Symbol x0 = Symbol.of("x");
    final Symbol x1 = Symbol.of("x", 1);
    assertThat(x0, not(x1));
    assertThat(x0, hasToString("x"));
    assertThat(x1, hasToString("x"));
    assertThat(x0.prefixSymbol(), sameInstance(x0));
    assertThat(x1.prefixSymbol(), is(x0));

    assertThrows(IllegalArgumentException.class, () -> Symbol.of("x", -1));
  }

  @Test
  void testCompare() {
    assertThat(Symbol.of("a").compareTo(Symbol.of("b")), lessThan(0));
    assertThat(Symbol.of("b").compareTo(Symbol.of("a##z")), greaterThan(0));
    assertThat(Symbol.of("a", 1).compareTo(Symbol.of("a")), greaterThan(0));
    assertThat(Symbol.of("a").compareTo(Symbol.of("a")), is(0));
    assertThat(
        Symbol.ORDERING.max(Symbol.of("x"), Symbol.of("y"), Symbol.of("x", 3)),
        is(Symbol.of("y")));
  }

  @Test
  void testStartsWith() {
    assertThat(Symbol.of("lq_anf$##7").startsWith("lq_anf$"), is(true));
    assertThat(Symbol.of("lq_tmp").startsWith("lq_anf$"), is(false));
  }
}

// End SymbolTest.java
