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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.fixpoint.ast.Symbol;
import org.junit.jupiter.api.Test;

/** Tests for {@link Sort} and its implementations. */
public class SortTest {
  @Test
  void testDescribe() {
    assertThat(PrimitiveSort.INT, hasToString("int"));
    assertThat(PrimitiveSort.STR, hasToString("Str"));
    assertThat(VarSort.of(0), hasToString("@(0)"));
    assertThat(ObjSort.of(Symbol.of("Foo##1")), hasToString("Foo##1"));
    assertThat(
        AppSort.of(TyConSort.of("Set_Set"), PrimitiveSort.INT),
        hasToString("(Set_Set int)"));
    assertThat(
        AppSort.of(
            TyConSort.of("Map_t"),
            VarSort.of(0),
            AppSort.of(TyConSort.of("List"), PrimitiveSort.BOOL)),
        hasToString("(Map_t @(0) (List bool))"));
    assertThat(
        FuncSort.of(1, ImmutableList.of(VarSort.of(0), PrimitiveSort.INT)),
        hasToString("func(1, [@(0); int])"));
  }

  @Test
  void testFuncSortNeedsResult() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FuncSort.of(0, ImmutableList.of(PrimitiveSort.INT)));
  }

  @Test
  void testSymbols() {
    final Symbol a = Symbol.of("a##1");
    final Symbol b = Symbol.of("b");
    final Sort sort =
        FuncSort.of(
            0,
            ImmutableList.of(
                ObjSort.of(a),
                AppSort.of(TyConSort.of("List"), ObjSort.of(b))));
    assertThat(sort.symbols(), contains(a, b));
    assertThat(PrimitiveSort.REAL.symbols(), empty());
  }

  @Test
  void testSubstSort() {
    final Sort sort =
        AppSort.of(TyConSort.of("List"), ObjSort.of(Symbol.of("a##1")));
    final Sort sort2 = sort.substSort(s -> ObjSort.of(s.prefixSymbol()));
    assertThat(sort2, hasToString("(List a)"));
    assertThat(
        sort2,
        is(AppSort.of(TyConSort.of("List"), ObjSort.of(Symbol.of("a")))));

    // A sort without object sorts is returned unchanged.
    final Sort intList = AppSort.of(TyConSort.of("List"), PrimitiveSort.INT);
    assertThat(
        intList.substSort(s -> ObjSort.of(Symbol.of("z"))),
        sameInstance(intList));
  }
}

// End SortTest.java
