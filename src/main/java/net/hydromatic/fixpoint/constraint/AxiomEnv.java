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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Background facts available to the solver. */
public class AxiomEnv {
  /** An axiom environment with no equations. */
  public static final AxiomEnv EMPTY = new AxiomEnv(ImmutableList.of());

  public final List<Equation> equations;

  public AxiomEnv(List<Equation> equations) {
    this.equations = ImmutableList.copyOf(equations);
  }
}

// End AxiomEnv.java
