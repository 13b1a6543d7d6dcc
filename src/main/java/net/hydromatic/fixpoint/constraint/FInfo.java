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

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Query: the constraints to be solved, together with the bindings they refer
 * to and background axioms.
 *
 * <p>A query is immutable.
 */
public class FInfo {
  /** Constraints, keyed by identifier, in insertion order. */
  public final ImmutableMap<Integer, SubC> constraints;

  public final BindEnv bindEnv;
  public final AxiomEnv axiomEnv;

  public FInfo(
      Map<Integer, SubC> constraints, BindEnv bindEnv, AxiomEnv axiomEnv) {
    this.constraints = ImmutableMap.copyOf(constraints);
    this.bindEnv = requireNonNull(bindEnv);
    this.axiomEnv = requireNonNull(axiomEnv);
  }
}

// End FInfo.java
