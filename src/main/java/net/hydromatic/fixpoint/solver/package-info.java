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

/**
 * Prettification of fixpoint queries.
 *
 * <p>Environments in a query accumulate hundreds of generated bindings. To
 * show a constraint to a human, {@link
 * net.hydromatic.fixpoint.solver.Prettify} runs a pipeline over each
 * constraint's environment:
 *
 * <ol>
 *   <li>merge bindings of the same symbol, undo administrative normal form,
 *       simplify boolean refinements, and inline definitions into the sides
 *       of the constraint ({@link
 *       net.hydromatic.fixpoint.solver.EnvironmentReduction});
 *   <li>drop bindings that are unlikely to be relevant;
 *   <li>shorten the names of the remaining bindings ({@link
 *       net.hydromatic.fixpoint.solver.SymbolRenamer});
 *   <li>erase the names of bindings that nothing refers to ({@link
 *       net.hydromatic.fixpoint.solver.BindingEraser});
 *   <li>render the result as text.
 * </ol>
 *
 * <p>The output is written to a file with extension {@code .fq.prettified}
 * next to the query file.
 */
package net.hydromatic.fixpoint.solver;

// End package-info.java
