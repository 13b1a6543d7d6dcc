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
package net.hydromatic.fixpoint.solver;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.fixpoint.util.Doc.braces;
import static net.hydromatic.fixpoint.util.Doc.brackets;
import static net.hydromatic.fixpoint.util.Doc.hang;
import static net.hydromatic.fixpoint.util.Doc.nest;
import static net.hydromatic.fixpoint.util.Doc.punctuate;
import static net.hydromatic.fixpoint.util.Doc.sep;
import static net.hydromatic.fixpoint.util.Doc.text;
import static net.hydromatic.fixpoint.util.Doc.vcat;
import static net.hydromatic.fixpoint.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Expr;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.constraint.BindEnv;
import net.hydromatic.fixpoint.constraint.FInfo;
import net.hydromatic.fixpoint.constraint.SortedReft;
import net.hydromatic.fixpoint.constraint.SubC;
import net.hydromatic.fixpoint.util.Doc;
import net.hydromatic.fixpoint.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a query in a form that is easier for a human to read.
 *
 * <p>For each constraint, the environment is reduced to the bindings that are
 * likely to be relevant, bindings are given short names, and bindings that
 * nothing refers to lose their names. The result is for display only; it is
 * never read back by the solver.
 */
public class Prettify {
  private static final Logger logger = LoggerFactory.getLogger(Prettify.class);

  /** Extension added to the name of the query file. */
  public static final String EXTENSION = ".prettified";

  /** Comment that precedes the bindings of each environment. */
  public static final String ELIDED_MESSAGE =
      "// elided some likely irrelevant bindings";

  /** Orders bindings by descending name, then erased bindings by descending
   * original name. */
  private static final Comparator<BindingEraser.Entry> ENTRY_COMPARATOR =
      Comparator.comparing(
              (BindingEraser.Entry e) -> e.symbol,
              Ordering.<Symbol>natural().reverse().nullsLast())
          .thenComparing(e -> e.key, Ordering.<Symbol>natural().reverse());

  private final Config config;
  private final EnvironmentReduction reduction;

  /** Creates a Prettify. */
  public Prettify(Config config, EnvironmentReduction reduction) {
    this.config = requireNonNull(config);
    this.reduction = requireNonNull(reduction);
  }

  /**
   * Writes a prettified query to the file next to the query file, using the
   * standard reductions, and prints a message to {@link System#out}.
   *
   * @throws PrettifyException if the file cannot be written
   */
  public static void savePrettifiedQuery(Config config, FInfo fInfo) {
    new Prettify(config, EnvironmentReductions.standard())
        .save(fInfo, System.out);
  }

  /** Returns the file to which a prettified query is written. */
  public File file() {
    final File queryFile = config.queryFile(Config.FQ_EXTENSION);
    return new File(queryFile.getParentFile(), queryFile.getName() + EXTENSION);
  }

  /**
   * Writes a prettified query to {@link #file()}, creating its directory if
   * necessary, and prints a message to {@code out}.
   *
   * @throws PrettifyException if the file cannot be written
   */
  public void save(FInfo fInfo, PrintStream out) {
    final File file = file();
    out.println("Saving prettified Query: " + file);
    out.println();
    logger.info("Saving prettified query to {}", file);
    final String s = render(fInfo);
    try {
      Files.createDirectories(file.getAbsoluteFile().getParentFile().toPath());
    } catch (IOException e) {
      throw new PrettifyException("cannot create directory for", file, e);
    }
    try (Writer w =
        new OutputStreamWriter(
            new FileOutputStream(file), StandardCharsets.UTF_8)) {
      w.write(s);
    } catch (IOException e) {
      throw new PrettifyException("cannot write prettified query", file, e);
    }
  }

  /** Renders a query as a string. */
  public String render(FInfo fInfo) {
    return toDoc(fInfo).render(config.lineWidth());
  }

  /** Converts a query to a document, one part per constraint. */
  public Doc toDoc(FInfo fInfo) {
    final Map<Symbol, Set<Symbol>> axiomSymbols =
        reduction.axiomEnvSymbols(fInfo.axiomEnv);
    return vcat(
        transformEager(
            fInfo.constraints.values(),
            c -> toDoc(axiomSymbols, fInfo.bindEnv, c)));
  }

  /** Converts a constraint to a document. */
  public Doc toDoc(
      Map<Symbol, Set<Symbol>> axiomSymbols, BindEnv bindEnv, SubC c) {
    final List<Map.Entry<Symbol, Binding>> env = new ArrayList<>();
    for (int id : c.envIds) {
      final BindEnv.Bind bind = bindEnv.lookup(id);
      env.add(
          Maps.immutableEntry(bind.symbol, Binding.of(id, bind.sortedReft)));
    }

    final Map<Symbol, Binding> mergedEnv =
        reduction.mergeDuplicatedBindings(env);
    final Map<Symbol, Binding> undoAnfEnv =
        Static.union(
            reduction.undoAnf(config.undoAnfDepth(), mergedEnv), mergedEnv);
    final Map<Symbol, Binding> boolSimplEnv =
        Static.union(reduction.simplifyBooleanRefts(undoAnfEnv), undoAnfEnv);

    final SortedReft lhs =
        reduction.inlineInSortedReft(config.inlineDepth(), boolSimplEnv, c.lhs);
    final SortedReft rhs =
        reduction.inlineInSortedReft(config.inlineDepth(), boolSimplEnv, c.rhs);

    final Map<Symbol, SortedReft> prunedEnv =
        reduction.dropLikelyIrrelevantBindings(
            axiomSymbols,
            constraintSymbols(lhs, rhs),
            Static.transformValuesEager(boolSimplEnv, b -> b.sortedReft));

    final SymbolRenamer.Renamed renamed =
        SymbolRenamer.shortenVarNames(prunedEnv, c.withSides(lhs, rhs));
    final SubC c2 = renamed.constraint;
    final List<BindingEraser.Entry> entries =
        new ArrayList<>(
            BindingEraser.eraseUnusedBindings(
                constraintSymbols(c2.lhs, c2.rhs), renamed.env));
    entries.sort(ENTRY_COMPARATOR);

    if (logger.isDebugEnabled()) {
      logger.debug(
          "constraint {}: {} bindings, {} merged, {} after pruning, {} erased",
          c.id,
          env.size(),
          mergedEnv.size(),
          prunedEnv.size(),
          entries.stream().filter(BindingEraser.Entry::isErased).count());
    }

    final List<Doc> envDocs = new ArrayList<>();
    envDocs.add(text(ELIDED_MESSAGE));
    for (BindingEraser.Entry entry : entries) {
      envDocs.add(text(""));
      envDocs.add(toDoc(entry));
    }

    return vcat(
        ImmutableList.of(
            text(""),
            text(""),
            hang(
                text("constraint:"),
                2,
                vcat(
                    ImmutableList.of(
                        text("lhs").besideSpace(toDoc(c2.lhs)),
                        text("rhs").besideSpace(toDoc(c2.rhs)),
                        idDoc(c2.id)
                            .besideSpace(text("tag"))
                            .besideSpace(toDoc(c2.tag)),
                        text("// META")
                            .besideSpace(
                                text("constraint").besideSpace(idDoc(c2.id)))
                            .besideSpace(text(":"))
                            .besideSpace(text(String.valueOf(c2.info))),
                        hang(text("environment:"), 2, vcat(envDocs)))))));
  }

  private static Set<Symbol> constraintSymbols(SortedReft lhs, SortedReft rhs) {
    return ImmutableSet.<Symbol>builder()
        .addAll(lhs.symbols())
        .addAll(rhs.symbols())
        .build();
  }

  private static Doc idDoc(@Nullable Integer id) {
    return id == null ? Doc.EMPTY : text("id").besideSpace(text(id.toString()));
  }

  /** Converts a binding to a document, "{@code name : {v : sort | [p]}}". */
  static Doc toDoc(BindingEraser.Entry entry) {
    final String name = entry.symbol == null ? "_" : entry.symbol.toString();
    return sep(
        ImmutableList.of(
            text(name).besideSpace(text(":")),
            nest(2, toNestedDoc(entry.sortedReft))));
  }

  /** Converts a sorted refinement to a document that breaks after the
   * sort if it does not fit on one line. */
  private static Doc toNestedDoc(SortedReft sortedReft) {
    return braces(
        sep(
            ImmutableList.of(
                headDoc(sortedReft), nest(2, toDoc(sortedReft.pred())))));
  }

  /** Converts a sorted refinement to a document, "{@code {v : sort | [p]}}". */
  static Doc toDoc(SortedReft sortedReft) {
    return braces(headDoc(sortedReft).besideSpace(toDoc(sortedReft.pred())));
  }

  private static Doc headDoc(SortedReft sortedReft) {
    return text(sortedReft.bind().toString())
        .besideSpace(text(":"))
        .besideSpace(text(sortedReft.sort.toString()))
        .besideSpace(text("|"));
  }

  /** Converts a predicate to a list of its conjuncts, "{@code [p1; p2]}". */
  private static Doc toDoc(Expr pred) {
    return toDoc(transformEager(pred.conjuncts(), Expr::toString));
  }

  private static Doc toDoc(List<?> list) {
    return brackets(
        sep(punctuate(";", transformEager(list, o -> text(o.toString())))));
  }
}

// End Prettify.java
