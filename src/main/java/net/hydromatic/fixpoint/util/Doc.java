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
package net.hydromatic.fixpoint.util;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.fixpoint.util.Static.spaces;
import static net.hydromatic.fixpoint.util.Static.str;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Document that can be laid out as text, wrapping to fit a line width.
 *
 * <p>Documents are immutable, and are built from {@link #text}, {@link
 * #beside}, {@link #besideSpace}, {@link #above}, {@link #nest}, and {@link
 * #sep}. The combinators follow the Hughes-Peyton Jones pretty-printing
 * library: {@link #sep} puts its components on one line if they fit, and
 * otherwise stacks them vertically.
 *
 * <p>{@link #EMPTY} is the unit of the combinators. It is not the same as
 * {@code text("")}, which occupies a line when stacked.
 *
 * <p>As in that library, a line must fit both the line width and the
 * ribbon width. The ribbon is the text on a line not counting its
 * indentation; its width is the line width divided by the number of ribbons
 * per line.
 */
public abstract class Doc {
  /** The empty document. */
  public static final Doc EMPTY = new Empty();

  /** Default number of ribbons per line. */
  public static final double RIBBONS_PER_LINE = 1.5;

  Doc() {}

  /** Creates a document consisting of a string. */
  public static Doc text(String s) {
    return new Text(s);
  }

  /** Creates a document that nests another by a given indentation. */
  public static Doc nest(int indent, Doc doc) {
    return doc.isEmpty() ? doc : new Nest(indent, doc);
  }

  /**
   * Creates a document that puts {@code d1} and {@code d2} on one line if they
   * fit, otherwise puts {@code d2} below {@code d1}, indented.
   */
  public static Doc hang(Doc d1, int indent, Doc d2) {
    return sep(ImmutableList.of(d1, nest(indent, d2)));
  }

  /**
   * Creates a document that lays out its components horizontally, separated by
   * spaces, if they fit on one line, otherwise vertically.
   */
  public static Doc sep(List<Doc> docs) {
    final List<Doc> list = nonEmpty(docs);
    switch (list.size()) {
      case 0:
        return EMPTY;
      case 1:
        return list.get(0);
      default:
        return new Sep(ImmutableList.copyOf(list));
    }
  }

  /** Stacks documents vertically. */
  public static Doc vcat(List<Doc> docs) {
    Doc doc = EMPTY;
    for (Doc d : docs) {
      doc = doc.above(d);
    }
    return doc;
  }

  /** Encloses a document in braces. */
  public static Doc braces(Doc doc) {
    return text("{").beside(doc).beside(text("}"));
  }

  /** Encloses a document in brackets. */
  public static Doc brackets(Doc doc) {
    return text("[").beside(doc).beside(text("]"));
  }

  /**
   * Appends {@code punctuation} to every document but the last.
   *
   * <p>For example, {@code sep(punctuate(";", docs))} lays out a list as "a;
   * b; c" or one item per line.
   */
  public static List<Doc> punctuate(String punctuation, List<Doc> docs) {
    final List<Doc> list = nonEmpty(docs);
    final ImmutableList.Builder<Doc> b = ImmutableList.builder();
    for (int i = 0; i < list.size(); i++) {
      final Doc doc = list.get(i);
      b.add(i < list.size() - 1 ? doc.beside(text(punctuation)) : doc);
    }
    return b.build();
  }

  /** Returns the number of leading spaces of a line. */
  private static int indentation(String line) {
    int i = 0;
    while (i < line.length() && line.charAt(i) == ' ') {
      ++i;
    }
    return i;
  }

  private static List<Doc> nonEmpty(List<Doc> docs) {
    return Static.filterEager(docs, doc -> !doc.isEmpty());
  }

  /** Places a document immediately after this one ("&lt;&gt;"). */
  public Doc beside(Doc doc) {
    return beside(doc, false);
  }

  /**
   * Places a document after this one, separated by a space ("&lt;+&gt;").
   */
  public Doc besideSpace(Doc doc) {
    return beside(doc, true);
  }

  private Doc beside(Doc doc, boolean space) {
    if (doc.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return doc;
    }
    return new Beside(this, doc, space);
  }

  /** Places a document below this one ("$+$"). */
  public Doc above(Doc doc) {
    if (doc.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return doc;
    }
    return new Above(this, doc);
  }

  /** Returns whether this is the empty document. */
  public boolean isEmpty() {
    return false;
  }

  /**
   * Renders this document, wrapping lines longer than {@code lineWidth} where
   * possible, with the default number of ribbons per line.
   */
  public String render(int lineWidth) {
    return render(lineWidth, RIBBONS_PER_LINE);
  }

  /**
   * Renders this document, wrapping lines longer than {@code lineWidth}, or
   * whose text after indentation is longer than {@code lineWidth /
   * ribbonsPerLine}, where possible. Trailing spaces are removed from each
   * line.
   */
  public String render(int lineWidth, double ribbonsPerLine) {
    checkArgument(ribbonsPerLine >= 1, "ribbonsPerLine must be at least 1");
    final Width width =
        new Width(lineWidth, (int) Math.round(lineWidth / ribbonsPerLine));
    final StringBuilder b = new StringBuilder();
    final StringBuilder line = new StringBuilder();
    for (String s : layout(0, 0, width)) {
      line.append(s);
      while (line.length() > 0 && line.charAt(line.length() - 1) == ' ') {
        line.setLength(line.length() - 1);
      }
      b.append(str(line)).append('\n');
    }
    return b.toString();
  }

  /** Returns the text of this document on a single line, or null if it cannot
   * be laid out on a single line. */
  abstract @Nullable String flat();

  /**
   * Lays out this document starting at a given column. The first line starts
   * at {@code column}; the other lines are relative to {@code column}.
   *
   * @param lineStart Column where the text of the first line begins, after
   *     its indentation; at most {@code column}
   */
  abstract List<String> layout(int lineStart, int column, Width width);

  /** Line width and ribbon width. */
  static class Width {
    final int line;
    final int ribbon;

    Width(int line, int ribbon) {
      this.line = line;
      this.ribbon = ribbon;
    }

    /** Returns whether text of a given length fits on a line after the text
     * that is already there. */
    boolean fits(int lineStart, int column, int length) {
      return column + length <= line && column - lineStart + length <= ribbon;
    }
  }

  /** The empty document. */
  private static class Empty extends Doc {
    @Override
    public boolean isEmpty() {
      return true;
    }

    @Override
    String flat() {
      return "";
    }

    @Override
    List<String> layout(int lineStart, int column, Width width) {
      return ImmutableList.of();
    }
  }

  /** Document consisting of a single string. */
  private static class Text extends Doc {
    final String s;

    Text(String s) {
      this.s = requireNonNull(s);
    }

    @Override
    String flat() {
      return s;
    }

    @Override
    List<String> layout(int lineStart, int column, Width width) {
      return ImmutableList.of(s);
    }
  }

  /** Document indented relative to its enclosing document. */
  private static class Nest extends Doc {
    final int indent;
    final Doc doc;

    Nest(int indent, Doc doc) {
      this.indent = indent;
      this.doc = requireNonNull(doc);
    }

    @Override
    @Nullable String flat() {
      return doc.flat();
    }

    @Override
    List<String> layout(int lineStart, int column, Width width) {
      // Indentation at the start of a line does not count towards the ribbon.
      final int lineStart2 = column == lineStart ? column + indent : lineStart;
      final ImmutableList.Builder<String> b = ImmutableList.builder();
      final StringBuilder buf = new StringBuilder();
      for (String line : doc.layout(lineStart2, column + indent, width)) {
        b.add(spaces(buf, indent).append(line).toString());
        buf.setLength(0);
      }
      return b.build();
    }
  }

  /** Two documents side by side; the second starts where the first ends. */
  private static class Beside extends Doc {
    final Doc left;
    final Doc right;
    final boolean space;

    Beside(Doc left, Doc right, boolean space) {
      this.left = requireNonNull(left);
      // Nesting has no effect in horizontal composition.
      Doc d = requireNonNull(right);
      while (d instanceof Nest) {
        d = ((Nest) d).doc;
      }
      this.right = d;
      this.space = space;
    }

    @Override
    @Nullable String flat() {
      final String s0 = left.flat();
      final String s1 = right.flat();
      if (s0 == null || s1 == null) {
        return null;
      }
      return space ? s0 + " " + s1 : s0 + s1;
    }

    @Override
    List<String> layout(int lineStart, int column, Width width) {
      final List<String> leftLines = left.layout(lineStart, column, width);
      final int n = leftLines.size();
      final String last =
          (n == 0 ? "" : leftLines.get(n - 1)) + (space ? " " : "");
      final int lastStart =
          n > 1 || n == 1 && column == lineStart
              ? column + indentation(leftLines.get(n - 1))
              : lineStart;
      final List<String> rightLines =
          right.layout(lastStart, column + last.length(), width);
      final List<String> lines = new ArrayList<>();
      if (n > 1) {
        lines.addAll(leftLines.subList(0, n - 1));
      }
      final StringBuilder buf = new StringBuilder();
      for (int i = 0; i < rightLines.size(); i++) {
        if (i == 0) {
          lines.add(last + rightLines.get(0));
        } else {
          lines.add(
              spaces(buf, last.length()).append(rightLines.get(i)).toString());
          buf.setLength(0);
        }
      }
      if (rightLines.isEmpty()) {
        lines.add(last);
      }
      return lines;
    }
  }

  /** One document above another. */
  private static class Above extends Doc {
    final Doc top;
    final Doc bottom;

    Above(Doc top, Doc bottom) {
      this.top = requireNonNull(top);
      this.bottom = requireNonNull(bottom);
    }

    @Override
    @Nullable String flat() {
      return null;
    }

    @Override
    List<String> layout(int lineStart, int column, Width width) {
      return ImmutableList.<String>builder()
          .addAll(top.layout(lineStart, column, width))
          .addAll(bottom.layout(column, column, width))
          .build();
    }
  }

  /** Documents that are laid out horizontally if they fit, otherwise
   * vertically. */
  private static class Sep extends Doc {
    final List<Doc> docs;

    Sep(ImmutableList<Doc> docs) {
      this.docs = docs;
    }

    @Override
    @Nullable String flat() {
      final StringBuilder b = new StringBuilder();
      for (int i = 0; i < docs.size(); i++) {
        final String s = docs.get(i).flat();
        if (s == null) {
          return null;
        }
        b.append(i > 0 ? " " : "").append(s);
      }
      return b.toString();
    }

    @Override
    List<String> layout(int lineStart, int column, Width width) {
      final String flat = flat();
      if (flat != null && width.fits(lineStart, column, flat.length())) {
        return ImmutableList.of(flat);
      }
      // The first component continues the current line; the others start
      // new lines.
      final ImmutableList.Builder<String> b = ImmutableList.builder();
      for (int i = 0; i < docs.size(); i++) {
        final int start = i == 0 ? lineStart : column;
        b.addAll(docs.get(i).layout(start, column, width));
      }
      return b.build();
    }
  }
}

// End Doc.java
