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
package net.hydromatic.leo.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.Lists;
import java.util.List;
import java.util.Objects;

/**
 * Source-location range of a syntax tree node.
 *
 * <p>Lines and columns are 1-based. The end position is inclusive of the
 * last character, so a one-character token at line 3, column 5 has span
 * {@code 3.5-3.5}; {@link #toString()} prints it as {@code 3.5}.
 */
public class Span {
  public static final Span ZERO = new Span("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Span. */
  public Span(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Span that lies within a single line. */
  public static Span of(int line, int startColumn, int endColumn) {
    return new Span("", line, startColumn, line, endColumn);
  }

  /** Creates a Span from two character offsets into a source string. */
  public static Span of(String source, String file, int startOffset,
      int endOffset) {
    final int[] start = lineCol(source, startOffset);
    final int[] end = lineCol(source, endOffset);
    return new Span(file, start[0], start[1], end[0], end[1]);
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Span
        && this.startLine == ((Span) o).startLine
        && this.startColumn == ((Span) o).startColumn
        && this.endLine == ((Span) o).endLine
        && this.endColumn == ((Span) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /**
   * Combines a list of spans to create a span which extends from the
   * beginning of the first to the end of the last. Ignores {@link #ZERO}.
   */
  public static Span sum(Iterable<Span> spans) {
    final List<Span> list =
        spans instanceof List ? (List<Span>) spans : Lists.newArrayList(spans);
    Span result = null;
    for (Span span : list) {
      if (span == null || span.equals(ZERO)) {
        continue;
      }
      result = result == null ? span : result.plus(span);
    }
    return result == null ? ZERO : result;
  }

  /** Returns the smallest span that contains both this and another span. */
  public Span plus(Span span) {
    if (span.equals(ZERO)) {
      return this;
    }
    if (this.equals(ZERO)) {
      return span;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (span.startLine < startLine
        || span.startLine == startLine
        && span.startColumn < startColumn) {
      startLine = span.startLine;
      startColumn = span.startColumn;
    }
    int endLine = span.endLine;
    int endColumn = span.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine
        && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Span(file, startLine, startColumn, endLine, endColumn);
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("offset " + offset
          + " is beyond end of source");
    }
  }
}

// End Span.java
