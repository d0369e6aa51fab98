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
package net.hydromatic.recpat.ast;

import java.util.Objects;
import net.hydromatic.recpat.util.Pair;

/**
 * Position of a parse-tree node.
 *
 * <p>Lines and columns are 1-based. The end is exclusive, so a position
 * whose start equals its end is a caret between two characters.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets. */
  public static Pos of(String text, String file, int startOffset,
      int endOffset) {
    final Pair<Integer, Integer> start = lineCol(text, startOffset);
    final Pair<Integer, Integer> end = lineCol(text, endOffset);
    return new Pos(file, start.left, start.right, end.left, end.right);
  }

  /**
   * Creates a Pos from a filename and a string with a delimiter character.
   * The delimiter must occur exactly twice in the string.
   *
   * <p>Two adjacent delimiters denote a caret, for example
   * {@code "a.b == 1 $$&& a.c == 2"}.
   */
  public static Pair<String, Pos> split(String s, char delimiter,
      String file) {
    final int i = s.indexOf(delimiter);
    final int j = s.indexOf(delimiter, i + 1);
    final int k = s.indexOf(delimiter, j + 1);
    if (i < 0 || j <= i || k >= 0) {
      throw new IllegalArgumentException("expected exactly two occurrences "
          + "of delimiter, '" + delimiter + "'");
    }
    final String s2 = s.substring(0, i)
        + s.substring(i + 1, j)
        + s.substring(j + 1);
    final Pos pos = of(s2, file, i, j - 1);
    return Pair.of(s2, pos);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /** Returns whether this position is a caret (covers no characters). */
  public boolean isEmpty() {
    return startLine == endLine && startColumn == endColumn;
  }

  /**
   * Returns whether the start of {@code pos} lies within this position.
   * {@link #ZERO}, the position of synthesized nodes, contains nothing.
   */
  public boolean contains(Pos pos) {
    if (this.equals(ZERO)) {
      return false;
    }
    return compare(startLine, startColumn, pos.startLine, pos.startColumn) <= 0
        && compare(pos.startLine, pos.startColumn, endLine, endColumn) < 0;
  }

  private static int compare(int line0, int column0, int line1, int column1) {
    return line0 != line1
        ? Integer.compare(line0, line1)
        : Integer.compare(column0, column1);
  }

  /** Returns the smallest position that covers this and another. */
  public Pos plus(Pos pos) {
    if (pos.equals(ZERO)) {
      return this;
    }
    if (this.equals(ZERO)) {
      return pos;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine
        && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine
        && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }

  /** Returns the 1-based line and column of an offset. */
  private static Pair<Integer, Integer> lineCol(String s, int offset) {
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
      return Pair.of(line, offset - lineStart + 1);
    } else {
      throw new IllegalArgumentException("not found");
    }
  }
}

// End Pos.java
