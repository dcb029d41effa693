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
package net.hydromatic.bimdl.ast;

import com.google.common.collect.Lists;
import java.util.List;
import java.util.Objects;

/**
 * Position of a parse-tree node or AST node in the recipe text.
 *
 * <p>Lines and columns are 1-based. The end column is exclusive, so a
 * single-character token at line 3, column 5 has position "3.5".
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
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /**
   * Combines an iterable of parser positions to create a position which spans
   * from the beginning of the first to the end of the last.
   */
  public static Pos sum(Iterable<Pos> poses) {
    final List<Pos> list =
        poses instanceof List ? (List<Pos>) poses : Lists.newArrayList(poses);
    switch (list.size()) {
      case 0:
        throw new AssertionError();
      case 1:
        return list.get(0);
      default:
        Pos p = list.get(0);
        for (Pos pos : list.subList(1, list.size())) {
          p = p.plus(pos);
        }
        return p;
    }
  }

  /** Returns a position spanning this position and another. */
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
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }
}

// End Pos.java
