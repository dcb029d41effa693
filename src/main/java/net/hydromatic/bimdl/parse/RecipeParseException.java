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
package net.hydromatic.bimdl.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.util.BimdlException;

/**
 * Exception caused by a parse error.
 *
 * <p>The message is the parser's own message. The line and column are
 * 1-based, and the context is two lines: the offending source line, and a
 * caret under the offending column.
 */
public class RecipeParseException extends RuntimeException
    implements BimdlException {
  private final int line;
  private final int column;
  private final String context;
  private final Pos pos;

  RecipeParseException(Throwable cause, Pos pos, String context) {
    super(cause.getMessage(), cause);
    this.pos = requireNonNull(pos);
    this.line = pos.startLine;
    this.column = pos.startColumn;
    this.context = requireNonNull(context);
  }

  /** Returns the 1-based line of the error. */
  public int line() {
    return line;
  }

  /** Returns the 1-based column of the error. */
  public int column() {
    return column;
  }

  /** Returns the source line and a caret pointing at the column. */
  public String context() {
    return context;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(getMessage())
        .append('\n')
        .append(context);
  }
}

// End RecipeParseException.java
