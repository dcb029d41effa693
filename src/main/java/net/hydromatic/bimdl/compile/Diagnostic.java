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
package net.hydromatic.bimdl.compile;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.bimdl.ast.BlockKind;
import net.hydromatic.bimdl.ast.Op;
import net.hydromatic.bimdl.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Problem found while checking a recipe.
 *
 * <p>Every diagnostic has the same severity: if a check produces any
 * diagnostic, the recipe is not run.
 */
public class Diagnostic {
  /** Code, e.g. "FN001". */
  public final String code;
  public final String message;
  /** Kind of block in which the problem was found. */
  public final BlockKind blockKind;
  /** Kind of statement that is missing or at fault. */
  public final Op stmtKind;
  /** Name declared by the statement at fault, if any. */
  public final @Nullable String stmtName;
  public final Pos pos;

  public Diagnostic(String code, String message, BlockKind blockKind,
      Op stmtKind, @Nullable String stmtName, Pos pos) {
    this.code = requireNonNull(code);
    this.message = requireNonNull(message);
    this.blockKind = requireNonNull(blockKind);
    this.stmtKind = requireNonNull(stmtKind);
    this.stmtName = stmtName;
    this.pos = requireNonNull(pos);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, blockKind, stmtKind, stmtName);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Diagnostic
            && code.equals(((Diagnostic) o).code)
            && message.equals(((Diagnostic) o).message)
            && blockKind == ((Diagnostic) o).blockKind
            && stmtKind == ((Diagnostic) o).stmtKind
            && Objects.equals(stmtName, ((Diagnostic) o).stmtName);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this diagnostic in the form
   * "{@code FN001 derive/feature x: Unknown function 'foo'}". */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(code)
        .append(' ')
        .append(blockKind.keyword())
        .append('/')
        .append(stmtKind.lowerName());
    if (stmtName != null) {
      buf.append(' ').append(stmtName);
    }
    return buf.append(": ").append(message);
  }
}

// End Diagnostic.java
