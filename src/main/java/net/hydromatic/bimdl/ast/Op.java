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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // literals
  NUMBER_LITERAL(true),
  STRING_LITERAL(true),
  BOOL_LITERAL(true),
  NULL_LITERAL(true),

  /**
   * Placeholder for an expression whose parse-tree shape was not recognized.
   * Evaluates to null.
   */
  MISSING(true),

  // access chains and calls
  ACCESS(true),
  FIELD(true),
  INDEX(true),
  CALL(true),

  // operators
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  NEGATE("-", 8),
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  GT(" > ", 4),
  LE(" <= ", 4),
  GE(" >= ", 4),
  NOT("not ", 3),
  AND(" and ", 2),
  OR(" or ", 1),

  // statements
  ASSIGN,
  FEATURE,
  LABEL,
  EMIT,
  SELECT,
  WHERE,
  FORMAT,
  PATH,
  BY,
  NODE_FEATURES,
  EDGE_FEATURES,

  // blocks
  BLOCK,
  RECIPE;

  /** Padded name, e.g. " + ", or null if this is not an operator. */
  public final @Nullable String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  /** Operators, keyed by the symbol that appears in recipe text. */
  private static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.padded != null && !op.padded.isEmpty() && op != NEGATE) {
        b.put(op.symbol(), op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(@Nullable String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the symbol of this operator, e.g. "+" for {@link #PLUS}. */
  public String symbol() {
    return padded == null ? "" : padded.trim();
  }

  /**
   * Returns the operator with a given symbol, or null. Unary minus is
   * {@link #NEGATE}; binary minus is {@link #MINUS}.
   */
  public static @Nullable Op bySymbol(String symbol, boolean unary) {
    if (unary && symbol.equals("-")) {
      return NEGATE;
    }
    final Op op = BY_SYMBOL.get(symbol);
    if (op == null || (op == NOT) != unary) {
      return null;
    }
    return op;
  }

  /** Converts the name to lower case, e.g. "NODE_FEATURES" to
   * "node_features". Statement keywords are spelled this way in recipes. */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Op.java
