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

import java.util.List;
import net.hydromatic.bimdl.parse.Parsers;

/** Context for writing an AST out as recipe text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private int indent = 0;

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, in a context with given precedences. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a string literal, quoted and escaped. */
  public AstWriter appendString(String s) {
    return append("\"").append(Parsers.stringToString(s)).append("\"");
  }

  /** Appends a literal value. */
  public AstWriter appendLiteral(Object value) {
    if (value instanceof String) {
      return appendString((String) value);
    }
    return append(String.valueOf(value));
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a list of nodes separated by commas. */
  public AstWriter appendAll(List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /**
   * Appends a brace-delimited sequence of statements, one per line, indented
   * one level deeper than the current line.
   */
  public AstWriter block(List<? extends AstNode> statements) {
    if (statements.isEmpty()) {
      return append("{}");
    }
    append("{");
    ++indent;
    for (AstNode statement : statements) {
      newline();
      append(statement, 0, 0);
    }
    --indent;
    newline();
    return append("}");
  }

  private void newline() {
    b.append('\n');
    for (int i = 0; i < indent; i++) {
      b.append("  ");
    }
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
