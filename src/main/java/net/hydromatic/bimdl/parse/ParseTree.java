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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.bimdl.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Normalized tree produced by the recipe parser.
 *
 * <p>Every node has the same shape: a {@link Tag}, a position, an optional
 * text payload, and a list of children. The meaning of the text and the
 * children depends on the tag:
 *
 * <ul>
 *   <li>blocks: text is the view name or export kind (null for other
 *       blocks); children are statements
 *   <li>{@link Tag#ASSIGN_STMT}, {@link Tag#FEATURE_STMT},
 *       {@link Tag#LABEL_STMT}: text is the name; one child, the expression
 *   <li>{@link Tag#EMIT_STMT}, {@link Tag#WHERE_STMT}: one child
 *   <li>{@link Tag#SELECT_STMT}, {@link Tag#PATH_STMT},
 *       {@link Tag#FORMAT_STMT}: text is the value; no children
 *   <li>{@link Tag#BY_STMT}, {@link Tag#CALL}: text is the qualified
 *       function name; children are the arguments
 *   <li>{@link Tag#NODE_FEATURES_STMT}, {@link Tag#EDGE_FEATURES_STMT}:
 *       children are feature statements
 *   <li>{@link Tag#BINOP}, {@link Tag#UNOP}: text is the operator symbol;
 *       children are the operands
 *   <li>{@link Tag#ACCESS}: children are {@link Tag#FIELD} (text is the
 *       name) and {@link Tag#INDEX} (one child) nodes
 *   <li>literals: text is the token (numbers) or unquoted value (strings)
 * </ul>
 *
 * <p>Semantic layers consume this tree only through
 * {@link net.hydromatic.bimdl.ast.AstBuilder}, so that changes to the grammar
 * do not ripple further.
 */
public class ParseTree {
  private ParseTree() {}

  /** Kind of parse-tree node. */
  public enum Tag {
    DOCUMENT,

    // blocks
    SOURCE_BLOCK,
    VIEW_BLOCK,
    DERIVE_BLOCK,
    SYNTHESIZE_BLOCK,
    SPLIT_BLOCK,
    EXPORT_BLOCK,

    // statements
    ASSIGN_STMT,
    FEATURE_STMT,
    EMIT_STMT,
    SELECT_STMT,
    WHERE_STMT,
    LABEL_STMT,
    FORMAT_STMT,
    PATH_STMT,
    BY_STMT,
    NODE_FEATURES_STMT,
    EDGE_FEATURES_STMT,

    // expressions
    NUMBER,
    STRING,
    TRUE,
    FALSE,
    NULL,
    BINOP,
    UNOP,
    CALL,
    ACCESS,
    FIELD,
    INDEX
  }

  /** Creates a node. */
  public static Node node(Tag tag, Pos pos, @Nullable String text,
      List<Node> children) {
    return new Node(tag, pos, text, ImmutableList.copyOf(children));
  }

  /** Creates a node with no children. */
  public static Node leaf(Tag tag, Pos pos, @Nullable String text) {
    return new Node(tag, pos, text, ImmutableList.of());
  }

  /** Node in a parse tree. */
  public static class Node {
    public final Tag tag;
    public final Pos pos;
    public final @Nullable String text;
    public final List<Node> children;

    Node(Tag tag, Pos pos, @Nullable String text,
        ImmutableList<Node> children) {
      this.tag = requireNonNull(tag);
      this.pos = requireNonNull(pos);
      this.text = text;
      this.children = requireNonNull(children);
    }

    /** Returns the {@code i}th child. */
    public Node child(int i) {
      return children.get(i);
    }

    @Override
    public String toString() {
      return describeTo(new StringBuilder()).toString();
    }

    /** Writes this node and its descendants in prefix form, e.g.
     * "{@code BINOP(+ NUMBER(1) NUMBER(2))}". */
    public StringBuilder describeTo(StringBuilder buf) {
      buf.append(tag);
      if (text == null && children.isEmpty()) {
        return buf;
      }
      buf.append('(');
      if (text != null) {
        buf.append(text);
      }
      for (int i = 0; i < children.size(); i++) {
        if (i > 0 || text != null) {
          buf.append(' ');
        }
        children.get(i).describeTo(buf);
      }
      return buf.append(')');
    }
  }
}

// End ParseTree.java
