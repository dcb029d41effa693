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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.bimdl.compile.StructureException;
import net.hydromatic.bimdl.parse.ParseTree;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds AST nodes, and converts parse trees into recipes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(AstBuilder.class);

  // literals

  /** Creates a number literal from its token. Integral tokens become
   * {@link Long} values, others {@link Double}. */
  public Ast.Literal numberLiteral(Pos pos, String image) {
    if (image.indexOf('.') < 0
        && image.indexOf('e') < 0
        && image.indexOf('E') < 0) {
      try {
        return numberLiteral(pos, Long.parseLong(image));
      } catch (NumberFormatException e) {
        // Too large for a long; fall back to double.
        LOGGER.debug("integer literal {} overflows long", image);
      }
    }
    return numberLiteral(pos, Double.parseDouble(image));
  }

  public Ast.Literal numberLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  public Ast.Literal numberLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  public Ast.Literal nullLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.NULL_LITERAL, null);
  }

  public Ast.Missing missing(Pos pos, String reason) {
    return new Ast.Missing(pos, reason);
  }

  // expressions

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.Call call(Pos pos, String name, Iterable<? extends Ast.Exp> args) {
    return new Ast.Call(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Call call(Pos pos, String name, Ast.Exp... args) {
    return new Ast.Call(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Field field(Pos pos, String name) {
    return new Ast.Field(pos, name);
  }

  public Ast.Index index(Pos pos, Ast.Exp exp) {
    return new Ast.Index(pos, exp);
  }

  public Ast.Access access(Pos pos, Iterable<? extends Ast.AccessPart> parts) {
    return new Ast.Access(pos, ImmutableList.copyOf(parts));
  }

  /** Creates an access chain of named fields, e.g. {@code Name} or
   * {@code ObjectPlacement.Location}. */
  public Ast.Access access(Pos pos, String... names) {
    final ImmutableList.Builder<Ast.AccessPart> b = ImmutableList.builder();
    for (String name : names) {
      b.add(field(pos, name));
    }
    return new Ast.Access(pos, b.build());
  }

  // statements

  public Ast.Assign assign(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Assign(pos, Op.ASSIGN, name, exp);
  }

  public Ast.Assign feature(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Assign(pos, Op.FEATURE, name, exp);
  }

  public Ast.Assign label(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Assign(pos, Op.LABEL, name, exp);
  }

  public Ast.Emit emit(Pos pos, Ast.Exp exp) {
    return new Ast.Emit(pos, exp);
  }

  public Ast.Select select(Pos pos, String typeName) {
    return new Ast.Select(pos, typeName);
  }

  public Ast.Where where(Pos pos, Ast.Exp exp) {
    return new Ast.Where(pos, exp);
  }

  public Ast.Setting path(Pos pos, String value) {
    return new Ast.Setting(pos, Op.PATH, value);
  }

  public Ast.Setting format(Pos pos, String value) {
    return new Ast.Setting(pos, Op.FORMAT, value);
  }

  public Ast.By by(Pos pos, String name, Iterable<? extends Ast.Exp> args) {
    return new Ast.By(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.FeatureGroup nodeFeatures(Pos pos,
      Iterable<? extends Ast.Assign> features) {
    return new Ast.FeatureGroup(pos, Op.NODE_FEATURES,
        ImmutableList.copyOf(features));
  }

  public Ast.FeatureGroup edgeFeatures(Pos pos,
      Iterable<? extends Ast.Assign> features) {
    return new Ast.FeatureGroup(pos, Op.EDGE_FEATURES,
        ImmutableList.copyOf(features));
  }

  // blocks

  public Ast.Block block(Pos pos, BlockKind kind, @Nullable String name,
      Iterable<? extends Ast.Stmt> statements) {
    return new Ast.Block(pos, kind, name, ImmutableList.copyOf(statements));
  }

  public Ast.Block block(Pos pos, BlockKind kind,
      Ast.Stmt... statements) {
    return block(pos, kind, null, ImmutableList.copyOf(statements));
  }

  /**
   * Creates a recipe from a list of blocks.
   *
   * <p>Views and exports keep their relative order.
   *
   * @throws StructureException if there is no source block, no derive block,
   *     or no export block, or if a block that may occur at most once occurs
   *     more than once
   */
  public Recipe recipe(Pos pos, Iterable<? extends Ast.Block> blocks) {
    Ast.Block source = null;
    Ast.Block derive = null;
    Ast.Block synthesize = null;
    Ast.Block split = null;
    final ImmutableList.Builder<Ast.Block> views = ImmutableList.builder();
    final ImmutableList.Builder<Ast.Block> exports = ImmutableList.builder();
    for (Ast.Block block : blocks) {
      switch (block.kind) {
        case SOURCE:
          source = single(source, block);
          break;
        case VIEW:
          views.add(block);
          break;
        case DERIVE:
          derive = single(derive, block);
          break;
        case SYNTHESIZE:
          synthesize = single(synthesize, block);
          break;
        case SPLIT:
          split = single(split, block);
          break;
        case EXPORT:
          exports.add(block);
          break;
        default:
          throw new AssertionError(block.kind);
      }
    }
    if (source == null) {
      throw new StructureException("recipe has no source block", pos);
    }
    if (derive == null) {
      throw new StructureException("recipe has no derive block", pos);
    }
    final ImmutableList<Ast.Block> exportList = exports.build();
    if (exportList.isEmpty()) {
      throw new StructureException("recipe has no export block", pos);
    }
    return new Recipe(pos, source, views.build(), derive, synthesize, split,
        exportList);
  }

  private static Ast.Block single(Ast.@Nullable Block previous,
      Ast.Block block) {
    if (previous != null) {
      throw new StructureException("recipe has more than one "
          + block.kind.keyword() + " block", block.pos);
    }
    return block;
  }

  // conversion from parse tree

  /**
   * Converts a parse tree into a recipe.
   *
   * <p>Conversion of blocks, statements and expressions never fails. A node
   * whose tag or shape is not recognized is logged; a statement is dropped,
   * and an expression becomes {@link Ast.Missing}. The only failures are
   * those of {@link #recipe}.
   */
  public Recipe toRecipe(ParseTree.Node document) {
    final ImmutableList.Builder<Ast.Block> blocks = ImmutableList.builder();
    for (ParseTree.Node child : document.children) {
      final Ast.@Nullable Block block = toBlock(child);
      if (block != null) {
        blocks.add(block);
      }
    }
    return recipe(document.pos, blocks.build());
  }

  /** Converts a parse tree node into a block, or returns null if the node
   * is not a block. */
  public Ast.@Nullable Block toBlock(ParseTree.Node node) {
    final BlockKind kind = blockKind(node.tag);
    if (kind == null || kind.named != (node.text != null)) {
      LOGGER.warn("dropping malformed block {} at {}", node.tag, node.pos);
      return null;
    }
    final ImmutableList.Builder<Ast.Stmt> statements = ImmutableList.builder();
    for (ParseTree.Node child : node.children) {
      final Ast.@Nullable Stmt statement = toStmt(kind, child);
      if (statement != null) {
        statements.add(statement);
      }
    }
    return block(node.pos, kind, node.text, statements.build());
  }

  private static @Nullable BlockKind blockKind(ParseTree.Tag tag) {
    switch (tag) {
      case SOURCE_BLOCK:
        return BlockKind.SOURCE;
      case VIEW_BLOCK:
        return BlockKind.VIEW;
      case DERIVE_BLOCK:
        return BlockKind.DERIVE;
      case SYNTHESIZE_BLOCK:
        return BlockKind.SYNTHESIZE;
      case SPLIT_BLOCK:
        return BlockKind.SPLIT;
      case EXPORT_BLOCK:
        return BlockKind.EXPORT;
      default:
        return null;
    }
  }

  /**
   * Converts a parse tree node into a statement, or returns null if the node
   * is malformed.
   *
   * <p>In a derive block, an assignment "{@code x = e;}" is a feature.
   */
  public Ast.@Nullable Stmt toStmt(BlockKind blockKind, ParseTree.Node node) {
    final String text = node.text;
    final int arity = node.children.size();
    switch (node.tag) {
      case ASSIGN_STMT:
        if (text == null || arity != 1) {
          break;
        }
        final Ast.Exp exp = toExp(node.child(0));
        return blockKind == BlockKind.DERIVE
            ? feature(node.pos, text, exp)
            : assign(node.pos, text, exp);

      case FEATURE_STMT:
        if (text == null || arity != 1) {
          break;
        }
        return feature(node.pos, text, toExp(node.child(0)));

      case LABEL_STMT:
        if (text == null || arity != 1) {
          break;
        }
        return label(node.pos, text, toExp(node.child(0)));

      case EMIT_STMT:
        if (arity != 1) {
          break;
        }
        return emit(node.pos, toExp(node.child(0)));

      case WHERE_STMT:
        if (arity != 1) {
          break;
        }
        return where(node.pos, toExp(node.child(0)));

      case SELECT_STMT:
        if (text == null) {
          break;
        }
        return select(node.pos, text);

      case PATH_STMT:
        if (text == null) {
          break;
        }
        return path(node.pos, text);

      case FORMAT_STMT:
        if (text == null) {
          break;
        }
        return format(node.pos, text);

      case BY_STMT:
        if (text == null) {
          break;
        }
        return by(node.pos, text, toExps(node.children));

      case NODE_FEATURES_STMT:
        return nodeFeatures(node.pos, toFeatures(node.children));

      case EDGE_FEATURES_STMT:
        return edgeFeatures(node.pos, toFeatures(node.children));

      default:
        break;
    }
    LOGGER.warn("dropping malformed statement {} at {}", node, node.pos);
    return null;
  }

  private List<Ast.Assign> toFeatures(List<ParseTree.Node> nodes) {
    final ImmutableList.Builder<Ast.Assign> features = ImmutableList.builder();
    for (ParseTree.Node node : nodes) {
      final Ast.@Nullable Stmt statement = toStmt(BlockKind.DERIVE, node);
      if (statement != null && statement.op == Op.FEATURE) {
        features.add((Ast.Assign) statement);
      } else if (statement != null) {
        LOGGER.warn("dropping non-feature statement {} at {}", statement,
            node.pos);
      }
    }
    return features.build();
  }

  private List<Ast.Exp> toExps(List<ParseTree.Node> nodes) {
    final ImmutableList.Builder<Ast.Exp> exps = ImmutableList.builder();
    for (ParseTree.Node node : nodes) {
      exps.add(toExp(node));
    }
    return exps.build();
  }

  /**
   * Converts a parse tree node into an expression.
   *
   * <p>Never fails. A node whose tag or shape is not recognized is logged and
   * converted to {@link Ast.Missing}, which evaluates to null.
   */
  public Ast.Exp toExp(ParseTree.Node node) {
    final String text = node.text;
    final int arity = node.children.size();
    switch (node.tag) {
      case NUMBER:
        if (text == null) {
          break;
        }
        try {
          return numberLiteral(node.pos, text);
        } catch (NumberFormatException e) {
          break;
        }

      case STRING:
        if (text == null) {
          break;
        }
        return stringLiteral(node.pos, text);

      case TRUE:
        return boolLiteral(node.pos, true);

      case FALSE:
        return boolLiteral(node.pos, false);

      case NULL:
        return nullLiteral(node.pos);

      case BINOP:
        final Op binOp = text == null ? null : Op.bySymbol(text, false);
        if (binOp == null || arity != 2) {
          break;
        }
        return infixCall(node.pos, binOp, toExp(node.child(0)),
            toExp(node.child(1)));

      case UNOP:
        final Op unOp = text == null ? null : Op.bySymbol(text, true);
        if (unOp == null || arity != 1) {
          break;
        }
        return prefixCall(node.pos, unOp, toExp(node.child(0)));

      case CALL:
        if (text == null) {
          break;
        }
        return call(node.pos, text, toExps(node.children));

      case ACCESS:
        if (arity == 0) {
          break;
        }
        final ImmutableList.Builder<Ast.AccessPart> parts =
            ImmutableList.builder();
        for (ParseTree.Node part : node.children) {
          if (part.tag == ParseTree.Tag.FIELD && part.text != null) {
            parts.add(field(part.pos, part.text));
          } else if (part.tag == ParseTree.Tag.INDEX
              && part.children.size() == 1) {
            parts.add(index(part.pos, toExp(part.child(0))));
          } else {
            parts.add(index(part.pos, unknown(part)));
          }
        }
        return access(node.pos, parts.build());

      default:
        break;
    }
    return unknown(node);
  }

  private Ast.Missing unknown(ParseTree.Node node) {
    final String reason = requireNonNull(node.toString());
    LOGGER.warn("unrecognized expression {} at {}; treating as null", reason,
        node.pos);
    return missing(node.pos, reason);
  }
}

// End AstBuilder.java
