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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns the direct sub-expressions of this expression. */
    public List<Exp> args() {
      return ImmutableList.of();
    }

    /**
     * Calls a consumer for this expression and, recursively, every
     * expression inside it, in pre-order.
     */
    public void visit(Consumer<Exp> consumer) {
      consumer.accept(this);
      for (Exp arg : args()) {
        arg.visit(consumer);
      }
    }
  }

  /**
   * Literal: a number, string, boolean, or null.
   *
   * <p>Integral numbers are held as {@link Long}, other numbers as
   * {@link Double}.
   */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final @Nullable Comparable value;

    Literal(Pos pos, Op op, @Nullable Comparable value) {
      super(pos, op);
      this.value = value;
      checkArgument(
          op == Op.NULL_LITERAL ? value == null : value != null,
          "value of %s literal", op);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && this.op == ((Literal) o).op
              && Objects.equals(this.value, ((Literal) o).value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /**
   * Expression that stands in for a parse-tree node that could not be
   * converted. Evaluates to null.
   */
  public static class Missing extends Exp {
    /** Description of the node that could not be converted. */
    public final String reason;

    Missing(Pos pos, String reason) {
      super(pos, Op.MISSING);
      this.reason = requireNonNull(reason);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("null");
    }
  }

  /** Call to an infix operator, e.g. "{@code a + b}". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public List<Exp> args() {
      return ImmutableList.of(a0, a1);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a prefix operator, e.g. "{@code not a}" or "{@code -x}". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    public List<Exp> args() {
      return ImmutableList.of(a);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Call to a built-in function, e.g. "{@code pset.get("Pset_WallCommon",
   * "IsExternal")}". */
  public static class Call extends Exp {
    /** Qualified name of the function, e.g. "pset.get". */
    public final String name;
    public final List<Exp> args;

    Call(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public List<Exp> args() {
      return args;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append("(").appendAll(args).append(")");
    }
  }

  /** Part of an access chain; either a {@link Field} or an {@link Index}. */
  public abstract static class AccessPart extends AstNode {
    AccessPart(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Named field in an access chain, e.g. "Name" in "{@code Name}". */
  public static class Field extends AccessPart {
    public final String name;

    Field(Pos pos, String name) {
      super(pos, Op.FIELD);
      this.name = requireNonNull(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Bracketed index in an access chain, e.g. "[0]" in "{@code Tags[0]}". */
  public static class Index extends AccessPart {
    public final Exp exp;

    Index(Pos pos, Exp exp) {
      super(pos, Op.INDEX);
      this.exp = requireNonNull(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(exp, 0, 0).append("]");
    }
  }

  /** Access chain, e.g. "{@code ObjectPlacement.Location[0]}". */
  public static class Access extends Exp {
    public final List<AccessPart> parts;

    Access(Pos pos, ImmutableList<AccessPart> parts) {
      super(pos, Op.ACCESS);
      this.parts = requireNonNull(parts);
      checkArgument(!parts.isEmpty(), "empty access chain");
    }

    /** Returns the expressions inside index parts. */
    @Override
    public List<Exp> args() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      for (AccessPart part : parts) {
        if (part instanceof Index) {
          b.add(((Index) part).exp);
        }
      }
      return b.build();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < parts.size(); i++) {
        final AccessPart part = parts.get(i);
        if (i > 0 && part instanceof Field) {
          w.append(".");
        }
        w.append(part, 0, 0);
      }
      return w;
    }
  }

  /** Base class for a statement. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns the name declared by this statement, or null. */
    public @Nullable String name() {
      return null;
    }

    /**
     * Returns the expressions directly held by this statement, including
     * those of nested feature statements.
     */
    public List<Exp> exps() {
      return ImmutableList.of();
    }
  }

  /**
   * Statement that binds a name to an expression.
   *
   * <p>Op is {@link Op#ASSIGN} ("{@code x = 1;}" outside a derive block),
   * {@link Op#FEATURE} ("{@code x = 1;}" in a derive block, or
   * "{@code feature x = 1;}"), or {@link Op#LABEL}
   * ("{@code label y = 1;}").
   */
  public static class Assign extends Stmt {
    public final String name;
    public final Exp exp;

    Assign(Pos pos, Op op, String name, Exp exp) {
      super(pos, op);
      checkArgument(op == Op.ASSIGN || op == Op.FEATURE || op == Op.LABEL);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (op != Op.ASSIGN) {
        w.append(op.lowerName()).append(" ");
      }
      return w.append(name).append(" = ").append(exp, 0, 0).append(";");
    }
  }

  /** Emit statement, e.g. "{@code emit node;}". */
  public static class Emit extends Stmt {
    public final Exp exp;

    Emit(Pos pos, Exp exp) {
      super(pos, Op.EMIT);
      this.exp = requireNonNull(exp);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("emit ").append(exp, 0, 0).append(";");
    }
  }

  /** Select statement, e.g. "{@code select IfcWall;}". Replaces the
   * current candidates of a view with all nodes of a type. */
  public static class Select extends Stmt {
    public final String typeName;

    Select(Pos pos, String typeName) {
      super(pos, Op.SELECT);
      this.typeName = requireNonNull(typeName);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("select ").append(typeName).append(";");
    }
  }

  /** Where statement, e.g. "{@code where geom.exists();}". Filters the
   * current candidates of a view. */
  public static class Where extends Stmt {
    public final Exp exp;

    Where(Pos pos, Exp exp) {
      super(pos, Op.WHERE);
      this.exp = requireNonNull(exp);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("where ").append(exp, 0, 0).append(";");
    }
  }

  /**
   * Statement that sets a string-valued option of a block, e.g.
   * "{@code path "out/walls.jsonl";}" or "{@code format jsonl;}".
   *
   * <p>Op is {@link Op#PATH} or {@link Op#FORMAT}.
   */
  public static class Setting extends Stmt {
    public final String value;

    Setting(Pos pos, Op op, String value) {
      super(pos, op);
      checkArgument(op == Op.PATH || op == Op.FORMAT);
      this.value = requireNonNull(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op.lowerName()).append(" ");
      if (op == Op.FORMAT && IDENTIFIER.matcher(value).matches()) {
        w.append(value);
      } else {
        w.appendString(value);
      }
      return w.append(";");
    }
  }

  /** Split statement, e.g. "{@code by storey();}". */
  public static class By extends Stmt {
    /** Name of the split operator, e.g. "storey". */
    public final String name;
    public final List<Exp> args;

    By(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.BY);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public List<Exp> exps() {
      return args;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("by ").append(name).append("(").appendAll(args)
          .append(");");
    }
  }

  /**
   * Group of feature statements.
   *
   * <p>Op is {@link Op#NODE_FEATURES} or {@link Op#EDGE_FEATURES}.
   */
  public static class FeatureGroup extends Stmt {
    public final List<Assign> features;

    FeatureGroup(Pos pos, Op op, ImmutableList<Assign> features) {
      super(pos, op);
      checkArgument(op == Op.NODE_FEATURES || op == Op.EDGE_FEATURES);
      this.features = requireNonNull(features);
    }

    @Override
    public List<Exp> exps() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      for (Assign feature : features) {
        b.add(feature.exp);
      }
      return b.build();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.lowerName()).append(" ").block(features);
    }
  }

  /** Block: a kind, an optional name, and a list of statements. */
  public static class Block extends AstNode {
    public final BlockKind kind;
    /** Name of a view, or kind of an export; null for other blocks. */
    public final @Nullable String name;
    public final List<Stmt> statements;

    Block(Pos pos, BlockKind kind, @Nullable String name,
        ImmutableList<Stmt> statements) {
      super(pos, Op.BLOCK);
      this.kind = requireNonNull(kind);
      this.name = name;
      this.statements = requireNonNull(statements);
      checkArgument(kind.named == (name != null),
          "block %s must %shave a name", kind, kind.named ? "" : "not ");
    }

    /** Returns whether this block has at least one statement of a given
     * kind. */
    public boolean has(Op op) {
      return first(op) != null;
    }

    /** Returns the first statement of a given kind, or null. */
    public @Nullable Stmt first(Op op) {
      for (Stmt statement : statements) {
        if (statement.op == op) {
          return statement;
        }
      }
      return null;
    }

    /** Returns the value of the first {@code path} or {@code format}
     * statement, or null. */
    public @Nullable String setting(Op op) {
      final Stmt statement = first(op);
      return statement instanceof Setting ? ((Setting) statement).value : null;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(kind.keyword()).append(" ");
      if (name != null) {
        w.append(name).append(" ");
      }
      return w.block(statements);
    }
  }
}

// End Ast.java
