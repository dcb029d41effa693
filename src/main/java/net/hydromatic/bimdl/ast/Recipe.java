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
import java.util.Objects;
import net.hydromatic.bimdl.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parsed recipe.
 *
 * <p>Has exactly one source block, zero or more view blocks, exactly one
 * derive block, at most one synthesize block, at most one split block, and
 * one or more export blocks. Use {@link AstBuilder#recipe} to create one; it
 * enforces these rules.
 */
public class Recipe extends AstNode {
  public final Ast.Block source;
  public final List<Ast.Block> views;
  public final Ast.Block derive;
  public final Ast.@Nullable Block synthesize;
  public final Ast.@Nullable Block split;
  public final List<Ast.Block> exports;

  Recipe(Pos pos, Ast.Block source, ImmutableList<Ast.Block> views,
      Ast.Block derive, Ast.@Nullable Block synthesize,
      Ast.@Nullable Block split, ImmutableList<Ast.Block> exports) {
    super(pos, Op.RECIPE);
    this.source = requireNonNull(source);
    this.views = requireNonNull(views);
    this.derive = requireNonNull(derive);
    this.synthesize = synthesize;
    this.split = split;
    this.exports = requireNonNull(exports);
  }

  /** Returns all blocks, in canonical order. */
  public List<Ast.Block> blocks() {
    final ImmutableList.Builder<Ast.Block> b = ImmutableList.builder();
    b.add(source).addAll(views).add(derive);
    if (synthesize != null) {
      b.add(synthesize);
    }
    if (split != null) {
      b.add(split);
    }
    return b.addAll(exports).build();
  }

  /** Returns the number of statements in each block. */
  public Summary summary() {
    return new Summary(source.statements.size(),
        Static.transformEager(views, v -> v.statements.size()),
        derive.statements.size(),
        synthesize == null ? null : synthesize.statements.size(),
        split == null ? null : split.statements.size(),
        Static.transformEager(exports, e -> e.statements.size()));
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    final List<Ast.Block> blocks = blocks();
    for (int i = 0; i < blocks.size(); i++) {
      if (i > 0) {
        w.append("\n");
      }
      w.append(blocks.get(i), 0, 0);
    }
    return w;
  }

  /** Statement counts per block. Counts are null for absent optional
   * blocks. */
  public static class Summary {
    public final int source;
    public final List<Integer> views;
    public final int derive;
    public final @Nullable Integer synthesize;
    public final @Nullable Integer split;
    public final List<Integer> exports;

    Summary(int source, List<Integer> views, int derive,
        @Nullable Integer synthesize, @Nullable Integer split,
        List<Integer> exports) {
      this.source = source;
      this.views = ImmutableList.copyOf(views);
      this.derive = derive;
      this.synthesize = synthesize;
      this.split = split;
      this.exports = ImmutableList.copyOf(exports);
    }

    @Override
    public int hashCode() {
      return Objects.hash(source, views, derive, synthesize, split, exports);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Summary
              && source == ((Summary) o).source
              && views.equals(((Summary) o).views)
              && derive == ((Summary) o).derive
              && Objects.equals(synthesize, ((Summary) o).synthesize)
              && Objects.equals(split, ((Summary) o).split)
              && exports.equals(((Summary) o).exports);
    }

    @Override
    public String toString() {
      return "{source: " + source
          + ", views: " + views
          + ", derive: " + derive
          + ", synthesize: " + synthesize
          + ", split: " + split
          + ", exports: " + exports
          + "}";
    }
  }
}

// End Recipe.java
