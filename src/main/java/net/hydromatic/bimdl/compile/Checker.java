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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.bimdl.ast.Ast;
import net.hydromatic.bimdl.ast.BlockKind;
import net.hydromatic.bimdl.ast.Op;
import net.hydromatic.bimdl.ast.Recipe;
import net.hydromatic.bimdl.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the structure of a recipe's blocks and the names of the functions
 * it calls.
 *
 * <p>All blocks are checked before reporting, so that a single
 * {@link CheckException} contains every problem.
 */
public class Checker {
  private static final Logger LOGGER = LoggerFactory.getLogger(Checker.class);

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private Checker() {}

  /** Checks a recipe; throws if there are any problems. */
  public static void check(Recipe recipe) {
    final List<Diagnostic> diagnostics = diagnose(recipe);
    if (!diagnostics.isEmpty()) {
      throw new CheckException(diagnostics);
    }
  }

  /** Returns the problems in a recipe, in the order they were found. */
  public static List<Diagnostic> diagnose(Recipe recipe) {
    final Checker checker = new Checker();
    checker.checkSource(recipe.source);
    for (int i = 0; i < recipe.views.size(); i++) {
      checker.checkView(recipe.views.get(i), i);
    }
    checker.checkDerive(recipe.derive);
    if (recipe.synthesize != null) {
      checker.checkSynthesize(recipe.synthesize);
    }
    if (recipe.split != null) {
      checker.checkSplit(recipe.split);
    }
    for (int i = 0; i < recipe.exports.size(); i++) {
      checker.checkExport(recipe.exports.get(i), i);
    }
    for (Ast.Block block : recipe.blocks()) {
      checker.checkFunctions(block);
    }
    LOGGER.debug("check found {} diagnostic(s)", checker.diagnostics.size());
    return checker.diagnostics;
  }

  private void add(String code, String message, Ast.Block block, Op stmtKind) {
    diagnostics.add(
        new Diagnostic(code, message, block.kind, stmtKind, null, block.pos));
  }

  private void checkSource(Ast.Block block) {
    if (!block.has(Op.PATH)) {
      add("SRC001", "source block must include: path \"...\";", block,
          Op.PATH);
    }
  }

  private void checkView(Ast.Block block, int i) {
    if (!block.has(Op.SELECT)) {
      add("VIEW001", "view[" + i + "] '" + block.name
          + "' has no select statement; "
          + "view will have no effect unless selection is defined.",
          block, Op.SELECT);
    }
  }

  private void checkDerive(Ast.Block block) {
    if (!block.has(Op.FEATURE) && !block.has(Op.EMIT)) {
      add("DER001", "derive block should include at least one feature "
          + "or emit statement.", block, Op.FEATURE);
    }
  }

  private void checkSynthesize(Ast.Block block) {
    for (Ast.Stmt stmt : block.statements) {
      switch (stmt.op) {
        case ASSIGN:
        case FEATURE:
        case EMIT:
          if (!callsSynth(stmt.exps().get(0))) {
            diagnostics.add(
                new Diagnostic("SYN001", "synthesize statements should "
                    + "call synth.* functions.", block.kind, stmt.op,
                    stmt.name(), stmt.pos));
          }
          break;
        default:
          break;
      }
    }
  }

  /** Returns whether an expression contains a call to a synthesis
   * function in the catalog. */
  private static boolean callsSynth(Ast.Exp exp) {
    final SynthFinder finder = new SynthFinder();
    exp.accept(finder);
    return finder.found;
  }

  private void checkSplit(Ast.Block block) {
    if (!block.has(Op.BY)) {
      add("SPL001", "split block should include: by <operator>(...);",
          block, Op.BY);
    }
  }

  private void checkExport(Ast.Block block, int i) {
    if (!block.has(Op.FORMAT)) {
      add("EXP001", "export[" + i + "] block must include: format <name>;",
          block, Op.FORMAT);
    }
    if (!block.has(Op.PATH)) {
      add("EXP002", "export[" + i + "] block must include: path \"...\";",
          block, Op.PATH);
    }
  }

  /** Checks that every function called in a block, and every split operator
   * it uses, is in the catalog. */
  private void checkFunctions(Ast.Block block) {
    final FunctionChecker functionChecker = new FunctionChecker(block.kind);
    for (Ast.Stmt stmt : block.statements) {
      functionChecker.stmt = stmt;
      stmt.accept(functionChecker);
    }
  }

  /** Visitor that sets a flag if it sees a call to a synthesis function. */
  private static class SynthFinder extends Visitor {
    boolean found;

    @Override protected void visit(Ast.Call call) {
      final BuiltIn builtIn = BuiltIn.lookup(call.name);
      if (builtIn != null && builtIn.isSynth()) {
        found = true;
      }
      super.visit(call);
    }
  }

  /** Visitor that reports calls to unknown functions and split operators.
   * Diagnostics are attributed to the top-level statement being visited. */
  private class FunctionChecker extends Visitor {
    private final BlockKind kind;
    Ast.@Nullable Stmt stmt;

    FunctionChecker(BlockKind kind) {
      this.kind = kind;
    }

    @Override protected void visit(Ast.By by) {
      if (!BuiltIn.isKnown(by.name)) {
        diagnostics.add(
            new Diagnostic("FN002", "Unknown split operator '" + by.name
                + "'.", kind, Op.BY, null, by.pos));
      }
      super.visit(by);
    }

    @Override protected void visit(Ast.Call call) {
      if (!BuiltIn.isKnown(call.name)) {
        final Ast.Stmt stmt = requireNonNull(this.stmt);
        diagnostics.add(
            new Diagnostic("FN001", "Unknown function '" + call.name
                + "'.", kind, stmt.op, stmt.name(), call.pos));
      }
      super.visit(call);
    }
  }
}

// End Checker.java
