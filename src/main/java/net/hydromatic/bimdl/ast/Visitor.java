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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Missing missing) {}

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.Access access) {
    access.parts.forEach(this::accept);
  }

  protected void visit(Ast.Field field) {}

  protected void visit(Ast.Index index) {
    index.exp.accept(this);
  }

  // statements

  protected void visit(Ast.Assign assign) {
    assign.exp.accept(this);
  }

  protected void visit(Ast.Emit emit) {
    emit.exp.accept(this);
  }

  protected void visit(Ast.Select select) {}

  protected void visit(Ast.Where where) {
    where.exp.accept(this);
  }

  protected void visit(Ast.Setting setting) {}

  protected void visit(Ast.By by) {
    by.args.forEach(this::accept);
  }

  protected void visit(Ast.FeatureGroup featureGroup) {
    featureGroup.features.forEach(this::accept);
  }

  // blocks

  protected void visit(Ast.Block block) {
    block.statements.forEach(this::accept);
  }

  protected void visit(Recipe recipe) {
    recipe.blocks().forEach(this::accept);
  }
}

// End Visitor.java
