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
package net.hydromatic.bimdl.eval;

import static java.util.Objects.requireNonNull;

import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.graph.GraphNode;
import net.hydromatic.bimdl.graph.SemanticGraph;
import net.hydromatic.bimdl.model.Entity;
import net.hydromatic.bimdl.model.Model;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment: the model, its graph, and the node that
 * expressions are currently evaluated against.
 *
 * <p>Immutable; {@link #bind} creates an environment for another node.
 */
public class EvalEnv {
  public final Model model;
  public final SemanticGraph graph;
  /** Seed for randomized functions, or null. */
  public final @Nullable Integer seed;
  private final @Nullable GraphNode node;
  private final @Nullable Entity entity;

  private EvalEnv(Model model, SemanticGraph graph, @Nullable Integer seed,
      @Nullable GraphNode node, @Nullable Entity entity) {
    this.model = requireNonNull(model);
    this.graph = requireNonNull(graph);
    this.seed = seed;
    this.node = node;
    this.entity = entity;
  }

  /** Creates an environment not bound to any node. */
  public static EvalEnv of(Model model, SemanticGraph graph,
      @Nullable Integer seed) {
    return new EvalEnv(model, graph, seed, null, null);
  }

  /** Creates an environment that has the same content as this one, bound to
   * a given node. */
  public EvalEnv bind(GraphNode node) {
    return new EvalEnv(model, graph, seed, node, model.entity(node.guid));
  }

  /** Returns the current node.
   *
   * @throws EvalException if this environment is not bound to a node */
  public GraphNode node() {
    if (node == null) {
      throw new EvalException("no current node", Pos.ZERO);
    }
    return node;
  }

  /** Returns the model entity of the current node, or null if the model has
   * no entity with the node's guid. */
  public @Nullable Entity entity() {
    return entity;
  }
}

// End EvalEnv.java
