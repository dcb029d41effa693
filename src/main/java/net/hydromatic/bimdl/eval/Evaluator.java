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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.bimdl.ast.Ast;
import net.hydromatic.bimdl.ast.Op;
import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.ast.Recipe;
import net.hydromatic.bimdl.compile.BuiltIn;
import net.hydromatic.bimdl.graph.GraphNode;
import net.hydromatic.bimdl.graph.SemanticGraph;
import net.hydromatic.bimdl.model.Entity;
import net.hydromatic.bimdl.model.Model;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a checked recipe against a model and its semantic graph.
 *
 * <p>Evaluation has two phases. The selection phase applies the recipe's
 * views to find candidate nodes; the derivation phase computes one row per
 * candidate. Each row is a map whose first key is {@link #GUID} and whose
 * remaining keys are feature names in declaration order.
 */
public class Evaluator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Evaluator.class);

  /** Key of the node identifier in each row. */
  public static final String GUID = "guid";

  private final EvalEnv env;

  public Evaluator(Model model, SemanticGraph graph, @Nullable Integer seed) {
    this.env = EvalEnv.of(model, graph, seed);
  }

  /** Evaluates a recipe, returning one row per selected node. */
  public List<Map<String, @Nullable Object>> evaluate(Recipe recipe) {
    final List<GraphNode> nodes = select(recipe);
    LOGGER.debug("selected {} node(s)", nodes.size());
    return derive(recipe, nodes);
  }

  /** Returns the nodes selected by a recipe's views.
   *
   * <p>If there are no views, returns all nodes. Otherwise concatenates the
   * results of each view, removing duplicates but preserving the order in
   * which each node is first seen. */
  public List<GraphNode> select(Recipe recipe) {
    if (recipe.views.isEmpty()) {
      return env.graph.nodes();
    }
    final Set<GraphNode> selected = new LinkedHashSet<>();
    for (Ast.Block view : recipe.views) {
      selected.addAll(selectView(view));
    }
    return ImmutableList.copyOf(selected);
  }

  private List<GraphNode> selectView(Ast.Block view) {
    List<GraphNode> nodes = env.graph.nodes();
    for (Ast.Stmt stmt : view.statements) {
      switch (stmt.op) {
        case SELECT:
          // Replaces the current set; it does not intersect with it.
          nodes = env.graph.nodesOfType(((Ast.Select) stmt).typeName);
          break;
        case WHERE:
          final Ast.Exp condition = ((Ast.Where) stmt).exp;
          final List<GraphNode> filtered = new ArrayList<>();
          for (GraphNode node : nodes) {
            if (Codes.truthy(eval(condition, env.bind(node)))) {
              filtered.add(node);
            }
          }
          nodes = filtered;
          break;
        default:
          LOGGER.debug("ignoring {} statement in view {}", stmt.op,
              view.name);
      }
    }
    return nodes;
  }

  /** Computes one row per node from the features of a recipe's derive
   * block. A later feature with the same name overwrites an earlier one. */
  public List<Map<String, @Nullable Object>> derive(Recipe recipe,
      List<GraphNode> nodes) {
    final List<Ast.Assign> features = new ArrayList<>();
    for (Ast.Stmt stmt : recipe.derive.statements) {
      if (stmt.op == Op.FEATURE) {
        features.add((Ast.Assign) stmt);
      }
    }
    final List<Map<String, @Nullable Object>> rows = new ArrayList<>();
    for (GraphNode node : nodes) {
      final EvalEnv nodeEnv = env.bind(node);
      final Map<String, @Nullable Object> row = new LinkedHashMap<>();
      row.put(GUID, node.guid);
      for (Ast.Assign feature : features) {
        row.put(feature.name, eval(feature.exp, nodeEnv));
      }
      rows.add(row);
    }
    return rows;
  }

  /** Evaluates an expression in an environment. */
  public @Nullable Object eval(Ast.Exp exp, EvalEnv env) {
    switch (exp.op) {
      case NUMBER_LITERAL:
      case STRING_LITERAL:
      case BOOL_LITERAL:
      case NULL_LITERAL:
        return ((Ast.Literal) exp).value;

      case MISSING:
        return null;

      case NOT:
      case NEGATE:
        final Ast.PrefixCall prefixCall = (Ast.PrefixCall) exp;
        return Codes.unary(exp.op, eval(prefixCall.a, env), exp.pos);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
      case EQ:
      case NE:
      case LT:
      case GT:
      case LE:
      case GE:
      case AND:
      case OR:
        final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
        final Object a0 = eval(infixCall.a0, env);
        final Object a1 = eval(infixCall.a1, env);
        return Codes.binary(exp.op, a0, a1, exp.pos);

      case CALL:
        return call((Ast.Call) exp, env);

      case ACCESS:
        return access((Ast.Access) exp, env);

      default:
        throw new EvalException("unsupported expression " + exp.op,
            exp.pos);
    }
  }

  private @Nullable Object call(Ast.Call call, EvalEnv env) {
    final BuiltIn builtIn = BuiltIn.lookup(call.name);
    if (builtIn == null) {
      throw new EvalException("unknown function '" + call.name + "'",
          call.pos);
    }
    if (builtIn.implementation == null) {
      throw new EvalException("function '" + call.name
          + "' is not implemented", call.pos);
    }
    final List<@Nullable Object> args = new ArrayList<>(call.args.size());
    for (Ast.Exp arg : call.args) {
      args.add(eval(arg, env));
    }
    if (!builtIn.accepts(args.size())) {
      return null;
    }
    try {
      return builtIn.implementation.apply(env, args);
    } catch (EvalException e) {
      if (e.pos().equals(Pos.ZERO)) {
        throw new EvalException(requireNonNull(e.getMessage()), call.pos);
      }
      throw e;
    }
  }

  /** Evaluates an access chain such as {@code Name} or {@code a.b}.
   *
   * <p>Each field is looked up as an attribute of the current entity; the
   * value of the chain is the value of its last field. An index part makes
   * the whole chain null, and its expression is not evaluated. */
  private @Nullable Object access(Ast.Access access, EvalEnv env) {
    final Entity entity = env.entity();
    Object value = null;
    for (Ast.AccessPart part : access.parts) {
      if (!(part instanceof Ast.Field)) {
        return null;
      }
      final String name = ((Ast.Field) part).name;
      value = entity == null ? null : env.model.attribute(entity, name);
    }
    return value;
  }
}

// End Evaluator.java
