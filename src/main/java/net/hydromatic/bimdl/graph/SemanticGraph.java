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
package net.hydromatic.bimdl.graph;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.bimdl.model.Entity;
import net.hydromatic.bimdl.model.Model;
import net.hydromatic.bimdl.model.RelationCategory;
import net.hydromatic.bimdl.model.Relationship;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directed multigraph of the entities of a model and the relationships
 * between them.
 *
 * <p>Every entity with a non-empty guid becomes a node; if two entities have
 * the same guid, the first wins. Each relationship record of an enabled
 * {@link RelationKind} becomes one edge per related entity; an edge whose
 * source or target is not a node is dropped.
 *
 * <p>Immutable once constructed, and therefore safe for concurrent readers.
 */
public class SemanticGraph {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SemanticGraph.class);

  private final ImmutableMap<String, GraphNode> nodes;
  private final ImmutableListMultimap<String, GraphNode> byType;
  private final ImmutableListMultimap<String, GraphEdge> out;
  private final ImmutableListMultimap<String, GraphEdge> in;

  /** Creates a graph with all kinds of relation. */
  public SemanticGraph(Model model) {
    this(model, null);
  }

  /**
   * Creates a graph.
   *
   * @param model Model
   * @param kinds Kinds of relation to build, or null to build all kinds
   */
  public SemanticGraph(Model model, @Nullable Set<RelationKind> kinds) {
    final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    final ListMultimap<String, GraphNode> byType =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (Entity entity : model.entities()) {
      if (!entity.hasGuid() || nodes.containsKey(entity.guid)) {
        continue;
      }
      final GraphNode node = new GraphNode(entity.guid, entity.type);
      nodes.put(node.guid, node);
      byType.put(node.type, node);
    }
    this.nodes = ImmutableMap.copyOf(nodes);
    this.byType = ImmutableListMultimap.copyOf(byType);

    final ListMultimap<String, GraphEdge> out =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    final ListMultimap<String, GraphEdge> in =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    int dropped = 0;
    for (RelationKind kind : RelationKind.values()) {
      if (kinds != null && !kinds.contains(kind)) {
        continue;
      }
      for (RelationCategory category : kind.categories) {
        for (Relationship r : model.relationships(category)) {
          for (Entity related : r.related) {
            final boolean added;
            switch (kind) {
              case CONTAINED_IN:
              case TYPE_OF:
                added = addEdge(out, in, related, r.relating, kind);
                break;
              default:
                added = addEdge(out, in, r.relating, related, kind);
            }
            if (!added) {
              ++dropped;
            }
          }
        }
      }
    }
    this.out = ImmutableListMultimap.copyOf(out);
    this.in = ImmutableListMultimap.copyOf(in);
    LOGGER.debug("built graph with {} nodes, {} edges; dropped {} edges",
        this.nodes.size(), this.out.size(), dropped);
  }

  private boolean addEdge(ListMultimap<String, GraphEdge> out,
      ListMultimap<String, GraphEdge> in, Entity source, Entity target,
      RelationKind kind) {
    if (!source.hasGuid()
        || !target.hasGuid()
        || !nodes.containsKey(source.guid)
        || !nodes.containsKey(target.guid)) {
      return false;
    }
    final GraphEdge edge = new GraphEdge(source.guid, target.guid, kind);
    out.put(edge.source, edge);
    in.put(edge.target, edge);
    return true;
  }

  /** Returns all nodes, in model order. */
  public List<GraphNode> nodes() {
    return nodes.values().asList();
  }

  /** Returns the node with a given guid, or null. */
  public @Nullable GraphNode node(String guid) {
    return nodes.get(guid);
  }

  /** Returns the nodes of a given type, in model order. */
  public List<GraphNode> nodesOfType(String type) {
    return byType.get(type);
  }

  /** Returns the edges whose source is a given node. */
  public List<GraphEdge> outEdges(String guid) {
    return out.get(guid);
  }

  /** Returns the edges of a given kind whose source is a given node. */
  public List<GraphEdge> outEdges(String guid, @Nullable RelationKind kind) {
    return filter(out.get(guid), kind);
  }

  /** Returns the edges whose target is a given node. */
  public List<GraphEdge> inEdges(String guid) {
    return in.get(guid);
  }

  /** Returns the edges of a given kind whose target is a given node. */
  public List<GraphEdge> inEdges(String guid, @Nullable RelationKind kind) {
    return filter(in.get(guid), kind);
  }

  private static List<GraphEdge> filter(List<GraphEdge> edges,
      @Nullable RelationKind kind) {
    if (kind == null) {
      return edges;
    }
    final ImmutableList.Builder<GraphEdge> b = ImmutableList.builder();
    for (GraphEdge edge : edges) {
      if (edge.kind == kind) {
        b.add(edge);
      }
    }
    return b.build();
  }

  /** Returns the nodes adjacent to a given node in either direction. */
  public List<GraphNode> neighbors(String guid) {
    return neighbors(guid, null);
  }

  /**
   * Returns the nodes adjacent to a given node in either direction via edges
   * of a given kind (or of any kind, if {@code kind} is null).
   *
   * <p>Targets of outgoing edges come first, then sources of incoming edges.
   * Each node occurs once, at its first position.
   */
  public List<GraphNode> neighbors(String guid, @Nullable RelationKind kind) {
    final Set<String> seen = new HashSet<>();
    final ImmutableList.Builder<GraphNode> b = ImmutableList.builder();
    for (GraphEdge edge : outEdges(guid, kind)) {
      if (seen.add(edge.target)) {
        b.add(requireNonNull(nodes.get(edge.target)));
      }
    }
    for (GraphEdge edge : inEdges(guid, kind)) {
      if (seen.add(edge.source)) {
        b.add(requireNonNull(nodes.get(edge.source)));
      }
    }
    return b.build();
  }

  /** Returns the immediate spatial container of a node: the target of its
   * first {@link RelationKind#CONTAINED_IN} edge; or null. */
  public @Nullable GraphNode containedIn(String guid) {
    return firstTarget(guid, RelationKind.CONTAINED_IN);
  }

  /**
   * Returns the chain of containers of a node: its container, its container's
   * container, and so forth. Does not include the node itself.
   *
   * <p>Stops at a node that has no container, or at a node that has already
   * been visited, so it terminates even if containment has a cycle.
   */
  public List<GraphNode> containerChain(String guid) {
    final List<GraphNode> chain = new ArrayList<>();
    final Set<String> visited = new HashSet<>();
    String current = guid;
    while (visited.add(current)) {
      final GraphNode parent = containedIn(current);
      if (parent == null) {
        break;
      }
      chain.add(parent);
      current = parent.guid;
    }
    return ImmutableList.copyOf(chain);
  }

  /** Returns the parts aggregated by a node. */
  public List<GraphNode> aggregates(String guid) {
    final ImmutableList.Builder<GraphNode> b = ImmutableList.builder();
    for (GraphEdge edge : outEdges(guid, RelationKind.AGGREGATES)) {
      b.add(requireNonNull(nodes.get(edge.target)));
    }
    return b.build();
  }

  /** Returns the whole that a node is part of: the source of its first
   * incoming {@link RelationKind#AGGREGATES} edge; or null. */
  public @Nullable GraphNode decomposes(String guid) {
    for (GraphEdge edge : in.get(guid)) {
      if (edge.kind == RelationKind.AGGREGATES) {
        return nodes.get(edge.source);
      }
    }
    return null;
  }

  /** Returns the type object of a node, or null. */
  public @Nullable GraphNode typeOf(String guid) {
    return firstTarget(guid, RelationKind.TYPE_OF);
  }

  /** Returns the nodes connected to a node, in either direction. */
  public List<GraphNode> connectsTo(String guid) {
    return neighbors(guid, RelationKind.CONNECTS_TO);
  }

  private @Nullable GraphNode firstTarget(String guid, RelationKind kind) {
    for (GraphEdge edge : out.get(guid)) {
      if (edge.kind == kind) {
        return nodes.get(edge.target);
      }
    }
    return null;
  }

  /** Returns the number of edges into and out of a node. */
  public int degree(String guid) {
    return out.get(guid).size() + in.get(guid).size();
  }

  /** Returns the number of edges of a given kind into and out of a node. */
  public int degree(String guid, @Nullable RelationKind kind) {
    return degreeOut(guid, kind) + degreeIn(guid, kind);
  }

  /** Returns the number of edges of a given kind (or any kind, if null)
   * into a node. */
  public int degreeIn(String guid, @Nullable RelationKind kind) {
    return inEdges(guid, kind).size();
  }

  /** Returns the number of edges of a given kind (or any kind, if null) out
   * of a node. */
  public int degreeOut(String guid, @Nullable RelationKind kind) {
    return outEdges(guid, kind).size();
  }

  /** Returns all edges, grouped by source node in order of each source's
   * first edge. */
  public List<GraphEdge> edgeList() {
    return out.values().asList();
  }

  /** Returns all edges whose kind is in a given collection. */
  public List<GraphEdge> edgeList(Collection<RelationKind> kinds) {
    final ImmutableList.Builder<GraphEdge> b = ImmutableList.builder();
    for (GraphEdge edge : out.values()) {
      if (kinds.contains(edge.kind)) {
        b.add(edge);
      }
    }
    return b.build();
  }

  /** Returns the distinct kinds of edge present, as lower-case names, in
   * sorted order. */
  public List<String> kinds() {
    final Set<String> kinds = new TreeSet<>();
    for (GraphEdge edge : out.values()) {
      kinds.add(edge.kind.lowerName());
    }
    return ImmutableList.copyOf(kinds);
  }

  /** Returns the distinct kinds of edge incident to a node, in the order
   * first seen. */
  public List<String> kinds(String guid) {
    final Set<String> kinds = new LinkedHashSet<>();
    for (GraphEdge edge : out.get(guid)) {
      kinds.add(edge.kind.lowerName());
    }
    for (GraphEdge edge : in.get(guid)) {
      kinds.add(edge.kind.lowerName());
    }
    return ImmutableList.copyOf(kinds);
  }

  /** Returns summary statistics. */
  public GraphStats stats() {
    return new GraphStats(nodes.size(), kinds(), out.size());
  }
}

// End SemanticGraph.java
