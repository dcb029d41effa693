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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import net.hydromatic.bimdl.Fixtures;
import net.hydromatic.bimdl.model.Entity;
import net.hydromatic.bimdl.model.RelationCategory;
import net.hydromatic.bimdl.model.Relationship;
import net.hydromatic.bimdl.model.SimpleModel;
import org.junit.jupiter.api.Test;

/** Tests for {@link SemanticGraph}. */
class SemanticGraphTest {
  private static List<String> guids(List<GraphNode> nodes) {
    final List<String> list = new ArrayList<>();
    nodes.forEach(n -> list.add(n.guid));
    return list;
  }

  @Test void testNodes() {
    final SemanticGraph graph = new SemanticGraph(Fixtures.sampleModel());
    // The entity with no guid is not a node
    assertThat(guids(graph.nodes()),
        is(ImmutableList.of("b1", "st1", "w1", "w2", "d1", "wt1")));
    assertThat(guids(graph.nodesOfType("IfcWall")),
        is(ImmutableList.of("w1", "w2")));
    assertThat(graph.nodesOfType("IfcSlab"), empty());
    assertThat(graph.node("d1"), is(new GraphNode("d1", "IfcDoor")));
    assertThat(graph.node("zzz"), nullValue());
  }

  @Test void testEdges() {
    final SemanticGraph graph = new SemanticGraph(Fixtures.sampleModel());
    assertThat(graph.edgeList().toString(),
        is("[w1 -contained_in-> st1, w1 -type_of-> wt1, "
            + "w1 -connects_to-> w2, "
            + "w2 -contained_in-> st1, w2 -type_of-> wt1, "
            + "d1 -contained_in-> st1, "
            + "b1 -aggregates-> st1]"));
    assertThat(graph.edgeList(EnumSet.of(RelationKind.AGGREGATES)),
        is(
            ImmutableList.of(
                new GraphEdge("b1", "st1", RelationKind.AGGREGATES))));
    // Every edge's endpoints are nodes
    for (GraphEdge edge : graph.edgeList()) {
      assertThat(graph.node(edge.source) == null, is(false));
      assertThat(graph.node(edge.target) == null, is(false));
    }
    assertThat(graph.outEdges("w1"), hasSize(3));
    assertThat(graph.inEdges("st1"), hasSize(4));
    assertThat(graph.inEdges("st1", RelationKind.CONTAINED_IN), hasSize(3));
  }

  @Test void testQueries() {
    final SemanticGraph graph = new SemanticGraph(Fixtures.sampleModel());
    assertThat(graph.containedIn("w1"), is(new GraphNode("st1",
        "IfcBuildingStorey")));
    assertThat(graph.containedIn("st1"), nullValue());
    assertThat(graph.typeOf("w2").guid, is("wt1"));
    assertThat(graph.typeOf("d1"), nullValue());
    assertThat(guids(graph.aggregates("b1")), is(ImmutableList.of("st1")));
    assertThat(graph.decomposes("st1").guid, is("b1"));
    assertThat(graph.decomposes("b1"), nullValue());
    assertThat(guids(graph.connectsTo("w1")), is(ImmutableList.of("w2")));
    assertThat(guids(graph.connectsTo("w2")), is(ImmutableList.of("w1")));
    assertThat(guids(graph.neighbors("w1")),
        is(ImmutableList.of("st1", "wt1", "w2")));
    assertThat(guids(graph.neighbors("st1")),
        is(ImmutableList.of("w1", "w2", "d1", "b1")));
    assertThat(graph.degree("w1"), is(3));
    assertThat(graph.degree("w2"), is(3));
    assertThat(graph.degree("w2", RelationKind.CONNECTS_TO), is(1));
    assertThat(graph.degreeIn("st1", null), is(4));
    assertThat(graph.degreeOut("st1", null), is(0));
    assertThat(graph.kinds(),
        is(
            ImmutableList.of("aggregates", "connects_to", "contained_in",
                "type_of")));
    assertThat(graph.kinds("w2"),
        is(ImmutableList.of("contained_in", "type_of", "connects_to")));
  }

  @Test void testStats() {
    final GraphStats stats =
        new SemanticGraph(Fixtures.sampleModel()).stats();
    assertThat(stats.nodes, is(6));
    assertThat(stats.edgesTotal, is(7));
    assertThat(stats.toMap(),
        is(
            ImmutableMap.of("nodes", 6,
                "edge_kinds",
                ImmutableList.of("aggregates", "connects_to", "contained_in",
                    "type_of"),
                "edges_total", 7)));
  }

  @Test void testAllowList() {
    final SemanticGraph graph =
        new SemanticGraph(Fixtures.sampleModel(),
            EnumSet.of(RelationKind.CONTAINED_IN, RelationKind.TYPE_OF));
    assertThat(graph.edgeList(), hasSize(5));
    assertThat(graph.kinds(),
        is(ImmutableList.of("contained_in", "type_of")));
    assertThat(graph.connectsTo("w1"), empty());
    assertThat(graph.nodes(), hasSize(6));
  }

  /** Tests that the first entity with a given guid wins, and that edges to
   * entities that are not nodes are dropped. */
  @Test void testDuplicatesAndDroppedEdges() {
    final SimpleModel.Builder b = SimpleModel.builder();
    final Entity s = b.entity("s", "IfcBuildingStorey").last();
    final Entity first = b.entity("x", "IfcWall").last();
    final Entity second = b.entity("x", "IfcSlab").last();
    final Entity anonymous = b.entity(null, "IfcWall").last();
    b.relationship(
        new Relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, s,
            ImmutableList.of(first, anonymous)));
    b.relationship(
        new Relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, s,
            ImmutableList.of(second)));
    final SemanticGraph graph = new SemanticGraph(b.build());
    assertThat(guids(graph.nodes()), is(ImmutableList.of("s", "x")));
    assertThat(graph.node("x").type, is("IfcWall"));
    // The edge from the anonymous entity is dropped; the edge from the
    // second "x" is kept, because its guid is a node.
    assertThat(graph.edgeList(), hasSize(2));
  }

  @Test void testContainerChain() {
    final SimpleModel model = SimpleModel.builder()
        .entity("site", "IfcSite")
        .entity("bldg", "IfcBuilding")
        .entity("lvl", "IfcBuildingStorey")
        .entity("w", "IfcWall")
        .relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, "lvl",
            "w")
        .relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, "bldg",
            "lvl")
        .relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, "site",
            "bldg")
        .build();
    final SemanticGraph graph = new SemanticGraph(model);
    assertThat(guids(graph.containerChain("w")),
        is(ImmutableList.of("lvl", "bldg", "site")));
    assertThat(graph.containerChain("site"), empty());
  }

  @Test void testContainerChainCycle() {
    final SimpleModel model = SimpleModel.builder()
        .entity("a", "IfcSpace")
        .entity("b", "IfcSpace")
        .relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, "a",
            "b")
        .relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, "b",
            "a")
        .build();
    final SemanticGraph graph = new SemanticGraph(model);
    assertThat(guids(graph.containerChain("a")),
        is(ImmutableList.of("b", "a")));
  }

  @Test void testRelationKind() {
    assertThat(RelationKind.lookup("Contained_In"),
        is(RelationKind.CONTAINED_IN));
    assertThat(RelationKind.lookup("voids"), nullValue());
    assertThat(RelationKind.parseList(" type_of, ,connects_to"),
        is(EnumSet.of(RelationKind.TYPE_OF, RelationKind.CONNECTS_TO)));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> RelationKind.parseList("type_of,voids"));
    assertThat(e.getMessage(), is("unknown relation kind 'voids'"));
  }
}

// End SemanticGraphTest.java
