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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Summary statistics of a {@link SemanticGraph}. */
public class GraphStats {
  public final int nodes;
  /** Distinct kinds of edge present, sorted by name. */
  public final List<String> edgeKinds;
  public final int edgesTotal;

  GraphStats(int nodes, List<String> edgeKinds, int edgesTotal) {
    this.nodes = nodes;
    this.edgeKinds = ImmutableList.copyOf(edgeKinds);
    this.edgesTotal = edgesTotal;
  }

  /** Converts to a map, for a manifest. */
  public Map<String, Object> toMap() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("nodes", nodes);
    map.put("edge_kinds", edgeKinds);
    map.put("edges_total", edgesTotal);
    return map;
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodes, edgeKinds, edgesTotal);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GraphStats
            && nodes == ((GraphStats) o).nodes
            && edgeKinds.equals(((GraphStats) o).edgeKinds)
            && edgesTotal == ((GraphStats) o).edgesTotal;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}

// End GraphStats.java
