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

import java.util.Objects;

/** Directed edge in a {@link SemanticGraph}. */
public class GraphEdge {
  public final String source;
  public final String target;
  public final RelationKind kind;

  public GraphEdge(String source, String target, RelationKind kind) {
    this.source = requireNonNull(source);
    this.target = requireNonNull(target);
    this.kind = requireNonNull(kind);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, kind);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GraphEdge
            && source.equals(((GraphEdge) o).source)
            && target.equals(((GraphEdge) o).target)
            && kind == ((GraphEdge) o).kind;
  }

  @Override
  public String toString() {
    return source + " -" + kind.lowerName() + "-> " + target;
  }
}

// End GraphEdge.java
