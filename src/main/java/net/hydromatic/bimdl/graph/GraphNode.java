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

/** Node in a {@link SemanticGraph}: an entity's guid and type. */
public class GraphNode {
  public final String guid;
  public final String type;

  public GraphNode(String guid, String type) {
    this.guid = requireNonNull(guid);
    this.type = requireNonNull(type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(guid, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GraphNode
            && guid.equals(((GraphNode) o).guid)
            && type.equals(((GraphNode) o).type);
  }

  @Override
  public String toString() {
    return type + "(" + guid + ")";
  }
}

// End GraphNode.java
