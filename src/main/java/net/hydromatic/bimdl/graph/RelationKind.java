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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import net.hydromatic.bimdl.model.RelationCategory;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of edge in a {@link SemanticGraph}. */
public enum RelationKind {
  /** Element is contained in a spatial structure; element to container. */
  CONTAINED_IN(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE),
  /** Whole aggregates part; whole to part. */
  AGGREGATES(RelationCategory.AGGREGATES),
  /** Instance is of a type object; instance to type. */
  TYPE_OF(RelationCategory.DEFINES_BY_TYPE),
  /** Element or port connects to element or port. */
  CONNECTS_TO(RelationCategory.CONNECTS_ELEMENTS,
      RelationCategory.CONNECTS_PORTS,
      RelationCategory.CONNECTS_PORT_TO_ELEMENT);

  /** Categories of relationship record from which edges of this kind are
   * built. */
  public final ImmutableList<RelationCategory> categories;

  RelationKind(RelationCategory... categories) {
    this.categories = ImmutableList.copyOf(categories);
  }

  /** Returns the name as it appears in recipes and edge lists, e.g.
   * "contained_in". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a kind by name, ignoring case; returns null if not found. */
  public static @Nullable RelationKind lookup(String name) {
    for (RelationKind kind : values()) {
      if (kind.name().equalsIgnoreCase(name.trim())) {
        return kind;
      }
    }
    return null;
  }

  /** Parses a comma-separated list of kinds, e.g.
   * "contained_in,type_of".
   *
   * @throws IllegalArgumentException if a name is not a valid kind */
  public static Set<RelationKind> parseList(String names) {
    final Set<RelationKind> kinds = EnumSet.noneOf(RelationKind.class);
    for (String name : Splitter.on(',').trimResults().omitEmptyStrings()
        .split(names)) {
      final RelationKind kind = lookup(name);
      if (kind == null) {
        throw new IllegalArgumentException("unknown relation kind '"
            + name + "'");
      }
      kinds.add(kind);
    }
    return kinds;
  }
}

// End RelationKind.java
