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
package net.hydromatic.bimdl.model;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Category of relationship record in a building model. */
public enum RelationCategory {
  /** Relating structure contains related elements. */
  CONTAINED_IN_SPATIAL_STRUCTURE("IfcRelContainedInSpatialStructure"),
  /** Relating whole aggregates related parts. */
  AGGREGATES("IfcRelAggregates"),
  /** Relating type defines related objects. */
  DEFINES_BY_TYPE("IfcRelDefinesByType"),
  /** Relating element connects to related element. */
  CONNECTS_ELEMENTS("IfcRelConnectsElements"),
  /** Relating port connects to related port. */
  CONNECTS_PORTS("IfcRelConnectsPorts"),
  /** Relating port connects to related element. */
  CONNECTS_PORT_TO_ELEMENT("IfcRelConnectsPortToElement");

  /** Name of the entity type of the record, e.g. "IfcRelAggregates". */
  public final String ifcName;

  private static final ImmutableMap<String, RelationCategory> BY_NAME;

  static {
    final ImmutableMap.Builder<String, RelationCategory> b =
        ImmutableMap.builder();
    for (RelationCategory category : values()) {
      b.put(category.name(), category);
      b.put(category.ifcName.toUpperCase(Locale.ROOT), category);
    }
    BY_NAME = b.build();
  }

  RelationCategory(String ifcName) {
    this.ifcName = ifcName;
  }

  /** Looks up a category by its name (e.g. "AGGREGATES") or its entity
   * type name (e.g. "IfcRelAggregates"), ignoring case; returns null if not
   * found. */
  public static @Nullable RelationCategory lookup(String name) {
    return BY_NAME.get(name.toUpperCase(Locale.ROOT));
  }
}

// End RelationCategory.java
