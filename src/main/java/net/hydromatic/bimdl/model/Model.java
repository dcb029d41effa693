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

import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only view of a building model.
 *
 * <p>This is the only way that the graph engine and the evaluator access a
 * model, so that they do not depend on how the model was loaded.
 */
public interface Model {
  /** Returns the schema of the model, e.g. "IFC4". */
  String schema();

  /** Returns all entities, in file order. */
  List<Entity> entities();

  /** Returns the entity with a given guid, or null. */
  @Nullable Entity entity(String guid);

  /** Returns the value of a named attribute of an entity, or null if the
   * entity does not have that attribute. */
  @Nullable Object attribute(Entity entity, String name);

  /** Returns the display name of an entity (its "Name" attribute). */
  default @Nullable String name(Entity entity) {
    final Object name = attribute(entity, "Name");
    return name == null ? null : name.toString();
  }

  /** Returns the predefined type of an entity (its "PredefinedType"
   * attribute). */
  default @Nullable String predefinedType(Entity entity) {
    final Object type = attribute(entity, "PredefinedType");
    return type == null ? null : type.toString();
  }

  /** Returns the value of a property in a property set, or null. */
  @Nullable Object propertyValue(Entity entity, String pset, String property);

  /** Returns whether an entity has a property set with a given name. */
  boolean hasPropertySet(Entity entity, String pset);

  /** Returns the value of a quantity in a quantity set, or null. */
  @Nullable Object quantityValue(Entity entity, String qto, String quantity);

  /** Returns whether an entity has a quantity set with a given name. */
  boolean hasQuantitySet(Entity entity, String qto);

  /** Returns the bounding box of an entity, or null if it has no geometry
   * or its geometry cannot be processed. */
  @Nullable BoundingBox boundingBox(Entity entity);

  /** Returns whether an entity has a geometric representation. */
  boolean hasGeometry(Entity entity);

  /** Returns the relationship records of a given category. */
  List<Relationship> relationships(RelationCategory category);

  /** Returns summary statistics: "schema", "total_entities", "types", and
   * possibly others. */
  Map<String, Object> stats();
}

// End Model.java
