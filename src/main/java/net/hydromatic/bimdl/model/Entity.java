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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entity in a building model.
 *
 * <p>An entity is a handle; its attributes, property sets and geometry are
 * obtained from the {@link Model} that owns it. Entities compare by
 * identity, because a model may contain entities without a guid.
 */
public class Entity {
  /** Globally unique identifier, or null if the entity has none. */
  public final @Nullable String guid;
  /** Type, e.g. "IfcWall". */
  public final String type;

  public Entity(@Nullable String guid, String type) {
    this.guid = guid;
    this.type = requireNonNull(type);
  }

  /** Returns whether this entity has a non-empty guid. */
  public boolean hasGuid() {
    return guid != null && !guid.isEmpty();
  }

  @Override
  public String toString() {
    return type + "(" + guid + ")";
  }
}

// End Entity.java
