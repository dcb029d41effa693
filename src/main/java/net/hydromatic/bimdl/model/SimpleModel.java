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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Model held in memory. Use {@link #builder} to create one. */
public class SimpleModel implements Model {
  private final String schema;
  private final @Nullable String source;
  private final ImmutableList<Entity> entities;
  private final Map<Entity, Data> data;
  private final ImmutableMap<String, Entity> byGuid;
  private final ImmutableListMultimap<RelationCategory, Relationship>
      relationships;

  private SimpleModel(String schema, @Nullable String source,
      ImmutableList<Entity> entities, Map<Entity, Data> data,
      ImmutableListMultimap<RelationCategory, Relationship> relationships) {
    this.schema = requireNonNull(schema);
    this.source = source;
    this.entities = requireNonNull(entities);
    this.data = requireNonNull(data);
    this.relationships = requireNonNull(relationships);
    final Map<String, Entity> byGuid = new HashMap<>();
    for (Entity entity : entities) {
      if (entity.hasGuid()) {
        byGuid.putIfAbsent(entity.guid, entity);
      }
    }
    this.byGuid = ImmutableMap.copyOf(byGuid);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String schema() {
    return schema;
  }

  @Override
  public List<Entity> entities() {
    return entities;
  }

  @Override
  public @Nullable Entity entity(String guid) {
    return byGuid.get(guid);
  }

  private Data data(Entity entity) {
    final Data d = data.get(entity);
    return d == null ? Data.EMPTY : d;
  }

  @Override
  public @Nullable Object attribute(Entity entity, String name) {
    switch (name) {
      case "GlobalId":
        return entity.guid;
      default:
        return data(entity).attributes.get(name);
    }
  }

  @Override
  public @Nullable Object propertyValue(Entity entity, String pset,
      String property) {
    final Map<String, Object> properties = data(entity).psets.get(pset);
    return properties == null ? null : properties.get(property);
  }

  @Override
  public boolean hasPropertySet(Entity entity, String pset) {
    return data(entity).psets.containsKey(pset);
  }

  @Override
  public @Nullable Object quantityValue(Entity entity, String qto,
      String quantity) {
    final Map<String, Object> quantities = data(entity).quantities.get(qto);
    return quantities == null ? null : quantities.get(quantity);
  }

  @Override
  public boolean hasQuantitySet(Entity entity, String qto) {
    return data(entity).quantities.containsKey(qto);
  }

  @Override
  public @Nullable BoundingBox boundingBox(Entity entity) {
    return data(entity).bbox;
  }

  @Override
  public boolean hasGeometry(Entity entity) {
    final Data d = data(entity);
    return d.representation || d.bbox != null;
  }

  @Override
  public List<Relationship> relationships(RelationCategory category) {
    return relationships.get(category);
  }

  @Override
  public Map<String, Object> stats() {
    final Set<String> types = new LinkedHashSet<>();
    entities.forEach(e -> types.add(e.type));
    final Map<String, Object> map = new LinkedHashMap<>();
    if (source != null) {
      map.put("path", source);
    }
    map.put("schema", schema);
    map.put("total_entities", entities.size());
    map.put("types", types.size());
    return map;
  }

  /** Attributes, property sets, quantities and geometry of an entity. */
  private static class Data {
    static final Data EMPTY =
        new Data(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of(),
            null, false);

    final Map<String, Object> attributes;
    final Map<String, Map<String, Object>> psets;
    final Map<String, Map<String, Object>> quantities;
    final @Nullable BoundingBox bbox;
    final boolean representation;

    Data(Map<String, Object> attributes,
        Map<String, Map<String, Object>> psets,
        Map<String, Map<String, Object>> quantities,
        @Nullable BoundingBox bbox, boolean representation) {
      this.attributes = attributes;
      this.psets = psets;
      this.quantities = quantities;
      this.bbox = bbox;
      this.representation = representation;
    }
  }

  /** Builder for {@link SimpleModel}. */
  public static class Builder {
    private String schema = "IFC4";
    private @Nullable String source;
    private final List<Entity> entities = new ArrayList<>();
    private final Map<Entity, Data> data = new IdentityHashMap<>();
    private final ImmutableListMultimap.Builder<RelationCategory, Relationship>
        relationships = ImmutableListMultimap.builder();
    private @Nullable EntityBuilder current;

    private Builder() {}

    public Builder schema(String schema) {
      this.schema = requireNonNull(schema);
      return this;
    }

    /** Sets the name of the file the model was loaded from. */
    public Builder source(@Nullable String source) {
      this.source = source;
      return this;
    }

    /** Starts an entity. Subsequent calls to {@link #attribute},
     * {@link #property} etc. apply to it. */
    public Builder entity(@Nullable String guid, String type) {
      flush();
      current = new EntityBuilder(new Entity(guid, type));
      return this;
    }

    /** Returns the most recently added entity. */
    public Entity last() {
      flush();
      return requireNonNull(current, "no entity").entity;
    }

    public Builder attribute(String name, @Nullable Object value) {
      entityBuilder().attributes.put(name, value);
      return this;
    }

    public Builder property(String pset, String name, @Nullable Object value) {
      entityBuilder().psets.computeIfAbsent(pset, k -> new LinkedHashMap<>())
          .put(name, value);
      return this;
    }

    public Builder quantity(String qto, String name, @Nullable Object value) {
      entityBuilder().quantities
          .computeIfAbsent(qto, k -> new LinkedHashMap<>())
          .put(name, value);
      return this;
    }

    public Builder bbox(@Nullable BoundingBox bbox) {
      entityBuilder().bbox = bbox;
      return this;
    }

    public Builder representation(boolean representation) {
      entityBuilder().representation = representation;
      return this;
    }

    /** Adds a relationship between entities identified by guid. Entities
     * must have been added already. */
    public Builder relationship(RelationCategory category, String relating,
        String... related) {
      flush();
      final List<Entity> relatedEntities = new ArrayList<>();
      for (String guid : related) {
        relatedEntities.add(find(guid));
      }
      return relationship(
          new Relationship(category, find(relating), relatedEntities));
    }

    public Builder relationship(Relationship relationship) {
      flush();
      relationships.put(relationship.category, relationship);
      return this;
    }

    private Entity find(String guid) {
      for (Entity entity : entities) {
        if (guid.equals(entity.guid)) {
          return entity;
        }
      }
      throw new IllegalArgumentException("unknown entity " + guid);
    }

    private EntityBuilder entityBuilder() {
      return requireNonNull(current, "call entity() first");
    }

    private void flush() {
      if (current != null && !data.containsKey(current.entity)) {
        entities.add(current.entity);
      }
      if (current != null) {
        data.put(current.entity, current.build());
      }
    }

    public SimpleModel build() {
      flush();
      return new SimpleModel(schema, source, ImmutableList.copyOf(entities),
          new IdentityHashMap<>(data), relationships.build());
    }
  }

  /** Accumulates the data of one entity. */
  private static class EntityBuilder {
    final Entity entity;
    final Map<String, Object> attributes = new LinkedHashMap<>();
    final Map<String, Map<String, Object>> psets = new LinkedHashMap<>();
    final Map<String, Map<String, Object>> quantities = new LinkedHashMap<>();
    @Nullable BoundingBox bbox;
    boolean representation;

    EntityBuilder(Entity entity) {
      this.entity = entity;
    }

    Data build() {
      return new Data(attributes, psets, quantities, bbox, representation);
    }
  }
}

// End SimpleModel.java
