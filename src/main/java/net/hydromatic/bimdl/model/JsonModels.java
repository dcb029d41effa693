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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a model from a JSON snapshot.
 *
 * <p>The snapshot has the form
 *
 * <pre>{@code
 * {
 *   "schema": "IFC4",
 *   "entities": [
 *     {"guid": "w1", "type": "IfcWall",
 *      "attributes": {"Name": "Wall 1"},
 *      "psets": {"Pset_WallCommon": {"IsExternal": true}},
 *      "quantities": {"Qto_WallBaseQuantities": {"Length": 5.0}},
 *      "bbox": [0, 0, 0, 5, 0.2, 3],
 *      "representation": true}
 *   ],
 *   "relationships": [
 *     {"category": "IfcRelContainedInSpatialStructure",
 *      "relating": "s1", "related": ["w1"]}
 *   ]
 * }
 * }</pre>
 *
 * <p>Relationships refer to entities by guid. A relationship that refers to
 * an unknown guid is skipped.
 */
public class JsonModels {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(JsonModels.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonModels() {}

  /** Loads a model from a file.
   *
   * @throws UncheckedIOException if the file is missing or is not valid
   *     JSON */
  public static SimpleModel load(File file) {
    final JsonNode root;
    try {
      root = MAPPER.readTree(file);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read model " + file, e);
    }
    LOGGER.debug("loaded model snapshot {}", file);
    return convert(root, file.getPath());
  }

  /** Loads a model from a JSON string. */
  public static SimpleModel parse(String json) {
    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot parse model", e);
    }
    return convert(root, null);
  }

  private static SimpleModel convert(JsonNode root, @Nullable String source) {
    final SimpleModel.Builder b = SimpleModel.builder().source(source);
    if (root.hasNonNull("schema")) {
      b.schema(root.get("schema").asText());
    }
    final Map<String, Entity> byGuid = new LinkedHashMap<>();
    for (JsonNode e : root.path("entities")) {
      final String guid = e.hasNonNull("guid") ? e.get("guid").asText() : null;
      b.entity(guid, e.path("type").asText("IfcRoot"));
      for (Map.Entry<String, JsonNode> a : fields(e.path("attributes"))) {
        b.attribute(a.getKey(), toJava(a.getValue()));
      }
      for (Map.Entry<String, JsonNode> pset : fields(e.path("psets"))) {
        for (Map.Entry<String, JsonNode> p : fields(pset.getValue())) {
          b.property(pset.getKey(), p.getKey(), toJava(p.getValue()));
        }
      }
      for (Map.Entry<String, JsonNode> qto : fields(e.path("quantities"))) {
        for (Map.Entry<String, JsonNode> q : fields(qto.getValue())) {
          b.quantity(qto.getKey(), q.getKey(), toJava(q.getValue()));
        }
      }
      final JsonNode bbox = e.path("bbox");
      if (bbox.isArray() && bbox.size() == 6) {
        final List<Double> values = new ArrayList<>();
        bbox.forEach(v -> values.add(v.asDouble()));
        b.bbox(BoundingBox.of(values));
      }
      b.representation(e.path("representation").asBoolean(false));
      if (guid != null && !guid.isEmpty()) {
        byGuid.putIfAbsent(guid, b.last());
      }
    }
    for (JsonNode r : root.path("relationships")) {
      final String categoryName = r.path("category").asText();
      final RelationCategory category = RelationCategory.lookup(categoryName);
      if (category == null) {
        LOGGER.warn("skipping relationship with unknown category '{}'",
            categoryName);
        continue;
      }
      final Entity relating = byGuid.get(r.path("relating").asText());
      if (relating == null) {
        LOGGER.warn("skipping {} relationship with unknown relating entity"
            + " '{}'", category.ifcName, r.path("relating").asText());
        continue;
      }
      final List<Entity> related = new ArrayList<>();
      for (JsonNode g : r.path("related")) {
        final Entity entity = byGuid.get(g.asText());
        if (entity == null) {
          LOGGER.warn("skipping unknown related entity '{}' in {}",
              g.asText(), category.ifcName);
        } else {
          related.add(entity);
        }
      }
      b.relationship(new Relationship(category, relating, related));
    }
    return b.build();
  }

  private static Iterable<Map.Entry<String, JsonNode>> fields(JsonNode node) {
    return node::fields;
  }

  /** Converts a JSON value to a Java value: null, Boolean, Long, Double,
   * String, List or Map. */
  static @Nullable Object toJava(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    } else if (node.isBoolean()) {
      return node.booleanValue();
    } else if (node.isIntegralNumber() && node.canConvertToLong()) {
      return node.longValue();
    } else if (node.isNumber()) {
      return node.doubleValue();
    } else if (node.isTextual()) {
      return node.textValue();
    } else if (node.isArray()) {
      final List<Object> list = new ArrayList<>();
      node.forEach(v -> list.add(toJava(v)));
      return list;
    } else if (node.isObject()) {
      final Map<String, Object> map = new LinkedHashMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        map.put(field.getKey(), toJava(field.getValue()));
      }
      return map;
    } else {
      return node.asText();
    }
  }
}

// End JsonModels.java
