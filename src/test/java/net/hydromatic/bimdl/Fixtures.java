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
package net.hydromatic.bimdl;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import net.hydromatic.bimdl.model.BoundingBox;
import net.hydromatic.bimdl.model.RelationCategory;
import net.hydromatic.bimdl.model.SimpleModel;

/** Models and recipes shared by tests. */
public abstract class Fixtures {
  private Fixtures() {}

  /** Returns a small building: a storey containing two walls and a door,
   * a wall type, and a connection between the walls.
   *
   * <p>Same content as the "model.json" resource. */
  public static SimpleModel sampleModel() {
    return SimpleModel.builder()
        .schema("IFC4")
        .entity("b1", "IfcBuilding")
        .attribute("Name", "Building")
        .entity("st1", "IfcBuildingStorey")
        .attribute("Name", "Level 1")
        .attribute("Elevation", 0d)
        .entity("w1", "IfcWall")
        .attribute("Name", "Wall A")
        .attribute("PredefinedType", "SOLIDWALL")
        .property("Pset_WallCommon", "IsExternal", true)
        .property("Pset_WallCommon", "LoadBearing", false)
        .quantity("Qto_WallBaseQuantities", "Length", 5d)
        .quantity("Qto_WallBaseQuantities", "Height", 3L)
        .bbox(BoundingBox.of(ImmutableList.of(0, 0, 0, 5, 0.2, 3)))
        .representation(true)
        .entity("w2", "IfcWall")
        .attribute("Name", "Wall B")
        .property("Pset_WallCommon", "IsExternal", false)
        .entity("d1", "IfcDoor")
        .attribute("Name", "Door")
        .representation(true)
        .entity("wt1", "IfcWallType")
        .attribute("Name", "Basic Wall")
        .entity(null, "IfcOwnerHistory")
        .relationship(RelationCategory.CONTAINED_IN_SPATIAL_STRUCTURE, "st1",
            "w1", "w2", "d1")
        .relationship(RelationCategory.AGGREGATES, "b1", "st1")
        .relationship(RelationCategory.DEFINES_BY_TYPE, "wt1", "w1", "w2")
        .relationship(RelationCategory.CONNECTS_ELEMENTS, "w1", "w2")
        .build();
  }

  /** Returns a model of three entities and no relationships. */
  public static SimpleModel threeWalls() {
    return SimpleModel.builder()
        .entity("a", "IfcWall")
        .entity("b", "IfcWall")
        .entity("c", "IfcWall")
        .build();
  }

  /** Returns a minimal recipe whose derive block has the given
   * statements. */
  public static String recipe(String derive) {
    return "source { path \"m.json\"; }\n"
        + "derive {\n" + derive + "\n}\n"
        + "export out { format jsonl; path \"out.jsonl\"; }\n";
  }

  /** Returns a file on the test class path. */
  public static File resource(String name) {
    final URL url =
        requireNonNull(Fixtures.class.getResource("/" + name), name);
    try {
      return new File(url.toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }
}

// End Fixtures.java
