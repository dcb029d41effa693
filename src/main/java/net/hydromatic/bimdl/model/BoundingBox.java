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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Axis-aligned bounding box in world coordinates. */
public class BoundingBox {
  public final double minX;
  public final double minY;
  public final double minZ;
  public final double maxX;
  public final double maxY;
  public final double maxZ;

  public BoundingBox(double minX, double minY, double minZ,
      double maxX, double maxY, double maxZ) {
    this.minX = minX;
    this.minY = minY;
    this.minZ = minZ;
    this.maxX = maxX;
    this.maxY = maxY;
    this.maxZ = maxZ;
  }

  /** Creates a bounding box from a list
   * {@code [minX, minY, minZ, maxX, maxY, maxZ]}. */
  public static BoundingBox of(List<? extends Number> values) {
    checkArgument(values.size() == 6,
        "bounding box needs 6 values, got %s", values.size());
    return new BoundingBox(values.get(0).doubleValue(),
        values.get(1).doubleValue(), values.get(2).doubleValue(),
        values.get(3).doubleValue(), values.get(4).doubleValue(),
        values.get(5).doubleValue());
  }

  /** Returns {@code [minX, minY, minZ, maxX, maxY, maxZ]}. */
  public List<Double> toList() {
    return ImmutableList.of(minX, minY, minZ, maxX, maxY, maxZ);
  }

  /** Returns the center, {@code [x, y, z]}. */
  public List<Double> centroid() {
    return ImmutableList.of((minX + maxX) / 2d, (minY + maxY) / 2d,
        (minZ + maxZ) / 2d);
  }

  /** Returns the extent along each axis, {@code [dx, dy, dz]}. */
  public List<Double> dims() {
    return ImmutableList.of(maxX - minX, maxY - minY, maxZ - minZ);
  }

  @Override
  public int hashCode() {
    return toList().hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BoundingBox
            && Objects.equals(toList(), ((BoundingBox) o).toList());
  }

  @Override
  public String toString() {
    return toList().toString();
  }
}

// End BoundingBox.java
