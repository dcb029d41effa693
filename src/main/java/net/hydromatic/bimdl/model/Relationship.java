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
import java.util.List;

/** Relationship record: one relating entity and one or more related
 * entities. */
public class Relationship {
  public final RelationCategory category;
  public final Entity relating;
  public final List<Entity> related;

  public Relationship(RelationCategory category, Entity relating,
      List<Entity> related) {
    this.category = requireNonNull(category);
    this.relating = requireNonNull(relating);
    this.related = ImmutableList.copyOf(related);
  }

  @Override
  public String toString() {
    return category.ifcName + "(" + relating + ", " + related + ")";
  }
}

// End Relationship.java
