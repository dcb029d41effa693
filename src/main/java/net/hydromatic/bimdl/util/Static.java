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
package net.hydromatic.bimdl.util;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }
}

// End Static.java
