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
package net.hydromatic.bimdl.ast;

import java.util.Locale;

/** Kind of a block in a recipe. */
public enum BlockKind {
  SOURCE(false),
  /** A view has a name, e.g. "walls" in "{@code view walls { ... }}". */
  VIEW(true),
  DERIVE(false),
  SYNTHESIZE(false),
  SPLIT(false),
  /** An export has a name, its kind, e.g. "tabular" or "graph". */
  EXPORT(true);

  /** Whether the block keyword is followed by a name. */
  public final boolean named;

  BlockKind(boolean named) {
    this.named = named;
  }

  /** Returns the keyword that introduces this kind of block, e.g. "view". */
  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End BlockKind.java
