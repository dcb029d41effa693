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
package net.hydromatic.bimdl.parse;

import net.hydromatic.bimdl.ast.Pos;

/**
 * Parser for recipes.
 *
 * <p>Implemented by {@code RecipeParserImpl}, which JavaCC generates from
 * {@code RecipeParser.jj}.
 */
public interface RecipeParser {
  /** Returns the position of the last token returned by the parser. */
  Pos pos();

  /**
   * Sets the name of the file being parsed, which is included in positions.
   */
  void zero(String file);

  /** Parses a recipe followed by end-of-file. */
  ParseTree.Node documentEof() throws ParseException;
}

// End RecipeParser.java
