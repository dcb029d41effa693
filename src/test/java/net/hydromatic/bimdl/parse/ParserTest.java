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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.bimdl.Fixtures;
import org.junit.jupiter.api.Test;

/** Tests the recipe parser. */
class ParserTest {
  /** Parses a recipe whose derive block has a single feature "x", and
   * returns the parse tree of the feature's expression. */
  private static String parseExp(String exp) {
    final ParseTree.Node document =
        Parsers.parse(Fixtures.recipe("x = " + exp + ";"));
    final ParseTree.Node derive = document.child(1);
    assertThat(derive.tag, is(ParseTree.Tag.DERIVE_BLOCK));
    return derive.child(0).child(0).toString();
  }

  @Test void testParseDocument() {
    final String text = "# a comment\n"
        + "source { path \"model.ifc\"; }\n"
        + "view walls { select IfcWall; where geom.exists(); }\n"
        + "view doors { select IfcDoor; }\n"
        + "derive {\n"
        + "  feature h = qto.get(\"Qto\", \"Height\"); # trailing comment\n"
        + "  n = ifc.name();\n"
        + "  node_features { a = 1; feature b = 2; }\n"
        + "}\n"
        + "synthesize { noisy = synth.noise_numeric(h, 0.1); }\n"
        + "split { by storey(); }\n"
        + "export dataset { format jsonl; path \"out/d.jsonl\"; }\n"
        + "export graph { format \"edge_list\"; path \"out/e.tsv\"; }\n";
    final ParseTree.Node document = Parsers.parse(text);
    assertThat(document.tag, is(ParseTree.Tag.DOCUMENT));
    assertThat(document.children, hasSize(8));
    assertThat(document.child(1).toString(),
        is("VIEW_BLOCK(walls SELECT_STMT(IfcWall) "
            + "WHERE_STMT(CALL(geom.exists)))"));
    assertThat(document.child(3).child(2).toString(),
        is("NODE_FEATURES_STMT(FEATURE_STMT(a NUMBER(1)) "
            + "FEATURE_STMT(b NUMBER(2)))"));
    assertThat(document.child(5).toString(),
        is("SPLIT_BLOCK(BY_STMT(storey))"));
    assertThat(document.child(7).child(0).toString(),
        is("FORMAT_STMT(edge_list)"));
  }

  @Test void testPrecedence() {
    assertThat(parseExp("1 + 2 * 3"),
        is("BINOP(+ NUMBER(1) BINOP(* NUMBER(2) NUMBER(3)))"));
    assertThat(parseExp("(1 + 2) * 3"),
        is("BINOP(* BINOP(+ NUMBER(1) NUMBER(2)) NUMBER(3))"));
    assertThat(parseExp("1 - 2 - 3"),
        is("BINOP(- BINOP(- NUMBER(1) NUMBER(2)) NUMBER(3))"));
    assertThat(parseExp("not a and b or c"),
        is("BINOP(or BINOP(and UNOP(not ACCESS(FIELD(a))) "
            + "ACCESS(FIELD(b))) ACCESS(FIELD(c)))"));
    assertThat(parseExp("-x < 2 == true"),
        is("BINOP(== BINOP(< UNOP(- ACCESS(FIELD(x))) NUMBER(2)) TRUE)"));
  }

  @Test void testAtoms() {
    assertThat(parseExp("\"a\\tb\""), is("STRING(a\tb)"));
    assertThat(parseExp("null"), is("NULL"));
    assertThat(parseExp("1.5e3"), is("NUMBER(1.5e3)"));
    assertThat(parseExp("pset.get(\"P\", \"Q\")"),
        is("CALL(pset.get STRING(P) STRING(Q))"));
    assertThat(parseExp("seed()"), is("CALL(seed)"));
    assertThat(parseExp("Placement.Location[0]"),
        is("ACCESS(FIELD(Placement) FIELD(Location) INDEX(NUMBER(0)))"));
  }

  @Test void testErrorPosition() {
    final String text = "source { path \"m\"; }\n"
        + "derive {\n"
        + "  x = 1 +;\n"
        + "}\n"
        + "export e { format jsonl; path \"p\"; }\n";
    final RecipeParseException e =
        assertThrows(RecipeParseException.class, () -> Parsers.parse(text));
    assertThat(e.line(), is(3));
    assertThat(e.column(), is(10));
    assertThat(e.context(), is("  x = 1 +;\n         ^"));
    assertThat(e.getMessage(), containsString("\";\""));
  }

  @Test void testUnknownCharacter() {
    final RecipeParseException e =
        assertThrows(RecipeParseException.class,
            () -> Parsers.parse(Fixtures.recipe("x = 1 @ 2;")));
    assertThat(e.line(), is(3));
    assertThat(e.column(), is(7));
    assertThat(e.context(), is("x = 1 @ 2;\n      ^"));
  }

  /** Tests that a malformed unicode escape in a string literal is a parse
   * error at the opening quote, not a failure while unquoting. */
  @Test void testBadUnicodeEscape() {
    final RecipeParseException e =
        assertThrows(RecipeParseException.class,
            () -> Parsers.parse(Fixtures.recipe("x = \"\\uZZZZ\";")));
    assertThat(e.line(), is(3));
    assertThat(e.column(), is(5));
    assertThat(e.context(), is("x = \"\\uZZZZ\";\n    ^"));

    final RecipeParseException e2 =
        assertThrows(RecipeParseException.class,
            () -> Parsers.parse(Fixtures.recipe("x = \"a\\u12\";")));
    assertThat(e2.line(), is(3));
    assertThat(e2.column(), is(5));

    // A well-formed escape is fine
    final ParseTree.Node node =
        Parsers.parse(Fixtures.recipe("x = \"\\u0041\\u00e9\";"));
    assertThat(node.toString(), containsString("STRING(A\u00e9)"));
  }

  /** Tests that a tab counts as one column. */
  @Test void testTabColumn() {
    final RecipeParseException e =
        assertThrows(RecipeParseException.class,
            () -> Parsers.parse(Fixtures.recipe("\tx = 1 +;")));
    assertThat(e.line(), is(3));
    assertThat(e.column(), is(9));
  }

  @Test void testMissingBlock() {
    // A recipe with no export block does not match the grammar.
    final String text = "source { path \"m\"; }\nderive { x = 1; }\n";
    final RecipeParseException e =
        assertThrows(RecipeParseException.class, () -> Parsers.parse(text));
    final StringBuilder buf = new StringBuilder();
    e.describeTo(buf);
    assertThat(buf.toString(), containsString("Error: "));
  }

  @Test void testBlocksOutOfOrder() {
    final String text = "derive { x = 1; }\nsource { path \"m\"; }\n"
        + "export e { format jsonl; path \"p\"; }\n";
    final RecipeParseException e =
        assertThrows(RecipeParseException.class, () -> Parsers.parse(text));
    assertThat(e.line(), is(1));
    assertThat(e.column(), is(1));
  }

  @Test void testUnquoteString() {
    assertThat(Parsers.unquoteString("\"abc\""), is("abc"));
    assertThat(Parsers.unquoteString("\"a\\\"b\\\\c\\n\""),
        is("a\"b\\c\n"));
    assertThat(Parsers.unquoteString("\"\\u0041\""), is("A"));
    assertThat(Parsers.stringToString("a\"b\n"), is("a\\\"b\\n"));
  }

  @Test void testContext() {
    assertThat(Parsers.context("ab\ncd\n", 2, 2), is("cd\n ^"));
    assertThat(Parsers.context("ab", 5, 1), is("\n^"));
  }
}

// End ParserTest.java
