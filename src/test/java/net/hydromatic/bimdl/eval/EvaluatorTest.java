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
package net.hydromatic.bimdl.eval;

import static net.hydromatic.bimdl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.bimdl.Fixtures;
import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.ast.Recipe;
import net.hydromatic.bimdl.graph.SemanticGraph;
import net.hydromatic.bimdl.model.Model;
import net.hydromatic.bimdl.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator} and the built-in functions in
 * {@link Codes}. */
class EvaluatorTest {
  private static List<Map<String, @Nullable Object>> rows(Model model,
      String text) {
    final Recipe recipe = ast.toRecipe(Parsers.parse(text));
    return new Evaluator(model, new SemanticGraph(model), 42)
        .evaluate(recipe);
  }

  /** Evaluates a recipe with one feature "x" over the sample model, and
   * returns the value of x for the node with a given guid. */
  private static @Nullable Object eval(String exp, String guid) {
    for (Map<String, @Nullable Object> row
        : rows(Fixtures.sampleModel(), Fixtures.recipe("x = " + exp + ";"))) {
      if (row.get(Evaluator.GUID).equals(guid)) {
        return row.get("x");
      }
    }
    throw new AssertionError("no row for " + guid);
  }

  private static @Nullable Object eval(String exp) {
    return eval(exp, "w1");
  }

  private static List<Object> guids(List<Map<String, @Nullable Object>> rows) {
    final List<Object> list = new ArrayList<>();
    rows.forEach(row -> list.add(row.get(Evaluator.GUID)));
    return list;
  }

  @Test void testThreeEntities() {
    final List<Map<String, @Nullable Object>> rows =
        rows(Fixtures.threeWalls(), Fixtures.recipe("x = 1 + 2;"));
    assertThat(rows,
        is(
            ImmutableList.of(ImmutableMap.of("guid", "a", "x", 3L),
                ImmutableMap.of("guid", "b", "x", 3L),
                ImmutableMap.of("guid", "c", "x", 3L))));
    assertThat(ImmutableList.copyOf(rows.get(0).keySet()),
        is(ImmutableList.of("guid", "x")));
  }

  @Test void testLaterFeatureOverwrites() {
    final List<Map<String, @Nullable Object>> rows =
        rows(Fixtures.threeWalls(),
            Fixtures.recipe("x = 1; y = 2; feature x = \"three\";"));
    assertThat(rows.get(0),
        is(ImmutableMap.of("guid", "a", "x", "three", "y", 2L)));
  }

  @Test void testNoViewsSelectsAll() {
    final List<Map<String, @Nullable Object>> rows =
        rows(Fixtures.sampleModel(), Fixtures.recipe("t = ifc.type();"));
    assertThat(guids(rows),
        is(ImmutableList.of("b1", "st1", "w1", "w2", "d1", "wt1")));
  }

  @Test void testSelectReplaces() {
    final String text = "source { path \"m\"; }\n"
        + "view v { select IfcWall; select IfcDoor; }\n"
        + "derive { t = ifc.type(); }\n"
        + "export e { format jsonl; path \"p\"; }\n";
    assertThat(guids(rows(Fixtures.sampleModel(), text)),
        is(ImmutableList.of("d1")));
  }

  @Test void testWhereFilters() {
    final String text = "source { path \"m\"; }\n"
        + "view v {\n"
        + "  select IfcWall;\n"
        + "  where pset.get(\"Pset_WallCommon\", \"IsExternal\");\n"
        + "}\n"
        + "derive { t = ifc.type(); }\n"
        + "export e { format jsonl; path \"p\"; }\n";
    assertThat(guids(rows(Fixtures.sampleModel(), text)),
        is(ImmutableList.of("w1")));
  }

  /** Tests that the results of views are concatenated in view order, and
   * that a node selected by more than one view occurs once. */
  @Test void testViewsDeduplicate() {
    final String text = "source { path \"m\"; }\n"
        + "view doors { select IfcDoor; }\n"
        + "view everything { where true; }\n"
        + "view walls { select IfcWall; }\n"
        + "derive { t = ifc.type(); }\n"
        + "export e { format jsonl; path \"p\"; }\n";
    assertThat(guids(rows(Fixtures.sampleModel(), text)),
        is(ImmutableList.of("d1", "b1", "st1", "w1", "w2", "wt1")));
  }

  @Test void testArithmetic() {
    assertThat(eval("7 - 2 * 3"), is(1L));
    assertThat(eval("7 / 2"), is(3.5d));
    assertThat(eval("6 / 3"), is(2d));
    assertThat(eval("1.5 + 1"), is(2.5d));
    assertThat(eval("7 % 3"), is(1L));
    assertThat(eval("-7 % 3"), is(2L));
    assertThat(eval("-(2 - 5)"), is(3L));
    assertThat(eval("\"a\" + \"b\""), is("ab"));
    assertThat(eval("1 + null"), nullValue());
    assertThat(eval("-null"), nullValue());
  }

  @Test void testDivisionByZero() {
    assertThat(eval("1 / 0"), nullValue());
    assertThat(eval("1.5 / 0.0"), nullValue());
    assertThat(eval("5 % 0"), nullValue());
  }

  /** Tests that integer arithmetic that does not fit in a long produces a
   * double rather than wrapping around. */
  @Test void testIntegerOverflow() {
    assertThat(eval("9223372036854775806 + 1"), is(Long.MAX_VALUE));
    assertThat(eval("9223372036854775807 + 1"), is(Math.pow(2, 63)));
    assertThat(eval("9223372036854775807 * 2"), is(Math.pow(2, 64)));
    assertThat(eval("-9223372036854775807 - 2"), is(-Math.pow(2, 63)));
    assertThat(eval("4294967296 * 4294967296"), is(Math.pow(2, 64)));
    assertThat(eval("-9223372036854775807 - 1"), is(Long.MIN_VALUE));
    assertThat(eval("-(-9223372036854775807 - 1)"), is(Math.pow(2, 63)));
  }

  @Test void testTypeMismatch() {
    final EvalException e =
        assertThrows(EvalException.class, () -> eval("\"a\" + 1"));
    assertThat(e.getMessage(), is("cannot apply + to String and Long"));
  }

  @Test void testComparison() {
    assertThat(eval("1 < 2"), is(true));
    assertThat(eval("2 <= 1.5"), is(false));
    assertThat(eval("1 == 1.0"), is(true));
    assertThat(eval("\"a\" != \"b\""), is(true));
    assertThat(eval("\"b\" > \"a\""), is(true));
    assertThat(eval("null == null"), is(true));
    assertThat(eval("null < 1"), nullValue());
    assertThat(eval("not 0"), is(true));
    assertThat(eval("not \"x\""), is(false));
    assertThat(eval("1 and \"\""), is(false));
    assertThat(eval("0 or 2"), is(true));
  }

  /** Tests that both operands of "and" are evaluated, even if the left
   * operand is false. */
  @Test void testAndEvaluatesBothOperands() {
    final EvalException e =
        assertThrows(EvalException.class,
            () -> eval("false and ml.onehot(1)"));
    assertThat(e.getMessage(), is("function 'ml.onehot' is not implemented"));
  }

  @Test void testNotImplemented() {
    final EvalException e =
        assertThrows(EvalException.class, () -> eval("geom.mesh()"));
    assertThat(e.getMessage(), is("function 'geom.mesh' is not implemented"));
    assertThat(e.pos().startLine, is(3));
  }

  @Test void testUnknownFunction() {
    final EvalException e =
        assertThrows(EvalException.class, () -> eval("nosuch()"));
    assertThat(e.getMessage(), is("unknown function 'nosuch'"));
  }

  @Test void testWrongArgumentCount() {
    assertThat(eval("pset.get(\"Pset_WallCommon\")"), nullValue());
    assertThat(eval("guid(1)"), nullValue());
  }

  @Test void testAccess() {
    assertThat(eval("Name"), is("Wall A"));
    assertThat(eval("GlobalId"), is("w1"));
    assertThat(eval("Missing"), nullValue());
    assertThat(eval("Name[0]"), nullValue());
    // The index expression is not evaluated
    assertThat(eval("Name[geom.mesh()]"), nullValue());
  }

  @Test void testCoreFunctions() {
    assertThat(eval("guid()"), is("w1"));
    assertThat(eval("id()"), is("w1"));
    assertThat(eval("exists(Name)"), is(true));
    assertThat(eval("exists(Color)"), is(false));
    assertThat(eval("coalesce(Color, null, \"red\", \"blue\")"), is("red"));
    assertThat(eval("seed()"), is(42L));
    assertThat(eval("hash(\"abc\")"), is(eval("hash(\"abc\")", "d1")));
    assertThat(eval("hash(\"abc\") == hash(\"abd\")"), is(false));
    assertThat(eval("hash(null)"), nullValue());
  }

  @Test void testIfcFunctions() {
    assertThat(eval("ifc.type()"), is("IfcWall"));
    assertThat(eval("ifc.schema()"), is("IFC4"));
    assertThat(eval("ifc.name()"), is("Wall A"));
    assertThat(eval("ifc.attr(\"PredefinedType\")"), is("SOLIDWALL"));
    assertThat(eval("ifc.predefined()"), is("SOLIDWALL"));
    assertThat(eval("ifc.predefined()", "w2"), nullValue());
    assertThat(eval("ifc.is_a(\"ifcwall\")"), is(true));
    assertThat(eval("ifc.is_a(\"IfcDoor\")"), is(false));
  }

  @Test void testPropertyAndQuantityFunctions() {
    assertThat(eval("pset.get(\"Pset_WallCommon\", \"IsExternal\")"),
        is(true));
    assertThat(eval("pset.get(\"Pset_WallCommon\", \"IsExternal\")", "w2"),
        is(false));
    assertThat(eval("pset.get(\"Pset_WallCommon\", \"Nope\")"), nullValue());
    assertThat(eval("pset.has(\"Pset_WallCommon\")", "w2"), is(true));
    assertThat(eval("pset.has(\"Pset_WallCommon\")", "d1"), is(false));
    assertThat(eval("pset.has(\"Pset_WallCommon\", \"LoadBearing\")"),
        is(true));
    assertThat(eval("pset.has(\"Pset_WallCommon\", \"LoadBearing\")", "w2"),
        is(false));
    assertThat(eval("qto.get(\"Qto_WallBaseQuantities\", \"Length\") * 2"),
        is(10d));
    assertThat(eval("qto.has(\"Qto_WallBaseQuantities\")"), is(true));
    assertThat(eval("qto.has(\"Qto_WallBaseQuantities\", \"Width\")"),
        is(false));
  }

  @Test void testRelationshipFunctions() {
    assertThat(eval("contained_in()"), is("st1"));
    assertThat(eval("contained_in()", "st1"), nullValue());
    assertThat(eval("container_chain()"), is(ImmutableList.of("st1")));
    assertThat(eval("type_of()"), is("wt1"));
    assertThat(eval("aggregates()", "b1"), is(ImmutableList.of("st1")));
    assertThat(eval("decomposes()", "st1"), is("b1"));
    assertThat(eval("connects_to()", "w2"), is(ImmutableList.of("w1")));
    assertThat(eval("degree()"), is(3L));
    assertThat(eval("degree(\"contained_in\")", "st1"), is(3L));
    assertThat(eval("degree_in()", "st1"), is(4L));
    assertThat(eval("degree_out(\"type_of\")"), is(1L));
    assertThat(eval("neighbors()"), is(ImmutableList.of("st1", "wt1", "w2")));
    assertThat(eval("neighbors(\"aggregates\")", "st1"),
        is(ImmutableList.of("b1")));
    assertThat(eval("rel.kinds()", "st1"),
        is(ImmutableList.of("contained_in", "aggregates")));
  }

  @Test void testUnknownRelationKind() {
    final EvalException e =
        assertThrows(EvalException.class, () -> eval("degree(\"voids\")"));
    assertThat(e.getMessage(), is("unknown relation kind 'voids'"));
    // The position is that of the call
    assertThat(e.pos().startLine, is(3));
  }

  @Test void testGeometryFunctions() {
    assertThat(eval("geom.exists()"), is(true));
    assertThat(eval("geom.exists()", "w2"), is(false));
    assertThat(eval("geom.exists()", "d1"), is(true));
    assertThat(eval("geom.bbox()"),
        is(ImmutableList.of(0d, 0d, 0d, 5d, 0.2d, 3d)));
    assertThat(eval("geom.bbox()", "d1"), nullValue());
    assertThat(eval("geom.centroid()"), is(ImmutableList.of(2.5d, 0.1d, 1.5d)));
    assertThat(eval("geom.dims()"), is(ImmutableList.of(5d, 0.2d, 3d)));
  }

  @Test void testTextAndMlFunctions() {
    assertThat(eval("text.concat(ifc.type(), \":\", null, Name)"),
        is("IfcWall:Wall A"));
    assertThat(eval("text.lower(Name)"), is("wall a"));
    assertThat(eval("text.normalize(\"  Wall    A \")"), is("wall a"));
    assertThat(eval("text.lower(null)"), nullValue());
    assertThat(eval("ml.bucket(7.5, 2)"), is(3L));
    assertThat(eval("ml.bucket(-1, 2)"), is(-1L));
    assertThat(eval("ml.bucket(7, 0)"), nullValue());
    assertThat(eval("ml.bucket(\"x\", 2)"), nullValue());
  }

  @Test void testSelect() {
    final Recipe recipe =
        ast.toRecipe(
            Parsers.parse("source { path \"m\"; }\n"
                + "view v { select IfcWall; where Name == \"Wall B\"; }\n"
                + "derive { x = 1; }\n"
                + "export e { format jsonl; path \"p\"; }\n"));
    final Model model = Fixtures.sampleModel();
    final Evaluator evaluator =
        new Evaluator(model, new SemanticGraph(model), null);
    assertThat(evaluator.select(recipe), hasSize(1));
    assertThat(evaluator.select(recipe).get(0).guid, is("w2"));
  }

  @Test void testMissingEvaluatesToNull() {
    assertThat(
        new Evaluator(Fixtures.threeWalls(),
            new SemanticGraph(Fixtures.threeWalls()), null)
            .eval(ast.missing(Pos.ZERO, "?"),
                EvalEnv.of(Fixtures.threeWalls(),
                    new SemanticGraph(Fixtures.threeWalls()), null)),
        nullValue());
  }

  @Test void testTruthy() {
    assertThat(Codes.truthy(null), is(false));
    assertThat(Codes.truthy(0.0d), is(false));
    assertThat(Codes.truthy(ImmutableList.of()), is(false));
    assertThat(Codes.truthy(ImmutableList.of(1)), is(true));
  }
}

// End EvaluatorTest.java
