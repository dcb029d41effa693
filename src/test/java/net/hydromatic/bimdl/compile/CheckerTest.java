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
package net.hydromatic.bimdl.compile;

import static net.hydromatic.bimdl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.bimdl.Fixtures;
import net.hydromatic.bimdl.ast.BlockKind;
import net.hydromatic.bimdl.ast.Op;
import net.hydromatic.bimdl.ast.Recipe;
import net.hydromatic.bimdl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Checker} and {@link BuiltIn}. */
class CheckerTest {
  private static List<Diagnostic> diagnose(String text) {
    final Recipe recipe = ast.toRecipe(Parsers.parse(text));
    return Checker.diagnose(recipe);
  }

  private static List<String> codes(String text) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    diagnose(text).forEach(d -> b.add(d.code));
    return b.build();
  }

  @Test void testValid() {
    final String text = "source { path \"m\"; }\n"
        + "view walls { select IfcWall; where geom.exists(); }\n"
        + "derive {\n"
        + "  h = qto.get(\"Q\", \"Height\");\n"
        + "  c = coalesce(ifc.name(), text.lower(ifc.type()));\n"
        + "}\n"
        + "synthesize { j = synth.jitter_bbox(0.1); }\n"
        + "split { by hash_group(guid(), 10); }\n"
        + "export e { format jsonl; path \"p\"; }\n";
    assertThat(diagnose(text), empty());
    Checker.check(ast.toRecipe(Parsers.parse(text)));
  }

  @Test void testMissingSettings() {
    final String text = "source { }\n"
        + "view v { where true; }\n"
        + "derive { emit 1; }\n"
        + "split { }\n"
        + "export e { }\n"
        + "export f { format jsonl; }\n";
    assertThat(codes(text),
        is(
            ImmutableList.of("SRC001", "VIEW001", "SPL001", "EXP001",
                "EXP002", "EXP002")));
    final List<Diagnostic> diagnostics = diagnose(text);
    assertThat(diagnostics.get(0).message,
        is("source block must include: path \"...\";"));
    assertThat(diagnostics.get(1).blockKind, is(BlockKind.VIEW));
    assertThat(diagnostics.get(1).stmtKind, is(Op.SELECT));
    assertThat(diagnostics.get(5).message,
        is("export[1] block must include: path \"...\";"));
  }

  @Test void testEmptyDerive() {
    assertThat(codes(Fixtures.recipe("")), is(ImmutableList.of("DER001")));
  }

  @Test void testSynthesize() {
    final String text = "source { path \"m\"; }\n"
        + "derive { x = 1; }\n"
        + "synthesize {\n"
        + "  a = synth.noise_numeric(x, 0.1);\n"
        + "  b = x + 1;\n"
        + "  feature c = coalesce(synth.drop_pset(\"P\"));\n"
        + "  emit guid();\n"
        + "  label y = 1;\n"
        + "}\n"
        + "export e { format jsonl; path \"p\"; }\n";
    final List<Diagnostic> diagnostics = diagnose(text);
    assertThat(codes(text), is(ImmutableList.of("SYN001", "SYN001")));
    assertThat(diagnostics.get(0).stmtName, is("b"));
    assertThat(diagnostics.get(0).stmtKind, is(Op.ASSIGN));
    assertThat(diagnostics.get(1).stmtName, nullValue());
    assertThat(diagnostics.get(1).stmtKind, is(Op.EMIT));
  }

  /** Tests that a call whose name merely starts with "synth." does not
   * count as a synthesis function unless it is in the catalog. */
  @Test void testSynthesizeUnknownSynth() {
    final String text = "source { path \"m\"; }\n"
        + "derive { x = 1; }\n"
        + "synthesize {\n"
        + "  a = synth.nosuch(x);\n"
        + "  b = synth.upsample(2);\n"
        + "}\n"
        + "export e { format jsonl; path \"p\"; }\n";
    final List<Diagnostic> diagnostics = diagnose(text);
    assertThat(codes(text), is(ImmutableList.of("SYN001", "FN001")));
    assertThat(diagnostics.get(0).stmtName, is("a"));
    assertThat(diagnostics.get(1).message,
        is("Unknown function 'synth.nosuch'."));
    assertThat(diagnostics.get(1).blockKind, is(BlockKind.SYNTHESIZE));
  }

  /** Tests that every occurrence of an unknown function is reported, in
   * nested arguments and index expressions too. */
  @Test void testUnknownFunctions() {
    final String text = "source { path \"m\"; }\n"
        + "view v { select IfcWall; where foo(bar()) > 1; }\n"
        + "derive {\n"
        + "  x = foo(1) + foo(2);\n"
        + "  y = Tags[baz()];\n"
        + "  node_features { z = qux(); }\n"
        + "}\n"
        + "split { by nosuch(quux()); }\n"
        + "export e { format jsonl; path \"p\"; }\n";
    final List<Diagnostic> diagnostics = diagnose(text);
    assertThat(codes(text),
        is(
            ImmutableList.of("FN001", "FN001", "FN001", "FN001", "FN001",
                "FN001", "FN002", "FN001")));
    assertThat(diagnostics.get(0).message, is("Unknown function 'foo'."));
    assertThat(diagnostics.get(1).message, is("Unknown function 'bar'."));
    assertThat(diagnostics.get(2).blockKind, is(BlockKind.DERIVE));
    assertThat(diagnostics.get(2).stmtName, is("x"));
    assertThat(diagnostics.get(4).message, is("Unknown function 'baz'."));
    assertThat(diagnostics.get(5).message, is("Unknown function 'qux'."));
    assertThat(diagnostics.get(6).message,
        is("Unknown split operator 'nosuch'."));
    assertThat(diagnostics.get(7).stmtKind, is(Op.BY));
  }

  @Test void testCheckThrowsBatch() {
    final Recipe recipe =
        ast.toRecipe(Parsers.parse("source { }\n"
            + "derive { x = nope(); }\n"
            + "export e { }\n"));
    final CheckException e =
        assertThrows(CheckException.class, () -> Checker.check(recipe));
    assertThat(e.codes(),
        is(ImmutableList.of("SRC001", "EXP001", "EXP002", "FN001")));
    assertThat(e.getMessage(), is("Check failed with 4 diagnostic(s)"));
  }

  @Test void testCatalog() {
    assertThat(BuiltIn.isKnown("ifc.is_a"), is(true));
    assertThat(BuiltIn.isKnown("is_a"), is(false));
    assertThat(BuiltIn.lookup("pset.get"), is(BuiltIn.PSET_GET));
    assertThat(BuiltIn.PSET_GET.qualifiedName, is("pset.get"));
    assertThat(BuiltIn.GUID.qualifiedName, is("guid"));
    assertThat(BuiltIn.SYNTH_UPSAMPLE.isSynth(), is(true));
    assertThat(BuiltIn.GEOM_MESH.implementation, nullValue());
    assertThat(BuiltIn.PSET_HAS.accepts(1), is(true));
    assertThat(BuiltIn.PSET_HAS.accepts(3), is(false));
    assertThat(BuiltIn.BY_STRUCTURE.get("qto"),
        is(
            ImmutableList.of("qto.get", "qto.has", "qto.net_area",
                "qto.net_volume", "qto.gross_area")));
    // Every name is unique
    assertThat(BuiltIn.BY_NAME.size(), is(BuiltIn.values().length));
  }
}

// End CheckerTest.java
