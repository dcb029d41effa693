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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.bimdl.compile.CheckException;
import net.hydromatic.bimdl.eval.Prop;
import net.hydromatic.bimdl.export.ExportException;
import net.hydromatic.bimdl.export.ExportResult;
import net.hydromatic.bimdl.export.Manifest;
import net.hydromatic.bimdl.parse.RecipeParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Runner}. */
class RunnerTest {
  private static final File MODEL = Fixtures.resource("model.json");
  private static final File WALLS = Fixtures.resource("recipes/walls.bimdl");

  @TempDir Path tempDir;

  private Runner runner(Map<Prop, Object> propMap) {
    Prop.OUTPUT_DIRECTORY.set(propMap, tempDir.toFile());
    return new Runner(propMap);
  }

  private Runner runner() {
    return runner(new HashMap<>());
  }

  private static List<String> lines(Path path) throws IOException {
    return Files.readAllLines(path, StandardCharsets.UTF_8);
  }

  @Test void testRun() throws IOException {
    final Runner.Result result = runner().run(MODEL, WALLS);

    // Rows are walls then doors, in view order; columns are guid and then
    // the feature names in alphabetical order.
    final Path dataset = tempDir.resolve("dataset.jsonl");
    assertThat(lines(dataset),
        is(
            ImmutableList.of("{\"guid\":\"w1\",\"degree\":3,\"external\":true,"
                    + "\"name\":\"Wall A\",\"storey\":\"st1\","
                    + "\"type\":\"IfcWall\"}",
                "{\"guid\":\"w2\",\"degree\":3,\"external\":false,"
                    + "\"name\":\"Wall B\",\"storey\":\"st1\","
                    + "\"type\":\"IfcWall\"}",
                "{\"guid\":\"d1\",\"degree\":1,\"external\":null,"
                    + "\"name\":\"Door\",\"storey\":\"st1\","
                    + "\"type\":\"IfcDoor\"}")));

    // The edge list gets a ".tsv" suffix
    final Path edges = tempDir.resolve("edges.tsv");
    assertThat(Files.exists(tempDir.resolve("edges.txt")), is(false));
    final List<String> edgeLines = lines(edges);
    assertThat(edgeLines, hasSize(8));
    assertThat(edgeLines.get(0), is("source_guid\ttarget_guid\tedge_type"));
    assertThat(edgeLines.get(1), is("w1\tst1\tcontained_in"));

    assertThat(result.artifacts,
        is(
            ImmutableList.of(
                new ExportResult("jsonl", dataset.toString(), 3, 6),
                new ExportResult("edge_list_tsv", edges.toString(), 7, 3))));
    assertThat(result.manifestPath, is(tempDir.resolve(Runner.MANIFEST)));
    assertThat(Files.exists(result.manifestPath), is(true));
  }

  @Test void testManifest() {
    final Manifest manifest = runner().run(MODEL, WALLS).manifest;
    assertThat(manifest.modelPath, is(MODEL.getPath()));
    assertThat(manifest.modelSha256, is(Runner.sha256(MODEL)));
    assertThat(manifest.modelSha256.length(), is(64));
    assertThat(manifest.recipeSha256, is(Runner.sha256(WALLS)));
    assertThat(manifest.schema, is("IFC4"));
    assertThat(manifest.seed == null, is(true));
    assertThat(manifest.relations,
        is(
            ImmutableList.of("contained_in", "aggregates", "type_of",
                "connects_to")));
    assertThat(manifest.rows, is(3));
    assertThat(manifest.cols, is(6));
    assertThat(manifest.graphStats.edgesTotal, is(7));
    assertThat(ImmutableList.copyOf(manifest.timings.keySet()),
        is(
            ImmutableList.of("parse_ast_check_s", "model_load_s",
                "graph_build_s", "evaluate_s", "export_s")));
  }

  /** Tests that two runs with the same inputs and configuration produce the
   * same manifest, apart from timings. */
  @Test void testManifestIsDeterministic() {
    final Map<String, @Nullable Object> map1 =
        runner().run(MODEL, WALLS).manifest.toMap();
    final Map<String, @Nullable Object> map2 =
        runner().run(MODEL, WALLS).manifest.toMap();
    map1.remove("timings");
    map2.remove("timings");
    assertThat(map1, is(map2));
  }

  @Test void testSeedAndRelations() {
    final Map<Prop, Object> propMap = new HashMap<>();
    Prop.SEED.set(propMap, 17);
    Prop.RELATIONS.set(propMap, "type_of, contained_in");
    final Manifest manifest = runner(propMap).run(MODEL, WALLS).manifest;
    assertThat(manifest.seed, is(17));
    assertThat(manifest.relations,
        is(ImmutableList.of("contained_in", "type_of")));
    assertThat(manifest.graphStats.edgesTotal, is(5));
    assertThat(manifest.toMap().get("config"),
        is(
            ImmutableMap.of("seed", 17, "relations",
                ImmutableList.of("contained_in", "type_of"))));
  }

  @Test void testUnsupportedFormat() {
    final ExportException e =
        assertThrows(ExportException.class,
            () -> runner().run(MODEL,
                Fixtures.resource("recipes/parquet.bimdl")));
    assertThat(e.getMessage(), is("unsupported export format 'parquet'"));
    // The run stopped before writing the manifest
    assertThat(Files.exists(tempDir.resolve(Runner.MANIFEST)), is(false));
  }

  @Test void testBadRecipe() {
    assertThrows(RecipeParseException.class,
        () -> runner().run(MODEL,
            Fixtures.resource("recipes/bad-syntax.bimdl")));
    final CheckException e =
        assertThrows(CheckException.class,
            () -> runner().run(MODEL,
                Fixtures.resource("recipes/unknown-function.bimdl")));
    assertThat(e.codes(), is(ImmutableList.of("FN001")));
    assertThat(Files.exists(tempDir.resolve("out.jsonl")), is(false));
  }

  @Test void testCompile() {
    assertThat(Runner.compile(WALLS.toPath()).exports, hasSize(2));
  }

  @Test void testWithSuffix() {
    assertThat(Runner.withSuffix(Paths.get("a/b/edges.txt")),
        is(Paths.get("a/b/edges.tsv")));
    assertThat(Runner.withSuffix(Paths.get("edges")),
        is(Paths.get("edges.tsv")));
    assertThat(Runner.withSuffix(Paths.get("x.tar.gz")),
        is(Paths.get("x.tar.tsv")));
  }
}

// End RunnerTest.java
