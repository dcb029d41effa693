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
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.bimdl.ast.Ast;
import net.hydromatic.bimdl.ast.AstBuilder;
import net.hydromatic.bimdl.ast.Op;
import net.hydromatic.bimdl.ast.Recipe;
import net.hydromatic.bimdl.compile.Checker;
import net.hydromatic.bimdl.eval.Evaluator;
import net.hydromatic.bimdl.eval.Prop;
import net.hydromatic.bimdl.export.ExportException;
import net.hydromatic.bimdl.export.ExportResult;
import net.hydromatic.bimdl.export.Exporters;
import net.hydromatic.bimdl.export.Manifest;
import net.hydromatic.bimdl.graph.RelationKind;
import net.hydromatic.bimdl.graph.SemanticGraph;
import net.hydromatic.bimdl.model.JsonModels;
import net.hydromatic.bimdl.model.Model;
import net.hydromatic.bimdl.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a recipe against a model.
 *
 * <p>The stages are: parse the recipe, build its AST, check it, load the
 * model, build the semantic graph, evaluate, write each export, and write
 * {@code manifest.json}. Each stage completes before the next starts; a
 * stage that fails throws, and later stages do not run.
 */
public class Runner {
  private static final Logger LOGGER = LoggerFactory.getLogger(Runner.class);

  /** Name of the manifest file in the output directory. */
  public static final String MANIFEST = "manifest.json";

  private final Map<Prop, Object> propMap;

  /** Creates a Runner.
   *
   * @param propMap Configuration; see {@link Prop} */
  public Runner(Map<Prop, Object> propMap) {
    this.propMap = requireNonNull(propMap);
  }

  /** Parses, builds and checks a recipe file. */
  public static Recipe compile(Path recipeFile) {
    final Recipe recipe =
        AstBuilder.ast.toRecipe(Parsers.parseFile(recipeFile));
    Checker.check(recipe);
    return recipe;
  }

  /** Runs a recipe against a model, writing files to the output
   * directory. */
  public Result run(File modelFile, File recipeFile) {
    final File outDir = Prop.OUTPUT_DIRECTORY.fileValue(propMap);
    final @Nullable Integer seed = Prop.SEED.intValue(propMap);
    final Set<RelationKind> kinds =
        RelationKind.parseList(Prop.RELATIONS.stringValue(propMap));
    final Manifest.Builder manifest = Manifest.builder();
    LOGGER.debug("running {} against {} with {}", recipeFile, modelFile,
        Prop.toMap(propMap));

    long t = System.nanoTime();
    final Recipe recipe = compile(recipeFile.toPath());
    t = lap(manifest, "parse_ast_check_s", t);

    final Model model = JsonModels.load(modelFile);
    t = lap(manifest, "model_load_s", t);

    final SemanticGraph graph = new SemanticGraph(model, kinds);
    t = lap(manifest, "graph_build_s", t);

    final Evaluator evaluator = new Evaluator(model, graph, seed);
    final List<Map<String, @Nullable Object>> rows =
        evaluator.evaluate(recipe);
    t = lap(manifest, "evaluate_s", t);
    LOGGER.info("evaluated {} row(s)", rows.size());

    final List<ExportResult> artifacts = new ArrayList<>();
    for (Ast.Block export : recipe.exports) {
      final ExportResult artifact = export(export, rows, graph, outDir);
      artifacts.add(artifact);
      manifest.artifact(artifact);
    }
    t = lap(manifest, "export_s", t);

    final List<String> relations = new ArrayList<>();
    kinds.forEach(k -> relations.add(k.lowerName()));
    manifest
        .model(modelFile.getPath(), sha256(modelFile), model.schema())
        .recipe(recipeFile.getPath(), sha256(recipeFile))
        .config(seed, relations)
        .stats(model.stats(), graph.stats(), rows.size(),
            rows.isEmpty() ? 0 : rows.get(0).size());
    final Manifest m = manifest.build();
    final Path manifestPath = outDir.toPath().resolve(MANIFEST);
    Exporters.manifestJson(m.toMap(), manifestPath);
    LOGGER.info("wrote manifest {}", manifestPath);
    return new Result(artifacts, manifestPath, m);
  }

  private static long lap(Manifest.Builder manifest, String stage,
      long start) {
    final long now = System.nanoTime();
    manifest.timing(stage, now - start);
    return now;
  }

  /** Writes one export. Relative paths are resolved against the output
   * directory. */
  private static ExportResult export(Ast.Block export,
      List<Map<String, @Nullable Object>> rows, SemanticGraph graph,
      File outDir) {
    final String format = export.setting(Op.FORMAT);
    final String path = export.setting(Op.PATH);
    if (format == null || path == null) {
      // the checker does not allow this
      throw new ExportException("export " + export.name
          + " has no format or path");
    }
    final Path outPath = outDir.toPath().resolve(path);
    switch (format) {
      case "jsonl":
        return Exporters.tabularJsonl(rows, outPath);
      case "edge_list":
        return Exporters.edgeListTsv(graph.edgeList(), withSuffix(outPath));
      default:
        throw new ExportException("unsupported export format '" + format
            + "'");
    }
  }

  /** Replaces a path's extension with ".tsv". */
  static Path withSuffix(Path path) {
    final String name = path.getFileName().toString();
    final String base = Files.getNameWithoutExtension(name);
    return path.resolveSibling(base + ".tsv");
  }

  /** Returns the SHA-256 digest of a file, in hexadecimal. */
  static String sha256(File file) {
    try {
      return Files.asByteSource(file).hash(Hashing.sha256()).toString();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Outcome of a run. */
  public static class Result {
    public final List<ExportResult> artifacts;
    public final Path manifestPath;
    public final Manifest manifest;

    Result(List<ExportResult> artifacts, Path manifestPath,
        Manifest manifest) {
      this.artifacts = ImmutableList.copyOf(artifacts);
      this.manifestPath = requireNonNull(manifestPath);
      this.manifest = requireNonNull(manifest);
    }
  }
}

// End Runner.java
