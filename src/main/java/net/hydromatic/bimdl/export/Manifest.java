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
package net.hydromatic.bimdl.export;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.bimdl.graph.GraphStats;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Record of a run: its inputs, configuration, statistics, the files it
 * wrote, and how long each stage took.
 *
 * <p>Apart from timings, the manifest of a run depends only on its inputs
 * and configuration.
 */
public class Manifest {
  public static final String RUNTIME_NAME = "bimdl";
  public static final String RUNTIME_VERSION = "0.2.0";

  public final String modelPath;
  public final String modelSha256;
  public final String schema;
  public final String recipePath;
  public final String recipeSha256;
  public final @Nullable Integer seed;
  public final List<String> relations;
  public final Map<String, Object> modelStats;
  public final GraphStats graphStats;
  public final int rows;
  public final int cols;
  public final List<ExportResult> artifacts;
  /** Elapsed seconds per stage, in the order the stages ran. */
  public final Map<String, Double> timings;

  private Manifest(Builder b) {
    this.modelPath = requireNonNull(b.modelPath, "modelPath");
    this.modelSha256 = requireNonNull(b.modelSha256, "modelSha256");
    this.schema = requireNonNull(b.schema, "schema");
    this.recipePath = requireNonNull(b.recipePath, "recipePath");
    this.recipeSha256 = requireNonNull(b.recipeSha256, "recipeSha256");
    this.seed = b.seed;
    this.relations = ImmutableList.copyOf(b.relations);
    this.modelStats = ImmutableMap.copyOf(b.modelStats);
    this.graphStats = requireNonNull(b.graphStats, "graphStats");
    this.rows = b.rows;
    this.cols = b.cols;
    this.artifacts = ImmutableList.copyOf(b.artifacts);
    this.timings = ImmutableMap.copyOf(b.timings);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Converts this manifest to nested maps, ready to be written as
   * JSON. */
  public Map<String, @Nullable Object> toMap() {
    final Map<String, @Nullable Object> runtime = new LinkedHashMap<>();
    runtime.put("name", RUNTIME_NAME);
    runtime.put("version", RUNTIME_VERSION);
    runtime.put("mode", "cli");

    final Map<String, @Nullable Object> model = new LinkedHashMap<>();
    model.put("path", modelPath);
    model.put("sha256", modelSha256);
    model.put("schema", schema);
    final Map<String, @Nullable Object> recipe = new LinkedHashMap<>();
    recipe.put("path", recipePath);
    recipe.put("sha256", recipeSha256);
    final Map<String, @Nullable Object> inputs = new LinkedHashMap<>();
    inputs.put("model", model);
    inputs.put("recipe", recipe);

    final Map<String, @Nullable Object> config = new LinkedHashMap<>();
    config.put("seed", seed);
    config.put("relations", relations);

    final Map<String, @Nullable Object> dataset = new LinkedHashMap<>();
    dataset.put("rows", rows);
    dataset.put("cols", cols);
    final Map<String, @Nullable Object> stats = new LinkedHashMap<>();
    stats.put("model", modelStats);
    stats.put("graph", graphStats.toMap());
    stats.put("dataset", dataset);

    final List<Map<String, @Nullable Object>> artifactList =
        new ArrayList<>();
    artifacts.forEach(a -> artifactList.add(a.toMap()));

    final Map<String, @Nullable Object> map = new LinkedHashMap<>();
    map.put("runtime", runtime);
    map.put("inputs", inputs);
    map.put("config", config);
    map.put("stats", stats);
    map.put("artifacts", artifactList);
    map.put("timings", timings);
    return map;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  /** Builder for a {@link Manifest}. */
  public static class Builder {
    private @Nullable String modelPath;
    private @Nullable String modelSha256;
    private @Nullable String schema;
    private @Nullable String recipePath;
    private @Nullable String recipeSha256;
    private @Nullable Integer seed;
    private List<String> relations = ImmutableList.of();
    private Map<String, Object> modelStats = ImmutableMap.of();
    private @Nullable GraphStats graphStats;
    private int rows;
    private int cols;
    private final List<ExportResult> artifacts = new ArrayList<>();
    private final Map<String, Double> timings = new LinkedHashMap<>();

    private Builder() {}

    public Builder model(String path, String sha256, String schema) {
      this.modelPath = path;
      this.modelSha256 = sha256;
      this.schema = schema;
      return this;
    }

    public Builder recipe(String path, String sha256) {
      this.recipePath = path;
      this.recipeSha256 = sha256;
      return this;
    }

    public Builder config(@Nullable Integer seed, List<String> relations) {
      this.seed = seed;
      this.relations = relations;
      return this;
    }

    public Builder stats(Map<String, Object> modelStats,
        GraphStats graphStats, int rows, int cols) {
      this.modelStats = modelStats;
      this.graphStats = graphStats;
      this.rows = rows;
      this.cols = cols;
      return this;
    }

    public Builder artifact(ExportResult artifact) {
      artifacts.add(artifact);
      return this;
    }

    /** Records the duration of a stage, in nanoseconds. */
    public Builder timing(String stage, long nanos) {
      timings.put(stage, nanos / 1_000_000_000d);
      return this;
    }

    public Manifest build() {
      return new Manifest(this);
    }
  }
}

// End Manifest.java
