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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.bimdl.eval.Applicable;
import net.hydromatic.bimdl.eval.Codes;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions and split operators.
 *
 * <p>This is the closed catalog of names that a recipe may call. The
 * {@link Checker} rejects any name not in the catalog; the evaluator
 * invokes {@link #implementation}, and fails if a function has none.
 */
public enum BuiltIn {
  /** Function "guid()", the GlobalId of the current node. */
  GUID(null, "guid", 0, 0, Codes::guid),

  /** Function "id()", a synonym for {@link #GUID}. */
  ID(null, "id", 0, 0, Codes::guid),

  /** Function "exists(x)", whether a value is not null. */
  EXISTS(null, "exists", 1, 1, Codes::exists),

  /** Function "coalesce(x, ...)", the first argument that is not null. */
  COALESCE(null, "coalesce", 1, Integer.MAX_VALUE, Codes::coalesce),

  /** Function "hash(x)", a stable 64-bit fingerprint of a value. */
  HASH(null, "hash", 1, 1, Codes::hash),

  /** Function "seed()", the random seed of the current run, or null. */
  SEED(null, "seed", 0, 0, Codes::seed),

  IFC_TYPE("ifc", "type", 0, 0, Codes::ifcType),
  IFC_SCHEMA("ifc", "schema", 0, 0, Codes::ifcSchema),

  /** Function "ifc.attr(name)", a direct attribute of the current
   * entity. */
  IFC_ATTR("ifc", "attr", 1, 1, Codes::ifcAttr),
  IFC_NAME("ifc", "name", 0, 0, Codes::ifcName),
  IFC_PREDEFINED("ifc", "predefined", 0, 0, Codes::ifcPredefined),

  /** Function "ifc.is_a(type)", whether the current entity has a given
   * type. */
  IFC_IS_A("ifc", "is_a", 1, 1, Codes::ifcIsA),
  IFC_GLOBAL_PLACEMENT("ifc", "global_placement"),

  /** Function "pset.get(pset, property)", the value of a property. */
  PSET_GET("pset", "get", 2, 2, Codes::psetGet),

  /** Function "pset.has(pset [, property])". */
  PSET_HAS("pset", "has", 1, 2, Codes::psetHas),
  PSET_KEYS("pset", "keys"),
  PSET_LIST("pset", "list"),
  PSET_TEXT("pset", "text"),
  PSET_NUMERIC("pset", "numeric"),

  /** Function "qto.get(qto, quantity)", the value of a quantity. */
  QTO_GET("qto", "get", 2, 2, Codes::qtoGet),

  /** Function "qto.has(qto [, quantity])". */
  QTO_HAS("qto", "has", 1, 2, Codes::qtoHas),
  QTO_NET_AREA("qto", "net_area"),
  QTO_NET_VOLUME("qto", "net_volume"),
  QTO_GROSS_AREA("qto", "gross_area"),

  REL_OUT("rel", "out"),
  REL_IN("rel", "in"),
  REL_EDGES("rel", "edges"),

  /** Function "rel.kinds()", the sorted kinds of the edges that touch the
   * current node. */
  REL_KINDS("rel", "kinds", 0, 0, Codes::relKinds),

  /** Function "contained_in()", the spatial structure that directly
   * contains the current node. */
  CONTAINED_IN(null, "contained_in", 0, 0, Codes::containedIn),

  /** Function "container_chain()", the containers of the current node,
   * innermost first. */
  CONTAINER_CHAIN(null, "container_chain", 0, 0, Codes::containerChain),
  TYPE_OF(null, "type_of", 0, 0, Codes::typeOf),
  AGGREGATES(null, "aggregates", 0, 0, Codes::aggregates),
  DECOMPOSES(null, "decomposes", 0, 0, Codes::decomposes),
  ASSIGNED_TO(null, "assigned_to"),
  CONNECTS_TO(null, "connects_to", 0, 0, Codes::connectsTo),
  VOIDS(null, "voids"),
  FILLS(null, "fills"),
  SPACES(null, "spaces"),

  /** Function "degree([kind])", the number of edges that touch the current
   * node. */
  DEGREE(null, "degree", 0, 1, Codes::degree),
  DEGREE_IN(null, "degree_in", 0, 1, Codes::degreeIn),
  DEGREE_OUT(null, "degree_out", 0, 1, Codes::degreeOut),

  /** Function "neighbors([kind])", the distinct neighbors of the current
   * node. */
  NEIGHBORS(null, "neighbors", 0, 1, Codes::neighbors),
  SUBGRAPH(null, "subgraph"),
  PATH_TO(null, "path_to"),

  GEOM_EXISTS("geom", "exists", 0, 0, Codes::geomExists),
  GEOM_BBOX("geom", "bbox", 0, 0, Codes::geomBbox),
  GEOM_CENTROID("geom", "centroid", 0, 0, Codes::geomCentroid),
  GEOM_DIMS("geom", "dims", 0, 0, Codes::geomDims),
  GEOM_VOLUME("geom", "volume"),
  GEOM_AREA("geom", "area"),
  GEOM_ORIENTATION("geom", "orientation"),
  GEOM_SIGNATURE("geom", "signature"),
  GEOM_MESH("geom", "mesh"),
  GEOM_POINTCLOUD("geom", "pointcloud"),

  TEXT_DESCRIBE("text", "describe"),
  TEXT_CONCAT("text", "concat", 0, Integer.MAX_VALUE, Codes::textConcat),
  TEXT_LOWER("text", "lower", 1, 1, Codes::textLower),
  TEXT_NORMALIZE("text", "normalize", 1, 1, Codes::textNormalize),
  TEXT_TOKENS("text", "tokens"),

  ML_ONEHOT("ml", "onehot"),
  ML_VOCAB("ml", "vocab"),

  /** Function "ml.bucket(x, width)", the index of the bucket that contains
   * {@code x}. */
  ML_BUCKET("ml", "bucket", 2, 2, Codes::mlBucket),
  ML_EMBED_HASH("ml", "embed_hash"),
  ML_STANDARDIZE("ml", "standardize"),

  SYNTH_JITTER_BBOX("synth", "jitter_bbox"),
  SYNTH_DROP_PSET("synth", "drop_pset"),
  SYNTH_DROP_FEATURE("synth", "drop_feature"),
  SYNTH_NOISE_NUMERIC("synth", "noise_numeric"),
  SYNTH_UPSAMPLE("synth", "upsample"),
  SYNTH_DOWNSAMPLE("synth", "downsample"),
  SYNTH_PERMUTE_WITHIN("synth", "permute_within"),

  /** Split operator "building", used as {@code by building();}. */
  BUILDING(null, "building"),
  STOREY(null, "storey"),
  PROJECT(null, "project"),
  SYSTEM(null, "system"),
  HASH_GROUP(null, "hash_group");

  /** Namespace, e.g. "ifc"; null for core functions. */
  public final @Nullable String structure;

  /** Unqualified name, e.g. "is_a". */
  public final String simpleName;

  /** Qualified name, e.g. "ifc.is_a". */
  public final String qualifiedName;

  public final int minArgs;
  public final int maxArgs;

  /** Implementation, or null if the function is reserved but not
   * implemented. */
  public final @Nullable Applicable implementation;

  /** Namespace name of synthesis functions. */
  public static final String SYNTH = "synth";

  /** Built-ins, keyed by qualified name. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  /** Qualified names of built-ins, grouped by namespace; core functions are
   * under "". */
  public static final SortedMap<String, List<String>> BY_STRUCTURE;

  static {
    final ImmutableMap.Builder<String, BuiltIn> byName =
        ImmutableMap.builder();
    final SortedMap<String, List<String>> byStructure =
        new TreeMap<>();
    for (BuiltIn builtIn : values()) {
      byName.put(builtIn.qualifiedName, builtIn);
      byStructure
          .computeIfAbsent(
              builtIn.structure == null ? "" : builtIn.structure,
              k -> new ArrayList<>())
          .add(builtIn.qualifiedName);
    }
    BY_NAME = byName.build();
    BY_STRUCTURE = ImmutableSortedMap.copyOf(byStructure);
  }

  BuiltIn(@Nullable String structure, String name) {
    this(structure, name, 0, Integer.MAX_VALUE, null);
  }

  BuiltIn(@Nullable String structure, String name, int minArgs, int maxArgs,
      @Nullable Applicable implementation) {
    this.structure = structure;
    this.simpleName = requireNonNull(name);
    this.qualifiedName = structure == null ? name : structure + "." + name;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.implementation = implementation;
  }

  /** Looks up a built-in by qualified name; returns null if not found. */
  public static @Nullable BuiltIn lookup(String qualifiedName) {
    return BY_NAME.get(qualifiedName);
  }

  /** Returns whether a name is in the catalog. */
  public static boolean isKnown(String qualifiedName) {
    return BY_NAME.containsKey(qualifiedName);
  }

  /** Returns whether this built-in accepts a given number of arguments. */
  public boolean accepts(int argCount) {
    return argCount >= minArgs && argCount <= maxArgs;
  }

  /** Returns whether this is a synthesis function ("synth.*"). */
  public boolean isSynth() {
    return SYNTH.equals(structure);
  }
}

// End BuiltIn.java
