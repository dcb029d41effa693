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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import net.hydromatic.bimdl.eval.Evaluator;
import net.hydromatic.bimdl.graph.GraphEdge;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writers for the files that a recipe produces. */
public class Exporters {
  private static final Logger LOGGER = LoggerFactory.getLogger(Exporters.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final ObjectMapper PRETTY_MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  /** Header line of an edge list. */
  public static final String EDGE_LIST_HEADER =
      "source_guid\ttarget_guid\tedge_type";

  private Exporters() {}

  /** Returns the columns of a table: the union of the keys of its rows,
   * with {@code guid} first and the rest in alphabetical order. */
  public static List<String> columns(
      List<? extends Map<String, ?>> rows) {
    final TreeSet<String> names = new TreeSet<>();
    rows.forEach(row -> names.addAll(row.keySet()));
    final List<String> columns = new ArrayList<>();
    if (names.remove(Evaluator.GUID)) {
      columns.add(Evaluator.GUID);
    }
    columns.addAll(names);
    return columns;
  }

  /** Writes rows as JSON Lines, one object per line. Every line has every
   * column; a column that a row lacks is written as null. */
  public static ExportResult tabularJsonl(
      List<? extends Map<String, ?>> rows, Path path) {
    final List<String> columns = columns(rows);
    try (BufferedWriter w = open(path)) {
      for (Map<String, ?> row : rows) {
        final Map<String, @Nullable Object> line = new LinkedHashMap<>();
        for (String column : columns) {
          line.put(column, row.get(column));
        }
        w.write(MAPPER.writeValueAsString(line));
        w.write('\n');
      }
    } catch (IOException e) {
      throw new ExportException("cannot write " + path, e);
    }
    LOGGER.info("wrote {} row(s) to {}", rows.size(), path);
    return new ExportResult("jsonl", path.toString(), rows.size(),
        columns.size());
  }

  /** Writes edges as tab-separated values, with a header line. */
  public static ExportResult edgeListTsv(List<GraphEdge> edges, Path path) {
    try (BufferedWriter w = open(path)) {
      w.write(EDGE_LIST_HEADER);
      w.write('\n');
      for (GraphEdge edge : edges) {
        w.write(edge.source);
        w.write('\t');
        w.write(edge.target);
        w.write('\t');
        w.write(edge.kind.lowerName());
        w.write('\n');
      }
    } catch (IOException e) {
      throw new ExportException("cannot write " + path, e);
    }
    LOGGER.info("wrote {} edge(s) to {}", edges.size(), path);
    return new ExportResult("edge_list_tsv", path.toString(), edges.size(),
        edges.isEmpty() ? 0 : 3);
  }

  /** Writes a manifest as indented JSON, with keys sorted. */
  public static ExportResult manifestJson(Map<String, ?> manifest,
      Path path) {
    try (BufferedWriter w = open(path)) {
      w.write(toPrettyJson(manifest));
      w.write('\n');
    } catch (IOException e) {
      throw new ExportException("cannot write " + path, e);
    }
    return new ExportResult("json", path.toString(), null, null);
  }

  /** Converts a map to indented JSON with sorted keys. */
  public static String toPrettyJson(Map<String, ?> map) {
    try {
      return PRETTY_MAPPER.writeValueAsString(map);
    } catch (JsonProcessingException e) {
      throw new ExportException("cannot convert to JSON", e);
    }
  }

  private static BufferedWriter open(Path path) throws IOException {
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
  }
}

// End Exporters.java
