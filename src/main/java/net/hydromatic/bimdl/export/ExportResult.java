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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Description of a file written by {@link Exporters}. */
public class ExportResult {
  /** Format of the file, e.g. "jsonl". */
  public final String format;
  public final String path;
  /** Number of rows, or null if the file is not tabular. */
  public final @Nullable Integer rows;
  /** Number of columns, or null if the file is not tabular. */
  public final @Nullable Integer cols;

  public ExportResult(String format, String path, @Nullable Integer rows,
      @Nullable Integer cols) {
    this.format = requireNonNull(format);
    this.path = requireNonNull(path);
    this.rows = rows;
    this.cols = cols;
  }

  /** Converts this result to a map, as it appears in the manifest. */
  public Map<String, @Nullable Object> toMap() {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>();
    map.put("format", format);
    map.put("path", path);
    map.put("rows", rows);
    map.put("cols", cols);
    return map;
  }

  @Override
  public int hashCode() {
    return Objects.hash(format, path, rows, cols);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ExportResult
            && format.equals(((ExportResult) o).format)
            && path.equals(((ExportResult) o).path)
            && Objects.equals(rows, ((ExportResult) o).rows)
            && Objects.equals(cols, ((ExportResult) o).cols);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}

// End ExportResult.java
