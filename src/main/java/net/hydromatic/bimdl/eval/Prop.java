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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration property of a run.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}. A property can be set
 * from a system property whose name is "bimdl." followed by its
 * {@link #camelName}, e.g. "bimdl.outputDirectory".
 */
public enum Prop {
  /**
   * Integer property "seed" is the seed for randomized functions. It is
   * recorded in the manifest. Default is null.
   */
  SEED("seed", Integer.class, false, null),

  /**
   * String property "relations" is a comma-separated list of the kinds of
   * relation to build into the graph. Default is all kinds.
   */
  RELATIONS("relations", String.class, true,
      "contained_in,aggregates,type_of,connects_to"),

  /**
   * File property "outputDirectory" is the directory against which relative
   * export paths are resolved, and where the manifest is written. Default is
   * "out".
   */
  OUTPUT_DIRECTORY("outputDirectory", File.class, true, new File("out"));

  /** Prefix of the names of system properties that set properties. */
  public static final String SYSTEM_PREFIX = "bimdl.";

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of an integer property, or null if it has no value
   * and no default value. */
  public @Nullable Integer intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) requireValue(get(map));
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return (File) requireValue(get(map));
  }

  private Object requireValue(@Nullable Object o) {
    if (o == null) {
      throw new IllegalStateException(
          "no value for property " + camelName + " and no default value");
    }
    return o;
  }

  /** Sets the value of a property, converting strings to the property's
   * type. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type == Integer.class) {
        try {
          value = Integer.valueOf(s.trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer: " + s, e);
        }
      } else if (type == File.class) {
        value = new File(s);
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /** Sets properties from system properties such as "bimdl.seed". */
  public static void setFromSystem(Map<Prop, Object> map,
      Properties properties) {
    for (Prop prop : values()) {
      final String value =
          properties.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
  }

  /** Returns the values of all properties, keyed by camel name, in sorted
   * order. Files become strings. */
  public static Map<String, @Nullable Object> toMap(Map<Prop, Object> map) {
    final Map<String, @Nullable Object> values = new LinkedHashMap<>();
    for (Prop prop : BY_CAMEL_NAME) {
      final Object value = prop.get(map);
      values.put(prop.camelName,
          value instanceof File ? ((File) value).getPath() : value);
    }
    return values;
  }
}

// End Prop.java
