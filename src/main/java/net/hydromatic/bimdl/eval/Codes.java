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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.bimdl.util.Static.transformEager;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.hydromatic.bimdl.ast.Op;
import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.graph.GraphNode;
import net.hydromatic.bimdl.graph.RelationKind;
import net.hydromatic.bimdl.model.BoundingBox;
import net.hydromatic.bimdl.model.Entity;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementations of operators and built-in functions.
 *
 * <p>Values are null, {@link Boolean}, {@link Long} (integral numbers),
 * {@link Double}, {@link String}, and {@link List}.
 */
public abstract class Codes {
  private static final Logger LOGGER = LoggerFactory.getLogger(Codes.class);

  private Codes() {}

  // operators

  /** Returns whether a value counts as true in a condition. Null, false,
   * zero, the empty string and the empty list are false. */
  public static boolean truthy(@Nullable Object o) {
    if (o == null) {
      return false;
    } else if (o instanceof Boolean) {
      return (Boolean) o;
    } else if (o instanceof Long) {
      return (Long) o != 0L;
    } else if (o instanceof Number) {
      return ((Number) o).doubleValue() != 0d;
    } else if (o instanceof String) {
      return !((String) o).isEmpty();
    } else if (o instanceof Collection) {
      return !((Collection<?>) o).isEmpty();
    } else {
      return true;
    }
  }

  /** Applies a binary operator to two values. */
  public static @Nullable Object binary(Op op, @Nullable Object a0,
      @Nullable Object a1, Pos pos) {
    switch (op) {
      case PLUS:
        if (a0 instanceof String && a1 instanceof String) {
          return (String) a0 + a1;
        }
        // fall through
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
        return arithmetic(op, a0, a1, pos);
      case EQ:
        return equal(a0, a1);
      case NE:
        return !equal(a0, a1);
      case LT:
      case GT:
      case LE:
      case GE:
        return compare(op, a0, a1, pos);
      case AND:
        return truthy(a0) & truthy(a1);
      case OR:
        return truthy(a0) | truthy(a1);
      default:
        throw new EvalException("unsupported operator " + op.symbol(), pos);
    }
  }

  /** Applies a prefix operator to a value. */
  public static @Nullable Object unary(Op op, @Nullable Object a, Pos pos) {
    switch (op) {
      case NOT:
        return !truthy(a);
      case NEGATE:
        if (a == null) {
          return null;
        } else if (a instanceof Long && (Long) a != Long.MIN_VALUE) {
          return -(Long) a;
        } else if (a instanceof Number) {
          return -((Number) a).doubleValue();
        }
        throw new EvalException("cannot negate " + typeName(a), pos);
      default:
        throw new EvalException("unsupported operator " + op.symbol(), pos);
    }
  }

  private static @Nullable Object arithmetic(Op op, @Nullable Object a0,
      @Nullable Object a1, Pos pos) {
    if (a0 == null || a1 == null) {
      return null;
    }
    if (!isNumber(a0) || !isNumber(a1)) {
      throw new EvalException("cannot apply " + op.symbol() + " to "
          + typeName(a0) + " and " + typeName(a1), pos);
    }
    if (a0 instanceof Long && a1 instanceof Long && op != Op.DIVIDE) {
      final long x = (Long) a0;
      final long y = (Long) a1;
      try {
        switch (op) {
          case PLUS:
            return Math.addExact(x, y);
          case MINUS:
            return Math.subtractExact(x, y);
          case TIMES:
            return Math.multiplyExact(x, y);
          case MOD:
            return y == 0L ? null : Math.floorMod(x, y);
          default:
            throw new AssertionError(op);
        }
      } catch (ArithmeticException e) {
        // Result does not fit in a long; compute it as a double below.
        LOGGER.debug("{} {} {} overflows long at {}", x, op.symbol(), y, pos);
      }
    }
    final double x = ((Number) a0).doubleValue();
    final double y = ((Number) a1).doubleValue();
    switch (op) {
      case PLUS:
        return x + y;
      case MINUS:
        return x - y;
      case TIMES:
        return x * y;
      case DIVIDE:
        return y == 0d ? null : x / y;
      case MOD:
        return y == 0d ? null : x - y * Math.floor(x / y);
      default:
        throw new AssertionError(op);
    }
  }

  private static boolean isNumber(Object o) {
    return o instanceof Long || o instanceof Double || o instanceof Integer;
  }

  /** Returns whether two values are equal. Numbers are equal if they have
   * the same value, regardless of type. */
  public static boolean equal(@Nullable Object a0, @Nullable Object a1) {
    if (a0 != null && a1 != null && isNumber(a0) && isNumber(a1)) {
      if (a0 instanceof Double || a1 instanceof Double) {
        return ((Number) a0).doubleValue() == ((Number) a1).doubleValue();
      }
      return ((Number) a0).longValue() == ((Number) a1).longValue();
    }
    return Objects.equals(a0, a1);
  }

  private static @Nullable Boolean compare(Op op, @Nullable Object a0,
      @Nullable Object a1, Pos pos) {
    if (a0 == null || a1 == null) {
      return null;
    }
    final int c;
    if (isNumber(a0) && isNumber(a1)) {
      if (a0 instanceof Double || a1 instanceof Double) {
        c = Double.compare(((Number) a0).doubleValue(),
            ((Number) a1).doubleValue());
      } else {
        c = Long.compare(((Number) a0).longValue(),
            ((Number) a1).longValue());
      }
    } else if (a0 instanceof String && a1 instanceof String) {
      c = ((String) a0).compareTo((String) a1);
    } else if (a0 instanceof Boolean && a1 instanceof Boolean) {
      c = Boolean.compare((Boolean) a0, (Boolean) a1);
    } else {
      throw new EvalException("cannot compare " + typeName(a0) + " and "
          + typeName(a1), pos);
    }
    switch (op) {
      case LT:
        return c < 0;
      case GT:
        return c > 0;
      case LE:
        return c <= 0;
      case GE:
        return c >= 0;
      default:
        throw new AssertionError(op);
    }
  }

  private static String typeName(@Nullable Object o) {
    return o == null ? "null" : o.getClass().getSimpleName();
  }

  // helpers for built-ins

  /** Converts an argument to a string, or null. */
  static @Nullable String str(@Nullable Object o) {
    return o == null ? null : o.toString();
  }

  private static List<String> guids(List<GraphNode> nodes) {
    return transformEager(nodes, n -> n.guid);
  }

  private static @Nullable String guidOf(@Nullable GraphNode node) {
    return node == null ? null : node.guid;
  }

  /** Converts an optional relation-kind argument. */
  private static @Nullable RelationKind kind(List<@Nullable Object> args) {
    if (args.isEmpty() || args.get(0) == null) {
      return null;
    }
    final String name = requireNonNull(str(args.get(0)));
    final RelationKind kind = RelationKind.lookup(name);
    if (kind == null) {
      throw new EvalException("unknown relation kind '" + name + "'",
          Pos.ZERO);
    }
    return kind;
  }

  // core built-ins

  /** Implements {@code guid()} and {@code id()}. */
  public static @Nullable Object guid(EvalEnv env,
      List<@Nullable Object> args) {
    return env.node().guid;
  }

  /** Implements {@code exists(x)}. */
  public static @Nullable Object exists(EvalEnv env,
      List<@Nullable Object> args) {
    return args.get(0) != null;
  }

  /** Implements {@code coalesce(x, ...)}. */
  public static @Nullable Object coalesce(EvalEnv env,
      List<@Nullable Object> args) {
    for (Object arg : args) {
      if (arg != null) {
        return arg;
      }
    }
    return null;
  }

  /** Implements {@code hash(x)}: a 64-bit fingerprint of the string form of
   * a value, stable across runs. */
  public static @Nullable Object hash(EvalEnv env,
      List<@Nullable Object> args) {
    final String s = str(args.get(0));
    return s == null
        ? null
        : Hashing.farmHashFingerprint64()
            .hashString(s, StandardCharsets.UTF_8).asLong();
  }

  /** Implements {@code seed()}. */
  public static @Nullable Object seed(EvalEnv env,
      List<@Nullable Object> args) {
    return env.seed == null ? null : (long) env.seed;
  }

  // ifc.* built-ins

  public static @Nullable Object ifcType(EvalEnv env,
      List<@Nullable Object> args) {
    return env.node().type;
  }

  public static @Nullable Object ifcSchema(EvalEnv env,
      List<@Nullable Object> args) {
    return env.model.schema();
  }

  public static @Nullable Object ifcAttr(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    final String name = str(args.get(0));
    return entity == null || name == null
        ? null
        : env.model.attribute(entity, name);
  }

  public static @Nullable Object ifcName(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    return entity == null ? null : env.model.name(entity);
  }

  public static @Nullable Object ifcPredefined(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    return entity == null ? null : env.model.predefinedType(entity);
  }

  /** Implements {@code ifc.is_a(type)}; compares type names ignoring
   * case. */
  public static @Nullable Object ifcIsA(EvalEnv env,
      List<@Nullable Object> args) {
    final String type = str(args.get(0));
    return type != null && env.node().type.equalsIgnoreCase(type);
  }

  // pset.* and qto.* built-ins

  public static @Nullable Object psetGet(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    final String pset = str(args.get(0));
    final String property = str(args.get(1));
    return entity == null || pset == null || property == null
        ? null
        : env.model.propertyValue(entity, pset, property);
  }

  /** Implements {@code pset.has(pset)} and {@code pset.has(pset, prop)}. */
  public static @Nullable Object psetHas(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    final String pset = str(args.get(0));
    if (entity == null || pset == null) {
      return false;
    }
    if (args.size() == 1) {
      return env.model.hasPropertySet(entity, pset);
    }
    final String property = str(args.get(1));
    return property != null
        && env.model.propertyValue(entity, pset, property) != null;
  }

  public static @Nullable Object qtoGet(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    final String qto = str(args.get(0));
    final String quantity = str(args.get(1));
    return entity == null || qto == null || quantity == null
        ? null
        : env.model.quantityValue(entity, qto, quantity);
  }

  /** Implements {@code qto.has(qto)} and {@code qto.has(qto, quantity)}. */
  public static @Nullable Object qtoHas(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    final String qto = str(args.get(0));
    if (entity == null || qto == null) {
      return false;
    }
    if (args.size() == 1) {
      return env.model.hasQuantitySet(entity, qto);
    }
    final String quantity = str(args.get(1));
    return quantity != null
        && env.model.quantityValue(entity, qto, quantity) != null;
  }

  // relationship and graph built-ins

  public static @Nullable Object containedIn(EvalEnv env,
      List<@Nullable Object> args) {
    return guidOf(env.graph.containedIn(env.node().guid));
  }

  public static @Nullable Object containerChain(EvalEnv env,
      List<@Nullable Object> args) {
    return guids(env.graph.containerChain(env.node().guid));
  }

  public static @Nullable Object typeOf(EvalEnv env,
      List<@Nullable Object> args) {
    return guidOf(env.graph.typeOf(env.node().guid));
  }

  public static @Nullable Object aggregates(EvalEnv env,
      List<@Nullable Object> args) {
    return guids(env.graph.aggregates(env.node().guid));
  }

  public static @Nullable Object decomposes(EvalEnv env,
      List<@Nullable Object> args) {
    return guidOf(env.graph.decomposes(env.node().guid));
  }

  public static @Nullable Object connectsTo(EvalEnv env,
      List<@Nullable Object> args) {
    return guids(env.graph.connectsTo(env.node().guid));
  }

  /** Implements {@code degree()} and {@code degree(kind)}. */
  public static @Nullable Object degree(EvalEnv env,
      List<@Nullable Object> args) {
    return (long) env.graph.degree(env.node().guid, kind(args));
  }

  public static @Nullable Object degreeIn(EvalEnv env,
      List<@Nullable Object> args) {
    return (long) env.graph.degreeIn(env.node().guid, kind(args));
  }

  public static @Nullable Object degreeOut(EvalEnv env,
      List<@Nullable Object> args) {
    return (long) env.graph.degreeOut(env.node().guid, kind(args));
  }

  public static @Nullable Object neighbors(EvalEnv env,
      List<@Nullable Object> args) {
    return guids(env.graph.neighbors(env.node().guid, kind(args)));
  }

  public static @Nullable Object relKinds(EvalEnv env,
      List<@Nullable Object> args) {
    return env.graph.kinds(env.node().guid);
  }

  // geom.* built-ins

  public static @Nullable Object geomExists(EvalEnv env,
      List<@Nullable Object> args) {
    final Entity entity = env.entity();
    return entity != null && env.model.hasGeometry(entity);
  }

  private static @Nullable BoundingBox bbox(EvalEnv env) {
    final Entity entity = env.entity();
    return entity == null ? null : env.model.boundingBox(entity);
  }

  public static @Nullable Object geomBbox(EvalEnv env,
      List<@Nullable Object> args) {
    final BoundingBox bbox = bbox(env);
    return bbox == null ? null : bbox.toList();
  }

  public static @Nullable Object geomCentroid(EvalEnv env,
      List<@Nullable Object> args) {
    final BoundingBox bbox = bbox(env);
    return bbox == null ? null : bbox.centroid();
  }

  public static @Nullable Object geomDims(EvalEnv env,
      List<@Nullable Object> args) {
    final BoundingBox bbox = bbox(env);
    return bbox == null ? null : bbox.dims();
  }

  // text.* and ml.* built-ins

  /** Implements {@code text.concat(x, ...)}; null arguments are skipped. */
  public static @Nullable Object textConcat(EvalEnv env,
      List<@Nullable Object> args) {
    final StringBuilder b = new StringBuilder();
    for (Object arg : args) {
      if (arg != null) {
        b.append(arg);
      }
    }
    return b.toString();
  }

  public static @Nullable Object textLower(EvalEnv env,
      List<@Nullable Object> args) {
    final String s = str(args.get(0));
    return s == null ? null : s.toLowerCase(Locale.ROOT);
  }

  /** Implements {@code text.normalize(s)}: trims, converts to lower case,
   * and collapses runs of white space to a single space. */
  public static @Nullable Object textNormalize(EvalEnv env,
      List<@Nullable Object> args) {
    final String s = str(args.get(0));
    return s == null
        ? null
        : s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  /** Implements {@code ml.bucket(x, width)}: the index of the bucket of
   * width {@code width} that contains {@code x}. */
  public static @Nullable Object mlBucket(EvalEnv env,
      List<@Nullable Object> args) {
    final Object x = args.get(0);
    final Object width = args.get(1);
    if (!(x instanceof Number) || !(width instanceof Number)) {
      return null;
    }
    final double w = ((Number) width).doubleValue();
    if (w == 0d) {
      return null;
    }
    return (long) Math.floor(((Number) x).doubleValue() / w);
  }
}

// End Codes.java
