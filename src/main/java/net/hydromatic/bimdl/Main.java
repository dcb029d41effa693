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

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.bimdl.ast.Ast;
import net.hydromatic.bimdl.ast.AstBuilder;
import net.hydromatic.bimdl.ast.Recipe;
import net.hydromatic.bimdl.compile.Checker;
import net.hydromatic.bimdl.compile.Diagnostic;
import net.hydromatic.bimdl.eval.Prop;
import net.hydromatic.bimdl.export.ExportResult;
import net.hydromatic.bimdl.export.Manifest;
import net.hydromatic.bimdl.graph.RelationKind;
import net.hydromatic.bimdl.parse.Parsers;
import net.hydromatic.bimdl.util.BimdlException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Command line. */
public class Main {
  /** Exit status if a stage of the pipeline fails. */
  public static final int FAILURE = 1;

  /** Exit status if the arguments are not valid. */
  public static final int USAGE = 2;

  private static final String USAGE_TEXT = "Usage:\n"
      + "  bimdl run <model.json> <recipe> [--out DIR] [--seed N]"
      + " [--relations K,...]\n"
      + "  bimdl validate <recipe>\n"
      + "  bimdl explain <recipe>\n"
      + "  bimdl version\n";

  private final List<String> argList;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.setFromSystem(propMap, System.getProperties());
    final Main main =
        new Main(ImmutableList.copyOf(args), new PrintWriter(System.out),
            propMap);
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out, Map<Prop, Object> propMap) {
    this.argList = ImmutableList.copyOf(argList);
    this.out =
        out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
    this.propMap = propMap;
  }

  /** Runs the command, and returns the exit status. */
  public int run() {
    try {
      return run_();
    } catch (UsageException e) {
      out.println(e.getMessage());
      out.print(USAGE_TEXT);
      return USAGE;
    } catch (RuntimeException e) {
      if (e instanceof BimdlException) {
        out.println(((BimdlException) e).describeTo(new StringBuilder()));
        return FAILURE;
      }
      if (e instanceof UncheckedIOException) {
        out.println("I/O error: " + e.getMessage());
        return FAILURE;
      }
      throw e;
    } finally {
      out.flush();
    }
  }

  private int run_() {
    if (argList.isEmpty()) {
      throw new UsageException("no command");
    }
    final String command = argList.get(0);
    final List<String> args = argList.subList(1, argList.size());
    switch (command) {
      case "run":
        return runCommand(args);
      case "validate":
        return validate(single(command, args));
      case "explain":
        return explain(single(command, args));
      case "version":
        out.println(Manifest.RUNTIME_NAME + " " + Manifest.RUNTIME_VERSION);
        return 0;
      default:
        throw new UsageException("unknown command '" + command + "'");
    }
  }

  private static String single(String command, List<String> args) {
    if (args.size() != 1) {
      throw new UsageException(command + " requires one argument");
    }
    return args.get(0);
  }

  private int runCommand(List<String> args) {
    final List<String> files = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      final String arg = args.get(i);
      switch (arg) {
        case "--out":
          Prop.OUTPUT_DIRECTORY.setLenient(propMap, value(args, ++i, arg));
          break;
        case "--seed":
          try {
            Prop.SEED.setLenient(propMap, value(args, ++i, arg));
          } catch (IllegalArgumentException e) {
            throw new UsageException("--seed requires an integer");
          }
          break;
        case "--relations":
          final String relations = value(args, ++i, arg);
          try {
            RelationKind.parseList(relations);
          } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
          }
          Prop.RELATIONS.set(propMap, relations);
          break;
        default:
          if (arg.startsWith("--")) {
            throw new UsageException("unknown option '" + arg + "'");
          }
          files.add(arg);
      }
    }
    if (files.size() != 2) {
      throw new UsageException("run requires a model and a recipe");
    }
    final Runner.Result result =
        new Runner(propMap)
            .run(new File(files.get(0)), new File(files.get(1)));
    for (ExportResult artifact : result.artifacts) {
      out.println("wrote " + artifact.path);
    }
    out.println("wrote " + result.manifestPath);
    return 0;
  }

  private static String value(List<String> args, int i, String option) {
    if (i >= args.size()) {
      throw new UsageException(option + " requires a value");
    }
    return args.get(i);
  }

  private int validate(String recipeFile) {
    final Recipe recipe =
        AstBuilder.ast.toRecipe(Parsers.parseFile(Paths.get(recipeFile)));
    final List<Diagnostic> diagnostics = Checker.diagnose(recipe);
    if (diagnostics.isEmpty()) {
      out.println("OK");
      return 0;
    }
    for (Diagnostic diagnostic : diagnostics) {
      out.println(diagnostic);
    }
    return FAILURE;
  }

  private int explain(String recipeFile) {
    final Recipe recipe =
        AstBuilder.ast.toRecipe(Parsers.parseFile(Paths.get(recipeFile)));
    out.println(recipe.summary());
    for (Ast.Block block : recipe.blocks()) {
      out.println();
      out.println(block);
    }
    return 0;
  }

  /** Thrown when the command-line arguments are not valid. */
  private static class UsageException extends RuntimeException {
    UsageException(@Nullable String message) {
      super(message);
    }
  }
}

// End Main.java
