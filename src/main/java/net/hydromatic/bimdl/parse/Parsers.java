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
package net.hydromatic.bimdl.parse;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.hydromatic.bimdl.ast.Pos;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Parses recipe text. */
  public static ParseTree.Node parse(String text) {
    return parse(text, "");
  }

  /**
   * Parses recipe text, recording a file name in positions.
   *
   * @throws RecipeParseException if the text is not a valid recipe
   */
  public static ParseTree.Node parse(String text, String file) {
    final RecipeParserImpl parser =
        new RecipeParserImpl(new StringReader(text));
    parser.zero(file);
    try {
      return parser.documentEof();
    } catch (ParseException e) {
      final Token t = e.currentToken == null ? null : e.currentToken.next;
      final int line = t == null ? 1 : Math.max(t.beginLine, 1);
      final int column = t == null ? 1 : Math.max(t.beginColumn, 1);
      throw error(e, text, file, line, column);
    } catch (TokenMgrError e) {
      throw error(e, text, file, 1, 1);
    }
  }

  /** Reads and parses a recipe file. */
  public static ParseTree.Node parseFile(Path path) {
    final String text;
    try {
      text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return parse(text, path.toString());
  }

  private static RecipeParseException error(Throwable e, String text,
      String file, int line, int column) {
    final Pos pos = new Pos(file, line, column, line, column + 1);
    return new RecipeParseException(e, pos, context(text, line, column));
  }

  /**
   * Renders the context of an error: the source line, then a line with a caret
   * under the given column. Both line and column are 1-based.
   */
  public static String context(String text, int line, int column) {
    final List<String> lines = Splitter.onPattern("\r?\n").splitToList(text);
    final String sourceLine =
        line >= 1 && line <= lines.size() ? lines.get(line - 1) : "";
    return sourceLine + "\n" + Strings.repeat(" ", Math.max(column - 1, 0))
        + "^";
  }

  /**
   * Given quoted string {@code "abc"} returns {@code abc}; {@code "\t"} returns
   * the tab character; {@code "A"} returns "A".
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != '\\' || i + 1 == s.length()) {
        b.append(c);
        continue;
      }
      final char c2 = s.charAt(++i);
      switch (c2) {
        case 'b':
          b.append('\b');
          break;
        case 'f':
          b.append('\f');
          break;
        case 'n':
          b.append('\n');
          break;
        case 'r':
          b.append('\r');
          break;
        case 't':
          b.append('\t');
          break;
        case 'u':
          if (i + 4 < s.length()) {
            b.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
            i += 4;
            break;
          }
          throw new IllegalArgumentException("illegal unicode escape");
        default:
          // '\"', '\\', '\/' and unknown escapes stand for the character
          b.append(c2);
      }
    }
    return b.toString();
  }

  /**
   * Converts a character to how it appears in a string literal.
   *
   * <p>Inverse of the escape handling in {@link #unquoteString}.
   */
  public static String charToString(char c) {
    switch (c) {
      case '\b':
        return "\\b";
      case '\f':
        return "\\f";
      case '\n':
        return "\\n";
      case '\r':
        return "\\r";
      case '\t':
        return "\\t";
      case '"':
        return "\\\"";
      case '\\':
        return "\\\\";
      default:
        if (c < 32) {
          return String.format("\\u%04x", (int) c);
        }
        return String.valueOf(c);
    }
  }

  /** Converts an internal string to the body of a string literal. */
  public static String stringToString(String s) {
    if (!requiresEscape(s)) {
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      b.append(charToString(s.charAt(i)));
    }
    return b.toString();
  }

  private static boolean requiresEscape(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < 32 || c == '"' || c == '\\') {
        return true;
      }
    }
    return false;
  }
}

// End Parsers.java
