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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.util.BimdlException;

/** Exception thrown when checking a recipe produces one or more
 * diagnostics. Holds all of them. */
public class CheckException extends RuntimeException
    implements BimdlException {
  public final List<Diagnostic> diagnostics;

  public CheckException(List<Diagnostic> diagnostics) {
    super("Check failed with " + diagnostics.size() + " diagnostic(s)");
    checkArgument(!diagnostics.isEmpty());
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  /** Returns the codes of the diagnostics, in the order they were found. */
  public List<String> codes() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    diagnostics.forEach(d -> b.add(d.code));
    return b.build();
  }

  @Override
  public Pos pos() {
    return diagnostics.get(0).pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(getMessage());
    for (Diagnostic diagnostic : diagnostics) {
      buf.append("\n  ");
      diagnostic.describeTo(buf);
    }
    return buf;
  }
}

// End CheckException.java
