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

import net.hydromatic.bimdl.ast.Pos;
import net.hydromatic.bimdl.util.BimdlException;

/** Exception thrown while writing the outputs of a recipe; for example,
 * if an export block names a format that is not supported. */
public class ExportException extends RuntimeException
    implements BimdlException {
  public ExportException(String message) {
    super(message);
  }

  public ExportException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public Pos pos() {
    return Pos.ZERO;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Export error: ").append(getMessage());
  }
}

// End ExportException.java
