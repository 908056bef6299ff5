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
package net.hydromatic.tensorir.compile;

import static java.util.Objects.requireNonNull;

import java.util.Locale;
import net.hydromatic.tensorir.ast.Pos;

/** An error occurred while building or transforming IR.
 *
 * <p>Carries the {@link Diagnostic} that caused it. Usually thrown by
 * {@link DiagnosticContext#emitFatal}, which has already recorded the
 * diagnostic. */
public class CompileException extends RuntimeException {
  private final Diagnostic diagnostic;

  public CompileException(Diagnostic diagnostic) {
    super(diagnostic.message);
    this.diagnostic = requireNonNull(diagnostic, "diagnostic");
  }

  /** Creates an exception for an error at a given position. */
  public CompileException(String message, Pos pos) {
    this(Diagnostic.error(pos, message));
  }

  @Override public String toString() {
    return super.toString() + " at " + diagnostic.pos;
  }

  public Diagnostic diagnostic() {
    return diagnostic;
  }

  public Pos pos() {
    return diagnostic.pos;
  }

  /** Writes the position, severity and message; for example,
   * "model.ir:2.1-2.9 Error: bad shape". */
  public StringBuilder describeTo(StringBuilder buf) {
    final String level = diagnostic.level.name();
    return diagnostic.pos.describeTo(buf)
        .append(' ')
        .append(level.charAt(0))
        .append(level.substring(1).toLowerCase(Locale.ROOT))
        .append(": ")
        .append(diagnostic.message);
  }
}

// End CompileException.java
