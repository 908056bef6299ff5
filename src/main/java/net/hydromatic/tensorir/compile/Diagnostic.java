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

/** Report of a problem found while building or transforming IR. */
public class Diagnostic {
  public final Level level;
  public final Pos pos;
  public final String message;

  public Diagnostic(Level level, Pos pos, String message) {
    this.level = requireNonNull(level, "level");
    this.pos = requireNonNull(pos, "pos");
    this.message = requireNonNull(message, "message");
  }

  /** Creates an error diagnostic. */
  public static Diagnostic error(Pos pos, String message) {
    return new Diagnostic(Level.ERROR, pos, message);
  }

  /** Creates a warning diagnostic. */
  public static Diagnostic warning(Pos pos, String message) {
    return new Diagnostic(Level.WARNING, pos, message);
  }

  @Override public String toString() {
    return pos.describeTo(new StringBuilder())
        .append(' ')
        .append(level.name().toLowerCase(Locale.ROOT))
        .append(": ")
        .append(message)
        .toString();
  }

  /** Severity of a diagnostic. */
  public enum Level {
    WARNING,
    ERROR
  }
}

// End Diagnostic.java
