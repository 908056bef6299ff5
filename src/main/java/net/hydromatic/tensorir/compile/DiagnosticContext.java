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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Collects diagnostics.
 *
 * <p>Inference rules report problems with {@link #emit}; a fatal report,
 * {@link #emitFatal}, also aborts the current pass by throwing. */
public class DiagnosticContext {
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final Tracer tracer;

  public DiagnosticContext(Tracer tracer) {
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Records a diagnostic. */
  public void emit(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
    tracer.onDiagnostic(diagnostic);
  }

  /** Records a diagnostic and throws a {@link CompileException}. Never
   * returns normally; declared to return an exception so that callers can
   * write {@code throw context.emitFatal(d)}. */
  public CompileException emitFatal(Diagnostic diagnostic) {
    emit(diagnostic);
    throw new CompileException(diagnostic);
  }

  /** Returns the diagnostics recorded so far. */
  public List<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }
}

// End DiagnosticContext.java
