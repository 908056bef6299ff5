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

import java.util.function.Consumer;
import net.hydromatic.tensorir.ast.Ir;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each emitted
   * binding, then calls the underlying tracer. */
  public static Tracer withOnEmit(Tracer tracer,
      Consumer<Ir.Binding> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEmit(Ir.Binding binding) {
        consumer.accept(binding);
        super.onEmit(binding);
      }
    };
  }

  /** Returns a tracer that performs the given action on each finished
   * block, then calls the underlying tracer. */
  public static Tracer withOnEndBlock(Tracer tracer,
      Consumer<Ir.BindingBlock> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEndBlock(Ir.BindingBlock block) {
        consumer.accept(block);
        super.onEndBlock(block);
      }
    };
  }

  public static Tracer withOnDiagnostic(Tracer tracer,
      Consumer<Diagnostic> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDiagnostic(Diagnostic diagnostic) {
        consumer.accept(diagnostic);
        super.onDiagnostic(diagnostic);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onEmit(Ir.Binding binding) {
    }

    @Override public void onEndBlock(Ir.BindingBlock block) {
    }

    @Override public void onDiagnostic(Diagnostic diagnostic) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onEmit(Ir.Binding binding) {
      tracer.onEmit(binding);
    }

    @Override public void onEndBlock(Ir.BindingBlock block) {
      tracer.onEndBlock(block);
    }

    @Override public void onDiagnostic(Diagnostic diagnostic) {
      tracer.onDiagnostic(diagnostic);
    }
  }
}

// End Tracers.java
