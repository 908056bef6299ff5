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
package net.hydromatic.tensorir.arith;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;

/**
 * Symbolic integer expression describing one dimension of a shape.
 *
 * <p>For example, in the shape {@code (n, 4 * m)}, the first dimension is the
 * {@link SizeVar} {@code n} and the second is the {@link BinaryOp}
 * {@code 4 * m}.
 */
public abstract class PrimExpr {
  PrimExpr() {}

  /** Creates an integer constant. */
  public static IntImm of(long value) {
    return new IntImm(value);
  }

  /** Creates a symbolic variable. Each call creates a distinct variable,
   * even if the name is the same. */
  public static SizeVar var(String name) {
    return new SizeVar(name);
  }

  public PrimExpr plus(PrimExpr e) {
    return new BinaryOp(PrimOp.ADD, this, e);
  }

  public PrimExpr minus(PrimExpr e) {
    return new BinaryOp(PrimOp.SUB, this, e);
  }

  public PrimExpr times(PrimExpr e) {
    return new BinaryOp(PrimOp.MUL, this, e);
  }

  public PrimExpr floorDiv(PrimExpr e) {
    return new BinaryOp(PrimOp.FLOOR_DIV, this, e);
  }

  public PrimExpr floorMod(PrimExpr e) {
    return new BinaryOp(PrimOp.FLOOR_MOD, this, e);
  }

  /** Operator of a {@link BinaryOp}. */
  public enum PrimOp {
    ADD(" + "),
    SUB(" - "),
    MUL(" * "),
    FLOOR_DIV(" // "),
    FLOOR_MOD(" % ");

    public final String symbol;

    PrimOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Integer constant. */
  public static class IntImm extends PrimExpr {
    public final long value;

    IntImm(long value) {
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IntImm && ((IntImm) o).value == value;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  /** Symbolic dimension variable.
   *
   * <p>Uses object identity: two variables with the same name are different
   * variables. */
  public static class SizeVar extends PrimExpr {
    public final String name;

    SizeVar(String name) {
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Binary arithmetic on two dimension expressions. */
  public static class BinaryOp extends PrimExpr {
    public final PrimOp op;
    public final PrimExpr a;
    public final PrimExpr b;

    BinaryOp(PrimOp op, PrimExpr a, PrimExpr b) {
      this.op = requireNonNull(op, "op");
      this.a = requireNonNull(a, "a");
      this.b = requireNonNull(b, "b");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a, b);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BinaryOp
              && ((BinaryOp) o).op == op
              && ((BinaryOp) o).a.equals(a)
              && ((BinaryOp) o).b.equals(b);
    }

    @Override
    public String toString() {
      return String.format(Locale.ROOT, "(%s%s%s)", a, op.symbol, b);
    }
  }
}

// End PrimExpr.java
