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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Iterables;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Proves facts about symbolic dimension expressions.
 *
 * <p>Expressions built from constants, variables, {@code +}, {@code -} and
 * {@code *} are brought to a canonical polynomial form: a map from monomial
 * (a multiset of atoms) to an integer coefficient. Floor division and modulo
 * fold when both operands are constant and are otherwise treated as atoms
 * keyed by the canonical forms of their operands.
 *
 * <p>The analyzer is conservative. A {@code false} result from
 * {@link #canProveEqual} means "not proven", never "unequal".
 */
public class Analyzer {
  /** Returns whether {@code a} and {@code b} are provably equal. */
  public boolean canProveEqual(PrimExpr a, PrimExpr b) {
    if (a == b || a.equals(b)) {
      return true;
    }
    try {
      return canonical(a).equals(canonical(b));
    } catch (ArithmeticException e) {
      // Overflow while folding constants; equality is not proven.
      return false;
    }
  }

  /** Returns the constant value of an expression, or null if it is not
   * provably constant. */
  public @Nullable Long constantValue(PrimExpr e) {
    try {
      return canonical(e).constant();
    } catch (ArithmeticException ex) {
      return null;
    }
  }

  private Poly canonical(PrimExpr e) {
    if (e instanceof PrimExpr.IntImm) {
      return Poly.constant(((PrimExpr.IntImm) e).value);
    }
    if (e instanceof PrimExpr.SizeVar) {
      return Poly.atom(e);
    }
    final PrimExpr.BinaryOp binary = (PrimExpr.BinaryOp) e;
    final Poly a = canonical(binary.a);
    final Poly b = canonical(binary.b);
    switch (binary.op) {
    case ADD:
      return a.plus(b);
    case SUB:
      return a.plus(b.negate());
    case MUL:
      return a.times(b);
    case FLOOR_DIV:
    case FLOOR_MOD:
      return divMod(binary.op, a, b);
    default:
      throw new AssertionError("unexpected " + binary.op);
    }
  }

  private static Poly divMod(PrimExpr.PrimOp op, Poly a, Poly b) {
    final Long divisor = b.constant();
    if (divisor != null && divisor == 1L) {
      return op == PrimExpr.PrimOp.FLOOR_DIV ? a : Poly.constant(0);
    }
    final Long dividend = a.constant();
    if (divisor != null && dividend != null && divisor != 0L) {
      if (dividend == Long.MIN_VALUE && divisor == -1L) {
        throw new ArithmeticException("long overflow");
      }
      return Poly.constant(op == PrimExpr.PrimOp.FLOOR_DIV
          ? Math.floorDiv(dividend, divisor)
          : Math.floorMod(dividend, divisor));
    }
    return Poly.atom(new OpaqueAtom(op, a, b));
  }

  /** Polynomial with integer coefficients. Terms with a zero coefficient are
   * never stored. */
  private static class Poly {
    final ImmutableMap<ImmutableMultiset<Object>, Long> terms;

    private Poly(ImmutableMap<ImmutableMultiset<Object>, Long> terms) {
      this.terms = terms;
    }

    static Poly constant(long value) {
      return value == 0L
          ? new Poly(ImmutableMap.of())
          : new Poly(ImmutableMap.of(ImmutableMultiset.of(), value));
    }

    static Poly atom(Object atom) {
      return new Poly(ImmutableMap.of(ImmutableMultiset.of(atom), 1L));
    }

    @Nullable Long constant() {
      if (terms.isEmpty()) {
        return 0L;
      }
      if (terms.size() == 1) {
        final Map.Entry<ImmutableMultiset<Object>, Long> term =
            Iterables.getOnlyElement(terms.entrySet());
        if (term.getKey().isEmpty()) {
          return term.getValue();
        }
      }
      return null;
    }

    Poly plus(Poly p) {
      final Map<ImmutableMultiset<Object>, Long> map =
          new LinkedHashMap<>(terms);
      p.terms.forEach((monomial, c) -> map.merge(monomial, c, Math::addExact));
      return of(map);
    }

    Poly negate() {
      final Map<ImmutableMultiset<Object>, Long> map = new LinkedHashMap<>();
      terms.forEach((monomial, c) -> map.put(monomial, Math.negateExact(c)));
      return of(map);
    }

    Poly times(Poly p) {
      final Map<ImmutableMultiset<Object>, Long> map = new LinkedHashMap<>();
      terms.forEach((m1, c1) ->
          p.terms.forEach((m2, c2) -> {
            final ImmutableMultiset<Object> monomial =
                ImmutableMultiset.builder().addAll(m1).addAll(m2).build();
            map.merge(monomial, Math.multiplyExact(c1, c2), Math::addExact);
          }));
      return of(map);
    }

    private static Poly of(Map<ImmutableMultiset<Object>, Long> map) {
      map.values().removeIf(c -> c == 0L);
      return new Poly(ImmutableMap.copyOf(map));
    }

    @Override
    public int hashCode() {
      return terms.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Poly && ((Poly) o).terms.equals(terms);
    }
  }

  /** Floor division or modulo that could not be folded. */
  private static class OpaqueAtom {
    final PrimExpr.PrimOp op;
    final Poly a;
    final Poly b;

    OpaqueAtom(PrimExpr.PrimOp op, Poly a, Poly b) {
      this.op = op;
      this.a = a;
      this.b = b;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a, b);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof OpaqueAtom
              && ((OpaqueAtom) o).op == op
              && ((OpaqueAtom) o).a.equals(a)
              && ((OpaqueAtom) o).b.equals(b);
    }
  }
}

// End Analyzer.java
