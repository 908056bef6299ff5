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

import static net.hydromatic.tensorir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensorir.arith.Analyzer;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.ast.Kind;
import net.hydromatic.tensorir.type.DType;
import net.hydromatic.tensorir.type.DynTensorType;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in operators and their inference rules.
 *
 * @see OpRegistry#standard() */
public enum BuiltIn {
  /** Elementwise addition, "add(x, y)". Dimensions of extent 1
   * broadcast. */
  ADD("add", BuiltIn::elementwiseShape, BuiltIn::elementwiseType),

  /** Elementwise multiplication, "multiply(x, y)". */
  MULTIPLY("multiply", BuiltIn::elementwiseShape, BuiltIn::elementwiseType),

  /** Matrix multiplication of two rank-2 tensors, "matmul(x, y)". */
  MATMUL("matmul", BuiltIn::matmulShape, BuiltIn::matmulType),

  /** Distinct elements of a tensor, "unique(x)", as a rank-1 tensor. Its
   * extent depends on the data, so its shape is a
   * {@link Ir.RuntimeDepShape}. */
  UNIQUE("unique", (call, context) -> ir.runtimeDepShape(),
      BuiltIn::uniqueType),

  /** Prints its arguments; has no inference rules. */
  PRINT("print", null, null);

  public final String opName;
  public final @Nullable FInferShape shapeRule;
  public final @Nullable FInferType typeRule;

  BuiltIn(String opName, @Nullable FInferShape shapeRule,
      @Nullable FInferType typeRule) {
    this.opName = opName;
    this.shapeRule = shapeRule;
    this.typeRule = typeRule;
  }

  /** Returns the operator. */
  public Ir.Op op() {
    return ir.op(opName);
  }

  /** Creates a call to this operator. */
  public Ir.Call call(Ir.Expr... args) {
    return ir.call(op(), args);
  }

  private static boolean checkArity(Ir.Call call, int arity,
      DiagnosticContext context) {
    if (call.args.size() == arity) {
      return true;
    }
    context.emit(
        Diagnostic.error(call.pos,
            "operator " + call.op + " expects " + arity + " arguments, got "
                + call.args.size()));
    return false;
  }

  private static Ir.@Nullable ShapeExpr shapeOf(Ir.Expr e) {
    final Ir.Expr shape = e.shape();
    return shape != null && shape.kind == Kind.SHAPE_EXPR
        ? (Ir.ShapeExpr) shape
        : null;
  }

  private static @Nullable DynTensorType typeOf(Ir.Expr e) {
    final Type type = e.checkedType();
    return type instanceof DynTensorType ? (DynTensorType) type : null;
  }

  private static boolean isOne(PrimExpr e) {
    return e instanceof PrimExpr.IntImm && ((PrimExpr.IntImm) e).value == 1;
  }

  static Ir.@Nullable Expr elementwiseShape(Ir.Call call,
      DiagnosticContext context) {
    if (!checkArity(call, 2, context)) {
      return null;
    }
    final Ir.ShapeExpr lhs = shapeOf(call.args.get(0));
    final Ir.ShapeExpr rhs = shapeOf(call.args.get(1));
    if (lhs == null || rhs == null) {
      return null;
    }
    if (lhs.ndim() != rhs.ndim()) {
      context.emit(
          Diagnostic.error(call.pos,
              "operands of " + call.op + " have different ranks "
                  + lhs.ndim() + " and " + rhs.ndim()));
      return null;
    }
    final Analyzer analyzer = new Analyzer();
    final ImmutableList.Builder<PrimExpr> dims = ImmutableList.builder();
    for (int i = 0; i < lhs.ndim(); i++) {
      final PrimExpr l = lhs.values.get(i);
      final PrimExpr r = rhs.values.get(i);
      if (analyzer.canProveEqual(l, r) || isOne(r)) {
        dims.add(l);
      } else if (isOne(l)) {
        dims.add(r);
      } else {
        // Not provably incompatible; the extent is only known at run time.
        return null;
      }
    }
    return ir.shapeExpr(dims.build());
  }

  static @Nullable Type elementwiseType(Ir.Call call,
      DiagnosticContext context) {
    if (!checkArity(call, 2, context)) {
      return null;
    }
    final DynTensorType lhs = typeOf(call.args.get(0));
    final DynTensorType rhs = typeOf(call.args.get(1));
    if (lhs == null || rhs == null) {
      return null;
    }
    final DType dtype = unifyDtype(call, lhs, rhs, context);
    if (dtype == null) {
      return null;
    }
    if (lhs.isUnknownNdim() || rhs.isUnknownNdim()) {
      return DynTensorType.of(DynTensorType.UNKNOWN_NDIM, dtype);
    }
    if (lhs.ndim != rhs.ndim) {
      context.emit(
          Diagnostic.error(call.pos,
              "operands of " + call.op + " have different ranks "
                  + lhs.ndim + " and " + rhs.ndim));
      return null;
    }
    return DynTensorType.of(lhs.ndim, dtype);
  }

  private static @Nullable DType unifyDtype(Ir.Call call, DynTensorType lhs,
      DynTensorType rhs, DiagnosticContext context) {
    if (!lhs.dtype.isKnown()) {
      return rhs.dtype;
    }
    if (!rhs.dtype.isKnown() || lhs.dtype == rhs.dtype) {
      return lhs.dtype;
    }
    context.emit(
        Diagnostic.error(call.pos,
            "operands of " + call.op + " have different element types "
                + lhs.dtype + " and " + rhs.dtype));
    return null;
  }

  static Ir.@Nullable Expr matmulShape(Ir.Call call,
      DiagnosticContext context) {
    if (!checkArity(call, 2, context)) {
      return null;
    }
    final Ir.ShapeExpr lhs = shapeOf(call.args.get(0));
    final Ir.ShapeExpr rhs = shapeOf(call.args.get(1));
    if (lhs == null || rhs == null) {
      return null;
    }
    if (lhs.ndim() != 2 || rhs.ndim() != 2) {
      context.emit(
          Diagnostic.error(call.pos, "operands of matmul must have rank 2"));
      return null;
    }
    final List<PrimExpr> l = lhs.values;
    final List<PrimExpr> r = rhs.values;
    if (!new Analyzer().canProveEqual(l.get(1), r.get(0))) {
      return null;
    }
    return ir.shapeExpr(l.get(0), r.get(1));
  }

  static @Nullable Type matmulType(Ir.Call call, DiagnosticContext context) {
    if (!checkArity(call, 2, context)) {
      return null;
    }
    final DynTensorType lhs = typeOf(call.args.get(0));
    final DynTensorType rhs = typeOf(call.args.get(1));
    if (lhs == null || rhs == null) {
      return null;
    }
    if (!lhs.isUnknownNdim() && lhs.ndim != 2
        || !rhs.isUnknownNdim() && rhs.ndim != 2) {
      context.emit(
          Diagnostic.error(call.pos, "operands of matmul must have rank 2"));
      return null;
    }
    final DType dtype = unifyDtype(call, lhs, rhs, context);
    return dtype == null ? null : DynTensorType.of(2, dtype);
  }

  static @Nullable Type uniqueType(Ir.Call call, DiagnosticContext context) {
    if (!checkArity(call, 1, context)) {
      return null;
    }
    final DynTensorType type = typeOf(call.args.get(0));
    return type == null ? null : DynTensorType.of(1, type.dtype);
  }
}

// End BuiltIn.java
