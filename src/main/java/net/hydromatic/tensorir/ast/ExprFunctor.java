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
package net.hydromatic.tensorir.ast;

import static java.util.Objects.requireNonNull;

/**
 * Calls a handler chosen by the kind of an expression.
 *
 * <p>Each of the fourteen kinds of {@link Ir.Expr} has a handler,
 * {@code visit}, that receives the expression and an extra argument of type
 * {@code A}. The expression chooses its handler in
 * {@link Ir.Expr#accept(ExprFunctor, Object)}, so the choice is made by the
 * virtual-method table of the concrete functor class; there are no casts.
 *
 * <p>Every handler defaults to {@link #visitExprDefault}, which throws.
 * Sub-classes override the handlers for the kinds they support.
 *
 * @param <R> Result type
 * @param <A> Type of the argument passed to each handler
 */
public abstract class ExprFunctor<R, A> {
  /** Calls the handler for the kind of {@code expr}. */
  public R visitExpr(Ir.Expr expr, A arg) {
    requireNonNull(expr,
        "found null node while traversing IR; "
            + "the previous transformation produced invalid structure");
    return expr.accept(this, arg);
  }

  protected R visit(Ir.Constant constant, A arg) {
    return visitExprDefault(constant, arg);
  }

  protected R visit(Ir.Tuple tuple, A arg) {
    return visitExprDefault(tuple, arg);
  }

  protected R visit(Ir.Var var, A arg) {
    return visitExprDefault(var, arg);
  }

  protected R visit(Ir.DataflowVar var, A arg) {
    return visitExprDefault(var, arg);
  }

  protected R visit(Ir.ShapeExpr shapeExpr, A arg) {
    return visitExprDefault(shapeExpr, arg);
  }

  protected R visit(Ir.RuntimeDepShape runtimeDepShape, A arg) {
    return visitExprDefault(runtimeDepShape, arg);
  }

  protected R visit(Ir.ExternFunc externFunc, A arg) {
    return visitExprDefault(externFunc, arg);
  }

  protected R visit(Ir.GlobalVar globalVar, A arg) {
    return visitExprDefault(globalVar, arg);
  }

  protected R visit(Ir.Function function, A arg) {
    return visitExprDefault(function, arg);
  }

  protected R visit(Ir.Call call, A arg) {
    return visitExprDefault(call, arg);
  }

  protected R visit(Ir.SeqExpr seqExpr, A arg) {
    return visitExprDefault(seqExpr, arg);
  }

  protected R visit(Ir.If ifThenElse, A arg) {
    return visitExprDefault(ifThenElse, arg);
  }

  protected R visit(Ir.Op op, A arg) {
    return visitExprDefault(op, arg);
  }

  protected R visit(Ir.TupleGetItem tupleGetItem, A arg) {
    return visitExprDefault(tupleGetItem, arg);
  }

  /** Called for a kind that has no handler. */
  protected R visitExprDefault(Ir.Expr expr, A arg) {
    throw new UnsupportedOperationException("do not have a default for "
        + expr.kind + " in " + getClass().getName());
  }
}

// End ExprFunctor.java
