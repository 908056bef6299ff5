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

import com.google.common.collect.Sets;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.type.Type;

/** Visits IR trees.
 *
 * <p>By default, each handler visits the immediate children of a node, in
 * order. The places where a variable is defined (function parameters, and
 * the left side of bindings) are visited by {@link #visitVarDef}; the
 * expression handlers for {@link Ir.Var} and {@link Ir.DataflowVar} see only
 * the places where a variable is used. */
public class ExprVisitor extends ExprFunctor<Void, Void> {
  /** Visits an expression. Handlers call this method to visit their
   * children, so sub-classes may override it to act on every
   * expression. */
  public void visitExpr(Ir.Expr expr) {
    visitExpr(expr, null);
  }

  /** Visits each sub-expression of {@code expr}, children before parents,
   * and calls {@code consumer} once for each distinct node. */
  public static void postOrderVisit(Ir.Expr expr,
      Consumer<Ir.Expr> consumer) {
    requireNonNull(consumer, "consumer");
    final Set<Ir.Expr> visited = Sets.newIdentityHashSet();
    new ExprVisitor() {
      @Override
      public void visitExpr(Ir.Expr e) {
        if (visited.add(e)) {
          super.visitExpr(e);
          consumer.accept(e);
        }
      }
    }.visitExpr(expr);
  }

  // bridges from the functor's handlers

  @Override
  protected final Void visit(Ir.Constant constant, Void unused) {
    visit(constant);
    return null;
  }

  @Override
  protected final Void visit(Ir.Tuple tuple, Void unused) {
    visit(tuple);
    return null;
  }

  @Override
  protected final Void visit(Ir.Var var, Void unused) {
    visit(var);
    return null;
  }

  @Override
  protected final Void visit(Ir.DataflowVar var, Void unused) {
    visit(var);
    return null;
  }

  @Override
  protected final Void visit(Ir.ShapeExpr shapeExpr, Void unused) {
    visit(shapeExpr);
    return null;
  }

  @Override
  protected final Void visit(Ir.RuntimeDepShape runtimeDepShape,
      Void unused) {
    visit(runtimeDepShape);
    return null;
  }

  @Override
  protected final Void visit(Ir.ExternFunc externFunc,
      Void unused) {
    visit(externFunc);
    return null;
  }

  @Override
  protected final Void visit(Ir.GlobalVar globalVar, Void unused) {
    visit(globalVar);
    return null;
  }

  @Override
  protected final Void visit(Ir.Function function, Void unused) {
    visit(function);
    return null;
  }

  @Override
  protected final Void visit(Ir.Call call, Void unused) {
    visit(call);
    return null;
  }

  @Override
  protected final Void visit(Ir.SeqExpr seqExpr, Void unused) {
    visit(seqExpr);
    return null;
  }

  @Override
  protected final Void visit(Ir.If ifThenElse, Void unused) {
    visit(ifThenElse);
    return null;
  }

  @Override
  protected final Void visit(Ir.Op op, Void unused) {
    visit(op);
    return null;
  }

  @Override
  protected final Void visit(Ir.TupleGetItem tupleGetItem,
      Void unused) {
    visit(tupleGetItem);
    return null;
  }

  // expressions

  protected void visit(Ir.Constant constant) {
    visitSpan(constant.pos);
  }

  protected void visit(Ir.Tuple tuple) {
    visitSpan(tuple.pos);
    tuple.fields.forEach(this::visitExpr);
  }

  protected void visit(Ir.Var var) {
    visitSpan(var.pos);
  }

  protected void visit(Ir.DataflowVar var) {
    visitSpan(var.pos);
  }

  protected void visit(Ir.ShapeExpr shapeExpr) {
    visitSpan(shapeExpr.pos);
    shapeExpr.values.forEach(this::visitPrimExpr);
  }

  protected void visit(Ir.RuntimeDepShape runtimeDepShape) {
    visitSpan(runtimeDepShape.pos);
  }

  protected void visit(Ir.ExternFunc externFunc) {
    visitSpan(externFunc.pos);
  }

  protected void visit(Ir.GlobalVar globalVar) {
    visitSpan(globalVar.pos);
  }

  protected void visit(Ir.Function function) {
    visitSpan(function.pos);
    function.params.forEach(this::visitVarDef);
    visitExpr(function.body);
    if (function.retType != null) {
      visitType(function.retType);
    }
  }

  protected void visit(Ir.Call call) {
    visitSpan(call.pos);
    visitExpr(call.op);
    call.args.forEach(this::visitExpr);
    call.typeArgs.forEach(this::visitType);
  }

  protected void visit(Ir.SeqExpr seqExpr) {
    visitSpan(seqExpr.pos);
    seqExpr.blocks.forEach(this::visitBindingBlock);
    visitExpr(seqExpr.body);
  }

  protected void visit(Ir.If ifThenElse) {
    visitSpan(ifThenElse.pos);
    visitExpr(ifThenElse.cond);
    visitExpr(ifThenElse.trueBranch);
    visitExpr(ifThenElse.falseBranch);
  }

  protected void visit(Ir.Op op) {
    visitSpan(op.pos);
  }

  protected void visit(Ir.TupleGetItem tupleGetItem) {
    visitSpan(tupleGetItem.pos);
    visitExpr(tupleGetItem.tuple);
  }

  // bindings

  /** Calls the handler for the kind of {@code binding}. */
  public void visitBinding(Ir.Binding binding) {
    switch (binding.kind) {
    case VAR_BINDING:
      visit((Ir.VarBinding) binding);
      break;
    case MATCH_SHAPE:
      visit((Ir.MatchShape) binding);
      break;
    default:
      throw new AssertionError("unexpected " + binding.kind);
    }
  }

  protected void visit(Ir.VarBinding binding) {
    visitExpr(binding.value);
    visitVarDef(binding.var);
  }

  protected void visit(Ir.MatchShape binding) {
    visitExpr(binding.value);
    binding.pattern.forEach(this::visitPrimExpr);
    visitVarDef(binding.var);
  }

  // blocks

  /** Calls the handler for the kind of {@code block}. */
  public void visitBindingBlock(Ir.BindingBlock block) {
    switch (block.kind) {
    case BINDING_BLOCK:
      visitOrdinaryBlock(block);
      break;
    case DATAFLOW_BLOCK:
      visitDataflowBlock((Ir.DataflowBlock) block);
      break;
    default:
      throw new AssertionError("unexpected " + block.kind);
    }
  }

  protected void visitOrdinaryBlock(Ir.BindingBlock block) {
    block.bindings.forEach(this::visitBinding);
  }

  protected void visitDataflowBlock(Ir.DataflowBlock block) {
    block.bindings.forEach(this::visitBinding);
  }

  // variable definitions

  /** Calls the handler for the place where {@code var} is defined. */
  public void visitVarDef(Ir.Var var) {
    if (var.kind == Kind.DATAFLOW_VAR) {
      visitDataflowVarDef((Ir.DataflowVar) var);
    } else {
      visitOrdinaryVarDef(var);
    }
  }

  protected void visitOrdinaryVarDef(Ir.Var var) {
    visitSpan(var.pos);
  }

  protected void visitDataflowVarDef(Ir.DataflowVar var) {
    visitSpan(var.pos);
  }

  // metadata

  /** Visits a type that appears in the tree. Default does nothing. */
  protected void visitType(Type type) {}

  /** Visits a dimension of a shape. Default does nothing. */
  protected void visitPrimExpr(PrimExpr primExpr) {}

  /** Visits the position of a node. Default does nothing. */
  protected void visitSpan(Pos pos) {}
}

// End ExprVisitor.java
