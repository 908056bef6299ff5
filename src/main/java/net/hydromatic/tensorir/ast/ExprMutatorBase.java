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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensorir.type.Type;

/** Visits and transforms IR trees that are not necessarily in normal form.
 *
 * <p>The tree may contain nested compound expressions, and the shape and
 * type annotations may be missing. Each handler rebuilds its node from the
 * transformed children, and returns the original node if no child
 * changed.
 *
 * <p>This class keeps no scope, substitution or construction state; see
 * {@code ExprMutator} for a transformer that keeps the tree in normal
 * form. */
public class ExprMutatorBase extends ExprFunctor<Ir.Expr, Void> {
  /** Transforms an expression. Handlers call this method to transform their
   * children, so sub-classes may override it to act on every
   * expression. */
  public Ir.Expr visitExpr(Ir.Expr expr) {
    return visitExpr(expr, null);
  }

  protected List<Ir.Expr> visitList(List<Ir.Expr> exprs) {
    final List<Ir.Expr> list = new ArrayList<>(exprs.size());
    for (Ir.Expr expr : exprs) {
      list.add(visitExpr(expr));
    }
    return list;
  }

  protected List<Type> visitTypes(List<Type> types) {
    final List<Type> list = new ArrayList<>(types.size());
    for (Type type : types) {
      list.add(visitType(type));
    }
    return list;
  }

  // bridges from the functor's handlers

  @Override
  protected final Ir.Expr visit(Ir.Constant constant, Void unused) {
    return visit(constant);
  }

  @Override
  protected final Ir.Expr visit(Ir.Tuple tuple, Void unused) {
    return visit(tuple);
  }

  @Override
  protected final Ir.Expr visit(Ir.Var var, Void unused) {
    return visit(var);
  }

  @Override
  protected final Ir.Expr visit(Ir.DataflowVar var, Void unused) {
    return visit(var);
  }

  @Override
  protected final Ir.Expr visit(Ir.ShapeExpr shapeExpr, Void unused) {
    return visit(shapeExpr);
  }

  @Override
  protected final Ir.Expr visit(Ir.RuntimeDepShape runtimeDepShape,
      Void unused) {
    return visit(runtimeDepShape);
  }

  @Override
  protected final Ir.Expr visit(Ir.ExternFunc externFunc, Void unused) {
    return visit(externFunc);
  }

  @Override
  protected final Ir.Expr visit(Ir.GlobalVar globalVar, Void unused) {
    return visit(globalVar);
  }

  @Override
  protected final Ir.Expr visit(Ir.Function function, Void unused) {
    return visit(function);
  }

  @Override
  protected final Ir.Expr visit(Ir.Call call, Void unused) {
    return visit(call);
  }

  @Override
  protected final Ir.Expr visit(Ir.SeqExpr seqExpr, Void unused) {
    return visit(seqExpr);
  }

  @Override
  protected final Ir.Expr visit(Ir.If ifThenElse, Void unused) {
    return visit(ifThenElse);
  }

  @Override
  protected final Ir.Expr visit(Ir.Op op, Void unused) {
    return visit(op);
  }

  @Override
  protected final Ir.Expr visit(Ir.TupleGetItem tupleGetItem, Void unused) {
    return visit(tupleGetItem);
  }

  // leaves

  protected Ir.Expr visit(Ir.Constant constant) {
    return constant; // leaf
  }

  protected Ir.Expr visit(Ir.Var var) {
    return var; // leaf
  }

  protected Ir.Expr visit(Ir.DataflowVar var) {
    return var; // leaf
  }

  protected Ir.Expr visit(Ir.ShapeExpr shapeExpr) {
    return shapeExpr; // leaf
  }

  protected Ir.Expr visit(Ir.RuntimeDepShape runtimeDepShape) {
    return runtimeDepShape; // leaf
  }

  protected Ir.Expr visit(Ir.ExternFunc externFunc) {
    return externFunc; // leaf
  }

  protected Ir.Expr visit(Ir.GlobalVar globalVar) {
    return globalVar; // leaf
  }

  protected Ir.Expr visit(Ir.Op op) {
    return op; // leaf
  }

  // compound expressions

  protected Ir.Expr visit(Ir.Tuple tuple) {
    return tuple.copy(visitList(tuple.fields));
  }

  protected Ir.Expr visit(Ir.Function function) {
    final Type retType =
        function.retType == null ? null : visitType(function.retType);
    return function.copy(function.params, visitExpr(function.body), retType);
  }

  protected Ir.Expr visit(Ir.Call call) {
    return call.copy(visitExpr(call.op), visitList(call.args),
        visitTypes(call.typeArgs));
  }

  protected Ir.Expr visit(Ir.SeqExpr seqExpr) {
    final List<Ir.BindingBlock> blocks = new ArrayList<>();
    for (Ir.BindingBlock block : seqExpr.blocks) {
      blocks.add(visitBindingBlock(block));
    }
    return seqExpr.copy(blocks, visitExpr(seqExpr.body));
  }

  protected Ir.Expr visit(Ir.If ifThenElse) {
    return ifThenElse.copy(visitExpr(ifThenElse.cond),
        visitExpr(ifThenElse.trueBranch),
        visitExpr(ifThenElse.falseBranch));
  }

  protected Ir.Expr visit(Ir.TupleGetItem tupleGetItem) {
    return tupleGetItem.copy(visitExpr(tupleGetItem.tuple));
  }

  // blocks

  /** Transforms a binding block, transforming the value of each binding.
   * Variables are not renamed. */
  public Ir.BindingBlock visitBindingBlock(Ir.BindingBlock block) {
    final List<Ir.Binding> bindings = new ArrayList<>();
    for (Ir.Binding binding : block.bindings) {
      switch (binding.kind) {
      case VAR_BINDING:
        final Ir.VarBinding varBinding = (Ir.VarBinding) binding;
        bindings.add(
            varBinding.copy(varBinding.var, visitExpr(varBinding.value)));
        break;
      case MATCH_SHAPE:
        final Ir.MatchShape matchShape = (Ir.MatchShape) binding;
        bindings.add(
            matchShape.copy(visitExpr(matchShape.value), matchShape.pattern,
                matchShape.var));
        break;
      default:
        throw new AssertionError("unexpected " + binding.kind);
      }
    }
    return block.copy(bindings);
  }

  // types

  /** Transforms a type that appears in the tree, such as the return type of
   * a function or a type argument of a call. Default returns the type
   * unchanged; sub-classes may apply a
   * {@link net.hydromatic.tensorir.type.TypeShuttle}. */
  protected Type visitType(Type type) {
    return type;
  }
}

// End ExprMutatorBase.java
