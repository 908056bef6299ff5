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

import java.util.List;
import net.hydromatic.tensorir.arith.PrimExpr;

/** Writes IR nodes as text, for debugging.
 *
 * <p>For example, a function that adds its argument to itself inside a
 * dataflow block is written
 *
 * <blockquote><pre>
 * fn @f(%x) {
 *   dataflow { %lv = add(%x, %x); %gv = %lv };
 *   %gv }
 * </pre></blockquote>
 *
 * <p>but on one line. */
public class IrWriter extends ExprFunctor<IrWriter, Void> {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  private IrWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Writes an expression. */
  public IrWriter expr(Ir.Expr expr) {
    return visitExpr(expr, null);
  }

  private IrWriter exprs(List<? extends Ir.Expr> exprs) {
    for (int i = 0; i < exprs.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      expr(exprs.get(i));
    }
    return this;
  }

  private IrWriter dims(List<PrimExpr> dims) {
    for (int i = 0; i < dims.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      append(dims.get(i).toString());
    }
    return this;
  }

  /** Writes a variable where it is defined, with its type. */
  private IrWriter varDef(Ir.Var var) {
    append("%").append(var.name());
    if (var.checkedType() != null) {
      append(": ").append(var.checkedType().moniker());
    }
    return this;
  }

  /** Writes a binding. */
  public IrWriter binding(Ir.Binding binding) {
    varDef(binding.var).append(" = ");
    if (binding.kind == Kind.MATCH_SHAPE) {
      final Ir.MatchShape matchShape = (Ir.MatchShape) binding;
      return append("match_shape(").expr(matchShape.value).append(", [")
          .dims(matchShape.pattern).append("])");
    }
    return expr(binding.value());
  }

  /** Writes a block. */
  public IrWriter block(Ir.BindingBlock block) {
    if (block.isDataflow()) {
      append("dataflow { ");
    }
    for (int i = 0; i < block.bindings.size(); i++) {
      if (i > 0) {
        append("; ");
      }
      binding(block.bindings.get(i));
    }
    if (block.isDataflow()) {
      append(" }");
    }
    return this;
  }

  @Override
  protected IrWriter visit(Ir.Constant constant, Void unused) {
    return append("const(").append(String.valueOf(constant.value))
        .append(")");
  }

  @Override
  protected IrWriter visit(Ir.Tuple tuple, Void unused) {
    return append("(").exprs(tuple.fields).append(")");
  }

  @Override
  protected IrWriter visit(Ir.Var var, Void unused) {
    return append("%").append(var.name());
  }

  @Override
  protected IrWriter visit(Ir.DataflowVar var, Void unused) {
    return append("%").append(var.name());
  }

  @Override
  protected IrWriter visit(Ir.ShapeExpr shapeExpr, Void unused) {
    return append("shape(").dims(shapeExpr.values).append(")");
  }

  @Override
  protected IrWriter visit(Ir.RuntimeDepShape runtimeDepShape, Void unused) {
    return append("RuntimeDepShape()");
  }

  @Override
  protected IrWriter visit(Ir.ExternFunc externFunc, Void unused) {
    return append("extern(\"").append(externFunc.globalSymbol).append("\")");
  }

  @Override
  protected IrWriter visit(Ir.GlobalVar globalVar, Void unused) {
    return append("@").append(globalVar.nameHint);
  }

  @Override
  protected IrWriter visit(Ir.Function function, Void unused) {
    append("fn ");
    if (function.name != null) {
      append("@").append(function.name);
    }
    append("(");
    for (int i = 0; i < function.params.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      varDef(function.params.get(i));
    }
    append(")");
    if (function.retType != null) {
      append(" -> ").append(function.retType.moniker());
    }
    return append(" { ").expr(function.body).append(" }");
  }

  @Override
  protected IrWriter visit(Ir.Call call, Void unused) {
    if (call.op.kind == Kind.OP) {
      append(((Ir.Op) call.op).name);
    } else {
      expr(call.op);
    }
    return append("(").exprs(call.args).append(")");
  }

  @Override
  protected IrWriter visit(Ir.SeqExpr seqExpr, Void unused) {
    append("{ ");
    for (Ir.BindingBlock block : seqExpr.blocks) {
      block(block).append("; ");
    }
    return expr(seqExpr.body).append(" }");
  }

  @Override
  protected IrWriter visit(Ir.If ifThenElse, Void unused) {
    return append("if (").expr(ifThenElse.cond).append(") ")
        .expr(ifThenElse.trueBranch).append(" else ")
        .expr(ifThenElse.falseBranch);
  }

  @Override
  protected IrWriter visit(Ir.Op op, Void unused) {
    return append(op.name);
  }

  @Override
  protected IrWriter visit(Ir.TupleGetItem tupleGetItem, Void unused) {
    return expr(tupleGetItem.tuple).append(".")
        .append(Integer.toString(tupleGetItem.index));
  }
}

// End IrWriter.java
