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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.type.DynTensorType;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds IR nodes. */
public enum IrBuilder {
  /**
   * The singleton instance of the IR builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ir;

  /** Interned operators, keyed by name. */
  private final Map<String, Ir.Op> ops = new ConcurrentHashMap<>();

  /** Creates a variable identity. Each call returns a distinct identity,
   * even if the name is the same. */
  public Ir.Id id(String name) {
    return new Ir.Id(name);
  }

  /** Creates a constant without annotations. */
  public Ir.Constant constant(Object value) {
    return new Ir.Constant(Pos.ZERO, value);
  }

  /** Creates a constant tensor of a given type and shape. */
  public Ir.Constant constant(Object value, DynTensorType type,
      Ir.ShapeExpr shape) {
    final Ir.Constant constant = new Ir.Constant(Pos.ZERO, value);
    constant.setCheckedType(type);
    constant.setShape(shape);
    return constant;
  }

  /** Creates a tuple. */
  public Ir.Tuple tuple(Ir.Expr... fields) {
    return tuple(Arrays.asList(fields));
  }

  /** Creates a tuple. */
  public Ir.Tuple tuple(List<? extends Ir.Expr> fields) {
    return new Ir.Tuple(Pos.ZERO, ImmutableList.copyOf(fields));
  }

  /** Creates a variable with a fresh identity and no annotations. */
  public Ir.Var var(String name) {
    return var(id(name), null, null);
  }

  /** Creates a variable with a fresh identity. */
  public Ir.Var var(String name, Ir.@Nullable Expr shape,
      @Nullable Type type) {
    return var(id(name), shape, type);
  }

  /** Creates a variable with a given identity. */
  public Ir.Var var(Ir.Id vid, Ir.@Nullable Expr shape, @Nullable Type type) {
    return new Ir.Var(Pos.ZERO, vid, shape, type);
  }

  /** Creates a dataflow variable with a fresh identity and no
   * annotations. */
  public Ir.DataflowVar dataflowVar(String name) {
    return dataflowVar(id(name), null, null);
  }

  /** Creates a dataflow variable with a fresh identity. */
  public Ir.DataflowVar dataflowVar(String name, Ir.@Nullable Expr shape,
      @Nullable Type type) {
    return dataflowVar(id(name), shape, type);
  }

  /** Creates a dataflow variable with a given identity. */
  public Ir.DataflowVar dataflowVar(Ir.Id vid, Ir.@Nullable Expr shape,
      @Nullable Type type) {
    return new Ir.DataflowVar(Pos.ZERO, vid, shape, type);
  }

  /** Creates a variable of the same kind, identity and position as a given
   * variable, carrying the same cached annotations but no declared
   * annotations. Callers then overwrite the annotations that changed. */
  public Ir.Var varLike(Ir.Var var) {
    final Ir.Var newVar = var.isDataflow()
        ? new Ir.DataflowVar(var.pos, var.vid, null, null)
        : new Ir.Var(var.pos, var.vid, null, null);
    newVar.setShape(var.shape());
    newVar.setCheckedType(var.checkedType());
    return newVar;
  }

  /** Creates a shape. */
  public Ir.ShapeExpr shapeExpr(PrimExpr... values) {
    return shapeExpr(Arrays.asList(values));
  }

  /** Creates a shape. */
  public Ir.ShapeExpr shapeExpr(List<? extends PrimExpr> values) {
    return new Ir.ShapeExpr(Pos.ZERO, ImmutableList.copyOf(values));
  }

  /** Creates a shape whose dimensions are all constant. */
  public Ir.ShapeExpr shapeOf(long... dims) {
    final ImmutableList.Builder<PrimExpr> values = ImmutableList.builder();
    for (long dim : dims) {
      values.add(PrimExpr.of(dim));
    }
    return new Ir.ShapeExpr(Pos.ZERO, values.build());
  }

  /** Creates a shape that is computed at run time. */
  public Ir.RuntimeDepShape runtimeDepShape() {
    return new Ir.RuntimeDepShape(Pos.ZERO);
  }

  /** Creates a reference to an external function. */
  public Ir.ExternFunc externFunc(String globalSymbol) {
    return new Ir.ExternFunc(Pos.ZERO, globalSymbol);
  }

  /** Creates a reference to a global function. */
  public Ir.GlobalVar globalVar(String nameHint) {
    return new Ir.GlobalVar(Pos.ZERO, nameHint);
  }

  /** Creates an anonymous function. */
  public Ir.Function function(List<? extends Ir.Var> params, Ir.Expr body,
      @Nullable Type retType) {
    return function(null, params, body, retType);
  }

  /** Creates a function. */
  public Ir.Function function(@Nullable String name,
      List<? extends Ir.Var> params, Ir.Expr body, @Nullable Type retType) {
    return new Ir.Function(Pos.ZERO, ImmutableList.copyOf(params), body,
        retType, name);
  }

  /** Returns the operator with a given name, creating it if necessary.
   * Operators are interned, so two calls with the same name return the
   * same object. */
  public Ir.Op op(String name) {
    return ops.computeIfAbsent(name, Ir.Op::new);
  }

  /** Creates a call to a named operator. */
  public Ir.Call call(String opName, Ir.Expr... args) {
    return call(op(opName), Arrays.asList(args));
  }

  /** Creates a call. */
  public Ir.Call call(Ir.Expr op, Ir.Expr... args) {
    return call(op, Arrays.asList(args));
  }

  /** Creates a call. */
  public Ir.Call call(Ir.Expr op, List<? extends Ir.Expr> args) {
    return call(op, args, ImmutableMap.of(), ImmutableList.of());
  }

  /** Creates a call with attributes and type arguments. */
  public Ir.Call call(Ir.Expr op, List<? extends Ir.Expr> args,
      Map<String, ?> attrs, List<? extends Type> typeArgs) {
    return new Ir.Call(Pos.ZERO, op, ImmutableList.copyOf(args),
        ImmutableMap.copyOf(attrs), ImmutableList.copyOf(typeArgs));
  }

  /** Creates a sequence expression. */
  public Ir.SeqExpr seqExpr(List<? extends Ir.BindingBlock> blocks,
      Ir.Expr body) {
    return new Ir.SeqExpr(Pos.ZERO, ImmutableList.copyOf(blocks), body);
  }

  /** Creates a conditional expression. */
  public Ir.If ifThenElse(Ir.Expr cond, Ir.Expr trueBranch,
      Ir.Expr falseBranch) {
    return new Ir.If(Pos.ZERO, cond, trueBranch, falseBranch);
  }

  /** Creates an access to the {@code index}th field of a tuple. */
  public Ir.TupleGetItem tupleGetItem(Ir.Expr tuple, int index) {
    return new Ir.TupleGetItem(Pos.ZERO, tuple, index);
  }

  /** Creates a binding of a variable to a value. */
  public Ir.VarBinding varBinding(Ir.Var var, Ir.Expr value) {
    return new Ir.VarBinding(Pos.ZERO, var, value);
  }

  /** Creates a match-shape binding. */
  public Ir.MatchShape matchShape(Ir.Expr value,
      List<? extends PrimExpr> pattern, Ir.Var var) {
    return new Ir.MatchShape(Pos.ZERO, value, ImmutableList.copyOf(pattern),
        var);
  }

  /** Creates an ordinary binding block. */
  public Ir.BindingBlock bindingBlock(List<? extends Ir.Binding> bindings) {
    return bindingBlock(bindings, false);
  }

  /** Creates a dataflow block. */
  public Ir.DataflowBlock dataflowBlock(List<? extends Ir.Binding> bindings) {
    return new Ir.DataflowBlock(Pos.ZERO, ImmutableList.copyOf(bindings));
  }

  /** Creates a dataflow block or an ordinary binding block. */
  public Ir.BindingBlock bindingBlock(List<? extends Ir.Binding> bindings,
      boolean dataflow) {
    return dataflow
        ? dataflowBlock(bindings)
        : new Ir.BindingBlock(Pos.ZERO, ImmutableList.copyOf(bindings));
  }
}

// End IrBuilder.java
