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
import static net.hydromatic.tensorir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.tensorir.ast.ExprMutatorBase;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms IR trees in normal form, keeping them in normal form.
 *
 * <p>The bindings of each block are re-emitted through a
 * {@link BlockBuilder}, so that a compound value produced by the rewrite is
 * bound to a variable rather than nested in its parent. The body of a
 * function and each branch of an {@code If} are rewritten in a new scope; if
 * the rewrite emits bindings there, the result is wrapped in a
 * {@link Ir.SeqExpr}.
 *
 * <p>When the rewrite of a variable definition yields a different variable
 * (for example, with a more precise shape), later uses of the variable are
 * replaced by the new one.
 */
public class ExprMutator extends ExprMutatorBase {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ExprMutator.class);

  protected final BlockBuilder builder;
  private final Map<Ir.Id, Ir.Var> varRemap = new HashMap<>();
  private final boolean normalizeArguments;

  /** Creates an ExprMutator with a new builder. */
  public ExprMutator() {
    this(BlockBuilder.create());
  }

  /** Creates an ExprMutator that emits bindings into a given builder. */
  public ExprMutator(BlockBuilder builder) {
    this.builder = requireNonNull(builder, "builder");
    this.normalizeArguments =
        Prop.NORMALIZE_ARGUMENTS.booleanValue(builder.props());
  }

  public BlockBuilder builder() {
    return builder;
  }

  /** Transforms an expression, and infers the shape and type of the result
   * if it is a call. */
  @Override public Ir.Expr visitExpr(Ir.Expr expr) {
    return builder.normalize(super.visitExpr(expr));
  }

  /** Transforms an expression that is an argument of a compound expression.
   * If the result is itself compound and a block is being built, binds it
   * to a new variable and returns the variable. */
  protected Ir.Expr visitArgument(Ir.Expr expr) {
    final Ir.Expr e = visitExpr(expr);
    if (normalizeArguments
        && builder.hasActiveBlock()
        && !Ir.isLeafOrTuple(e)) {
      return builder.emit(e);
    }
    return e;
  }

  private List<Ir.Expr> visitArguments(List<Ir.Expr> exprs) {
    final List<Ir.Expr> list = new ArrayList<>(exprs.size());
    for (Ir.Expr expr : exprs) {
      list.add(visitArgument(expr));
    }
    return list;
  }

  // variable remapping

  /** Declares that uses of the variable whose identity is {@code vid}
   * are to be replaced by {@code var}. */
  public void setVarRemap(Ir.Id vid, Ir.Var var) {
    LOGGER.debug("remap {} to {}", vid, var);
    varRemap.put(vid, var);
  }

  /** Returns the variable that replaces uses of {@code vid}, or null. */
  public Ir.@Nullable Var getVarRemap(Ir.Id vid) {
    return varRemap.get(vid);
  }

  @Override protected Ir.Expr visit(Ir.Var var) {
    final Ir.Var v = varRemap.get(var.vid);
    return v != null ? v : var;
  }

  @Override protected Ir.Expr visit(Ir.DataflowVar var) {
    final Ir.Var v = varRemap.get(var.vid);
    return v != null ? v : var;
  }

  // compound expressions

  @Override protected Ir.Expr visit(Ir.Tuple tuple) {
    return tuple.copy(visitArguments(tuple.fields));
  }

  @Override protected Ir.Expr visit(Ir.Call call) {
    return call.copy(visitExpr(call.op), visitArguments(call.args),
        visitTypes(call.typeArgs));
  }

  @Override protected Ir.Expr visit(Ir.TupleGetItem tupleGetItem) {
    return tupleGetItem.copy(visitArgument(tupleGetItem.tuple));
  }

  @Override protected Ir.Expr visit(Ir.Function function) {
    final List<Ir.Var> params = new ArrayList<>();
    for (Ir.Var param : function.params) {
      params.add(visitVarDef(param));
    }
    builder.declareParams(params);
    final Type retType =
        function.retType == null ? null : visitType(function.retType);
    final Ir.Expr body = visitWithNewScope(function.body);
    return function.copy(params, body, retType);
  }

  @Override protected Ir.Expr visit(Ir.If ifThenElse) {
    final Ir.Expr cond = visitArgument(ifThenElse.cond);
    final Ir.Expr trueBranch = visitWithNewScope(ifThenElse.trueBranch);
    final Ir.Expr falseBranch = visitWithNewScope(ifThenElse.falseBranch);
    return ifThenElse.copy(cond, trueBranch, falseBranch);
  }

  /** Transforms a sequence. Each block is rebuilt by re-emitting its
   * bindings; blocks left empty are dropped. Bindings emitted while
   * transforming the body form a final block. */
  @Override protected Ir.Expr visit(Ir.SeqExpr seqExpr) {
    boolean unchanged = true;
    final List<Ir.BindingBlock> blocks = new ArrayList<>();
    for (Ir.BindingBlock block : seqExpr.blocks) {
      final Ir.BindingBlock newBlock = visitBindingBlock(block);
      if (!newBlock.bindings.isEmpty()) {
        blocks.add(newBlock);
      }
      unchanged &= newBlock == block;
    }
    builder.beginBindingBlock();
    final Ir.Expr body = visitExpr(seqExpr.body);
    final Ir.BindingBlock prologue = builder.endBlock();
    if (!prologue.bindings.isEmpty()) {
      blocks.add(prologue);
      unchanged = false;
    }
    if (unchanged && body == seqExpr.body) {
      return seqExpr;
    }
    return ir.seqExpr(blocks, body);
  }

  /** Transforms an expression in a new scope: the body of a function or a
   * branch of a conditional. If the transformation emits bindings, returns
   * a sequence of them followed by the transformed expression. */
  protected Ir.Expr visitWithNewScope(Ir.Expr expr) {
    builder.beginBindingBlock();
    final Ir.Expr e = visitExpr(expr);
    final Ir.BindingBlock prologue = builder.endBlock();
    if (prologue.bindings.isEmpty()) {
      return e;
    }
    return ir.seqExpr(ImmutableList.of(prologue), e);
  }

  /** Transforms a call and infers its shape and type, in one step.
   * Sub-classes that override {@link #visit(Ir.Call)} call this to get
   * the default transformation. */
  protected Ir.Expr visitPostOrder(Ir.Call call) {
    return builder.normalize(
        call.copy(visitExpr(call.op), visitArguments(call.args),
            visitTypes(call.typeArgs)));
  }

  /** Returns the value bound to a variable, or null if the variable is a
   * function parameter. */
  protected Ir.@Nullable Expr lookupBinding(Ir.Var var) {
    return builder.lookupBinding(var);
  }

  // blocks

  /** Transforms a binding block by re-emitting each of its bindings into a
   * new block of the same kind. Returns the original block if every
   * binding was re-emitted unchanged. */
  @Override public Ir.BindingBlock visitBindingBlock(Ir.BindingBlock block) {
    switch (block.kind) {
    case BINDING_BLOCK:
      return visitOrdinaryBlock(block);
    case DATAFLOW_BLOCK:
      return visitDataflowBlock((Ir.DataflowBlock) block);
    default:
      throw new AssertionError("unexpected " + block.kind);
    }
  }

  protected Ir.BindingBlock visitOrdinaryBlock(Ir.BindingBlock block) {
    builder.beginBindingBlock();
    for (Ir.Binding binding : block.bindings) {
      visitBinding(binding);
    }
    return block.copy(builder.endBlock().bindings);
  }

  protected Ir.BindingBlock visitDataflowBlock(Ir.DataflowBlock block) {
    builder.beginDataflowBlock();
    for (Ir.Binding binding : block.bindings) {
      visitBinding(binding);
    }
    return block.copy(builder.endBlock().bindings);
  }

  // bindings

  /** Transforms a binding, emitting the result into the current block. */
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
    final Ir.Expr value = visitExpr(binding.value);
    Ir.Var var = visitVarDef(binding.var);
    if (var == binding.var && value == binding.value) {
      emitBinding(binding);
      return;
    }
    final Ir.Var var2 = withShapeAndType(var, value.shape(),
        value.checkedType());
    if (var2 != var) {
      var = var2;
      setVarRemap(binding.var.vid, var);
    }
    emitBinding(ir.varBinding(var, value));
  }

  /** Emits a binding into the current block. An ordinary variable bound in a
   * dataflow block is emitted as an output. */
  private void emitBinding(Ir.VarBinding binding) {
    if (builder.currentBlockIsDataflow() && !binding.var.isDataflow()) {
      builder.emitOutput(binding);
    } else {
      builder.emit(binding);
    }
  }

  protected void visit(Ir.MatchShape binding) {
    final Ir.Expr value = visitExpr(binding.value);
    final Ir.Var var = visitVarDef(binding.var);
    final Ir.MatchShape newBinding =
        binding.copy(value, binding.pattern, var);
    if (builder.currentBlockIsDataflow() && var.isDataflow()) {
      // keeps the variable, and does not re-derive its type from the value
      builder.appendMatchShape(newBinding);
    } else {
      builder.emitMatchShape(newBinding);
    }
  }

  // variable definitions

  /** Transforms the definition of a variable, as a function parameter or on
   * the left side of a binding. Uses of the variable are transformed by
   * {@link #visit(Ir.Var)}. */
  public Ir.Var visitVarDef(Ir.Var var) {
    switch (var.kind) {
    case VAR:
      return visitOrdinaryVarDef(var);
    case DATAFLOW_VAR:
      return visitDataflowVarDef((Ir.DataflowVar) var);
    default:
      throw new AssertionError("unexpected " + var.kind);
    }
  }

  protected Ir.Var visitOrdinaryVarDef(Ir.Var var) {
    return rewriteVarDef(var);
  }

  protected Ir.Var visitDataflowVarDef(Ir.DataflowVar var) {
    return rewriteVarDef(var);
  }

  /** If the variable has a shape, transforms it; if the shape changes,
   * returns a variable with the same identity and the new shape. */
  private Ir.Var rewriteVarDef(Ir.Var var) {
    final Ir.Expr shape = var.shape();
    if (shape == null) {
      return var;
    }
    final Ir.Expr newShape = visitExpr(shape);
    if (newShape == shape) {
      return var;
    }
    final Ir.Var newVar = var.isDataflow()
        ? ir.dataflowVar(var.vid, newShape, var.typeAnnotation)
        : ir.var(var.vid, newShape, var.typeAnnotation);
    if (var.typeAnnotation == null) {
      newVar.setCheckedType(var.checkedType());
    }
    setVarRemap(var.vid, newVar);
    return newVar;
  }

  /** Returns a variable with the same identity as {@code var} carrying a
   * given shape and type, or {@code var} itself if they are the same as its
   * own. The shapes are compared using
   * {@link BlockBuilder#canProveShapeEqual}, the types structurally. A null
   * shape or type means "unknown" and leaves that annotation as it is. */
  public Ir.Var withShapeAndType(Ir.Var var, Ir.@Nullable Expr shape,
      @Nullable Type type) {
    final boolean shapeChanged =
        shape != null && !builder.canProveShapeEqual(var.shape(), shape);
    final boolean typeChanged =
        type != null && !Objects.equals(var.checkedType(), type);
    if (!shapeChanged && !typeChanged) {
      return var;
    }
    final Ir.Var newVar = ir.varLike(var);
    if (shapeChanged) {
      newVar.setShape(shape);
    }
    if (typeChanged) {
      newVar.setCheckedType(type);
    }
    return newVar;
  }
}

// End ExprMutator.java
