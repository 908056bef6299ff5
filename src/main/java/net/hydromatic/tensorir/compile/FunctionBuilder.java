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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensorir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds a function in normal form, statement by statement.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * FunctionBuilder fb = FunctionBuilder.create(builder, "f");
 * Ir.Var x = fb.param("x", ir.shapeOf(2, 3), DynTensorType.of(2, FLOAT32));
 * List&lt;Ir.Var&gt; outputs = new ArrayList&lt;&gt;();
 * fb.dataflow(b -&gt;
 *     outputs.add(b.output(b.emit(BuiltIn.ADD.call(x, x)), "y")));
 * Ir.Function f = fb.build(outputs.get(0));
 * </pre></blockquote>
 *
 * <p>builds a function whose body is a dataflow block binding
 * {@code %lv = add(%x, %x)} and {@code %y = %lv}, followed by {@code %y}.
 * Bindings emitted outside {@link #dataflow} go into ordinary binding
 * blocks.
 */
public class FunctionBuilder {
  private final BlockBuilder builder;
  private final @Nullable String name;
  private final List<Ir.Var> params = new ArrayList<>();
  private final List<Ir.BindingBlock> blocks = new ArrayList<>();
  private @Nullable Type retType;
  private int branchDepth;
  private boolean built;

  private FunctionBuilder(BlockBuilder builder, @Nullable String name) {
    this.builder = requireNonNull(builder, "builder");
    this.name = name;
    builder.beginBindingBlock();
  }

  /** Creates a FunctionBuilder that emits bindings into a given block
   * builder. */
  public static FunctionBuilder create(BlockBuilder builder,
      @Nullable String name) {
    return new FunctionBuilder(builder, name);
  }

  /** Declares a parameter, and returns its variable. */
  public Ir.Var param(String name, Ir.@Nullable Expr shape,
      @Nullable Type type) {
    checkState(!built, "function has been built");
    final Ir.Var var = ir.var(name, shape, type);
    params.add(var);
    builder.declareParams(ImmutableList.of(var));
    return var;
  }

  /** Sets the return type. */
  public FunctionBuilder retType(@Nullable Type retType) {
    this.retType = retType;
    return this;
  }

  /** Binds a value to a new variable in the current block. */
  public Ir.Var emit(Ir.Expr value) {
    return builder.emit(value);
  }

  /** Binds a value to a new variable in the current block. */
  public Ir.Var emit(Ir.Expr value, String nameHint) {
    return builder.emit(value, nameHint);
  }

  /** Binds a new variable by matching a pattern against the shape of a
   * value. */
  public Ir.Var emitMatchShape(Ir.Expr value, List<PrimExpr> pattern) {
    return builder.emitMatchShape(value, pattern);
  }

  /** Binds a value computed in the current dataflow block to a variable
   * that is visible after the block. */
  public Ir.Var output(Ir.Expr value) {
    return builder.emitOutput(value);
  }

  /** Binds a value computed in the current dataflow block to a variable
   * that is visible after the block. */
  public Ir.Var output(Ir.Expr value, String nameHint) {
    return builder.emitOutput(value, nameHint);
  }

  /** Builds a dataflow block whose bindings are emitted by {@code body}.
   * The body calls {@link #output} to make values visible after the
   * block. */
  public FunctionBuilder dataflow(Consumer<FunctionBuilder> body) {
    checkState(!built, "function has been built");
    checkState(branchDepth == 0,
        "dataflow block must be at the top level of a function");
    finishOrdinaryBlock();
    try {
      blocks.add(builder.withDataflowBlock(b -> body.accept(this)));
    } finally {
      builder.beginBindingBlock();
    }
    return this;
  }

  /** Binds a conditional to a new variable. Each branch is built in its own
   * scope by a function that emits bindings and returns the branch's
   * value. */
  public Ir.Var ifThenElse(Ir.Expr cond,
      Function<FunctionBuilder, Ir.Expr> thenBody,
      Function<FunctionBuilder, Ir.Expr> elseBody) {
    final Ir.Expr trueBranch = branch(thenBody);
    final Ir.Expr falseBranch = branch(elseBody);
    return builder.emit(ir.ifThenElse(cond, trueBranch, falseBranch));
  }

  private Ir.Expr branch(Function<FunctionBuilder, Ir.Expr> body) {
    ++branchDepth;
    final Ir.Expr[] result = {null};
    try {
      final Ir.BindingBlock block =
          builder.withBindingBlock(b -> result[0] = body.apply(this));
      final Ir.Expr value = requireNonNull(result[0], "branch value");
      return block.bindings.isEmpty()
          ? value
          : ir.seqExpr(ImmutableList.of(block), value);
    } finally {
      --branchDepth;
    }
  }

  private void finishOrdinaryBlock() {
    final Ir.BindingBlock block = builder.endBlock();
    if (!block.bindings.isEmpty()) {
      blocks.add(block);
    }
  }

  /** Finishes the function, whose body is the blocks built so far followed
   * by {@code ret}. */
  public Ir.Function build(Ir.Expr ret) {
    checkState(!built, "function has been built");
    finishOrdinaryBlock();
    built = true;
    return ir.function(name, params, ir.seqExpr(blocks, ret), retType);
  }
}

// End FunctionBuilder.java
