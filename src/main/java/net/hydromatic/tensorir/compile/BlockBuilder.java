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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensorir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.tensorir.arith.Analyzer;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.ast.Kind;
import net.hydromatic.tensorir.type.DynTensorType;
import net.hydromatic.tensorir.type.PrimitiveType;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds binding blocks in normal form, one binding at a time.
 *
 * <p>A builder has a stack of blocks under construction. {@link
 * #beginBindingBlock()} and {@link #beginDataflowBlock()} push a block,
 * the {@code emit} methods append bindings to the block on top of the stack,
 * and {@link #endBlock()} pops it and returns it as an immutable
 * {@link Ir.BindingBlock}.
 *
 * <p>Each variable the builder binds is recorded, with its value, in a table
 * that lives as long as the builder; see {@link #lookupVar(Ir.Var)}. The
 * names of the variables it creates are unique within its
 * {@link NameTable}.
 *
 * <p>When a call is emitted, the builder infers its shape and type using the
 * rules in its {@link OpRegistry}.
 *
 * <p>A builder is not thread-safe.
 */
public class BlockBuilder implements AutoCloseable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(BlockBuilder.class);

  private final Deque<BlockFrame> blockStack = new ArrayDeque<>();
  private final Map<Ir.Id, Ir.Expr> bindingTable = new HashMap<>();
  private final Set<Ir.Id> params = new HashSet<>();
  private final NameTable nameTable;
  private final OpRegistry opRegistry;
  private final Tracer tracer;
  private final DiagnosticContext diagnosticContext;
  private final ImmutableMap<Prop, Object> props;
  private final Analyzer analyzer = new Analyzer();

  /** Creates a BlockBuilder. */
  public BlockBuilder(NameTable nameTable, OpRegistry opRegistry,
      Tracer tracer, Map<Prop, Object> props) {
    this.nameTable = requireNonNull(nameTable, "nameTable");
    this.opRegistry = requireNonNull(opRegistry, "opRegistry");
    this.tracer = requireNonNull(tracer, "tracer");
    this.props = ImmutableMap.copyOf(props);
    this.diagnosticContext = new DiagnosticContext(tracer);
  }

  /** Creates a BlockBuilder with default properties, the built-in
   * operators, and its own name table. */
  public static BlockBuilder create() {
    return create(ImmutableMap.of());
  }

  /** Creates a BlockBuilder with given properties, the built-in operators,
   * and its own name table. */
  public static BlockBuilder create(Map<Prop, Object> props) {
    return new BlockBuilder(new NameTable(), OpRegistry.standard(),
        Tracers.empty(), props);
  }

  /** Creates a BlockBuilder that shares a name table with other builders,
   * so that the names they create do not collide. */
  public static BlockBuilder create(NameTable nameTable) {
    return new BlockBuilder(nameTable, OpRegistry.standard(),
        Tracers.empty(), ImmutableMap.of());
  }

  public NameTable nameTable() {
    return nameTable;
  }

  public OpRegistry opRegistry() {
    return opRegistry;
  }

  public DiagnosticContext diagnosticContext() {
    return diagnosticContext;
  }

  public ImmutableMap<Prop, Object> props() {
    return props;
  }

  // blocks

  /** Starts building a dataflow block. */
  public void beginDataflowBlock() {
    blockStack.push(new BlockFrame(true));
  }

  /** Starts building an ordinary binding block. */
  public void beginBindingBlock() {
    blockStack.push(new BlockFrame(false));
  }

  /** Finishes the block on top of the stack and returns it. Its bindings are
   * in the order they were emitted. */
  public Ir.BindingBlock endBlock() {
    final BlockFrame frame = currentFrame();
    final Ir.BindingBlock block =
        ir.bindingBlock(frame.bindings, frame.dataflow);
    blockStack.pop();
    LOGGER.debug("end block with {} bindings, depth {}",
        block.bindings.size(), blockStack.size());
    tracer.onEndBlock(block);
    return block;
  }

  /** Returns whether the block on top of the stack is a dataflow block. */
  public boolean currentBlockIsDataflow() {
    return currentFrame().dataflow;
  }

  /** Returns whether a block is being built. */
  public boolean hasActiveBlock() {
    return !blockStack.isEmpty();
  }

  /** Builds an ordinary binding block whose bindings are emitted by
   * {@code body}. The block is popped even if {@code body} throws. */
  public Ir.BindingBlock withBindingBlock(Consumer<BlockBuilder> body) {
    return withBlock(false, body);
  }

  /** Builds a dataflow block whose bindings are emitted by {@code body}.
   * The block is popped even if {@code body} throws. */
  public Ir.BindingBlock withDataflowBlock(Consumer<BlockBuilder> body) {
    return withBlock(true, body);
  }

  private Ir.BindingBlock withBlock(boolean dataflow,
      Consumer<BlockBuilder> body) {
    final int depth = blockStack.size();
    blockStack.push(new BlockFrame(dataflow));
    try {
      body.accept(this);
    } catch (RuntimeException | Error e) {
      while (blockStack.size() > depth) {
        blockStack.pop();
      }
      throw e;
    }
    checkState(blockStack.size() == depth + 1,
        "body left %s unfinished block(s)", blockStack.size() - depth - 1);
    return endBlock();
  }

  private BlockFrame currentFrame() {
    checkState(!blockStack.isEmpty(), "no block is being built");
    return blockStack.peek();
  }

  private void append(BlockFrame frame, Ir.Binding binding) {
    frame.bindings.add(binding);
    LOGGER.debug("emit {}", binding);
    tracer.onEmit(binding);
  }

  private Ir.Var newVar(boolean dataflow, @Nullable String nameHint) {
    final String hint;
    if (nameHint != null && !nameHint.isEmpty()) {
      hint = nameHint;
    } else {
      hint = dataflow
          ? Prop.LOCAL_NAME_HINT.stringValue(props)
          : Prop.GLOBAL_NAME_HINT.stringValue(props);
    }
    final Ir.Id vid = ir.id(nameTable.getUniqueName(hint));
    return dataflow
        ? ir.dataflowVar(vid, null, null)
        : ir.var(vid, null, null);
  }

  // emission

  /** Binds a value to a new variable, and returns the variable.
   *
   * @see #emit(Ir.Expr, String) */
  public Ir.Var emit(Ir.Expr expr) {
    return emit(expr, null);
  }

  /** Binds a value to a new variable, and returns the variable.
   *
   * <p>The variable is a {@link Ir.DataflowVar} if the current block is a
   * dataflow block. Its name is derived from {@code nameHint}, or if that is
   * null or empty, from the {@link Prop#LOCAL_NAME_HINT} or
   * {@link Prop#GLOBAL_NAME_HINT} property.
   *
   * <p>If the value is a call, infers its shape and type; the binding holds
   * a copy of the call carrying the inferred annotations, and so does the
   * variable. */
  public Ir.Var emit(Ir.Expr expr, @Nullable String nameHint) {
    return emit(expr, currentFrame().dataflow, nameHint);
  }

  private Ir.Var emit(Ir.Expr expr, boolean dataflow,
      @Nullable String nameHint) {
    final BlockFrame frame = currentFrame();
    final Ir.Var var = newVar(dataflow, nameHint);
    final Ir.Expr value;
    if (expr.kind == Kind.CALL) {
      final Ir.Call call = (Ir.Call) expr;
      final Ir.Expr shape = opRegistry.inferShape(call, diagnosticContext);
      final Type type = opRegistry.inferType(call, diagnosticContext);
      var.setShape(shape);
      var.setCheckedType(type);
      final Ir.Call newCall = call.fresh();
      newCall.setShape(shape);
      newCall.setCheckedType(type);
      value = newCall;
    } else {
      value = expr;
    }
    append(frame, ir.varBinding(var, value));
    bindingTable.put(var.vid, value);
    return var;
  }

  /** Appends an existing binding to the current block, and returns its
   * variable. In a dataflow block, the variable must be a
   * {@link Ir.DataflowVar}; use {@link #emitOutput(Ir.VarBinding)} to bind
   * an ordinary variable there. */
  public Ir.Var emit(Ir.VarBinding binding) {
    final BlockFrame frame = currentFrame();
    if (frame.dataflow) {
      checkArgument(binding.var.isDataflow(),
          "cannot emit binding of ordinary variable %s in a dataflow block",
          binding.var.name());
    }
    append(frame, binding);
    bindingTable.put(binding.var.vid, binding.value);
    return binding.var;
  }

  /** Binds a new variable by matching a pattern against the shape of a
   * value.
   *
   * @see #emitMatchShape(Ir.Expr, List, String) */
  public Ir.Var emitMatchShape(Ir.Expr value, List<PrimExpr> pattern) {
    return emitMatchShape(value, pattern, null);
  }

  /** Binds a new variable by matching a pattern against the shape of a
   * value, and returns the variable.
   *
   * <p>If the value has the shape type, so does the variable. If the value
   * is a tensor, the variable is a tensor of the same element type whose
   * shape is {@code pattern}. Any other value is a fatal error. */
  public Ir.Var emitMatchShape(Ir.Expr value, List<PrimExpr> pattern,
      @Nullable String nameHint) {
    final BlockFrame frame = currentFrame();
    final Type type = value.checkedType();
    final Ir.@Nullable ShapeExpr shape;
    final Type varType;
    if (type == PrimitiveType.SHAPE) {
      shape = null;
      varType = PrimitiveType.SHAPE;
    } else if (type instanceof DynTensorType) {
      shape = ir.shapeExpr(pattern);
      varType = DynTensorType.of(pattern.size(), ((DynTensorType) type).dtype);
    } else {
      throw diagnosticContext.emitFatal(
          Diagnostic.error(value.pos,
              "The value passed to emitMatchShape must be of DynTensorType "
                  + "or ShapeType, but was " + type));
    }
    final Ir.Var var = newVar(frame.dataflow, nameHint);
    var.setShape(shape);
    var.setCheckedType(varType);
    append(frame, ir.matchShape(value, pattern, var));
    bindingTable.put(var.vid, value);
    return var;
  }

  /** Appends an existing match-shape binding to the current block, and
   * returns its variable. In a dataflow block, the variable must not be a
   * {@link Ir.DataflowVar}. */
  public Ir.Var emitMatchShape(Ir.MatchShape binding) {
    final BlockFrame frame = currentFrame();
    if (frame.dataflow) {
      checkArgument(!binding.var.isDataflow(),
          "cannot emit match-shape binding of dataflow variable %s directly",
          binding.var.name());
    }
    append(frame, binding);
    bindingTable.put(binding.var.vid, binding.value);
    return binding.var;
  }

  /** Appends a match-shape binding to the current block as it is, whatever
   * the kind of its variable and the type of its value. Used by
   * {@link ExprMutator} to re-emit a binding it has already checked. */
  Ir.Var appendMatchShape(Ir.MatchShape binding) {
    append(currentFrame(), binding);
    bindingTable.put(binding.var.vid, binding.value);
    return binding.var;
  }

  /** Binds a value computed in a dataflow block to a new ordinary
   * variable, so that it is visible outside the block.
   *
   * @see #emitOutput(Ir.Expr, String) */
  public Ir.Var emitOutput(Ir.Expr output) {
    return emitOutput(output, null);
  }

  /** Binds a value computed in a dataflow block to a new ordinary variable,
   * and returns the variable. Must be called while a dataflow block is being
   * built. */
  public Ir.Var emitOutput(Ir.Expr output, @Nullable String nameHint) {
    checkState(currentFrame().dataflow,
        "emitOutput must be called inside a dataflow block");
    return emit(output, false, nameHint);
  }

  /** Appends an existing binding of an ordinary variable to the current
   * dataflow block, and returns the variable. */
  public Ir.Var emitOutput(Ir.VarBinding binding) {
    final BlockFrame frame = currentFrame();
    checkState(frame.dataflow,
        "emitOutput must be called inside a dataflow block");
    checkArgument(!binding.var.isDataflow(),
        "emitOutput can only emit bindings of ordinary variables, not %s",
        binding.var.name());
    append(frame, binding);
    bindingTable.put(binding.var.vid, binding.value);
    return binding.var;
  }

  // lookup

  /** Returns the value bound to a variable by this builder. It is a fatal
   * error if this builder has not bound the variable. */
  public Ir.Expr lookupVar(Ir.Var var) {
    final Ir.Expr value = bindingTable.get(var.vid);
    if (value == null) {
      throw diagnosticContext.emitFatal(
          Diagnostic.error(var.pos,
              "The var to be looked up is not in the binding table: "
                  + var.name()));
    }
    return value;
  }

  /** Declares the parameters of a function that is being built or
   * rewritten; they have no bound value. */
  public void declareParams(List<? extends Ir.Var> vars) {
    for (Ir.Var var : vars) {
      params.add(var.vid);
    }
  }

  /** Returns the value bound to a variable, or null if it is a declared
   * parameter. It is a fatal error if the variable is neither. */
  public Ir.@Nullable Expr lookupBinding(Ir.Var var) {
    if (params.contains(var.vid)) {
      return null;
    }
    return lookupVar(var);
  }

  // annotations

  /** Infers the shape and type of a call, storing them in the call, and
   * returns the call. Returns any other expression unchanged.
   *
   * <p>The shape is set only if the inferred shape is a
   * {@link Ir.ShapeExpr}; the type is always set, to null if it cannot be
   * inferred. */
  public Ir.Expr normalize(Ir.Expr expr) {
    if (expr.kind == Kind.CALL) {
      final Ir.Call call = (Ir.Call) expr;
      final Ir.Expr shape = opRegistry.inferShape(call, diagnosticContext);
      if (shape != null && shape.kind == Kind.SHAPE_EXPR) {
        call.setShape(shape);
      }
      call.setCheckedType(opRegistry.inferType(call, diagnosticContext));
    }
    return expr;
  }

  /** Returns whether two shapes can be proved equal. Returns false if they
   * may not be equal, or if equality cannot be proved. */
  public boolean canProveShapeEqual(Ir.@Nullable Expr lhs,
      Ir.@Nullable Expr rhs) {
    if (lhs == rhs) {
      return true;
    }
    if (lhs == null || rhs == null
        || lhs.kind != Kind.SHAPE_EXPR
        || rhs.kind != Kind.SHAPE_EXPR) {
      return false;
    }
    final Ir.ShapeExpr lhsShape = (Ir.ShapeExpr) lhs;
    final Ir.ShapeExpr rhsShape = (Ir.ShapeExpr) rhs;
    if (lhsShape.ndim() != rhsShape.ndim()) {
      return false;
    }
    for (int i = 0; i < lhsShape.ndim(); i++) {
      if (!analyzer.canProveEqual(lhsShape.values.get(i),
          rhsShape.values.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Logs a warning if blocks are still being built, and discards them. */
  @Override public void close() {
    if (!blockStack.isEmpty()) {
      if (Prop.WARN_ON_UNCLOSED_BLOCKS.booleanValue(props)) {
        LOGGER.warn("BlockBuilder closed with remaining blocks ({})",
            blockStack.size());
      }
      blockStack.clear();
    }
  }

  /** Block under construction. */
  private static class BlockFrame {
    final boolean dataflow;
    final List<Ir.Binding> bindings = new ArrayList<>();

    BlockFrame(boolean dataflow) {
      this.dataflow = dataflow;
    }
  }
}

// End BlockBuilder.java
