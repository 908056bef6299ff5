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
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.ast.Kind;
import net.hydromatic.tensorir.type.DType;
import net.hydromatic.tensorir.type.DynTensorType;
import net.hydromatic.tensorir.type.PrimitiveType;
import net.hydromatic.tensorir.type.TupleType;
import org.junit.jupiter.api.Test;

/** Tests {@link BlockBuilder}. */
public class BlockBuilderTest {
  private static class Fixture {
    final BlockBuilder bb = BlockBuilder.create();
    final DynTensorType f32 = DynTensorType.of(2, DType.FLOAT32);
    final PrimExpr n = PrimExpr.var("n");
    final Ir.Var x = ir.var("x", ir.shapeOf(2, 3), f32);
    final Ir.Var y = ir.var("y", ir.shapeOf(2, 3), f32);
    final Ir.Var z =
        ir.var("z", ir.shapeOf(2, 3, 4), DynTensorType.of(3, DType.FLOAT32));
  }

  @Test
  void testEmitAppendsInOrder() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    final Ir.Call add = BuiltIn.ADD.call(f.x, f.y);
    final Ir.Var v0 = f.bb.emit(add);
    final Ir.Var v1 = f.bb.emit(BuiltIn.MULTIPLY.call(v0, f.x));
    final Ir.Tuple tuple = ir.tuple(v0, v1);
    final Ir.Var v2 = f.bb.emit(tuple);
    final Ir.BindingBlock block = f.bb.endBlock();

    assertThat(block.isDataflow(), is(false));
    assertThat(block.bindings, hasSize(3));
    final List<Ir.Var> vars = ImmutableList.of(v0, v1, v2);
    for (int i = 0; i < vars.size(); i++) {
      final Ir.VarBinding binding = (Ir.VarBinding) block.bindings.get(i);
      assertThat(binding.var, sameInstance(vars.get(i)));
      assertThat(binding.var.kind, is(Kind.VAR));
      assertThat(binding.value, sameInstance(f.bb.lookupVar(vars.get(i))));
    }
    assertThat(v0.name(), is("gv"));
    assertThat(v1.name(), is("gv1"));
    assertThat(v2.name(), is("gv2"));

    // A call is bound as a copy; other values are bound as they are.
    final Ir.VarBinding b0 = (Ir.VarBinding) block.bindings.get(0);
    assertThat(b0.value, not(sameInstance(add)));
    assertThat(b0.value, hasToString("add(%x, %y)"));
    assertThat(((Ir.VarBinding) block.bindings.get(2)).value,
        sameInstance(tuple));
    assertThat(block,
        hasToString("%gv: Tensor[2, float32] = add(%x, %y); "
            + "%gv1: Tensor[2, float32] = multiply(%gv, %x); "
            + "%gv2 = (%gv, %gv1)"));
  }

  @Test
  void testEmitInfersShapeAndType() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    final Ir.Call add = BuiltIn.ADD.call(f.x, f.y);
    final Ir.Var v = f.bb.emit(add);
    assertThat(v.shape(), hasToString("shape(2, 3)"));
    assertThat(v.checkedType(), is(f.f32));
    final Ir.Expr value = f.bb.lookupVar(v);
    assertThat(value.shape(), sameInstance(v.shape()));
    assertThat(value.checkedType(), is(f.f32));
    // the original call is not annotated
    assertThat(add.shape(), nullValue());
    assertThat(add.checkedType(), nullValue());

    // "print" has no rules; its shape and type are unknown
    final Ir.Var p = f.bb.emit(BuiltIn.PRINT.call(v));
    assertThat(p.shape(), nullValue());
    assertThat(p.checkedType(), nullValue());

    // an operator nobody has registered, and a call to a non-operator
    final Ir.Var q = f.bb.emit(ir.call("my_op", v));
    assertThat(q.checkedType(), nullValue());
    final Ir.Var r = f.bb.emit(ir.call(ir.externFunc("my_func"), v));
    assertThat(r.checkedType(), nullValue());

    // "matmul" of (n, 3) and (3, 5) has shape (n, 5)
    final Ir.Var a = ir.var("a", ir.shapeExpr(f.n, PrimExpr.of(3)), f.f32);
    final Ir.Var b = ir.var("b", ir.shapeOf(3, 5), f.f32);
    final Ir.Var m = f.bb.emit(BuiltIn.MATMUL.call(a, b));
    assertThat(m.shape(), hasToString("shape(n, 5)"));
    assertThat(m.checkedType(), is(f.f32));

    // "unique" has a shape that is only known at run time
    final Ir.Var u = f.bb.emit(BuiltIn.UNIQUE.call(f.x));
    assertThat(u.shape(), instanceOf(Ir.RuntimeDepShape.class));
    assertThat(u.checkedType(), is(DynTensorType.of(1, DType.FLOAT32)));
    f.bb.endBlock();
    assertThat(f.bb.diagnosticContext().diagnostics(), hasSize(0));
  }

  @Test
  void testInferenceProblemsAreNotFatal() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    final Ir.Var v = f.bb.emit(BuiltIn.ADD.call(f.x, f.z));
    assertThat(v.shape(), nullValue());
    assertThat(v.checkedType(), nullValue());
    // one from the shape rule, one from the type rule
    final List<Diagnostic> diagnostics =
        f.bb.diagnosticContext().diagnostics();
    assertThat(diagnostics, hasSize(2));
    assertThat(diagnostics.get(0).level, is(Diagnostic.Level.ERROR));
    assertThat(diagnostics.get(0).message,
        containsString("different ranks 2 and 3"));
    assertThat(f.bb.endBlock().bindings, hasSize(1));
  }

  @Test
  void testEmitOutputInDataflowBlock() {
    final Fixture f = new Fixture();
    f.bb.beginDataflowBlock();
    final Ir.Var a = f.bb.emit(BuiltIn.ADD.call(f.x, f.y));
    final Ir.Var b = f.bb.emit(BuiltIn.MULTIPLY.call(a, a));
    final Ir.Var out = f.bb.emitOutput(b);
    final Ir.BindingBlock block = f.bb.endBlock();

    assertThat(block.isDataflow(), is(true));
    assertThat(block.bindings, hasSize(3));
    assertThat(a.isDataflow(), is(true));
    assertThat(b.isDataflow(), is(true));
    assertThat(out.isDataflow(), is(false));
    assertThat(block.bindings.get(0).var, sameInstance(a));
    assertThat(block.bindings.get(2).var, sameInstance(out));
    assertThat(block.bindings.get(2).value(), sameInstance(b));
    assertThat(a.name(), is("lv"));
    assertThat(b.name(), is("lv1"));
    assertThat(out.name(), is("gv"));
  }

  @Test
  void testEmitOutputOutsideDataflowBlockIsFatal() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class,
            () -> f.bb.emitOutput(f.x));
    assertThat(e.getMessage(), containsString("inside a dataflow block"));
    final Ir.VarBinding binding = ir.varBinding(ir.var("v"), f.x);
    assertThrows(IllegalStateException.class,
        () -> f.bb.emitOutput(binding));
    assertThat(f.bb.endBlock().bindings, hasSize(0));

    // in a dataflow block, an output binding must bind an ordinary variable
    f.bb.beginDataflowBlock();
    final Ir.VarBinding dataflowBinding =
        ir.varBinding(ir.dataflowVar("d"), f.x);
    assertThrows(IllegalArgumentException.class,
        () -> f.bb.emitOutput(dataflowBinding));
    assertThat(f.bb.emitOutput(binding), sameInstance(binding.var));
    assertThat(f.bb.lookupVar(binding.var), sameInstance(f.x));
    f.bb.endBlock();
  }

  @Test
  void testEmitBinding() {
    final Fixture f = new Fixture();
    final Ir.VarBinding ordinary = ir.varBinding(ir.var("v"), f.x);
    final Ir.VarBinding dataflow = ir.varBinding(ir.dataflowVar("d"), f.y);

    f.bb.beginBindingBlock();
    assertThat(f.bb.emit(ordinary), sameInstance(ordinary.var));
    assertThat(f.bb.endBlock().bindings.get(0), sameInstance(ordinary));

    f.bb.beginDataflowBlock();
    assertThat(f.bb.emit(dataflow), sameInstance(dataflow.var));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> f.bb.emit(ordinary));
    assertThat(e.getMessage(), containsString("ordinary variable v"));
    assertThat(f.bb.endBlock().bindings, hasSize(1));

    assertThat(f.bb.lookupVar(ordinary.var), sameInstance(f.x));
    assertThat(f.bb.lookupVar(dataflow.var), sameInstance(f.y));
  }

  @Test
  void testEmitMatchShape() {
    final Fixture f = new Fixture();
    final PrimExpr a = PrimExpr.var("a");
    final PrimExpr b = PrimExpr.var("b");
    f.bb.beginBindingBlock();

    // a value of shape type gives a variable of shape type
    final Ir.ShapeExpr shape = ir.shapeOf(4, 5);
    final Ir.Var s = f.bb.emitMatchShape(shape, ImmutableList.of(a, b));
    assertThat(s.checkedType(), is(PrimitiveType.SHAPE));
    assertThat(s.shape(), nullValue());

    // a tensor gives a tensor with the pattern as its shape
    final Ir.Var t =
        f.bb.emitMatchShape(f.x, ImmutableList.of(a, b), "t");
    assertThat(t.name(), is("t"));
    assertThat(t.shape(), hasToString("shape(a, b)"));
    assertThat(t.checkedType(), is(DynTensorType.of(2, DType.FLOAT32)));

    // the rank comes from the pattern, even if the tensor's rank is unknown
    final Ir.Var unknownRank =
        ir.var("w", null, DynTensorType.of(-1, DType.FLOAT16));
    final Ir.Var w =
        f.bb.emitMatchShape(unknownRank, ImmutableList.of(a, b, f.n));
    assertThat(w.checkedType(), is(DynTensorType.of(3, DType.FLOAT16)));

    final Ir.BindingBlock block = f.bb.endBlock();
    assertThat(block.bindings, hasSize(3));
    assertThat(block.bindings.get(1).kind, is(Kind.MATCH_SHAPE));
    final Ir.MatchShape matchShape = (Ir.MatchShape) block.bindings.get(1);
    assertThat(matchShape.value, sameInstance(f.x));
    assertThat(matchShape.var, sameInstance(t));
    assertThat(matchShape,
        hasToString("%t: Tensor[2, float32] = match_shape(%x, [a, b])"));
    assertThat(f.bb.lookupVar(t), sameInstance(f.x));

    // in a dataflow block, the variable is a dataflow variable
    f.bb.beginDataflowBlock();
    final Ir.Var d = f.bb.emitMatchShape(f.x, ImmutableList.of(a, b));
    assertThat(d.isDataflow(), is(true));
    f.bb.endBlock();
  }

  @Test
  void testEmitMatchShapeOfIllegalTypeIsFatal() {
    final Fixture f = new Fixture();
    final List<Diagnostic> traced = new ArrayList<>();
    final BlockBuilder bb =
        new BlockBuilder(new NameTable(), OpRegistry.standard(),
            Tracers.withOnDiagnostic(Tracers.empty(), traced::add),
            new EnumMap<>(Prop.class));
    bb.beginBindingBlock();
    final List<PrimExpr> pattern = ImmutableList.of(f.n);

    // a value with no type
    final CompileException e =
        assertThrows(CompileException.class,
            () -> bb.emitMatchShape(ir.constant(1), pattern));
    assertThat(e.getMessage(),
        containsString("must be of DynTensorType or ShapeType"));
    assertThat(traced, hasSize(1));
    assertThat(bb.diagnosticContext().diagnostics(), hasSize(1));

    // a tuple
    final Ir.Var tuple = ir.var("t", null, TupleType.of(f.f32, f.f32));
    assertThrows(CompileException.class,
        () -> bb.emitMatchShape(tuple, pattern));
    assertThat(traced, hasSize(2));

    // nothing was emitted
    assertThat(bb.endBlock().bindings, hasSize(0));
  }

  @Test
  void testEmitMatchShapeBinding() {
    final Fixture f = new Fixture();
    final List<PrimExpr> pattern = ImmutableList.of(f.n, PrimExpr.of(3));
    final Ir.MatchShape ordinary =
        ir.matchShape(f.x, pattern, ir.var("v"));
    final Ir.MatchShape dataflow =
        ir.matchShape(f.x, pattern, ir.dataflowVar("d"));

    f.bb.beginBindingBlock();
    assertThat(f.bb.emitMatchShape(dataflow), sameInstance(dataflow.var));
    f.bb.endBlock();

    f.bb.beginDataflowBlock();
    assertThrows(IllegalArgumentException.class,
        () -> f.bb.emitMatchShape(dataflow));
    assertThat(f.bb.emitMatchShape(ordinary), sameInstance(ordinary.var));
    final Ir.BindingBlock block = f.bb.endBlock();
    assertThat(block.bindings, hasSize(1));
    assertThat(block.bindings.get(0), sameInstance(ordinary));
  }

  @Test
  void testEndBlockWithoutBeginIsFatal() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    f.bb.endBlock();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, f.bb::endBlock);
    assertThat(e.getMessage(), is("no block is being built"));
    assertThrows(IllegalStateException.class, () -> f.bb.emit(f.x));
    assertThrows(IllegalStateException.class, f.bb::currentBlockIsDataflow);
    assertThat(f.bb.hasActiveBlock(), is(false));
  }

  @Test
  void testNestedBlocks() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    final Ir.Var outer = f.bb.emit(f.x);
    f.bb.beginDataflowBlock();
    assertThat(f.bb.currentBlockIsDataflow(), is(true));
    final Ir.Var inner = f.bb.emit(f.y);
    final Ir.BindingBlock innerBlock = f.bb.endBlock();
    assertThat(f.bb.currentBlockIsDataflow(), is(false));
    final Ir.BindingBlock outerBlock = f.bb.endBlock();
    assertThat(innerBlock.isDataflow(), is(true));
    assertThat(innerBlock.bindings.get(0).var, sameInstance(inner));
    assertThat(outerBlock.bindings, hasSize(1));
    assertThat(outerBlock.bindings.get(0).var, sameInstance(outer));
  }

  @Test
  void testCanProveShapeEqual() {
    final Fixture f = new Fixture();
    final BlockBuilder bb = f.bb;
    assertThat(bb.canProveShapeEqual(ir.shapeOf(2, 3), ir.shapeOf(2, 3)),
        is(true));
    assertThat(bb.canProveShapeEqual(ir.shapeOf(2, 3), ir.shapeOf(2, 4)),
        is(false));
    assertThat(
        bb.canProveShapeEqual(ir.shapeExpr(f.n, PrimExpr.of(3)),
            ir.shapeExpr(f.n, PrimExpr.of(3))),
        is(true));
    assertThat(bb.canProveShapeEqual(ir.shapeOf(2, 3), ir.shapeOf(2, 3, 1)),
        is(false));

    // symbolic arithmetic
    assertThat(
        bb.canProveShapeEqual(ir.shapeExpr(f.n.times(PrimExpr.of(2))),
            ir.shapeExpr(f.n.plus(f.n))),
        is(true));
    assertThat(
        bb.canProveShapeEqual(ir.shapeExpr(f.n),
            ir.shapeExpr(PrimExpr.var("n"))),
        is(false));

    // identity, and shapes that are not shape expressions
    final Ir.RuntimeDepShape r = ir.runtimeDepShape();
    assertThat(bb.canProveShapeEqual(r, r), is(true));
    assertThat(bb.canProveShapeEqual(r, ir.runtimeDepShape()), is(false));
    assertThat(bb.canProveShapeEqual(r, ir.shapeOf(2)), is(false));
    assertThat(bb.canProveShapeEqual(null, null), is(true));
    assertThat(bb.canProveShapeEqual(null, ir.shapeOf(2)), is(false));
  }

  @Test
  void testNormalize() {
    final Fixture f = new Fixture();
    final Ir.Call call = BuiltIn.ADD.call(f.x, f.y);
    assertThat(f.bb.normalize(call), sameInstance(call));
    final Ir.Expr shape = call.shape();
    assertThat(shape, hasToString("shape(2, 3)"));
    assertThat(call.checkedType(), is(f.f32));

    // normalizing again gives the same annotations
    f.bb.normalize(call);
    assertThat(f.bb.canProveShapeEqual(call.shape(), shape), is(true));
    assertThat(call.shape(), hasToString(shape.toString()));
    assertThat(call.checkedType(), is(f.f32));

    // not a call: no change
    final Ir.Tuple tuple = ir.tuple(f.x, f.y);
    assertThat(f.bb.normalize(tuple), sameInstance(tuple));
    assertThat(tuple.shape(), nullValue());
    assertThat(tuple.checkedType(), nullValue());
    assertThat(f.bb.normalize(f.x), sameInstance(f.x));
    assertThat(f.bb.normalize(f.x).shape(), hasToString("shape(2, 3)"));

    // a shape that is not a shape expression is not stored
    final Ir.Call unique = BuiltIn.UNIQUE.call(f.x);
    f.bb.normalize(unique);
    assertThat(unique.shape(), nullValue());
    assertThat(unique.checkedType(), is(DynTensorType.of(1, DType.FLOAT32)));

    // normalize does not need an active block
    assertThat(f.bb.hasActiveBlock(), is(false));
  }

  @Test
  void testLookupVar() {
    final Fixture f = new Fixture();
    f.bb.beginDataflowBlock();
    final Ir.Var v = f.bb.emit(f.x);
    assertThat(f.bb.lookupVar(v), sameInstance(f.x));
    f.bb.endBlock();
    // the binding table outlives the block
    assertThat(f.bb.lookupVar(v), sameInstance(f.x));

    final CompileException e =
        assertThrows(CompileException.class, () -> f.bb.lookupVar(f.y));
    assertThat(e.getMessage(),
        containsString("not in the binding table: y"));

    // a variable with the same name, but a different identity, is unbound
    assertThrows(CompileException.class,
        () -> f.bb.lookupVar(ir.dataflowVar(v.name())));
    // a variable with the same identity is bound
    assertThat(f.bb.lookupVar(ir.varLike(v)), sameInstance(f.x));
  }

  @Test
  void testLookupBinding() {
    final Fixture f = new Fixture();
    f.bb.declareParams(ImmutableList.of(f.x));
    assertThat(f.bb.lookupBinding(f.x), nullValue());
    assertThrows(CompileException.class, () -> f.bb.lookupVar(f.x));
    assertThrows(CompileException.class, () -> f.bb.lookupBinding(f.y));
    f.bb.beginBindingBlock();
    final Ir.Var v = f.bb.emit(f.x);
    f.bb.endBlock();
    assertThat(f.bb.lookupBinding(v), sameInstance(f.x));
  }

  @Test
  void testNames() {
    final Fixture f = new Fixture();
    f.bb.beginBindingBlock();
    assertThat(f.bb.emit(f.x, "a").name(), is("a"));
    assertThat(f.bb.emit(f.x, "a").name(), is("a1"));
    assertThat(f.bb.emit(f.x, "").name(), is("gv"));
    assertThat(f.bb.emit(f.x, "a.b").name(), is("a_b"));
    f.bb.endBlock();

    // builders that share a name table do not create the same name
    final NameTable nameTable = new NameTable();
    final BlockBuilder bb1 = BlockBuilder.create(nameTable);
    final BlockBuilder bb2 = BlockBuilder.create(nameTable);
    bb1.beginBindingBlock();
    bb2.beginBindingBlock();
    assertThat(bb1.emit(f.x).name(), is("gv"));
    assertThat(bb2.emit(f.x).name(), is("gv1"));
    bb1.endBlock();
    bb2.endBlock();

    // default names are configurable
    final Map<Prop, Object> props = new EnumMap<>(Prop.class);
    Prop.LOCAL_NAME_HINT.set(props, "tmp");
    Prop.GLOBAL_NAME_HINT.set(props, "out");
    final BlockBuilder bb3 = BlockBuilder.create(props);
    bb3.beginDataflowBlock();
    assertThat(bb3.emit(f.x).name(), is("tmp"));
    assertThat(bb3.emitOutput(f.x).name(), is("out"));
    bb3.endBlock();
  }

  @Test
  void testScopedBlocks() {
    final Fixture f = new Fixture();
    final List<Ir.Var> vars = new ArrayList<>();
    final Ir.BindingBlock block =
        f.bb.withDataflowBlock(b -> {
          vars.add(b.emit(f.x));
          vars.add(b.emitOutput(vars.get(0)));
        });
    assertThat(block.isDataflow(), is(true));
    assertThat(block.bindings, hasSize(2));
    assertThat(block.bindings.get(1).var, sameInstance(vars.get(1)));
    assertThat(f.bb.hasActiveBlock(), is(false));

    // the block is popped even if the body fails
    assertThrows(CompileException.class,
        () -> f.bb.withBindingBlock(b -> b.lookupVar(f.y)));
    assertThat(f.bb.hasActiveBlock(), is(false));
    assertThrows(IllegalStateException.class,
        () -> f.bb.withBindingBlock(b -> {
          b.beginDataflowBlock();
          b.emit(f.x);
          b.endBlock();
          b.emitOutput(f.x);
        }));
    assertThat(f.bb.hasActiveBlock(), is(false));
    assertThrows(IllegalStateException.class,
        () -> f.bb.withDataflowBlock(b -> {
          b.beginBindingBlock();
          b.emitOutput(f.x);
        }));
    assertThat(f.bb.hasActiveBlock(), is(false));

    // a body that leaves a block open is an error
    assertThrows(IllegalStateException.class,
        () -> f.bb.withBindingBlock(BlockBuilder::beginBindingBlock));
  }

  @Test
  void testTracer() {
    final Fixture f = new Fixture();
    final List<Ir.Binding> emitted = new ArrayList<>();
    final List<Ir.BindingBlock> blocks = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnEndBlock(
            Tracers.withOnEmit(Tracers.empty(), emitted::add), blocks::add);
    final BlockBuilder bb =
        new BlockBuilder(new NameTable(), OpRegistry.standard(), tracer,
            new EnumMap<>(Prop.class));
    bb.beginBindingBlock();
    bb.emit(f.x);
    bb.emitMatchShape(f.x, ImmutableList.of(f.n, f.n));
    final Ir.BindingBlock block = bb.endBlock();
    assertThat(emitted, is(block.bindings));
    assertThat(blocks, hasSize(1));
    assertThat(blocks.get(0), sameInstance(block));
  }

  @Test
  void testClose() {
    final Fixture f = new Fixture();
    try (BlockBuilder bb = BlockBuilder.create()) {
      bb.beginBindingBlock();
      bb.beginDataflowBlock();
      bb.emit(f.x);
    }
    // closing a builder discards unfinished blocks
    final BlockBuilder bb = BlockBuilder.create();
    bb.beginBindingBlock();
    bb.close();
    assertThat(bb.hasActiveBlock(), is(false));
    bb.close();
  }

  @Test
  void testCustomRules() {
    final Fixture f = new Fixture();
    final OpRegistry registry = new OpRegistry()
        .register("identity",
            (call, context) -> call.args.get(0).shape(),
            (call, context) -> call.args.get(0).checkedType());
    final BlockBuilder bb =
        new BlockBuilder(new NameTable(), registry, Tracers.empty(),
            new EnumMap<>(Prop.class));
    bb.beginBindingBlock();
    final Ir.Var v = bb.emit(ir.call("identity", f.z));
    assertThat(v.shape(), sameInstance(f.z.shape()));
    assertThat(v.checkedType(), is(DynTensorType.of(3, DType.FLOAT32)));
    // this registry does not know the built-in operators
    assertThat(bb.emit(BuiltIn.ADD.call(f.x, f.x)).checkedType(),
        nullValue());
    bb.endBlock();
  }
}

// End BlockBuilderTest.java
