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
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.type.DType;
import net.hydromatic.tensorir.type.DynTensorType;
import net.hydromatic.tensorir.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests the inference rules of {@link BuiltIn} operators, and
 * {@link OpRegistry}. */
public class BuiltInTest {
  /** Infers shapes and types of calls to built-in operators. */
  private static class Fixture {
    final OpRegistry registry = OpRegistry.standard();
    final DiagnosticContext context = new DiagnosticContext(Tracers.empty());

    Ir.Var tensor(String name, DType dtype, long... dims) {
      return ir.var(name, ir.shapeOf(dims),
          DynTensorType.of(dims.length, dtype));
    }

    Ir.Var f32(String name, long... dims) {
      return tensor(name, DType.FLOAT32, dims);
    }

    Ir.Expr shape(Ir.Call call) {
      return registry.inferShape(call, context);
    }

    Object type(Ir.Call call) {
      return registry.inferType(call, context);
    }
  }

  @Test
  void testBroadcast() {
    final Fixture f = new Fixture();
    final Ir.Var a = f.f32("a", 2, 3);
    assertThat(f.shape(BuiltIn.ADD.call(a, f.f32("b", 1, 3))),
        hasToString("shape(2, 3)"));
    assertThat(f.shape(BuiltIn.ADD.call(f.f32("b", 2, 1), a)),
        hasToString("shape(2, 3)"));
    assertThat(f.shape(BuiltIn.MULTIPLY.call(a, a)),
        hasToString("shape(2, 3)"));
    // incompatible extents give an unknown shape, but no error
    assertThat(f.shape(BuiltIn.ADD.call(a, f.f32("b", 2, 4))), nullValue());
    // symbolic extents
    final PrimExpr n = PrimExpr.var("n");
    final Ir.Var c = ir.var("c", ir.shapeExpr(n, PrimExpr.of(1)), null);
    final Ir.Var d =
        ir.var("d", ir.shapeExpr(n.plus(PrimExpr.of(0)), PrimExpr.of(5)),
            null);
    assertThat(f.shape(BuiltIn.ADD.call(c, d)), hasToString("shape(n, 5)"));
    // unknown shape
    assertThat(f.shape(BuiltIn.ADD.call(a, ir.var("e"))), nullValue());
    assertThat(f.context.diagnostics(), hasSize(0));
  }

  @Test
  void testElementwiseType() {
    final Fixture f = new Fixture();
    final Ir.Var a = f.f32("a", 2, 3);
    assertThat(f.type(BuiltIn.ADD.call(a, a)),
        is(DynTensorType.of(2, DType.FLOAT32)));
    final Ir.Var unknownRank =
        ir.var("u", null, DynTensorType.of(-1, DType.VOID));
    assertThat(f.type(BuiltIn.ADD.call(a, unknownRank)),
        is(DynTensorType.of(-1, DType.FLOAT32)));
    assertThat(f.type(BuiltIn.ADD.call(unknownRank, unknownRank)),
        is(DynTensorType.unknown()));
    assertThat(f.type(BuiltIn.ADD.call(a, ir.shapeOf(2, 3))), nullValue());
    assertThat(f.context.diagnostics(), hasSize(0));

    assertThat(f.type(BuiltIn.ADD.call(a, f.tensor("h", DType.FLOAT16, 2, 3))),
        nullValue());
    assertThat(f.context.diagnostics(), hasSize(1));
    assertThat(f.context.diagnostics().get(0).message,
        is("operands of add have different element types float32 and "
            + "float16"));
  }

  @Test
  void testArity() {
    final Fixture f = new Fixture();
    final Ir.Call call = BuiltIn.MULTIPLY.call(f.f32("a", 2));
    assertThat(f.shape(call), nullValue());
    assertThat(f.type(call), nullValue());
    assertThat(f.context.diagnostics(), hasSize(2));
    assertThat(f.context.diagnostics().get(0).message,
        is("operator multiply expects 2 arguments, got 1"));
  }

  @Test
  void testMatmul() {
    final Fixture f = new Fixture();
    final PrimExpr n = PrimExpr.var("n");
    final Ir.Var a = ir.var("a", ir.shapeExpr(n, PrimExpr.of(4)),
        DynTensorType.of(2, DType.FLOAT64));
    final Ir.Var b = f.tensor("b", DType.FLOAT64, 4, 5);
    final Ir.Call call = BuiltIn.MATMUL.call(a, b);
    assertThat(f.shape(call), hasToString("shape(n, 5)"));
    assertThat(f.type(call), is(DynTensorType.of(2, DType.FLOAT64)));
    assertThat(f.shape(BuiltIn.MATMUL.call(a, f.f32("c", 3, 5))),
        nullValue());
    assertThat(f.context.diagnostics(), hasSize(0));

    final Ir.Call call3 = BuiltIn.MATMUL.call(a, f.f32("d", 4, 5, 6));
    assertThat(f.shape(call3), nullValue());
    assertThat(f.type(call3), nullValue());
    assertThat(f.context.diagnostics(), hasSize(2));
  }

  @Test
  void testUnique() {
    final Fixture f = new Fixture();
    final Ir.Call call = BuiltIn.UNIQUE.call(f.tensor("a", DType.INT32, 10));
    assertThat(f.shape(call), instanceOf(Ir.RuntimeDepShape.class));
    assertThat(f.type(call), is(DynTensorType.of(1, DType.INT32)));
    assertThat(f.type(BuiltIn.UNIQUE.call(ir.var("s", null,
        PrimitiveType.SHAPE))), nullValue());
  }

  @Test
  void testRegistry() {
    final Fixture f = new Fixture();
    final Ir.Var a = f.f32("a", 2, 3);
    assertThat(f.registry.shapeRule(BuiltIn.ADD.call(a, a)), notNullValue());
    assertThat(f.registry.shapeRule(BuiltIn.PRINT.call(a)), nullValue());
    assertThat(f.registry.typeRule(ir.call(ir.globalVar("g"), a)),
        nullValue());

    // rules can be replaced and removed
    f.registry.register("print", null, (call, context) -> PrimitiveType.OBJECT);
    assertThat(f.type(BuiltIn.PRINT.call(a)), is(PrimitiveType.OBJECT));
    f.registry.register("add", null, null);
    assertThat(f.registry.shapeRule(BuiltIn.ADD.call(a, a)), nullValue());
    assertThat(f.type(BuiltIn.ADD.call(a, a)), nullValue());
  }
}

// End BuiltInTest.java
