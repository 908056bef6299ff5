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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.tensorir.arith.PrimExpr;
import net.hydromatic.tensorir.type.PrimitiveType;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** IR nodes.
 *
 * <p>This class functions as a namespace, so that we can keep the class
 * names short.
 *
 * <p>Nodes are immutable, except for the two cached annotations of an
 * {@link Expr}, its shape and its checked type, which are filled in during
 * construction and normalization. Nodes are compared by reference. */
public class Ir {
  private Ir() {}

  /** Returns whether an expression is atomic: a variable, constant,
   * operator, shape, or reference to a global or external function. */
  public static boolean isAtomic(Expr e) {
    return e.kind.atomic;
  }

  /** Returns whether an expression is atomic, or a tuple whose fields are
   * all atomic or such tuples. These are the expressions that may appear as
   * arguments in normal form. */
  public static boolean isLeafOrTuple(Expr e) {
    if (e.kind.atomic) {
      return true;
    }
    if (e.kind == Kind.TUPLE) {
      for (Expr field : ((Tuple) e).fields) {
        if (!isLeafOrTuple(field)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  /** Identity of a variable.
   *
   * <p>Two {@link Var} objects with the same {@code Id} denote the same
   * variable; this happens when a rewrite attaches a more precise shape or
   * type to a variable. Ids are compared by reference. */
  public static final class Id {
    public final String name;

    Id(String name) {
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Base class of expressions. */
  public abstract static class Expr extends IrNode {
    private @Nullable Expr shape;
    private @Nullable Type checkedType;

    Expr(Pos pos, Kind kind) {
      super(pos, kind);
      checkArgument(kind.isExpr(), "not an expression kind: %s", kind);
    }

    /** Returns the inferred shape, or null if it is not known. */
    public @Nullable Expr shape() {
      return shape;
    }

    /** Returns the checked type, or null if it is not known. */
    public @Nullable Type checkedType() {
      return checkedType;
    }

    /** Sets the cached shape annotation. */
    public final void setShape(@Nullable Expr shape) {
      this.shape = shape;
    }

    /** Sets the cached type annotation. */
    public final void setCheckedType(@Nullable Type checkedType) {
      this.checkedType = checkedType;
    }

    /** Calls the handler of {@code functor} for this kind of expression. */
    public abstract <R, A> R accept(ExprFunctor<R, A> functor, A arg);

    @Override
    IrWriter unparse(IrWriter w) {
      return w.expr(this);
    }
  }

  /** Constant tensor value. */
  public static class Constant extends Expr {
    public final Object value;

    Constant(Pos pos, Object value) {
      super(pos, Kind.CONSTANT);
      this.value = requireNonNull(value, "value");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Tuple of expressions. */
  public static class Tuple extends Expr {
    public final ImmutableList<Expr> fields;

    Tuple(Pos pos, ImmutableList<Expr> fields) {
      super(pos, Kind.TUPLE);
      this.fields = requireNonNull(fields, "fields");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }

    /** Returns a copy of this tuple with given fields, or this tuple if the
     * fields are the same. */
    public Tuple copy(List<Expr> fields) {
      return sameElements(fields, this.fields)
          ? this
          : new Tuple(pos, ImmutableList.copyOf(fields));
    }
  }

  /** Variable that is visible in its enclosing function.
   *
   * <p>The expression handler of a functor sees only the places where a
   * variable is used; the place where it is defined (the left side of a
   * binding, or a function parameter) is visited separately. */
  public static class Var extends Expr {
    public final Id vid;
    public final @Nullable Expr shapeAnnotation;
    public final @Nullable Type typeAnnotation;

    Var(Pos pos, Id vid, @Nullable Expr shapeAnnotation,
        @Nullable Type typeAnnotation) {
      this(pos, Kind.VAR, vid, shapeAnnotation, typeAnnotation);
    }

    Var(Pos pos, Kind kind, Id vid, @Nullable Expr shapeAnnotation,
        @Nullable Type typeAnnotation) {
      super(pos, kind);
      this.vid = requireNonNull(vid, "vid");
      this.shapeAnnotation = shapeAnnotation;
      this.typeAnnotation = typeAnnotation;
      setShape(shapeAnnotation);
      setCheckedType(typeAnnotation);
    }

    /** Returns the name of this variable. */
    public String name() {
      return vid.name;
    }

    /** Returns whether this is a {@link DataflowVar}. */
    public boolean isDataflow() {
      return false;
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Variable that is visible only in the dataflow block that defines it. */
  public static class DataflowVar extends Var {
    DataflowVar(Pos pos, Id vid, @Nullable Expr shapeAnnotation,
        @Nullable Type typeAnnotation) {
      super(pos, Kind.DATAFLOW_VAR, vid, shapeAnnotation, typeAnnotation);
    }

    @Override
    public boolean isDataflow() {
      return true;
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Shape whose dimensions are symbolic expressions, e.g.
   * {@code (n, 4)}. */
  public static class ShapeExpr extends Expr {
    public final ImmutableList<PrimExpr> values;

    ShapeExpr(Pos pos, ImmutableList<PrimExpr> values) {
      super(pos, Kind.SHAPE_EXPR);
      this.values = requireNonNull(values, "values");
      setCheckedType(PrimitiveType.SHAPE);
    }

    /** Returns the number of dimensions. */
    public int ndim() {
      return values.size();
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Shape that can only be computed at run time. */
  public static class RuntimeDepShape extends Expr {
    RuntimeDepShape(Pos pos) {
      super(pos, Kind.RUNTIME_DEP_SHAPE);
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Reference to a function implemented outside the IR. */
  public static class ExternFunc extends Expr {
    public final String globalSymbol;

    ExternFunc(Pos pos, String globalSymbol) {
      super(pos, Kind.EXTERN_FUNC);
      this.globalSymbol = requireNonNull(globalSymbol, "globalSymbol");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Reference to a function defined at the top level of a module. */
  public static class GlobalVar extends Expr {
    public final String nameHint;

    GlobalVar(Pos pos, String nameHint) {
      super(pos, Kind.GLOBAL_VAR);
      this.nameHint = requireNonNull(nameHint, "nameHint");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Function. Its body is usually a {@link SeqExpr}. */
  public static class Function extends Expr {
    public final ImmutableList<Var> params;
    public final Expr body;
    public final @Nullable Type retType;
    public final @Nullable String name;

    Function(Pos pos, ImmutableList<Var> params, Expr body,
        @Nullable Type retType, @Nullable String name) {
      super(pos, Kind.FUNCTION);
      this.params = requireNonNull(params, "params");
      this.body = requireNonNull(body, "body");
      this.retType = retType;
      this.name = name;
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }

    /** Returns a copy of this function with given components, or this
     * function if the components are the same. */
    public Function copy(List<Var> params, Expr body, @Nullable Type retType) {
      return sameElements(params, this.params)
          && body == this.body
          && retType == this.retType
          ? this
          : new Function(pos, ImmutableList.copyOf(params), body, retType,
              name);
    }
  }

  /** Call of an operator, function or external function. */
  public static class Call extends Expr {
    public final Expr op;
    public final ImmutableList<Expr> args;
    public final ImmutableMap<String, Object> attrs;
    public final ImmutableList<Type> typeArgs;

    Call(Pos pos, Expr op, ImmutableList<Expr> args,
        ImmutableMap<String, Object> attrs, ImmutableList<Type> typeArgs) {
      super(pos, Kind.CALL);
      this.op = requireNonNull(op, "op");
      this.args = requireNonNull(args, "args");
      this.attrs = requireNonNull(attrs, "attrs");
      this.typeArgs = requireNonNull(typeArgs, "typeArgs");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }

    /** Returns a copy of this call with given components, or this call if
     * the components are the same. */
    public Call copy(Expr op, List<Expr> args, List<Type> typeArgs) {
      return op == this.op
          && sameElements(args, this.args)
          && sameElements(typeArgs, this.typeArgs)
          ? this
          : new Call(pos, op, ImmutableList.copyOf(args), attrs,
              ImmutableList.copyOf(typeArgs));
    }

    /** Returns a new call with the same components as this, without
     * annotations. */
    public Call fresh() {
      return new Call(pos, op, args, attrs, typeArgs);
    }
  }

  /** Sequence of binding blocks followed by a body expression. */
  public static class SeqExpr extends Expr {
    public final ImmutableList<BindingBlock> blocks;
    public final Expr body;

    SeqExpr(Pos pos, ImmutableList<BindingBlock> blocks, Expr body) {
      super(pos, Kind.SEQ_EXPR);
      this.blocks = requireNonNull(blocks, "blocks");
      this.body = requireNonNull(body, "body");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }

    /** Returns a copy of this sequence with given components, or this
     * sequence if the components are the same. */
    public SeqExpr copy(List<BindingBlock> blocks, Expr body) {
      return sameElements(blocks, this.blocks) && body == this.body
          ? this
          : new SeqExpr(pos, ImmutableList.copyOf(blocks), body);
    }
  }

  /** Conditional expression. */
  public static class If extends Expr {
    public final Expr cond;
    public final Expr trueBranch;
    public final Expr falseBranch;

    If(Pos pos, Expr cond, Expr trueBranch, Expr falseBranch) {
      super(pos, Kind.IF);
      this.cond = requireNonNull(cond, "cond");
      this.trueBranch = requireNonNull(trueBranch, "trueBranch");
      this.falseBranch = requireNonNull(falseBranch, "falseBranch");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }

    /** Returns a copy of this conditional with given components, or this
     * conditional if the components are the same. */
    public If copy(Expr cond, Expr trueBranch, Expr falseBranch) {
      return cond == this.cond
          && trueBranch == this.trueBranch
          && falseBranch == this.falseBranch
          ? this
          : new If(pos, cond, trueBranch, falseBranch);
    }
  }

  /** Primitive operator, such as {@code add}.
   *
   * <p>Operators are interned: there is one {@code Op} per name; see
   * {@link IrBuilder#op(String)}. */
  public static class Op extends Expr {
    public final String name;

    Op(String name) {
      super(Pos.ZERO, Kind.OP);
      this.name = requireNonNull(name, "name");
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }
  }

  /** Access to a field of a tuple. */
  public static class TupleGetItem extends Expr {
    public final Expr tuple;
    public final int index;

    TupleGetItem(Pos pos, Expr tuple, int index) {
      super(pos, Kind.TUPLE_GET_ITEM);
      this.tuple = requireNonNull(tuple, "tuple");
      this.index = index;
      checkArgument(index >= 0, "negative index %s", index);
    }

    @Override
    public <R, A> R accept(ExprFunctor<R, A> functor, A arg) {
      return functor.visit(this, arg);
    }

    /** Returns a copy of this access with a given tuple, or this access if
     * the tuple is the same. */
    public TupleGetItem copy(Expr tuple) {
      return tuple == this.tuple ? this : new TupleGetItem(pos, tuple, index);
    }
  }

  /** Binding of a variable. */
  public abstract static class Binding extends IrNode {
    public final Var var;

    Binding(Pos pos, Kind kind, Var var) {
      super(pos, kind);
      this.var = requireNonNull(var, "var");
    }

    /** Returns the expression whose value is bound. */
    public abstract Expr value();

    @Override
    IrWriter unparse(IrWriter w) {
      return w.binding(this);
    }
  }

  /** Binding of a variable to the value of an expression. */
  public static class VarBinding extends Binding {
    public final Expr value;

    VarBinding(Pos pos, Var var, Expr value) {
      super(pos, Kind.VAR_BINDING, var);
      this.value = requireNonNull(value, "value");
    }

    @Override
    public Expr value() {
      return value;
    }

    /** Returns a copy of this binding with given components, or this
     * binding if the components are the same. */
    public VarBinding copy(Var var, Expr value) {
      return var == this.var && value == this.value
          ? this
          : new VarBinding(pos, var, value);
    }
  }

  /** Binding of a variable whose shape is derived by matching a pattern of
   * symbolic dimensions against the shape of a value. */
  public static class MatchShape extends Binding {
    public final Expr value;
    public final ImmutableList<PrimExpr> pattern;

    MatchShape(Pos pos, Expr value, ImmutableList<PrimExpr> pattern,
        Var var) {
      super(pos, Kind.MATCH_SHAPE, var);
      this.value = requireNonNull(value, "value");
      this.pattern = requireNonNull(pattern, "pattern");
    }

    @Override
    public Expr value() {
      return value;
    }

    /** Returns a copy of this binding with given components, or this
     * binding if the components are the same. */
    public MatchShape copy(Expr value, List<PrimExpr> pattern, Var var) {
      return value == this.value
          && sameElements(pattern, this.pattern)
          && var == this.var
          ? this
          : new MatchShape(pos, value, ImmutableList.copyOf(pattern), var);
    }
  }

  /** Ordered sequence of bindings. */
  public static class BindingBlock extends IrNode {
    public final ImmutableList<Binding> bindings;

    BindingBlock(Pos pos, ImmutableList<Binding> bindings) {
      this(pos, Kind.BINDING_BLOCK, bindings);
    }

    BindingBlock(Pos pos, Kind kind, ImmutableList<Binding> bindings) {
      super(pos, kind);
      this.bindings = requireNonNull(bindings, "bindings");
    }

    /** Returns whether this is a {@link DataflowBlock}. */
    public boolean isDataflow() {
      return false;
    }

    /** Returns a copy of this block with given bindings, or this block if
     * the bindings are the same. */
    public BindingBlock copy(List<Binding> bindings) {
      return sameElements(bindings, this.bindings)
          ? this
          : new BindingBlock(pos, ImmutableList.copyOf(bindings));
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.block(this);
    }
  }

  /** Block of bindings that are pure and may be reordered. The variables it
   * defines with {@link DataflowVar} are not visible outside it. */
  public static class DataflowBlock extends BindingBlock {
    DataflowBlock(Pos pos, ImmutableList<Binding> bindings) {
      super(pos, Kind.DATAFLOW_BLOCK, bindings);
    }

    @Override
    public boolean isDataflow() {
      return true;
    }

    @Override
    public DataflowBlock copy(List<Binding> bindings) {
      return sameElements(bindings, this.bindings)
          ? this
          : new DataflowBlock(pos, ImmutableList.copyOf(bindings));
    }
  }

  /** Returns whether two lists have the same elements, compared by
   * reference. */
  static <E> boolean sameElements(List<? extends E> list0,
      List<? extends E> list1) {
    if (list0 == list1) {
      return true;
    }
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }
}

// End Ir.java
