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

/** Sub-types of {@link IrNode}.
 *
 * <p>The set of expression kinds is closed; every {@link Ir.Expr} has
 * exactly one of the first fourteen kinds. */
public enum Kind {
  // expressions
  CONSTANT(true),
  TUPLE,
  VAR(true),
  DATAFLOW_VAR(true),
  SHAPE_EXPR(true),
  RUNTIME_DEP_SHAPE(true),
  EXTERN_FUNC(true),
  GLOBAL_VAR(true),
  FUNCTION,
  CALL,
  SEQ_EXPR,
  IF,
  OP(true),
  TUPLE_GET_ITEM,

  // bindings
  VAR_BINDING,
  MATCH_SHAPE,

  // blocks
  BINDING_BLOCK,
  DATAFLOW_BLOCK;

  /** Whether a node of this kind is atomic: it has no sub-expressions and
   * may appear as an argument in normal form. */
  public final boolean atomic;

  Kind() {
    this(false);
  }

  Kind(boolean atomic) {
    this.atomic = atomic;
  }

  /** Returns whether this is one of the kinds of {@link Ir.Expr}. */
  public boolean isExpr() {
    return ordinal() <= TUPLE_GET_ITEM.ordinal();
  }
}

// End Kind.java
