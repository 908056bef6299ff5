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

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.tensorir.ast.Ir;
import net.hydromatic.tensorir.ast.Kind;
import net.hydromatic.tensorir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Registry of shape and type inference rules, keyed by operator name.
 *
 * <p>An operator may have a shape rule, a type rule, both or neither. A
 * missing rule is not an error; inference yields an unknown (null) shape or
 * type. */
public class OpRegistry {
  private final Map<String, FInferShape> shapeRules = new HashMap<>();
  private final Map<String, FInferType> typeRules = new HashMap<>();

  /** Creates an empty registry. */
  public OpRegistry() {
  }

  /** Creates a registry that contains the rules of the built-in
   * operators. */
  public static OpRegistry standard() {
    final OpRegistry registry = new OpRegistry();
    for (BuiltIn builtIn : BuiltIn.values()) {
      registry.register(builtIn.opName, builtIn.shapeRule, builtIn.typeRule);
    }
    return registry;
  }

  /** Registers the rules of an operator, replacing any previous rules.
   * Either rule may be null. */
  public OpRegistry register(String opName, @Nullable FInferShape shapeRule,
      @Nullable FInferType typeRule) {
    requireNonNull(opName, "opName");
    if (shapeRule == null) {
      shapeRules.remove(opName);
    } else {
      shapeRules.put(opName, shapeRule);
    }
    if (typeRule == null) {
      typeRules.remove(opName);
    } else {
      typeRules.put(opName, typeRule);
    }
    return this;
  }

  /** Returns the shape rule for the operator of a call, or null. Calls to
   * anything other than an {@link Ir.Op} have no rule. */
  public @Nullable FInferShape shapeRule(Ir.Call call) {
    return call.op.kind == Kind.OP
        ? shapeRules.get(((Ir.Op) call.op).name)
        : null;
  }

  /** Returns the type rule for the operator of a call, or null. */
  public @Nullable FInferType typeRule(Ir.Call call) {
    return call.op.kind == Kind.OP
        ? typeRules.get(((Ir.Op) call.op).name)
        : null;
  }

  /** Infers the shape of a call; returns null if there is no rule. */
  public Ir.@Nullable Expr inferShape(Ir.Call call,
      DiagnosticContext context) {
    final FInferShape rule = shapeRule(call);
    return rule == null ? null : rule.inferShape(call, context);
  }

  /** Infers the type of a call; returns null if there is no rule. */
  public @Nullable Type inferType(Ir.Call call, DiagnosticContext context) {
    final FInferType rule = typeRule(call);
    return rule == null ? null : rule.inferType(call, context);
  }
}

// End OpRegistry.java
