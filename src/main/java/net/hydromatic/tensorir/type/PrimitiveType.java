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
package net.hydromatic.tensorir.type;

import java.util.Locale;
import java.util.function.UnaryOperator;

/** Type that has no components. */
public enum PrimitiveType implements Type {
  /** Type of a shape value, such as a {@code ShapeExpr}. Its rank and
   * dimensions are not part of the type; they are tracked as the shape
   * annotation of the expression. */
  SHAPE,

  /** Type of an opaque runtime object. */
  OBJECT;

  /** The name in the IR, e.g. {@code Shape}. */
  public final String moniker =
      name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public PrimitiveType copy(UnaryOperator<Type> transform) {
    return this;
  }
}

// End PrimitiveType.java
