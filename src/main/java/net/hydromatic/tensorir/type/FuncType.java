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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** Function type. */
public class FuncType implements Type {
  public final ImmutableList<Type> argTypes;
  public final Type retType;

  FuncType(ImmutableList<Type> argTypes, Type retType) {
    this.argTypes = argTypes;
    this.retType = requireNonNull(retType, "retType");
  }

  /** Creates a function type. */
  public static FuncType of(List<? extends Type> argTypes, Type retType) {
    return new FuncType(ImmutableList.copyOf(argTypes), retType);
  }

  @Override
  public String moniker() {
    final StringBuilder b = new StringBuilder("(");
    for (int i = 0; i < argTypes.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(argTypes.get(i).moniker());
    }
    return b.append(") -> ").append(retType.moniker()).toString();
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public int hashCode() {
    return Objects.hash(argTypes, retType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FuncType
            && ((FuncType) o).argTypes.equals(argTypes)
            && ((FuncType) o).retType.equals(retType);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public FuncType copy(UnaryOperator<Type> transform) {
    final ImmutableList.Builder<Type> b = ImmutableList.builder();
    boolean changed = false;
    for (Type argType : argTypes) {
      final Type argType2 = transform.apply(argType);
      b.add(argType2);
      changed |= argType2 != argType;
    }
    final Type retType2 = transform.apply(retType);
    changed |= retType2 != retType;
    return changed ? new FuncType(b.build(), retType2) : this;
  }
}

// End FuncType.java
