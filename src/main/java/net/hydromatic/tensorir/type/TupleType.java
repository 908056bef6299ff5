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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;

/** Tuple type. */
public class TupleType implements Type {
  public final ImmutableList<Type> fields;

  TupleType(ImmutableList<Type> fields) {
    this.fields = fields;
  }

  /** Creates a tuple type. */
  public static TupleType of(List<? extends Type> fields) {
    return new TupleType(ImmutableList.copyOf(fields));
  }

  /** Creates a tuple type. */
  public static TupleType of(Type... fields) {
    return new TupleType(ImmutableList.copyOf(fields));
  }

  @Override
  public String moniker() {
    final StringBuilder b = new StringBuilder("Tuple(");
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(fields.get(i).moniker());
    }
    return b.append(')').toString();
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType && ((TupleType) o).fields.equals(fields);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public TupleType copy(UnaryOperator<Type> transform) {
    final ImmutableList.Builder<Type> b = ImmutableList.builder();
    boolean changed = false;
    for (Type field : fields) {
      final Type field2 = transform.apply(field);
      b.add(field2);
      changed |= field2 != field;
    }
    return changed ? new TupleType(b.build()) : this;
  }
}

// End TupleType.java
