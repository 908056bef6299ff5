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

/** Visitor over {@link Type} objects that returns types. */
public class TypeShuttle extends TypeVisitor<Type> {
  @Override
  public Type visit(PrimitiveType primitiveType) {
    return primitiveType.copy(t -> t.accept(this));
  }

  @Override
  public Type visit(DynTensorType dynTensorType) {
    return dynTensorType.copy(t -> t.accept(this));
  }

  @Override
  public Type visit(TupleType tupleType) {
    return tupleType.copy(t -> t.accept(this));
  }

  @Override
  public Type visit(FuncType funcType) {
    return funcType.copy(t -> t.accept(this));
  }
}

// End TypeShuttle.java
