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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Type of a tensor whose rank may be known but whose dimensions are dynamic.
 *
 * <p>The dimensions themselves are not part of the type; they are carried by
 * the shape annotation of the expression.
 */
public class DynTensorType implements Type {
  /** Rank that signifies that the rank is not known. */
  public static final int UNKNOWN_NDIM = -1;

  /** Number of dimensions, or {@link #UNKNOWN_NDIM}. */
  public final int ndim;

  /** Element type. */
  public final DType dtype;

  DynTensorType(int ndim, DType dtype) {
    checkArgument(ndim >= UNKNOWN_NDIM, "invalid rank %s", ndim);
    this.ndim = ndim;
    this.dtype = requireNonNull(dtype, "dtype");
  }

  /** Creates a tensor type. */
  public static DynTensorType of(int ndim, DType dtype) {
    return new DynTensorType(ndim, dtype);
  }

  /** Creates a tensor type whose rank and element type are unknown. */
  public static DynTensorType unknown() {
    return new DynTensorType(UNKNOWN_NDIM, DType.VOID);
  }

  /** Returns whether the rank is unknown. */
  public boolean isUnknownNdim() {
    return ndim == UNKNOWN_NDIM;
  }

  @Override
  public String moniker() {
    return "Tensor["
        + (isUnknownNdim() ? "_" : Integer.toString(ndim))
        + ", "
        + dtype
        + "]";
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public int hashCode() {
    return Objects.hash(ndim, dtype);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DynTensorType
            && ((DynTensorType) o).ndim == ndim
            && ((DynTensorType) o).dtype == dtype;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public DynTensorType copy(UnaryOperator<Type> transform) {
    return this;
  }
}

// End DynTensorType.java
