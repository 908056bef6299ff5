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

/** Element data type of a tensor. */
public enum DType {
  BOOL(1),
  INT8(8),
  INT32(32),
  INT64(64),
  FLOAT16(16),
  FLOAT32(32),
  FLOAT64(64),
  /** Unknown element type. */
  VOID(0);

  /** Number of bits in one element; 0 if unknown. */
  public final int bits;

  /** The name in the IR, e.g. {@code float32}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  DType(int bits) {
    this.bits = bits;
  }

  /** Returns whether the element type is known. */
  public boolean isKnown() {
    return this != VOID;
  }

  /** Looks up a data type by its name, e.g. "float32". */
  public static DType of(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return moniker;
  }
}

// End DType.java
