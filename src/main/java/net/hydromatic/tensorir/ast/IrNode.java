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

import static java.util.Objects.requireNonNull;

/** Node of the intermediate representation. */
public abstract class IrNode {
  public final Pos pos;
  public final Kind kind;

  IrNode(Pos pos, Kind kind) {
    this.pos = requireNonNull(pos, "pos");
    this.kind = requireNonNull(kind, "kind");
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging; the format is not stable.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new IrWriter()).toString();
  }

  abstract IrWriter unparse(IrWriter w);
}

// End IrNode.java
