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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique names.
 *
 * <p>Keeps track of how many times each hint has been used, so that a new
 * occurrence of a hint can be given a fresh suffix. Several
 * {@link BlockBuilder}s may share a table, so that the names they mint do
 * not collide.
 */
public class NameTable {
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  /** Returns a name derived from {@code hint} that this table has not
   * returned before. The first use of a hint returns the hint itself
   * (with any '.' replaced by '_'); later uses append a counter. */
  public String getUniqueName(String hint) {
    final String prefix = hint.replace('.', '_');
    String name = prefix;
    for (;;) {
      final int n =
          nameCounts.computeIfAbsent(name, k -> new AtomicInteger(0))
              .getAndIncrement();
      if (n == 0) {
        return name;
      }
      name = prefix + n;
    }
  }

  /** Returns whether this table has returned a given name. */
  public boolean contains(String name) {
    return nameCounts.containsKey(name);
  }
}

// End NameTable.java
