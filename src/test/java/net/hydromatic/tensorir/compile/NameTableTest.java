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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests {@link NameTable}. */
public class NameTableTest {
  @Test
  void testUniqueNames() {
    final NameTable nameTable = new NameTable();
    assertThat(nameTable.contains("x"), is(false));
    assertThat(nameTable.getUniqueName("x"), is("x"));
    assertThat(nameTable.contains("x"), is(true));
    assertThat(nameTable.getUniqueName("x"), is("x1"));
    assertThat(nameTable.getUniqueName("x"), is("x2"));
    assertThat(nameTable.getUniqueName("y"), is("y"));
    assertThat(nameTable.getUniqueName("a.b.c"), is("a_b_c"));
    assertThat(nameTable.getUniqueName("a_b_c"), is("a_b_c1"));
  }

  /** A hint that looks like a generated name does not cause a
   * collision. */
  @Test
  void testSuffixCollision() {
    final NameTable nameTable = new NameTable();
    final Set<String> names = new HashSet<>();
    for (String hint : new String[] {"v1", "v", "v", "v", "v2", "v1"}) {
      final String name = nameTable.getUniqueName(hint);
      assertThat(name + " is a duplicate", names.add(name), is(true));
    }
    assertThat(names.size(), is(6));
  }
}

// End NameTableTest.java
