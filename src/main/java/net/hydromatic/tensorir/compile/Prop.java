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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how IR is built and transformed.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is
 * absent from the map has its default value.
 *
 * @see BlockBuilder#create(Map)
 */
public enum Prop {
  /**
   * String property "localNameHint" is the name given to a variable that
   * is emitted without a name hint and is visible only locally (a
   * {@link net.hydromatic.tensorir.ast.Ir.DataflowVar}). Default is "lv".
   */
  LOCAL_NAME_HINT("localNameHint", String.class, "lv"),

  /**
   * String property "globalNameHint" is the name given to a variable that
   * is emitted without a name hint and is visible outside its block.
   * Default is "gv".
   */
  GLOBAL_NAME_HINT("globalNameHint", String.class, "gv"),

  /**
   * Boolean property "normalizeArguments" controls whether
   * {@link ExprMutator} binds a compound expression that its rewrite
   * produces in argument position (a call argument, a tuple field, the
   * condition of an {@code If}) to a fresh variable. Default is true.
   */
  NORMALIZE_ARGUMENTS("normalizeArguments", Boolean.class, true),

  /**
   * Boolean property "warnOnUnclosedBlocks" controls whether
   * {@link BlockBuilder#close()} logs a warning if blocks are still being
   * built. Default is true.
   */
  WARN_ON_UNCLOSED_BLOCKS("warnOnUnclosedBlocks", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName)
        .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns
   * null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value reverts the property to its default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
