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
package net.hydromatic.hdl.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.hdl.model.Component;
import net.hydromatic.hdl.model.DesignObject;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lexical environment of a behavioral block: the component that encloses it,
 * the variables it captures, and the global constants it may reference.
 *
 * <p>Every environment is immutable; {@link #bindGlobal} and
 * {@link #bindCaptured} create a new environment that inherits from this one.
 * The new environment may obscure bindings in the old environment, but
 * neither the new nor the old will ever change.
 */
public class Environment {
  /** The component whose block is being lowered. */
  public final Component self;
  private final ImmutableMap<String, DesignObject> captured;
  private final ImmutableMap<String, DesignObject> globals;

  private Environment(Component self,
      ImmutableMap<String, DesignObject> captured,
      ImmutableMap<String, DesignObject> globals) {
    this.self = requireNonNull(self);
    this.captured = requireNonNull(captured);
    this.globals = requireNonNull(globals);
  }

  /**
   * Creates an environment for a block of {@code self} that refers to its
   * component via the variable {@code selfName}, typically "s".
   */
  public static Environment of(Component self, String selfName) {
    return new Environment(self, ImmutableMap.of(selfName, self),
        ImmutableMap.of());
  }

  /** Creates an environment with one more captured variable. */
  public Environment bindCaptured(String name, DesignObject value) {
    return new Environment(self, plus(captured, name, value), globals);
  }

  /** Creates an environment with one more global constant. */
  public Environment bindGlobal(String name, DesignObject value) {
    return new Environment(self, captured, plus(globals, name, value));
  }

  private static ImmutableMap<String, DesignObject> plus(
      ImmutableMap<String, DesignObject> map, String name,
      DesignObject value) {
    final Map<String, DesignObject> m = new LinkedHashMap<>(map);
    m.put(requireNonNull(name), requireNonNull(value));
    return ImmutableMap.copyOf(m);
  }

  /** Returns the global constant called {@code name}, or null. */
  public @Nullable DesignObject getGlobal(String name) {
    return globals.get(name);
  }

  /** Returns the captured variable called {@code name}, or null. */
  public @Nullable DesignObject getCaptured(String name) {
    return captured.get(name);
  }

  /** Returns whether {@code name} is a variable bound to the enclosing
   * component. */
  public boolean isSelf(String name) {
    return captured.get(name) == self;
  }

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we
   * did, debuggers would invoke it automatically.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    globals.forEach((k, v) -> b.append("global ").append(k).append(" = ")
        .append(v).append("\n"));
    captured.forEach((k, v) -> b.append(k).append(" = ").append(v)
        .append("\n"));
    return b.toString();
  }
}

// End Environment.java
