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

import net.hydromatic.hdl.model.DesignObject;

/**
 * Resolved reference: the path by which an object was reached, and the
 * object.
 *
 * <p>For example, resolving {@code s.mod.port} starts with the binding
 * ("", s), then ("mod", s.mod), then ("mod.port", s.mod.port). Bindings are
 * immutable; {@link #extend} creates a new binding.
 */
public class Binding {
  public final String path;
  public final DesignObject obj;

  private Binding(String path, DesignObject obj) {
    this.path = requireNonNull(path);
    this.obj = requireNonNull(obj);
  }

  /** Creates a binding with an empty path. */
  public static Binding root(DesignObject obj) {
    return new Binding("", obj);
  }

  public static Binding of(String path, DesignObject obj) {
    return new Binding(path, obj);
  }

  /** Creates a binding reached from this one via {@code step}. */
  public Binding extend(String step, DesignObject obj) {
    final String path2 =
        path.isEmpty() || step.startsWith("[")
            ? path + step
            : path + "." + step;
    return new Binding(path2, obj);
  }

  @Override
  public String toString() {
    return "Binding(" + (path.isEmpty() ? "<root>" : path) + ", " + obj + ")";
  }
}

// End Binding.java
