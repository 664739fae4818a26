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
package net.hydromatic.hdl.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Fixed-width signal: a port, a wire, or a register. */
public class Signal extends DesignObject {
  public final Kind signalKind;
  public final String name;
  public final int nbits;
  public final @Nullable Container parent;

  public Signal(Kind signalKind, String name, int nbits,
      @Nullable Container parent) {
    checkArgument(nbits > 0, "width must be positive: %s", nbits);
    this.signalKind = requireNonNull(signalKind);
    this.name = requireNonNull(name);
    this.nbits = nbits;
    this.parent = parent;
  }

  /** Creates a combinational temporary with no parent. */
  public static Signal temporary(String name, int nbits) {
    return new Signal(Kind.WIRE, name, nbits, null);
  }

  /** Returns the dotted name of this signal within the hierarchy. */
  public String fullName() {
    return parent == null ? name : parent.fullName() + "." + name;
  }

  /** Returns whether this signal holds state across evaluation steps. */
  public boolean isStateful() {
    return signalKind == Kind.REG;
  }

  /**
   * Returns a shallow copy of this signal with a new name and no parent. The
   * copy is a standalone temporary, not an alias.
   */
  public Signal copyAs(String name) {
    return new Signal(signalKind, name, nbits, null);
  }

  @Override
  public String kind() {
    return "signal";
  }

  @Override
  public String toString() {
    return signalKind.camelName + "(" + nbits + ", " + fullName() + ")";
  }

  /** Kind of signal. */
  public enum Kind {
    IN_PORT("InPort"),
    OUT_PORT("OutPort"),
    /** Combinational signal. */
    WIRE("Wire"),
    /** Stateful, register-like signal. */
    REG("Reg");

    public final String camelName;

    Kind(String camelName) {
      this.camelName = camelName;
    }
  }
}

// End Signal.java
