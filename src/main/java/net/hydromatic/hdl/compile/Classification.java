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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.hdl.model.DesignList;
import net.hydromatic.hdl.model.DesignObject;
import net.hydromatic.hdl.model.Signal;

/**
 * Storage classes of the objects referenced by a lowered block.
 *
 * <p>A signal may be both a register and a loop variable; code generation
 * resolves such overlaps when it emits declarations.
 *
 * @see Classifier
 */
public class Classification {
  /** Signals assigned by the block, keyed by full name. */
  public final ImmutableMap<String, Signal> registers;
  /** Names bound by {@code for} loops and integer temporaries. */
  public final ImmutableSet<String> loopVariables;
  /** Integer and bit-vector constants referenced by the block. */
  public final ImmutableSet<Param> parameters;
  /** Indexed lists referenced by the block, each mapped to whether it is
   * ever written. */
  public final ImmutableMap<DesignList, Boolean> arrays;

  Classification(Map<String, Signal> registers, Iterable<String> loopVariables,
      Iterable<Param> parameters, Map<DesignList, Boolean> arrays) {
    this.registers = ImmutableMap.copyOf(registers);
    this.loopVariables = ImmutableSet.copyOf(loopVariables);
    this.parameters = ImmutableSet.copyOf(parameters);
    this.arrays = ImmutableMap.copyOf(arrays);
  }

  /** Returns the full names of the registers, in the order first
   * assigned. */
  public ImmutableList<String> registerNames() {
    return registers.keySet().asList();
  }

  /** Returns whether an array appears on the left-hand side of an
   * assignment. */
  public boolean isWritten(DesignList array) {
    return Boolean.TRUE.equals(arrays.get(array));
  }

  @Override
  public String toString() {
    return "registers " + registers.keySet()
        + ", loop variables " + loopVariables
        + ", parameters " + parameters
        + ", arrays " + arrays;
  }

  /** A named constant referenced by a block. */
  public static class Param {
    public final String name;
    public final DesignObject obj;

    public Param(String name, DesignObject obj) {
      this.name = requireNonNull(name);
      this.obj = requireNonNull(obj);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, obj);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param
              && name.equals(((Param) o).name)
              && obj.equals(((Param) o).obj);
    }

    @Override
    public String toString() {
      return name + "=" + obj;
    }
  }
}

// End Classification.java
