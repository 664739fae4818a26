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

import static java.util.Objects.requireNonNull;

import net.hydromatic.hdl.type.Bits;

/** Bit-vector constant, such as a parameter of type {@link Bits}. */
public class Constant extends DesignObject {
  public final Bits value;

  public Constant(Bits value) {
    this.value = requireNonNull(value);
  }

  public int nbits() {
    return value.nbits;
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Constant
            && value.equals(((Constant) o).value);
  }

  @Override
  public String kind() {
    return "constant";
  }

  @Override
  public String toString() {
    return value.toString();
  }
}

// End Constant.java
