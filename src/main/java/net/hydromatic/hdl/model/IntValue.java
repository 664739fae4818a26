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

import java.math.BigInteger;

/** Plain integer from the host program, such as a loop bound. */
public class IntValue extends DesignObject {
  public final BigInteger value;

  private IntValue(BigInteger value) {
    this.value = requireNonNull(value);
  }

  public static IntValue of(long value) {
    return new IntValue(BigInteger.valueOf(value));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IntValue
            && value.equals(((IntValue) o).value);
  }

  @Override
  public String kind() {
    return "int";
  }

  @Override
  public String toString() {
    return value.toString();
  }
}

// End IntValue.java
