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
import java.util.Objects;

/**
 * Integer temporary, the type that inference gives to a local that is
 * assigned an integer.
 *
 * <p>Holds the name of the temporary and the value it was assigned.
 */
public class IntTemp extends DesignObject {
  public final String name;
  public final BigInteger value;

  public IntTemp(String name, BigInteger value) {
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IntTemp
            && name.equals(((IntTemp) o).name)
            && value.equals(((IntTemp) o).value);
  }

  @Override
  public String kind() {
    return "int temporary";
  }

  @Override
  public String toString() {
    return "(" + name + ", " + value + ")";
  }
}

// End IntTemp.java
