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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Range or slice descriptor from the host program, such as a constant that
 * names a bit field, {@code FIELD = slice(0, 4)}.
 */
public class RangeValue extends DesignObject {
  public final int start;
  public final int stop;
  public final @Nullable Integer step;

  public RangeValue(int start, int stop, @Nullable Integer step) {
    this.start = start;
    this.stop = stop;
    this.step = step;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, stop, step);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RangeValue
            && start == ((RangeValue) o).start
            && stop == ((RangeValue) o).stop
            && Objects.equals(step, ((RangeValue) o).step);
  }

  @Override
  public String kind() {
    return "range";
  }

  @Override
  public String toString() {
    return "slice(" + start + ", " + stop
        + (step == null ? "" : ", " + step) + ")";
  }
}

// End RangeValue.java
