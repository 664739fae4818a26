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

import java.util.Optional;

/**
 * Object in a hardware design that a name in a behavioral block may denote.
 *
 * <p>The set of sub-classes is closed: {@link Component}, {@link Bundle},
 * {@link Signal}, {@link DesignList}, {@link Constant}, {@link IntValue},
 * {@link RangeValue}, and the inferred {@link IntTemp}.
 *
 * <p>Attribute references are resolved via {@link #resolveField(String)}
 * rather than by reflection.
 */
public abstract class DesignObject {
  DesignObject() {}

  /**
   * Returns the object denoted by field {@code name} of this object, or empty
   * if this object has no such field.
   */
  public Optional<DesignObject> resolveField(String name) {
    return Optional.empty();
  }

  /** Returns a short description of the kind of this object, for messages. */
  public abstract String kind();
}

// End DesignObject.java
