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

/**
 * Instance of a hardware component.
 *
 * <p>A component has a class tag (the name of its type, such as "Adder") and
 * an instance name, and its members are ports, wires, registers, parameters
 * and sub-components.
 */
public class Component extends Container {
  public Component(String className, String name) {
    super(className, name);
  }

  /** Adds a sub-component, using its instance name as the field name. */
  public Component submodule(Component component) {
    return add(component.name, component);
  }

  @Override
  public String kind() {
    return "component";
  }

  @Override
  public String toString() {
    return className + "(" + fullName() + ")";
  }
}

// End Component.java
