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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.hdl.type.Bits;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Design object that has named members: a {@link Component} or a
 * {@link Bundle}.
 *
 * <p>Members are added while the design is being built, and are not changed
 * afterwards. Signals created via the helper methods have this object as
 * their parent.
 */
public abstract class Container extends DesignObject {
  public final String className;
  public final String name;
  private @Nullable Container parent;
  private final Map<String, DesignObject> members = new LinkedHashMap<>();

  Container(String className, String name) {
    this.className = requireNonNull(className);
    this.name = requireNonNull(name);
  }

  @Override
  public Optional<DesignObject> resolveField(String name) {
    return Optional.ofNullable(members.get(name));
  }

  /** Returns the members of this container, in the order they were added. */
  public Map<String, DesignObject> members() {
    return ImmutableMap.copyOf(members);
  }

  public @Nullable Container parent() {
    return parent;
  }

  /** Returns the dotted name of this container within the hierarchy. */
  public String fullName() {
    return parent == null ? name : parent.fullName() + "." + name;
  }

  /** Adds a member. If the member is a container, this becomes its parent. */
  public <T extends DesignObject> T add(String field, T member) {
    checkArgument(!members.containsKey(field), "duplicate member %s in %s",
        field, name);
    if (member instanceof Container) {
      final Container container = (Container) member;
      checkArgument(container.parent == null, "%s already has a parent",
          container.name);
      container.parent = this;
    } else if (member instanceof DesignList) {
      for (DesignObject element : ((DesignList) member).elements) {
        if (element instanceof Container
            && ((Container) element).parent == null) {
          ((Container) element).parent = this;
        }
      }
    }
    members.put(field, member);
    return member;
  }

  public Signal inPort(String name, int nbits) {
    return add(name, new Signal(Signal.Kind.IN_PORT, name, nbits, this));
  }

  public Signal outPort(String name, int nbits) {
    return add(name, new Signal(Signal.Kind.OUT_PORT, name, nbits, this));
  }

  public Signal wire(String name, int nbits) {
    return add(name, new Signal(Signal.Kind.WIRE, name, nbits, this));
  }

  public Signal reg(String name, int nbits) {
    return add(name, new Signal(Signal.Kind.REG, name, nbits, this));
  }

  /** Adds a list of signals named "name[0]", "name[1]", and so on. */
  public DesignList signals(Signal.Kind kind, String name, int count,
      int nbits) {
    final List<Signal> list = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      list.add(new Signal(kind, name + "[" + i + "]", nbits, this));
    }
    return add(name, DesignList.of(name, list));
  }

  /** Adds a list of components or bundles. */
  public DesignList list(String name, List<? extends DesignObject> elements) {
    return add(name, DesignList.of(name, elements));
  }

  /** Adds a plain integer parameter. */
  public IntValue param(String name, long value) {
    return add(name, IntValue.of(value));
  }

  /** Adds a bit-vector constant. */
  public Constant constant(String name, Bits value) {
    return add(name, new Constant(value));
  }

  /** Adds a range (slice) descriptor. */
  public RangeValue range(String name, int start, int stop) {
    return add(name, new RangeValue(start, stop, null));
  }

  /** Returns the names of the members, for use in messages. */
  public List<String> memberNames() {
    return ImmutableList.copyOf(members.keySet());
  }
}

// End Container.java
