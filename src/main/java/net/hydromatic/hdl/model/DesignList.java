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
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Indexed list of design objects.
 *
 * <p>Used for arrays of components, bundles and signals declared by a
 * component; for list literals in a behavioral block; and for the synthetic
 * lists created by {@link #project(String, String)} when a reference such as
 * {@code s.arr[i].port} is flattened.
 *
 * <p>Elements are expected to be homogeneous; see {@link #isHomogeneous()}.
 */
public class DesignList extends DesignObject {
  public final String name;
  public final List<DesignObject> elements;

  private DesignList(String name, ImmutableList<DesignObject> elements) {
    this.name = requireNonNull(name);
    this.elements = requireNonNull(elements);
  }

  public static DesignList of(String name,
      Iterable<? extends DesignObject> elements) {
    return new DesignList(name, ImmutableList.copyOf(elements));
  }

  /** Creates the object denoted by a list literal whose elements all
   * resolved. */
  public static DesignList literal(List<? extends DesignObject> elements) {
    return new DesignList("", ImmutableList.copyOf(elements));
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public DesignObject get(int i) {
    return elements.get(i);
  }

  /** Returns the first element, or null if the list is empty. */
  public @Nullable DesignObject first() {
    return elements.isEmpty() ? null : elements.get(0);
  }

  /** Returns whether all elements are of the same class. */
  public boolean isHomogeneous() {
    for (DesignObject element : elements) {
      if (element.getClass() != elements.get(0).getClass()) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether the elements are components. */
  public boolean isComponentList() {
    return first() instanceof Component;
  }

  /** Returns whether the elements are bundles. */
  public boolean isBundleList() {
    return first() instanceof Bundle;
  }

  /** Returns whether the elements are signals. */
  public boolean isSignalList() {
    return first() instanceof Signal;
  }

  /**
   * Creates a list of the given field of every element, in the same order.
   *
   * <p>For example, if this list contains components {@code c0, c1} and
   * {@code field} is "out", returns the list {@code c0.out, c1.out}.
   *
   * @throws IllegalArgumentException if an element has no such field
   */
  public DesignList project(String field, String name) {
    final ImmutableList.Builder<DesignObject> b = ImmutableList.builder();
    for (int i = 0; i < elements.size(); i++) {
      final DesignObject element = elements.get(i);
      final Optional<DesignObject> o = element.resolveField(field);
      checkArgument(o.isPresent(), "element %s of %s has no field '%s'", i,
          this.name, field);
      b.add(o.get());
    }
    return new DesignList(name, b.build());
  }

  @Override
  public String kind() {
    return "list";
  }

  @Override
  public String toString() {
    return "List(" + name + ", " + elements.size() + ")";
  }
}

// End DesignList.java
