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

import static net.hydromatic.hdl.ast.AstBuilder.ast;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Shuttle;
import net.hydromatic.hdl.model.Bundle;
import net.hydromatic.hdl.model.Component;
import net.hydromatic.hdl.model.DesignList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Collapses the design hierarchy into flat identifiers.
 *
 * <p>A member of a sub-component, {@code sub.port}, becomes
 * {@code sub$port}; a member of a bundle, {@code b.port}, becomes
 * {@code b_port}; and a member of an element of a list of components,
 * {@code subs[i].port}, becomes an element of a list of ports,
 * {@code subs$port[i]}.
 *
 * <p>Names of nested sub-components are joined in full, so
 * {@code adder.inc.out} becomes {@code adder$inc$out}, not {@code inc$out}.
 *
 * <p>A sub-component or bundle reached through an element of a list, such
 * as {@code subs[i].sub.port}, has no flat name that keeps the index, and
 * is an error.
 */
public class Flattener {
  /** Separator between a sub-component and its member. */
  public static final String COMPONENT_SEPARATOR = "$";

  /** Separator between a bundle and its member. */
  public static final String BUNDLE_SEPARATOR = "_";

  /** Lists of one field of every element of a list, keyed by the list and
   * then by the field. */
  private final Map<DesignList, Map<String, DesignList>> projections =
      new IdentityHashMap<>();

  /** Creates a Flattener. Its cache of projections lasts as long as it
   * does, typically for the lowering of one block. */
  public Flattener() {}

  /** Flattens members of sub-components. */
  public Ast.FunctionDef flattenSubmodules(Ast.FunctionDef functionDef) {
    return functionDef.accept(new SubmoduleFlattener());
  }

  /** Flattens members of bundles. */
  public Ast.FunctionDef flattenBundles(Ast.FunctionDef functionDef) {
    return functionDef.accept(new BundleFlattener());
  }

  /** Flattens members of elements of lists of sub-components and lists of
   * bundles. */
  public Ast.FunctionDef flattenLists(Ast.FunctionDef functionDef) {
    return functionDef.accept(new ListFlattener());
  }

  /** Returns the identifier of a reference, or null if it has none. */
  private static @Nullable String identifier(Ast.@Nullable Exp e) {
    if (e instanceof Ast.Name) {
      return ((Ast.Name) e).name;
    } else if (e instanceof Ast.Attribute) {
      return ((Ast.Attribute) e).attr;
    } else {
      return null;
    }
  }

  /** Returns whether a chain of attribute accesses passes through a
   * subscript. */
  private static boolean throughSubscript(Ast.@Nullable Exp e) {
    while (e instanceof Ast.Attribute) {
      e = ((Ast.Attribute) e).receiver;
    }
    return e instanceof Ast.Subscript;
  }

  private static CompileException ambiguous(Ast.Attribute attribute) {
    return CompileException.at(CompileException.Kind.AMBIGUOUS_FLATTENING,
        attribute, "Don't know how to flatten '" + attribute + "'");
  }

  /** Returns the list of field {@code field} of every element of
   * {@code list}. The same list is returned for repeated calls. */
  DesignList project(Ast.Subscript subscript, DesignList list, String field,
      String name) {
    final Map<String, DesignList> fieldMap =
        projections.computeIfAbsent(list, k -> new HashMap<>());
    DesignList projection = fieldMap.get(field);
    if (projection == null) {
      try {
        projection = list.project(field, name);
      } catch (IllegalArgumentException e) {
        throw CompileException.at(CompileException.Kind.UNRESOLVED_REFERENCE,
            subscript, e.getMessage());
      }
      fieldMap.put(field, projection);
    }
    return projection;
  }

  /** Shuttle that flattens members of sub-components. */
  private static class SubmoduleFlattener extends Shuttle {
    @Override
    protected Ast.Exp visit(Ast.Attribute attribute) {
      final Ast.Exp receiver = visitOpt(attribute.receiver);
      if (receiver != null && receiver.obj instanceof Component) {
        if (throughSubscript(receiver)) {
          throw ambiguous(attribute);
        }
        // If the receiver has already been flattened, say to "a$b", the
        // result is "a$b$port"; otherwise use the component's name.
        final String prefix =
            attribute.receiver instanceof Ast.Attribute
                    && receiver instanceof Ast.Name
                ? ((Ast.Name) receiver).name
                : ((Component) receiver.obj).name;
        return ast.name(attribute.pos,
            prefix + COMPONENT_SEPARATOR + attribute.attr, attribute.ctx,
            attribute.obj);
      }
      return attribute.copy(receiver, attribute.attr, attribute.obj);
    }
  }

  /** Shuttle that flattens members of bundles. */
  private static class BundleFlattener extends Shuttle {
    @Override
    protected Ast.Exp visit(Ast.Attribute attribute) {
      final Ast.Exp receiver = visitOpt(attribute.receiver);
      final String prefix = identifier(receiver);
      if (receiver != null
          && receiver.obj instanceof Bundle
          && prefix != null) {
        if (throughSubscript(receiver)) {
          throw ambiguous(attribute);
        }
        return ast.name(attribute.pos,
            prefix + BUNDLE_SEPARATOR + attribute.attr, attribute.ctx,
            attribute.obj);
      }
      return attribute.copy(receiver, attribute.attr, attribute.obj);
    }
  }

  /** Shuttle that converts {@code r[i].attr} to {@code r$attr[i]}. */
  private class ListFlattener extends Shuttle {
    @Override
    protected Ast.Exp visit(Ast.Attribute attribute) {
      if (!(attribute.receiver instanceof Ast.Subscript)) {
        return super.visit(attribute);
      }
      final Ast.Subscript subscript = (Ast.Subscript) attribute.receiver;
      if (subscript.obj == null) {
        return super.visit(attribute);
      }
      final String separator;
      if (subscript.obj instanceof DesignList
          && ((DesignList) subscript.obj).isComponentList()) {
        separator = COMPONENT_SEPARATOR;
      } else if (subscript.obj instanceof DesignList
          && ((DesignList) subscript.obj).isBundleList()) {
        separator = BUNDLE_SEPARATOR;
      } else {
        throw ambiguous(attribute);
      }
      final Ast.Exp value = subscript.value.accept(this);
      final String prefix = identifier(value);
      if (prefix == null) {
        throw ambiguous(attribute);
      }
      final String name = prefix + separator + attribute.attr;
      final DesignList projection =
          project(subscript, (DesignList) subscript.obj, attribute.attr,
              name);
      final Ast.Exp value2;
      if (value instanceof Ast.Name) {
        value2 = ast.name(value.pos, name, ((Ast.Name) value).ctx, projection);
      } else {
        final Ast.Attribute a = (Ast.Attribute) value;
        value2 = a.copy(a.receiver, name, projection);
      }
      return ast.subscript(subscript.pos, value2,
          subscript.index.accept(this), attribute.ctx, projection);
    }
  }
}

// End Flattener.java
