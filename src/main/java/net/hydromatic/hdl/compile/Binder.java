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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Shuttle;
import net.hydromatic.hdl.model.DesignList;
import net.hydromatic.hdl.model.DesignObject;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Annotates names and attribute accesses with the design objects they
 * denote.
 *
 * <p>Resolution walks each attribute chain from its root name, keeping the
 * current {@link Binding} in {@link #current}. A name that is neither a
 * global constant nor a captured variable is a local temporary, and remains
 * unannotated until type inference.
 */
public class Binder extends Shuttle {
  private final Environment env;
  private final Set<String> accessorNames;
  private final boolean checkHomogeneous;

  /** Binding reached by the most recent name, attribute or subscript; null
   * if it did not resolve. */
  private @Nullable Binding current;

  private Binder(Environment env, Set<String> accessorNames,
      boolean checkHomogeneous) {
    this.env = requireNonNull(env);
    this.accessorNames = ImmutableSet.copyOf(accessorNames);
    this.checkHomogeneous = checkHomogeneous;
  }

  /** Annotates a declaration. */
  public static Ast.Decl bind(Environment env, Map<Prop, Object> propMap,
      Ast.Decl decl) {
    final Binder binder =
        new Binder(env,
            ImmutableSet.copyOf(Prop.ACCESSOR_NAMES.listValue(propMap)),
            Prop.CHECK_HOMOGENEOUS.booleanValue(propMap));
    return decl.accept(binder);
  }

  private static @Nullable DesignObject objOf(@Nullable Binding binding) {
    return binding == null ? null : binding.obj;
  }

  @Override
  protected Ast.Exp visit(Ast.Name name) {
    final DesignObject global = env.getGlobal(name.name);
    final DesignObject captured = env.getCaptured(name.name);
    if (global != null) {
      current = Binding.root(global);
    } else if (captured == null) {
      current = null; // a local temporary
    } else if (env.isSelf(name.name)) {
      current = Binding.root(env.self);
    } else {
      current = Binding.of(name.name, captured);
    }
    return name.copy(name.ctx, objOf(current));
  }

  @Override
  protected Ast.Exp visit(Ast.Attribute attribute) {
    final Ast.Exp receiver;
    if (attribute.receiver == null) {
      current = Binding.root(env.self);
      receiver = null;
    } else {
      receiver = attribute.receiver.accept(this);
      if (!isChain(receiver)) {
        current = null;
      }
    }
    if (current != null) {
      final Optional<DesignObject> o = current.obj.resolveField(attribute.attr);
      if (o.isPresent()) {
        current = current.extend(attribute.attr, o.get());
      } else if (!accessorNames.contains(attribute.attr)) {
        throw CompileException.at(CompileException.Kind.UNRESOLVED_REFERENCE,
            attribute,
            "Unknown attribute '" + attribute.attr + "' of "
                + current.obj.kind() + " "
                + (current.path.isEmpty() ? current.obj : current.path));
      }
    }
    return attribute.copy(receiver, attribute.attr, objOf(current));
  }

  /** Returns whether an expression's binding is carried into an attribute
   * access on it. */
  private static boolean isChain(Ast.Exp e) {
    return e instanceof Ast.Name
        || e instanceof Ast.Attribute
        || e instanceof Ast.Subscript
        || e instanceof Ast.ListExp;
  }

  @Override
  protected Ast.Exp visit(Ast.Subscript subscript) {
    final Ast.Exp value = subscript.value.accept(this);
    if (!isChain(value)) {
      current = null;
    }

    // The index does not see the binding of the container.
    final Binding stash = current;
    current = null;
    final Ast.Exp index = subscript.index.accept(this);
    current = stash;

    final DesignObject obj = objOf(current);
    if (current != null && obj instanceof DesignList) {
      final DesignList list = (DesignList) obj;
      if (!list.isEmpty()) {
        if (checkHomogeneous && !list.isHomogeneous()) {
          throw CompileException.at(CompileException.Kind.HETEROGENEOUS_LIST,
              subscript,
              "Elements of list '" + list.name + "' have different kinds");
        }
        current = current.extend("[]", list.get(0));
      }
    }
    return subscript.copy(value, index, obj);
  }

  @Override
  protected Ast.Exp visit(Ast.ListExp list) {
    final List<Ast.Exp> args = new ArrayList<>();
    final List<DesignObject> objs = new ArrayList<>();
    boolean resolved = true;
    for (Ast.Exp arg : list.args) {
      final Ast.Exp arg2 = arg.accept(this);
      args.add(arg2);
      if (arg2.obj == null) {
        resolved = false;
      } else {
        objs.add(arg2.obj);
      }
    }
    final DesignObject obj = resolved ? DesignList.literal(objs) : null;
    current = obj == null ? null : Binding.root(obj);
    return list.copy(args, obj);
  }

  @Override
  protected Ast.Stmt visit(Ast.Assign assign) {
    current = null;
    return super.visit(assign);
  }

  @Override
  protected Ast.FunctionDef visit(Ast.FunctionDef functionDef) {
    // A decorator such as "s.combinational" names a block kind, not a field,
    // so only its receiver is bound.
    final List<Ast.Exp> decorators = new ArrayList<>();
    for (Ast.Exp decorator : functionDef.decorators) {
      if (decorator instanceof Ast.Attribute
          && ((Ast.Attribute) decorator).receiver != null) {
        final Ast.Attribute attribute = (Ast.Attribute) decorator;
        decorators.add(
            attribute.copy(attribute.receiver.accept(this), attribute.attr,
                null));
      } else {
        decorators.add(decorator.accept(this));
      }
      current = null;
    }
    return functionDef.copy(decorators, functionDef.tag,
        visitList(functionDef.body));
  }
}

// End Binder.java
