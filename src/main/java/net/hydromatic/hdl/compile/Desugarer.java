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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Pos;
import net.hydromatic.hdl.ast.Shuttle;
import net.hydromatic.hdl.model.Component;
import net.hydromatic.hdl.model.DesignList;
import net.hydromatic.hdl.model.DesignObject;
import net.hydromatic.hdl.model.RangeValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites that reduce a bound block to a smaller grammar.
 *
 * <p>Each method performs one rewrite and returns a new tree; the argument is
 * not modified.
 */
public abstract class Desugarer {
  private Desugarer() {}

  /** Replaces a module that holds exactly one function definition by that
   * definition. */
  public static Ast.FunctionDef unwrapModule(Ast.Decl decl) {
    if (decl instanceof Ast.FunctionDef) {
      return (Ast.FunctionDef) decl;
    }
    final Ast.Module module = (Ast.Module) decl;
    if (module.defs.size() != 1) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          module,
          "Expected exactly one function definition, got "
              + module.defs.size());
    }
    return module.defs.get(0);
  }

  /**
   * Reduces the decorator of a block, such as {@code @s.combinational}, to
   * its tag, "combinational".
   */
  public static Ast.FunctionDef simplifyDecorator(Component self,
      Ast.FunctionDef functionDef) {
    if (functionDef.decorators.size() != 1) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          functionDef,
          "Block '" + functionDef.name + "' must have exactly one decorator, "
              + "has " + functionDef.decorators.size());
    }
    final Ast.Exp decorator = functionDef.decorators.get(0);
    if (!(decorator instanceof Ast.Attribute)
        || !isSelfOrAbsent(((Ast.Attribute) decorator).receiver, self)) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          decorator, "Unsupported decorator '" + decorator + "'");
    }
    return functionDef.copy(ImmutableList.of(),
        ((Ast.Attribute) decorator).attr, functionDef.body);
  }

  private static boolean isSelfOrAbsent(Ast.@Nullable Exp receiver,
      Component self) {
    return receiver == null
        || receiver instanceof Ast.Name && receiver.obj == self;
  }

  /**
   * Replaces an accessor such as {@code x.value} or {@code x.next} by the
   * signal it accesses, {@code x}. The signal takes over the accessor's
   * context.
   */
  public static Ast.FunctionDef stripAccessors(Map<Prop, Object> propMap,
      Ast.FunctionDef functionDef) {
    final Set<String> accessorNames =
        ImmutableSet.copyOf(Prop.ACCESSOR_NAMES.listValue(propMap));
    return functionDef.accept(new AccessorStripper(accessorNames));
  }

  /**
   * Removes references to the enclosing component. {@code s.x} becomes a
   * receiver-less attribute {@code x}; {@code s} is dropped from argument
   * lists and list literals, and is invalid anywhere else.
   */
  public static Ast.FunctionDef removeSelf(Component self,
      Ast.FunctionDef functionDef) {
    return functionDef.accept(new SelfRemover(self));
  }

  /**
   * Converts the iterable of each {@code for} loop, a call to a range
   * function, to an explicit (start, stop, step) slice.
   */
  public static Ast.FunctionDef canonicalizeLoops(Map<Prop, Object> propMap,
      Ast.FunctionDef functionDef) {
    final Set<String> rangeFunctions =
        ImmutableSet.copyOf(Prop.RANGE_FUNCTIONS.listValue(propMap));
    return functionDef.accept(new LoopCanonicalizer(rangeFunctions));
  }

  /** Replaces each reference to a range constant by an explicit slice. */
  public static Ast.FunctionDef expandRangeConstants(
      Ast.FunctionDef functionDef) {
    return functionDef.accept(new RangeExpander());
  }

  /** Returns a copy of a reference with a different context. */
  static Ast.Exp withCtx(Ast.Exp e, Ast.Ctx ctx) {
    if (e instanceof Ast.Name) {
      return ((Ast.Name) e).copy(ctx, e.obj);
    } else if (e instanceof Ast.Attribute) {
      final Ast.Attribute a = (Ast.Attribute) e;
      return a.ctx == ctx ? a
          : ast.attribute(a.pos, a.receiver, a.attr, ctx, a.obj);
    } else if (e instanceof Ast.Subscript) {
      final Ast.Subscript s = (Ast.Subscript) e;
      return s.ctx == ctx ? s
          : ast.subscript(s.pos, s.value, s.index, ctx, s.obj);
    } else {
      return e;
    }
  }

  /** Shuttle that removes accessors. */
  private static class AccessorStripper extends Shuttle {
    private final Set<String> accessorNames;

    AccessorStripper(Set<String> accessorNames) {
      this.accessorNames = accessorNames;
    }

    @Override
    protected Ast.Exp visit(Ast.Attribute attribute) {
      final Ast.Exp receiver = visitOpt(attribute.receiver);
      if (receiver != null
          && accessorNames.contains(attribute.attr)
          && !hasField(receiver, attribute.attr)) {
        return withCtx(receiver, attribute.ctx);
      }
      return attribute.copy(receiver, attribute.attr, attribute.obj);
    }

    /** Returns whether the object denoted by {@code e} has a field called
     * {@code name}. A field that happens to be called "v" is not an
     * accessor. */
    private static boolean hasField(Ast.Exp e, String name) {
      DesignObject obj = e.obj;
      if (e instanceof Ast.Subscript && obj instanceof DesignList) {
        obj = ((DesignList) obj).first();
      }
      return obj != null && obj.resolveField(name).isPresent();
    }
  }

  /** Shuttle that removes references to the enclosing component. */
  private static class SelfRemover extends Shuttle {
    private final Component self;

    SelfRemover(Component self) {
      this.self = self;
    }

    private boolean isSelf(Ast.Exp e) {
      return e instanceof Ast.Name && e.obj == self;
    }

    @Override
    protected Ast.Exp visit(Ast.Name name) {
      if (name.obj == self) {
        throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
            name,
            "Reference to the enclosing component '" + name.name
                + "' is not allowed here");
      }
      return name;
    }

    @Override
    protected Ast.Exp visit(Ast.Attribute attribute) {
      if (attribute.receiver != null && isSelf(attribute.receiver)) {
        return attribute.copy(null, attribute.attr, attribute.obj);
      }
      return super.visit(attribute);
    }

    /** Visits a list of expressions, dropping references to self. */
    private List<Ast.Exp> visitArgs(List<Ast.Exp> args) {
      final List<Ast.Exp> list = new ArrayList<>();
      for (Ast.Exp arg : args) {
        if (!isSelf(arg)) {
          list.add(arg.accept(this));
        }
      }
      return list;
    }

    @Override
    protected Ast.Exp visit(Ast.Call call) {
      return call.copy(call.func.accept(this), visitArgs(call.args));
    }

    @Override
    protected Ast.Exp visit(Ast.ListExp list) {
      final List<Ast.Exp> args = visitArgs(list.args);
      if (args.size() == list.args.size() || list.obj == null) {
        return list.copy(args, list.obj);
      }
      final List<DesignObject> objs = new ArrayList<>();
      for (Ast.Exp arg : args) {
        objs.add(arg.obj);
      }
      return list.copy(args, DesignList.literal(objs));
    }
  }

  /** Shuttle that converts calls to range functions into slices. */
  private static class LoopCanonicalizer extends Shuttle {
    private final Set<String> rangeFunctions;

    LoopCanonicalizer(Set<String> rangeFunctions) {
      this.rangeFunctions = rangeFunctions;
    }

    @Override
    protected Ast.Stmt visit(Ast.For forLoop) {
      final Ast.Exp iter = forLoop.iter;
      if (!(iter instanceof Ast.Call)
          || !rangeFunctions.contains(((Ast.Call) iter).funcName())) {
        throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
            iter,
            "Loop must iterate over one of " + rangeFunctions + ", not '"
                + iter + "'");
      }
      final Ast.Call call = (Ast.Call) iter;
      final List<Ast.Exp> args = visitList(call.args);
      final Pos pos = call.pos;
      final Ast.Slice slice;
      switch (args.size()) {
        case 1:
          slice =
              ast.slice(pos, ast.num(pos, 0), args.get(0), ast.num(pos, 1));
          break;
        case 2:
          slice = ast.slice(pos, args.get(0), args.get(1), ast.num(pos, 1));
          break;
        case 3:
          slice = ast.slice(pos, args.get(0), args.get(1), args.get(2));
          break;
        default:
          throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
              call,
              "Invalid number of arguments to " + call.funcName() + ": "
                  + args.size());
      }
      return forLoop.copy(forLoop.target.accept(this), slice,
          visitList(forLoop.body));
    }
  }

  /** Shuttle that replaces references to range constants with slices. */
  private static class RangeExpander extends Shuttle {
    private static Ast.Exp expand(Ast.Exp e) {
      if (!(e.obj instanceof RangeValue)) {
        return e;
      }
      final RangeValue range = (RangeValue) e.obj;
      final Pos pos = e.pos;
      return ast.slice(pos, ast.num(pos, range.start),
          ast.num(pos, range.stop),
          range.step == null ? null : ast.num(pos, range.step));
    }

    @Override
    protected Ast.Exp visit(Ast.Name name) {
      return expand(name);
    }

    @Override
    protected Ast.Exp visit(Ast.Attribute attribute) {
      return expand(super.visit(attribute));
    }
  }
}

// End Desugarer.java
