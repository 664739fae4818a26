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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Shuttle;
import net.hydromatic.hdl.ast.Visitor;
import net.hydromatic.hdl.model.Constant;
import net.hydromatic.hdl.model.DesignList;
import net.hydromatic.hdl.model.DesignObject;
import net.hydromatic.hdl.model.IntTemp;
import net.hydromatic.hdl.model.IntValue;
import net.hydromatic.hdl.model.Signal;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the types of temporaries, the local variables of a block that are
 * not bound to any design object.
 *
 * <p>A temporary is typed by its first assignment: {@code x = s.in_} gives
 * {@code x} the width of {@code s.in_}; {@code n = 4} makes {@code n} an
 * integer. Later loads of the temporary carry the inferred object.
 *
 * <p>After inference, every name that is read must be bound to an object or
 * be the variable of an enclosing loop.
 */
public class TemporaryTypeInferrer extends Shuttle {
  /** Functions whose result is a single bit. */
  private static final Set<String> REDUCTIONS =
      ImmutableSet.of("reduce_and", "reduce_or", "reduce_xor");

  /** Functions whose second argument is the width of the result. */
  private static final Set<String> EXTENSIONS = ImmutableSet.of("sext", "zext");

  private static final String CONCAT = "concat";

  /** Objects inferred so far, by temporary name. */
  private final Map<String, DesignObject> temps = new HashMap<>();

  private TemporaryTypeInferrer() {}

  /** Infers the types of the temporaries in a block. */
  public static Ast.FunctionDef infer(Ast.FunctionDef functionDef) {
    final Ast.FunctionDef f = functionDef.accept(new TemporaryTypeInferrer());
    f.accept(new ResolvedChecker());
    return f;
  }

  @Override
  protected Ast.Exp visit(Ast.Name name) {
    if (name.obj == null && name.ctx == Ast.Ctx.LOAD) {
      final DesignObject obj = temps.get(name.name);
      if (obj != null) {
        return name.copy(name.ctx, obj);
      }
    }
    return name;
  }

  @Override
  protected Ast.Stmt visit(Ast.Assign assign) {
    if (assign.targets.size() != 1) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          assign,
          "Assignment must have exactly one target, has "
              + assign.targets.size());
    }
    final Ast.Exp value = assign.value.accept(this);
    final Ast.Exp target = assign.targets.get(0).accept(this);
    if (target.obj != null) {
      return assign.copy(ImmutableList.of(target), value);
    }
    if (!(target instanceof Ast.Name)) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          target, "Cannot assign to unresolved target '" + target + "'");
    }
    final Ast.Name name = (Ast.Name) target;
    final DesignObject obj = inferType(name.name, value);
    temps.put(name.name, obj);
    final Ast.Exp target2 = name.copy(name.ctx, obj);
    return assign.copy(ImmutableList.of(target2), value);
  }

  @Override
  protected Ast.Exp visit(Ast.Subscript subscript) {
    final Ast.Exp value = subscript.value.accept(this);
    final Ast.Exp index = subscript.index.accept(this);
    // A bit of a temporary, "x[0]", refers to the temporary.
    return subscript.copy(value, index,
        subscript.obj == null ? value.obj : subscript.obj);
  }

  /** Returns the object of a temporary called {@code name} that is assigned
   * {@code value}. */
  private DesignObject inferType(String name, Ast.Exp value) {
    if (value instanceof Ast.Name || value instanceof Ast.Attribute) {
      final DesignObject obj = value.obj;
      if (obj instanceof IntValue) {
        return new IntTemp(name, ((IntValue) obj).value);
      } else if (obj instanceof IntTemp) {
        return new IntTemp(name, ((IntTemp) obj).value);
      } else if (obj instanceof Signal) {
        return ((Signal) obj).copyAs(name);
      } else if (obj instanceof Constant) {
        return Signal.temporary(name, ((Constant) obj).nbits());
      }
      throw cannotInfer(name, value,
          obj == null ? "unresolved reference" : obj.kind());
    } else if (value instanceof Ast.Num) {
      return new IntTemp(name, ((Ast.Num) value).value);
    } else if (value instanceof Ast.BoolOp || value instanceof Ast.Compare) {
      return Signal.temporary(name, 1);
    } else if (value instanceof Ast.Subscript
        && ((Ast.Subscript) value).isSingleElement()) {
      return Signal.temporary(name, 1);
    } else if (value instanceof Ast.Call) {
      return inferCall(name, (Ast.Call) value);
    }
    throw cannotInfer(name, value, value.op.name().toLowerCase(Locale.ROOT));
  }

  private DesignObject inferCall(String name, Ast.Call call) {
    final String func = call.funcName();
    if (func != null && EXTENSIONS.contains(func)) {
      if (call.args.size() != 2) {
        throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, call,
            "Function " + func + " requires 2 arguments");
      }
      return Signal.temporary(name, intWidth(call.args.get(1)));
    } else if (CONCAT.equals(func)) {
      return Signal.temporary(name, totalWidth(call));
    } else if (func != null && REDUCTIONS.contains(func)) {
      return Signal.temporary(name, 1);
    }
    throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, call,
        "Function is not translatable: " + call.func);
  }

  /** Returns the value of an expression that must be a plain integer. */
  private static int intWidth(Ast.Exp e) {
    final BigInteger value;
    if (e instanceof Ast.Num) {
      value = ((Ast.Num) e).value;
    } else if (e.obj instanceof IntValue) {
      value = ((IntValue) e.obj).value;
    } else {
      throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, e,
          "Width '" + e + "' is not an integer constant");
    }
    if (value.signum() <= 0 || value.bitLength() > 31) {
      throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, e,
          "Invalid width " + value);
    }
    return value.intValue();
  }

  private static int totalWidth(Ast.Call call) {
    if (call.args.isEmpty()) {
      throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, call,
          "Function " + CONCAT + " requires at least one argument");
    }
    long nbits = 0;
    for (Ast.Exp arg : call.args) {
      nbits += width(arg);
    }
    if (nbits > Integer.MAX_VALUE) {
      throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, call,
          "Invalid width " + nbits);
    }
    return (int) nbits;
  }

  /** Returns the width of an argument to {@code concat}. */
  private static int width(Ast.Exp e) {
    if (e instanceof Ast.Subscript) {
      final Ast.Subscript subscript = (Ast.Subscript) e;
      if (subscript.obj instanceof Signal) {
        if (subscript.isSingleElement()) {
          return 1;
        }
        final Ast.Slice slice = (Ast.Slice) subscript.index;
        if (slice.lower instanceof Ast.Num && slice.upper instanceof Ast.Num) {
          final BigInteger nbits = ((Ast.Num) slice.upper).value
              .subtract(((Ast.Num) slice.lower).value);
          if (nbits.signum() <= 0 || nbits.bitLength() > 31) {
            throw CompileException.at(CompileException.Kind.TYPE_INFERENCE,
                e, "Invalid width " + nbits + " of slice '" + e + "'");
          }
          return nbits.intValue();
        }
      } else if (subscript.obj instanceof DesignList
          && subscript.isSingleElement()) {
        final DesignObject element = ((DesignList) subscript.obj).first();
        if (element instanceof Signal) {
          return ((Signal) element).nbits;
        }
      }
    } else if (e.obj instanceof Signal) {
      return ((Signal) e.obj).nbits;
    } else if (e.obj instanceof Constant) {
      return ((Constant) e.obj).nbits();
    }
    throw CompileException.at(CompileException.Kind.TYPE_INFERENCE, e,
        "Cannot determine the width of '" + e + "'");
  }

  private static CompileException cannotInfer(String name, Ast.Exp value,
      @Nullable String what) {
    return CompileException.at(CompileException.Kind.TYPE_INFERENCE, value,
        "Cannot infer type of temporary '" + name + "' from " + what + " '"
            + value + "'");
  }

  /** Visitor that checks that every name read is bound or is a loop
   * variable in scope. Function names are not checked. */
  private static class ResolvedChecker extends Visitor {
    private final List<String> loopVariables = new ArrayList<>();

    @Override
    protected void visit(Ast.Name name) {
      if (name.ctx == Ast.Ctx.LOAD
          && name.obj == null
          && !loopVariables.contains(name.name)) {
        throw CompileException.at(
            CompileException.Kind.UNRESOLVED_REFERENCE, name,
            "Variable '" + name.name + "' is read but never assigned");
      }
    }

    @Override
    protected void visit(Ast.Call call) {
      call.args.forEach(this::accept);
    }

    @Override
    protected void visit(Ast.For forLoop) {
      forLoop.iter.accept(this);
      if (!(forLoop.target instanceof Ast.Name)) {
        forLoop.body.forEach(this::accept);
        return;
      }
      loopVariables.add(((Ast.Name) forLoop.target).name);
      forLoop.body.forEach(this::accept);
      loopVariables.remove(loopVariables.size() - 1);
    }

    @Override
    protected void visit(Ast.FunctionDef functionDef) {
      functionDef.body.forEach(this::accept);
    }
  }
}

// End TemporaryTypeInferrer.java
