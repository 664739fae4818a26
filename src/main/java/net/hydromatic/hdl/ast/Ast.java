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
package net.hydromatic.hdl.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;
import net.hydromatic.hdl.model.DesignObject;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>The grammar is deliberately small: it describes one behavioral block of
 * a hardware component. Expressions are names, attribute accesses,
 * subscripts, slices, calls, operators and literals; statements are
 * assignments, {@code for} loops over integer ranges, and {@code if}.
 */
public class Ast {
  private Ast() {}

  /** Whether a reference is read or written. */
  public enum Ctx {
    LOAD,
    STORE
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op, @Nullable DesignObject obj) {
      super(pos, op, obj);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }
  }

  /** Parse tree node of an identifier. */
  public static class Name extends Exp {
    public final String name;
    public final Ctx ctx;

    /** Creates a Name. */
    Name(Pos pos, String name, Ctx ctx, @Nullable DesignObject obj) {
      super(pos, Op.ID, obj);
      this.name = requireNonNull(name);
      this.ctx = requireNonNull(ctx);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }

    /**
     * Creates a copy of this {@code Name} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Name copy(Ctx ctx, @Nullable DesignObject obj) {
      return this.ctx == ctx && this.obj == obj
          ? this
          : new Name(pos, name, ctx, obj);
    }
  }

  /**
   * Parse tree node of an attribute access, "receiver.attr".
   *
   * <p>The receiver is null if it referred to the enclosing component and has
   * been removed; the attribute then denotes a member of that component.
   */
  public static class Attribute extends Exp {
    public final @Nullable Exp receiver;
    public final String attr;
    public final Ctx ctx;

    Attribute(
        Pos pos,
        @Nullable Exp receiver,
        String attr,
        Ctx ctx,
        @Nullable DesignObject obj) {
      super(pos, Op.ATTRIBUTE, obj);
      this.receiver = receiver;
      this.attr = requireNonNull(attr);
      this.ctx = requireNonNull(ctx);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      if (receiver != null) {
        action.accept(receiver, 0);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (receiver != null) {
        w.append(receiver, left, op.left).append(".");
      }
      return w.id(attr);
    }

    /**
     * Creates a copy of this {@code Attribute} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Attribute copy(
        @Nullable Exp receiver, String attr, @Nullable DesignObject obj) {
      return this.receiver == receiver
              && this.attr.equals(attr)
              && this.obj == obj
          ? this
          : new Attribute(pos, receiver, attr, ctx, obj);
    }
  }

  /** Parse tree node of a subscript, "value[index]". */
  public static class Subscript extends Exp {
    public final Exp value;
    public final Exp index;
    public final Ctx ctx;

    Subscript(
        Pos pos, Exp value, Exp index, Ctx ctx, @Nullable DesignObject obj) {
      super(pos, Op.SUBSCRIPT, obj);
      this.value = requireNonNull(value);
      this.index = requireNonNull(index);
      this.ctx = requireNonNull(ctx);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(value, 0);
      action.accept(index, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(value, left, op.left).append("[");
      if (index instanceof Slice) {
        ((Slice) index).unparseBounds(w);
      } else {
        w.append(index, 0, 0);
      }
      return w.append("]");
    }

    /** Returns whether this subscript selects a single element. */
    public boolean isSingleElement() {
      return !(index instanceof Slice);
    }

    /**
     * Creates a copy of this {@code Subscript} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Subscript copy(Exp value, Exp index, @Nullable DesignObject obj) {
      return this.value == value && this.index == index && this.obj == obj
          ? this
          : new Subscript(pos, value, index, ctx, obj);
    }
  }

  /**
   * Explicit (start, stop, step) triple.
   *
   * <p>Occurs as the index of a {@link Subscript} (a bit slice such as
   * {@code x[0:4]}), as the canonical iterable of a {@link For} loop, and as
   * the expansion of a range constant. Any of the bounds may be null.
   */
  public static class Slice extends Exp {
    public final @Nullable Exp lower;
    public final @Nullable Exp upper;
    public final @Nullable Exp step;

    Slice(Pos pos, @Nullable Exp lower, @Nullable Exp upper,
        @Nullable Exp step) {
      super(pos, Op.SLICE, null);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      int i = 0;
      for (Exp e : new Exp[] {lower, upper, step}) {
        if (e != null) {
          action.accept(e, i++);
        }
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("slice(");
      w.append(lower == null ? "None" : lower.toString());
      w.append(", ");
      w.append(upper == null ? "None" : upper.toString());
      if (step != null) {
        w.append(", ").append(step, 0, 0);
      }
      return w.append(")");
    }

    /** Writes the bounds in subscript form, "lower:upper[:step]". */
    AstWriter unparseBounds(AstWriter w) {
      if (lower != null) {
        w.append(lower, 0, 0);
      }
      w.append(":");
      if (upper != null) {
        w.append(upper, 0, 0);
      }
      if (step != null) {
        w.append(":").append(step, 0, 0);
      }
      return w;
    }

    /**
     * Creates a copy of this {@code Slice} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Slice copy(
        @Nullable Exp lower, @Nullable Exp upper, @Nullable Exp step) {
      return this.lower == lower && this.upper == upper && this.step == step
          ? this
          : new Slice(pos, lower, upper, step);
    }
  }

  /** Integer literal. */
  public static class Num extends Exp {
    public final BigInteger value;

    Num(Pos pos, BigInteger value) {
      super(pos, Op.NUM_LITERAL, null);
      this.value = requireNonNull(value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(value.toString());
    }
  }

  /** List literal, "[a, b, c]". */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args, @Nullable DesignObject obj) {
      super(pos, Op.LIST, obj);
      this.args = requireNonNull(args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args).append("]");
    }

    /**
     * Creates a copy of this {@code ListExp} with given contents, or {@code
     * this} if the contents are the same.
     */
    public ListExp copy(List<Exp> args, @Nullable DesignObject obj) {
      return this.args.equals(args) && this.obj == obj
          ? this
          : new ListExp(pos, ImmutableList.copyOf(args), obj);
    }
  }

  /** Call to a function, "func(arg, ...)". */
  public static class Call extends Exp {
    public final Exp func;
    public final List<Exp> args;

    Call(Pos pos, Exp func, ImmutableList<Exp> args) {
      super(pos, Op.CALL, null);
      this.func = requireNonNull(func);
      this.args = requireNonNull(args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(func, 0);
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i + 1);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(func, left, op.left)
          .append("(")
          .appendAll(args)
          .append(")");
    }

    /** Returns the name of the called function, or null if it is not a bare
     * name. */
    public @Nullable String funcName() {
      return func instanceof Name ? ((Name) func).name : null;
    }

    /**
     * Creates a copy of this {@code Call} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Call copy(Exp func, List<Exp> args) {
      return this.func == func && this.args.equals(args)
          ? this
          : new Call(pos, func, ImmutableList.copyOf(args));
    }
  }

  /** Call to an infix operator. */
  public abstract static class Infix extends Exp {
    public final Exp a0;
    public final Exp a1;

    Infix(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op, null);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /**
     * Creates a copy of this node with given operands, or {@code this} if the
     * operands are the same.
     */
    public abstract Infix copy(Exp a0, Exp a1);
  }

  /** Arithmetic, bitwise or shift operator, such as "a + b" or "a &amp; b". */
  public static class BinOp extends Infix {
    BinOp(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op, a0, a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public BinOp copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : new BinOp(pos, op, a0, a1);
    }
  }

  /** Comparison, such as "a &lt; b". */
  public static class Compare extends Infix {
    Compare(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op, a0, a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Compare copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : new Compare(pos, op, a0, a1);
    }
  }

  /** Boolean combination, "a and b" or "a or b". */
  public static class BoolOp extends Infix {
    BoolOp(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op, a0, a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public BoolOp copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : new BoolOp(pos, op, a0, a1);
    }
  }

  /** Call to a prefix operator, such as "~a" or "not a". */
  public static class UnaryOp extends Exp {
    public final Exp a;

    UnaryOp(Pos pos, Op op, Exp a) {
      super(pos, op, null);
      this.a = requireNonNull(a);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    public UnaryOp copy(Exp a) {
      return this.a == a ? this : new UnaryOp(pos, op, a);
    }
  }

  /** Base class for statements. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op, null);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Assignment statement, "target = value". */
  public static class Assign extends Stmt {
    public final List<Exp> targets;
    public final Exp value;

    Assign(Pos pos, ImmutableList<Exp> targets, Exp value) {
      super(pos, Op.ASSIGN);
      this.targets = requireNonNull(targets);
      this.value = requireNonNull(value);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Exp target : targets) {
        w.append(target, 0, 0).append(op.padded);
      }
      return w.append(value, 0, 0);
    }

    /**
     * Creates a copy of this {@code Assign} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Assign copy(List<Exp> targets, Exp value) {
      return this.targets.equals(targets) && this.value == value
          ? this
          : new Assign(pos, ImmutableList.copyOf(targets), value);
    }
  }

  /** Loop statement, "for target in iter: body". */
  public static class For extends Stmt {
    public final Exp target;
    public final Exp iter;
    public final List<Stmt> body;

    For(Pos pos, Exp target, Exp iter, ImmutableList<Stmt> body) {
      super(pos, Op.FOR);
      this.target = requireNonNull(target);
      this.iter = requireNonNull(iter);
      this.body = requireNonNull(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for ")
          .append(target, 0, 0)
          .append(" in ")
          .append(iter, 0, 0)
          .append(":")
          .block(body);
    }

    /**
     * Creates a copy of this {@code For} with given contents, or {@code this}
     * if the contents are the same.
     */
    public For copy(Exp target, Exp iter, List<Stmt> body) {
      return this.target == target
              && this.iter == iter
              && this.body.equals(body)
          ? this
          : new For(pos, target, iter, ImmutableList.copyOf(body));
    }
  }

  /** Conditional statement, "if test: body else: orElse". */
  public static class If extends Stmt {
    public final Exp test;
    public final List<Stmt> body;
    public final List<Stmt> orElse;

    If(Pos pos, Exp test, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orElse) {
      super(pos, Op.IF);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orElse = requireNonNull(orElse);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ").append(test, 0, 0).append(":").block(body);
      if (!orElse.isEmpty()) {
        w.newline().append("else:").block(orElse);
      }
      return w;
    }

    /**
     * Creates a copy of this {@code If} with given contents, or {@code this}
     * if the contents are the same.
     */
    public If copy(Exp test, List<Stmt> body, List<Stmt> orElse) {
      return this.test == test
              && this.body.equals(body)
              && this.orElse.equals(orElse)
          ? this
          : new If(pos, test, ImmutableList.copyOf(body),
              ImmutableList.copyOf(orElse));
    }
  }

  /** Base class for declarations. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op, null);
    }

    @Override
    public abstract Decl accept(Shuttle shuttle);
  }

  /**
   * Definition of a behavioral block.
   *
   * <p>Before decorator simplification, {@link #decorators} holds the
   * decorator expressions and {@link #tag} is null; afterwards the decorator
   * list is empty and the tag holds the block kind, such as "combinational".
   */
  public static class FunctionDef extends Decl {
    public final String name;
    public final List<Exp> decorators;
    public final @Nullable String tag;
    public final List<Stmt> body;

    FunctionDef(Pos pos, String name, ImmutableList<Exp> decorators,
        @Nullable String tag, ImmutableList<Stmt> body) {
      super(pos, Op.FUNCTION_DEF);
      this.name = requireNonNull(name);
      this.decorators = requireNonNull(decorators);
      this.tag = tag;
      this.body = requireNonNull(body);
    }

    @Override
    public FunctionDef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Exp decorator : decorators) {
        w.append("@").append(decorator, 0, 0).newline();
      }
      if (tag != null) {
        w.append("@").append(tag).newline();
      }
      return w.append("def ").append(name).append("():").block(body);
    }

    /**
     * Creates a copy of this {@code FunctionDef} with given contents, or
     * {@code this} if the contents are the same.
     */
    public FunctionDef copy(List<Exp> decorators, @Nullable String tag,
        List<Stmt> body) {
      return this.decorators.equals(decorators)
              && Objects.equals(this.tag, tag)
              && this.body.equals(body)
          ? this
          : new FunctionDef(pos, name, ImmutableList.copyOf(decorators), tag,
              ImmutableList.copyOf(body));
    }
  }

  /** A unit of source holding function definitions. */
  public static class Module extends Decl {
    public final List<FunctionDef> defs;

    Module(Pos pos, ImmutableList<FunctionDef> defs) {
      super(pos, Op.MODULE);
      this.defs = requireNonNull(defs);
    }

    @Override
    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < defs.size(); i++) {
        if (i > 0) {
          w.newline().newline();
        }
        w.append(defs.get(i), 0, 0);
      }
      return w;
    }

    public Module copy(List<FunctionDef> defs) {
      return this.defs.equals(defs)
          ? this
          : new Module(pos, ImmutableList.copyOf(defs));
    }
  }
}

// End Ast.java
