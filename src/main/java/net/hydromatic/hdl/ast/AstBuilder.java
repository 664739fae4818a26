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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.hdl.model.DesignObject;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds syntax tree nodes. */
public enum AstBuilder {
  INSTANCE;

  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  public static final AstBuilder ast = INSTANCE;

  /** Creates a name that is read. */
  public Ast.Name name(Pos pos, String name) {
    return new Ast.Name(pos, name, Ast.Ctx.LOAD, null);
  }

  /** Creates a name with a given context and annotation. */
  public Ast.Name name(Pos pos, String name, Ast.Ctx ctx,
      @Nullable DesignObject obj) {
    return new Ast.Name(pos, name, ctx, obj);
  }

  /** Creates an attribute access that is read. */
  public Ast.Attribute attribute(Pos pos, Ast.Exp receiver, String attr) {
    return new Ast.Attribute(pos, receiver, attr, Ast.Ctx.LOAD, null);
  }

  /** Creates an attribute access with a given context and annotation. */
  public Ast.Attribute attribute(Pos pos, Ast.@Nullable Exp receiver,
      String attr, Ast.Ctx ctx, @Nullable DesignObject obj) {
    return new Ast.Attribute(pos, receiver, attr, ctx, obj);
  }

  /** Creates a chain of attribute accesses, "root.a.b.c". */
  public Ast.Exp path(Pos pos, String root, String... attrs) {
    Ast.Exp e = name(pos, root);
    for (String attr : attrs) {
      e = attribute(pos, e, attr);
    }
    return e;
  }

  /** Creates a subscript that is read. */
  public Ast.Subscript subscript(Pos pos, Ast.Exp value, Ast.Exp index) {
    return new Ast.Subscript(pos, value, index, Ast.Ctx.LOAD, null);
  }

  /** Creates a subscript with a given context and annotation. */
  public Ast.Subscript subscript(Pos pos, Ast.Exp value, Ast.Exp index,
      Ast.Ctx ctx, @Nullable DesignObject obj) {
    return new Ast.Subscript(pos, value, index, ctx, obj);
  }

  public Ast.Slice slice(Pos pos, Ast.@Nullable Exp lower,
      Ast.@Nullable Exp upper, Ast.@Nullable Exp step) {
    return new Ast.Slice(pos, lower, upper, step);
  }

  /** Creates an integer literal. */
  public Ast.Num num(Pos pos, BigInteger value) {
    return new Ast.Num(pos, value);
  }

  /** Creates an integer literal. */
  public Ast.Num num(Pos pos, long value) {
    return num(pos, BigInteger.valueOf(value));
  }

  public Ast.ListExp list(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args), null);
  }

  public Ast.ListExp list(Pos pos, Iterable<? extends Ast.Exp> args,
      @Nullable DesignObject obj) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args), obj);
  }

  /** Creates a call to a function. */
  public Ast.Call call(Pos pos, Ast.Exp func,
      Iterable<? extends Ast.Exp> args) {
    return new Ast.Call(pos, func, ImmutableList.copyOf(args));
  }

  /** Creates a call to a function identified by name. */
  public Ast.Call call(Pos pos, String func, Ast.Exp... args) {
    return call(pos, name(pos, func), ImmutableList.copyOf(args));
  }

  /** Creates a call to an arithmetic, bitwise or shift operator. */
  public Ast.BinOp binOp(Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(op.isBinary(), "not a binary operator: %s", op);
    return new Ast.BinOp(a0.pos.plus(a1.pos), op, a0, a1);
  }

  /** Creates a comparison. */
  public Ast.Compare compare(Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(op.isComparison(), "not a comparison: %s", op);
    return new Ast.Compare(a0.pos.plus(a1.pos), op, a0, a1);
  }

  /** Creates a boolean combination. */
  public Ast.BoolOp boolOp(Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(op.isBoolean(), "not a boolean operator: %s", op);
    return new Ast.BoolOp(a0.pos.plus(a1.pos), op, a0, a1);
  }

  /** Creates a call to a prefix operator. */
  public Ast.UnaryOp unaryOp(Pos pos, Op op, Ast.Exp a) {
    checkArgument(op.isUnary(), "not a unary operator: %s", op);
    return new Ast.UnaryOp(pos, op, a);
  }

  /** Creates an assignment with a single target. */
  public Ast.Assign assign(Pos pos, Ast.Exp target, Ast.Exp value) {
    return assign(pos, ImmutableList.of(target), value);
  }

  public Ast.Assign assign(Pos pos, List<? extends Ast.Exp> targets,
      Ast.Exp value) {
    return new Ast.Assign(pos, ImmutableList.copyOf(targets), value);
  }

  public Ast.For forLoop(Pos pos, Ast.Exp target, Ast.Exp iter,
      Iterable<? extends Ast.Stmt> body) {
    return new Ast.For(pos, target, iter, ImmutableList.copyOf(body));
  }

  public Ast.If ifThen(Pos pos, Ast.Exp test,
      Iterable<? extends Ast.Stmt> body) {
    return ifThenElse(pos, test, body, ImmutableList.of());
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp test,
      Iterable<? extends Ast.Stmt> body,
      Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.If(pos, test, ImmutableList.copyOf(body),
        ImmutableList.copyOf(orElse));
  }

  /** Creates a function definition whose decorators are expressions. */
  public Ast.FunctionDef functionDef(Pos pos, String name,
      Iterable<? extends Ast.Exp> decorators,
      Iterable<? extends Ast.Stmt> body) {
    return new Ast.FunctionDef(pos, name, ImmutableList.copyOf(decorators),
        null, ImmutableList.copyOf(body));
  }

  public Ast.Module module(Pos pos, Iterable<Ast.FunctionDef> defs) {
    return new Ast.Module(pos, ImmutableList.copyOf(defs));
  }
}

// End AstBuilder.java
