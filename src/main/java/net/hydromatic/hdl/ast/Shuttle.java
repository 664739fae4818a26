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

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits and transforms syntax trees.
 *
 * <p>Each method returns a node; the default implementation returns a copy of
 * the node whose children have been transformed, or the node itself if no
 * child changed. Nodes are never modified in place.
 */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  protected Ast.@Nullable Exp visitOpt(Ast.@Nullable Exp exp) {
    return exp == null ? null : exp.accept(this);
  }

  // expressions

  protected Ast.Exp visit(Ast.Name name) {
    return name; // leaf
  }

  protected Ast.Exp visit(Ast.Num num) {
    return num; // leaf
  }

  protected Ast.Exp visit(Ast.Attribute attribute) {
    return attribute.copy(visitOpt(attribute.receiver), attribute.attr,
        attribute.obj);
  }

  protected Ast.Exp visit(Ast.Subscript subscript) {
    return subscript.copy(subscript.value.accept(this),
        subscript.index.accept(this), subscript.obj);
  }

  protected Ast.Exp visit(Ast.Slice slice) {
    return slice.copy(visitOpt(slice.lower), visitOpt(slice.upper),
        visitOpt(slice.step));
  }

  protected Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args), list.obj);
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(call.func.accept(this), visitList(call.args));
  }

  // operators

  protected Ast.Exp visit(Ast.BinOp binOp) {
    return binOp.copy(binOp.a0.accept(this), binOp.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.Compare compare) {
    return compare.copy(compare.a0.accept(this), compare.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.BoolOp boolOp) {
    return boolOp.copy(boolOp.a0.accept(this), boolOp.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.UnaryOp unaryOp) {
    return unaryOp.copy(unaryOp.a.accept(this));
  }

  // statements

  protected Ast.Stmt visit(Ast.Assign assign) {
    return assign.copy(visitList(assign.targets), assign.value.accept(this));
  }

  protected Ast.Stmt visit(Ast.For forLoop) {
    return forLoop.copy(forLoop.target.accept(this),
        forLoop.iter.accept(this), visitList(forLoop.body));
  }

  protected Ast.Stmt visit(Ast.If anIf) {
    return anIf.copy(anIf.test.accept(this), visitList(anIf.body),
        visitList(anIf.orElse));
  }

  // declarations

  protected Ast.FunctionDef visit(Ast.FunctionDef functionDef) {
    return functionDef.copy(visitList(functionDef.decorators),
        functionDef.tag, visitList(functionDef.body));
  }

  protected Ast.Decl visit(Ast.Module module) {
    return module.copy(visitList(module.defs));
  }
}

// End Shuttle.java
