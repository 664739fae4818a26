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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Name name) {}

  protected void visit(Ast.Num num) {}

  protected void visit(Ast.Attribute attribute) {
    if (attribute.receiver != null) {
      attribute.receiver.accept(this);
    }
  }

  protected void visit(Ast.Subscript subscript) {
    subscript.value.accept(this);
    subscript.index.accept(this);
  }

  protected void visit(Ast.Slice slice) {
    slice.forEachArg((arg, i) -> arg.accept(this));
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.Call call) {
    call.func.accept(this);
    call.args.forEach(this::accept);
  }

  // operators

  protected void visit(Ast.BinOp binOp) {
    binOp.a0.accept(this);
    binOp.a1.accept(this);
  }

  protected void visit(Ast.Compare compare) {
    compare.a0.accept(this);
    compare.a1.accept(this);
  }

  protected void visit(Ast.BoolOp boolOp) {
    boolOp.a0.accept(this);
    boolOp.a1.accept(this);
  }

  protected void visit(Ast.UnaryOp unaryOp) {
    unaryOp.a.accept(this);
  }

  // statements

  protected void visit(Ast.Assign assign) {
    assign.targets.forEach(this::accept);
    assign.value.accept(this);
  }

  protected void visit(Ast.For forLoop) {
    forLoop.target.accept(this);
    forLoop.iter.accept(this);
    forLoop.body.forEach(this::accept);
  }

  protected void visit(Ast.If anIf) {
    anIf.test.accept(this);
    anIf.body.forEach(this::accept);
    anIf.orElse.forEach(this::accept);
  }

  // declarations

  protected void visit(Ast.FunctionDef functionDef) {
    functionDef.decorators.forEach(this::accept);
    functionDef.body.forEach(this::accept);
  }

  protected void visit(Ast.Module module) {
    module.defs.forEach(this::accept);
  }
}

// End Visitor.java
