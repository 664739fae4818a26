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

import com.google.common.collect.Sets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Visitor;
import net.hydromatic.hdl.model.Constant;
import net.hydromatic.hdl.model.DesignList;
import net.hydromatic.hdl.model.DesignObject;
import net.hydromatic.hdl.model.IntTemp;
import net.hydromatic.hdl.model.IntValue;
import net.hydromatic.hdl.model.Signal;

/**
 * Collects the registers, loop variables, parameters and arrays of a lowered
 * block.
 */
public class Classifier extends Visitor {
  private final Map<String, Signal> registers = new LinkedHashMap<>();
  private final Set<String> loopVariables = new LinkedHashSet<>();
  private final Set<Classification.Param> parameters = new LinkedHashSet<>();
  private final Map<DesignList, Boolean> arrays = new LinkedHashMap<>();
  private final Set<DesignObject> arrayElements = Sets.newIdentityHashSet();

  /** Whether the node being visited is on the left-hand side of an
   * assignment. */
  private boolean lhs;

  private Classifier() {}

  /** Classifies the objects referenced by a block. */
  public static Classification classify(Ast.FunctionDef functionDef) {
    final Classifier classifier = new Classifier();
    functionDef.accept(classifier);
    return new Classification(classifier.registers,
        classifier.loopVariables, classifier.parameters, classifier.arrays);
  }

  private void addParameter(String name, DesignObject obj) {
    if (obj instanceof IntValue || obj instanceof Constant) {
      parameters.add(new Classification.Param(name, obj));
    }
  }

  @Override
  protected void visit(Ast.Name name) {
    if (name.obj != null) {
      addParameter(name.name, name.obj);
    }
  }

  // Receivers are not visited.
  @Override
  protected void visit(Ast.Attribute attribute) {
    if (attribute.obj != null) {
      addParameter(attribute.attr, attribute.obj);
    }
  }

  @Override
  protected void visit(Ast.Subscript subscript) {
    if (subscript.obj instanceof DesignList) {
      final DesignList list = (DesignList) subscript.obj;
      arrays.merge(list, lhs, Boolean::logicalOr);
      arrayElements.addAll(list.elements);
    }
    subscript.value.accept(this);

    // An index is read, even on the left-hand side.
    final boolean lhs = this.lhs;
    this.lhs = false;
    subscript.index.accept(this);
    this.lhs = lhs;
  }

  @Override
  protected void visit(Ast.Assign assign) {
    if (assign.targets.size() != 1) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          assign, "Assignment must have exactly one target");
    }
    final Ast.Exp target = assign.targets.get(0);
    lhs = true;
    target.accept(this);
    lhs = false;
    assign.value.accept(this);

    final DesignObject obj = target.obj;
    if (obj == null || arrayElements.contains(obj)) {
      return;
    }
    if (obj instanceof Signal) {
      registers.put(((Signal) obj).fullName(), (Signal) obj);
    } else if (obj instanceof IntTemp) {
      loopVariables.add(((IntTemp) obj).name);
    }
  }

  @Override
  protected void visit(Ast.For forLoop) {
    if (!(forLoop.iter instanceof Ast.Slice)) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          forLoop.iter, "Loop must iterate over a range");
    }
    if (!(forLoop.target instanceof Ast.Name)) {
      throw CompileException.at(CompileException.Kind.UNSUPPORTED_SYNTAX,
          forLoop.target, "Loop variable must be a name");
    }
    loopVariables.add(((Ast.Name) forLoop.target).name);
    super.visit(forLoop);
  }
}

// End Classifier.java
