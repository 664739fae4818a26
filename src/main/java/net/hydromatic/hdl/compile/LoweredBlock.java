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

import net.hydromatic.hdl.ast.Ast;

/** Result of lowering a behavioral block, ready for code generation. */
public class LoweredBlock {
  /** The block, with flat identifiers and typed temporaries. */
  public final Ast.FunctionDef functionDef;
  /** Kind of block, such as "combinational" or "tick". */
  public final String tag;
  public final Classification classification;

  LoweredBlock(Ast.FunctionDef functionDef, String tag,
      Classification classification) {
    this.functionDef = requireNonNull(functionDef);
    this.tag = requireNonNull(tag);
    this.classification = requireNonNull(classification);
  }

  public String name() {
    return functionDef.name;
  }

  @Override
  public String toString() {
    return functionDef.toString();
  }
}

// End LoweredBlock.java
