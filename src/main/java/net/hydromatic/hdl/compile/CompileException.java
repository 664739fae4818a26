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

import net.hydromatic.hdl.ast.AstNode;
import net.hydromatic.hdl.ast.Pos;

/**
 * An error occurred while lowering a behavioral block.
 *
 * <p>Errors are fatal to the block being lowered; no partial output is
 * usable. They do not affect other blocks.
 */
public class CompileException extends RuntimeException {
  public final Kind kind;
  private final Pos pos;

  public CompileException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  /** Creates an exception located at a node. */
  static CompileException at(Kind kind, AstNode node, String message) {
    return new CompileException(kind, message, node.pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  public Pos pos() {
    return pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }

  /** Category of error. */
  public enum Kind {
    /** The tree contains a construct outside the supported grammar. */
    UNSUPPORTED_SYNTAX,
    /** An attribute is not a field of its receiver, nor an accessor. */
    UNRESOLVED_REFERENCE,
    /** An indexed reference whose elements are neither components nor
     * bundles. */
    AMBIGUOUS_FLATTENING,
    /** The type of a temporary cannot be inferred. */
    TYPE_INFERENCE,
    /** An indexed list has elements of different kinds. */
    HETEROGENEOUS_LIST
  }
}

// End CompileException.java
