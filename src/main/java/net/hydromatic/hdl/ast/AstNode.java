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

import net.hydromatic.hdl.model.DesignObject;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract syntax tree node.
 *
 * <p>Every node carries an annotation slot, {@link #obj}, holding the design
 * object that the node denotes, or null if the node denotes nothing that has
 * been resolved (for example a local temporary before type inference). Nodes
 * are immutable; a pass that needs a different annotation creates a new node.
 */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;
  public final @Nullable DesignObject obj;

  protected AstNode(Pos pos, Op op, @Nullable DesignObject obj) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
    this.obj = obj;
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging and testing. Derived classes
   * override {@link #unparse(AstWriter, int, int)}, not this method.
   */
  @Override
  public final String toString() {
    return unparse(new AstWriter());
  }

  /** Converts this node into a string, with a given writer. */
  public final String unparse(AstWriter w) {
    return unparse(w, 0, 0).toString();
  }

  abstract AstWriter unparse(AstWriter w, int left, int right);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result.
   */
  public abstract AstNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
