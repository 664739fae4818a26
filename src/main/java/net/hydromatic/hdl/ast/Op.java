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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),
  ATTRIBUTE(true),
  SUBSCRIPT(true),

  // literals
  NUM_LITERAL(true),
  LIST(true),
  /** Explicit (start, stop, step) triple; see {@link Ast.Slice}. */
  SLICE(true),

  // calls
  CALL(true),

  // boolean operators
  OR(" or ", 1),
  AND(" and ", 2),
  NOT("not ", 3),

  // comparisons
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),

  // bitwise and arithmetic operators
  BIT_OR(" | ", 5),
  BIT_XOR(" ^ ", 6),
  BIT_AND(" & ", 7),
  LSHIFT(" << ", 8),
  RSHIFT(" >> ", 8),
  PLUS(" + ", 9),
  MINUS(" - ", 9),
  TIMES(" * ", 10),
  DIVIDE(" / ", 10),
  MOD(" % ", 10),
  NEGATE("-", 11),
  INVERT("~", 11),

  // statements
  ASSIGN(" = "),
  FOR,
  IF,

  // declarations
  FUNCTION_DEF,
  MODULE;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a comparison operator. */
  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this is a boolean connective. */
  public boolean isBoolean() {
    return this == AND || this == OR;
  }

  /** Returns whether this is an arithmetic, bitwise or shift operator. */
  public boolean isBinary() {
    switch (this) {
      case BIT_OR:
      case BIT_XOR:
      case BIT_AND:
      case LSHIFT:
      case RSHIFT:
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this is a prefix (unary) operator. */
  public boolean isUnary() {
    return this == NOT || this == NEGATE || this == INVERT;
  }
}

// End Op.java
