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
package net.hydromatic.asp.ast;

/**
 * Operators, and the precedence that decides how they are parenthesized.
 *
 * <p>A node whose operator is {@code op} wraps itself in parentheses if the
 * enclosing context is {@code (left, right)} and {@code left > op.left ||
 * op.right < right}. When it does not wrap, its left operand is written in
 * context {@code (left, op.left)} and its right operand in context {@code
 * (op.right, right)}.
 *
 * <p>The asymmetric values for {@link #MINUS}, {@link #TIMES} and {@link
 * #DIVIDE} make a right operand of the same precedence wrap where evaluation
 * order would otherwise change: {@code X - (Y - Z)}, {@code X * (Y / Z)},
 * {@code X / (Y * Z)}, while {@code X + (Y - Z)} is written {@code X + Y - Z}.
 */
public enum Op {
  // atoms
  ATOM("", 99, 99),

  // arithmetic
  PLUS(" + ", 10, 10),
  MINUS(" - ", 10, 11),
  TIMES(" * ", 21, 21),
  DIVIDE(" / ", 20, 22),
  NEGATE("-", 29, 30),
  ABS("|", 29, 99),

  // comparison
  EQ(" = ", 5, 5),
  NE(" != ", 5, 5),
  LT(" < ", 5, 5),
  LE(" <= ", 5, 5),
  GT(" > ", 5, 5),
  GE(" >= ", 5, 5),

  // pools
  RANGE("..", 3, 3),
  POOL(";", 2, 2),

  // literals
  NOT("not ", 1, 1),
  CLASSICAL_NOT("-", 1, 1),
  CONDITION(" : ", 1, 1),

  /** Separator between arguments of a predicate. */
  COMMA(", ", 1, 1);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

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

  /** Returns whether this is a unary arithmetic operator. */
  public boolean isUnary() {
    return this == NEGATE || this == ABS;
  }

  /** Returns whether this is a binary arithmetic operator. */
  public boolean isBinary() {
    switch (this) {
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
        return true;
      default:
        return false;
    }
  }

  /** Returns the operator text without padding, e.g. "+" or "&lt;=". */
  public String symbol() {
    return padded.trim();
  }
}

// End Op.java
