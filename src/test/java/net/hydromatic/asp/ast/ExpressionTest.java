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

import static net.hydromatic.asp.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests values, arithmetic expressions and comparisons. */
public class ExpressionTest {
  private final Ast.Variable x = ast.var("X");
  private final Ast.Variable y = ast.var("Y");
  private final Ast.Variable z = ast.var("Z");

  @Test
  void testValues() {
    assertThat(ast.intLiteral(42), hasToString("42"));
    assertThat(ast.intLiteral(-3), hasToString("-3"));
    assertThat(ast.stringLiteral("red"), hasToString("\"red\""));
    assertThat(ast.symbolic("size"), hasToString("size"));
    assertThat(ast.var("Row"), hasToString("Row"));
    assertThat(ast.any(), hasToString("_"));
    assertThat(ast.any().isAnonymous(), is(true));
    assertThat(x.isAnonymous(), is(false));
  }

  @Test
  void testInvalidNames() {
    assertThrows(IllegalArgumentException.class, () -> ast.var("x"));
    assertThrows(IllegalArgumentException.class, () -> ast.var("1X"));
    assertThrows(IllegalArgumentException.class, () -> ast.symbolic("N"));
    assertThrows(IllegalArgumentException.class, () -> ast.symbolic("a-b"));
    assertThrows(
        IllegalArgumentException.class, () -> ast.stringLiteral("say \"hi\""));
  }

  @Test
  void testVars() {
    final List<Ast.Variable> vars = ast.vars("R", "C");
    assertThat(vars, contains(ast.var("R"), ast.var("C")));
    assertThat(ast.var("R").equals(ast.var("R")), is(true));
    assertThat(ast.var("R").equals(ast.var("C")), is(false));
  }

  @Test
  void testArithmetic() {
    assertThat(ast.plus(x, 1), hasToString("X + 1"));
    assertThat(x.minus(y), hasToString("X - Y"));
    assertThat(x.times(2), hasToString("X * 2"));
    assertThat(x.divide(y), hasToString("X / Y"));
    assertThat(x.negate(), hasToString("-X"));
    assertThat(ast.abs(x.minus(y)), hasToString("|X - Y|"));
    assertThat(ast.plus(1, 2), hasToString("1 + 2"));
  }

  @Test
  void testPrecedence() {
    // (X * Y) / Z needs no parentheses; X * (Y / Z) does
    assertThat(ast.divide(ast.times(x, y), z), hasToString("X * Y / Z"));
    assertThat(ast.times(x, ast.divide(y, z)), hasToString("X * (Y / Z)"));

    // subtraction is left-associative
    assertThat(x.minus(y).minus(z), hasToString("X - Y - Z"));
    assertThat(x.minus(y.minus(z)), hasToString("X - (Y - Z)"));
    assertThat(x.plus(y.minus(z)), hasToString("X + Y - Z"));
    assertThat(x.divide(y.times(z)), hasToString("X / (Y * Z)"));
    assertThat(x.divide(y).divide(z), hasToString("X / Y / Z"));

    // multiplication binds tighter than addition
    assertThat(x.plus(y).times(z), hasToString("(X + Y) * Z"));
    assertThat(x.plus(y.times(z)), hasToString("X + Y * Z"));
    assertThat(x.times(y).plus(z), hasToString("X * Y + Z"));

    // unary minus
    assertThat(x.plus(y).negate(), hasToString("-(X + Y)"));
    assertThat(x.negate().negate(), hasToString("-(-X)"));
    assertThat(x.negate().times(y), hasToString("-X * Y"));
    assertThat(ast.abs(x).negate(), hasToString("-(|X|)"));
    assertThat(ast.negate(-3), hasToString("-(-3)"));
    assertThat(ast.times(-3, x), hasToString("-3 * X"));

    // absolute value brackets its operand
    assertThat(x.plus(y).abs().times(2), hasToString("|X + Y| * 2"));

    // nested
    assertThat(
        ast.plus(
            ast.plus(2, x.minus(2).divide(3)),
            ast.times(3, y.minus(2).divide(3))),
        hasToString("2 + (X - 2) / 3 + 3 * ((Y - 2) / 3)"));
    assertThat(
        x.plus(1).times(y.minus(1)).negate(),
        hasToString("-((X + 1) * (Y - 1))"));
    assertThat(
        ast.abs(x.minus(y)).plus(ast.abs(y.minus(z))).divide(2),
        hasToString("(|X - Y| + |Y - Z|) / 2"));
  }

  @Test
  void testComparisons() {
    assertThat(x.eq(y), hasToString("X = Y"));
    assertThat(x.ne(1), hasToString("X != 1"));
    assertThat(x.lt(y.plus(1)), hasToString("X < Y + 1"));
    assertThat(x.plus(1).le(y), hasToString("X + 1 <= Y"));
    assertThat(x.gt(0), hasToString("X > 0"));
    assertThat(x.ge(ast.symbolic("n")), hasToString("X >= n"));
    assertThat(ast.ne(x, "red"), hasToString("X != \"red\""));
    assertThat(ast.eq(x, y).isAssignment(), is(true));
    assertThat(ast.eq(1, y).isAssignment(), is(false));
    assertThat(ast.lt(x, y).isAssignment(), is(false));
  }

  @Test
  void testComparisonOperands() {
    // a variable may be compared with a pool only by '='
    assertThat(ast.eq(x, ast.range(1, 5)), hasToString("X = 1..5"));
    assertThrows(
        IllegalArgumentException.class, () -> ast.lt(x, ast.range(1, 5)));
    assertThrows(
        IllegalArgumentException.class, () -> ast.eq(ast.range(1, 5), x));
    assertThrows(IllegalArgumentException.class, () -> ast.eq(x, 1.5));
    assertThrows(
        IllegalArgumentException.class,
        () -> ast.binary(Op.EQ, x, y));
  }

  @Test
  void testGrounded() {
    assertThat(ast.intLiteral(1).isGrounded(), is(true));
    assertThat(ast.symbolic("n").isGrounded(), is(true));
    assertThat(x.isGrounded(), is(false));
    assertThat(ast.plus(1, ast.symbolic("n")).isGrounded(), is(true));
    assertThat(ast.plus(1, x).isGrounded(), is(false));
    assertThat(ast.eq(ast.times(2, 3), 6).isGrounded(), is(true));
    assertThat(ast.any().isGrounded(), is(false));
  }

  @Test
  void testCollect() {
    final Ast.Comparison c =
        ast.lt(x.plus(ast.symbolic("n")), y.times(ast.symbolic("m")));
    assertThat(c.collectVariables(), contains("X", "Y"));
    assertThat(c.collectSymbolicConstants(), contains("n", "m"));
    assertThat(c.collectPredicates(), empty());
  }

  @Test
  void testEquality() {
    assertThat(ast.plus(x, 1).equals(ast.plus(x, 1)), is(true));
    assertThat(ast.plus(x, 1).equals(ast.plus(1, x)), is(false));
    assertThat(ast.plus(x, 1).hashCode(), is(ast.plus(x, 1).hashCode()));
    assertThat(ast.eq(x, 1).equals(ast.eq(x, 1)), is(true));
    assertThat(ast.intLiteral(1).equals(ast.stringLiteral("1")), is(false));
  }

  @Test
  void testTermsNotAllowedAsLiterals() {
    // values and expressions are not literals; they may not stand alone in
    // a rule
    final InvalidContextException e =
        assertThrows(
            InvalidContextException.class, () -> x.validateInContext(false));
    assertThat(
        e.getMessage(),
        is(
            "Variable 'X' cannot be used in a rule body: a variable must be "
                + "used within a predicate, comparison or aggregate"));
    assertThrows(
        InvalidContextException.class,
        () -> ast.intLiteral(1).validateInContext(true));
    assertThrows(
        InvalidContextException.class,
        () -> ast.plus(x, 1).validateInContext(false));
    // comparisons are allowed in both head and body
    ast.eq(x, 1).validateInContext(true);
    ast.eq(x, 1).validateInContext(false);
  }
}

// End ExpressionTest.java
