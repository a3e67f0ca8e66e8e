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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.asp.ast.Ast.toComparand;
import static net.hydromatic.asp.ast.Ast.toOperand;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import net.hydromatic.asp.util.Static;

/** Builds syntax tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // values

  /** Creates a variable. */
  public Ast.Variable var(String name) {
    return name.equals("_") ? Ast.Variable.ANY : new Ast.Variable(name);
  }

  /** Creates several variables. */
  public List<Ast.Variable> vars(String... names) {
    final ImmutableList.Builder<Ast.Variable> b = ImmutableList.builder();
    for (String name : names) {
      b.add(var(name));
    }
    return b.build();
  }

  /** Returns the anonymous variable, "_". */
  public Ast.Variable any() {
    return Ast.Variable.ANY;
  }

  /**
   * Creates a variable whose name is not in {@code used}; the first free
   * name in {@code preferred}, or else the last preferred name with a
   * numeric suffix.
   */
  public Ast.Variable uniqueVar(Set<String> used, String... preferred) {
    return var(Static.uniqueName(used, Arrays.asList(preferred)));
  }

  /** Creates an integer constant. */
  public Ast.Constant intLiteral(int value) {
    return new Ast.Constant(value);
  }

  /** Creates a string constant. */
  public Ast.StringConstant stringLiteral(String value) {
    return new Ast.StringConstant(value);
  }

  /**
   * Creates a reference to a symbolic constant. The constant must be
   * registered with the program before it is rendered.
   */
  public Ast.SymbolicConstant symbolic(String name) {
    return new Ast.SymbolicConstant(name);
  }

  // arithmetic

  /** Creates "a0 + a1"; each operand is an int, value or expression. */
  public Ast.Expression plus(Object a0, Object a1) {
    return binary(Op.PLUS, a0, a1);
  }

  /** Creates "a0 - a1". */
  public Ast.Expression minus(Object a0, Object a1) {
    return binary(Op.MINUS, a0, a1);
  }

  /** Creates "a0 * a1". */
  public Ast.Expression times(Object a0, Object a1) {
    return binary(Op.TIMES, a0, a1);
  }

  /** Creates "a0 / a1", integer division. */
  public Ast.Expression divide(Object a0, Object a1) {
    return binary(Op.DIVIDE, a0, a1);
  }

  /** Creates a binary arithmetic expression. */
  public Ast.Expression binary(Op op, Object a0, Object a1) {
    return new Ast.Expression(op, toOperand(a0), toOperand(a1));
  }

  /** Creates "-a". */
  public Ast.Expression negate(Object a) {
    return new Ast.Expression(Op.NEGATE, null, toOperand(a));
  }

  /** Creates "|a|". */
  public Ast.Expression abs(Object a) {
    return new Ast.Expression(Op.ABS, null, toOperand(a));
  }

  // comparisons

  /**
   * Creates a comparison. The left operand is an int, string, value,
   * expression or aggregate; the right may also be a pool.
   */
  public Ast.Comparison compare(Object a0, Op op, Object a1) {
    final Term left = toComparand(a0);
    checkArgument(
        !(left instanceof Ast.Pool),
        "A pool may only be the right operand of a comparison: %s",
        left);
    return new Ast.Comparison(left, op, toComparand(a1));
  }

  /** Creates "a0 = a1". */
  public Ast.Comparison eq(Object a0, Object a1) {
    return compare(a0, Op.EQ, a1);
  }

  /** Creates "a0 != a1". */
  public Ast.Comparison ne(Object a0, Object a1) {
    return compare(a0, Op.NE, a1);
  }

  /** Creates "a0 &lt; a1". */
  public Ast.Comparison lt(Object a0, Object a1) {
    return compare(a0, Op.LT, a1);
  }

  /** Creates "a0 &lt;= a1". */
  public Ast.Comparison le(Object a0, Object a1) {
    return compare(a0, Op.LE, a1);
  }

  /** Creates "a0 &gt; a1". */
  public Ast.Comparison gt(Object a0, Object a1) {
    return compare(a0, Op.GT, a1);
  }

  /** Creates "a0 &gt;= a1". */
  public Ast.Comparison ge(Object a0, Object a1) {
    return compare(a0, Op.GE, a1);
  }

  // pools

  /** Creates a range "start..end"; each bound is an int or grounded term. */
  public Ast.RangePool range(Object start, Object end) {
    return new Ast.RangePool(toOperand(start), toOperand(end));
  }

  /**
   * Creates an explicit pool "(a;b;c)". Each element is an int, a string, a
   * constant or a grounded predicate.
   */
  public Ast.ExplicitPool pool(Object... elements) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (Object element : elements) {
      b.add(element instanceof Ast.Predicate ? (Term) element
          : toComparand(element));
    }
    return new Ast.ExplicitPool(b.build());
  }

  /**
   * Creates a pool containing a collection of integers; a range if they are
   * consecutive and ascending, otherwise an explicit pool.
   */
  public Ast.Pool pool(Iterable<Integer> values) {
    final List<Integer> list = ImmutableList.copyOf(values);
    checkArgument(!list.isEmpty(), "Pool must not be empty");
    boolean consecutive = list.size() > 1;
    for (int i = 1; i < list.size(); i++) {
      if (list.get(i) != list.get(i - 1) + 1) {
        consecutive = false;
        break;
      }
    }
    if (consecutive) {
      return range(list.get(0), Static.last(list));
    }
    return pool(list.toArray());
  }

  // literals

  /**
   * Creates a default negation, "not t".
   *
   * <p>Triple negation is simplified: {@code not(not(not(p)))} returns
   * {@code not p}. Double negation is kept, because "not not p" differs
   * from "p".
   */
  public Ast.DefaultNegation not(Term term) {
    if (term instanceof Ast.DefaultNegation
        && ((Ast.DefaultNegation) term).term instanceof Ast.DefaultNegation) {
      return (Ast.DefaultNegation) ((Ast.DefaultNegation) term).term;
    }
    return new Ast.DefaultNegation(term);
  }

  /**
   * Creates a classical negation, "-p". The negation of a classical negation
   * is the original predicate.
   */
  public Term classicalNot(Term term) {
    if (term instanceof Ast.ClassicalNegation) {
      return ((Ast.ClassicalNegation) term).predicate;
    }
    checkArgument(
        term instanceof Ast.Predicate,
        "Classical negation applies only to a predicate; got %s",
        Ast.describe(term));
    return new Ast.ClassicalNegation((Ast.Predicate) term);
  }

  /** Creates a conditional literal, "head : c1, c2". */
  public Ast.ConditionalLiteral conditional(Term head, Term... conditions) {
    return new Ast.ConditionalLiteral(head, Arrays.asList(conditions));
  }

  /** Creates a conditional literal, "head : c1, c2". */
  public Ast.ConditionalLiteral conditional(
      Term head, List<? extends Term> conditions) {
    return new Ast.ConditionalLiteral(head, conditions);
  }

  /**
   * Creates a conditional literal that requires, for each lock, the key;
   * "key : lock1, lock2". For example, "holds(X) : box(X)" requires every
   * box to hold.
   */
  public Ast.ConditionalLiteral keyForEachLock(Term key, Term... locks) {
    return conditional(key, locks);
  }

  // aggregates

  /** Creates an empty aggregate of a given kind. */
  public Ast.Aggregate aggregate(Ast.Aggregate.Kind kind) {
    return new Ast.Aggregate(kind, ImmutableList.of());
  }

  /** Creates an empty "#count" aggregate. */
  public Ast.Aggregate count() {
    return aggregate(Ast.Aggregate.Kind.COUNT);
  }

  /** Creates "#count{element : conditions}". */
  public Ast.Aggregate count(Term element, Term... conditions) {
    return count().add(element, conditions);
  }

  /** Creates an empty "#sum" aggregate. */
  public Ast.Aggregate sum() {
    return aggregate(Ast.Aggregate.Kind.SUM);
  }

  /** Creates an empty "#sum+" aggregate. */
  public Ast.Aggregate sumPlus() {
    return aggregate(Ast.Aggregate.Kind.SUM_PLUS);
  }

  /** Creates an empty "#min" aggregate. */
  public Ast.Aggregate min() {
    return aggregate(Ast.Aggregate.Kind.MIN);
  }

  /** Creates an empty "#max" aggregate. */
  public Ast.Aggregate max() {
    return aggregate(Ast.Aggregate.Kind.MAX);
  }

  /** Creates an empty choice with no bounds. */
  public Ast.Choice choice() {
    return new Ast.Choice(ImmutableList.of(), null, null);
  }

  /** Creates a choice "{ element : conditions }". */
  public Ast.Choice choice(Term element, Term... conditions) {
    return choice().add(element, conditions);
  }
}

// End AstBuilder.java
