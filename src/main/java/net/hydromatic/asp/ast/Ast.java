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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.asp.util.Static.isLowerIdentifier;
import static net.hydromatic.asp.util.Static.isVariableName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of ASP syntax tree nodes. */
public class Ast {
  private Ast() {}

  /**
   * Converts a Java value to a term that may be the operand of arithmetic.
   * Integers become {@link Constant}.
   */
  static Operand toOperand(Object o) {
    if (o instanceof Integer) {
      return new Constant((Integer) o);
    }
    if (o instanceof Operand) {
      return (Operand) o;
    }
    throw new IllegalArgumentException(
        "Operand must be an int, value or expression; got " + describe(o));
  }

  /**
   * Converts a Java value to a term that may be the operand of a comparison.
   * Integers become {@link Constant}, strings become {@link StringConstant}.
   */
  static Term toComparand(Object o) {
    if (o instanceof Integer) {
      return new Constant((Integer) o);
    }
    if (o instanceof String) {
      return new StringConstant((String) o);
    }
    if (o instanceof Operand || o instanceof Aggregate || o instanceof Pool) {
      return (Term) o;
    }
    throw new IllegalArgumentException(
        "Comparison operand must be an int, string, value, expression, "
            + "aggregate or pool; got "
            + describe(o));
  }

  /** Describes a value for an error message. */
  static String describe(@Nullable Object o) {
    return o == null ? "null" : o.getClass().getSimpleName() + " " + o;
  }

  /** Returns whether a term may be a condition of a rule or aggregate. */
  static boolean isLiteral(Term term) {
    return term instanceof Predicate
        || term instanceof DefaultNegation
        || term instanceof ClassicalNegation
        || term instanceof Comparison;
  }

  private static ImmutableList<Term> conditions(List<? extends Term> terms) {
    for (Term term : terms) {
      checkArgument(
          isLiteral(term),
          "Condition must be a predicate, negated literal or comparison; "
              + "got %s",
          describe(term));
    }
    return ImmutableList.copyOf(terms);
  }

  /** Term that may be compared using "=", "&lt;" and so forth. */
  public abstract static class Comparand extends Term {
    Comparand(Op op) {
      super(op);
    }

    private Comparison compare(Op op, Object right) {
      return new Comparison(this, op, toComparand(right));
    }

    /** Creates a comparison "this = right". */
    public Comparison eq(Term right) {
      return compare(Op.EQ, right);
    }

    /** Creates a comparison "this = right". */
    public Comparison eq(int right) {
      return compare(Op.EQ, right);
    }

    /** Creates a comparison "this != right". */
    public Comparison ne(Term right) {
      return compare(Op.NE, right);
    }

    /** Creates a comparison "this != right". */
    public Comparison ne(int right) {
      return compare(Op.NE, right);
    }

    /** Creates a comparison "this &lt; right". */
    public Comparison lt(Term right) {
      return compare(Op.LT, right);
    }

    /** Creates a comparison "this &lt; right". */
    public Comparison lt(int right) {
      return compare(Op.LT, right);
    }

    /** Creates a comparison "this &lt;= right". */
    public Comparison le(Term right) {
      return compare(Op.LE, right);
    }

    /** Creates a comparison "this &lt;= right". */
    public Comparison le(int right) {
      return compare(Op.LE, right);
    }

    /** Creates a comparison "this &gt; right". */
    public Comparison gt(Term right) {
      return compare(Op.GT, right);
    }

    /** Creates a comparison "this &gt; right". */
    public Comparison gt(int right) {
      return compare(Op.GT, right);
    }

    /** Creates a comparison "this &gt;= right". */
    public Comparison ge(Term right) {
      return compare(Op.GE, right);
    }

    /** Creates a comparison "this &gt;= right". */
    public Comparison ge(int right) {
      return compare(Op.GE, right);
    }
  }

  /** Term that may be an operand of arithmetic; a value or expression. */
  public abstract static class Operand extends Comparand {
    Operand(Op op) {
      super(op);
    }

    /** Creates an expression "this + right". */
    public Expression plus(Operand right) {
      return new Expression(Op.PLUS, this, right);
    }

    /** Creates an expression "this + right". */
    public Expression plus(int right) {
      return new Expression(Op.PLUS, this, new Constant(right));
    }

    /** Creates an expression "this - right". */
    public Expression minus(Operand right) {
      return new Expression(Op.MINUS, this, right);
    }

    /** Creates an expression "this - right". */
    public Expression minus(int right) {
      return new Expression(Op.MINUS, this, new Constant(right));
    }

    /** Creates an expression "this * right". */
    public Expression times(Operand right) {
      return new Expression(Op.TIMES, this, right);
    }

    /** Creates an expression "this * right". */
    public Expression times(int right) {
      return new Expression(Op.TIMES, this, new Constant(right));
    }

    /** Creates an expression "this / right" (integer division). */
    public Expression divide(Operand right) {
      return new Expression(Op.DIVIDE, this, right);
    }

    /** Creates an expression "this / right" (integer division). */
    public Expression divide(int right) {
      return new Expression(Op.DIVIDE, this, new Constant(right));
    }

    /** Creates an expression "-this". */
    public Expression negate() {
      return new Expression(Op.NEGATE, null, this);
    }

    /** Creates an expression "|this|". */
    public Expression abs() {
      return new Expression(Op.ABS, null, this);
    }
  }

  /** Leaf of an expression: a variable or a constant. */
  public abstract static class Value extends Operand {
    Value() {
      super(Op.ATOM);
    }
  }

  /** Variable. */
  public static class Variable extends Value {
    /** The anonymous variable, "_". */
    public static final Variable ANY = new Variable("_");

    public final String name;

    Variable(String name) {
      this.name = requireNonNull(name);
      checkArgument(
          isVariableName(name),
          "Variable name must be '_' or start with an upper-case letter: '%s'",
          name);
    }

    /** Returns whether this is the anonymous variable, "_". */
    public boolean isAnonymous() {
      return name.equals("_");
    }

    /**
     * Creates a comparison that restricts this variable to the values of a
     * pool; for example "X = 1..5" or "X = (1;3;5)".
     */
    public Comparison in(Pool pool) {
      return new Comparison(this, Op.EQ, pool);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void validateInContext(boolean inHead) {
      invalidIn(
          inHead,
          "a variable must be used within a predicate, comparison "
              + "or aggregate");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Variable && name.equals(((Variable) o).name);
    }
  }

  /** Base class for constants. A constant is always grounded. */
  public abstract static class ConstantBase extends Value {
    @Override
    public void validateInContext(boolean inHead) {
      invalidIn(
          inHead,
          "a constant must be used within a predicate, comparison "
              + "or aggregate");
    }
  }

  /** Integer constant. */
  public static class Constant extends ConstantBase {
    public final int value;

    Constant(int value) {
      this.value = value;
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      if (value < 0 && (left > Op.NEGATE.left || Op.NEGATE.right < right)) {
        // A negative literal is a unary minus, and wraps like one.
        return w.append("(").append(Integer.toString(value)).append(")");
      }
      return w.append(Integer.toString(value));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return Integer.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant && value == ((Constant) o).value;
    }
  }

  /** String constant, written in double quotes. */
  public static class StringConstant extends ConstantBase {
    public final String value;

    StringConstant(String value) {
      this.value = requireNonNull(value);
      checkArgument(
          value.indexOf('"') < 0 && value.indexOf('\'') < 0,
          "String constant must not contain quotes: %s",
          value);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append("\"").append(value).append("\"");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof StringConstant
              && value.equals(((StringConstant) o).value);
    }
  }

  /**
   * Symbolic constant; a name whose value is defined by a "#const" directive
   * of the program in which it is used.
   */
  public static class SymbolicConstant extends ConstantBase {
    public final String name;

    SymbolicConstant(String name) {
      this.name = requireNonNull(name);
      checkArgument(
          isLowerIdentifier(name),
          "Symbolic constant name must start with a lower-case letter and "
              + "contain only letters, digits and underscores: '%s'",
          name);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SymbolicConstant
              && name.equals(((SymbolicConstant) o).name);
    }
  }

  /**
   * Arithmetic expression. A binary expression has both operands; a unary
   * expression ({@link Op#NEGATE}, {@link Op#ABS}) has only {@code a1}.
   */
  public static class Expression extends Operand {
    public final @Nullable Operand a0;
    public final Operand a1;

    Expression(Op op, @Nullable Operand a0, Operand a1) {
      super(op);
      this.a0 = a0;
      this.a1 = requireNonNull(a1);
      if (op.isBinary()) {
        checkArgument(a0 != null, "binary operator %s needs two operands", op);
      } else if (op.isUnary()) {
        checkArgument(a0 == null, "unary operator %s has one operand", op);
      } else {
        throw new IllegalArgumentException("not an arithmetic operator: " + op);
      }
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      switch (op) {
        case ABS:
          if (left > op.left || op.right < right) {
            return w.append("(").append(this, 0, 0).append(")");
          }
          return w.append("|").append(a1, 0, 0).append("|");
        case NEGATE:
          return w.prefix(left, op, a1, right);
        default:
          return w.infix(left, requireNonNull(a0), op, a1, right);
      }
    }

    @Override
    public void validateInContext(boolean inHead) {
      invalidIn(
          inHead,
          "an expression must be used within a predicate, comparison "
              + "or aggregate");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Expression
              && op == ((Expression) o).op
              && Objects.equals(a0, ((Expression) o).a0)
              && a1.equals(((Expression) o).a1);
    }
  }

  /** Comparison, such as "X &lt; Y + 1" or "N = #count{...}". */
  public static class Comparison extends Term {
    public final Term a0;
    public final Term a1;

    Comparison(Term a0, Op op, Term a1) {
      super(op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isComparison(), "not a comparison operator: %s", op);
      checkArgument(
          a0 instanceof Operand || a0 instanceof Aggregate,
          "Left operand of comparison must be a value, expression or "
              + "aggregate; got %s",
          describe(a0));
      checkArgument(
          a1 instanceof Operand
              || a1 instanceof Aggregate
              || a1 instanceof Pool,
          "Right operand of comparison must be a value, expression, "
              + "aggregate or pool; got %s",
          describe(a1));
      if (a1 instanceof Pool) {
        checkArgument(
            op == Op.EQ && a0 instanceof Variable,
            "A pool may only be the right operand of '=' "
                + "with a variable on the left: %s %s %s",
            a0,
            op.symbol(),
            a1);
      }
    }

    /** Returns whether this comparison binds a variable, as in "X = ...". */
    public boolean isAssignment() {
      return op == Op.EQ && a0 instanceof Variable;
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    @Override
    public void validateInContext(boolean inHead) {
      // allowed in head and body
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Comparison
              && op == ((Comparison) o).op
              && a0.equals(((Comparison) o).a0)
              && a1.equals(((Comparison) o).a1);
    }
  }

  /** Pool of values; a range or an explicit list. */
  public abstract static class Pool extends Term {
    Pool(Op op) {
      super(op);
    }

    @Override
    public void validateInContext(boolean inHead) {
      // The engine expands a pool wherever it occurs.
    }
  }

  /** Range of integers, "start..end". */
  public static class RangePool extends Pool {
    public final Operand start;
    public final Operand end;

    RangePool(Operand start, Operand end) {
      super(Op.RANGE);
      this.start = checkBound(start);
      this.end = checkBound(end);
    }

    private static Operand checkBound(Operand bound) {
      checkArgument(
          bound instanceof Constant
              || bound instanceof SymbolicConstant
              || bound instanceof Expression && bound.isGrounded(),
          "Range bound must be an int, constant or grounded expression; "
              + "got %s",
          describe(bound));
      return bound;
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append(start, 0, op.left)
          .append(op.padded)
          .append(end, op.right, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(start, end);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RangePool
              && start.equals(((RangePool) o).start)
              && end.equals(((RangePool) o).end);
    }
  }

  /**
   * Explicit list of alternatives, "(a;b;c)". As the only argument of a
   * predicate, the parentheses are omitted: "p(a;b;c)".
   */
  public static class ExplicitPool extends Pool {
    public final ImmutableList<Term> elements;

    ExplicitPool(List<? extends Term> elements) {
      super(Op.POOL);
      checkArgument(!elements.isEmpty(), "Pool must not be empty");
      for (Term e : elements) {
        checkArgument(
            e instanceof ConstantBase
                || e instanceof Predicate && e.isGrounded(),
            "Pool element must be a constant or grounded predicate; got %s",
            describe(e));
      }
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").list(elements, op.padded, 0, 0).append(")");
      }
      return w.list(elements, op.padded, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ExplicitPool
              && elements.equals(((ExplicitPool) o).elements);
    }
  }

  /**
   * Instance of a predicate; an atom such as "cell(1, 2)".
   *
   * <p>Equality is structural: two predicates are equal if they have the
   * same rendered name and equal arguments, even if they were created by
   * different {@link Schema} objects.
   */
  public static class Predicate extends Term implements Comparable<Predicate> {
    public final Schema schema;
    public final ImmutableList<Term> arguments;

    Predicate(Schema schema, List<Term> arguments) {
      super(Op.ATOM);
      this.schema = requireNonNull(schema);
      this.arguments = ImmutableList.copyOf(arguments);
      checkArgument(
          arguments.size() == schema.arity(),
          "Predicate %s expects %s arguments, got %s",
          schema.qualifiedName(),
          schema.arity(),
          arguments.size());
    }

    /** Returns the rendered name, including namespace prefix. */
    public String name() {
      return schema.qualifiedName();
    }

    /** Returns the number of arguments. */
    public int arity() {
      return arguments.size();
    }

    /** Returns the value of a field. */
    public Term get(String field) {
      return arguments.get(schema.fieldIndex(field));
    }

    /** Returns the value of a field, which must be an integer constant. */
    public int getInt(String field) {
      final Term term = get(field);
      checkArgument(
          term instanceof Constant,
          "Field %s of %s is not an integer: %s",
          field,
          name(),
          term);
      return ((Constant) term).value;
    }

    /** Returns the fields and their values, in declaration order. */
    public ImmutableMap<String, Term> items() {
      final ImmutableMap.Builder<String, Term> b = ImmutableMap.builder();
      for (int i = 0; i < arguments.size(); i++) {
        b.put(schema.fields.get(i), arguments.get(i));
      }
      return b.build();
    }

    /** Returns the classical negation of this predicate, "-p(X)". */
    public ClassicalNegation negate() {
      return new ClassicalNegation(this);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      w.append(name());
      if (arguments.isEmpty()) {
        return w;
      }
      // A lone argument is written in a bare context, so that a pool
      // argument is written "p(1;2;3)" rather than "p((1;2;3))".
      final int c = arguments.size() == 1 ? 0 : Op.COMMA.left;
      return w.append("(").list(arguments, Op.COMMA.padded, c, c).append(")");
    }

    @Override
    public void validateInContext(boolean inHead) {
      // allowed in head and body
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int compareTo(Predicate o) {
      int c = name().compareTo(o.name());
      if (c != 0) {
        return c;
      }
      c = Integer.compare(arity(), o.arity());
      if (c != 0) {
        return c;
      }
      for (int i = 0; i < arguments.size(); i++) {
        c = compareArguments(arguments.get(i), o.arguments.get(i));
        if (c != 0) {
          return c;
        }
      }
      return 0;
    }

    /**
     * Compares two arguments. Integers sort numerically and before anything
     * else, nested predicates sort recursively, and other terms sort by
     * their text.
     */
    private static int compareArguments(Term t0, Term t1) {
      if (t0 instanceof Constant && t1 instanceof Constant) {
        return Integer.compare(((Constant) t0).value, ((Constant) t1).value);
      }
      if (t0 instanceof Constant) {
        return -1;
      }
      if (t1 instanceof Constant) {
        return 1;
      }
      if (t0 instanceof Predicate && t1 instanceof Predicate) {
        return ((Predicate) t0).compareTo((Predicate) t1);
      }
      return t0.render().compareTo(t1.render());
    }

    @Override
    public int hashCode() {
      return Objects.hash(name(), arguments);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Predicate
              && name().equals(((Predicate) o).name())
              && arguments.equals(((Predicate) o).arguments);
    }
  }

  /** Classical ("strong") negation of a predicate, "-p(X)". */
  public static class ClassicalNegation extends Term {
    public final Predicate predicate;

    ClassicalNegation(Predicate predicate) {
      super(Op.CLASSICAL_NOT);
      this.predicate = requireNonNull(predicate);
    }

    /** Negates this negation, returning the original predicate. */
    public Predicate negate() {
      return predicate;
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append(op.padded).append(predicate, 0, 0);
    }

    @Override
    public void validateInContext(boolean inHead) {
      // allowed in head and body
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return predicate.hashCode() * 31 + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ClassicalNegation
              && predicate.equals(((ClassicalNegation) o).predicate);
    }
  }

  /**
   * Default negation ("negation as failure"), "not p(X)".
   *
   * <p>Use {@link AstBuilder#not}, which simplifies a triple negation to a
   * single one.
   */
  public static class DefaultNegation extends Term {
    public final Term term;

    DefaultNegation(Term term) {
      super(Op.NOT);
      this.term = requireNonNull(term);
      checkArgument(
          isLiteral(term),
          "Default negation applies to a predicate, negated literal "
              + "or comparison; got %s",
          describe(term));
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append(op.padded).append(term, op.right, right);
    }

    @Override
    public void validateInContext(boolean inHead) {
      if (inHead) {
        invalidIn(true, "default negation is only allowed in a rule body");
      }
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public int hashCode() {
      return term.hashCode() * 31 + 2;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DefaultNegation
              && term.equals(((DefaultNegation) o).term);
    }
  }

  /**
   * Conditional literal, "head : c1, c2"; for every instance of the
   * conditions, the head must hold.
   */
  public static class ConditionalLiteral extends Term {
    public final Term head;
    public final ImmutableList<Term> conditions;

    ConditionalLiteral(Term head, List<? extends Term> conditions) {
      super(Op.CONDITION);
      this.head = requireNonNull(head);
      checkArgument(
          head instanceof Predicate
              || head instanceof Comparison
              || head instanceof ClassicalNegation
              || head instanceof DefaultNegation,
          "Head of conditional literal must be a predicate, comparison or "
              + "negated literal; got %s",
          describe(head));
      checkArgument(
          !conditions.isEmpty(), "Conditional literal needs a condition");
      this.conditions = conditions(conditions);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      return w.append(head, 0, 0)
          .append(op.padded)
          .list(conditions, Op.COMMA.padded, 0, 0);
    }

    @Override
    public void validateInContext(boolean inHead) {
      if (inHead) {
        invalidIn(true, "a conditional literal is only allowed in a rule body");
      }
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Element of an aggregate or choice: one or more terms, and the conditions
   * under which they are included.
   */
  public static class Clause {
    public final ImmutableList<Term> elements;
    public final ImmutableList<Term> conditions;

    Clause(List<? extends Term> elements, List<? extends Term> conditions) {
      checkArgument(!elements.isEmpty(), "Clause needs at least one element");
      this.elements = ImmutableList.copyOf(elements);
      this.conditions = conditions(conditions);
    }

    void unparse(AspWriter w) {
      w.list(elements, Op.COMMA.padded, 0, 0);
      if (!conditions.isEmpty()) {
        w.append(Op.CONDITION.padded).list(conditions, Op.COMMA.padded, 0, 0);
      }
    }

    void accept(Visitor visitor) {
      elements.forEach(visitor::accept);
      conditions.forEach(visitor::accept);
    }
  }

  /** Aggregate, such as "#count{X : p(X)}". */
  public static class Aggregate extends Comparand {
    public final Kind kind;
    public final ImmutableList<Clause> clauses;

    Aggregate(Kind kind, List<Clause> clauses) {
      super(Op.ATOM);
      this.kind = requireNonNull(kind);
      this.clauses = ImmutableList.copyOf(clauses);
    }

    /**
     * Returns an aggregate with one more clause. Elements must be values or
     * predicates; conditions must be literals.
     */
    public Aggregate add(
        List<? extends Term> elements, List<? extends Term> conditions) {
      for (Term e : elements) {
        checkArgument(
            e instanceof Value || e instanceof Predicate,
            "Aggregate element must be a value or predicate; got %s",
            describe(e));
      }
      return new Aggregate(
          kind,
          ImmutableList.<Clause>builder()
              .addAll(clauses)
              .add(new Clause(elements, conditions))
              .build());
    }

    /** Returns an aggregate with one more clause of a single element. */
    public Aggregate add(Term element, Term... conditions) {
      return add(ImmutableList.of(element), Arrays.asList(conditions));
    }

    /** Creates a comparison that assigns this aggregate to a variable. */
    public Comparison assignTo(Variable variable) {
      return new Comparison(variable, Op.EQ, this);
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      w.append(kind.symbol).append("{");
      for (int i = 0; i < clauses.size(); i++) {
        if (i > 0) {
          w.append("; ");
        }
        clauses.get(i).unparse(w);
      }
      return w.append("}");
    }

    @Override
    public void validateInContext(boolean inHead) {
      invalidIn(inHead, "an aggregate must be used within a comparison");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Aggregate function. */
    public enum Kind {
      COUNT("#count"),
      SUM("#sum"),
      /** Sum of the positive elements only. */
      SUM_PLUS("#sum+"),
      MIN("#min"),
      MAX("#max");

      public final String symbol;

      Kind(String symbol) {
        this.symbol = symbol;
      }
    }
  }

  /**
   * Choice, such as "1 { p(X) : q(X) } 2"; the engine may choose any subset
   * of the elements whose size is within the bounds.
   */
  public static class Choice extends Term {
    public final ImmutableList<Clause> clauses;
    public final @Nullable Operand min;
    public final @Nullable Operand max;

    Choice(
        List<Clause> clauses,
        @Nullable Operand min,
        @Nullable Operand max) {
      super(Op.ATOM);
      this.clauses = ImmutableList.copyOf(clauses);
      this.min = min;
      this.max = max;
    }

    /** Returns a choice with one more element. */
    public Choice add(Term element, List<? extends Term> conditions) {
      checkArgument(
          element instanceof Predicate || element instanceof ClassicalNegation,
          "Choice element must be a predicate or classical negation; got %s",
          describe(element));
      return new Choice(
          ImmutableList.<Clause>builder()
              .addAll(clauses)
              .add(new Clause(ImmutableList.of(element), conditions))
              .build(),
          min,
          max);
    }

    /** Returns a choice with one more element. */
    public Choice add(Term element, Term... conditions) {
      return add(element, Arrays.asList(conditions));
    }

    /** Returns a choice that must choose exactly {@code n} elements. */
    public Choice exactly(int n) {
      return exactly(bound(n));
    }

    /** Returns a choice that must choose exactly {@code n} elements. */
    public Choice exactly(Operand n) {
      checkArgument(
          min == null && max == null,
          "Choice already has cardinality bounds: %s",
          this);
      final Operand bound = checkBound(n);
      return new Choice(clauses, bound, bound);
    }

    /** Returns a choice that must choose at least {@code n} elements. */
    public Choice atLeast(int n) {
      return atLeast(bound(n));
    }

    /** Returns a choice that must choose at least {@code n} elements. */
    public Choice atLeast(Operand n) {
      checkArgument(min == null, "Choice already has a lower bound: %s", this);
      return new Choice(clauses, checkBound(n), max);
    }

    /** Returns a choice that may choose at most {@code n} elements. */
    public Choice atMost(int n) {
      return atMost(bound(n));
    }

    /** Returns a choice that may choose at most {@code n} elements. */
    public Choice atMost(Operand n) {
      checkArgument(max == null, "Choice already has an upper bound: %s", this);
      return new Choice(clauses, min, checkBound(n));
    }

    private static Constant bound(int n) {
      checkArgument(n >= 0, "Cardinality bound must not be negative: %s", n);
      return new Constant(n);
    }

    private static Operand checkBound(Operand n) {
      if (n instanceof Constant) {
        checkArgument(
            ((Constant) n).value >= 0,
            "Cardinality bound must not be negative: %s",
            n);
        return n;
      }
      checkArgument(
          n instanceof SymbolicConstant
              || n instanceof Expression && n.isGrounded(),
          "Cardinality bound must be an int, symbolic constant or grounded "
              + "expression; got %s",
          describe(n));
      return n;
    }

    @Override
    protected AspWriter unparse(AspWriter w, int left, int right) {
      if (min != null && !min.equals(max)) {
        w.append(min, 0, 0).append(" ");
      }
      w.append("{ ");
      for (int i = 0; i < clauses.size(); i++) {
        if (i > 0) {
          w.append("; ");
        }
        clauses.get(i).unparse(w);
      }
      w.append(" }");
      if (max != null) {
        if (max.equals(min)) {
          w.append(" = ");
        } else {
          w.append(" ");
        }
        w.append(max, 0, 0);
      }
      return w;
    }

    @Override
    public void validateInContext(boolean inHead) {
      if (!inHead) {
        invalidIn(false, "a choice is only allowed in a rule head");
      }
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
