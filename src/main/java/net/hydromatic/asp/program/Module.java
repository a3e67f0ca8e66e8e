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
package net.hydromatic.asp.program;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.asp.util.Static.lower;

import com.google.common.base.CharMatcher;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Schema;
import net.hydromatic.asp.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Part of a {@link Puzzle} that contributes schemas and statements.
 *
 * <p>A module writes to a segment of the puzzle's program that has the same
 * name as the module. Schemas it defines are in its namespace, so that the
 * predicates of different modules do not clash; a module created with
 * {@code primaryNamespace} has an empty namespace.
 *
 * <p>Schemas and terms that are expensive to compute, or that must be
 * defined only once, can be wrapped in {@link #memoize(Supplier)}.
 */
public abstract class Module {
  private static final CharMatcher ALPHANUMERIC =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'));

  protected final Puzzle puzzle;
  public final String name;
  /** Namespace of this module's schemas; empty if primary. */
  public final String namespace;

  protected Module(Puzzle puzzle, String name, boolean primaryNamespace) {
    this.puzzle = requireNonNull(puzzle);
    checkArgument(
        !name.isEmpty()
            && Character.isLetter(name.charAt(0))
            && ALPHANUMERIC.matchesAllOf(name),
        "Bad name %s; must be alphanumeric and start with a letter",
        name);
    this.name = lower(name);
    this.namespace = primaryNamespace ? "" : this.name;
    puzzle.register(this);
  }

  protected Module(Puzzle puzzle, String name) {
    this(puzzle, name, false);
  }

  public Puzzle puzzle() {
    return puzzle;
  }

  /** Returns this module's segment. */
  public Segment segment() {
    return puzzle.segment(name);
  }

  /**
   * Defines a schema in this module's namespace, and registers it with the
   * program.
   */
  protected Schema defineSchema(String name, String... fields) {
    return defineSchema(name, ImmutableList.copyOf(fields), true);
  }

  /** Defines a schema in this module's namespace. */
  protected Schema defineSchema(
      String name, List<String> fields, boolean show) {
    return puzzle
        .program()
        .defineSchema(Schema.define(name, fields, namespace, show));
  }

  /** Returns a supplier that computes its value once, on first use. */
  protected static <T> Supplier<T> memoize(Supplier<T> supplier) {
    return Suppliers.memoize(supplier);
  }

  public Module addFact(Ast.Predicate... predicates) {
    segment().addFact(predicates);
    return this;
  }

  public Module addRule(List<? extends Term> conditions, Term consequent) {
    segment().addRule(conditions, consequent);
    return this;
  }

  public Module addRule(Term condition, Term consequent) {
    segment().addRule(condition, consequent);
    return this;
  }

  public Module addConstraint(Term... conditions) {
    segment().addConstraint(conditions);
    return this;
  }

  public Module comment(String text) {
    segment().comment(text);
    return this;
  }

  public Module blankLine() {
    segment().blankLine();
    return this;
  }

  public Module section(String title) {
    segment().section(title);
    return this;
  }

  /**
   * As {@link Puzzle#countConstraint}, but adds the rules to this module's
   * segment.
   */
  public void countConstraint(
      Term countOver,
      List<? extends Term> conditions,
      Ast.@Nullable Variable countVariable,
      List<? extends Term> when,
      Map<Puzzle.CountBound, ?> bounds) {
    puzzle.countConstraint(
        segment(), countOver, conditions, countVariable, when, bounds);
  }

  /**
   * Called once, before the puzzle is first rendered or solved, so that the
   * module can add statements that depend on its accumulated state.
   *
   * <p>The default implementation does nothing.
   */
  protected void finalizeModule() {}

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ")";
  }
}

// End Module.java
