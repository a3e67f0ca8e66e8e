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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Term;

/**
 * Named, ordered list of statements within a program.
 *
 * <p>Segments let the parts of a program be built in any order but rendered
 * in a fixed order, each under its own banner.
 */
public class Segment {
  public final String name;
  private final List<Statement> statements = new ArrayList<>();

  Segment(String name) {
    this.name = requireNonNull(name);
  }

  /** Returns the statements added so far. */
  public List<Statement> statements() {
    return ImmutableList.copyOf(statements);
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  /** Adds a statement. */
  public Segment add(Statement statement) {
    statements.add(requireNonNull(statement));
    return this;
  }

  /** Adds one fact per predicate. */
  public Segment addFact(Ast.Predicate... predicates) {
    for (Ast.Predicate predicate : predicates) {
      add(Statement.Rule.fact(predicate));
    }
    return this;
  }

  /**
   * Adds a rule that derives {@code consequent} whenever all
   * {@code conditions} hold.
   */
  public Segment addRule(List<? extends Term> conditions, Term consequent) {
    return add(new Statement.Rule(requireNonNull(consequent), conditions));
  }

  /** Adds a rule with a single condition. */
  public Segment addRule(Term condition, Term consequent) {
    return addRule(ImmutableList.of(condition), consequent);
  }

  /** Adds a constraint that forbids a combination of conditions. */
  public Segment addConstraint(Term... conditions) {
    return add(Statement.Rule.constraint(Arrays.asList(conditions)));
  }

  public Segment comment(String text) {
    return add(new Statement.Comment(text));
  }

  public Segment blankLine() {
    return add(Statement.BlankLine.INSTANCE);
  }

  /** Adds a blank line followed by a comment. */
  public Segment section(String title) {
    return blankLine().comment(title);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Segment.java
