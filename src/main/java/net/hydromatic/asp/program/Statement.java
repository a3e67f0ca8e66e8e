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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.asp.ast.Collector;
import net.hydromatic.asp.ast.Schema;
import net.hydromatic.asp.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Element of a program: a rule, a comment or a blank line. */
public abstract class Statement {
  /** Renders this statement as one or more lines of program text. */
  public abstract String render();

  /** Returns the schemas of predicates referenced by this statement. */
  public Set<Schema> collectPredicates() {
    return ImmutableSet.of();
  }

  /** Returns the names of symbolic constants referenced by this statement. */
  public Set<String> collectSymbolicConstants() {
    return ImmutableSet.of();
  }

  @Override
  public String toString() {
    return render();
  }

  /**
   * Rule; a fact ("h."), a normal rule ("h :- b1, b2.") or a constraint
   * (":- b1, b2.").
   *
   * <p>The head, if present, must be legal in a head; each body literal must
   * be legal in a body.
   */
  public static class Rule extends Statement {
    public final @Nullable Term head;
    public final ImmutableList<Term> body;

    public Rule(@Nullable Term head, List<? extends Term> body) {
      this.head = head;
      this.body = ImmutableList.copyOf(body);
      checkArgument(
          head != null || !body.isEmpty(),
          "Rule must have a head or a body");
      if (head != null) {
        head.validateInContext(true);
      }
      for (Term term : this.body) {
        term.validateInContext(false);
      }
    }

    /** Creates a fact. */
    public static Rule fact(Term head) {
      return new Rule(requireNonNull(head), ImmutableList.of());
    }

    /** Creates a constraint. */
    public static Rule constraint(List<? extends Term> body) {
      return new Rule(null, body);
    }

    public boolean isFact() {
      return body.isEmpty();
    }

    public boolean isConstraint() {
      return head == null;
    }

    private Collector collect() {
      final Collector collector = new Collector();
      if (head != null) {
        collector.collect(head);
      }
      body.forEach(collector::collect);
      return collector;
    }

    @Override
    public Set<Schema> collectPredicates() {
      return collect().schemas();
    }

    @Override
    public Set<String> collectSymbolicConstants() {
      return collect().symbolicConstants();
    }

    @Override
    public String render() {
      final StringBuilder b = new StringBuilder();
      if (head != null) {
        b.append(head.render());
      }
      if (!body.isEmpty()) {
        b.append(head != null ? " :- " : ":- ");
        for (int i = 0; i < body.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          b.append(body.get(i).render());
        }
      }
      return b.append('.').toString();
    }
  }

  /**
   * Comment. A one-line comment renders as "% text"; a comment that contains
   * line breaks renders as a block, "%* text *%".
   */
  public static class Comment extends Statement {
    public final String text;

    public Comment(String text) {
      this.text = requireNonNull(text);
    }

    @Override
    public String render() {
      if (text.indexOf('\n') >= 0) {
        return "%*\n" + text + "\n*%";
      }
      return "% " + text;
    }
  }

  /** Blank line. */
  public static class BlankLine extends Statement {
    public static final BlankLine INSTANCE = new BlankLine();

    private BlankLine() {}

    @Override
    public String render() {
      return "";
    }
  }
}

// End Statement.java
