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

import static java.util.Objects.requireNonNull;

import java.util.Set;

/**
 * Node of an ASP syntax tree.
 *
 * <p>Terms are immutable, and may be shared between programs and between
 * parent terms. Each term knows its own operator, and so can decide for
 * itself whether it needs parentheses in the context where it is written.
 */
public abstract class Term {
  public final Op op;

  protected Term(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this term into ASP source text.
   *
   * <p>Marked final because you should override {@link #unparse}, not
   * toString.
   */
  @Override
  public final String toString() {
    return render();
  }

  /** Converts this term into ASP source text, as a top-level term. */
  public final String render() {
    return unparse(new AspWriter(), 0, 0).toString();
  }

  /**
   * Writes this term, adding parentheses if the context {@code (left, right)}
   * binds more tightly than this term's operator.
   */
  protected abstract AspWriter unparse(AspWriter w, int left, int right);

  /**
   * Returns whether this term contains no variables, including the anonymous
   * variable and variables local to an aggregate or choice.
   */
  public boolean isGrounded() {
    final Collector collector = new Collector();
    accept(collector);
    return collector.variables.isEmpty();
  }

  /**
   * Checks that this term may be used as a whole literal in the head (if
   * {@code inHead}) or in the body of a rule.
   *
   * @throws InvalidContextException if it may not
   */
  public abstract void validateInContext(boolean inHead);

  /** Returns the schemas of all predicates that occur in this term. */
  public Set<Schema> collectPredicates() {
    final Collector collector = new Collector();
    accept(collector);
    return collector.schemas;
  }

  /** Returns the names of all symbolic constants that occur in this term. */
  public Set<String> collectSymbolicConstants() {
    final Collector collector = new Collector();
    accept(collector);
    return collector.symbolicConstants;
  }

  /** Returns the names of all variables that occur in this term. */
  public Set<String> collectVariables() {
    final Collector collector = new Collector();
    accept(collector);
    return collector.variables;
  }

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this term.
   */
  public abstract void accept(Visitor visitor);

  /** Throws if this term is not allowed in the given context. */
  protected final void invalidIn(boolean inHead, String reason) {
    throw new InvalidContextException(
        String.format(
            "%s '%s' cannot be used in a rule %s: %s",
            getClass().getSimpleName(),
            render(),
            inHead ? "head" : "body",
            reason),
        this,
        inHead);
  }
}

// End Term.java
