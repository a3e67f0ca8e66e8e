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

import java.util.List;

/** Context for writing a term out as ASP source text. */
public class AspWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AspWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a term in a given context. */
  public AspWriter append(Term term, int left, int right) {
    return term.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public AspWriter infix(int left, Term a0, Op op, Term a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AspWriter prefix(int left, Op op, Term a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /**
   * Appends a list of terms separated by a string, each written in context
   * {@code (left, right)}.
   */
  public AspWriter list(
      List<? extends Term> terms, String separator, int left, int right) {
    for (int i = 0; i < terms.size(); i++) {
      if (i > 0) {
        append(separator);
      }
      terms.get(i).unparse(this, left, right);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AspWriter.java
