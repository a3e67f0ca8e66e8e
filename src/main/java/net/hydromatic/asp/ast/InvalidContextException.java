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

import net.hydromatic.asp.util.AspException;

/**
 * A term was used where it is not allowed; for example, a choice in a rule
 * body, or a bare variable as a literal.
 */
public class InvalidContextException extends RuntimeException
    implements AspException {
  private final Term term;
  private final boolean inHead;

  public InvalidContextException(String message, Term term, boolean inHead) {
    super(message);
    this.term = requireNonNull(term);
    this.inHead = inHead;
  }

  /** Returns the term that was misplaced. */
  public Term term() {
    return term;
  }

  /** Returns whether the term was being placed in a rule head. */
  public boolean inHead() {
    return inHead;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End InvalidContextException.java
