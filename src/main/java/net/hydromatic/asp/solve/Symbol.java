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
package net.hydromatic.asp.solve;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Ground term in a solution, as written by the engine; for example
 * {@code 3}, {@code "abc"}, {@code p(1, q(2))}, {@code -p(1)} or
 * {@code (1, 2)}.
 *
 * <p>A tuple is a function whose name is empty.
 */
public class Symbol {
  public final Kind kind;
  public final int number;
  /** Name of a function, or value of a string; otherwise empty. */
  public final String name;
  public final ImmutableList<Symbol> arguments;
  /** Whether a function is classically negated. */
  public final boolean negative;

  private Symbol(
      Kind kind,
      int number,
      String name,
      List<Symbol> arguments,
      boolean negative) {
    this.kind = requireNonNull(kind);
    this.number = number;
    this.name = requireNonNull(name);
    this.arguments = ImmutableList.copyOf(arguments);
    this.negative = negative;
  }

  public static Symbol number(int n) {
    return new Symbol(Kind.NUMBER, n, "", ImmutableList.of(), false);
  }

  public static Symbol string(String s) {
    return new Symbol(Kind.STRING, 0, s, ImmutableList.of(), false);
  }

  public static Symbol function(
      String name, List<Symbol> arguments, boolean negative) {
    return new Symbol(Kind.FUNCTION, 0, name, arguments, negative);
  }

  public static Symbol infimum() {
    return new Symbol(Kind.INFIMUM, 0, "", ImmutableList.of(), false);
  }

  public static Symbol supremum() {
    return new Symbol(Kind.SUPREMUM, 0, "", ImmutableList.of(), false);
  }

  /** Returns whether this is a tuple, a function with no name. */
  public boolean isTuple() {
    return kind == Kind.FUNCTION && name.isEmpty();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, number, name, arguments, negative);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
            && kind == ((Symbol) o).kind
            && number == ((Symbol) o).number
            && name.equals(((Symbol) o).name)
            && arguments.equals(((Symbol) o).arguments)
            && negative == ((Symbol) o).negative;
  }

  @Override
  public String toString() {
    switch (kind) {
      case NUMBER:
        return Integer.toString(number);
      case STRING:
        return '"'
            + name.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
            + '"';
      case INFIMUM:
        return "#inf";
      case SUPREMUM:
        return "#sup";
      default:
        final StringBuilder b = new StringBuilder();
        if (negative) {
          b.append('-');
        }
        b.append(name);
        if (!arguments.isEmpty() || isTuple()) {
          b.append('(');
          for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
              b.append(',');
            }
            b.append(arguments.get(i));
          }
          if (isTuple() && arguments.size() == 1) {
            b.append(',');
          }
          b.append(')');
        }
        return b.toString();
    }
  }

  /** Kind of symbol. */
  public enum Kind {
    NUMBER,
    STRING,
    FUNCTION,
    INFIMUM,
    SUPREMUM
  }
}

// End Symbol.java
