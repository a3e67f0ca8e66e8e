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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Parses the text of a symbol written by the engine. */
public class SymbolParser {
  private final String s;
  private int i;

  private SymbolParser(String s) {
    this.s = s;
  }

  /** Parses a symbol; throws {@link SolveException} if it is malformed. */
  public static Symbol parse(String s) {
    final SymbolParser parser = new SymbolParser(s);
    final Symbol symbol = parser.symbol();
    parser.skipSpace();
    if (parser.i < s.length()) {
      throw parser.error("unexpected '" + s.charAt(parser.i) + "'");
    }
    return symbol;
  }

  private Symbol symbol() {
    skipSpace();
    if (i >= s.length()) {
      throw error("unexpected end");
    }
    final char c = s.charAt(i);
    if (c == '"') {
      return Symbol.string(string());
    }
    if (s.startsWith("#inf", i)) {
      i += 4;
      return Symbol.infimum();
    }
    if (s.startsWith("#sup", i)) {
      i += 4;
      return Symbol.supremum();
    }
    if (c == '(') {
      return Symbol.function("", arguments(), false);
    }
    if (c == '-') {
      ++i;
      if (i < s.length() && Character.isDigit(s.charAt(i))) {
        return Symbol.number(-number());
      }
      return function(true);
    }
    if (Character.isDigit(c)) {
      return Symbol.number(number());
    }
    return function(false);
  }

  private Symbol function(boolean negative) {
    final int start = i;
    while (i < s.length() && s.charAt(i) == '_') {
      ++i;
    }
    if (i >= s.length() || !Character.isLowerCase(s.charAt(i))) {
      throw error("expected identifier");
    }
    while (i < s.length()
        && (Character.isLetterOrDigit(s.charAt(i))
            || s.charAt(i) == '_'
            || s.charAt(i) == '\'')) {
      ++i;
    }
    final String name = s.substring(start, i);
    if (i < s.length() && s.charAt(i) == '(') {
      return Symbol.function(name, arguments(), negative);
    }
    return Symbol.function(name, ImmutableList.of(), negative);
  }

  /** Parses "(a, b, c)", allowing a trailing comma. */
  private List<Symbol> arguments() {
    ++i; // skip '('
    final ImmutableList.Builder<Symbol> b = ImmutableList.builder();
    skipSpace();
    if (i < s.length() && s.charAt(i) == ')') {
      ++i;
      return b.build();
    }
    for (;;) {
      b.add(symbol());
      skipSpace();
      if (i >= s.length()) {
        throw error("unclosed '('");
      }
      final char c = s.charAt(i++);
      if (c == ')') {
        return b.build();
      }
      if (c != ',') {
        throw error("expected ',' or ')'");
      }
      skipSpace();
      if (i < s.length() && s.charAt(i) == ')') {
        ++i;
        return b.build();
      }
    }
  }

  private int number() {
    final int start = i;
    while (i < s.length() && Character.isDigit(s.charAt(i))) {
      ++i;
    }
    return Integer.parseInt(s.substring(start, i));
  }

  private String string() {
    ++i; // skip opening quote
    final StringBuilder b = new StringBuilder();
    while (i < s.length()) {
      final char c = s.charAt(i++);
      if (c == '"') {
        return b.toString();
      }
      if (c == '\\' && i < s.length()) {
        final char d = s.charAt(i++);
        b.append(d == 'n' ? '\n' : d);
      } else {
        b.append(c);
      }
    }
    throw error("unclosed string");
  }

  private void skipSpace() {
    while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
      ++i;
    }
  }

  private SolveException error(String reason) {
    return new SolveException(
        String.format(
            "Cannot parse symbol '%s' at position %d: %s", s, i, reason));
  }
}

// End SymbolParser.java
