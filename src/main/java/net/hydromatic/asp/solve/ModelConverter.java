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

import static net.hydromatic.asp.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Schema;

/**
 * Converts the symbols of a model back into predicates, using the schemas of
 * the program that was solved.
 */
public class ModelConverter {
  private final ImmutableMap<String, Schema> schemas;

  /**
   * Creates a converter. If two schemas have the same rendered name, the
   * first is used.
   */
  public ModelConverter(Collection<Schema> schemas) {
    final Map<String, Schema> map = new LinkedHashMap<>();
    for (Schema schema : schemas) {
      map.putIfAbsent(schema.qualifiedName(), schema);
    }
    this.schemas = ImmutableMap.copyOf(map);
  }

  /** Converts the symbols of a model. */
  public Model convert(int number, List<Symbol> symbols) {
    final Map<String, List<Ast.Predicate>> atoms = new LinkedHashMap<>();
    final Map<String, List<Ast.Predicate>> negated = new LinkedHashMap<>();
    for (Symbol symbol : symbols) {
      final Ast.Predicate predicate = toPredicate(symbol);
      (symbol.negative ? negated : atoms)
          .computeIfAbsent(predicate.name(), k -> new ArrayList<>())
          .add(predicate);
    }
    return new Model(number, freeze(atoms), freeze(negated));
  }

  private static ImmutableMap<String, ImmutableList<Ast.Predicate>> freeze(
      Map<String, List<Ast.Predicate>> map) {
    final ImmutableMap.Builder<String, ImmutableList<Ast.Predicate>> b =
        ImmutableMap.builder();
    map.forEach((k, v) -> b.put(k, ImmutableList.copyOf(v)));
    return b.build();
  }

  /**
   * Converts a function symbol to a predicate. If the symbol is classically
   * negated, returns the predicate without the negation.
   */
  public Ast.Predicate toPredicate(Symbol symbol) {
    if (symbol.kind != Symbol.Kind.FUNCTION || symbol.isTuple()) {
      throw new SolveException("Not a predicate: " + symbol);
    }
    final Schema schema = schemas.get(symbol.name);
    if (schema == null) {
      throw new SolveException("Unknown predicate type: " + symbol.name);
    }
    if (symbol.arguments.size() != schema.arity()) {
      throw new SolveException(
          String.format(
              "Arity mismatch for predicate %s: got %d arguments, expected %d",
              symbol.name,
              symbol.arguments.size(),
              schema.arity()));
    }
    final Object[] arguments = new Object[symbol.arguments.size()];
    for (int i = 0; i < arguments.length; i++) {
      arguments[i] = toArgument(symbol, i);
    }
    return schema.of(arguments);
  }

  private Object toArgument(Symbol symbol, int i) {
    final Symbol arg = symbol.arguments.get(i);
    switch (arg.kind) {
      case NUMBER:
        return ast.intLiteral(arg.number);
      case STRING:
        return ast.stringLiteral(arg.name);
      case FUNCTION:
        if (!arg.isTuple() && !arg.negative) {
          if (arg.arguments.isEmpty() && !schemas.containsKey(arg.name)) {
            // A bare name such as "red" in "color(red)"
            return ast.symbolic(arg.name);
          }
          return toPredicate(arg);
        }
        // fall through
      default:
        throw new SolveException(
            String.format(
                "Unsupported symbol in argument %d of %s: %s",
                i,
                symbol.name,
                arg));
    }
  }
}

// End ModelConverter.java
