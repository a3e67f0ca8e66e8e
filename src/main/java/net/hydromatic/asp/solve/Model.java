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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Schema;

/**
 * Solution of a program: the shown atoms, grouped by rendered predicate
 * name.
 *
 * <p>Classically negated atoms, such as "-p(1)", are held separately.
 */
public class Model {
  /** Ordinal of this model within its solve, starting at 1. */
  public final int number;
  private final ImmutableMap<String, ImmutableList<Ast.Predicate>> atoms;
  private final ImmutableMap<String, ImmutableList<Ast.Predicate>> negated;

  Model(
      int number,
      ImmutableMap<String, ImmutableList<Ast.Predicate>> atoms,
      ImmutableMap<String, ImmutableList<Ast.Predicate>> negated) {
    this.number = number;
    this.atoms = atoms;
    this.negated = negated;
  }

  /** Returns the names of predicates that have at least one atom. */
  public Set<String> names() {
    return atoms.keySet();
  }

  /** Returns all atoms, by predicate name. */
  public ImmutableMap<String, ImmutableList<Ast.Predicate>> atoms() {
    return atoms;
  }

  /** Returns the atoms of a predicate; empty if there are none. */
  public List<Ast.Predicate> get(String name) {
    final ImmutableList<Ast.Predicate> list = atoms.get(name);
    return list == null ? ImmutableList.of() : list;
  }

  /** Returns the atoms of a schema; empty if there are none. */
  public List<Ast.Predicate> get(Schema schema) {
    return get(schema.qualifiedName());
  }

  /**
   * Returns the classically negated atoms of a predicate (without their
   * negation); empty if there are none.
   */
  public List<Ast.Predicate> getNegated(String name) {
    final ImmutableList<Ast.Predicate> list = negated.get(name);
    return list == null ? ImmutableList.of() : list;
  }

  /** Returns whether the model contains an atom. */
  public boolean contains(Ast.Predicate predicate) {
    return get(predicate.name()).contains(predicate);
  }

  /** Returns the number of atoms, including negated atoms. */
  public int size() {
    int n = 0;
    for (List<Ast.Predicate> list : atoms.values()) {
      n += list.size();
    }
    for (List<Ast.Predicate> list : negated.values()) {
      n += list.size();
    }
    return n;
  }

  @Override
  public String toString() {
    final List<String> list = new ArrayList<>();
    atoms.values().forEach(ps -> ps.forEach(p -> list.add(p.toString())));
    negated.values().forEach(ps -> ps.forEach(p -> list.add("-" + p)));
    return String.join(" ", list);
  }
}

// End Model.java
