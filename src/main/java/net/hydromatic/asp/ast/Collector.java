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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Visitor that gathers the variables, symbolic constants and predicate
 * schemas referenced by a term.
 *
 * <p>Schemas are compared by identity, so two distinct schemas with the same
 * name are both collected.
 */
public class Collector extends Visitor {
  final Set<String> variables = new LinkedHashSet<>();
  final Set<String> symbolicConstants = new LinkedHashSet<>();
  final Set<Schema> schemas = new LinkedHashSet<>();

  /** Visits a term, and returns this collector. */
  public Collector collect(Term term) {
    term.accept(this);
    return this;
  }

  public Set<String> variables() {
    return variables;
  }

  public Set<String> symbolicConstants() {
    return symbolicConstants;
  }

  public Set<Schema> schemas() {
    return schemas;
  }

  @Override
  protected void visit(Ast.Variable variable) {
    variables.add(variable.name);
  }

  @Override
  protected void visit(Ast.SymbolicConstant symbolicConstant) {
    symbolicConstants.add(symbolicConstant.name);
  }

  @Override
  protected void visit(Ast.Predicate predicate) {
    schemas.add(predicate.schema);
    super.visit(predicate);
  }
}

// End Collector.java
