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

/**
 * Visits syntax trees.
 *
 * <p>Each method visits the children of a node. Override to intercept a
 * particular kind of node.
 */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends Term> void accept(E e) {
    e.accept(this);
  }

  // values

  protected void visit(Ast.Variable variable) {}

  protected void visit(Ast.Constant constant) {}

  protected void visit(Ast.StringConstant stringConstant) {}

  protected void visit(Ast.SymbolicConstant symbolicConstant) {}

  // expressions

  protected void visit(Ast.Expression expression) {
    if (expression.a0 != null) {
      expression.a0.accept(this);
    }
    expression.a1.accept(this);
  }

  protected void visit(Ast.Comparison comparison) {
    comparison.a0.accept(this);
    comparison.a1.accept(this);
  }

  // pools

  protected void visit(Ast.RangePool rangePool) {
    rangePool.start.accept(this);
    rangePool.end.accept(this);
  }

  protected void visit(Ast.ExplicitPool explicitPool) {
    explicitPool.elements.forEach(this::accept);
  }

  // literals

  protected void visit(Ast.Predicate predicate) {
    predicate.arguments.forEach(this::accept);
  }

  protected void visit(Ast.ClassicalNegation classicalNegation) {
    classicalNegation.predicate.accept(this);
  }

  protected void visit(Ast.DefaultNegation defaultNegation) {
    defaultNegation.term.accept(this);
  }

  protected void visit(Ast.ConditionalLiteral conditionalLiteral) {
    conditionalLiteral.head.accept(this);
    conditionalLiteral.conditions.forEach(this::accept);
  }

  // aggregates

  protected void visit(Ast.Aggregate aggregate) {
    aggregate.clauses.forEach(clause -> clause.accept(this));
  }

  protected void visit(Ast.Choice choice) {
    choice.clauses.forEach(clause -> clause.accept(this));
    if (choice.min != null) {
      choice.min.accept(this);
    }
    if (choice.max != null) {
      choice.max.accept(this);
    }
  }
}

// End Visitor.java
