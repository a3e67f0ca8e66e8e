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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.asp.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Collector;
import net.hydromatic.asp.ast.Op;
import net.hydromatic.asp.ast.Term;
import net.hydromatic.asp.solve.Solve;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates the {@link Module}s that together build a program.
 *
 * <p>Each module writes to its own segment. Before the program is rendered
 * or solved for the first time, each module's {@link Module#finalizeModule()}
 * is called, in registration order, so that it can add statements that
 * depend on state accumulated while the puzzle was being built.
 */
public class Puzzle {
  private static final Logger LOGGER = LoggerFactory.getLogger(Puzzle.class);

  public final String name;
  private final AspProgram program = new AspProgram();
  private final Map<String, Module> modules = new LinkedHashMap<>();
  private State state = State.ACCUMULATING;

  public Puzzle(String name) {
    this.name = requireNonNull(name);
  }

  public Puzzle() {
    this("Puzzle");
  }

  /** Returns the underlying program. */
  public AspProgram program() {
    return program;
  }

  public State state() {
    return state;
  }

  /** Returns the registered modules, in registration order. */
  public Collection<Module> modules() {
    return ImmutableList.copyOf(modules.values());
  }

  /** Returns the module with a given name; throws if there is none. */
  public Module module(String name) {
    final Module module = modules.get(name);
    checkArgument(module != null, "No module named '%s' is registered", name);
    return module;
  }

  /** Called by the {@link Module} constructor. */
  void register(Module module) {
    checkState(
        state == State.ACCUMULATING,
        "Cannot register module '%s' in state %s",
        module.name,
        state);
    checkArgument(
        !modules.containsKey(module.name),
        "Module with name '%s' is already registered",
        module.name);
    modules.put(module.name, module);
    program.addSegment(module.name);
  }

  /** Returns the segment with a given name, creating it if necessary. */
  public Segment segment(String name) {
    return program.segment(name);
  }

  // statements, added to the program's default segment

  public Puzzle addFact(Ast.Predicate... predicates) {
    program.addFact(predicates);
    return this;
  }

  public Puzzle addRule(List<? extends Term> conditions, Term consequent) {
    program.addRule(conditions, consequent);
    return this;
  }

  public Puzzle addRule(Term condition, Term consequent) {
    program.addRule(condition, consequent);
    return this;
  }

  public Puzzle addConstraint(Term... conditions) {
    program.addConstraint(conditions);
    return this;
  }

  public Puzzle comment(String text) {
    program.comment(text);
    return this;
  }

  public Puzzle blankLine() {
    program.blankLine();
    return this;
  }

  public Puzzle section(String title) {
    program.section(title);
    return this;
  }

  public Ast.SymbolicConstant registerConstant(String name, int value) {
    return program.registerConstant(name, value);
  }

  public Ast.SymbolicConstant registerConstant(String name, String value) {
    return program.registerConstant(name, value);
  }

  /**
   * Constrains the number of distinct {@code countOver} terms that satisfy
   * {@code conditions}. For example,
   *
   * <blockquote><pre>
   * puzzle.countConstraint(ast.var("C"), List.of(cell.of(R, ast.var("C"))),
   *     null, List.of(row.of(R)), Map.of(CountBound.EXACTLY, 1));
   * </pre></blockquote>
   *
   * <p>adds "N = 1 :- row(R), N = #count{C : cell(R, C)}.".
   *
   * @param countOver Variable or predicate to count
   * @param conditions Conditions of the count
   * @param countVariable Variable to bind the count to, or null to create
   *     one whose name does not clash
   * @param when Additional conditions of the rule
   * @param bounds Bounds on the count; values are ints or numeric terms
   */
  public void countConstraint(
      Term countOver,
      List<? extends Term> conditions,
      Ast.@Nullable Variable countVariable,
      List<? extends Term> when,
      Map<CountBound, ?> bounds) {
    countConstraint(
        program.segment(), countOver, conditions, countVariable, when, bounds);
  }

  void countConstraint(
      Segment segment,
      Term countOver,
      List<? extends Term> conditions,
      Ast.@Nullable Variable countVariable,
      List<? extends Term> when,
      Map<CountBound, ?> bounds) {
    checkArgument(!bounds.isEmpty(), "Must provide at least one bound");
    final Ast.Variable variable;
    if (countVariable != null) {
      variable = countVariable;
    } else {
      final Collector collector = new Collector().collect(countOver);
      conditions.forEach(collector::collect);
      when.forEach(collector::collect);
      final Set<String> used = collector.variables();
      variable = ast.uniqueVar(used, "N", "C", "Count");
    }
    final Ast.Comparison count =
        ast.count()
            .add(ImmutableList.of(countOver), conditions)
            .assignTo(variable);
    final List<Term> body =
        ImmutableList.<Term>builder().addAll(when).add(count).build();
    bounds.forEach((bound, value) ->
        segment.addRule(body, ast.compare(variable, bound.op, value)));
  }

  // rendering and solving

  /**
   * Calls {@link Module#finalizeModule()} on each module, if this has not
   * already been done.
   */
  public void finalizeModules() {
    if (state != State.ACCUMULATING) {
      return;
    }
    state = State.FINALIZING;
    for (Module module : modules.values()) {
      LOGGER.debug("Finalizing module {}", module.name);
      module.finalizeModule();
    }
    state = State.RENDERED;
  }

  /** Finalizes the modules and renders the program. */
  public String render() {
    finalizeModules();
    program.setHeader(name);
    return program.render();
  }

  /** Finalizes the modules and starts solving the program. */
  public Solve solve() {
    finalizeModules();
    program.setHeader(name);
    final Solve solve = program.solve();
    state = State.SOLVED;
    return solve;
  }

  /** Lifecycle of a puzzle. */
  public enum State {
    /** Modules are being registered and are adding statements. */
    ACCUMULATING,
    /** Modules are adding their final statements. */
    FINALIZING,
    /** Modules have been finalized; the program can be rendered. */
    RENDERED,
    /** The program has been submitted to the engine. */
    SOLVED
  }

  /**
   * Kind of bound in {@link #countConstraint}; each kind corresponds to a
   * comparison operator.
   */
  public enum CountBound {
    EXACTLY(Op.EQ),
    NOT_EQUAL(Op.NE),
    AT_LEAST(Op.GE),
    AT_MOST(Op.LE),
    GREATER_THAN(Op.GT),
    LESS_THAN(Op.LT);

    public final Op op;

    CountBound(Op op) {
      this.op = op;
    }
  }
}

// End Puzzle.java
