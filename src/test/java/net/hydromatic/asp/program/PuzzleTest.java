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

import static net.hydromatic.asp.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Schema;
import net.hydromatic.asp.program.Puzzle.CountBound;
import net.hydromatic.asp.solve.FakeEngine;
import net.hydromatic.asp.solve.Model;
import net.hydromatic.asp.solve.Solve;
import org.junit.jupiter.api.Test;

/** Tests {@link Puzzle} and {@link Module}. */
public class PuzzleTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneOffset.UTC);

  private final Ast.Variable r = ast.var("R");
  private final Ast.Variable c = ast.var("C");

  private static Puzzle puzzle(String name) {
    final Puzzle puzzle = new Puzzle(name);
    puzzle.program().setClock(CLOCK);
    return puzzle;
  }

  /** Module that defines a grid of cells in its own namespace. */
  static class GridModule extends Module {
    int schemaCount;
    int finalizeCount;

    final Supplier<Schema> cell =
        memoize(() -> {
          ++schemaCount;
          return defineSchema("cell", "r", "c");
        });

    GridModule(Puzzle puzzle) {
      super(puzzle, "Grid");
    }

    @Override
    protected void finalizeModule() {
      ++finalizeCount;
      comment("finalized");
    }
  }

  /** Module whose schemas have no namespace. */
  static class MainModule extends Module {
    final Supplier<Schema> shaded =
        memoize(() -> defineSchema("shaded", "r", "c"));

    MainModule(Puzzle puzzle) {
      super(puzzle, "Main", true);
    }
  }

  /** Module that does nothing. */
  static class EmptyModule extends Module {
    EmptyModule(Puzzle puzzle, String name) {
      super(puzzle, name);
    }
  }

  @Test
  void testModules() {
    final Puzzle puzzle = puzzle("Test Puzzle");
    final GridModule grid = new GridModule(puzzle);
    final MainModule main = new MainModule(puzzle);
    assertThat(grid.name, is("grid"));
    assertThat(grid.namespace, is("grid"));
    assertThat(main.namespace, is(""));
    assertThat(grid, hasToString("GridModule(grid)"));
    assertThat(puzzle.modules(), contains(grid, main));
    assertThat(puzzle.module("main"), sameInstance(main));
    assertThat(grid.puzzle(), sameInstance(puzzle));

    final Schema cell = grid.cell.get();
    assertThat(grid.cell.get(), sameInstance(cell));
    assertThat(grid.schemaCount, is(1));
    assertThat(cell, hasToString("grid_cell/2"));

    grid.addFact(cell.of(1, 2));
    main.addRule(cell.of(r, c), main.shaded.get().of(r, c));
    assertThat(puzzle.state(), is(Puzzle.State.ACCUMULATING));

    final String expected =
        "% Test Puzzle\n"
            + "% Generated by asp on 2025-01-02 03:04:05\n"
            + "\n"
            + "% ===== Grid =====\n"
            + "grid_cell(1, 2).\n"
            + "% finalized\n"
            + "\n"
            + "% ===== Main =====\n"
            + "shaded(R, C) :- grid_cell(R, C).\n"
            + "\n"
            + "#show.\n"
            + "#show grid_cell/2.\n"
            + "#show shaded/2.\n";
    assertThat(puzzle.render(), is(expected));
    assertThat(puzzle.state(), is(Puzzle.State.RENDERED));

    // Rendering again does not finalize again
    assertThat(puzzle.render(), is(expected));
    assertThat(grid.finalizeCount, is(1));
  }

  @Test
  void testModuleErrors() {
    final Puzzle puzzle = puzzle("Errors");
    new GridModule(puzzle);
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> new GridModule(puzzle));
    assertThat(
        e.getMessage(), is("Module with name 'grid' is already registered"));

    final IllegalArgumentException e2 =
        assertThrows(
            IllegalArgumentException.class,
            () -> new EmptyModule(puzzle, "2d"));
    assertThat(
        e2.getMessage(),
        is("Bad name 2d; must be alphanumeric and start with a letter"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EmptyModule(puzzle, "my grid"));
    assertThrows(
        IllegalArgumentException.class, () -> new EmptyModule(puzzle, ""));

    final IllegalArgumentException e3 =
        assertThrows(
            IllegalArgumentException.class, () -> puzzle.module("nope"));
    assertThat(e3.getMessage(), is("No module named 'nope' is registered"));

    puzzle.finalizeModules();
    assertThrows(
        IllegalStateException.class, () -> new EmptyModule(puzzle, "late"));
    assertThat(puzzle.modules(), hasSize(1));
  }

  @Test
  void testCountConstraint() {
    final Puzzle puzzle = puzzle("Count");
    final Schema row = puzzle.program().defineSchema("row", "r");
    final Schema cell = puzzle.program().defineSchema("cell", "r", "c");
    puzzle.countConstraint(
        c,
        ImmutableList.of(cell.of(r, c)),
        null,
        ImmutableList.of(row.of(r)),
        ImmutableMap.of(CountBound.EXACTLY, 1));
    final List<Statement> statements = puzzle.program().segment().statements();
    assertThat(statements, hasSize(1));
    assertThat(
        statements.get(0),
        hasToString("N = 1 :- row(R), N = #count{C : cell(R, C)}."));
  }

  @Test
  void testCountConstraintVariable() {
    final Puzzle puzzle = puzzle("Count");
    final EmptyModule module = new EmptyModule(puzzle, "counts");
    final Schema cell = Schema.define("cell", "r", "c");
    final Ast.Variable n = ast.var("N");
    final Ast.SymbolicConstant size = puzzle.registerConstant("size", 9);

    // "N" and "R" are used, so the count is bound to "C"
    module.countConstraint(
        n,
        ImmutableList.of(cell.of(r, n)),
        null,
        ImmutableList.of(),
        ImmutableMap.of(CountBound.AT_LEAST, 1, CountBound.LESS_THAN, size));
    assertThat(
        module.segment().statements(),
        contains(
            hasToString("C >= 1 :- C = #count{N : cell(R, N)}."),
            hasToString("C < size :- C = #count{N : cell(R, N)}.")));

    // An explicit variable
    module.countConstraint(
        n,
        ImmutableList.of(cell.of(r, n)),
        ast.var("Total"),
        ImmutableList.of(),
        ImmutableMap.of(CountBound.NOT_EQUAL, 0));
    assertThat(
        module.segment().statements().get(2),
        hasToString("Total != 0 :- Total = #count{N : cell(R, N)}."));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                puzzle.countConstraint(
                    n,
                    ImmutableList.of(cell.of(r, n)),
                    null,
                    ImmutableList.of(),
                    ImmutableMap.of()));
    assertThat(e.getMessage(), is("Must provide at least one bound"));
  }

  @Test
  void testSolve() {
    final Puzzle puzzle = puzzle("Solve");
    final GridModule grid = new GridModule(puzzle);
    final FakeEngine engine = FakeEngine.of("grid_cell(1,2)");
    puzzle.program().setEngine(engine);
    grid.addFact(grid.cell.get().of(1, 2));
    try (Solve solve = puzzle.solve()) {
      assertThat(puzzle.state(), is(Puzzle.State.SOLVED));
      final List<Model> models = solve.toList();
      assertThat(models, hasSize(1));
      assertThat(models.get(0).get(grid.cell.get()), hasSize(1));
      assertThat(models.get(0).contains(grid.cell.get().of(1, 2)), is(true));
    }
    assertThat(grid.finalizeCount, is(1));
    assertThat(puzzle.program().header(), is("Solve"));
    assertThat(engine.source, is(puzzle.render()));
  }
}

// End PuzzleTest.java
