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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Schema;
import org.junit.jupiter.api.Test;

/** Tests {@link Solver} and {@link Solve}, using a {@link FakeEngine}. */
public class SolverTest {
  private static final String SOURCE = "p(1).\np(2).\nq(X) :- p(X), X > 1.\n";

  private final Schema p = Schema.define("p", "x");
  private final Schema q = Schema.define("q", "x");
  private final List<Schema> schemas = ImmutableList.of(p, q);

  private static Solver solver(Engine engine) {
    return new Solver(engine, ImmutableMap.of());
  }

  @Test
  void testModels() {
    final FakeEngine engine =
        new FakeEngine(
            ImmutableList.of(
                ImmutableList.of("p(1)", "p(2)", "q(2)"),
                ImmutableList.of("p(1)", "q(1)")));
    try (Solve solve = solver(engine).solve(SOURCE, schemas)) {
      assertThat(solve.satisfiable(), nullValue());
      final List<Model> models = solve.toList();
      assertThat(models, hasSize(2));
      final Model model = models.get(0);
      assertThat(model.number, is(1));
      assertThat(model.names(), contains("p", "q"));
      assertThat(model.get("p"), contains(p.of(1), p.of(2)));
      assertThat(model.get(q), contains(q.of(2)));
      assertThat(model.get("r"), empty());
      assertThat(model.contains(q.of(2)), is(true));
      assertThat(model.contains(q.of(1)), is(false));
      assertThat(model.size(), is(3));
      assertThat(model, hasToString("p(1) p(2) q(2)"));
      assertThat(models.get(1).number, is(2));

      assertThat(solve.satisfiable(), is(true));
      assertThat(solve.exhausted(), is(true));
      assertThat(solve.modelCount(), is(2));
      final Statistics statistics = solve.statistics();
      assertThat(statistics, notNullValue());
      assertThat(statistics.count("Models", "Number"), is(2L));
    }
    assertThat(engine.source, is(SOURCE));
    assertThat(engine.closed, is(true));
  }

  @Test
  void testUnsatisfiable() {
    final FakeEngine engine = FakeEngine.unsatisfiable();
    final Solve solve = solver(engine).solve(SOURCE, schemas);
    assertThat(solve.toList(), empty());
    assertThat(solve.satisfiable(), is(false));
    assertThat(solve.exhausted(), is(true));
    assertThat(solve.modelCount(), is(0));
    assertThat(engine.closed, is(true));
  }

  @Test
  void testNotExhausted() {
    final FakeEngine engine = FakeEngine.of("p(1)").withMore();
    final Solve solve = solver(engine).solve(SOURCE, schemas);
    assertThat(solve.toList(), hasSize(1));
    assertThat(solve.satisfiable(), is(true));
    assertThat(solve.exhausted(), is(false));
  }

  @Test
  void testStopEarly() {
    final FakeEngine engine =
        new FakeEngine(
            ImmutableList.of(
                ImmutableList.of("p(1)"),
                ImmutableList.of("p(2)"),
                ImmutableList.of("p(3)")));
    try (Solve solve = solver(engine).solve(SOURCE, schemas)) {
      final Iterator<Model> iterator = solve.iterator();
      assertThat(iterator.next().get(p), contains(p.of(1)));
      assertThat(engine.closed, is(false));
    }
    assertThat(engine.closed, is(true));
    assertThat(engine.modelsRead, is(1));
  }

  @Test
  void testIterateOnce() {
    final Solve solve = solver(FakeEngine.of("p(1)")).solve(SOURCE, schemas);
    assertThat(solve.toList(), hasSize(1));
    assertThrows(IllegalStateException.class, solve::iterator);
  }

  @Test
  void testProps() {
    final FakeEngine engine = FakeEngine.of("p(1)");
    final Map<Prop, Object> props =
        ImmutableMap.of(Prop.MODELS, 3, Prop.TIMEOUT, 10);
    new Solver(engine, props).solve(SOURCE, schemas).toList();
    assertThat(engine.props, is(props));
  }

  @Test
  void testNestedPredicates() {
    final Schema cell = Schema.define("cell", "row", "col");
    final Schema color = Schema.define("color", "c");
    final Schema at = Schema.define("at", "what", "where");
    final Solve solve =
        solver(FakeEngine.of("at(color(red),cell(1,2))", "color(\"x y\")"))
            .solve(SOURCE, ImmutableList.of(cell, color, at));
    final Model model = solve.toList().get(0);
    assertThat(
        model.get(at),
        contains(at.of(color.of(ast.symbolic("red")), cell.of(1, 2))));
    assertThat(model.get(color), contains(color.of("x y")));
    assertThat(
        model.get(at).get(0), hasToString("at(color(red), cell(1, 2))"));
  }

  @Test
  void testNegatedAtoms() {
    final Solve solve =
        solver(FakeEngine.of("p(1)", "-p(2)")).solve(SOURCE, schemas);
    final Model model = solve.toList().get(0);
    assertThat(model.get(p), contains(p.of(1)));
    assertThat(model.getNegated("p"), contains(p.of(2)));
    assertThat(model.size(), is(2));
    assertThat(model, hasToString("p(1) -p(2)"));
  }

  @Test
  void testNamespacedPredicate() {
    final Schema gridCell = Schema.define("cell", "r").withNamespace("grid");
    final Model model =
        solver(FakeEngine.of("grid_cell(-3)"))
            .solve(SOURCE, ImmutableList.of(gridCell))
            .toList()
            .get(0);
    assertThat(model.get("grid_cell"), contains(gridCell.of(-3)));
  }

  @Test
  void testUnknownPredicate() {
    final FakeEngine engine = FakeEngine.of("r(1)");
    final SolveException e =
        assertThrows(
            SolveException.class,
            () -> solver(engine).solve(SOURCE, schemas).toList());
    assertThat(e.getMessage(), is("Unknown predicate type: r"));
    // the engine is stopped even though the caller did not close the solve
    assertThat(engine.closed, is(true));
  }

  @Test
  void testArityMismatch() {
    final FakeEngine engine =
        new FakeEngine(
            ImmutableList.of(
                ImmutableList.of("p(1)"), ImmutableList.of("p(1,2)")));
    final Solve solve = solver(engine).solve(SOURCE, schemas);
    final Iterator<Model> iterator = solve.iterator();
    assertThat(iterator.next().get(p), contains(p.of(1)));
    assertThat(engine.closed, is(false));
    final SolveException e =
        assertThrows(SolveException.class, iterator::next);
    assertThat(
        e.getMessage(),
        is("Arity mismatch for predicate p: got 2 arguments, expected 1"));
    assertThat(engine.closed, is(true));
  }

  @Test
  void testMessagesStopSolving() {
    final FakeEngine engine =
        FakeEngine.of("p(1)")
            .withDiagnostics(
                "<stdin>:3:15-16: info: atom does not occur in any rule head:\n"
                    + "  r(X)\n");
    final Solve solve = solver(engine).solve(SOURCE, schemas);
    final SolveException e = assertThrows(SolveException.class, solve::toList);
    assertThat(
        e.getMessage(),
        startsWith(
            "Grounding produced INFO level messages (stop threshold: INFO)."));
    assertThat(e.getMessage(), containsString("INFO: atom does not occur"));
    assertThat(e.getMessage(), containsString("   3 | q(X) :- p(X), X > 1."));
    assertThat(e.messages(), hasSize(1));
    assertThat(e.messages().get(0).text, containsString("r(X)"));
    assertThat(engine.closed, is(true));
  }

  @Test
  void testMessagesBelowThreshold() {
    final FakeEngine engine =
        FakeEngine.of("p(1)")
            .withDiagnostics(
                "<stdin>:3:15-16: info: atom does not occur in any rule head:\n"
                    + "  r(X)\n");
    final Solver solver =
        new Solver(engine, ImmutableMap.of(Prop.STOP_ON_LEVEL, LogLevel.ERROR));
    assertThat(solver.solve(SOURCE, schemas).toList(), hasSize(1));
  }

  @Test
  void testSyntaxError() {
    final FakeEngine engine =
        FakeEngine.of("p(1)")
            .withFailure()
            .withDiagnostics(
                "<stdin>:2:5-6: error: syntax error, unexpected .\n\n"
                    + "*** ERROR: (clingo): parsing failed\n");
    final Solve solve = solver(engine).solve(SOURCE, schemas);
    final SolveException e = assertThrows(SolveException.class, solve::toList);
    assertThat(e.getMessage(), startsWith("Solving failed during parsing"));
    assertThat(
        e.getMessage(), containsString("Found 2 messages during parsing:"));
    assertThat(e.messages(), hasSize(2));
    assertThat(e.messages().get(0).level(), is(LogLevel.ERROR));
    assertThat(e.messages().get(1).text, is("(clingo): parsing failed"));
    assertThat(engine.closed, is(true));
  }

  @Test
  void testGroundingError() {
    final FakeEngine engine =
        FakeEngine.unsatisfiable()
            .withFailure()
            .withDiagnostics("<stdin>:3:1-20: error: unsafe variables in:\n"
                + "  q(X):-[#inc_base];p(Y).\n");
    final SolveException e =
        assertThrows(
            SolveException.class,
            () -> solver(engine).solve(SOURCE, schemas).toList());
    assertThat(e.getMessage(), startsWith("Solving failed during grounding"));
  }

  @Test
  void testDescribe() {
    final SolveException e =
        new SolveException("Solving failed", ImmutableList.of());
    assertThat(
        e.describeTo(new StringBuilder()).toString(),
        is("Error: Solving failed"));
  }

  @Test
  void testConverterTable() {
    // the first schema with a given name wins
    final Schema p2 = Schema.define("p", "a", "b");
    final ModelConverter converter =
        new ModelConverter(ImmutableList.of(p, p2));
    final Ast.Predicate predicate =
        converter.toPredicate(SymbolParser.parse("p(7)"));
    assertThat(predicate.schema, is(p));
    assertThrows(
        SolveException.class,
        () -> converter.toPredicate(SymbolParser.parse("(1,2)")));
    assertThrows(
        SolveException.class,
        () -> converter.toPredicate(SymbolParser.parse("p(#inf)")));
  }
}

// End SolverTest.java
