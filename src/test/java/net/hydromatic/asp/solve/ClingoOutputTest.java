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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.hydromatic.asp.ast.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests {@link ClingoEngine} against a script that behaves like clingo: it
 * saves its standard input, writes canned JSON and diagnostics, and exits
 * with a given code.
 */
@DisabledOnOs(OS.WINDOWS)
public class ClingoOutputTest {
  private static final String SOURCE = "p(1).\nq(X) :- p(X).\n";

  private final Schema p = Schema.define("p", "x");
  private final Schema q = Schema.define("q", "x");

  @TempDir Path dir;

  /** Writes an executable script that imitates a run of clingo. */
  private Solver solver(String stdout, String stderr, int exitCode)
      throws IOException {
    final StringBuilder b =
        new StringBuilder()
            .append("#!/bin/sh\n")
            .append("cat > \"$(dirname \"$0\")/input.lp\"\n")
            .append("cat <<'EOF'\n")
            .append(stdout)
            .append("\nEOF\n");
    if (!stderr.isEmpty()) {
      b.append("cat >&2 <<'EOF'\n").append(stderr).append("\nEOF\n");
    }
    b.append("exit ").append(exitCode).append('\n');
    final Path script = dir.resolve("clingo");
    Files.write(script, b.toString().getBytes(UTF_8));
    assertThat(script.toFile().setExecutable(true), is(true));
    return new Solver(new ClingoEngine(script.toString()), ImmutableMap.of());
  }

  private String input() throws IOException {
    return new String(Files.readAllBytes(dir.resolve("input.lp")), UTF_8);
  }

  @Test
  void testModels() throws IOException {
    final String json =
        "{\"Solver\": \"clingo version 5.7.1\",\n"
            + " \"Input\": [\"<stdin>\"],\n"
            + " \"Call\": [{\"Witnesses\": [\n"
            + "   {\"Value\": [\"p(1)\", \"q(2)\", \"-q(3)\"]},\n"
            + "   {\"Value\": [\"p(2)\"]}]}],\n"
            + " \"Result\": \"SATISFIABLE\",\n"
            + " \"Models\": {\"Number\": 2, \"More\": \"no\"},\n"
            + " \"Calls\": 1,\n"
            + " \"Time\": {\"Total\": 0.002, \"Solve\": 0.001,"
            + " \"Model\": 0.001, \"Unsat\": 0.0, \"CPU\": 0.002}}";
    final Solver solver = solver(json, "", 30);
    try (Solve solve = solver.solve(SOURCE, ImmutableList.of(p, q))) {
      final List<Model> models = solve.toList();
      assertThat(models, hasSize(2));
      final Model model = models.get(0);
      assertThat(model.get(p), contains(p.of(1)));
      assertThat(model.get(q), contains(q.of(2)));
      assertThat(model.getNegated("q"), contains(q.of(3)));
      assertThat(model.contains(q.of(3)), is(false));
      assertThat(models.get(1).get(p), contains(p.of(2)));
      assertThat(models.get(1).get(q), empty());
      assertThat(solve.satisfiable(), is(true));
      assertThat(solve.exhausted(), is(true));
      final Statistics statistics = solve.statistics();
      assertThat(statistics != null, is(true));
      assertThat(statistics.count("Models", "Number"), is(2L));
      assertThat(statistics.text("Result"), is("SATISFIABLE"));
    }
    assertThat(input(), is(SOURCE));
  }

  @Test
  void testMore() throws IOException {
    final String json =
        "{\"Call\": [{\"Witnesses\": [{\"Value\": [\"p(1)\"]}]}],\n"
            + " \"Result\": \"SATISFIABLE\",\n"
            + " \"Models\": {\"Number\": 1, \"More\": \"yes\"}}";
    try (Solve solve =
        solver(json, "", 10).solve(SOURCE, ImmutableList.of(p, q))) {
      assertThat(solve.toList(), hasSize(1));
      assertThat(solve.satisfiable(), is(true));
      assertThat(solve.exhausted(), is(false));
    }
  }

  @Test
  void testUnsatisfiable() throws IOException {
    final String json =
        "{\"Call\": [{}],\n"
            + " \"Result\": \"UNSATISFIABLE\",\n"
            + " \"Models\": {\"Number\": 0, \"More\": \"no\"}}";
    try (Solve solve =
        solver(json, "", 20).solve(SOURCE, ImmutableList.of(p, q))) {
      assertThat(solve.toList(), empty());
      assertThat(solve.satisfiable(), is(false));
      assertThat(solve.exhausted(), is(true));
    }
  }

  @Test
  void testSyntaxError() throws IOException {
    final String source = "p(1).\nq(X) r :- p(X).\n";
    final String json =
        "{\"Call\": [],\n"
            + " \"Result\": \"UNKNOWN\",\n"
            + " \"Models\": {\"Number\": 0, \"More\": \"yes\"}}";
    final String stderr =
        "<stdin>:2:6-7: error: syntax error, unexpected <IDENTIFIER>\n"
            + "\n"
            + "*** ERROR: (clingo): parsing failed";
    final Solver solver = solver(json, stderr, 65);
    final Solve solve = solver.solve(source, ImmutableList.of(p, q));
    final SolveException e =
        assertThrows(SolveException.class, solve::toList);
    assertThat(e.getMessage(), startsWith("Solving failed during parsing"));
    assertThat(e.getMessage(), containsString("q(X) r :- p(X)."));
    assertThat(e.messages(), not(empty()));
    final Message message = e.messages().get(0);
    assertThat(message.line, is(2));
    assertThat(message.level(), is(LogLevel.ERROR));
    assertThat(solve.satisfiable() == null, is(true));
  }

  @Test
  void testExecutableExitsEarly() throws IOException {
    // The script does not read its input, so writing a large program fails
    final Path script = dir.resolve("quitter");
    Files.write(script, "#!/bin/sh\nexit 1\n".getBytes(UTF_8));
    assertThat(script.toFile().setExecutable(true), is(true));
    final String source = Strings.repeat("p(1).\n", 1_000_000);
    final ClingoEngine engine = new ClingoEngine(script.toString());
    final SolveException e =
        assertThrows(
            SolveException.class,
            () -> engine.start(source, ImmutableMap.of()));
    assertThat(e.getMessage(), is("Could not run " + script));
  }

  @Test
  void testMissingExecutable() {
    final String path = dir.resolve("missing").toString();
    final ClingoEngine engine = new ClingoEngine(path);
    final SolveException e =
        assertThrows(
            SolveException.class,
            () -> engine.start(SOURCE, ImmutableMap.of()));
    assertThat(e.getMessage(), is("Could not run " + path));
  }
}

// End ClingoOutputTest.java
