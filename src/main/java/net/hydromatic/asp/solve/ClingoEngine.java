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
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine that runs the clingo executable.
 *
 * <p>The program is written to clingo's standard input. Clingo is asked for
 * JSON output ({@code --outf=2}), which is read incrementally, so that each
 * model is available as soon as clingo writes it. Diagnostics go to a
 * temporary file.
 */
public class ClingoEngine implements Engine {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ClingoEngine.class);

  /** Exit code with which clingo reports an error, such as a syntax error. */
  static final int EXIT_ERROR = 65;

  /** Exit code with which clingo reports that it did not run. */
  static final int EXIT_NO_RUN = 128;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final @Nullable String executable;

  /** Creates an engine that uses the {@link Prop#CLINGO} property. */
  public ClingoEngine() {
    this.executable = null;
  }

  /** Creates an engine that uses a given executable. */
  public ClingoEngine(String executable) {
    this.executable = requireNonNull(executable);
  }

  /**
   * Returns whether an executable can be launched and reports a version.
   * Does not throw.
   */
  public static boolean isAvailable(String executable) {
    try {
      final Process process =
          new ProcessBuilder(executable, "--version")
              .redirectErrorStream(true)
              .start();
      process.getInputStream().readAllBytes();
      return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
    } catch (IOException e) {
      LOGGER.debug("clingo executable '{}' not available", executable, e);
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Returns the command line to solve with given properties. */
  List<String> command(Map<Prop, Object> props) {
    final List<String> command = new ArrayList<>();
    command.add(
        executable != null ? executable : Prop.CLINGO.stringValue(props));
    command.add("--outf=2");
    command.add("--stats");
    command.add("-n");
    command.add(Integer.toString(Prop.MODELS.intValue(props)));
    final int timeout = Prop.TIMEOUT.intValue(props);
    if (timeout > 0) {
      command.add("--time-limit=" + timeout);
    }
    return command;
  }

  @Override
  public Run start(String source, Map<Prop, Object> props) {
    final List<String> command = command(props);
    LOGGER.debug("Starting {}", command);
    @Nullable File errFile = null;
    @Nullable Process process = null;
    try {
      errFile = File.createTempFile("clingo", ".err");
      errFile.deleteOnExit();
      process =
          new ProcessBuilder(command)
              .redirectError(ProcessBuilder.Redirect.to(errFile))
              .start();
      // clingo reads all of its input before it writes any output, so we
      // can write the whole program before we start reading.
      try (Writer w =
          new OutputStreamWriter(process.getOutputStream(), UTF_8)) {
        w.write(source);
      }
      final JsonParser parser =
          MAPPER.getFactory().createParser(process.getInputStream());
      return new ClingoRun(process, parser, errFile);
    } catch (IOException e) {
      if (process != null) {
        process.destroy();
      }
      if (errFile != null && !errFile.delete()) {
        LOGGER.debug("Could not delete {}", errFile);
      }
      throw new SolveException("Could not run " + command.get(0), e);
    }
  }

  /** Run of the clingo executable. */
  private static class ClingoRun implements Run {
    private final Process process;
    private final JsonParser parser;
    private final File errFile;
    /** Top-level fields other than "Call", such as "Result" and "Time". */
    private final ObjectNode result = MAPPER.createObjectNode();
    private @Nullable Summary summary;
    private int modelCount;

    ClingoRun(Process process, JsonParser parser, File errFile) {
      this.process = process;
      this.parser = parser;
      this.errFile = errFile;
    }

    @Override
    public @Nullable List<Symbol> nextModel() {
      if (summary != null) {
        return null;
      }
      try {
        for (;;) {
          final JsonToken token = parser.nextToken();
          if (token == null) {
            finish();
            return null;
          }
          if (token != JsonToken.FIELD_NAME) {
            continue;
          }
          final String name = parser.currentName();
          if (isTopLevel(parser.getParsingContext())) {
            if (!name.equals("Call")) {
              parser.nextToken();
              final JsonNode value = parser.readValueAsTree();
              result.set(name, value);
            }
          } else if (name.equals("Value")
              && parser.nextToken() == JsonToken.START_ARRAY) {
            final ImmutableList.Builder<Symbol> symbols =
                ImmutableList.builder();
            while (parser.nextToken() == JsonToken.VALUE_STRING) {
              symbols.add(SymbolParser.parse(parser.getText()));
            }
            ++modelCount;
            LOGGER.debug("Model {}", modelCount);
            return symbols.build();
          }
        }
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    private static boolean isTopLevel(JsonStreamContext context) {
      final JsonStreamContext parent = context.getParent();
      return parent != null && parent.inRoot();
    }

    private void finish() {
      int exitCode;
      try {
        exitCode = process.waitFor();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        process.destroy();
        exitCode = EXIT_NO_RUN;
      }
      LOGGER.debug("clingo exited with code {}", exitCode);
      final String resultText =
          result.has("Result") ? result.get("Result").asText() : "UNKNOWN";
      final Boolean satisfiable;
      switch (resultText) {
        case "SATISFIABLE":
        case "OPTIMUM FOUND":
          satisfiable = true;
          break;
        case "UNSATISFIABLE":
          satisfiable = false;
          break;
        default:
          satisfiable = null;
      }
      final boolean exhausted =
          result.has("Models")
              && "no".equals(result.get("Models").path("More").asText());
      final boolean failed =
          exitCode == EXIT_ERROR || exitCode >= EXIT_NO_RUN;
      summary = new Summary(satisfiable, exhausted, failed, result);
    }

    @Override
    public String diagnostics() {
      try {
        return new String(Files.readAllBytes(errFile.toPath()), UTF_8);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    @Override
    public Summary summary() {
      if (summary == null) {
        throw new IllegalStateException("run has not finished");
      }
      return summary;
    }

    @Override
    public void close() {
      try {
        parser.close();
      } catch (IOException e) {
        LOGGER.warn("Error closing clingo output", e);
      }
      if (process.isAlive()) {
        LOGGER.debug("Stopping clingo after {} models", modelCount);
        process.destroy();
      }
      if (!errFile.delete()) {
        LOGGER.debug("Could not delete {}", errFile);
      }
    }
  }
}

// End ClingoEngine.java
