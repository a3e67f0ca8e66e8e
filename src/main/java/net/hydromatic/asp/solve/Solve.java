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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solve in progress; an iterable over the models of a program.
 *
 * <p>Models are produced lazily. A caller that stops early should close the
 * solve, which stops the engine. The outcome ({@link #satisfiable()},
 * {@link #exhausted()}, {@link #statistics()}) is available once all models
 * have been read.
 *
 * <p>Can be iterated only once.
 */
public class Solve implements Iterable<Model>, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(Solve.class);

  private final Engine.Run run;
  private final MessageHandler handler;
  private final ModelConverter converter;
  private final Stopwatch stopwatch;
  private boolean iterated;
  private boolean checked;
  private int modelCount;
  private @Nullable Boolean satisfiable;
  private boolean exhausted;
  private @Nullable Statistics statistics;

  Solve(
      Engine.Run run,
      MessageHandler handler,
      ModelConverter converter,
      Stopwatch stopwatch) {
    this.run = requireNonNull(run);
    this.handler = requireNonNull(handler);
    this.converter = requireNonNull(converter);
    this.stopwatch = requireNonNull(stopwatch);
  }

  @Override
  public Iterator<Model> iterator() {
    checkState(!iterated, "solve can only be iterated once");
    iterated = true;
    return new AbstractIterator<Model>() {
      @Override
      protected @Nullable Model computeNext() {
        try {
          return computeNextModel();
        } catch (RuntimeException e) {
          // a failed solve releases the engine
          run.close();
          throw e;
        }
      }

      private @Nullable Model computeNextModel() {
        final @Nullable List<Symbol> symbols = run.nextModel();
        if (!checked) {
          checked = true;
          checkMessages(symbols == null);
        }
        if (symbols == null) {
          finish();
          return endOfData();
        }
        ++modelCount;
        satisfiable = true;
        return converter.convert(modelCount, symbols);
      }
    };
  }

  /** Reads all remaining models into a list. */
  public List<Model> toList() {
    return ImmutableList.copyOf(this);
  }

  /**
   * Examines the engine's diagnostics, which are complete once grounding is
   * complete, and throws if they are severe enough.
   */
  private void checkMessages(boolean finished) {
    handler.onOutput(run.diagnostics());
    if (finished && run.summary().failed) {
      final String verb = isSyntaxError() ? "parsing" : "grounding";
      final StringBuilder b =
          new StringBuilder("Solving failed during ").append(verb);
      final String formatted = handler.formatAll(verb);
      if (formatted != null) {
        b.append("\n\n").append(formatted);
      }
      throw new SolveException(b.toString(), handler.messages());
    }
    if (handler.messages().isEmpty()) {
      return;
    }
    if (handler.shouldHalt()) {
      throw new SolveException(
          String.format(
              "Grounding produced %s level messages "
                  + "(stop threshold: %s).\n\n%s",
              requireNonNull(handler.highestLevel()),
              handler.stopOnLevel(),
              handler.formatAll("grounding")),
          handler.messages());
    }
    for (Message message : handler.messages()) {
      LOGGER.warn("{}", message);
    }
  }

  private boolean isSyntaxError() {
    for (Message message : handler.messages()) {
      if (message.text.contains("syntax error")
          || message.text.contains("parsing failed")) {
        return true;
      }
    }
    return false;
  }

  private void finish() {
    final Engine.Summary summary = run.summary();
    satisfiable = modelCount > 0 ? Boolean.TRUE : summary.satisfiable;
    exhausted = summary.exhausted;
    statistics =
        new Statistics(
            summary.statistics,
            stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1_000_000_000D);
    LOGGER.debug(
        "Solve finished: {} models, satisfiable {}, exhausted {}",
        modelCount,
        satisfiable,
        exhausted);
    run.close();
  }

  /** Returns the number of models produced so far. */
  public int modelCount() {
    return modelCount;
  }

  /**
   * Returns whether the program is satisfiable: true if a model has been
   * found, false if the engine proved there is none, null if not yet known.
   */
  public @Nullable Boolean satisfiable() {
    return satisfiable;
  }

  /** Returns whether the engine produced all models. */
  public boolean exhausted() {
    return exhausted;
  }

  /** Returns the statistics, or null if the solve has not finished. */
  public @Nullable Statistics statistics() {
    return statistics;
  }

  @Override
  public void close() {
    run.close();
  }
}

// End Solve.java
