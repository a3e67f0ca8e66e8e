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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Engine that grounds and solves ASP programs.
 *
 * <p>{@link ClingoEngine} runs the clingo executable; tests may supply their
 * own implementation.
 */
public interface Engine {
  /**
   * Starts solving a program. Models are produced lazily by the returned
   * run, which the caller must close.
   *
   * @param source Program text
   * @param props Solving properties, such as {@link Prop#MODELS}
   */
  Run start(String source, Map<Prop, Object> props);

  /** A solve in progress. */
  interface Run extends AutoCloseable {
    /**
     * Returns the shown symbols of the next model, or null if there are no
     * more models. Blocks until the engine produces a model or finishes.
     */
    @Nullable List<Symbol> nextModel();

    /**
     * Returns the diagnostic output written by the engine so far. Messages
     * about parsing and grounding are complete by the time the first model
     * is returned, or when {@link #nextModel()} first returns null.
     */
    String diagnostics();

    /** Returns the outcome. Valid after {@link #nextModel()} returns null. */
    Summary summary();

    /** Stops the engine, if it is still running, and releases resources. */
    @Override
    void close();
  }

  /** Outcome of a run. */
  class Summary {
    /** Whether the program has a model; null if unknown, as after a timeout. */
    public final @Nullable Boolean satisfiable;
    /** Whether the search space was exhausted; all models were produced. */
    public final boolean exhausted;
    /** Whether the engine failed, for example with a syntax error. */
    public final boolean failed;
    /** Statistics reported by the engine; an empty object if none. */
    public final JsonNode statistics;

    public Summary(
        @Nullable Boolean satisfiable,
        boolean exhausted,
        boolean failed,
        JsonNode statistics) {
      this.satisfiable = satisfiable;
      this.exhausted = exhausted;
      this.failed = failed;
      this.statistics = statistics;
    }
  }
}

// End Engine.java
