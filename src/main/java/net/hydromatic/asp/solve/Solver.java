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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Map;
import net.hydromatic.asp.ast.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Submits program text to an engine, and converts its models. */
public class Solver {
  private static final Logger LOGGER = LoggerFactory.getLogger(Solver.class);

  private final Engine engine;
  private final ImmutableMap<Prop, Object> props;

  public Solver(Engine engine, Map<Prop, Object> props) {
    this.engine = requireNonNull(engine);
    this.props = ImmutableMap.copyOf(props);
  }

  /**
   * Starts solving a program.
   *
   * @param source Program text
   * @param schemas Schemas of the predicates that may occur in models
   */
  public Solve solve(String source, Collection<Schema> schemas) {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final LogLevel stopOnLevel =
        Prop.STOP_ON_LEVEL.enumValue(props, LogLevel.class);
    LOGGER.debug(
        "Solving program of {} characters; models {}, timeout {}, "
            + "stop on {}",
        source.length(),
        Prop.MODELS.intValue(props),
        Prop.TIMEOUT.intValue(props),
        stopOnLevel);
    final MessageHandler handler = new MessageHandler(source, stopOnLevel);
    final ModelConverter converter = new ModelConverter(schemas);
    final Engine.Run run = engine.start(source, props);
    return new Solve(run, handler, converter, stopwatch);
  }
}

// End Solver.java
