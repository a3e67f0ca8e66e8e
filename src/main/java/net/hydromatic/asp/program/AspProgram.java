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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.asp.ast.AstBuilder.ast;
import static net.hydromatic.asp.util.Static.isLowerIdentifier;
import static net.hydromatic.asp.util.Static.lower;
import static net.hydromatic.asp.util.Static.titleCase;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.asp.ast.Ast;
import net.hydromatic.asp.ast.Schema;
import net.hydromatic.asp.ast.Term;
import net.hydromatic.asp.solve.ClingoEngine;
import net.hydromatic.asp.solve.Engine;
import net.hydromatic.asp.solve.Prop;
import net.hydromatic.asp.solve.Solve;
import net.hydromatic.asp.solve.Solver;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answer set program.
 *
 * <p>A program consists of segments of statements, symbolic constants and
 * the schemas of the predicates it uses. Statements added directly to the
 * program go to its default segment, "Rules".
 *
 * <p>Rendering checks that every symbolic constant used has been
 * registered, then writes a header, "#const" definitions, the segments
 * in the order they were created, and "#show" directives for the
 * predicates that are used.
 *
 * <p>Not thread-safe.
 */
public class AspProgram {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AspProgram.class);

  public static final String DEFAULT_SEGMENT = "Rules";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  /** Segments, keyed by lower-case name. */
  private final Map<String, Segment> segments = new LinkedHashMap<>();
  /** Registered constants; values are Integer or String. */
  private final Map<String, Object> constants = new LinkedHashMap<>();
  private final Set<Schema> schemas = new LinkedHashSet<>();
  private final Map<Prop, Object> props =
      new LinkedHashMap<>(Prop.fromSystemProperties());
  private final String defaultSegment;
  private @Nullable String header;
  private Clock clock = Clock.systemDefaultZone();
  private Engine engine = new ClingoEngine();

  /** Creates an empty program with no header. */
  public AspProgram() {
    this(null, DEFAULT_SEGMENT);
  }

  /** Creates an empty program. */
  public AspProgram(@Nullable String header, String defaultSegment) {
    this.header = header;
    this.defaultSegment = requireNonNull(defaultSegment);
  }

  public @Nullable String header() {
    return header;
  }

  public AspProgram setHeader(@Nullable String header) {
    this.header = header;
    return this;
  }

  /** Sets the clock that provides the timestamp in the rendered header. */
  public AspProgram setClock(Clock clock) {
    this.clock = requireNonNull(clock);
    return this;
  }

  /** Sets the engine that {@link #solve()} uses. */
  public AspProgram setEngine(Engine engine) {
    this.engine = requireNonNull(engine);
    return this;
  }

  /** Sets a solver property; for example, the number of models. */
  public AspProgram setProp(Prop prop, @Nullable Object value) {
    prop.setLenient(props, value);
    return this;
  }

  /** Returns the solver properties. */
  public Map<Prop, Object> props() {
    return ImmutableMap.copyOf(props);
  }

  // segments

  /**
   * Adds a segment.
   *
   * @throws IllegalArgumentException if a segment with the same name, ignoring
   *     case, exists
   */
  public Segment addSegment(String name) {
    final String key = lower(name);
    if (segments.containsKey(key)) {
      throw new IllegalArgumentException(
          "Segment '" + name + "' already exists");
    }
    final Segment segment = new Segment(name);
    segments.put(key, segment);
    return segment;
  }

  /**
   * Returns the segment with a given name, ignoring case, creating it if it
   * does not exist.
   */
  public Segment segment(String name) {
    final Segment segment = segments.get(lower(name));
    return segment != null ? segment : addSegment(name);
  }

  /** Returns the default segment. */
  public Segment segment() {
    return segment(defaultSegment);
  }

  /** Returns the segments, in creation order. */
  public List<Segment> segments() {
    return ImmutableList.copyOf(segments.values());
  }

  // schemas and constants

  /**
   * Registers a schema, so that models may contain instances of it even if
   * no statement of this program mentions it.
   */
  public Schema defineSchema(Schema schema) {
    schemas.add(requireNonNull(schema));
    return schema;
  }

  /** Defines and registers a schema with no namespace. */
  public Schema defineSchema(String name, String... fields) {
    return defineSchema(Schema.define(name, fields));
  }

  /** Registers an integer symbolic constant. */
  public Ast.SymbolicConstant registerConstant(String name, int value) {
    return register(name, value);
  }

  /** Registers a string symbolic constant. */
  public Ast.SymbolicConstant registerConstant(String name, String value) {
    return register(name, requireNonNull(value));
  }

  private Ast.SymbolicConstant register(String name, Object value) {
    checkArgument(
        isLowerIdentifier(name),
        "Constant name must start with a lower-case letter and contain only "
            + "letters, digits and underscores: '%s'",
        name);
    checkArgument(
        !constants.containsKey(name),
        "Symbolic constant '%s' is already registered",
        name);
    constants.put(name, value);
    return ast.symbolic(name);
  }

  /** Returns the registered constants. */
  public Map<String, Object> constants() {
    return ImmutableMap.copyOf(constants);
  }

  // statements, added to the default segment

  public AspProgram addFact(Ast.Predicate... predicates) {
    segment().addFact(predicates);
    return this;
  }

  public AspProgram addRule(List<? extends Term> conditions, Term consequent) {
    segment().addRule(conditions, consequent);
    return this;
  }

  public AspProgram addRule(Term condition, Term consequent) {
    segment().addRule(condition, consequent);
    return this;
  }

  public AspProgram addConstraint(Term... conditions) {
    segment().addConstraint(conditions);
    return this;
  }

  public AspProgram comment(String text) {
    segment().comment(text);
    return this;
  }

  public AspProgram blankLine() {
    segment().blankLine();
    return this;
  }

  public AspProgram section(String title) {
    segment().section(title);
    return this;
  }

  // rendering

  /** Returns the schemas of all predicates used by statements. */
  public Set<Schema> collectPredicates() {
    final Set<Schema> set = new LinkedHashSet<>();
    for (Segment segment : segments.values()) {
      for (Statement statement : segment.statements()) {
        set.addAll(statement.collectPredicates());
      }
    }
    return set;
  }

  /** Returns the names of all symbolic constants used by statements. */
  public Set<String> collectSymbolicConstants() {
    final Set<String> set = new LinkedHashSet<>();
    for (Segment segment : segments.values()) {
      for (Statement statement : segment.statements()) {
        set.addAll(statement.collectSymbolicConstants());
      }
    }
    return set;
  }

  /**
   * Renders this program as text.
   *
   * @throws UndefinedConstantException if the program uses symbolic constants
   *     that have not been registered
   */
  public String render() {
    final Set<String> used = collectSymbolicConstants();
    final Set<String> unregistered = new TreeSet<>(used);
    unregistered.removeAll(constants.keySet());
    if (!unregistered.isEmpty()) {
      throw new UndefinedConstantException(unregistered);
    }
    final Set<String> showDirectives = showDirectives(collectPredicates());

    final List<String> lines = new ArrayList<>();
    if (header != null && !header.isEmpty()) {
      lines.add("% " + header);
    }
    lines.add(
        "% Generated by asp on "
            + LocalDateTime.now(clock).format(TIMESTAMP_FORMAT));

    constants.forEach((name, value) -> {
      if (used.contains(name)) {
        lines.add(
            value instanceof String
                ? "#const " + name + " = \"" + value + "\"."
                : "#const " + name + " = " + value + ".");
      }
    });

    for (Segment segment : segments.values()) {
      if (segments.size() > 1 && !segment.isEmpty()) {
        lines.add("");
        lines.add("% ===== " + titleCase(segment.name) + " =====");
      }
      for (Statement statement : segment.statements()) {
        lines.add(statement.render());
      }
    }

    if (!showDirectives.isEmpty()) {
      lines.add("");
      lines.add("#show.");
      lines.addAll(showDirectives);
    }
    final String text = String.join("\n", lines) + "\n";
    LOGGER.debug(
        "Rendered program: {} segments, {} lines",
        segments.size(),
        lines.size());
    return text;
  }

  /**
   * Returns the sorted show directives of a set of schemas.
   *
   * <p>Schemas with the same qualified name and arity may occur more than
   * once, but their directives, if not null, must agree.
   */
  static Set<String> showDirectives(Set<Schema> schemas) {
    final Map<String, String> directives = new HashMap<>();
    final Set<String> set = new TreeSet<>();
    for (Schema schema : schemas) {
      final String directive = schema.showDirective();
      if (directive == null) {
        continue;
      }
      final String key = schema.toString();
      final String previous = directives.putIfAbsent(key, directive);
      if (previous != null && !previous.equals(directive)) {
        throw new IllegalStateException(
            String.format(
                "Conflicting show directives for predicate %s: '%s' and '%s'",
                key,
                previous,
                directive));
      }
      set.add(directive);
    }
    return set;
  }

  // solving

  /**
   * Renders this program and starts solving it.
   *
   * <p>Models are computed lazily as the result is iterated. Close the
   * result to stop early.
   */
  public Solve solve() {
    final String source = render();
    final Set<Schema> allSchemas =
        ImmutableSet.<Schema>builder()
            .addAll(collectPredicates())
            .addAll(schemas)
            .build();
    return new Solver(engine, props).solve(source, allSchemas);
  }
}

// End AspProgram.java
