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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Statistics of a solve.
 *
 * <p>Wraps the tree of counters that the engine reports. Counters are looked
 * up by path, ignoring case; if the path does not match, by the last key of
 * the path anywhere in the tree. This makes lookups robust to differences
 * between engine versions in how the tree is nested.
 */
public class Statistics {
  private final JsonNode root;
  private final double totalSeconds;

  public Statistics(JsonNode root, double totalSeconds) {
    this.root = requireNonNull(root);
    this.totalSeconds = totalSeconds;
  }

  /** Returns the raw tree of counters. */
  public JsonNode raw() {
    return root;
  }

  /** Returns the elapsed time of the whole solve, in seconds. */
  public double totalTime() {
    return totalSeconds;
  }

  /**
   * Returns the value of a counter, or a default value if it is not
   * present.
   */
  public double get(double defaultValue, String... path) {
    final JsonNode node = find(path);
    return node != null && node.isNumber() ? node.asDouble() : defaultValue;
  }

  /** Returns the value of an integer counter, or 0 if it is not present. */
  public long count(String... path) {
    return (long) get(0D, path);
  }

  /** Returns the value of a text counter, or null if it is not present. */
  public @Nullable String text(String... path) {
    final JsonNode node = find(path);
    return node != null && node.isTextual() ? node.asText() : null;
  }

  private @Nullable JsonNode find(String... path) {
    JsonNode node = root;
    for (String key : path) {
      node = child(node, key);
      if (node == null) {
        return search(root, path[path.length - 1]);
      }
    }
    return node;
  }

  private static @Nullable JsonNode child(JsonNode node, String key) {
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().equalsIgnoreCase(key)) {
        return field.getValue();
      }
    }
    return null;
  }

  /** Finds the first field with a given name, depth-first. */
  private static @Nullable JsonNode search(JsonNode node, String key) {
    final JsonNode child = child(node, key);
    if (child != null) {
      return child;
    }
    for (JsonNode value : node) {
      if (value.isContainerNode()) {
        final JsonNode found = search(value, key);
        if (found != null) {
          return found;
        }
      }
    }
    return null;
  }

  /** Formats the statistics in the style of clingo's own summary. */
  public String format() {
    final List<String> lines = new ArrayList<>();
    final long models = count("Models", "Number");
    final boolean more = "yes".equals(text("Models", "More"));
    lines.add(line("Models", models + (more ? "+" : "")));
    lines.add(line("Calls", Long.toString(Math.max(1, count("Calls")))));
    final double total =
        totalSeconds > 0 ? totalSeconds : get(0D, "Time", "Total");
    lines.add(
        line(
            "Time",
            String.format(
                Locale.ROOT,
                "%.3fs (Solving: %.3fs 1st Model: %.3fs Unsat: %.3fs)",
                total,
                get(0D, "Time", "Solve"),
                get(0D, "Time", "Model"),
                get(0D, "Time", "Unsat"))));
    lines.add(
        line(
            "CPU Time",
            String.format(Locale.ROOT, "%.3fs", get(0D, "Time", "CPU"))));
    lines.add("");

    final long conflictsAnalyzed = count("conflicts_analyzed");
    final long restarts = count("restarts");
    lines.add(line("Choices", Long.toString(count("choices"))));
    lines.add(
        line(
            "Conflicts",
            String.format(
                Locale.ROOT,
                "%-8d (Analyzed: %d)",
                count("conflicts"),
                conflictsAnalyzed)));
    lines.add(
        line(
            "Restarts",
            String.format(
                Locale.ROOT,
                "%-8d (Average: %5.2f Last: %d Blocked: %d)",
                restarts,
                restarts > 0 ? (double) conflictsAnalyzed / restarts : 0D,
                count("restarts_last"),
                count("restarts_blocked"))));
    lines.add("");

    lines.add(
        line(
            "Rules",
            String.format(
                Locale.ROOT,
                "%-8d (Original: %d)",
                count("rules_tr"),
                count("rules"))));
    lines.add(line("  Choice", Long.toString(count("rules_choice"))));
    final long atoms = count("atoms");
    final long atomsAux = count("atoms_aux");
    lines.add(
        line(
            "Atoms",
            atomsAux > 0
                ? String.format(
                    Locale.ROOT,
                    "%-8d (Original: %d Auxiliary: %d)",
                    atoms,
                    atoms - atomsAux,
                    atomsAux)
                : Long.toString(atoms)));
    lines.add(
        line(
            "Bodies",
            String.format(
                Locale.ROOT,
                "%-8d (Original: %d)",
                count("bodies_tr"),
                count("bodies"))));
    lines.add(
        line(
            "Variables",
            String.format(
                Locale.ROOT,
                "%-8d (Eliminated: %4d Frozen: %d)",
                count("vars"),
                count("vars_eliminated"),
                count("vars_frozen"))));
    final long binary = count("constraints_binary");
    final long ternary = count("constraints_ternary");
    final long other = count("constraints");
    lines.add(
        line(
            "Constraints",
            String.format(
                Locale.ROOT,
                "%-8d (Binary: %d Ternary: %d Other: %d)",
                binary + ternary + other,
                binary,
                ternary,
                other)));
    return String.join("\n", lines);
  }

  private static String line(String label, String value) {
    return String.format(Locale.ROOT, "%-13s: %s", label, value)
        .stripTrailing();
  }

  @Override
  public String toString() {
    return root.toString();
  }
}

// End Statistics.java
