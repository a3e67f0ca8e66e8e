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
import static net.hydromatic.asp.util.Static.plural;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Collects messages from the solving engine, tracks the most severe, and
 * formats them with an excerpt of the program source.
 */
public class MessageHandler {
  /** Message with location, "&lt;stdin&gt;:3:1-5: error: syntax error". */
  private static final Pattern LOCATED =
      Pattern.compile("<(.+?)>:(\\d+):(\\d+)-(\\d+):\\s*(.+?):\\s*(.+)");

  /** Message without location, "warning: something happened". */
  private static final Pattern UNLOCATED = Pattern.compile("^(\\w+):\\s*(.+)");

  private static final String SEPARATOR = Strings.repeat("-", 60);

  private final List<String> sourceLines;
  private final LogLevel stopOnLevel;
  private final List<Message> messages = new ArrayList<>();
  private @Nullable LogLevel highestLevel;

  public MessageHandler(String source, LogLevel stopOnLevel) {
    this.sourceLines = Splitter.on('\n').splitToList(requireNonNull(source));
    this.stopOnLevel = requireNonNull(stopOnLevel);
  }

  /** Parses and records one message. */
  public Message onMessage(String raw) {
    final Message message = parse(raw);
    add(message);
    return message;
  }

  /**
   * Parses the diagnostic output of the engine, which may contain several
   * messages. An indented line continues the previous message; blank lines
   * separate messages.
   */
  public void onOutput(String output) {
    @Nullable Message pending = null;
    for (String line : Splitter.on('\n').split(output)) {
      if (line.trim().isEmpty()) {
        continue;
      }
      if (pending != null && Character.isWhitespace(line.charAt(0))) {
        pending = pending.append(line.trim());
        continue;
      }
      if (pending != null) {
        add(pending);
      }
      pending = parse(line);
    }
    if (pending != null) {
      add(pending);
    }
  }

  /** Parses a message. */
  static Message parse(String raw) {
    final String s = raw.startsWith("*** ") ? raw.substring(4) : raw;
    final Matcher located = LOCATED.matcher(s);
    if (located.lookingAt()) {
      return new Message(
          located.group(1),
          Integer.parseInt(located.group(2)),
          Integer.parseInt(located.group(3)),
          Integer.parseInt(located.group(4)),
          located.group(5),
          located.group(6),
          raw);
    }
    final Matcher unlocated = UNLOCATED.matcher(s);
    if (unlocated.lookingAt()) {
      return new Message(
          "<unknown>", 0, 0, 0, unlocated.group(1), unlocated.group(2), raw);
    }
    return new Message("<unknown>", 0, 0, 0, "info", s, raw);
  }

  private void add(Message message) {
    messages.add(message);
    final LogLevel level = message.level();
    if (highestLevel == null || level.level > highestLevel.level) {
      highestLevel = level;
    }
  }

  public List<Message> messages() {
    return ImmutableList.copyOf(messages);
  }

  /** Returns the most severe level seen, or null if there are no messages. */
  public @Nullable LogLevel highestLevel() {
    return highestLevel;
  }

  public LogLevel stopOnLevel() {
    return stopOnLevel;
  }

  /** Returns whether the most severe message reaches the stop level. */
  public boolean shouldHalt() {
    return highestLevel != null && highestLevel.atLeast(stopOnLevel);
  }

  /**
   * Formats a message, with the offending line of source, the line before
   * it, and a marker under the offending columns.
   */
  public String format(Message message) {
    final List<String> lines = new ArrayList<>();
    lines.add(message.severity.toUpperCase(Locale.ROOT) + ": " + message.text);
    lines.add(
        "  at line "
            + message.line
            + ", columns "
            + message.startColumn
            + "-"
            + message.endColumn);
    lines.add("");
    lines.add("  in " + message.file);
    if (message.line > 0 && message.line <= sourceLines.size()) {
      if (message.line > 1) {
        lines.add(
            String.format(
                "%4d | %s",
                message.line - 1,
                sourceLines.get(message.line - 2)));
      }
      lines.add(
          String.format(
              "%4d | %s", message.line, sourceLines.get(message.line - 1)));
      if (message.startColumn > 0) {
        lines.add(
            "       "
                + Strings.repeat(" ", message.startColumn - 1)
                + Strings.repeat(
                    "^", Math.max(1, message.endColumn - message.startColumn)));
      }
    }
    lines.add("");
    return String.join("\n", lines);
  }

  /**
   * Formats all messages, or returns null if there are none.
   *
   * @param verb What was happening, for example "parsing" or "grounding"
   */
  public @Nullable String formatAll(String verb) {
    if (messages.isEmpty()) {
      return null;
    }
    final List<String> lines = new ArrayList<>();
    lines.add(SEPARATOR);
    lines.add(
        "Found "
            + plural(messages.size(), "message")
            + " during "
            + verb
            + ":\n");
    for (Message message : messages) {
      lines.add(format(message));
      lines.add(SEPARATOR);
      lines.add("");
    }
    return String.join("\n", lines);
  }
}

// End MessageHandler.java
