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

/**
 * Diagnostic message from the solving engine, such as a syntax error or a
 * warning that an atom does not occur in any rule head.
 *
 * <p>Line and columns are 1-based; they are 0 if the message has no
 * location.
 */
public class Message {
  public final String file;
  public final int line;
  public final int startColumn;
  public final int endColumn;
  /** Severity as written by the engine, for example "warning". */
  public final String severity;
  public final String text;
  /** The message as originally written. */
  public final String raw;

  public Message(
      String file,
      int line,
      int startColumn,
      int endColumn,
      String severity,
      String text,
      String raw) {
    this.file = requireNonNull(file);
    this.line = line;
    this.startColumn = startColumn;
    this.endColumn = endColumn;
    this.severity = requireNonNull(severity);
    this.text = requireNonNull(text);
    this.raw = requireNonNull(raw);
  }

  /** Returns the level of this message. */
  public LogLevel level() {
    return LogLevel.fromString(severity);
  }

  /** Returns whether this message refers to a location in the source. */
  public boolean hasLocation() {
    return line > 0;
  }

  /** Returns a copy of this message with a line of text appended. */
  Message append(String moreText) {
    return new Message(
        file,
        line,
        startColumn,
        endColumn,
        severity,
        text + "\n" + moreText,
        raw + "\n" + moreText);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    if (hasLocation()) {
      buf.append(file)
          .append(':')
          .append(line)
          .append(':')
          .append(startColumn)
          .append('-')
          .append(endColumn)
          .append(": ");
    }
    return buf.append(severity).append(": ").append(text);
  }
}

// End Message.java
