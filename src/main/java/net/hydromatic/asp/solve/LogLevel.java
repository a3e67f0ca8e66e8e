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

import java.util.Locale;

/** Severity of a message from the solving engine. */
public enum LogLevel {
  DEBUG(10),
  INFO(20),
  WARNING(30),
  ERROR(40),
  CRITICAL(50);

  /** Numeric level; a higher level is more severe. */
  public final int level;

  LogLevel(int level) {
    this.level = level;
  }

  /**
   * Converts the engine's name for a severity, such as "warning", to a level.
   * Unknown names are treated as {@link #INFO}.
   */
  public static LogLevel fromString(String s) {
    switch (s.toLowerCase(Locale.ROOT)) {
      case "debug":
        return DEBUG;
      case "warning":
        return WARNING;
      case "error":
        return ERROR;
      case "critical":
        return CRITICAL;
      default:
        return INFO;
    }
  }

  /** Returns whether this level is at least as severe as another. */
  public boolean atLeast(LogLevel other) {
    return level >= other.level;
  }
}

// End LogLevel.java
