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
package net.hydromatic.asp.util;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Utilities. */
public class Static {
  private Static() {}

  /** Lower-case identifier, as used for predicates and symbolic constants. */
  private static final Pattern LOWER_IDENTIFIER =
      Pattern.compile("[a-z][a-zA-Z0-9_]*");

  /** Upper-case identifier, as used for variables. */
  private static final Pattern UPPER_IDENTIFIER =
      Pattern.compile("[A-Z][a-zA-Z0-9_]*");

  /** Identifier of any case; field names of a schema. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  /**
   * Returns whether a string is a valid name for a predicate or symbolic
   * constant: a lower-case letter followed by letters, digits and
   * underscores.
   */
  public static boolean isLowerIdentifier(String s) {
    return LOWER_IDENTIFIER.matcher(s).matches();
  }

  /**
   * Returns whether a string is a valid variable name: "_", or an upper-case
   * letter followed by letters, digits and underscores.
   */
  public static boolean isVariableName(String s) {
    return s.equals("_") || UPPER_IDENTIFIER.matcher(s).matches();
  }

  /** Returns whether a string is a valid field name. */
  public static boolean isIdentifier(String s) {
    return IDENTIFIER.matcher(s).matches();
  }

  /**
   * Converts a string to title case; the first letter of each word is
   * upper-case, the rest lower-case. "board rules" becomes "Board Rules".
   */
  public static String titleCase(String s) {
    final StringBuilder b = new StringBuilder(s.length());
    boolean startOfWord = true;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (Character.isLetter(c)) {
        b.append(
            startOfWord
                ? Character.toUpperCase(c)
                : Character.toLowerCase(c));
        startOfWord = false;
      } else {
        b.append(c);
        startOfWord = true;
      }
    }
    return b.toString();
  }

  /** Converts a string to lower case in the root locale. */
  public static String lower(String s) {
    return s.toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the first of a list of preferred names that is not already used;
   * if all are used, appends the smallest positive number to the last
   * preferred name that makes it unused.
   *
   * <p>For example, if {@code used} is {"N", "C"} and {@code preferred} is
   * ["N", "C", "Count"], returns "Count"; if {@code used} also contains
   * "Count", returns "Count1".
   */
  public static String uniqueName(Set<String> used, List<String> preferred) {
    if (preferred.isEmpty()) {
      throw new IllegalArgumentException("no preferred names");
    }
    for (String name : preferred) {
      if (!used.contains(name)) {
        return name;
      }
    }
    final String last = last(preferred);
    for (int i = 1; ; i++) {
      final String name = last + i;
      if (!used.contains(name)) {
        return name;
      }
    }
  }

  /** Returns the last element of a list. */
  public static <E> E last(List<E> list) {
    return list.get(list.size() - 1);
  }

  /** Appends "s" to a noun if a count is not 1; "1 message", "2 messages". */
  public static String plural(int count, String noun) {
    return count + " " + noun + (count == 1 ? "" : "s");
  }
}

// End Static.java
