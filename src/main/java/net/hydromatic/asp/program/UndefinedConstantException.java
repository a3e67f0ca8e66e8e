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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.SortedSet;
import net.hydromatic.asp.util.AspException;

/**
 * A program uses symbolic constants that have not been registered.
 *
 * <p>The error lists all such constants, not just the first.
 */
public class UndefinedConstantException extends IllegalStateException
    implements AspException {
  private final ImmutableSortedSet<String> names;

  public UndefinedConstantException(Collection<String> names) {
    super(
        "Unregistered symbolic constants used in program: "
            + String.join(", ", ImmutableSortedSet.copyOf(names)));
    this.names = ImmutableSortedSet.copyOf(names);
  }

  /** Returns the names of the unregistered constants, sorted. */
  public SortedSet<String> names() {
    return names;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End UndefinedConstantException.java
