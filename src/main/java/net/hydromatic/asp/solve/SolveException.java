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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.asp.util.AspException;

/**
 * An error occurred while parsing, grounding or solving a program, or while
 * converting a solution back into predicates.
 */
public class SolveException extends RuntimeException implements AspException {
  private final ImmutableList<Message> messages;

  public SolveException(String message, List<Message> messages) {
    super(message);
    this.messages = ImmutableList.copyOf(messages);
  }

  public SolveException(String message) {
    this(message, ImmutableList.of());
  }

  public SolveException(String message, Throwable cause) {
    super(message, cause);
    this.messages = ImmutableList.of();
  }

  /** Returns the messages reported by the engine; may be empty. */
  public List<Message> messages() {
    return messages;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage());
    for (Message message : messages) {
      message.describeTo(buf.append('\n'));
    }
    return buf;
  }
}

// End SolveException.java
