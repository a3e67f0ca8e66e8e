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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("models"), is(Prop.MODELS));
    assertThat(Prop.lookup("STOP_ON_LEVEL"), is(Prop.STOP_ON_LEVEL));
    assertThat(Prop.lookup("stopOnLevel"), is(Prop.STOP_ON_LEVEL));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("x"));
    assertThat(
        Prop.BY_CAMEL_NAME,
        contains(Prop.CLINGO, Prop.MODELS, Prop.STOP_ON_LEVEL, Prop.TIMEOUT));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.MODELS.intValue(map), is(0));
    assertThat(Prop.TIMEOUT.intValue(map), is(0));
    assertThat(Prop.CLINGO.stringValue(map), is("clingo"));
    assertThat(
        Prop.STOP_ON_LEVEL.enumValue(map, LogLevel.class), is(LogLevel.INFO));
    assertThat(Prop.MODELS.get(map), is((Object) 0));
  }

  @Test
  void testFromProperties() {
    final Properties properties = new Properties();
    properties.setProperty("asp.models", "5");
    properties.setProperty("asp.timeout", " 7 ");
    properties.setProperty("asp.stopOnLevel", "warning");
    properties.setProperty("models", "100");
    final Map<Prop, Object> map = Prop.fromProperties(properties);
    assertThat(Prop.MODELS.intValue(map), is(5));
    assertThat(Prop.TIMEOUT.intValue(map), is(7));
    assertThat(
        Prop.STOP_ON_LEVEL.enumValue(map, LogLevel.class),
        is(LogLevel.WARNING));
    assertThat(Prop.CLINGO.stringValue(map), is("clingo"));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MODELS.set(map, 3);
    assertThat(Prop.MODELS.intValue(map), is(3));
    Prop.STOP_ON_LEVEL.setLenient(map, "Error");
    assertThat(
        Prop.STOP_ON_LEVEL.enumValue(map, LogLevel.class), is(LogLevel.ERROR));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.STOP_ON_LEVEL.setLenient(map, "loud"));
    assertThat(
        e.getMessage(),
        is(
            "value must be one of: 'DEBUG', 'INFO', 'WARNING', 'ERROR', "
                + "'CRITICAL'"));
    assertThrows(
        IllegalArgumentException.class, () -> Prop.MODELS.set(map, -1));
    assertThrows(
        IllegalArgumentException.class, () -> Prop.MODELS.set(map, "3"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.MODELS.setLenient(map, "three"));
    final IllegalArgumentException e2 =
        assertThrows(
            IllegalArgumentException.class, () -> Prop.CLINGO.set(map, null));
    assertThat(e2.getMessage(), is("property clingo is required"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.TIMEOUT.setLenient(map, null));
    assertThat(Prop.CLINGO.stringValue(map), is("clingo"));
    assertThrows(
        IllegalArgumentException.class, () -> Prop.CLINGO.intValue(map));
  }
}

// End PropTest.java
