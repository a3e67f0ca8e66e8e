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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls solving.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Integer property "models" is the maximum number of models to compute.
   * Default is 0, which means all models.
   */
  MODELS("models", Integer.class, 0),

  /**
   * Integer property "timeout" is the number of seconds after which the
   * engine stops searching. Default is 0, which means no limit.
   */
  TIMEOUT("timeout", Integer.class, 0),

  /**
   * Enum property "stopOnLevel" is the severity of engine message at which
   * solving is abandoned. Default is {@link LogLevel#INFO}, so that even an
   * informational message (such as "atom does not occur in any rule head")
   * stops solving.
   */
  STOP_ON_LEVEL("stopOnLevel", LogLevel.class, LogLevel.INFO),

  /**
   * String property "clingo" is the path of the clingo executable. Default is
   * "clingo", which is found on the {@code PATH}.
   */
  CLINGO("clingo", String.class, "clingo");

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  /** Prefix of system properties that override defaults; "asp.models". */
  public static final String SYSTEM_PREFIX = "asp.";

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Creates a map of property values from system properties whose names
   * start with {@link #SYSTEM_PREFIX}, for example "-Dasp.timeout=10".
   */
  public static Map<Prop, Object> fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /** Creates a map of property values from a set of properties. */
  public static Map<Prop, Object> fromProperties(Properties properties) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (Prop prop : BY_CAMEL_NAME) {
      final String value =
          properties.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing strings for enum and integer
   * types.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    if (type == Integer.class && value instanceof String) {
      try {
        set(map, Integer.valueOf(((String) value).trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be an integer", e);
      }
      return;
    }
    set(map, value);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A property
   * cannot be unset; to restore its default value, set the default.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      throw new IllegalArgumentException(
          "property " + camelName + " is required");
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property must have type " + type);
    }
    if (type == Integer.class) {
      checkArgument(
          (Integer) value >= 0,
          "value for property %s must not be negative",
          camelName);
    }
    map.put(this, value);
  }
}

// End Prop.java
