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
package net.hydromatic.asp.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.asp.util.Static.isIdentifier;
import static net.hydromatic.asp.util.Static.isLowerIdentifier;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Definition of a kind of predicate: its name, its ordered list of fields,
 * an optional namespace, and whether its instances are shown in solutions.
 *
 * <p>A schema is a factory for {@link Ast.Predicate} instances. For
 * example,
 *
 * <blockquote><pre>
 * Schema cell = Schema.define("cell", "row", "col");
 * Ast.Predicate p = cell.of(1, ast.var("C"));  // renders "cell(1, C)"
 * </pre></blockquote>
 *
 * <p>Schemas have identity semantics; two calls to {@code define} with the
 * same arguments create distinct schemas, but their instances are equal if
 * their arguments are equal.
 */
public class Schema {
  public final String name;
  public final ImmutableList<String> fields;
  /** Namespace; empty string if none. */
  public final String namespace;
  public final boolean show;
  private Ast.@Nullable ConditionalLiteral showFilter;

  private Schema(
      String name, List<String> fields, String namespace, boolean show) {
    this.name = requireNonNull(name);
    this.fields = ImmutableList.copyOf(fields);
    this.namespace = requireNonNull(namespace);
    this.show = show;
    checkArgument(
        isLowerIdentifier(name),
        "Predicate name must start with a lower-case letter and contain only "
            + "letters, digits and underscores: '%s'",
        name);
    checkArgument(
        namespace.isEmpty() || isIdentifier(namespace),
        "Invalid namespace: '%s'",
        namespace);
    final Set<String> seen = new HashSet<>();
    for (String field : fields) {
      checkArgument(isIdentifier(field), "Invalid field name: '%s'", field);
      checkArgument(seen.add(field), "Duplicate field name: '%s'", field);
    }
  }

  /** Defines a schema with no namespace that is shown. */
  public static Schema define(String name, String... fields) {
    return new Schema(name, ImmutableList.copyOf(fields), "", true);
  }

  /** Defines a schema. */
  public static Schema define(
      String name, List<String> fields, String namespace, boolean show) {
    return new Schema(name, fields, namespace, show);
  }

  /** Returns a copy of this schema in a different namespace. */
  public Schema withNamespace(String namespace) {
    final Schema schema = new Schema(name, fields, namespace, show);
    schema.showFilter = showFilter;
    return schema;
  }

  /** Returns a copy of this schema that is not shown. */
  public Schema hidden() {
    return new Schema(name, fields, namespace, false);
  }

  /**
   * Returns the name as rendered, "namespace_name", or just "name" if there
   * is no namespace.
   */
  public String qualifiedName() {
    return namespace.isEmpty() ? name : namespace + "_" + name;
  }

  /** Returns the number of fields. */
  public int arity() {
    return fields.size();
  }

  /** Returns the ordinal of a field; throws if there is no such field. */
  public int fieldIndex(String field) {
    final int i = fields.indexOf(field);
    checkArgument(
        i >= 0, "Predicate %s has no field '%s'", qualifiedName(), field);
    return i;
  }

  /**
   * Creates an instance from positional arguments.
   *
   * <p>Each argument may be an {@link Integer}, which is converted to a
   * constant, a {@link String}, which is converted to a string constant, or a
   * value, predicate, expression or pool.
   */
  public Ast.Predicate of(Object... arguments) {
    checkArgument(
        arguments.length == fields.size(),
        "Predicate %s expects %s arguments (%s), got %s",
        qualifiedName(),
        fields.size(),
        fields,
        arguments.length);
    final List<Term> terms = new ArrayList<>();
    for (int i = 0; i < arguments.length; i++) {
      terms.add(toArgument(fields.get(i), arguments[i]));
    }
    return new Ast.Predicate(this, terms);
  }

  /** Creates an instance from a map of field names to arguments. */
  public Ast.Predicate with(Map<String, ?> arguments) {
    for (String key : arguments.keySet()) {
      fieldIndex(key);
    }
    final List<Term> terms = new ArrayList<>();
    for (String field : fields) {
      checkArgument(
          arguments.containsKey(field),
          "Missing value for field '%s' of predicate %s",
          field,
          qualifiedName());
      terms.add(toArgument(field, arguments.get(field)));
    }
    return new Ast.Predicate(this, terms);
  }

  private Term toArgument(String field, @Nullable Object o) {
    if (o instanceof Integer) {
      return new Ast.Constant((Integer) o);
    }
    if (o instanceof String) {
      return new Ast.StringConstant((String) o);
    }
    if (o instanceof Ast.Value
        || o instanceof Ast.Predicate
        || o instanceof Ast.Expression
        || o instanceof Ast.Pool) {
      return (Term) o;
    }
    throw new IllegalArgumentException(
        String.format(
            "Field '%s' of predicate %s must be an int, string, value, "
                + "predicate, expression or pool; got %s",
            field,
            qualifiedName(),
            Ast.describe(o)));
  }

  /**
   * Restricts the show directive to instances that satisfy a conditional
   * literal, for example "#show p(X) : p(X), not q(X).", or removes the
   * restriction if {@code filter} is null.
   */
  public void setShowFilter(Ast.@Nullable ConditionalLiteral filter) {
    this.showFilter = filter;
  }

  /** Returns the show filter, or null. */
  public Ast.@Nullable ConditionalLiteral showFilter() {
    return showFilter;
  }

  /**
   * Returns the show directive for this schema, for example "#show p/2.", or
   * null if the schema is not shown.
   */
  public @Nullable String showDirective() {
    if (!show) {
      return null;
    }
    if (showFilter != null) {
      return "#show " + showFilter.render() + ".";
    }
    return "#show " + qualifiedName() + "/" + arity() + ".";
  }

  @Override
  public String toString() {
    return qualifiedName() + "/" + arity();
  }
}

// End Schema.java
