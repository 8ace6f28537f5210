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
package net.hydromatic.typescan.scan;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import net.hydromatic.typescan.type.TypeNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Which types to find, and what to do with them.
 *
 * <p>A query is declared on a type (its {@link #declaringType}), which
 * determines the default module to scan and the position from which matched
 * types must be visible. Type names in a query are metadata names, such as
 * "{@code GeneratorTests.ICommandHandler`1}"; they are resolved when the
 * query is evaluated.
 *
 * <p>Every field except {@code declaringType} is optional. A query with no
 * optional fields matches every eligible type in the declaring module.
 */
public final class Query {
  public final TypeNode declaringType;

  /** Scan only the module that declares this type. */
  public final @Nullable String assemblyOfTypeName;

  /** Scan the referenced modules whose names match this wildcard filter. */
  public final @Nullable String assemblyNameFilter;

  public final @Nullable String assignableToTypeName;
  public final @Nullable ImmutableList<String> assignableToGenericArguments;
  public final @Nullable String excludeAssignableToTypeName;
  public final @Nullable ImmutableList<String>
      excludeAssignableToGenericArguments;

  /** Marker that a type must have. */
  public final @Nullable String attributeFilterTypeName;

  /** Marker that a type must not have. */
  public final @Nullable String excludeByAttributeTypeName;

  public final @Nullable String typeNameFilter;
  public final @Nullable String excludeByTypeName;
  public final @Nullable Handler handler;

  private Query(Builder b) {
    this.declaringType = requireNonNull(b.declaringType);
    this.assemblyOfTypeName = b.assemblyOfTypeName;
    this.assemblyNameFilter = b.assemblyNameFilter;
    this.assignableToTypeName = b.assignableToTypeName;
    this.assignableToGenericArguments = b.assignableToGenericArguments;
    this.excludeAssignableToTypeName = b.excludeAssignableToTypeName;
    this.excludeAssignableToGenericArguments =
        b.excludeAssignableToGenericArguments;
    this.attributeFilterTypeName = b.attributeFilterTypeName;
    this.excludeByAttributeTypeName = b.excludeByAttributeTypeName;
    this.typeNameFilter = b.typeNameFilter;
    this.excludeByTypeName = b.excludeByTypeName;
    this.handler = b.handler;
    checkArgument(
        assignableToGenericArguments == null || assignableToTypeName != null,
        "generic arguments require a target");
    checkArgument(
        excludeAssignableToGenericArguments == null
            || excludeAssignableToTypeName != null,
        "generic arguments require a target");
  }

  /** Creates a builder of a query declared on a given type. */
  public static Builder builder(TypeNode declaringType) {
    return new Builder(declaringType);
  }

  /** Returns whether the handler, if any, is a generic method. */
  public boolean hasMethodHandler() {
    return handler != null && handler.kind == Handler.Kind.METHOD;
  }

  /** Returns whether the handler, if any, is a method of each type. */
  public boolean hasTypeMethodHandler() {
    return handler != null && handler.kind == Handler.Kind.TYPE_METHOD;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("Query{");
    append(b, "assemblyOfType", assemblyOfTypeName);
    append(b, "assemblyNameFilter", assemblyNameFilter);
    append(b, "assignableTo", assignableToTypeName);
    append(b, "assignableToGenericArguments", assignableToGenericArguments);
    append(b, "excludeAssignableTo", excludeAssignableToTypeName);
    append(
        b,
        "excludeAssignableToGenericArguments",
        excludeAssignableToGenericArguments);
    append(b, "attributeFilter", attributeFilterTypeName);
    append(b, "excludeByAttribute", excludeByAttributeTypeName);
    append(b, "typeNameFilter", typeNameFilter);
    append(b, "excludeByTypeName", excludeByTypeName);
    append(b, "handler", handler);
    return b.append('}').toString();
  }

  private static void append(
      StringBuilder b, String name, @Nullable Object value) {
    if (value != null) {
      if (b.charAt(b.length() - 1) != '{') {
        b.append(", ");
      }
      b.append(name).append('=').append(value);
    }
  }

  /** Builder for a {@link Query}. */
  public static final class Builder {
    private final TypeNode declaringType;
    private @Nullable String assemblyOfTypeName;
    private @Nullable String assemblyNameFilter;
    private @Nullable String assignableToTypeName;
    private @Nullable ImmutableList<String> assignableToGenericArguments;
    private @Nullable String excludeAssignableToTypeName;
    private @Nullable ImmutableList<String>
        excludeAssignableToGenericArguments;
    private @Nullable String attributeFilterTypeName;
    private @Nullable String excludeByAttributeTypeName;
    private @Nullable String typeNameFilter;
    private @Nullable String excludeByTypeName;
    private @Nullable Handler handler;

    private Builder(TypeNode declaringType) {
      this.declaringType = requireNonNull(declaringType);
    }

    @CanIgnoreReturnValue
    public Builder assemblyOfType(String typeName) {
      this.assemblyOfTypeName = requireNonNull(typeName);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder assemblyNameFilter(String filter) {
      this.assemblyNameFilter = requireNonNull(filter);
      return this;
    }

    /**
     * Sets the target that types must be assignable to, optionally with
     * generic arguments that close an open target.
     */
    @CanIgnoreReturnValue
    public Builder assignableTo(String typeName, String... genericArguments) {
      this.assignableToTypeName = requireNonNull(typeName);
      this.assignableToGenericArguments = arguments(genericArguments);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder excludeAssignableTo(
        String typeName, String... genericArguments) {
      this.excludeAssignableToTypeName = requireNonNull(typeName);
      this.excludeAssignableToGenericArguments = arguments(genericArguments);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attributeFilter(String typeName) {
      this.attributeFilterTypeName = requireNonNull(typeName);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder excludeByAttribute(String typeName) {
      this.excludeByAttributeTypeName = requireNonNull(typeName);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder typeNameFilter(String filter) {
      this.typeNameFilter = requireNonNull(filter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder excludeByTypeName(String filter) {
      this.excludeByTypeName = requireNonNull(filter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder handler(Handler handler) {
      this.handler = requireNonNull(handler);
      return this;
    }

    private static @Nullable ImmutableList<String> arguments(
        String[] genericArguments) {
      if (genericArguments.length == 0) {
        return null;
      }
      return ImmutableList.copyOf(genericArguments);
    }

    public Query build() {
      return new Query(this);
    }
  }
}

// End Query.java
