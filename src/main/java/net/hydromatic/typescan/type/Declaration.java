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
package net.hydromatic.typescan.type;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declared type: a class, interface, struct or enum, in a namespace of a
 * module, possibly nested in another declaration.
 *
 * <p>The header of a declaration (its name, kind, modifiers and type
 * parameters) is fixed when it is created. Its edges (base type, interfaces,
 * marker tags, constructors and nested types) are defined exactly once,
 * after every declaration in the graph exists, so that declarations can
 * refer to each other in cycles such as {@code SmthX : ISmth<SmthY>}, {@code
 * SmthY : ISmth<SmthX>}. Only {@link TypeGraph.Builder} defines edges.
 *
 * <p>The edges refer to the declaration's own type parameters; see {@link
 * TypeNode} for the edges of an instantiation.
 */
public final class Declaration implements NamespaceOrType {
  public final String moduleName;

  /** Namespace, e.g. "{@code GeneratorTests}"; empty if global. */
  public final String namespace;

  public final @Nullable Declaration container;
  public final String name;
  public final TypeKind kind;
  public final ImmutableSet<Modifier> modifiers;
  public final Accessibility accessibility;

  /** Whether the type can be referred to by name in source code. */
  public final boolean nameable;

  /** Whether a value of this type holds no references (structs only). */
  public final boolean unmanaged;

  /** Keyword alias, e.g. "{@code string}" for {@code System.String}. */
  public final @Nullable String keyword;

  public final ImmutableList<TypeParameter> typeParameters;

  private final String metadataName;
  private final String qualifiedName;
  private final TypeNode definition;
  private @Nullable Edges edges;

  Declaration(
      String moduleName,
      String namespace,
      @Nullable Declaration container,
      String name,
      TypeKind kind,
      Set<Modifier> modifiers,
      Accessibility accessibility,
      boolean nameable,
      boolean unmanaged,
      @Nullable String keyword,
      List<String> typeParameterNames) {
    this.moduleName = requireNonNull(moduleName);
    this.namespace = requireNonNull(namespace);
    this.container = container;
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.modifiers = Sets.immutableEnumSet(modifiers);
    this.accessibility = requireNonNull(accessibility);
    this.nameable = nameable;
    this.unmanaged = unmanaged;
    this.keyword = keyword;
    checkArgument(
        !unmanaged || kind.isValueType(), "only value types are unmanaged");

    final String suffix =
        typeParameterNames.isEmpty() ? "" : "`" + typeParameterNames.size();
    if (container != null) {
      checkArgument(
          container.moduleName.equals(moduleName)
              && container.namespace.equals(namespace),
          "nested type must be in the module and namespace of its container");
      this.metadataName = container.metadataName + "+" + name + suffix;
      this.qualifiedName = container.qualifiedName + "." + name;
    } else {
      final String prefix = namespace.isEmpty() ? "" : namespace + ".";
      this.metadataName = prefix + name + suffix;
      this.qualifiedName = prefix + name;
    }

    final ImmutableList.Builder<TypeParameter> b = ImmutableList.builder();
    for (int i = 0; i < typeParameterNames.size(); i++) {
      b.add(new TypeParameter(metadataName, i, typeParameterNames.get(i)));
    }
    this.typeParameters = b.build();
    this.definition = new TypeNode(this, ImmutableList.of());
  }

  /**
   * Defines the edges of this declaration. Called once, by {@link
   * TypeGraph.Builder#build()}.
   */
  void define(
      @Nullable TypeNode baseType,
      List<TypeNode> interfaces,
      List<TypeNode> markers,
      List<Constructor> constructors,
      List<Declaration> nestedTypes) {
    checkState(edges == null, "edges of %s are already defined", metadataName);
    this.edges =
        new Edges(baseType, interfaces, markers, constructors, nestedTypes);
  }

  private Edges edges() {
    checkState(edges != null, "edges of %s are not defined", metadataName);
    return edges;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return metadataName;
  }

  /**
   * Metadata name, which identifies the declaration within a graph, e.g.
   * "{@code GeneratorTests.IHandler`1}", "{@code GeneratorTests.Outer+Inner}".
   */
  public String metadataName() {
    return metadataName;
  }

  /**
   * Name including namespace and containing types, but not type parameters,
   * e.g. "{@code GeneratorTests.Outer.Inner}".
   */
  public String qualifiedName() {
    return qualifiedName;
  }

  /** Number of type parameters; 0 if the declaration is not generic. */
  public int arity() {
    return typeParameters.size();
  }

  /**
   * Returns whether this declaration or any declaration that contains it
   * has type parameters. Such a declaration cannot be instantiated without
   * type arguments.
   */
  public boolean isOpenGeneric() {
    for (Declaration d = this; d != null; d = d.container) {
      if (d.arity() > 0) {
        return true;
      }
    }
    return false;
  }

  public boolean isAbstract() {
    return modifiers.contains(Modifier.ABSTRACT);
  }

  public boolean isStatic() {
    return modifiers.contains(Modifier.STATIC);
  }

  /**
   * Returns the type that this declaration defines; for a generic
   * declaration, its open definition.
   */
  public TypeNode definition() {
    return definition;
  }

  /** Applies this declaration to type arguments. */
  public TypeNode apply(Type... typeArguments) {
    return apply(Arrays.asList(typeArguments));
  }

  /**
   * Applies this declaration to type arguments.
   *
   * <p>If there are no arguments, or the arguments are the declaration's own
   * type parameters, returns the definition.
   */
  public TypeNode apply(List<? extends Type> typeArguments) {
    if (typeArguments.isEmpty() || typeArguments.equals(typeParameters)) {
      return definition;
    }
    checkArgument(
        typeArguments.size() == arity(),
        "%s expects %s type arguments, got %s",
        metadataName,
        arity(),
        typeArguments.size());
    return new TypeNode(this, typeArguments);
  }

  /** Declared base type, in terms of this declaration's type parameters. */
  public @Nullable TypeNode baseType() {
    return edges().baseType;
  }

  /** Directly implemented interfaces, in declaration order. */
  public List<TypeNode> interfaces() {
    return edges().interfaces;
  }

  /** Marker tags (attributes) applied to this declaration. */
  public List<TypeNode> markers() {
    return edges().markers;
  }

  /**
   * Constructors, including the implicit constructor of a class that
   * declares none.
   */
  public List<Constructor> constructors() {
    return edges().constructors;
  }

  /** Nested types, in declaration order. */
  public List<Declaration> nestedTypes() {
    return edges().nestedTypes;
  }

  /** Edges of a declaration. */
  private static class Edges {
    final @Nullable TypeNode baseType;
    final ImmutableList<TypeNode> interfaces;
    final ImmutableList<TypeNode> markers;
    final ImmutableList<Constructor> constructors;
    final ImmutableList<Declaration> nestedTypes;

    Edges(
        @Nullable TypeNode baseType,
        List<TypeNode> interfaces,
        List<TypeNode> markers,
        List<Constructor> constructors,
        List<Declaration> nestedTypes) {
      this.baseType = baseType;
      this.interfaces = ImmutableList.copyOf(interfaces);
      this.markers = ImmutableList.copyOf(markers);
      this.constructors = ImmutableList.copyOf(constructors);
      this.nestedTypes = ImmutableList.copyOf(nestedTypes);
    }
  }
}

// End Declaration.java
