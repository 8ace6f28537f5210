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
import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.typescan.util.Static.anyMatch;
import static net.hydromatic.typescan.util.Static.transformEager;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Node in the type graph: a {@link Declaration} applied to zero or more type
 * arguments.
 *
 * <p>For a generic declaration, the node with no type arguments is the
 * <em>open definition</em> (e.g. {@code IHandler<>}); a node with type
 * arguments is an instantiation (e.g. {@code IHandler<string>}). A
 * non-generic declaration has exactly one node.
 *
 * <p>Identity is structural: two nodes are equal if they have the same
 * metadata name and equal type arguments.
 *
 * <p>The edges of an instantiation are those of its declaration, with the
 * type arguments substituted for the declaration's type parameters. They are
 * computed on first use.
 */
public final class TypeNode implements Type {
  public final Declaration declaration;
  public final ImmutableList<Type> typeArguments;

  private final Supplier<@Nullable TypeNode> baseTypeSupplier =
      Suppliers.memoize(this::computeBaseType);
  private final Supplier<ImmutableList<TypeNode>> interfacesSupplier =
      Suppliers.memoize(this::computeInterfaces);
  private final Supplier<ImmutableList<TypeNode>> allInterfacesSupplier =
      Suppliers.memoize(this::computeAllInterfaces);

  /** Called only from {@link Declaration}. */
  TypeNode(Declaration declaration, List<? extends Type> typeArguments) {
    this.declaration = requireNonNull(declaration);
    this.typeArguments = ImmutableList.copyOf(typeArguments);
    checkArgument(
        typeArguments.isEmpty() || typeArguments.size() == declaration.arity());
  }

  @Override
  public int hashCode() {
    return hash(declaration.metadataName(), typeArguments);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeNode
            && declaration
                .metadataName()
                .equals(((TypeNode) obj).declaration.metadataName())
            && typeArguments.equals(((TypeNode) obj).typeArguments);
  }

  @Override
  public String toString() {
    return displayName();
  }

  @Override
  public String displayName() {
    if (!isGeneric() && declaration.keyword != null) {
      return declaration.keyword;
    }
    final StringBuilder b = new StringBuilder(declaration.qualifiedName());
    if (isGeneric()) {
      final List<? extends Type> arguments =
          typeArguments.isEmpty() ? declaration.typeParameters : typeArguments;
      b.append('<');
      for (int i = 0; i < arguments.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(arguments.get(i).displayName());
      }
      b.append('>');
    }
    return b.toString();
  }

  @Override
  public TypeNode substitute(Map<TypeParameter, ? extends Type> map) {
    if (typeArguments.isEmpty() || map.isEmpty()) {
      return this;
    }
    final List<Type> arguments =
        transformEager(typeArguments, t -> t.substitute(map));
    if (arguments.equals(typeArguments)) {
      return this;
    }
    return declaration.apply(arguments);
  }

  @Override
  public boolean hasTypeParameters() {
    return anyMatch(typeArguments, Type::hasTypeParameters);
  }

  /** Metadata name of the declaration, e.g. "{@code NS.IHandler`1}". */
  public String metadataName() {
    return declaration.metadataName();
  }

  public TypeKind kind() {
    return declaration.kind;
  }

  public String moduleName() {
    return declaration.moduleName;
  }

  public Accessibility accessibility() {
    return declaration.accessibility;
  }

  public boolean isInterface() {
    return declaration.kind == TypeKind.INTERFACE;
  }

  public boolean isValueType() {
    return declaration.kind.isValueType();
  }

  /**
   * Returns whether this is a value type none of whose instances hold
   * references. Enums always are; structs are if so declared.
   */
  public boolean isUnmanaged() {
    return declaration.kind == TypeKind.ENUM || declaration.unmanaged;
  }

  public boolean isAbstract() {
    return declaration.isAbstract();
  }

  public boolean isStatic() {
    return declaration.isStatic();
  }

  /** Returns whether the declaration has type parameters. */
  public boolean isGeneric() {
    return declaration.arity() > 0;
  }

  /**
   * Returns whether the declaration, or a type containing it, has type
   * parameters; for example {@code Outer<T>.Inner}.
   */
  public boolean isOpenGeneric() {
    return declaration.isOpenGeneric();
  }

  /**
   * Returns whether this is the open definition of a generic declaration;
   * that is, generic but without type arguments.
   */
  public boolean isDefinition() {
    return isGeneric() && typeArguments.isEmpty();
  }

  /**
   * Returns the open definition of this type's declaration. For a
   * non-generic type, returns this type.
   */
  public TypeNode definition() {
    return declaration.definition();
  }

  /** Returns the base type, or null if this type has none. */
  public @Nullable TypeNode baseType() {
    return baseTypeSupplier.get();
  }

  /** Returns the directly implemented interfaces. */
  public List<TypeNode> interfaces() {
    return interfacesSupplier.get();
  }

  /**
   * Returns every interface this type implements, directly or indirectly,
   * without duplicates.
   *
   * <p>The order is stable: each direct interface followed by the interfaces
   * it extends, then the interfaces of the base type.
   */
  public List<TypeNode> allInterfaces() {
    return allInterfacesSupplier.get();
  }

  /** Returns the marker tags (attributes) applied to the declaration. */
  public List<TypeNode> markers() {
    return declaration.markers();
  }

  public List<Constructor> constructors() {
    return declaration.constructors();
  }

  /** Map from the declaration's type parameters to this type's arguments. */
  private Map<TypeParameter, Type> substitution() {
    if (typeArguments.isEmpty()) {
      return ImmutableMap.of();
    }
    final ImmutableMap.Builder<TypeParameter, Type> b = ImmutableMap.builder();
    for (int i = 0; i < typeArguments.size(); i++) {
      b.put(declaration.typeParameters.get(i), typeArguments.get(i));
    }
    return b.build();
  }

  private @Nullable TypeNode computeBaseType() {
    final TypeNode baseType = declaration.baseType();
    return baseType == null ? null : baseType.substitute(substitution());
  }

  private ImmutableList<TypeNode> computeInterfaces() {
    final Map<TypeParameter, Type> substitution = substitution();
    return ImmutableList.copyOf(
        transformEager(
            declaration.interfaces(), i -> i.substitute(substitution)));
  }

  private ImmutableList<TypeNode> computeAllInterfaces() {
    final Set<TypeNode> set = new LinkedHashSet<>();
    for (TypeNode i : interfaces()) {
      set.add(i);
      set.addAll(i.allInterfaces());
    }
    final TypeNode baseType = baseType();
    if (baseType != null) {
      set.addAll(baseType.allInterfaces());
    }
    return ImmutableList.copyOf(set);
  }
}

// End TypeNode.java
