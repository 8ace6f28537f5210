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
package net.hydromatic.typescan.solve;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.typescan.type.TypeNode;
import net.hydromatic.typescan.type.TypeParameter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assignment of types to the type parameters of a handler, in parameter
 * order; for example, {@code {THandler=SpecificHandler1, TCommand=string}}.
 */
public final class Binding {
  /** Binding of a signature with no type parameters. */
  public static final Binding EMPTY = new Binding(ImmutableMap.of());

  private final ImmutableMap<TypeParameter, TypeNode> map;

  private Binding(ImmutableMap<TypeParameter, TypeNode> map) {
    this.map = map;
  }

  /**
   * Creates a binding for a signature.
   *
   * @throws IllegalArgumentException if a parameter is not bound
   */
  public static Binding of(
      HandlerSignature signature, Map<TypeParameter, TypeNode> map) {
    final ImmutableMap.Builder<TypeParameter, TypeNode> b =
        ImmutableMap.builder();
    for (TypeParameter p : signature.parameters) {
      final TypeNode type = map.get(p);
      checkArgument(type != null, "parameter %s is not bound", p);
      b.put(p, type);
    }
    return new Binding(b.build());
  }

  /** Returns the type bound to a parameter, or null. */
  public @Nullable TypeNode get(TypeParameter parameter) {
    return map.get(parameter);
  }

  /** Returns the type bound to the {@code ordinal}th parameter. */
  public TypeNode get(int ordinal) {
    return map.values().asList().get(ordinal);
  }

  /** Returns the bound types, in parameter order. */
  public ImmutableList<TypeNode> types() {
    return map.values().asList();
  }

  public ImmutableMap<TypeParameter, TypeNode> asMap() {
    return map;
  }

  public int size() {
    return map.size();
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Binding && map.equals(((Binding) obj).map);
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End Binding.java
