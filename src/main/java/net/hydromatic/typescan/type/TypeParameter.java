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

import java.util.Map;

/**
 * Type parameter, e.g. {@code T} in {@code interface IHandler<T>} or {@code
 * THandler} in {@code void AddHandler<THandler, TArg>()}.
 *
 * <p>A type parameter is identified by its owner (the metadata name of the
 * declaration, or the name of the handler signature, that declares it) and
 * its ordinal. Its name is only for display.
 *
 * <p>Constraints are not part of the parameter. For parameters of a handler,
 * they are held by the signature, so that the constraints of one parameter
 * can refer to its siblings, and even to itself.
 */
public final class TypeParameter implements Type {
  public final String owner;
  public final int ordinal;
  public final String name;

  public TypeParameter(String owner, int ordinal, String name) {
    checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
    this.owner = requireNonNull(owner);
    this.ordinal = ordinal;
    this.name = requireNonNull(name);
  }

  @Override
  public int hashCode() {
    return hash(owner, ordinal);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeParameter
            && ordinal == ((TypeParameter) obj).ordinal
            && owner.equals(((TypeParameter) obj).owner);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public String displayName() {
    return name;
  }

  @Override
  public Type substitute(Map<TypeParameter, ? extends Type> map) {
    final Type type = map.get(this);
    return type != null ? type : this;
  }

  @Override
  public boolean hasTypeParameters() {
    return true;
  }
}

// End TypeParameter.java
