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

import java.util.Map;

/**
 * Type: either a {@link TypeNode} (a declaration, possibly applied to type
 * arguments) or a {@link TypeParameter}.
 *
 * <p>Types are values. Two types are equal if they have the same structure,
 * regardless of which edge of the type graph they were reached through.
 */
public interface Type {
  /**
   * Name of the type as it would be written in source code, e.g. "{@code
   * GeneratorTests.IHandler<string>}", "{@code T}", "{@code int}".
   */
  String displayName();

  /**
   * Returns this type with each type parameter that is a key in {@code map}
   * replaced by its value.
   */
  Type substitute(Map<TypeParameter, ? extends Type> map);

  /** Returns whether this type mentions any type parameter. */
  boolean hasTypeParameters();
}

// End Type.java
