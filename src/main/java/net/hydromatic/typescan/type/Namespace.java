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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Namespace in a module.
 *
 * <p>Members are held in declaration order. A namespace that is declared
 * several times (say, in different source files) is a single namespace whose
 * members are in the order in which they were first declared.
 */
public final class Namespace implements NamespaceOrType {
  /** Simple name; empty for the global namespace. */
  public final String name;

  /** Full name, e.g. "{@code GeneratorTests.Services}"; empty if global. */
  public final String qualifiedName;

  private final ImmutableList<NamespaceOrType> members;

  Namespace(String name, String qualifiedName, List<NamespaceOrType> members) {
    this.name = requireNonNull(name);
    this.qualifiedName = requireNonNull(qualifiedName);
    this.members = ImmutableList.copyOf(members);
  }

  @Override
  public String name() {
    return name;
  }

  /** Returns whether this is the global namespace of a module. */
  public boolean isGlobal() {
    return qualifiedName.isEmpty();
  }

  /** Returns the nested namespaces and types, in declaration order. */
  public List<NamespaceOrType> members() {
    return members;
  }

  @Override
  public String toString() {
    return isGlobal() ? "<global namespace>" : qualifiedName;
  }
}

// End Namespace.java
