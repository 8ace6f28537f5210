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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;

/**
 * Module (assembly): a unit of compilation that declares types and refers
 * to other modules by name.
 */
public final class Module {
  public final String name;

  /** Names of directly referenced modules, in the order they were added. */
  public final ImmutableList<String> references;

  /** Names of modules that may see this module's internal types. */
  public final ImmutableSet<String> internalsVisibleTo;

  public final Namespace globalNamespace;

  Module(
      String name,
      List<String> references,
      Set<String> internalsVisibleTo,
      Namespace globalNamespace) {
    this.name = requireNonNull(name);
    this.references = ImmutableList.copyOf(references);
    this.internalsVisibleTo = ImmutableSet.copyOf(internalsVisibleTo);
    this.globalNamespace = requireNonNull(globalNamespace);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Module.java
