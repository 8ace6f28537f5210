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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Stream;
import net.hydromatic.typescan.type.Declaration;
import net.hydromatic.typescan.type.Module;
import net.hydromatic.typescan.type.Namespace;
import net.hydromatic.typescan.type.NamespaceOrType;
import net.hydromatic.typescan.type.TypeGraph;
import net.hydromatic.typescan.type.TypeNode;

/** Chooses the modules that a query scans, and lists their types. */
public class TypeScanner {
  private final TypeGraph graph;
  private final boolean scanNestedTypes;

  public TypeScanner(TypeGraph graph, boolean scanNestedTypes) {
    this.graph = requireNonNull(graph);
    this.scanNestedTypes = scanNestedTypes;
  }

  /**
   * Returns the modules to scan for a query.
   *
   * <p>If the query names a type with {@link Query#assemblyOfTypeName} and
   * the type exists, the module that declares it. Otherwise, if the query
   * has an {@link Query#assemblyNameFilter}, the modules reachable from the
   * declaring module (including itself) whose names match. Otherwise, the
   * declaring module.
   */
  public List<Module> selectModules(Query query, Module declaringModule) {
    if (query.assemblyOfTypeName != null) {
      final TypeNode type = graph.lookup(query.assemblyOfTypeName);
      if (type != null) {
        return ImmutableList.of(graph.moduleOf(type));
      }
    }
    if (query.assemblyNameFilter != null) {
      final WildcardPattern pattern =
          requireNonNull(WildcardPattern.compile(query.assemblyNameFilter));
      final ImmutableList.Builder<Module> b = ImmutableList.builder();
      for (Module module : graph.referenceClosure(declaringModule)) {
        if (pattern.matches(module.name)) {
          b.add(module);
        }
      }
      return b.build();
    }
    return ImmutableList.of(declaringModule);
  }

  /** Returns the types declared in several modules, module by module. */
  public Stream<TypeNode> typesOf(List<Module> modules) {
    return modules.stream().flatMap(this::typesOf);
  }

  /**
   * Returns the types declared in a module.
   *
   * <p>The traversal is depth-first and follows declaration order: each
   * type is followed by the types nested in it, and each namespace by its
   * contents. The stream is lazy.
   */
  public Stream<TypeNode> typesOf(Module module) {
    return typesOf(module.globalNamespace);
  }

  private Stream<TypeNode> typesOf(NamespaceOrType member) {
    if (member instanceof Namespace) {
      return ((Namespace) member).members().stream().flatMap(this::typesOf);
    }
    final Declaration declaration = (Declaration) member;
    final Stream<TypeNode> self = Stream.of(declaration.definition());
    if (!scanNestedTypes || declaration.nestedTypes().isEmpty()) {
      return self;
    }
    return Stream.concat(
        self, declaration.nestedTypes().stream().flatMap(this::typesOf));
  }
}

// End TypeScanner.java
