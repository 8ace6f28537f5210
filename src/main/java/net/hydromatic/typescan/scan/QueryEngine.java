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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import net.hydromatic.typescan.solve.Assignability;
import net.hydromatic.typescan.solve.AssignabilityResolver;
import net.hydromatic.typescan.solve.Binding;
import net.hydromatic.typescan.solve.ConstraintSolver;
import net.hydromatic.typescan.solve.Generalization;
import net.hydromatic.typescan.solve.HandlerSignature;
import net.hydromatic.typescan.type.Module;
import net.hydromatic.typescan.type.TypeGraph;
import net.hydromatic.typescan.type.TypeKind;
import net.hydromatic.typescan.type.TypeNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates a {@link Query} against a {@link TypeGraph}.
 *
 * <p>Each candidate type goes through the filters of {@link Stage} in
 * order; the first filter it fails rejects it. A type that passes every
 * filter yields one {@link Match} per binding of the handler's type
 * parameters, or a single match if the query has no generic method handler.
 *
 * <p>An engine holds only its properties and tracer; any number of
 * evaluations may run at the same time, provided that the tracer allows it.
 */
public class QueryEngine {
  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  /**
   * Creates a QueryEngine.
   *
   * @param map Property values; properties not present have their default
   *     values
   * @param tracer Tracer
   */
  public QueryEngine(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a QueryEngine with default properties and no tracing. */
  public QueryEngine() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Evaluates a query.
   *
   * <p>Returns a lazy stream, which can be consumed only once. Matches are
   * in the order that the types occur in the scanned modules, and for each
   * type, in the order of its generalizations.
   */
  public Stream<Match> evaluate(Query query, TypeGraph graph) {
    final TypeScanner scanner =
        new TypeScanner(graph, Prop.SCAN_NESTED_TYPES.booleanValue(map));
    final Module declaringModule = graph.moduleOf(query.declaringType);
    final Evaluation evaluation = new Evaluation(query, graph);
    return scanner
        .typesOf(scanner.selectModules(query, declaringModule))
        .flatMap(type -> evaluation.matches(type).stream());
  }

  /**
   * Resolves a type name, and applies it to generic arguments if there are
   * any. Returns null if the name, or any argument, is not found.
   */
  private static @Nullable TypeNode resolve(
      TypeGraph graph,
      @Nullable String typeName,
      @Nullable List<String> genericArguments) {
    if (typeName == null) {
      return null;
    }
    final TypeNode type = graph.lookup(typeName);
    if (type == null || genericArguments == null) {
      return type;
    }
    final List<TypeNode> arguments = new ArrayList<>();
    for (String argumentName : genericArguments) {
      final TypeNode argument = graph.lookup(argumentName);
      if (argument == null) {
        return null;
      }
      arguments.add(argument);
    }
    return type.declaration.apply(arguments);
  }

  /** State of one call to {@link #evaluate}. */
  private class Evaluation {
    final Query query;
    final TypeGraph graph;
    final @Nullable TypeNode assignableTo;
    final @Nullable TypeNode excludeAssignableTo;
    final @Nullable TypeNode requiredMarker;
    final @Nullable TypeNode excludedMarker;
    final @Nullable WildcardPattern includePattern;
    final @Nullable WildcardPattern excludePattern;
    final ConstraintSolver solver;

    Evaluation(Query query, TypeGraph graph) {
      this.query = query;
      this.graph = graph;
      this.assignableTo =
          resolve(
              graph,
              query.assignableToTypeName,
              query.assignableToGenericArguments);
      this.excludeAssignableTo =
          resolve(
              graph,
              query.excludeAssignableToTypeName,
              query.excludeAssignableToGenericArguments);
      this.requiredMarker = resolve(graph, query.attributeFilterTypeName, null);
      this.excludedMarker =
          resolve(graph, query.excludeByAttributeTypeName, null);
      this.includePattern = WildcardPattern.compile(query.typeNameFilter);
      this.excludePattern = WildcardPattern.compile(query.excludeByTypeName);
      this.solver =
          new ConstraintSolver(
              Prop.CONSISTENT_CYCLES.booleanValue(map), tracer::onCycle);
    }

    private List<Match> reject(TypeNode type, Stage stage) {
      tracer.onReject(type, stage);
      return ImmutableList.of();
    }

    /** Returns the matches for a candidate type; empty if rejected. */
    List<Match> matches(TypeNode type) {
      tracer.onCandidate(type);
      if (type.kind() != TypeKind.CLASS
          || type.isAbstract()
          || !type.declaration.nameable
          || (type.isStatic() && !query.hasTypeMethodHandler())) {
        return reject(type, Stage.ELIGIBILITY);
      }
      if (type.isOpenGeneric() && query.handler != null) {
        return reject(type, Stage.GENERIC_ARITY);
      }
      if (query.attributeFilterTypeName != null
          && (requiredMarker == null
              || !type.markers().contains(requiredMarker))) {
        return reject(type, Stage.REQUIRED_MARKER);
      }
      if (excludedMarker != null && type.markers().contains(excludedMarker)) {
        return reject(type, Stage.EXCLUDED_MARKER);
      }
      final String name = type.displayName();
      if (!WildcardPattern.matches(includePattern, name)) {
        return reject(type, Stage.NAME_INCLUDE);
      }
      if (excludePattern != null && excludePattern.matches(name)) {
        return reject(type, Stage.NAME_EXCLUDE);
      }
      if (excludeAssignableTo != null
          && AssignabilityResolver.isAssignable(type, excludeAssignableTo)
              .assignable) {
        return reject(type, Stage.EXCLUDE_ASSIGNABLE);
      }
      List<Generalization> generalizations = ImmutableList.of();
      if (query.assignableToTypeName != null) {
        if (assignableTo == null) {
          return reject(type, Stage.ASSIGNABLE);
        }
        final Assignability assignability =
            AssignabilityResolver.isAssignable(type, assignableTo);
        if (!assignability.assignable) {
          return reject(type, Stage.ASSIGNABLE);
        }
        generalizations = assignability.generalizations;
      }
      final List<@Nullable Binding> bindings = new ArrayList<>();
      if (query.hasMethodHandler()) {
        bindings.addAll(bindings(type, generalizations));
        if (bindings.isEmpty()) {
          return reject(type, Stage.CONSTRAINTS);
        }
      } else {
        bindings.add(null);
      }
      if (!graph.isVisibleFrom(query.declaringType, type)) {
        return reject(type, Stage.VISIBILITY);
      }
      final List<Match> matches = new ArrayList<>();
      for (Binding binding : bindings) {
        final Match match = new Match(type, generalizations, binding);
        tracer.onMatch(match);
        matches.add(match);
      }
      return matches;
    }

    /**
     * Solves the handler's constraints once per generalization, or once if
     * the query has no assignable-to target.
     */
    private Set<Binding> bindings(
        TypeNode type, List<Generalization> generalizations) {
      final HandlerSignature signature =
          requireNonNull(query.handler).signature;
      final Set<Binding> bindings = new LinkedHashSet<>();
      if (generalizations.isEmpty()) {
        bindings.addAll(solver.solve(type, signature));
      } else {
        for (Generalization g : generalizations) {
          bindings.addAll(solver.solve(type, signature, g.target));
        }
      }
      return bindings;
    }
  }
}

// End QueryEngine.java
