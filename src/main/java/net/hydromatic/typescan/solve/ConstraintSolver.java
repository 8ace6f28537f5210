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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import net.hydromatic.typescan.type.Constructor;
import net.hydromatic.typescan.type.Type;
import net.hydromatic.typescan.type.TypeNode;
import net.hydromatic.typescan.type.TypeParameter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the bindings of a handler's type parameters that a candidate type
 * admits.
 *
 * <p>The first parameter is bound to the candidate. Other parameters are
 * bound only while checking constraints: if the first parameter has the
 * constraint {@code ICommandHandler<TCommand>} and the candidate implements
 * {@code ICommandHandler<string>}, then {@code TCommand} is bound to {@code
 * string}, and must in turn satisfy its own constraints.
 *
 * <p>A candidate that implements a constraint's interface more than once
 * gives rise to several bindings. The solver explores each alternative
 * separately, carrying an immutable {@link State}; a parameter that already
 * has a binding in a state is not checked again, which guarantees
 * termination when constraints are cyclic.
 *
 * <p>The solver has no state of its own between calls; it is safe to use
 * from several threads.
 */
public class ConstraintSolver {
  private final boolean consistentCycles;
  private final BiConsumer<TypeParameter, TypeNode> onCycle;

  /**
   * Creates a ConstraintSolver.
   *
   * @param consistentCycles Whether a type met again, when following a cycle
   *     of constraints back to a parameter that is already bound, must equal
   *     the type the parameter is bound to; if false, any type is accepted
   * @param onCycle Called each time a cycle is followed back to a parameter
   */
  public ConstraintSolver(
      boolean consistentCycles, BiConsumer<TypeParameter, TypeNode> onCycle) {
    this.consistentCycles = consistentCycles;
    this.onCycle = requireNonNull(onCycle);
  }

  /**
   * Returns every binding of {@code signature}'s parameters whose first
   * parameter is {@code candidate}; empty if the constraints cannot be
   * satisfied.
   */
  public List<Binding> solve(TypeNode candidate, HandlerSignature signature) {
    return solve(candidate, signature, null);
  }

  /**
   * Returns every binding of {@code signature}'s parameters whose first
   * parameter is {@code candidate}, considering only one generalization.
   *
   * <p>If {@code pinned} is not null, a constraint on the first parameter
   * whose generic definition is that of {@code pinned} is aligned only
   * against {@code pinned}, not against every instantiation of the
   * definition that the candidate implements.
   *
   * @param candidate Type to bind to the first parameter
   * @param signature Handler signature
   * @param pinned Generalization to use, or null
   * @return Distinct bindings, in the order found; empty if there is none
   */
  public List<Binding> solve(
      TypeNode candidate,
      HandlerSignature signature,
      @Nullable TypeNode pinned) {
    if (signature.parameters.isEmpty()) {
      return ImmutableList.of(Binding.EMPTY);
    }
    final Solution solution = new Solution(signature, pinned);
    final Set<Binding> bindings = new LinkedHashSet<>();
    for (State state
        : solution.satisfies(State.EMPTY, candidate,
            signature.parameters.get(0))) {
      if (solution.isComplete(state)) {
        bindings.add(Binding.of(signature, state.bindings));
      }
    }
    return ImmutableList.copyOf(bindings);
  }

  /** Returns whether a type meets the kind constraints of a parameter. */
  static boolean satisfiesFlags(
      TypeNode type, HandlerSignature.Constraints constraints) {
    for (ConstraintFlag flag : constraints.flags) {
      switch (flag) {
        case REFERENCE_TYPE:
          if (type.isValueType()) {
            return false;
          }
          break;
        case VALUE_TYPE:
          if (!type.isValueType()) {
            return false;
          }
          break;
        case UNMANAGED:
          if (!type.isValueType() || !type.isUnmanaged()) {
            return false;
          }
          break;
        case CONSTRUCTOR:
          if (type.constructors().stream()
              .noneMatch(Constructor::isPublicParameterless)) {
            return false;
          }
          break;
        default:
          throw new AssertionError(flag);
      }
    }
    return true;
  }

  private static boolean sameDefinition(TypeNode type1, TypeNode type2) {
    return type1.definition().equals(type2.definition());
  }

  /** Applies a function to each state and concatenates the results. */
  private static List<State> flatMap(
      List<State> states, Function<State, List<State>> fn) {
    if (states.size() == 1) {
      return fn.apply(states.get(0));
    }
    final List<State> list = new ArrayList<>();
    for (State state : states) {
      list.addAll(fn.apply(state));
    }
    return list;
  }

  /**
   * Bindings found so far along one line of exploration. The parameters
   * bound are also the parameters visited.
   */
  private static class State {
    static final State EMPTY = new State(ImmutableMap.of());

    final ImmutableMap<TypeParameter, TypeNode> bindings;

    private State(ImmutableMap<TypeParameter, TypeNode> bindings) {
      this.bindings = bindings;
    }

    State bind(TypeParameter parameter, TypeNode type) {
      return new State(
          ImmutableMap.<TypeParameter, TypeNode>builder()
              .putAll(bindings)
              .put(parameter, type)
              .build());
    }
  }

  /** Work space for one call to {@link #solve}. */
  private class Solution {
    final HandlerSignature signature;
    final @Nullable TypeNode pinned;

    Solution(HandlerSignature signature, @Nullable TypeNode pinned) {
      this.signature = signature;
      this.pinned = pinned;
    }

    /**
     * Returns the states in which {@code type} is bound to {@code parameter}
     * and the parameter's constraints hold.
     */
    List<State> satisfies(State state, Type type, TypeParameter parameter) {
      if (!(type instanceof TypeNode)) {
        return ImmutableList.of();
      }
      final TypeNode node = (TypeNode) type;
      final TypeNode bound = state.bindings.get(parameter);
      if (bound != null) {
        onCycle.accept(parameter, node);
        return !consistentCycles || bound.equals(node)
            ? ImmutableList.of(state)
            : ImmutableList.of();
      }
      final HandlerSignature.Constraints constraints =
          signature.constraints(parameter);
      if (!satisfiesFlags(node, constraints)) {
        return ImmutableList.of();
      }
      List<State> states = ImmutableList.of(state.bind(parameter, node));
      for (Type constraint : constraints.types) {
        states =
            flatMap(states, s -> satisfiesType(s, node, parameter, constraint));
        if (states.isEmpty()) {
          break;
        }
      }
      return states;
    }

    /**
     * Returns the states in which {@code type}, bound to {@code parameter},
     * satisfies one of the parameter's constraint types.
     */
    private List<State> satisfiesType(
        State state, TypeNode type, TypeParameter parameter, Type constraint) {
      if (!(constraint instanceof TypeNode)) {
        // Constraint is a parameter, as in "where T : U"; checked when every
        // parameter is bound.
        return ImmutableList.of(state);
      }
      final TypeNode c = (TypeNode) constraint;
      if (!c.hasTypeParameters()) {
        return AssignabilityResolver.isAssignable(type, c).assignable
            ? ImmutableList.of(state)
            : ImmutableList.of();
      }
      List<TypeNode> targets =
          AssignabilityResolver.isAssignable(type, c.definition()).targets();
      if (pinned != null
          && parameter.ordinal == 0
          && pinned.definition().equals(c.definition())) {
        targets =
            targets.contains(pinned)
                ? ImmutableList.of(pinned)
                : ImmutableList.of();
      }
      final List<State> list = new ArrayList<>();
      for (TypeNode target : targets) {
        list.addAll(align(state, c, target));
      }
      return list;
    }

    /**
     * Aligns the type arguments of a constraint type with those of a type
     * that has the same generic definition. Where the constraint has a
     * parameter, binds it; where the constraint has a generic type that
     * mentions parameters, aligns recursively; elsewhere, requires the
     * arguments to be equal.
     */
    private List<State> align(State state, TypeNode constraint, TypeNode type) {
      if (constraint.typeArguments.size() != type.typeArguments.size()) {
        return ImmutableList.of();
      }
      List<State> states = ImmutableList.of(state);
      for (int i = 0; i < constraint.typeArguments.size(); i++) {
        final Type c = constraint.typeArguments.get(i);
        final Type t = type.typeArguments.get(i);
        if (c instanceof TypeParameter
            && signature.isParameter((TypeParameter) c)) {
          states = flatMap(states, s -> satisfies(s, t, (TypeParameter) c));
        } else if (c instanceof TypeNode
            && c.hasTypeParameters()
            && t instanceof TypeNode
            && sameDefinition((TypeNode) c, (TypeNode) t)) {
          states = flatMap(states, s -> align(s, (TypeNode) c, (TypeNode) t));
        } else if (!c.equals(t)) {
          return ImmutableList.of();
        }
        if (states.isEmpty()) {
          break;
        }
      }
      return states;
    }

    /**
     * Returns whether every parameter is bound, and each constraint that is
     * itself a parameter holds.
     */
    boolean isComplete(State state) {
      if (state.bindings.size() != signature.parameters.size()) {
        return false;
      }
      for (TypeParameter p : signature.parameters) {
        final TypeNode type = requireNonNull(state.bindings.get(p));
        for (Type constraint : signature.constraints(p).types) {
          if (constraint instanceof TypeParameter) {
            final TypeNode bound = state.bindings.get(constraint);
            if (bound == null
                || !AssignabilityResolver.isAssignable(type, bound)
                    .assignable) {
              return false;
            }
          }
        }
      }
      return true;
    }
  }
}

// End ConstraintSolver.java
