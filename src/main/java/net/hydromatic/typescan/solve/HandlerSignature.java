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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.typescan.type.Type;
import net.hydromatic.typescan.type.TypeParameter;

/**
 * Generic signature of a handler method: its type parameters and their
 * constraints.
 *
 * <p>For example, the signature of
 *
 * <pre>{@code
 * void Handle<THandler, TCommand>()
 *     where THandler : class, ICommandHandler<TCommand>
 *     where TCommand : ISpecificCommand
 * }</pre>
 *
 * <p>has parameters {@code THandler} and {@code TCommand}. The first
 * parameter stands for the matched type; the others are bound by solving
 * constraints.
 *
 * <p>Constraints are held here, rather than in the parameters, so that the
 * constraints of one parameter can refer to another, or to itself.
 */
public final class HandlerSignature {
  /** Signature with no type parameters. */
  public static final HandlerSignature EMPTY = builder("").build();

  public final String name;
  public final ImmutableList<TypeParameter> parameters;
  private final ImmutableMap<TypeParameter, Constraints> constraints;

  private HandlerSignature(
      String name,
      List<TypeParameter> parameters,
      Map<TypeParameter, Constraints> constraints) {
    this.name = requireNonNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.constraints = ImmutableMap.copyOf(constraints);
  }

  /** Creates a builder of a signature for a method with a given name. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns whether a type parameter belongs to this signature. */
  public boolean isParameter(TypeParameter parameter) {
    return constraints.containsKey(parameter);
  }

  /** Returns the constraints of one of this signature's parameters. */
  public Constraints constraints(TypeParameter parameter) {
    final Constraints c = constraints.get(parameter);
    checkArgument(c != null, "%s is not a parameter of %s", parameter, name);
    return c;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(name);
    if (!parameters.isEmpty()) {
      b.append('<');
      for (TypeParameter p : parameters) {
        if (p.ordinal > 0) {
          b.append(", ");
        }
        b.append(p.name);
      }
      b.append('>');
    }
    for (TypeParameter p : parameters) {
      final Constraints c = constraints(p);
      if (!c.isEmpty()) {
        b.append(" where ").append(p.name).append(" : ").append(c);
      }
    }
    return b.toString();
  }

  /** Constraints on a type parameter. */
  public static final class Constraints {
    public final ImmutableSet<ConstraintFlag> flags;

    /**
     * Types the argument must be assignable to, in declaration order. A
     * type may mention parameters of the signature.
     */
    public final ImmutableList<Type> types;

    Constraints(Set<ConstraintFlag> flags, List<Type> types) {
      this.flags = Sets.immutableEnumSet(flags);
      this.types = ImmutableList.copyOf(types);
    }

    public boolean isEmpty() {
      return flags.isEmpty() && types.isEmpty();
    }

    @Override
    public String toString() {
      final List<String> list = new ArrayList<>();
      if (flags.contains(ConstraintFlag.REFERENCE_TYPE)) {
        list.add("class");
      }
      if (flags.contains(ConstraintFlag.VALUE_TYPE)) {
        list.add("struct");
      }
      if (flags.contains(ConstraintFlag.UNMANAGED)) {
        list.add("unmanaged");
      }
      types.forEach(t -> list.add(t.displayName()));
      if (flags.contains(ConstraintFlag.CONSTRUCTOR)) {
        list.add("new()");
      }
      return String.join(", ", list);
    }
  }

  /** Builder for a {@link HandlerSignature}. */
  public static final class Builder {
    private final String name;
    private final List<TypeParameter> parameters = new ArrayList<>();
    private final Map<TypeParameter, Set<ConstraintFlag>> flags =
        new LinkedHashMap<>();
    private final Map<TypeParameter, List<Type>> types = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = requireNonNull(name);
    }

    /**
     * Adds a type parameter. The parameter can be used in constraints
     * before the signature is built.
     */
    public TypeParameter parameter(String parameterName) {
      final TypeParameter p =
          new TypeParameter(name, parameters.size(), parameterName);
      parameters.add(p);
      flags.put(p, EnumSet.noneOf(ConstraintFlag.class));
      types.put(p, new ArrayList<>());
      return p;
    }

    /** Adds kind constraints to a parameter. */
    @CanIgnoreReturnValue
    public Builder flags(TypeParameter parameter, ConstraintFlag... flags) {
      checkParameter(parameter);
      this.flags.get(parameter).addAll(Arrays.asList(flags));
      return this;
    }

    /** Adds constraint types to a parameter. */
    @CanIgnoreReturnValue
    public Builder constraint(TypeParameter parameter, Type... types) {
      checkParameter(parameter);
      this.types.get(parameter).addAll(Arrays.asList(types));
      return this;
    }

    private void checkParameter(TypeParameter parameter) {
      checkArgument(
          flags.containsKey(parameter),
          "%s is not a parameter of %s",
          parameter,
          name);
    }

    public HandlerSignature build() {
      final Map<TypeParameter, Constraints> constraints =
          new LinkedHashMap<>();
      for (TypeParameter p : parameters) {
        constraints.put(p, new Constraints(flags.get(p), types.get(p)));
      }
      return new HandlerSignature(name, parameters, constraints);
    }
  }
}

// End HandlerSignature.java
