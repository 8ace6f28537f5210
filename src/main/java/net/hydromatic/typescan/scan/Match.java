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

import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.typescan.solve.Binding;
import net.hydromatic.typescan.solve.Generalization;
import net.hydromatic.typescan.type.TypeNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type that satisfies a query, with the evidence that it does. */
public final class Match {
  public final TypeNode type;

  /**
   * Generalizations of the type against the query's assignable-to target;
   * empty if the query has no target.
   */
  public final ImmutableList<Generalization> generalizations;

  /**
   * Binding of the handler's type parameters; null if the query has no
   * generic method handler.
   */
  public final @Nullable Binding binding;

  public Match(
      TypeNode type,
      List<Generalization> generalizations,
      @Nullable Binding binding) {
    this.type = requireNonNull(type);
    this.generalizations = ImmutableList.copyOf(generalizations);
    this.binding = binding;
  }

  @Override
  public int hashCode() {
    return hash(type, generalizations, binding);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Match
            && type.equals(((Match) obj).type)
            && generalizations.equals(((Match) obj).generalizations)
            && Objects.equals(binding, ((Match) obj).binding);
  }

  @Override
  public String toString() {
    return binding == null ? type.toString() : type + " " + binding;
  }
}

// End Match.java
