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
import static net.hydromatic.typescan.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.typescan.type.TypeNode;

/** Result of {@link AssignabilityResolver#isAssignable}. */
public final class Assignability {
  /** Result when the candidate is not assignable. */
  public static final Assignability NONE =
      new Assignability(false, ImmutableList.of());

  public final boolean assignable;

  /** Generalizations, without duplicates; empty if not assignable. */
  public final ImmutableList<Generalization> generalizations;

  private Assignability(
      boolean assignable, ImmutableList<Generalization> generalizations) {
    checkArgument(assignable != generalizations.isEmpty());
    this.assignable = assignable;
    this.generalizations = generalizations;
  }

  /** Creates a successful result. */
  static Assignability of(List<Generalization> generalizations) {
    return generalizations.isEmpty()
        ? NONE
        : new Assignability(true, ImmutableList.copyOf(generalizations));
  }

  /** Returns the target of each generalization. */
  public List<TypeNode> targets() {
    return transformEager(generalizations, g -> g.target);
  }

  @Override
  public String toString() {
    return assignable ? generalizations.toString() : "none";
  }
}

// End Assignability.java
