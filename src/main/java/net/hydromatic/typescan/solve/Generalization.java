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

import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;

import net.hydromatic.typescan.type.TypeNode;

/**
 * Witness that a candidate type satisfies a target: the instantiation of the
 * target that the candidate implements or extends.
 *
 * <p>For example, if {@code class SpecificHandler1 : ICommandHandler<string>}
 * and the target is the open definition {@code ICommandHandler<>}, the
 * generalization is ({@code SpecificHandler1}, {@code
 * ICommandHandler<string>}).
 */
public final class Generalization {
  public final TypeNode candidate;
  public final TypeNode target;

  public Generalization(TypeNode candidate, TypeNode target) {
    this.candidate = requireNonNull(candidate);
    this.target = requireNonNull(target);
  }

  @Override
  public int hashCode() {
    return hash(candidate, target);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Generalization
            && candidate.equals(((Generalization) obj).candidate)
            && target.equals(((Generalization) obj).target);
  }

  @Override
  public String toString() {
    return candidate + " : " + target;
  }
}

// End Generalization.java
