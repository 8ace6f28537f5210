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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.typescan.type.TypeNode;

/**
 * Decides whether a candidate type is assignable to a target type, and finds
 * the generalizations that justify it.
 *
 * <p>The target may be closed ({@code IHandler<string>}, {@code MyBase}) or
 * the open definition of a generic type ({@code IHandler<>}). Against an
 * open interface, a candidate may have several generalizations, one per
 * distinct instantiation of the interface that it implements.
 */
public class AssignabilityResolver {
  private AssignabilityResolver() {}

  /** Returns whether {@code candidate} is assignable to {@code target}. */
  public static Assignability isAssignable(
      TypeNode candidate, TypeNode target) {
    if (candidate.equals(target)) {
      return Assignability.of(
          ImmutableList.of(new Generalization(candidate, candidate)));
    }
    if (target.isDefinition()) {
      if (target.isInterface()) {
        final Set<TypeNode> matches = new LinkedHashSet<>();
        for (TypeNode i : candidate.allInterfaces()) {
          if (i.isGeneric() && i.definition().equals(target)) {
            matches.add(i);
          }
        }
        final List<Generalization> list = new ArrayList<>();
        matches.forEach(i -> list.add(new Generalization(candidate, i)));
        return Assignability.of(list);
      }
      for (TypeNode t = candidate.baseType(); t != null; t = t.baseType()) {
        if (t.isGeneric() && t.definition().equals(target)) {
          return Assignability.of(
              ImmutableList.of(new Generalization(candidate, t)));
        }
      }
    } else {
      if (target.isInterface()) {
        return candidate.allInterfaces().contains(target)
            ? Assignability.of(
                ImmutableList.of(new Generalization(candidate, target)))
            : Assignability.NONE;
      }
      for (TypeNode t = candidate.baseType(); t != null; t = t.baseType()) {
        if (t.equals(target)) {
          return Assignability.of(
              ImmutableList.of(new Generalization(candidate, t)));
        }
      }
    }
    return Assignability.NONE;
  }
}

// End AssignabilityResolver.java
