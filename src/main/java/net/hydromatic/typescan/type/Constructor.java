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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;

import java.util.Locale;

/** Constructor of a declared type. */
public final class Constructor {
  /** Implicit constructor of a class that declares none, and of a struct. */
  public static final Constructor DEFAULT =
      new Constructor(Accessibility.PUBLIC, 0, false);

  public final Accessibility accessibility;
  public final int parameterCount;
  public final boolean isStatic;

  private Constructor(
      Accessibility accessibility, int parameterCount, boolean isStatic) {
    checkArgument(parameterCount >= 0);
    checkArgument(
        !isStatic || parameterCount == 0,
        "static constructor cannot have parameters");
    this.accessibility = requireNonNull(accessibility);
    this.parameterCount = parameterCount;
    this.isStatic = isStatic;
  }

  /** Creates an instance constructor. */
  public static Constructor of(Accessibility accessibility, int paramCount) {
    return new Constructor(accessibility, paramCount, false);
  }

  /** Creates a static constructor (type initializer). */
  public static Constructor ofStatic() {
    return new Constructor(Accessibility.PRIVATE, 0, true);
  }

  /** Returns whether {@code new T()} can call this constructor. */
  public boolean isPublicParameterless() {
    return accessibility == Accessibility.PUBLIC
        && parameterCount == 0
        && !isStatic;
  }

  @Override
  public int hashCode() {
    return hash(accessibility, parameterCount, isStatic);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Constructor
            && accessibility == ((Constructor) obj).accessibility
            && parameterCount == ((Constructor) obj).parameterCount
            && isStatic == ((Constructor) obj).isStatic;
  }

  @Override
  public String toString() {
    final String prefix =
        isStatic ? "static" : accessibility.name().toLowerCase(Locale.ROOT);
    return prefix
        + " .ctor("
        + parameterCount
        + ")";
  }
}

// End Constructor.java
