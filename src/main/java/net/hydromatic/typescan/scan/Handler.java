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

import net.hydromatic.typescan.solve.HandlerSignature;

/**
 * Method that a code generator calls for each matched type.
 *
 * <p>A {@link Kind#METHOD} handler is a generic method declared next to the
 * query, whose first type parameter receives the matched type; its
 * signature's constraints restrict, and bind, the matches. A {@link
 * Kind#TYPE_METHOD} handler is a static method that each matched type
 * declares; it has no constraints to solve.
 */
public final class Handler {
  public final Kind kind;
  public final String name;
  public final HandlerSignature signature;

  private Handler(Kind kind, String name, HandlerSignature signature) {
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
    this.signature = requireNonNull(signature);
  }

  /** Creates a handler that is a generic method with a given signature. */
  public static Handler method(HandlerSignature signature) {
    return new Handler(Kind.METHOD, signature.name, signature);
  }

  /** Creates a handler that is a static method of each matched type. */
  public static Handler typeMethod(String name) {
    return new Handler(Kind.TYPE_METHOD, name, HandlerSignature.EMPTY);
  }

  @Override
  public String toString() {
    return kind == Kind.METHOD ? signature.toString() : "T." + name;
  }

  /** Kind of handler. */
  public enum Kind {
    /** Generic method; the matched type is its first type argument. */
    METHOD,

    /** Static method declared by each matched type. */
    TYPE_METHOD
  }
}

// End Handler.java
