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

/**
 * Step of {@link QueryEngine#evaluate}, in the order that the steps are
 * applied to each candidate type.
 *
 * @see Tracer#onReject
 */
public enum Stage {
  /**
   * The type must be a class that is not abstract, and whose name can be
   * written; it may be static only if the handler is a method of the type.
   */
  ELIGIBILITY,

  /** The type must not be generic if the query has a handler. */
  GENERIC_ARITY,

  /** The type must have the required marker. */
  REQUIRED_MARKER,

  /** The type must not have the excluded marker. */
  EXCLUDED_MARKER,

  /** The type's name must match the include filter. */
  NAME_INCLUDE,

  /** The type's name must not match the exclude filter. */
  NAME_EXCLUDE,

  /** The type must not be assignable to the excluded target. */
  EXCLUDE_ASSIGNABLE,

  /** The type must be assignable to the target. */
  ASSIGNABLE,

  /** The handler's type parameters must have at least one binding. */
  CONSTRAINTS,

  /** The type must be visible from the type that declares the query. */
  VISIBILITY
}

// End Stage.java
