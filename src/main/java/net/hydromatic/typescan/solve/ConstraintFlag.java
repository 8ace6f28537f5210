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

/** Kind constraint on a type parameter of a handler. */
public enum ConstraintFlag {
  /** {@code where T : class}; the type must not be a value type. */
  REFERENCE_TYPE,

  /** {@code where T : struct}; the type must be a value type. */
  VALUE_TYPE,

  /** {@code where T : unmanaged}. */
  UNMANAGED,

  /**
   * {@code where T : new()}; the type must have a public parameterless
   * constructor.
   */
  CONSTRUCTOR
}

// End ConstraintFlag.java
