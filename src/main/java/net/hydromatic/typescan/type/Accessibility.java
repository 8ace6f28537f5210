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

/**
 * Declared accessibility of a type or constructor.
 *
 * @see TypeGraph#isVisibleFrom(TypeNode, TypeNode)
 */
public enum Accessibility {
  PUBLIC,
  /** Visible within the declaring module. */
  INTERNAL,
  /** Visible within the containing type and types derived from it. */
  PROTECTED,
  /** Union of {@link #PROTECTED} and {@link #INTERNAL}. */
  PROTECTED_INTERNAL,
  /** Intersection of {@link #PROTECTED} and {@link #INTERNAL}. */
  PRIVATE_PROTECTED,
  /** Visible within the containing type. */
  PRIVATE
}

// End Accessibility.java
