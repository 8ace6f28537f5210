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

import net.hydromatic.typescan.type.TypeNode;
import net.hydromatic.typescan.type.TypeParameter;

/** Called on various events during the evaluation of a query. */
public interface Tracer {
  /** Called when a type is read from a module, before it is filtered. */
  void onCandidate(TypeNode type);

  /** Called when a type fails a filter. */
  void onReject(TypeNode type, Stage stage);

  /** Called when a match is produced. */
  void onMatch(Match match);

  /**
   * Called when solving constraints leads back to a type parameter that is
   * already bound.
   */
  void onCycle(TypeParameter parameter, TypeNode type);
}

// End Tracer.java
