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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiled wildcard filter, such as "{@code *Service,*Handler}".
 *
 * <p>The filter consists of comma-separated alternatives. In each
 * alternative, "{@code *}" matches any sequence of characters and every
 * other character matches itself; spaces are significant. A name matches
 * the filter if the whole name matches at least one alternative. Matching is
 * case-sensitive.
 */
public final class WildcardPattern {
  private static final Splitter COMMA = Splitter.on(',');
  private static final Splitter STAR = Splitter.on('*');
  private static final Joiner ANY = Joiner.on(".*");
  private static final Joiner OR = Joiner.on('|');

  public final String wildcard;
  private final Pattern pattern;

  private WildcardPattern(String wildcard) {
    this.wildcard = requireNonNull(wildcard);
    this.pattern = Pattern.compile(toRegex(wildcard));
  }

  /**
   * Compiles a wildcard filter; returns null if {@code wildcard} is null,
   * meaning that there is no filter.
   */
  public static @Nullable WildcardPattern compile(@Nullable String wildcard) {
    return wildcard == null ? null : new WildcardPattern(wildcard);
  }

  /**
   * Returns whether a name matches a filter. A null filter matches every
   * name.
   */
  public static boolean matches(
      @Nullable WildcardPattern pattern, String name) {
    return pattern == null || pattern.matches(name);
  }

  /** Converts a wildcard filter to a regular expression. */
  static String toRegex(String wildcard) {
    return OR.join(
        Iterables.transform(COMMA.split(wildcard), WildcardPattern::toRegex0));
  }

  private static String toRegex0(String alternative) {
    return ANY.join(
        Iterables.transform(STAR.split(alternative), WildcardPattern::quote));
  }

  private static String quote(String literal) {
    return literal.isEmpty() ? "" : Pattern.quote(literal);
  }

  /** Returns whether the whole of {@code name} matches this filter. */
  public boolean matches(String name) {
    return pattern.matcher(name).matches();
  }

  @Override
  public String toString() {
    return wildcard;
  }
}

// End WildcardPattern.java
