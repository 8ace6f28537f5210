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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for {@link WildcardPattern}. */
public class WildcardPatternTest {
  private static boolean matches(String wildcard, String name) {
    return WildcardPattern.matches(WildcardPattern.compile(wildcard), name);
  }

  @Test
  void testNull() {
    assertThat(WildcardPattern.compile(null), nullValue());
    assertThat(WildcardPattern.matches(null, "anything"), is(true));
    assertThat(WildcardPattern.matches(null, ""), is(true));
  }

  @Test
  void testStar() {
    assertThat(matches("*", "NS.MyService"), is(true));
    assertThat(matches("*", ""), is(true));
    assertThat(matches("*Service", "NS.MyService"), is(true));
    assertThat(matches("*Service", "NS.MyServiceImpl"), is(false));
    assertThat(matches("NS.*", "NS.MyService"), is(true));
    assertThat(matches("NS.*", "Other.NS.MyService"), is(false));
    assertThat(matches("*Smth*", "GeneratorTests.SmthX"), is(true));
    assertThat(matches("A*B*C", "AxxBxxC"), is(true));
    assertThat(matches("A*B*C", "AxxCxxB"), is(false));
  }

  /** Without a star, the whole name must be equal. */
  @Test
  void testExact() {
    assertThat(matches("NS.MyService", "NS.MyService"), is(true));
    assertThat(matches("MyService", "NS.MyService"), is(false));
    assertThat(matches("NS.My", "NS.MyService"), is(false));
  }

  @Test
  void testAlternatives() {
    final WildcardPattern p = WildcardPattern.compile("*Service,*Handler");
    assertThat(p.matches("NS.OrderService"), is(true));
    assertThat(p.matches("NS.OrderHandler"), is(true));
    assertThat(p.matches("NS.OrderRepository"), is(false));
    assertThat(p.toString(), is("*Service,*Handler"));
  }

  /** Spaces are not trimmed; an alternative with a space is different. */
  @Test
  void testSpaces() {
    assertThat(matches("*Service, *Handler", "NS.OrderHandler"), is(false));
    assertThat(matches("*Service, *Handler", " NS.OrderHandler"), is(true));
    assertThat(matches("* Service", "NS. Service"), is(true));
  }

  /** Characters that are special in regular expressions are literal. */
  @Test
  void testLiteral() {
    assertThat(matches("NS.A", "NSxA"), is(false));
    assertThat(matches("List<T>", "List<T>"), is(true));
    assertThat(matches("A+B", "A+B"), is(true));
    assertThat(matches("A+B", "AAB"), is(false));
    assertThat(matches("(x)|[y]", "(x)|[y]"), is(true));
    assertThat(matches("(x)|[y]", "x"), is(false));
    assertThat(matches("a\\E*", "a\\Ez"), is(true));
  }

  @Test
  void testCaseSensitive() {
    assertThat(matches("*service", "NS.MyService"), is(false));
    assertThat(matches("*Service", "NS.MyService"), is(true));
  }

  /** An empty filter, or an empty alternative, matches only the empty name. */
  @Test
  void testEmpty() {
    assertThat(matches("", ""), is(true));
    assertThat(matches("", "A"), is(false));
    assertThat(matches("A,", ""), is(true));
    assertThat(matches("A,", "A"), is(true));
    assertThat(matches("A,", "B"), is(false));
  }

  @Test
  void testToRegex() {
    assertThat(WildcardPattern.toRegex("*"), is(".*"));
    assertThat(WildcardPattern.toRegex("*Service"), is(".*\\QService\\E"));
    assertThat(
        WildcardPattern.toRegex("a*,b"), is("\\Qa\\E.*|\\Qb\\E"));
  }
}

// End WildcardPatternTest.java
