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

import static net.hydromatic.typescan.Scan.scan;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Tracers}. */
public class TracersTest {
  private static final String SOURCE =
      "namespace NS;\n"
          + "public static class Ext;\n"
          + "public interface IService;\n"
          + "public class Good : IService;\n"
          + "public class Bad;\n";

  @Test
  void testPrintTracer() {
    final StringWriter sw = new StringWriter();
    scan(SOURCE)
        .withQuery("NS.Ext", q -> q.assignableTo("NS.IService"))
        .withHandler("void Add<T>() where T : class")
        .withTracer(Tracers.printTracer(new PrintWriter(sw)))
        .assertMatches("NS.Good {T=NS.Good}");
    final String expected =
        "candidate NS.Ext\n"
            + "reject NS.Ext ELIGIBILITY\n"
            + "candidate NS.IService\n"
            + "reject NS.IService ELIGIBILITY\n"
            + "candidate NS.Good\n"
            + "match NS.Good {T=NS.Good}\n"
            + "candidate NS.Bad\n"
            + "reject NS.Bad ASSIGNABLE\n";
    assertThat(
        sw.toString().replace(System.lineSeparator(), "\n"), is(expected));

    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    scan(SOURCE)
        .withQuery("NS.Ext", q -> q.assignableTo("NS.IService"))
        .withHandler("void Add<T>() where T : class")
        .withTracer(Tracers.printTracer(out))
        .assertMatches("NS.Good {T=NS.Good}");
    assertThat(
        new String(out.toByteArray(), StandardCharsets.UTF_8)
            .replace(System.lineSeparator(), "\n"),
        is(expected));
  }

  @Test
  void testPrintCycle() {
    final StringWriter sw = new StringWriter();
    scan("namespace NS;\n"
            + "public static class Ext;\n"
            + "interface ISmth<T>;\n"
            + "class A : ISmth<B>;\n"
            + "class B : ISmth<A>;\n")
        .withQuery("NS.Ext", q -> q.typeNameFilter("NS.A"))
        .withHandler("void Add<X, Y>() where X : ISmth<Y> where Y : ISmth<X>")
        .withTracer(
            Tracers.withOnReject(
                Tracers.withOnCandidate(
                    Tracers.printTracer(new PrintWriter(sw)), t -> { }),
                (t, stage) -> { }))
        .assertMatches("NS.A {X=NS.A, Y=NS.B}");
    assertThat(
        sw.toString().replace(System.lineSeparator(), "\n"),
        is(
            "candidate NS.Ext\n"
                + "reject NS.Ext ELIGIBILITY\n"
                + "candidate NS.ISmth<T>\n"
                + "reject NS.ISmth<T> ELIGIBILITY\n"
                + "candidate NS.A\n"
                + "cycle X NS.A\n"
                + "match NS.A {X=NS.A, Y=NS.B}\n"
                + "candidate NS.B\n"
                + "reject NS.B NAME_INCLUDE\n"));
  }

  /** Decorators see the events, then pass them on. */
  @Test
  void testDecorators() {
    final List<String> events = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnMatch(
            Tracers.withOnReject(
                Tracers.withOnCandidate(
                    Tracers.empty(), t -> events.add("candidate " + t)),
                (t, stage) -> events.add("reject " + stage)),
            m -> events.add("match " + m.type));
    scan(SOURCE)
        .withQuery("NS.Ext", q -> q.assignableTo("NS.IService"))
        .withTracer(tracer)
        .assertMatches("NS.Good");
    assertThat(
        events,
        is(
            List.of(
                "candidate NS.Ext",
                "reject ELIGIBILITY",
                "candidate NS.IService",
                "reject ELIGIBILITY",
                "candidate NS.Good",
                "match NS.Good",
                "candidate NS.Bad",
                "reject ASSIGNABLE")));
  }
}

// End TracersTest.java
