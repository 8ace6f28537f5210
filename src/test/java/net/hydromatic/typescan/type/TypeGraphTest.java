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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.typescan.Scan.assertError;
import static net.hydromatic.typescan.Scan.scan;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.hasToString;

import java.util.List;
import net.hydromatic.typescan.DeclarationParser;
import net.hydromatic.typescan.Scan;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeGraph} and the types it contains. */
public class TypeGraphTest {
  private static final TypeGraph GRAPH =
      scan(
              "namespace NS;\n"
                  + "public class Outer\n"
                  + "{\n"
                  + "    private class Priv;\n"
                  + "    protected class Prot;\n"
                  + "    internal class Intern;\n"
                  + "    protected internal class ProtInt;\n"
                  + "    private protected class PrivProt;\n"
                  + "    public class Pub;\n"
                  + "    public class Gen<U>;\n"
                  + "}\n"
                  + "public class Derived : Outer;\n"
                  + "public class Unrelated;\n"
                  + "public class G<T>;\n"
                  + "public interface IA;\n"
                  + "public interface IB : IA;\n"
                  + "public interface IC;\n"
                  + "public class Base : IC;\n"
                  + "public class D : Base, IB, IA;\n"
                  + "public interface I<T>;\n"
                  + "public class GBase<T>"
                  + " : I<System.Collections.Generic.List<T>>;\n"
                  + "public class Mid : GBase<int>;\n"
                  + "interface ISmth<T>;\n"
                  + "class SmthX : ISmth<SmthY>;\n"
                  + "class SmthY : ISmth<SmthX>;\n"
                  + "public abstract class Abstract;\n"
                  + "public static class Static;\n"
                  + "public struct S { public S(int x) { } }\n"
                  + "public class WithStatic { static WithStatic() { } }\n"
                  + "public enum E { A }\n")
          .graph();

  private static TypeNode type(String metadataName) {
    return GRAPH.get(metadataName);
  }

  private static Matcher<Throwable> error(
      Class<? extends Throwable> clazz, String message) {
    return allOf(instanceOf(clazz), hasToString(containsString(message)));
  }

  @Test
  void testNames() {
    final TypeNode string = type("System.String");
    assertThat(string.displayName(), is("string"));
    assertThat(string.metadataName(), is("System.String"));
    assertThat(type("System.Guid").displayName(), is("System.Guid"));
    assertThat(BuiltIn.STRING.in(GRAPH), sameInstance(string));
    assertThat(
        BuiltIn.LIST.metadataName(), is("System.Collections.Generic.List`1"));

    final TypeNode pub = type("NS.Outer+Pub");
    assertThat(pub.displayName(), is("NS.Outer.Pub"));
    assertThat(pub.declaration.qualifiedName(), is("NS.Outer.Pub"));
    assertThat(pub.declaration.name, is("Pub"));
    assertThat(pub.declaration.container, is(type("NS.Outer").declaration));

    final TypeNode gen = type("NS.Outer+Gen`1");
    assertThat(gen.displayName(), is("NS.Outer.Gen<U>"));

    final TypeNode g = type("NS.G`1");
    assertThat(g.displayName(), is("NS.G<T>"));
    assertThat(g.isDefinition(), is(true));
    assertThat(g.declaration.arity(), is(1));
    final TypeNode gString = g.declaration.apply(string);
    assertThat(gString.displayName(), is("NS.G<string>"));
    assertThat(gString.metadataName(), is("NS.G`1"));
    assertThat(gString.isDefinition(), is(false));
    assertThat(gString.definition(), sameInstance(g));
    assertThat(
        type("System.Collections.Generic.List`1")
            .declaration
            .apply(gString)
            .displayName(),
        is("System.Collections.Generic.List<NS.G<string>>"));
  }

  /** Types are compared structurally. */
  @Test
  void testEquality() {
    final TypeNode g = type("NS.G`1");
    final TypeNode string = type("System.String");
    final TypeNode g1 = g.declaration.apply(string);
    final TypeNode g2 = g.declaration.apply(string);
    assertThat(g1, not(sameInstance(g2)));
    assertThat(g1, is(g2));
    assertThat(g1.hashCode(), is(g2.hashCode()));
    assertThat(g1, not(g.declaration.apply(type("System.Int32"))));
    assertThat(g1, not(g));

    // Applying a declaration to its own parameters gives its definition
    assertThat(
        g.declaration.apply(g.declaration.typeParameters), sameInstance(g));
    assertThat(g.declaration.apply(), sameInstance(g));
  }

  @Test
  void testApplyWrongArity() {
    final TypeNode string = type("System.String");
    assertError(
        () -> type("NS.G`1").declaration.apply(string, string),
        error(
            IllegalArgumentException.class,
            "NS.G`1 expects 1 type arguments, got 2"));
  }

  @Test
  void testBaseTypes() {
    assertThat(type("NS.Unrelated").baseType(), is(type("System.Object")));
    assertThat(type("System.Object").baseType(), nullValue());
    assertThat(type("NS.S").baseType(), is(type("System.ValueType")));
    assertThat(type("NS.E").baseType(), is(type("System.Enum")));
    assertThat(type("NS.IA").baseType(), nullValue());
    assertThat(type("NS.S").isValueType(), is(true));
    assertThat(type("NS.E").isUnmanaged(), is(true));
    assertThat(type("NS.S").isUnmanaged(), is(false));
    assertThat(type("System.Int32").isUnmanaged(), is(true));
  }

  /**
   * All interfaces: each direct interface followed by the interfaces it
   * extends, then those of the base type, without duplicates.
   */
  @Test
  void testAllInterfaces() {
    final TypeNode d = type("NS.D");
    assertThat(d.interfaces().toString(), is("[NS.IB, NS.IA]"));
    assertThat(d.allInterfaces().toString(), is("[NS.IB, NS.IA, NS.IC]"));
    assertThat(type("NS.IB").allInterfaces().toString(), is("[NS.IA]"));
    assertThat(type("NS.IA").allInterfaces().isEmpty(), is(true));
  }

  /** Edges of an instantiation have the type arguments substituted. */
  @Test
  void testSubstitution() {
    final TypeNode mid = type("NS.Mid");
    final TypeNode base = requireNonNull(mid.baseType());
    assertThat(base.toString(), is("NS.GBase<int>"));
    assertThat(
        base.interfaces().toString(),
        is("[NS.I<System.Collections.Generic.List<int>>]"));
    assertThat(
        mid.allInterfaces().toString(),
        is("[NS.I<System.Collections.Generic.List<int>>]"));
    assertThat(
        type("NS.GBase`1").interfaces().toString(),
        is("[NS.I<System.Collections.Generic.List<T>>]"));
  }

  /** Types may refer to each other in a cycle of type arguments. */
  @Test
  void testCyclicTypeArguments() {
    final TypeNode x = type("NS.SmthX");
    final TypeNode y = (TypeNode) x.interfaces().get(0).typeArguments.get(0);
    assertThat(y, is(type("NS.SmthY")));
    assertThat(y.interfaces().toString(), is("[NS.ISmth<NS.SmthX>]"));
  }

  @Test
  void testConstructors() {
    assertThat(
        type("NS.Unrelated").constructors().toString(),
        is("[public .ctor(0)]"));
    assertThat(
        type("NS.Abstract").constructors().toString(),
        is("[protected .ctor(0)]"));
    assertThat(type("NS.Static").constructors().isEmpty(), is(true));
    assertThat(type("NS.IA").constructors().isEmpty(), is(true));
    assertThat(
        type("NS.S").constructors().toString(),
        is("[public .ctor(1), public .ctor(0)]"));
    assertThat(
        type("NS.WithStatic").constructors().toString(),
        is("[static .ctor(0), public .ctor(0)]"));
  }

  @Test
  void testLookup() {
    assertThat(GRAPH.lookup("NS.Nope"), nullValue());
    assertThat(GRAPH.lookup("NS.G"), nullValue());
    assertThat(GRAPH.lookup("NS.Outer.Pub"), nullValue());
    assertThat(GRAPH.lookup("NS.Outer+Pub"), is(type("NS.Outer+Pub")));
    assertError(
        () -> GRAPH.get("NS.Nope"),
        error(TypeGraphException.class, "type 'NS.Nope' not found"));
  }

  @Test
  void testResolve() {
    final Declaration outer = type("NS.Outer").declaration;
    final Declaration pub = type("NS.Outer+Pub").declaration;
    assertThat(
        GRAPH.resolve("string", 0, "NS", null),
        is(type("System.String").declaration));
    assertThat(GRAPH.resolve("Pub", 0, "NS", outer), is(pub));
    // From within Pub, its siblings are in scope
    assertThat(
        GRAPH.resolve("Priv", 0, "NS", pub),
        is(type("NS.Outer+Priv").declaration));
    assertThat(GRAPH.resolve("Pub", 0, "NS", null), nullValue());
    assertThat(
        GRAPH.resolve("Outer", 0, "NS.Inner.Deeper", null), is(outer));
    assertThat(
        GRAPH.resolve("G", 1, "NS", null), is(type("NS.G`1").declaration));
    assertThat(GRAPH.resolve("G", 0, "NS", null), nullValue());
    assertThat(GRAPH.resolve("G", 1, "", null), nullValue());
    assertThat(
        GRAPH.resolve("System.Object", 0, "NS", null),
        is(type("System.Object").declaration));
  }

  @Test
  void testModules() {
    final Module module = requireNonNull(GRAPH.module(Scan.MODULE_NAME));
    assertThat(GRAPH.modules().toString(), is("[System.Runtime, compilation]"));
    assertThat(GRAPH.moduleOf(type("NS.D")), sameInstance(module));
    assertThat(
        GRAPH.moduleOf(type("System.String")).name, is("System.Runtime"));
    assertThat(module.references, is(List.of("System.Runtime")));
    assertThat(module.globalNamespace.toString(), is("<global namespace>"));
    assertThat(module.globalNamespace.members().toString(), is("[NS]"));
    final Namespace ns = (Namespace) module.globalNamespace.members().get(0);
    assertThat(ns.qualifiedName, is("NS"));
    assertThat(ns.members().get(0), is(type("NS.Outer").declaration));
    // Built-in types are declared first; a container before its nested types
    assertThat(
        GRAPH.declarations().get(0).metadataName(), is("System.Object"));
    final List<Declaration> declarations = GRAPH.declarations();
    assertThat(
        declarations.indexOf(type("NS.Outer").declaration)
            < declarations.indexOf(type("NS.Outer+Priv").declaration),
        is(true));
  }

  @Test
  void testVisibility() {
    final TypeNode outer = type("NS.Outer");
    final TypeNode pub = type("NS.Outer+Pub");
    final TypeNode derived = type("NS.Derived");
    final TypeNode unrelated = type("NS.Unrelated");

    final TypeNode priv = type("NS.Outer+Priv");
    assertThat(GRAPH.isVisibleFrom(outer, priv), is(true));
    assertThat(GRAPH.isVisibleFrom(pub, priv), is(true));
    assertThat(GRAPH.isVisibleFrom(derived, priv), is(false));
    assertThat(GRAPH.isVisibleFrom(unrelated, priv), is(false));

    final TypeNode prot = type("NS.Outer+Prot");
    assertThat(GRAPH.isVisibleFrom(outer, prot), is(true));
    assertThat(GRAPH.isVisibleFrom(derived, prot), is(true));
    assertThat(GRAPH.isVisibleFrom(unrelated, prot), is(false));

    final TypeNode protInt = type("NS.Outer+ProtInt");
    assertThat(GRAPH.isVisibleFrom(derived, protInt), is(true));
    assertThat(GRAPH.isVisibleFrom(unrelated, protInt), is(true));

    final TypeNode privProt = type("NS.Outer+PrivProt");
    assertThat(GRAPH.isVisibleFrom(derived, privProt), is(true));
    assertThat(GRAPH.isVisibleFrom(unrelated, privProt), is(false));

    assertThat(
        GRAPH.isVisibleFrom(unrelated, type("NS.Outer+Intern")), is(true));
    assertThat(GRAPH.isVisibleFrom(unrelated, pub), is(true));

    // A type argument must be visible too
    final Declaration g = type("NS.G`1").declaration;
    assertThat(GRAPH.isVisibleFrom(outer, g.apply(priv)), is(true));
    assertThat(GRAPH.isVisibleFrom(unrelated, g.apply(priv)), is(false));
  }

  /** Types nested in a generic class. */
  @Test
  void testNestedInGenericBase() {
    final TypeGraph graph =
        scan(
                "namespace NS;\n"
                    + "public class Base<T>\n"
                    + "{\n"
                    + "    protected class P;\n"
                    + "}\n"
                    + "public class D : Base<int>\n"
                    + "{\n"
                    + "    class N;\n"
                    + "}\n"
                    + "public class X;\n")
            .graph();
    final TypeNode p = graph.get("NS.Base`1+P");
    assertThat(graph.isVisibleFrom(graph.get("NS.D"), p), is(true));
    assertThat(graph.isVisibleFrom(graph.get("NS.D+N"), p), is(true));
    assertThat(graph.isVisibleFrom(graph.get("NS.X"), p), is(false));

    assertThat(p.isGeneric(), is(false));
    assertThat(p.isOpenGeneric(), is(true));
    assertThat(graph.get("NS.Base`1").isOpenGeneric(), is(true));
    assertThat(graph.get("NS.D+N").isOpenGeneric(), is(false));
  }

  @Test
  void testInternalAcrossModules() {
    final String lib =
        "namespace Lib;\n"
            + "public class P { internal class N; public class Q; }\n"
            + "internal class L;\n"
            + "class Default;\n";
    for (boolean friend : new boolean[] {false, true}) {
      final TypeGraph.Builder b = TypeGraph.builder();
      final TypeGraph.ModuleBuilder libModule = b.module("lib");
      if (friend) {
        libModule.internalsVisibleTo("app");
      }
      DeclarationParser.parse(libModule, lib);
      DeclarationParser.parse(
          b.module("app").reference("lib"), "namespace App; class A;");
      final TypeGraph graph = b.build();
      final TypeNode a = graph.get("App.A");
      assertThat(graph.isVisibleFrom(a, graph.get("Lib.P")), is(true));
      assertThat(graph.isVisibleFrom(a, graph.get("Lib.P+Q")), is(true));
      assertThat(graph.isVisibleFrom(a, graph.get("Lib.P+N")), is(friend));
      assertThat(graph.isVisibleFrom(a, graph.get("Lib.L")), is(friend));
      assertThat(graph.isVisibleFrom(a, graph.get("Lib.Default")), is(friend));
    }
  }

  @Test
  void testUnnameable() {
    final TypeGraph.Builder b = TypeGraph.builder();
    b.module("m").declare("NS", "<>c", TypeKind.CLASS).unnameable();
    final TypeGraph graph = b.build();
    assertThat(graph.get("NS.<>c").declaration.nameable, is(false));
    assertThat(
        graph.get("NS.<>c").constructors().toString(),
        is("[public .ctor(0)]"));
  }

  private static void assertBuildError(String source, Matcher<Throwable> m) {
    assertError(() -> scan(source).graph(), m);
  }

  @Test
  void testInvalidGraphs() {
    assertBuildError(
        "namespace NS; class A : B; class B : A;",
        error(IllegalArgumentException.class, "cycle in base types of NS.A"));
    assertBuildError(
        "namespace NS; class A : A;",
        error(IllegalArgumentException.class, "cycle in base types of NS.A"));
    assertBuildError(
        "namespace NS; interface IA : IB; interface IB : IA;",
        error(IllegalArgumentException.class, "cycle in interfaces of NS.IA"));
    assertBuildError(
        "namespace NS; class A : Missing;",
        error(
            TypeGraphException.class, "cannot resolve type 'Missing' in NS.A"));
    assertBuildError(
        "namespace NS; class A; class A;",
        error(IllegalArgumentException.class, "duplicate type NS.A"));
    assertBuildError(
        "namespace NS; class A; class B; class C : A, B;",
        error(IllegalArgumentException.class, "NS.B is not an interface"));
    assertBuildError(
        "namespace NS; class A; interface I : A;",
        error(
            IllegalArgumentException.class,
            "interface NS.I cannot have base type NS.A"));
    assertBuildError(
        "namespace NS; struct S; class C : S;",
        error(IllegalArgumentException.class, "NS.S is not an interface"));
  }

  @Test
  void testBuilder() {
    final TypeGraph.Builder b = TypeGraph.builder();
    b.module("a").reference("nope");
    assertError(
        b::build,
        error(
            IllegalArgumentException.class,
            "module a refers to unknown module nope"));

    final TypeGraph.Builder b2 = TypeGraph.builder();
    b2.build();
    assertError(
        b2::build, error(IllegalStateException.class, "already built"));
    assertError(
        () -> b2.module("x"),
        error(IllegalStateException.class, "already built"));
  }
}

// End TypeGraphTest.java
