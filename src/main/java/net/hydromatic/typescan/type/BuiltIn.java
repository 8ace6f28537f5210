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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in types of the core library.
 *
 * <p>Every graph created by {@link TypeGraph#builder()} contains a module
 * called {@link #MODULE_NAME} that declares these types, and every other
 * module refers to it.
 */
public enum BuiltIn {
  OBJECT("System", "Object", TypeKind.CLASS, "object"),
  VALUE_TYPE("System", "ValueType", TypeKind.CLASS, null),
  ENUM("System", "Enum", TypeKind.CLASS, null),
  ATTRIBUTE("System", "Attribute", TypeKind.CLASS, null),
  STRING("System", "String", TypeKind.CLASS, "string"),
  BOOLEAN("System", "Boolean", TypeKind.STRUCT, "bool"),
  INT32("System", "Int32", TypeKind.STRUCT, "int"),
  INT64("System", "Int64", TypeKind.STRUCT, "long"),
  DOUBLE("System", "Double", TypeKind.STRUCT, "double"),
  DECIMAL("System", "Decimal", TypeKind.STRUCT, "decimal"),
  GUID("System", "Guid", TypeKind.STRUCT, null),
  I_ENUMERABLE(
      "System.Collections.Generic",
      "IEnumerable",
      TypeKind.INTERFACE,
      null,
      "T"),
  LIST("System.Collections.Generic", "List", TypeKind.CLASS, null, "T");

  /** Name of the module that declares the built-in types. */
  public static final String MODULE_NAME = "System.Runtime";

  public final String namespace;
  public final String simpleName;
  public final TypeKind kind;
  public final @Nullable String keyword;
  public final ImmutableList<String> typeParameterNames;

  BuiltIn(
      String namespace,
      String simpleName,
      TypeKind kind,
      @Nullable String keyword,
      String... typeParameterNames) {
    this.namespace = requireNonNull(namespace);
    this.simpleName = requireNonNull(simpleName);
    this.kind = requireNonNull(kind);
    this.keyword = keyword;
    this.typeParameterNames = ImmutableList.copyOf(typeParameterNames);
  }

  /** Returns the metadata name, e.g. "{@code System.String}". */
  public String metadataName() {
    return namespace
        + "."
        + simpleName
        + (typeParameterNames.isEmpty() ? "" : "`" + typeParameterNames.size());
  }

  /** Returns this type's definition in a graph. */
  public TypeNode in(TypeGraph graph) {
    return graph.get(metadataName());
  }

  /** Declares the built-in types in the core module of a graph. */
  static void declare(TypeGraph.Builder builder) {
    final TypeGraph.ModuleBuilder module = builder.module(MODULE_NAME);
    for (BuiltIn builtIn : values()) {
      final TypeGraph.DeclarationBuilder d =
          module
              .declare(builtIn.namespace, builtIn.simpleName, builtIn.kind)
              .accessibility(Accessibility.PUBLIC)
              .typeParameters(builtIn.typeParameterNames);
      if (builtIn.keyword != null) {
        d.keyword(builtIn.keyword);
      }
      if (builtIn.kind.isValueType()) {
        d.unmanaged();
      }
      builtIn.define(d);
    }
  }

  /** Adds the modifiers, edges and constructors of a built-in type. */
  private void define(TypeGraph.DeclarationBuilder d) {
    switch (this) {
      case VALUE_TYPE:
      case ATTRIBUTE:
        d.modifiers(Modifier.ABSTRACT);
        break;

      case ENUM:
        d.modifiers(Modifier.ABSTRACT).extend(TypeGraph.ref("ValueType"));
        break;

      case STRING:
        d.modifiers(Modifier.SEALED)
            .constructor(Constructor.of(Accessibility.PUBLIC, 1));
        break;

      case LIST:
        d.implement(TypeGraph.ref("IEnumerable", TypeGraph.ref("T")));
        break;

      default:
        break;
    }
  }
}

// End BuiltIn.java
