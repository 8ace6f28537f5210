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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.typescan.util.Static.allMatch;
import static net.hydromatic.typescan.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable universe of modules and the types they declare.
 *
 * <p>Create a graph using {@link #builder()}. Once built, neither the graph
 * nor anything reachable from it changes, so any number of threads may query
 * it at the same time.
 */
public final class TypeGraph {
  private final ImmutableMap<String, Module> modules;
  private final ImmutableMap<String, Declaration> declarations;
  private final ImmutableMap<String, Declaration> keywords;

  private TypeGraph(
      Map<String, Module> modules, Map<String, Declaration> declarations) {
    this.modules = ImmutableMap.copyOf(modules);
    this.declarations = ImmutableMap.copyOf(declarations);
    this.keywords = keywords(declarations.values());
  }

  /**
   * Creates a builder. The graph it builds contains the module of {@link
   * BuiltIn built-in types}.
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates a reference to a type, to be resolved when a graph is built. */
  public static Ref ref(String name, Ref... typeArguments) {
    return new Ref(name, ImmutableList.copyOf(typeArguments));
  }

  private static ImmutableMap<String, Declaration> keywords(
      Iterable<Declaration> declarations) {
    final ImmutableMap.Builder<String, Declaration> b = ImmutableMap.builder();
    for (Declaration d : declarations) {
      if (d.keyword != null) {
        b.put(d.keyword, d);
      }
    }
    return b.build();
  }

  /** Returns all modules, in the order they were created. */
  public List<Module> modules() {
    return modules.values().asList();
  }

  /** Returns a module by name, or null. */
  public @Nullable Module module(String name) {
    return modules.get(name);
  }

  /** Returns the module that declares a type. */
  public Module moduleOf(TypeNode type) {
    return requireNonNull(modules.get(type.moduleName()));
  }

  /** Returns all declarations, in the order they were created. */
  public List<Declaration> declarations() {
    return declarations.values().asList();
  }

  /**
   * Looks up a type by metadata name (e.g. "{@code GeneratorTests.IHandler`1}")
   * and returns its definition, or null if there is no such type.
   */
  public @Nullable TypeNode lookup(String metadataName) {
    final Declaration declaration = declarations.get(metadataName);
    return declaration == null ? null : declaration.definition();
  }

  /**
   * Looks up a type by metadata name; never returns null.
   *
   * @throws TypeGraphException if there is no such type
   */
  public TypeNode get(String metadataName) {
    final TypeNode type = lookup(metadataName);
    if (type == null) {
      throw new TypeGraphException("type '" + metadataName + "' not found");
    }
    return type;
  }

  /**
   * Resolves a name the way source code does: as a keyword alias, then as a
   * type nested in {@code context} or one of its containers, then in {@code
   * namespace} and each enclosing namespace up to the global namespace.
   *
   * @param name Name, e.g. "{@code IHandler}", "{@code string}"
   * @param arity Number of type arguments
   * @param namespace Namespace in which the name occurs
   * @param context Declaration in which the name occurs, or null
   * @return Declaration, or null if not found
   */
  public @Nullable Declaration resolve(
      String name, int arity, String namespace, @Nullable Declaration context) {
    return resolve(declarations, keywords, name, arity, namespace, context);
  }

  private static @Nullable Declaration resolve(
      Map<String, Declaration> declarations,
      Map<String, Declaration> keywords,
      String name,
      int arity,
      String namespace,
      @Nullable Declaration context) {
    final String suffix = arity == 0 ? "" : "`" + arity;
    if (arity == 0) {
      final Declaration keyword = keywords.get(name);
      if (keyword != null) {
        return keyword;
      }
    }
    for (Declaration c = context; c != null; c = c.container) {
      final Declaration d =
          declarations.get(c.metadataName() + "+" + name + suffix);
      if (d != null) {
        return d;
      }
    }
    for (String ns = namespace; ; ns = parentNamespace(ns)) {
      final String prefix = ns.isEmpty() ? "" : ns + ".";
      final Declaration d = declarations.get(prefix + name + suffix);
      if (d != null) {
        return d;
      }
      if (ns.isEmpty()) {
        return null;
      }
    }
  }

  private static String parentNamespace(String namespace) {
    final int i = namespace.lastIndexOf('.');
    return i < 0 ? "" : namespace.substring(0, i);
  }

  /**
   * Returns a module and every module it refers to, directly or indirectly.
   *
   * <p>The order is depth-first, pre-order, starting with {@code module};
   * each module occurs once.
   */
  public List<Module> referenceClosure(Module module) {
    final Map<String, Module> closure = new LinkedHashMap<>();
    addReferences(module, closure);
    return ImmutableList.copyOf(closure.values());
  }

  private void addReferences(Module module, Map<String, Module> closure) {
    if (closure.putIfAbsent(module.name, module) != null) {
      return;
    }
    for (String reference : module.references) {
      addReferences(requireNonNull(modules.get(reference)), closure);
    }
  }

  /**
   * Returns whether a type can be referred to from code in a given type.
   *
   * <p>A type is visible if its declaration and each of its containing
   * declarations are accessible from {@code position}, and so is each of its
   * type arguments.
   */
  public boolean isVisibleFrom(TypeNode position, TypeNode type) {
    for (Declaration d = type.declaration; d != null; d = d.container) {
      if (!isAccessible(d, position.declaration)) {
        return false;
      }
    }
    for (Type typeArgument : type.typeArguments) {
      if (typeArgument instanceof TypeNode
          && !isVisibleFrom(position, (TypeNode) typeArgument)) {
        return false;
      }
    }
    return true;
  }

  private boolean isAccessible(Declaration d, Declaration from) {
    switch (d.accessibility) {
      case PUBLIC:
        return true;
      case INTERNAL:
        return isInternalTo(d, from);
      case PROTECTED_INTERNAL:
        return isInternalTo(d, from) || isProtectedTo(d, from);
      case PRIVATE_PROTECTED:
        return isInternalTo(d, from) && isProtectedTo(d, from);
      case PROTECTED:
        return isProtectedTo(d, from);
      case PRIVATE:
        return d.container == null
            ? isInternalTo(d, from)
            : isWithin(from, d.container);
      default:
        throw new AssertionError(d.accessibility);
    }
  }

  private boolean isInternalTo(Declaration d, Declaration from) {
    return d.moduleName.equals(from.moduleName)
        || requireNonNull(modules.get(d.moduleName))
            .internalsVisibleTo
            .contains(from.moduleName);
  }

  /**
   * Returns whether code in {@code from} may see protected members of the
   * container of {@code d}.
   */
  private static boolean isProtectedTo(Declaration d, Declaration from) {
    final Declaration container = d.container;
    if (container == null) {
      return false;
    }
    for (Declaration f = from; f != null; f = f.container) {
      for (TypeNode t = f.definition(); t != null; t = t.baseType()) {
        if (t.declaration.metadataName().equals(container.metadataName())) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns whether {@code from} is, or is nested in, {@code container}. */
  private static boolean isWithin(Declaration from, Declaration container) {
    for (Declaration f = from; f != null; f = f.container) {
      if (f.metadataName().equals(container.metadataName())) {
        return true;
      }
    }
    return false;
  }

  /**
   * Reference to a type by name, possibly with type arguments, resolved when
   * the graph is built.
   *
   * @see TypeGraph#resolve
   */
  public static final class Ref {
    public final String name;
    public final ImmutableList<Ref> typeArguments;

    Ref(String name, ImmutableList<Ref> typeArguments) {
      this.name = requireNonNull(name);
      this.typeArguments = requireNonNull(typeArguments);
    }

    @Override
    public String toString() {
      return typeArguments.isEmpty()
          ? name
          : name + typeArguments.toString().replace('[', '<').replace(']', '>');
    }
  }

  /** Builder for a {@link TypeGraph}. */
  public static final class Builder {
    private final Map<String, ModuleBuilder> modules = new LinkedHashMap<>();
    private final List<DeclarationBuilder> declarations = new ArrayList<>();
    private boolean built;

    private Builder() {
      BuiltIn.declare(this);
    }

    /**
     * Returns the builder of a module, creating it if necessary. A new module
     * refers to the module of built-in types.
     */
    public ModuleBuilder module(String name) {
      checkState(!built, "already built");
      return modules.computeIfAbsent(
          name,
          n -> {
            final ModuleBuilder module = new ModuleBuilder(this, n);
            if (!n.equals(BuiltIn.MODULE_NAME)) {
              module.reference(BuiltIn.MODULE_NAME);
            }
            return module;
          });
    }

    /**
     * Builds the graph.
     *
     * @throws TypeGraphException if a reference cannot be resolved
     * @throws IllegalArgumentException if the graph is not well-formed; for
     *     example, if a type inherits from itself
     */
    public TypeGraph build() {
      checkState(!built, "already built");
      built = true;

      // Create declarations. A container is always created before the types
      // nested in it.
      final Map<DeclarationBuilder, Declaration> map = new IdentityHashMap<>();
      final Map<String, Declaration> byName = new LinkedHashMap<>();
      for (DeclarationBuilder db : declarations) {
        final Declaration container =
            db.container == null ? null : map.get(db.container);
        final Declaration d = db.toDeclaration(container);
        checkArgument(
            byName.put(d.metadataName(), d) == null,
            "duplicate type %s",
            d.metadataName());
        map.put(db, d);
      }

      // Define edges, resolving references.
      final Map<String, Declaration> keywords = keywords(byName.values());
      for (DeclarationBuilder db : declarations) {
        final Declaration d = requireNonNull(map.get(db));
        final EdgeResolver resolver = new EdgeResolver(byName, keywords, d);
        TypeNode baseType =
            db.baseType == null ? null : resolver.node(db.baseType);
        final List<TypeNode> interfaces =
            new ArrayList<>(transformEager(db.interfaces, resolver::node));
        for (Ref ref : db.inherits) {
          final TypeNode t = resolver.node(ref);
          if (t.kind() == TypeKind.CLASS && baseType == null) {
            baseType = t;
          } else {
            interfaces.add(t);
          }
        }
        if (baseType == null) {
          baseType = defaultBaseType(d, byName);
        }
        checkEdges(d, baseType, interfaces);
        d.define(
            baseType,
            interfaces,
            transformEager(db.markers, resolver::node),
            constructors(d, db.constructors),
            transformEager(db.nested, n -> requireNonNull(map.get(n))));
      }
      for (Declaration d : byName.values()) {
        checkAcyclic(d);
      }

      final Map<String, Module> moduleMap = new LinkedHashMap<>();
      for (ModuleBuilder mb : modules.values()) {
        for (String reference : mb.references) {
          checkArgument(
              modules.containsKey(reference),
              "module %s refers to unknown module %s",
              mb.name,
              reference);
        }
        moduleMap.put(
            mb.name,
            new Module(
                mb.name,
                ImmutableList.copyOf(mb.references),
                mb.internalsVisibleTo,
                mb.global.toNamespace(map)));
      }
      return new TypeGraph(moduleMap, byName);
    }

    private static @Nullable TypeNode defaultBaseType(
        Declaration d, Map<String, Declaration> byName) {
      final BuiltIn builtIn;
      switch (d.kind) {
        case CLASS:
          if (d.metadataName().equals(BuiltIn.OBJECT.metadataName())) {
            return null;
          }
          builtIn = BuiltIn.OBJECT;
          break;
        case STRUCT:
          builtIn = BuiltIn.VALUE_TYPE;
          break;
        case ENUM:
          builtIn = BuiltIn.ENUM;
          break;
        default:
          return null;
      }
      final Declaration base = byName.get(builtIn.metadataName());
      return base == null ? null : base.definition();
    }

    private static void checkEdges(
        Declaration d, @Nullable TypeNode baseType, List<TypeNode> interfaces) {
      if (baseType != null) {
        checkArgument(
            d.kind != TypeKind.INTERFACE,
            "interface %s cannot have base type %s",
            d,
            baseType);
        checkArgument(
            baseType.kind() == TypeKind.CLASS,
            "base type %s of %s is not a class",
            baseType,
            d);
      }
      for (TypeNode i : interfaces) {
        checkArgument(
            i.isInterface(), "%s is not an interface, in %s", i, d);
      }
    }

    /** Adds implicit constructors. */
    private static List<Constructor> constructors(
        Declaration d, List<Constructor> declared) {
      final List<Constructor> list = new ArrayList<>(declared);
      switch (d.kind) {
        case CLASS:
          if (!d.isStatic() && allMatch(list, c -> c.isStatic)) {
            list.add(
                d.isAbstract()
                    ? Constructor.of(Accessibility.PROTECTED, 0)
                    : Constructor.DEFAULT);
          }
          break;
        case STRUCT:
        case ENUM:
          if (list.stream()
              .noneMatch(c -> !c.isStatic && c.parameterCount == 0)) {
            list.add(Constructor.DEFAULT);
          }
          break;
        default:
          break;
      }
      return list;
    }

    /**
     * Throws if a declaration is among its own base types or (for an
     * interface) among the interfaces it extends.
     */
    private static void checkAcyclic(Declaration d) {
      final Set<Declaration> seen = new HashSet<>();
      for (TypeNode t = d.baseType(); t != null; t = t.declaration.baseType()) {
        checkArgument(
            t.declaration != d && seen.add(t.declaration),
            "cycle in base types of %s",
            d);
      }
      checkInterfacesAcyclic(d, d, new LinkedHashSet<>());
    }

    private static void checkInterfacesAcyclic(
        Declaration root, Declaration d, Set<Declaration> path) {
      checkArgument(path.add(d), "cycle in interfaces of %s", root);
      for (TypeNode i : d.interfaces()) {
        checkInterfacesAcyclic(root, i.declaration, path);
      }
      path.remove(d);
    }
  }

  /** Resolves references from within a declaration. */
  private static class EdgeResolver {
    final Map<String, Declaration> declarations;
    final Map<String, Declaration> keywords;
    final Declaration context;

    EdgeResolver(
        Map<String, Declaration> declarations,
        Map<String, Declaration> keywords,
        Declaration context) {
      this.declarations = declarations;
      this.keywords = keywords;
      this.context = context;
    }

    TypeNode node(Ref ref) {
      final Type type = type(ref);
      if (!(type instanceof TypeNode)) {
        throw new TypeGraphException(
            "type parameter '" + ref + "' cannot be used here, in " + context);
      }
      return (TypeNode) type;
    }

    Type type(Ref ref) {
      if (ref.typeArguments.isEmpty()) {
        for (Declaration c = context; c != null; c = c.container) {
          for (TypeParameter p : c.typeParameters) {
            if (p.name.equals(ref.name)) {
              return p;
            }
          }
        }
      }
      final Declaration d =
          resolve(
              declarations,
              keywords,
              ref.name,
              ref.typeArguments.size(),
              context.namespace,
              context);
      if (d == null) {
        throw new TypeGraphException(
            "cannot resolve type '" + ref + "' in " + context);
      }
      return d.apply(transformEager(ref.typeArguments, this::type));
    }
  }

  /** Builder for a {@link Module}. */
  public static final class ModuleBuilder {
    private final Builder builder;
    private final String name;
    private final List<String> references = new ArrayList<>();
    private final Set<String> internalsVisibleTo = new LinkedHashSet<>();
    private final NamespaceBuilder global = new NamespaceBuilder("", "");

    private ModuleBuilder(Builder builder, String name) {
      this.builder = builder;
      this.name = requireNonNull(name);
    }

    /** Adds a reference to another module. */
    @CanIgnoreReturnValue
    public ModuleBuilder reference(String moduleName) {
      if (!references.contains(moduleName)) {
        references.add(moduleName);
      }
      return this;
    }

    /** Allows another module to see this module's internal types. */
    @CanIgnoreReturnValue
    public ModuleBuilder internalsVisibleTo(String moduleName) {
      internalsVisibleTo.add(moduleName);
      return this;
    }

    /**
     * Declares a top-level type.
     *
     * @param namespace Namespace, e.g. "{@code GeneratorTests}", or empty
     * @param name Simple name
     * @param kind Kind
     */
    public DeclarationBuilder declare(
        String namespace, String name, TypeKind kind) {
      checkState(!builder.built, "already built");
      final DeclarationBuilder d =
          new DeclarationBuilder(
              builder, this.name, namespace, null, name, kind);
      global.namespace(namespace).members.add(d);
      builder.declarations.add(d);
      return d;
    }
  }

  /** Builder for a {@link Namespace}. */
  private static final class NamespaceBuilder {
    final String name;
    final String qualifiedName;
    final List<Object> members = new ArrayList<>();
    final Map<String, NamespaceBuilder> children = new LinkedHashMap<>();

    NamespaceBuilder(String name, String qualifiedName) {
      this.name = name;
      this.qualifiedName = qualifiedName;
    }

    /** Returns the builder of a namespace, creating it if necessary. */
    NamespaceBuilder namespace(String path) {
      NamespaceBuilder ns = this;
      if (path.isEmpty()) {
        return ns;
      }
      for (String segment : path.split("\\.")) {
        checkArgument(!segment.isEmpty(), "invalid namespace '%s'", path);
        final NamespaceBuilder parent = ns;
        ns =
            parent.children.computeIfAbsent(
                segment,
                s -> {
                  final String q =
                      parent.qualifiedName.isEmpty()
                          ? s
                          : parent.qualifiedName + "." + s;
                  final NamespaceBuilder child = new NamespaceBuilder(s, q);
                  parent.members.add(child);
                  return child;
                });
      }
      return ns;
    }

    Namespace toNamespace(Map<DeclarationBuilder, Declaration> map) {
      final List<NamespaceOrType> list = new ArrayList<>();
      for (Object member : members) {
        if (member instanceof NamespaceBuilder) {
          list.add(((NamespaceBuilder) member).toNamespace(map));
        } else {
          list.add(requireNonNull(map.get((DeclarationBuilder) member)));
        }
      }
      return new Namespace(name, qualifiedName, list);
    }
  }

  /** Builder for a {@link Declaration}. */
  public static final class DeclarationBuilder {
    private final Builder builder;
    private final String moduleName;
    private final String namespace;
    private final @Nullable DeclarationBuilder container;
    private final String name;
    private final TypeKind kind;
    private final Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private Accessibility accessibility;
    private boolean nameable = true;
    private boolean unmanaged;
    private @Nullable String keyword;
    private final List<String> typeParameterNames = new ArrayList<>();

    private @Nullable Ref baseType;
    private final List<Ref> interfaces = new ArrayList<>();
    private final List<Ref> inherits = new ArrayList<>();
    private final List<Ref> markers = new ArrayList<>();
    private final List<Constructor> constructors = new ArrayList<>();
    private final List<DeclarationBuilder> nested = new ArrayList<>();

    private DeclarationBuilder(
        Builder builder,
        String moduleName,
        String namespace,
        @Nullable DeclarationBuilder container,
        String name,
        TypeKind kind) {
      this.builder = builder;
      this.moduleName = moduleName;
      this.namespace = namespace;
      this.container = container;
      this.name = requireNonNull(name);
      this.kind = requireNonNull(kind);
      this.accessibility =
          container == null ? Accessibility.INTERNAL : Accessibility.PRIVATE;
    }

    Declaration toDeclaration(@Nullable Declaration container) {
      return new Declaration(
          moduleName,
          namespace,
          container,
          name,
          kind,
          modifiers,
          accessibility,
          nameable,
          unmanaged,
          keyword,
          typeParameterNames);
    }

    /**
     * Sets the accessibility. The default is {@link Accessibility#INTERNAL}
     * for a top-level type and {@link Accessibility#PRIVATE} for a nested
     * type.
     */
    @CanIgnoreReturnValue
    public DeclarationBuilder accessibility(Accessibility accessibility) {
      this.accessibility = requireNonNull(accessibility);
      return this;
    }

    @CanIgnoreReturnValue
    public DeclarationBuilder modifiers(Modifier... modifiers) {
      this.modifiers.addAll(Arrays.asList(modifiers));
      return this;
    }

    @CanIgnoreReturnValue
    public DeclarationBuilder typeParameters(List<String> names) {
      typeParameterNames.addAll(names);
      return this;
    }

    @CanIgnoreReturnValue
    public DeclarationBuilder typeParameters(String... names) {
      return typeParameters(Arrays.asList(names));
    }

    /** Marks a struct as holding no references. */
    @CanIgnoreReturnValue
    public DeclarationBuilder unmanaged() {
      this.unmanaged = true;
      return this;
    }

    /**
     * Marks the type as having a name that cannot be written in source code,
     * such as a compiler-generated closure class.
     */
    @CanIgnoreReturnValue
    public DeclarationBuilder unnameable() {
      this.nameable = false;
      return this;
    }

    @CanIgnoreReturnValue
    public DeclarationBuilder keyword(String keyword) {
      this.keyword = requireNonNull(keyword);
      return this;
    }

    /** Sets the base class. */
    @CanIgnoreReturnValue
    public DeclarationBuilder extend(Ref baseType) {
      checkState(this.baseType == null, "base type already set");
      this.baseType = requireNonNull(baseType);
      return this;
    }

    /** Adds implemented (or, for an interface, extended) interfaces. */
    @CanIgnoreReturnValue
    public DeclarationBuilder implement(Ref... interfaces) {
      this.interfaces.addAll(Arrays.asList(interfaces));
      return this;
    }

    /**
     * Adds a type to the base list, as in "{@code class C : B, I}". When the
     * graph is built, the first class in the list becomes the base type and
     * the others must be interfaces.
     */
    @CanIgnoreReturnValue
    public DeclarationBuilder inherit(Ref type) {
      this.inherits.add(requireNonNull(type));
      return this;
    }

    /** Applies a marker tag (attribute). */
    @CanIgnoreReturnValue
    public DeclarationBuilder mark(Ref marker) {
      this.markers.add(requireNonNull(marker));
      return this;
    }

    @CanIgnoreReturnValue
    public DeclarationBuilder constructor(Constructor constructor) {
      this.constructors.add(requireNonNull(constructor));
      return this;
    }

    /** Declares a type nested in this one. */
    public DeclarationBuilder declareNested(String name, TypeKind kind) {
      checkState(!builder.built, "already built");
      final DeclarationBuilder d =
          new DeclarationBuilder(
              builder, moduleName, namespace, this, name, kind);
      nested.add(d);
      builder.declarations.add(d);
      return d;
    }
  }
}

// End TypeGraph.java
