package ai.codenav.index;

import ai.codenav.analyzer.CallSite;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.IndexNotReadyException;
import ai.codenav.analyzer.Language;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.analyzer.SourceLocation;
import ai.codenav.analyzer.SymbolCategory;
import ai.codenav.analyzer.TypeReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link CodeModel} over declaration facts produced elsewhere (an IDE export, a compiler plugin, a test fixture).
 *
 * <p>Built once through {@link Builder}; afterwards the facts are immutable and safe for concurrent reads. Positions
 * resolve to the innermost element covering them: a reference occurrence if the column falls on one, else the
 * declaration with the narrowest line span.
 */
public class InMemoryCodeModel implements CodeModel {

    /** A reference occurrence: {@code from} is the declaration the occurrence sits in. */
    private record Reference(ElementHandle target, ElementHandle from, int line, int column, String name) {
        boolean covers(int atLine, int atColumn) {
            return line == atLine && column <= atColumn && atColumn < column + Math.max(1, name.length());
        }
    }

    private final Map<ElementHandle, Declaration> declarations;
    private final Map<ElementHandle, Reference> references;
    private final Map<ElementHandle, List<TypeReference>> supertypes;
    private final Map<ElementHandle, List<ElementHandle>> directSubtypes;
    private final Map<ElementHandle, List<ElementHandle>> overridden;
    private final Map<ElementHandle, List<ElementHandle>> overriders;
    private final Map<ElementHandle, List<ElementHandle>> referencesByTarget;
    private final Map<ElementHandle, List<CallSite>> callSites;
    private final Map<ElementHandle, List<ElementHandle>> members;
    private final Map<String, ElementHandle> byQualifiedName;
    private final Set<Language> languages;
    private volatile boolean ready = true;

    protected InMemoryCodeModel(Builder builder) {
        this.declarations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.declarations));
        this.references = Map.copyOf(builder.references);
        this.supertypes = copyOfLists(builder.supertypes);
        this.overridden = copyOfLists(builder.overridden);
        this.callSites = copyOfLists(builder.callSites);

        var subtypes = new LinkedHashMap<ElementHandle, List<ElementHandle>>();
        supertypes.forEach((sub, refs) -> refs.stream()
                .map(TypeReference::target)
                .filter(Objects::nonNull)
                .forEach(sup -> subtypes.computeIfAbsent(sup, k -> new ArrayList<>()).add(sub)));
        this.directSubtypes = copyOfLists(subtypes);

        var reverseOverrides = new LinkedHashMap<ElementHandle, List<ElementHandle>>();
        overridden.forEach((method, supers) ->
                supers.forEach(sup -> reverseOverrides.computeIfAbsent(sup, k -> new ArrayList<>()).add(method)));
        this.overriders = copyOfLists(reverseOverrides);

        var refsByTarget = new LinkedHashMap<ElementHandle, List<ElementHandle>>();
        builder.references.forEach(
                (handle, ref) -> refsByTarget.computeIfAbsent(ref.target(), k -> new ArrayList<>()).add(handle));
        this.referencesByTarget = copyOfLists(refsByTarget);

        var membersByContainer = new LinkedHashMap<ElementHandle, List<ElementHandle>>();
        var qualified = new HashMap<String, ElementHandle>();
        for (var entry : declarations.entrySet()) {
            var decl = entry.getValue();
            if (decl.container() != null) {
                membersByContainer
                        .computeIfAbsent(new ElementHandle(decl.container()), k -> new ArrayList<>())
                        .add(entry.getKey());
            }
            if (decl.qualifiedName() != null) {
                qualified.putIfAbsent(decl.qualifiedName(), entry.getKey());
            }
        }
        this.members = copyOfLists(membersByContainer);
        this.byQualifiedName = Map.copyOf(qualified);
        this.languages = declarations.values().stream()
                .map(Declaration::language)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static <K, V> Map<K, List<V>> copyOfLists(Map<K, ? extends List<V>> source) {
        var copy = new LinkedHashMap<K, List<V>>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Marks the model as (re)indexing; while not ready every query method throws {@link IndexNotReadyException}. */
    public void setReady(boolean ready) {
        this.ready = ready;
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    private void checkReady() {
        if (!ready) {
            throw new IndexNotReadyException("Code model is being indexed");
        }
    }

    /** All declarations, in insertion order. */
    public List<Declaration> declarations() {
        return List.copyOf(declarations.values());
    }

    @Override
    public Set<Language> languages() {
        return Collections.unmodifiableSet(languages);
    }

    @Override
    public Optional<ElementHandle> resolveAt(String file, int line, int column) {
        checkReady();
        var reference = references.entrySet().stream()
                .filter(e -> file.equals(fileOf(e.getValue().from())) && e.getValue().covers(line, column))
                .map(Map.Entry::getKey)
                .findFirst();
        if (reference.isPresent()) {
            return reference;
        }
        return declarations.entrySet().stream()
                .filter(e -> file.equals(e.getValue().file()) && e.getValue().spans(line))
                .min((a, b) -> {
                    var da = a.getValue();
                    var db = b.getValue();
                    int bySpan = Integer.compare(da.endLine() - da.line(), db.endLine() - db.line());
                    return bySpan != 0 ? bySpan : Integer.compare(db.line(), da.line());
                })
                .map(Map.Entry::getKey);
    }

    @Override
    public Optional<ElementHandle> resolveByQualifiedName(String qualifiedName) {
        checkReady();
        return Optional.ofNullable(byQualifiedName.get(qualifiedName));
    }

    @Override
    public List<TypeReference> declaredSupertypes(ElementHandle type) {
        checkReady();
        return supertypes.getOrDefault(type, List.of());
    }

    @Override
    public Stream<ElementHandle> transitiveSubtypes(ElementHandle type) {
        checkReady();
        return closure(type, t -> directSubtypes.getOrDefault(t, List.of())).stream();
    }

    @Override
    public Stream<ElementHandle> overridingMethods(ElementHandle method) {
        checkReady();
        return closure(method, m -> overriders.getOrDefault(m, List.of())).stream();
    }

    /** Breadth-first closure over an edge function, excluding the start. */
    private static List<ElementHandle> closure(
            ElementHandle start, Function<ElementHandle, List<ElementHandle>> edges) {
        var seen = new LinkedHashSet<ElementHandle>();
        var queue = new ArrayDeque<ElementHandle>();
        queue.add(start);
        while (!queue.isEmpty()) {
            for (var next : edges.apply(queue.poll())) {
                if (!next.equals(start) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return List.copyOf(seen);
    }

    @Override
    public List<ElementHandle> overriddenMethods(ElementHandle method) {
        checkReady();
        return overridden.getOrDefault(method, List.of());
    }

    @Override
    public List<ElementHandle> membersNamed(ElementHandle type, String name) {
        checkReady();
        return members.getOrDefault(type, List.of()).stream()
                .filter(m -> name.equals(declaration(m).name()))
                .toList();
    }

    @Override
    public Stream<ElementHandle> referencesTo(ElementHandle element, SearchScope scope) {
        checkReady();
        return referencesByTarget.getOrDefault(element, List.of()).stream()
                .filter(ref -> scope == SearchScope.ALL || !isLibrary(references.get(ref).from()));
    }

    @Override
    public Optional<ElementHandle> targetOf(ElementHandle reference) {
        checkReady();
        return Optional.ofNullable(references.get(reference)).map(Reference::target);
    }

    @Override
    public Stream<CallSite> callSitesWithin(ElementHandle callable) {
        checkReady();
        return callSites.getOrDefault(callable, List.of()).stream();
    }

    @Override
    public Stream<String> allDeclaredNames(SymbolCategory category, SearchScope scope) {
        checkReady();
        return declarationsIn(category, scope).map(Declaration::name).distinct();
    }

    @Override
    public Stream<ElementHandle> declarationsNamed(String name, SymbolCategory category, SearchScope scope) {
        checkReady();
        return declarationsIn(category, scope)
                .filter(d -> d.name().equals(name))
                .map(d -> new ElementHandle(d.id()));
    }

    private Stream<Declaration> declarationsIn(SymbolCategory category, SearchScope scope) {
        return declarations.values().stream()
                .filter(d -> d.kind().category() == category)
                .filter(d -> scope == SearchScope.ALL || !d.library());
    }

    @Override
    public Optional<SourceLocation> locationOf(ElementHandle element) {
        checkReady();
        var ref = references.get(element);
        if (ref != null) {
            var file = fileOf(ref.from());
            return file == null ? Optional.empty() : Optional.of(new SourceLocation(file, ref.line(), ref.column()));
        }
        var decl = declaration(element);
        return decl.file() == null ? Optional.empty() : Optional.of(new SourceLocation(decl.file(), decl.line()));
    }

    private @Nullable String fileOf(ElementHandle declaration) {
        var decl = declarations.get(declaration);
        return decl == null ? null : decl.file();
    }

    @Override
    public ElementKind kindOf(ElementHandle element) {
        checkReady();
        return references.containsKey(element) ? ElementKind.REFERENCE : declaration(element).kind();
    }

    @Override
    public Language languageOf(ElementHandle element) {
        checkReady();
        var ref = references.get(element);
        return declaration(ref != null ? ref.from() : element).language();
    }

    @Override
    public String nameOf(ElementHandle element) {
        checkReady();
        var ref = references.get(element);
        return ref != null ? ref.name() : declaration(element).name();
    }

    @Override
    public Optional<String> qualifiedNameOf(ElementHandle element) {
        checkReady();
        if (references.containsKey(element)) {
            return Optional.empty();
        }
        return Optional.ofNullable(declaration(element).qualifiedName());
    }

    @Override
    public Optional<String> signatureOf(ElementHandle element) {
        checkReady();
        if (references.containsKey(element)) {
            return Optional.empty();
        }
        return Optional.ofNullable(declaration(element).signature());
    }

    @Override
    public List<String> parameterTypesOf(ElementHandle callable) {
        checkReady();
        if (references.containsKey(callable)) {
            return List.of();
        }
        return declaration(callable).parameterTypes();
    }

    @Override
    public Optional<ElementHandle> containerOf(ElementHandle element) {
        checkReady();
        var ref = references.get(element);
        if (ref != null) {
            return Optional.of(ref.from());
        }
        var container = declaration(element).container();
        return container == null ? Optional.empty() : Optional.of(new ElementHandle(container));
    }

    @Override
    public boolean isLibrary(ElementHandle element) {
        var ref = references.get(element);
        var decl = declarations.get(ref != null ? ref.from() : element);
        return decl != null && decl.library();
    }

    private Declaration declaration(ElementHandle handle) {
        var decl = declarations.get(handle);
        if (decl == null) {
            throw new IllegalArgumentException("Unknown element " + handle);
        }
        return decl;
    }

    /**
     * Collects facts for an {@link InMemoryCodeModel}. Convenience methods derive ids and qualified names from the
     * owner: a method {@code run()} in {@code com.example.Dog} gets id {@code com.example.Dog.run()} and qualified
     * name {@code com.example.Dog.run}.
     */
    public static class Builder {
        private final Map<ElementHandle, Declaration> declarations = new LinkedHashMap<>();
        private final Map<ElementHandle, Reference> references = new LinkedHashMap<>();
        private final Map<ElementHandle, List<TypeReference>> supertypes = new LinkedHashMap<>();
        private final Map<ElementHandle, List<ElementHandle>> overridden = new LinkedHashMap<>();
        private final Map<ElementHandle, List<CallSite>> callSites = new LinkedHashMap<>();
        private int referenceCounter;

        protected Builder() {}

        public ElementHandle declare(Declaration declaration) {
            var handle = new ElementHandle(declaration.id());
            if (declarations.putIfAbsent(handle, declaration) != null) {
                throw new IllegalArgumentException("Duplicate declaration id " + declaration.id());
            }
            return handle;
        }

        /** A top-level type; {@code endLine} closes its body. */
        public ElementHandle type(
                String qualifiedName, ElementKind kind, Language language, String file, int line, int endLine) {
            return declare(new Declaration(
                    qualifiedName,
                    simpleName(qualifiedName),
                    qualifiedName,
                    kind,
                    language,
                    file,
                    line,
                    endLine,
                    null,
                    List.of(),
                    null,
                    false));
        }

        /** A type nested in another type. */
        public ElementHandle nestedType(ElementHandle outer, String name, ElementKind kind, int line, int endLine) {
            var owner = owner(outer);
            var qualifiedName = qualifiedOf(owner) + "." + name;
            return declare(new Declaration(
                    qualifiedName,
                    name,
                    qualifiedName,
                    kind,
                    owner.language(),
                    owner.file(),
                    line,
                    endLine,
                    owner.id(),
                    List.of(),
                    null,
                    owner.library()));
        }

        public ElementHandle method(ElementHandle owner, String name, List<String> parameterTypes, int line, int endLine) {
            return member(owner, name, ElementKind.METHOD, parameterTypes, null, line, endLine);
        }

        public ElementHandle method(
                ElementHandle owner,
                String name,
                List<String> parameterTypes,
                @Nullable String signature,
                int line,
                int endLine) {
            return member(owner, name, ElementKind.METHOD, parameterTypes, signature, line, endLine);
        }

        public ElementHandle field(ElementHandle owner, String name, int line) {
            return member(owner, name, ElementKind.FIELD, List.of(), null, line, line);
        }

        private ElementHandle member(
                ElementHandle ownerHandle,
                String name,
                ElementKind kind,
                List<String> parameterTypes,
                @Nullable String signature,
                int line,
                int endLine) {
            var owner = owner(ownerHandle);
            var qualifiedName = qualifiedOf(owner) + "." + name;
            var id = kind.isCallable() ? qualifiedName + "(" + String.join(",", parameterTypes) + ")" : qualifiedName;
            return declare(new Declaration(
                    id,
                    name,
                    qualifiedName,
                    kind,
                    owner.language(),
                    owner.file(),
                    line,
                    endLine,
                    owner.id(),
                    parameterTypes,
                    signature,
                    owner.library()));
        }

        /** A free function, e.g. a Python module-level {@code def} or a JavaScript top-level function. */
        public ElementHandle function(
                String qualifiedName,
                Language language,
                String file,
                List<String> parameterTypes,
                int line,
                int endLine) {
            return declare(new Declaration(
                    qualifiedName + "(" + String.join(",", parameterTypes) + ")",
                    simpleName(qualifiedName),
                    qualifiedName,
                    ElementKind.FUNCTION,
                    language,
                    file,
                    line,
                    endLine,
                    null,
                    parameterTypes,
                    null,
                    false));
        }

        public ElementHandle variable(String qualifiedName, Language language, String file, int line) {
            return declare(new Declaration(
                    qualifiedName,
                    simpleName(qualifiedName),
                    qualifiedName,
                    ElementKind.VARIABLE,
                    language,
                    file,
                    line,
                    line,
                    null,
                    List.of(),
                    null,
                    false));
        }

        /** Marks a declaration, and everything declared inside it afterwards, as library code. */
        public Builder library(ElementHandle handle) {
            var decl = owner(handle);
            declarations.put(
                    handle,
                    new Declaration(
                            decl.id(),
                            decl.name(),
                            decl.qualifiedName(),
                            decl.kind(),
                            decl.language(),
                            decl.file(),
                            decl.line(),
                            decl.endLine(),
                            decl.container(),
                            decl.parameterTypes(),
                            decl.signature(),
                            true));
            return this;
        }

        // Hierarchy facts. Supertypes keep the order they are added in: add the superclass first.

        public Builder extendsType(ElementHandle type, ElementHandle superclass) {
            return supertype(type, TypeReference.resolved(qualifiedOf(owner(superclass)), superclass, false));
        }

        public Builder implementsType(ElementHandle type, ElementHandle iface) {
            return supertype(type, TypeReference.resolved(qualifiedOf(owner(iface)), iface, true));
        }

        public Builder extendsUnresolved(ElementHandle type, String declaredName) {
            return supertype(type, TypeReference.unresolved(declaredName, false));
        }

        public Builder implementsUnresolved(ElementHandle type, String declaredName) {
            return supertype(type, TypeReference.unresolved(declaredName, true));
        }

        public Builder supertype(ElementHandle type, TypeReference reference) {
            owner(type);
            supertypes.computeIfAbsent(type, k -> new ArrayList<>()).add(reference);
            return this;
        }

        public Builder overrides(ElementHandle method, ElementHandle superMethod) {
            owner(method);
            owner(superMethod);
            overridden.computeIfAbsent(method, k -> new ArrayList<>()).add(superMethod);
            return this;
        }

        // Reference facts

        /** A reference to {@code target} inside {@code from}, without a call site. Returns the reference handle. */
        public ElementHandle reference(ElementHandle from, ElementHandle target, int line, int column) {
            owner(from);
            var handle = new ElementHandle("ref#" + (++referenceCounter));
            references.put(handle, new Reference(target, from, line, column, owner(target).name()));
            return handle;
        }

        /** A resolved call: records both the call site in {@code caller} and the reference to {@code callee}. */
        public ElementHandle call(ElementHandle caller, ElementHandle callee, int line, int column) {
            var ref = reference(caller, callee, line, column);
            callSites
                    .computeIfAbsent(caller, k -> new ArrayList<>())
                    .add(new CallSite(owner(callee).name(), callee, line));
            return ref;
        }

        public Builder unresolvedCall(ElementHandle caller, String calleeText, int line) {
            owner(caller);
            callSites.computeIfAbsent(caller, k -> new ArrayList<>()).add(new CallSite(calleeText, null, line));
            return this;
        }

        public InMemoryCodeModel build() {
            for (var decl : declarations.values()) {
                if (decl.container() != null && !declarations.containsKey(new ElementHandle(decl.container()))) {
                    throw new IllegalStateException(
                            "Declaration " + decl.id() + " names unknown container " + decl.container());
                }
            }
            return new InMemoryCodeModel(this);
        }

        private Declaration owner(ElementHandle handle) {
            var decl = declarations.get(handle);
            if (decl == null) {
                throw new IllegalArgumentException("Unknown declaration " + handle + "; declare it first");
            }
            return decl;
        }

        private static String qualifiedOf(Declaration decl) {
            return decl.qualifiedName() != null ? decl.qualifiedName() : decl.name();
        }

        private static String simpleName(String qualifiedName) {
            int lastDot = qualifiedName.lastIndexOf('.');
            return lastDot >= 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
        }
    }
}
