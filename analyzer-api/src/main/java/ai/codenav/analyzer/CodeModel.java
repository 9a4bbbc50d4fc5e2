package ai.codenav.analyzer;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Read-only access to the host's pre-built semantic model of a codebase: declarations, their supertypes and overrides,
 * references and call sites, and name enumeration.
 *
 * <p>The query engine never parses source text or keeps an index of its own; everything it knows comes through this
 * interface. Implementations are expected to be safe for concurrent reads while the caller holds whatever
 * read-consistency scope the host requires.
 *
 * <p>Any method may throw {@link IndexNotReadyException} while the backing index is still being built.
 *
 * <p><b>Sequences:</b> methods returning a {@link Stream} are lazy and finite; each call returns a fresh stream, so a
 * traversal can be restarted by calling again.
 */
public interface CodeModel {

    /** Languages this model has facts for. Language families probe this before registering their providers. */
    Set<Language> languages();

    /** False while the backing index is being (re)built. */
    default boolean isReady() {
        return true;
    }

    // Resolution

    /**
     * Resolves the innermost element at a source position.
     *
     * @param file path relative to the project root
     * @param line 1-based line
     * @param column 1-based column
     */
    Optional<ElementHandle> resolveAt(String file, int line, int column);

    /** Resolves a declaration by its fully-qualified name. */
    Optional<ElementHandle> resolveByQualifiedName(String qualifiedName);

    // Hierarchy

    /**
     * Supertypes as declared in the type's header: the superclass (if any) first, then interfaces in declaration
     * order. References that cannot be resolved are still returned, with a null target.
     */
    List<TypeReference> declaredSupertypes(ElementHandle type);

    /** All direct and indirect subtypes of a type. Transitivity is the model's responsibility. */
    Stream<ElementHandle> transitiveSubtypes(ElementHandle type);

    /** All methods that override or implement the given method, directly or indirectly. */
    Stream<ElementHandle> overridingMethods(ElementHandle method);

    /** Methods the given method directly overrides or implements (nearest ancestors only). */
    List<ElementHandle> overriddenMethods(ElementHandle method);

    /** Methods or fields declared directly in a type with the given simple name. */
    List<ElementHandle> membersNamed(ElementHandle type, String name);

    // References and calls

    /**
     * Reference occurrences of a declaration. Each returned handle is a reference site; use {@link #containerOf} (or
     * {@link #enclosing}) to map it to the declaration that contains it.
     */
    Stream<ElementHandle> referencesTo(ElementHandle element, SearchScope scope);

    /** The declaration a reference occurrence points to. Empty for declarations and for unresolved references. */
    Optional<ElementHandle> targetOf(ElementHandle reference);

    /** Call expressions found syntactically inside a callable's body, in source order. */
    Stream<CallSite> callSitesWithin(ElementHandle callable);

    // Name enumeration

    /** Every distinct declared simple name in a category. */
    Stream<String> allDeclaredNames(SymbolCategory category, SearchScope scope);

    /** Every declaration with exactly the given simple name in a category. */
    Stream<ElementHandle> declarationsNamed(String name, SymbolCategory category, SearchScope scope);

    // Element facts

    Optional<SourceLocation> locationOf(ElementHandle element);

    ElementKind kindOf(ElementHandle element);

    Language languageOf(ElementHandle element);

    /** Simple name of a declaration (for a reference site, the referenced name). */
    String nameOf(ElementHandle element);

    Optional<String> qualifiedNameOf(ElementHandle element);

    /**
     * A human-readable signature for callables, e.g. {@code save(User user): void}. Empty for elements that have no
     * signature.
     */
    Optional<String> signatureOf(ElementHandle element);

    /** Parameter types of a callable as the language renders them; empty list for a parameterless callable. */
    List<String> parameterTypesOf(ElementHandle callable);

    /** The immediately enclosing declaration (a reference's method, a method's type, a type's outer type). */
    Optional<ElementHandle> containerOf(ElementHandle element);

    /** The declaration an element denotes: a reference occurrence's target, otherwise the element itself. */
    default Optional<ElementHandle> declarationOf(ElementHandle element) {
        return kindOf(element) == ElementKind.REFERENCE ? targetOf(element) : Optional.of(element);
    }

    /** True for declarations that come from libraries or other external dependencies rather than project sources. */
    default boolean isLibrary(ElementHandle element) {
        return false;
    }

    /**
     * Walks outward from an element (inclusive) via {@link #containerOf} until an element whose kind satisfies the
     * predicate is found.
     */
    default Optional<ElementHandle> enclosing(ElementHandle element, Predicate<ElementKind> kindFilter) {
        var current = Optional.of(element);
        // Bounded so a containment cycle in a broken model cannot loop forever.
        for (int steps = 0; current.isPresent() && steps < 64; steps++) {
            var handle = current.get();
            if (kindFilter.test(kindOf(handle))) {
                return current;
            }
            current = containerOf(handle);
        }
        return Optional.empty();
    }
}
