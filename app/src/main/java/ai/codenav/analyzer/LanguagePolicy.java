package ai.codenav.analyzer;

import java.util.List;
import java.util.Optional;

/**
 * The per-language knobs the shared resolvers consult. Each language family supplies one; everything else about a
 * query is language-neutral.
 */
public interface LanguagePolicy {

    /** Whether an element of this language belongs to the family the policy describes. */
    boolean handles(Language language);

    /** True for the language's universal root type, which is never reported as a supertype. */
    boolean isImplicitRoot(String qualifiedName);

    /** Kind to report for a type declaration. */
    ElementKind typeKindOf(ElementHandle type);

    /** Parameter types used in method keys and rendered call names. */
    List<String> parameterTypesOf(ElementHandle callable);

    /** Whether a same-named ancestor method is overridden by {@code method}, judged by their parameters. */
    boolean sameSignature(ElementHandle method, ElementHandle ancestorMethod);

    /** Methods the given method directly overrides or implements. */
    List<ElementHandle> directSuperMethods(ElementHandle method);

    /** Name of the declaration that contains a search hit, for display. */
    Optional<String> containerNameOf(ElementHandle declaration);
}
