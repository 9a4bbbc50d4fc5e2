package ai.codenav.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A supertype as written in a type declaration's header.
 *
 * @param declaredName the name as declared (qualified when the front end knows it)
 * @param target the resolved declaration, or null when the reference points outside the indexed code or is broken
 * @param interfaceSlot true when the reference appears in an interface/implements position rather than as the
 *     superclass
 */
public record TypeReference(String declaredName, @Nullable ElementHandle target, boolean interfaceSlot) {

    public static TypeReference resolved(String declaredName, ElementHandle target, boolean interfaceSlot) {
        return new TypeReference(declaredName, target, interfaceSlot);
    }

    public static TypeReference unresolved(String declaredName, boolean interfaceSlot) {
        return new TypeReference(declaredName, null, interfaceSlot);
    }

    public boolean isResolved() {
        return target != null;
    }
}
