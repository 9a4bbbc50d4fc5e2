package ai.codenav.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A call expression found inside a method body.
 *
 * @param calleeText the callee as written at the call site (e.g. {@code repo.save}); used to label unresolved calls
 * @param target the declaration the call resolves to, or null if it could not be resolved
 * @param line 1-based line of the call expression
 */
public record CallSite(String calleeText, @Nullable ElementHandle target, int line) {

    public boolean isResolved() {
        return target != null;
    }

    /** The short callee name, i.e. the last segment of {@link #calleeText()}. */
    public String calleeName() {
        int lastDot = calleeText.lastIndexOf('.');
        return lastDot >= 0 ? calleeText.substring(lastDot + 1) : calleeText;
    }
}
