package ai.codenav.analyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A method or function in a call hierarchy.
 *
 * @param name rendered as {@code Container.method(ParamType, ...)}
 * @param children nested callers/callees, or null when not expanded or nothing was found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallNode(String name, String file, int line, String language, @Nullable List<CallNode> children) {

    public static final String UNKNOWN_FILE = "unknown";

    public CallNode {
        children = children == null || children.isEmpty() ? null : List.copyOf(children);
    }

    public static CallNode unresolved(String calleeText, String language) {
        return new CallNode(calleeText + "(...) [unresolved]", UNKNOWN_FILE, 0, language, null);
    }

    /** Siblings are distinct under this key. */
    public String siblingKey() {
        return name + "|" + file + "|" + line;
    }
}
