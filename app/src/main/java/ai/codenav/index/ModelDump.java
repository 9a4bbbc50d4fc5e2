package ai.codenav.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Wire form of an exported index, read by {@link JsonCodeModelLoader}. Declarations and facts refer to each other by
 * declaration id; {@code language} is a language id or name as understood by {@link
 * ai.codenav.analyzer.Languages#fromId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelDump(
        @Nullable List<DeclarationEntry> declarations,
        @Nullable List<SupertypeEntry> supertypes,
        @Nullable List<OverrideEntry> overrides,
        @Nullable List<CallEntry> calls,
        @Nullable List<ReferenceEntry> references) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DeclarationEntry(
            String id,
            String name,
            @Nullable String qualifiedName,
            String kind,
            String language,
            @Nullable String file,
            int line,
            @Nullable Integer endLine,
            @Nullable String container,
            @Nullable List<String> parameterTypes,
            @Nullable String signature,
            boolean library) {}

    /** A declared supertype; {@code target} is null when it did not resolve. Listed superclass first. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SupertypeEntry(
            String type, String name, @Nullable String target, @JsonProperty("isInterface") boolean isInterface) {}

    public record OverrideEntry(String method, String overrides) {}

    /** A call expression; {@code callee} is null when the call did not resolve. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CallEntry(String caller, @Nullable String callee, String text, int line, int column) {}

    /** A non-call reference, e.g. a method reference or a type used in a signature. */
    public record ReferenceEntry(String from, String target, int line, int column) {}
}
