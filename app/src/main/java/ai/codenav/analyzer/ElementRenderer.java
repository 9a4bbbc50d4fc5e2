package ai.codenav.analyzer;

import ai.codenav.analyzer.model.CallNode;
import ai.codenav.analyzer.model.ImplementationEntry;
import ai.codenav.analyzer.model.MethodInfo;
import ai.codenav.analyzer.model.SymbolMatch;
import ai.codenav.analyzer.model.TypeNode;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Turns model elements into detached result records. Holds no per-query state. */
public final class ElementRenderer {
    private final CodeModel model;
    private final LanguagePolicy policy;

    public ElementRenderer(CodeModel model, LanguagePolicy policy) {
        this.model = model;
        this.policy = policy;
    }

    public String languageName(ElementHandle element) {
        return model.languageOf(element).name();
    }

    public @Nullable String fileOf(ElementHandle element) {
        return model.locationOf(element).map(SourceLocation::path).orElse(null);
    }

    public @Nullable Integer lineOf(ElementHandle element) {
        return model.locationOf(element).map(SourceLocation::line).orElse(null);
    }

    /** Qualified name when the model knows one, otherwise the simple name. */
    public String displayName(ElementHandle element) {
        return model.qualifiedNameOf(element).orElseGet(() -> model.nameOf(element));
    }

    /** The type that declares a member, if the member is declared in a type. */
    public Optional<ElementHandle> declaringType(ElementHandle member) {
        return model.containerOf(member).filter(c -> model.kindOf(c).isType());
    }

    public TypeNode typeNode(ElementHandle type, @Nullable List<TypeNode> supertypes) {
        return new TypeNode(
                displayName(type),
                model.qualifiedNameOf(type).orElse(null),
                fileOf(type),
                lineOf(type),
                policy.typeKindOf(type),
                languageName(type),
                supertypes);
    }

    /**
     * Identity of a callable across one traversal: declaring container, name and parameter types. Overloads get
     * distinct keys.
     */
    public String methodKey(ElementHandle callable) {
        var container = model.containerOf(callable)
                .map(c -> model.qualifiedNameOf(c).orElseGet(() -> model.nameOf(c)))
                .or(() -> Optional.ofNullable(fileOf(callable)))
                .orElse("");
        return container + "." + model.nameOf(callable) + "(" + String.join(",", policy.parameterTypesOf(callable))
                + ")";
    }

    /** {@code Container.method(ParamType, ...)}; free functions have no container prefix. */
    public String callName(ElementHandle callable) {
        var prefix = declaringType(callable).map(t -> model.nameOf(t) + ".").orElse("");
        return prefix + model.nameOf(callable) + "(" + String.join(", ", policy.parameterTypesOf(callable)) + ")";
    }

    public CallNode callNode(ElementHandle callable, @Nullable List<CallNode> children) {
        var location = model.locationOf(callable);
        return new CallNode(
                callName(callable),
                location.map(SourceLocation::path).orElse(CallNode.UNKNOWN_FILE),
                location.map(SourceLocation::line).orElse(0),
                languageName(callable),
                children);
    }

    public String signatureOf(ElementHandle callable) {
        return model.signatureOf(callable)
                .orElseGet(() -> model.nameOf(callable) + "(" + String.join(", ", policy.parameterTypesOf(callable))
                        + ")");
    }

    public MethodInfo methodInfo(ElementHandle method, ElementHandle declaringType) {
        var location = model.locationOf(method);
        return new MethodInfo(
                model.nameOf(method),
                signatureOf(method),
                displayName(declaringType),
                location.map(SourceLocation::path).orElse(CallNode.UNKNOWN_FILE),
                location.map(SourceLocation::line).orElse(0),
                languageName(method));
    }

    /** {@code Container.method} for a member of a type, the bare name otherwise. */
    public String memberName(ElementHandle member) {
        return declaringType(member)
                .map(t -> model.nameOf(t) + "." + model.nameOf(member))
                .orElseGet(() -> model.nameOf(member));
    }

    public ImplementationEntry implementationEntry(ElementHandle element, String name, ElementKind kind) {
        var location = model.locationOf(element);
        return new ImplementationEntry(
                name,
                location.map(SourceLocation::path).orElse(CallNode.UNKNOWN_FILE),
                location.map(SourceLocation::line).orElse(0),
                kind,
                languageName(element));
    }

    public SymbolMatch symbolMatch(ElementHandle declaration) {
        var kind = model.kindOf(declaration);
        var location = model.locationOf(declaration);
        return new SymbolMatch(
                model.nameOf(declaration),
                model.qualifiedNameOf(declaration).orElse(null),
                kind.isType() ? policy.typeKindOf(declaration) : kind,
                location.map(SourceLocation::path).orElse(CallNode.UNKNOWN_FILE),
                location.map(SourceLocation::line).orElse(0),
                policy.containerNameOf(declaration).orElse(null),
                languageName(declaration));
    }
}
