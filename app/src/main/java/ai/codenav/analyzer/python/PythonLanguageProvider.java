package ai.codenav.analyzer.python;

import ai.codenav.analyzer.AbstractLanguageProvider;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.Languages;
import ai.codenav.analyzer.TypeReference;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Python semantics: overriding is by name only, a class's kind is refined from well-known bases (an {@code Enum}
 * subclass is reported as an enum), and the implicit receiver parameter is not part of a method's identity.
 */
public class PythonLanguageProvider extends AbstractLanguageProvider {
    private static final Set<String> IMPLICIT_ROOTS = Set.of("object", "builtins.object");
    private static final Set<String> RECEIVERS = Set.of("self", "cls");

    private static final Set<String> ENUM_BASES =
            Set.of("Enum", "IntEnum", "StrEnum", "Flag", "IntFlag", "enum.Enum", "enum.IntEnum", "enum.StrEnum",
                    "enum.Flag", "enum.IntFlag");
    private static final Set<String> PROTOCOL_BASES = Set.of("Protocol", "typing.Protocol");
    private static final Set<String> ABSTRACT_BASES = Set.of("ABC", "abc.ABC");

    public PythonLanguageProvider(CodeModel model, QueryLimits limits) {
        super(model, limits, Languages.PYTHON, Set.of(Languages.PYTHON));
    }

    @Override
    public boolean isImplicitRoot(String qualifiedName) {
        return IMPLICIT_ROOTS.contains(qualifiedName);
    }

    @Override
    public ElementKind typeKindOf(ElementHandle type) {
        var kind = model.kindOf(type);
        if (kind != ElementKind.CLASS) {
            return kind;
        }
        for (TypeReference ref : model.declaredSupertypes(type)) {
            var name = ref.declaredName();
            if (ENUM_BASES.contains(name)) return ElementKind.ENUM;
            if (PROTOCOL_BASES.contains(name)) return ElementKind.PROTOCOL;
            if (ABSTRACT_BASES.contains(name)) return ElementKind.ABSTRACT_CLASS;
        }
        return kind;
    }

    @Override
    public List<String> parameterTypesOf(ElementHandle callable) {
        var params = model.parameterTypesOf(callable);
        if (!params.isEmpty() && RECEIVERS.contains(params.get(0)) && model.kindOf(callable) == ElementKind.METHOD) {
            return params.subList(1, params.size());
        }
        return params;
    }

    @Override
    public boolean sameSignature(ElementHandle method, ElementHandle ancestorMethod) {
        return true;
    }

    @Override
    public List<ElementHandle> directSuperMethods(ElementHandle method) {
        return superMethodsByName(method);
    }

    /** Class name for methods; the module for module-level functions and variables. */
    @Override
    public Optional<String> containerNameOf(ElementHandle declaration) {
        return super.containerNameOf(declaration).or(() -> moduleNameOf(declaration));
    }
}
