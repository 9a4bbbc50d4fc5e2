package ai.codenav.analyzer.javascript;

import ai.codenav.analyzer.AbstractLanguageProvider;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.Languages;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JavaScript and TypeScript. Method overriding is by name; where the model records explicit overrides (TypeScript
 * {@code implements} clauses) those are used, otherwise supertypes are searched by name.
 */
public class JavaScriptLanguageProvider extends AbstractLanguageProvider {
    private static final Set<String> IMPLICIT_ROOTS = Set.of("Object");

    public JavaScriptLanguageProvider(CodeModel model, QueryLimits limits) {
        super(model, limits, Languages.JAVASCRIPT, Set.of(Languages.JAVASCRIPT, Languages.TYPESCRIPT));
    }

    @Override
    public boolean isImplicitRoot(String qualifiedName) {
        return IMPLICIT_ROOTS.contains(qualifiedName);
    }

    @Override
    public boolean sameSignature(ElementHandle method, ElementHandle ancestorMethod) {
        return true;
    }

    @Override
    public List<ElementHandle> directSuperMethods(ElementHandle method) {
        var declared = model.overriddenMethods(method);
        return declared.isEmpty() ? superMethodsByName(method) : declared;
    }

    /** Class name for methods; the module for top-level functions. */
    @Override
    public Optional<String> containerNameOf(ElementHandle declaration) {
        return super.containerNameOf(declaration).or(() -> moduleNameOf(declaration));
    }
}
