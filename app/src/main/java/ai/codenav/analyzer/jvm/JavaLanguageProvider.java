package ai.codenav.analyzer.jvm;

import ai.codenav.analyzer.AbstractLanguageProvider;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.Languages;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Set;

/**
 * Java semantics over the shared model; also serves Kotlin through a delegating registration, since both compile to
 * the same class hierarchy.
 *
 * <p>Overrides are judged on erased parameter types, so {@code add(List<String>)} overrides {@code add(List<T>)}.
 */
public class JavaLanguageProvider extends AbstractLanguageProvider {
    private static final Set<String> IMPLICIT_ROOTS = Set.of("java.lang.Object", "kotlin.Any");

    public JavaLanguageProvider(CodeModel model, QueryLimits limits) {
        super(model, limits, Languages.JAVA, Set.of(Languages.JAVA, Languages.KOTLIN));
    }

    @Override
    public boolean isImplicitRoot(String qualifiedName) {
        return IMPLICIT_ROOTS.contains(qualifiedName);
    }

    @Override
    public boolean sameSignature(ElementHandle method, ElementHandle ancestorMethod) {
        return erase(parameterTypesOf(method)).equals(erase(parameterTypesOf(ancestorMethod)));
    }

    static List<String> erase(List<String> parameterTypes) {
        return parameterTypes.stream().map(JavaLanguageProvider::erase).toList();
    }

    /** {@code Map<K, List<V>>} becomes {@code Map}; varargs become arrays; whitespace is dropped. */
    static String erase(String type) {
        var sb = new StringBuilder();
        int nesting = 0;
        for (int i = 0; i < type.length(); i++) {
            char c = type.charAt(i);
            if (c == '<') {
                nesting++;
            } else if (c == '>') {
                nesting--;
            } else if (nesting == 0 && !Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        var erased = sb.toString();
        if (erased.endsWith("...")) {
            erased = erased.substring(0, erased.length() - 3) + "[]";
        }
        // type variables erase to their bound, which the model does not expose; treat a lone capital as Object
        if (erased.length() == 1 && Character.isUpperCase(erased.charAt(0))) {
            return "Object";
        }
        return erased;
    }
}
