package ai.codenav.analyzer;

import ai.codenav.analyzer.javascript.JavaScriptFamily;
import ai.codenav.analyzer.jvm.JvmFamily;
import ai.codenav.analyzer.python.PythonFamily;
import java.util.List;

public final class LanguageFamilies {
    private LanguageFamilies() {}

    /** The built-in families, in registration order. */
    public static List<LanguageFamily> defaults() {
        return List.of(new JvmFamily(), new PythonFamily(), new JavaScriptFamily());
    }
}
