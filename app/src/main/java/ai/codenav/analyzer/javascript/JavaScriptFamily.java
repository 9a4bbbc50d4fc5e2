package ai.codenav.analyzer.javascript;

import ai.codenav.analyzer.CapabilityRegistry;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.DelegatingLanguageProvider;
import ai.codenav.analyzer.LanguageFamily;
import ai.codenav.analyzer.Languages;
import ai.codenav.util.QueryLimits;

/** JavaScript, with TypeScript sharing the JavaScript provider. */
public final class JavaScriptFamily implements LanguageFamily {

    @Override
    public String name() {
        return "JavaScript";
    }

    @Override
    public boolean isSupported(CodeModel model) {
        var languages = model.languages();
        return languages.contains(Languages.JAVASCRIPT) || languages.contains(Languages.TYPESCRIPT);
    }

    @Override
    public void register(CapabilityRegistry registry, CodeModel model, QueryLimits limits) {
        var javascript = new JavaScriptLanguageProvider(model, limits);
        registry.registerAll(javascript);
        registry.registerAll(new DelegatingLanguageProvider(javascript, Languages.TYPESCRIPT));
    }
}
