package ai.codenav.analyzer.jvm;

import ai.codenav.analyzer.CapabilityRegistry;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.DelegatingLanguageProvider;
import ai.codenav.analyzer.LanguageFamily;
import ai.codenav.analyzer.Languages;
import ai.codenav.util.QueryLimits;

/** Java, with Kotlin sharing the Java provider. */
public final class JvmFamily implements LanguageFamily {

    @Override
    public String name() {
        return "JVM";
    }

    @Override
    public boolean isSupported(CodeModel model) {
        var languages = model.languages();
        return languages.contains(Languages.JAVA) || languages.contains(Languages.KOTLIN);
    }

    @Override
    public void register(CapabilityRegistry registry, CodeModel model, QueryLimits limits) {
        var java = new JavaLanguageProvider(model, limits);
        registry.registerAll(java);
        registry.registerAll(new DelegatingLanguageProvider(java, Languages.KOTLIN));
    }
}
