package ai.codenav.analyzer.python;

import ai.codenav.analyzer.CapabilityRegistry;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.LanguageFamily;
import ai.codenav.analyzer.Languages;
import ai.codenav.util.QueryLimits;

public final class PythonFamily implements LanguageFamily {

    @Override
    public String name() {
        return "Python";
    }

    @Override
    public boolean isSupported(CodeModel model) {
        return model.languages().contains(Languages.PYTHON);
    }

    @Override
    public void register(CapabilityRegistry registry, CodeModel model, QueryLimits limits) {
        registry.registerAll(new PythonLanguageProvider(model, limits));
    }
}
