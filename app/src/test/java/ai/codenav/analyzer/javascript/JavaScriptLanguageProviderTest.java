package ai.codenav.analyzer.javascript;

import static ai.codenav.analyzer.ElementKind.CLASS;
import static org.junit.jupiter.api.Assertions.*;

import ai.codenav.analyzer.CallDirection;
import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.Languages;
import ai.codenav.analyzer.model.CallNode;
import ai.codenav.index.InMemoryCodeModel;
import ai.codenav.testutil.TestModels;
import ai.codenav.util.QueryLimits;
import java.util.List;
import org.junit.jupiter.api.Test;

public class JavaScriptLanguageProviderTest {

    @Test
    public void testOverrideFoundByNameWithoutOverrideFact() {
        var model = TestModels.widgets();
        var provider = new JavaScriptLanguageProvider(model, QueryLimits.defaults());
        var render = model.resolveByQualifiedName("button.Button.render").orElseThrow();

        assertEquals(
                List.of(model.resolveByQualifiedName("widget.Widget.render").orElseThrow()),
                provider.directSuperMethods(render));
    }

    @Test
    public void testHandlesTypeScript() {
        var model = TestModels.widgets();
        var provider = new JavaScriptLanguageProvider(model, QueryLimits.defaults());

        assertTrue(provider.canHandle(model.resolveByQualifiedName("button.Button").orElseThrow()));
        assertTrue(provider.isImplicitRoot("Object"));
    }

    @Test
    public void testCallersThroughBaseClassMethod() {
        var b = InMemoryCodeModel.builder();
        var widget = b.type("widget.Widget", CLASS, Languages.JAVASCRIPT, "src/widget.js", 1, 10);
        var render = b.method(widget, "render", List.of(), 3, 5);
        var button = b.type("button.Button", CLASS, Languages.TYPESCRIPT, "src/button.ts", 1, 12);
        b.method(button, "render", List.of(), 4, 6);
        b.extendsType(button, widget);
        var draw = b.function("app.draw", Languages.JAVASCRIPT, "src/app.js", List.of("w"), 1, 4);
        b.call(draw, render, 2, 3);
        var model = b.build();
        var provider = new JavaScriptLanguageProvider(model, QueryLimits.defaults());

        var result = provider.callHierarchy(
                        model.resolveByQualifiedName("button.Button.render").orElseThrow(),
                        CallDirection.CALLERS,
                        1,
                        CancellationToken.none())
                .orElseThrow();
        assertEquals(List.of("draw(w)"), result.calls().stream().map(CallNode::name).toList());
        assertEquals("TypeScript", result.node().language());
    }

    @Test
    public void testModuleContainerForFunctions() {
        var b = InMemoryCodeModel.builder();
        var draw = b.function("app.draw", Languages.JAVASCRIPT, "src/app.js", List.of(), 1, 4);
        var model = b.build();

        assertEquals(
                "app",
                new JavaScriptLanguageProvider(model, QueryLimits.defaults())
                        .containerNameOf(draw)
                        .orElseThrow());
    }
}
