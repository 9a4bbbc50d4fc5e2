package ai.codenav.analyzer.navigation;

import static ai.codenav.analyzer.ElementKind.CLASS;
import static org.junit.jupiter.api.Assertions.*;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.Languages;
import ai.codenav.analyzer.jvm.JavaLanguageProvider;
import ai.codenav.analyzer.model.DefinitionResult;
import ai.codenav.index.InMemoryCodeModel;
import ai.codenav.testutil.TestModels;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class DefinitionFinderTest {

    private static Optional<DefinitionResult> definitionAt(InMemoryCodeModel model, ElementHandle element) {
        var finder = new DefinitionFinder(model, new JavaLanguageProvider(model, QueryLimits.defaults()));
        return finder.find(element, CancellationToken.none());
    }

    @Test
    public void testReferenceResolvesToDeclaration() {
        var model = TestModels.animals();
        var reference = model.resolveAt("src/zoo/Keeper.java", 4, 16).orElseThrow();

        var definition = definitionAt(model, reference).orElseThrow();

        assertEquals(
                new DefinitionResult(
                        "speak",
                        "zoo.Animal.speak",
                        ElementKind.METHOD,
                        "src/zoo/Animal.java",
                        5,
                        0,
                        "Animal",
                        "Java",
                        false),
                definition);
    }

    @Test
    public void testLibraryTargetIsFlagged() {
        var model = TestModels.animals();
        var reference = model.resolveAt("src/zoo/Keeper.java", 9, 13).orElseThrow();

        var definition = definitionAt(model, reference).orElseThrow();

        assertEquals("java.lang.Runnable.run", definition.qualifiedName());
        assertEquals("jdk/java/lang/Runnable.java", definition.file());
        assertTrue(definition.library());
    }

    @Test
    public void testDeclarationResolvesToItself() {
        var model = TestModels.animals();
        var dog = model.resolveByQualifiedName("zoo.Dog").orElseThrow();

        var definition = definitionAt(model, dog).orElseThrow();

        assertEquals("zoo.Dog", definition.qualifiedName());
        assertEquals(ElementKind.CLASS, definition.kind());
        assertNull(definition.containerName());
    }

    private static final class DanglingReferenceModel extends InMemoryCodeModel {
        DanglingReferenceModel(Builder builder) {
            super(builder);
        }

        @Override
        public Optional<ElementHandle> targetOf(ElementHandle reference) {
            return Optional.empty();
        }
    }

    @Test
    public void testUnresolvedReferenceHasNoDefinition() {
        var b = InMemoryCodeModel.builder();
        var app = b.type("app.App", CLASS, Languages.JAVA, "src/app/App.java", 1, 10);
        var main = b.method(app, "main", List.of("String[]"), 2, 8);
        var reference = b.reference(main, app, 4, 9);
        var model = new DanglingReferenceModel(b);

        assertEquals(Optional.empty(), definitionAt(model, reference));
    }
}
