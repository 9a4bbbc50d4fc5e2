package ai.codenav.analyzer.jvm;

import static ai.codenav.analyzer.ElementKind.CLASS;
import static org.junit.jupiter.api.Assertions.*;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.DelegatingLanguageProvider;
import ai.codenav.analyzer.Languages;
import ai.codenav.index.InMemoryCodeModel;
import ai.codenav.testutil.TestModels;
import ai.codenav.util.QueryLimits;
import java.util.List;
import org.junit.jupiter.api.Test;

public class JavaLanguageProviderTest {

    @Test
    public void testErasure() {
        assertEquals("List", JavaLanguageProvider.erase("List<String>"));
        assertEquals("Map", JavaLanguageProvider.erase("Map<K, List<V>>"));
        assertEquals("String[]", JavaLanguageProvider.erase("String..."));
        assertEquals("Object", JavaLanguageProvider.erase("T"));
        assertEquals("int[]", JavaLanguageProvider.erase("int []"));
        assertEquals(List.of("List", "Object"), JavaLanguageProvider.erase(List.of("List<E>", "E")));
    }

    @Test
    public void testImplicitRoots() {
        var provider = new JavaLanguageProvider(TestModels.animals(), QueryLimits.defaults());
        assertTrue(provider.isImplicitRoot("java.lang.Object"));
        assertTrue(provider.isImplicitRoot("kotlin.Any"));
        assertFalse(provider.isImplicitRoot("zoo.Animal"));
    }

    @Test
    public void testHandlesJavaAndKotlinOnly() {
        var b = InMemoryCodeModel.builder();
        var java = b.type("a.J", CLASS, Languages.JAVA, "J.java", 1, 2);
        var kotlin = b.type("a.K", CLASS, Languages.KOTLIN, "K.kt", 1, 2);
        var python = b.type("a.P", CLASS, Languages.PYTHON, "p.py", 1, 2);
        var model = b.build();
        var provider = new JavaLanguageProvider(model, QueryLimits.defaults());

        assertTrue(provider.canHandle(java));
        assertTrue(provider.canHandle(kotlin));
        assertFalse(provider.canHandle(python));
        assertEquals(Languages.JAVA, provider.language());
    }

    @Test
    public void testAvailabilityFollowsModelLanguages() {
        assertTrue(new JavaLanguageProvider(TestModels.animals(), QueryLimits.defaults()).isAvailable());
        assertFalse(new JavaLanguageProvider(TestModels.pythonShapes(), QueryLimits.defaults()).isAvailable());
    }

    @Test
    public void testKotlinDelegateSharesBehaviour() {
        var model = TestModels.animals();
        var java = new JavaLanguageProvider(model, QueryLimits.defaults());
        var kotlin = new DelegatingLanguageProvider(java, Languages.KOTLIN);

        assertEquals(Languages.KOTLIN, kotlin.language());
        var dog = model.resolveByQualifiedName("zoo.Dog").orElseThrow();
        assertTrue(kotlin.canHandle(dog));
        assertEquals(
                java.findImplementations(dog, CancellationToken.none()),
                kotlin.findImplementations(dog, CancellationToken.none()));
    }

    @Test
    public void testDelegateMustStayInFamily() {
        var java = new JavaLanguageProvider(TestModels.animals(), QueryLimits.defaults());

        assertThrows(IllegalArgumentException.class, () -> new DelegatingLanguageProvider(java, Languages.PYTHON));
    }
}
