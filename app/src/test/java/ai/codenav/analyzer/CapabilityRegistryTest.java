package ai.codenav.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.codenav.analyzer.model.TypeHierarchyResult;
import ai.codenav.testutil.TestModels;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

public class CapabilityRegistryTest {

    private static final ElementHandle ELEMENT = new ElementHandle("x.Y");

    /** Answers only to its tag; availability and acceptance are fixed at construction. */
    private static class StubProvider implements TypeHierarchyProvider {
        private final String label;
        private final Language language;
        private final boolean available;
        private final Predicate<ElementHandle> accepts;

        StubProvider(String label, Language language, boolean available, Predicate<ElementHandle> accepts) {
            this.label = label;
            this.language = language;
            this.available = available;
            this.accepts = accepts;
        }

        StubProvider(String label, Language language) {
            this(label, language, true, e -> true);
        }

        @Override
        public Language language() {
            return language;
        }

        @Override
        public boolean canHandle(ElementHandle element) {
            return accepts.test(element);
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Optional<TypeHierarchyResult> typeHierarchy(ElementHandle element, CancellationToken cancellation) {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private static String selected(CapabilityRegistry registry, Language language) {
        return registry.selectProvider(TypeHierarchyProvider.class, ELEMENT, language)
                .map(Object::toString)
                .orElse("none");
    }

    @Test
    public void testExactTagWinsOverRegistrationOrder() {
        var registry = new CapabilityRegistry();
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("python", Languages.PYTHON));
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("java", Languages.JAVA));

        assertEquals("java", selected(registry, Languages.JAVA));
        assertEquals("python", selected(registry, Languages.PYTHON));
    }

    @Test
    public void testBaseLanguageBeforeUnrelatedProviders() {
        var registry = new CapabilityRegistry();
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("java", Languages.JAVA));
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("js", Languages.JAVASCRIPT));

        assertEquals("js", selected(registry, Languages.TYPESCRIPT), "TypeScript falls back to its base language");
    }

    @Test
    public void testFallsBackToAnyProviderThatAccepts() {
        var registry = new CapabilityRegistry();
        registry.registerProvider(
                TypeHierarchyProvider.class, new StubProvider("java-picky", Languages.JAVA, true, e -> false));
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("python", Languages.PYTHON));

        assertEquals("python", selected(registry, Languages.JAVA));
    }

    @Test
    public void testFirstRegisteredWinsWithinTier() {
        var registry = new CapabilityRegistry();
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("first", Languages.JAVA));
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("second", Languages.JAVA));

        assertEquals("first", selected(registry, Languages.JAVA));
    }

    @Test
    public void testUnavailableProvidersAreSkipped() {
        var registry = new CapabilityRegistry();
        registry.registerProvider(
                TypeHierarchyProvider.class, new StubProvider("missing", Languages.JAVA, false, e -> true));

        assertEquals("none", selected(registry, Languages.JAVA));
        assertEquals(List.of(), registry.providers(TypeHierarchyProvider.class));
        assertEquals(Set.of(), registry.supportedLanguages(TypeHierarchyProvider.class));
    }

    @Test
    public void testThrowingProbeCountsAsUnavailable() {
        var registry = new CapabilityRegistry();
        var broken = new StubProvider("broken", Languages.JAVA) {
            @Override
            public boolean isAvailable() {
                throw new IllegalStateException("plugin missing");
            }
        };
        registry.registerProvider(TypeHierarchyProvider.class, broken);

        assertEquals("none", selected(registry, Languages.JAVA));
    }

    @Test
    public void testCapabilitiesAreSeparate() {
        var registry = new CapabilityRegistry();
        registry.registerProvider(TypeHierarchyProvider.class, new StubProvider("java", Languages.JAVA));

        assertTrue(registry.selectProvider(CallHierarchyProvider.class, ELEMENT, Languages.JAVA).isEmpty());
        assertEquals(List.of(), registry.providers(CallHierarchyProvider.class));
    }

    @Test
    public void testFailingFamilyDoesNotStopOthers() {
        var model = TestModels.animals();
        var registry = new CapabilityRegistry();
        var broken = new LanguageFamily() {
            @Override
            public String name() {
                return "Broken";
            }

            @Override
            public boolean isSupported(CodeModel m) {
                return true;
            }

            @Override
            public void register(CapabilityRegistry r, CodeModel m, QueryLimits limits) {
                throw new NoClassDefFoundError("org/example/MissingPlugin");
            }
        };

        assertFalse(registry.registerFamily(broken, model));
        assertTrue(registry.registerFamily(LanguageFamilies.defaults().get(0), model));
        assertEquals(
                Set.of(Languages.JAVA, Languages.KOTLIN), registry.supportedLanguages(TypeHierarchyProvider.class));
    }

    @Test
    public void testUnsupportedFamilyIsSkipped() {
        var registry = new CapabilityRegistry();

        assertFalse(registry.registerFamily(LanguageFamilies.defaults().get(1), TestModels.animals()), "no Python");
        assertEquals(List.of(), registry.providers(SymbolSearchProvider.class));
    }

    @Test
    public void testDefaultFamiliesRegisterEveryCapability() {
        var model = TestModels.widgets();
        var registry = new CapabilityRegistry();
        for (var family : LanguageFamilies.defaults()) {
            registry.registerFamily(family, model);
        }

        var expected = Set.of(Languages.JAVASCRIPT, Languages.TYPESCRIPT);
        assertEquals(expected, registry.supportedLanguages(TypeHierarchyProvider.class));
        assertEquals(expected, registry.supportedLanguages(CallHierarchyProvider.class));
        assertEquals(expected, registry.supportedLanguages(SuperMethodsProvider.class));
        assertEquals(expected, registry.supportedLanguages(SymbolSearchProvider.class));
        assertEquals(expected, registry.supportedLanguages(ImplementationsProvider.class));
    }
}
