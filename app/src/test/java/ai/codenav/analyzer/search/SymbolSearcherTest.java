package ai.codenav.analyzer.search;

import static org.junit.jupiter.api.Assertions.*;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.Languages;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.analyzer.SymbolCategory;
import ai.codenav.analyzer.jvm.JavaLanguageProvider;
import ai.codenav.analyzer.model.SymbolMatch;
import ai.codenav.analyzer.python.PythonLanguageProvider;
import ai.codenav.index.InMemoryCodeModel;
import ai.codenav.testutil.TestModels;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

public class SymbolSearcherTest {

    private static SymbolSearcher java(InMemoryCodeModel model) {
        return new SymbolSearcher(model, new JavaLanguageProvider(model, QueryLimits.defaults()));
    }

    private static SymbolSearcher python(InMemoryCodeModel model) {
        return new SymbolSearcher(model, new PythonLanguageProvider(model, QueryLimits.defaults()));
    }

    private static List<String> names(List<SymbolMatch> matches) {
        return matches.stream().map(SymbolMatch::name).toList();
    }

    @Test
    public void testAbbreviationRankedByDistance() {
        var matches = java(TestModels.services()).search("USvc", SearchScope.PROJECT, 25, CancellationToken.none());

        assertEquals(List.of("UtilitySvc", "UserService"), names(matches));
    }

    @Test
    public void testLibraryDeclarationsNeedWiderScope() {
        var matches = java(TestModels.services()).search("USvc", SearchScope.ALL, 25, CancellationToken.none());

        assertEquals(List.of("UserSvc", "UtilitySvc", "UserService"), names(matches));
    }

    @Test
    public void testMethodMatchCarriesContainer() {
        var matches = java(TestModels.services()).search("findUser", SearchScope.PROJECT, 25, CancellationToken.none());

        assertEquals(1, matches.size());
        var findUser = matches.get(0);
        assertEquals(ElementKind.METHOD, findUser.kind());
        assertEquals("svc.UserService.findUser", findUser.qualifiedName());
        assertEquals("UserService", findUser.containerName());
        assertEquals("src/svc/UserService.java", findUser.file());
        assertEquals(5, findUser.line());
    }

    @Test
    public void testFieldsAreSearchedAsVariables() {
        var matches = java(TestModels.services()).search("users", SearchScope.PROJECT, 25, CancellationToken.none());

        assertEquals(List.of("users", "UserService"), names(matches), "exact name first, then the type containing it");
        assertEquals(ElementKind.FIELD, matches.get(0).kind());
        assertEquals("UserService", matches.get(0).containerName());
    }

    @Test
    public void testOtherLanguagesAreIgnored() {
        var matches = python(TestModels.services()).search("User", SearchScope.ALL, 25, CancellationToken.none());

        assertEquals(List.of(), matches);
    }

    @Test
    public void testTypesAreCollectedBeforeCallables() {
        var matches = python(TestModels.pythonShapes()).search("s", SearchScope.PROJECT, 2, CancellationToken.none());

        assertEquals(2, matches.size());
        assertTrue(matches.stream().allMatch(m -> m.kind().isType()), "limit reached before callables: " + matches);
    }

    @Test
    public void testPythonModuleMembers() {
        var matches = python(TestModels.pythonShapes())
                .search("make_square", SearchScope.PROJECT, 25, CancellationToken.none());

        assertEquals(1, matches.size());
        assertEquals(ElementKind.FUNCTION, matches.get(0).kind());
        assertEquals("shapes", matches.get(0).containerName(), "module-level functions report their module");
        assertEquals("Python", matches.get(0).language());
    }

    @Test
    public void testNonPositiveLimit() {
        var results = java(TestModels.services()).search("User", SearchScope.PROJECT, 0, CancellationToken.none());
        assertEquals(List.of(), results);
    }

    /** Counts the names handed out by {@link #allDeclaredNames}. */
    private static final class CountingModel extends InMemoryCodeModel {
        final AtomicInteger namesEnumerated = new AtomicInteger();

        CountingModel(Builder builder) {
            super(builder);
        }

        @Override
        public Stream<String> allDeclaredNames(SymbolCategory category, SearchScope scope) {
            return super.allDeclaredNames(category, scope).peek(n -> namesEnumerated.incrementAndGet());
        }
    }

    @Test
    public void testEnumerationStopsOnceLimitIsFilled() {
        var b = InMemoryCodeModel.builder();
        for (int i = 0; i < 50; i++) {
            b.type("gen.Handler" + i, ElementKind.CLASS, Languages.JAVA, "gen/Handler" + i + ".java", 1, 5);
        }
        var model = new CountingModel(b);

        var matches = java(model).search("Handler", SearchScope.PROJECT, 3, CancellationToken.none());

        assertEquals(3, matches.size());
        assertEquals(3, model.namesEnumerated.get(), "no names are read past the third match");
    }
}
