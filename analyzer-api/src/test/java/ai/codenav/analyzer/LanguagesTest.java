package ai.codenav.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class LanguagesTest {

    @Test
    public void testFromIdAcceptsIdsAndNames() {
        assertEquals(Languages.JAVA, Languages.fromId("JAVA"));
        assertEquals(Languages.JAVA, Languages.fromId("java"));
        assertEquals(Languages.KOTLIN, Languages.fromId("Kotlin"));
        assertEquals(Languages.TYPESCRIPT, Languages.fromId("typescript"));
        assertEquals(Languages.NONE, Languages.fromId("COBOL"));
        assertEquals(Languages.NONE, Languages.fromId(null));
        assertEquals(Languages.NONE, Languages.fromId(" "));
    }

    @Test
    public void testFromPath() {
        assertEquals(Languages.PYTHON, Languages.fromPath("pkg/mod.py"));
        assertEquals(Languages.TYPESCRIPT, Languages.fromPath("src/App.TSX"));
        assertEquals(Languages.JAVASCRIPT, Languages.fromExtension(".mjs"));
        assertEquals(Languages.NONE, Languages.fromPath("Makefile"));
        assertEquals(Languages.NONE, Languages.fromPath("dir.d/README"), "a dot in a directory is not an extension");
    }

    @Test
    public void testDialects() {
        assertEquals(Languages.JAVASCRIPT, Languages.TYPESCRIPT.base());
        assertTrue(Languages.TYPESCRIPT.isDialectOf(Languages.JAVASCRIPT));
        assertFalse(Languages.JAVASCRIPT.isDialectOf(Languages.TYPESCRIPT));
        assertNull(Languages.KOTLIN.base(), "Kotlin shares the Java provider through its family, not as a dialect");
    }

    @Test
    public void testElementKindCategories() {
        assertEquals(SymbolCategory.TYPE, ElementKind.PROTOCOL.category());
        assertEquals(SymbolCategory.CALLABLE, ElementKind.CONSTRUCTOR.category());
        assertEquals(SymbolCategory.VARIABLE, ElementKind.FIELD.category());
        assertEquals(SymbolCategory.NONE, ElementKind.REFERENCE.category());
        assertTrue(ElementKind.TRAIT.isType());
        assertFalse(ElementKind.FUNCTION.isType());
    }

    @Test
    public void testCallSiteName() {
        assertEquals("debug", new CallSite("log.debug", null, 3).calleeName());
        assertEquals("run", new CallSite("run", null, 3).calleeName());
    }

    @Test
    public void testBlankHandleRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ElementHandle(""));
    }
}
