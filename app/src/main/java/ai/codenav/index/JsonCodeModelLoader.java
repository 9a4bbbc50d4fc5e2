package ai.codenav.index;

import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.Languages;
import ai.codenav.analyzer.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Reads a {@link ModelDump} JSON document into an {@link InMemoryCodeModel}. */
public final class JsonCodeModelLoader {
    private static final Logger logger = LogManager.getLogger(JsonCodeModelLoader.class);
    private static final ObjectMapper objectMapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodeModelLoader() {}

    public static InMemoryCodeModel load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException(file.toString());
        }
        try (var in = Files.newInputStream(file)) {
            var model = load(in);
            logger.info("Loaded {} declarations from {}", model.declarations().size(), file);
            return model;
        }
    }

    public static InMemoryCodeModel load(InputStream in) throws IOException {
        return fromDump(objectMapper.readValue(in, ModelDump.class));
    }

    public static InMemoryCodeModel fromJson(String json) throws IOException {
        return fromDump(objectMapper.readValue(json, ModelDump.class));
    }

    /** @throws IOException if the dump is internally inconsistent (unknown kinds, languages or ids) */
    public static InMemoryCodeModel fromDump(ModelDump dump) throws IOException {
        var builder = InMemoryCodeModel.builder();
        try {
            for (var entry : orEmpty(dump.declarations())) {
                builder.declare(toDeclaration(entry));
            }
            for (var entry : orEmpty(dump.supertypes())) {
                var target = entry.target() == null ? null : new ElementHandle(entry.target());
                builder.supertype(
                        new ElementHandle(entry.type()),
                        new TypeReference(entry.name(), target, entry.isInterface()));
            }
            for (var entry : orEmpty(dump.overrides())) {
                builder.overrides(new ElementHandle(entry.method()), new ElementHandle(entry.overrides()));
            }
            for (var entry : orEmpty(dump.calls())) {
                var caller = new ElementHandle(entry.caller());
                if (entry.callee() == null) {
                    builder.unresolvedCall(caller, entry.text(), entry.line());
                } else {
                    builder.call(caller, new ElementHandle(entry.callee()), entry.line(), entry.column());
                }
            }
            for (var entry : orEmpty(dump.references())) {
                builder.reference(
                        new ElementHandle(entry.from()), new ElementHandle(entry.target()), entry.line(), entry.column());
            }
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Invalid model dump: " + e.getMessage(), e);
        }
    }

    private static Declaration toDeclaration(ModelDump.DeclarationEntry entry) {
        if (entry.id() == null || entry.name() == null || entry.kind() == null || entry.language() == null) {
            throw new IllegalArgumentException("declaration " + entry.id() + " lacks one of id, name, kind, language");
        }
        var language = Languages.fromId(entry.language());
        if (language == Languages.NONE) {
            throw new IllegalArgumentException("unknown language '" + entry.language() + "' for " + entry.id());
        }
        ElementKind kind;
        try {
            kind = ElementKind.valueOf(entry.kind().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown kind '" + entry.kind() + "' for " + entry.id(), e);
        }
        return new Declaration(
                entry.id(),
                entry.name(),
                entry.qualifiedName(),
                kind,
                language,
                entry.file(),
                entry.line(),
                entry.endLine() == null ? entry.line() : entry.endLine(),
                entry.container(),
                orEmpty(entry.parameterTypes()),
                entry.signature(),
                entry.library());
    }

    private static <T> List<T> orEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }
}
