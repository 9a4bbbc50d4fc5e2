package ai.codenav.cli;

import ai.codenav.analyzer.CallDirection;
import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.index.JsonCodeModelLoader;
import ai.codenav.query.CodeQueryService;
import ai.codenav.query.QueryResult;
import ai.codenav.query.StartRef;
import ai.codenav.util.QueryLimits;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // fields are populated by picocli before call()
@CommandLine.Command(
        name = "codenav",
        mixinStandardHelpOptions = true,
        description = "Runs one code navigation query against an exported code model and prints the result as JSON.")
public final class CodeNavCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CodeNavCli.class);

    private static final ObjectMapper objectMapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Option(
            names = "--model",
            required = true,
            description = "Path to the JSON model dump.")
    private Path modelPath;

    @CommandLine.Option(
            names = "--type-hierarchy",
            description = "Supertypes and subtypes of the type at START (file:line:column or qualified name).")
    @Nullable
    private String typeHierarchy;

    @CommandLine.Option(
            names = "--call-hierarchy",
            description = "Callers or callees of the method at START.")
    @Nullable
    private String callHierarchy;

    @CommandLine.Option(names = "--super-methods", description = "Methods overridden by the method at START.")
    @Nullable
    private String superMethods;

    @CommandLine.Option(
            names = "--implementations",
            description = "Overriding methods of the method at START, or inheritors of the type at START.")
    @Nullable
    private String implementations;

    @CommandLine.Option(
            names = "--usages",
            description = "Reference occurrences of the declaration at START, or of the target of the reference there.")
    @Nullable
    private String usages;

    @CommandLine.Option(names = "--definition", description = "Declaration of the reference at START.")
    @Nullable
    private String definition;

    @CommandLine.Option(names = "--search", description = "Search declarations whose names match PATTERN.")
    @Nullable
    private String search;

    @CommandLine.Option(
            names = "--direction",
            defaultValue = "callers",
            description = "callers or callees (with --call-hierarchy). Default: ${DEFAULT-VALUE}.")
    private String direction = "callers";

    @CommandLine.Option(names = "--depth", description = "Call hierarchy depth, 1-5.")
    @Nullable
    private Integer depth;

    @CommandLine.Option(names = "--limit", description = "Maximum search results, 1-100.")
    @Nullable
    private Integer limit;

    @CommandLine.Option(
            names = "--include-libraries",
            description = "Search library declarations too (with --search and --usages).")
    private boolean includeLibraries;

    private final PrintStream out;

    public CodeNavCli() {
        this(System.out);
    }

    CodeNavCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeNavCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        long actionCount = Stream.of(
                        typeHierarchy, callHierarchy, superMethods, implementations, usages, definition, search)
                .filter(a -> a != null)
                .count();
        if (actionCount != 1) {
            System.err.println("Exactly one of --type-hierarchy, --call-hierarchy, --super-methods, --implementations,"
                    + " --usages, --definition or --search is required.");
            return 1;
        }

        CodeQueryService service;
        try {
            service = new CodeQueryService(JsonCodeModelLoader.load(modelPath), QueryLimits.load());
        } catch (IOException e) {
            logger.error("Failed to load model {}", modelPath, e);
            System.err.println("Error loading model " + modelPath + ": " + e.getMessage());
            return 1;
        }

        QueryResult<?> result;
        try {
            if (typeHierarchy != null) {
                result = service.typeHierarchy(parseStart(typeHierarchy));
            } else if (callHierarchy != null) {
                result = service.callHierarchy(parseStart(callHierarchy), CallDirection.parse(direction), depth);
            } else if (superMethods != null) {
                result = service.superMethods(parseStart(superMethods));
            } else if (implementations != null) {
                result = service.findImplementations(parseStart(implementations));
            } else if (usages != null) {
                result = service.findUsages(
                        parseStart(usages), SearchScope.of(includeLibraries), CancellationToken.none());
            } else if (definition != null) {
                result = service.findDefinition(parseStart(definition));
            } else {
                var pattern = search != null ? search : "";
                result = service.searchSymbols(pattern, SearchScope.of(includeLibraries), limit);
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        return print(result);
    }

    private int print(QueryResult<?> result) throws JsonProcessingException {
        if (result instanceof QueryResult.Success<?> success) {
            out.println(objectMapper.writeValueAsString(success.result()));
            return 0;
        }
        var error = ((QueryResult.Failure<?>) result).cause();
        var body = new LinkedHashMap<String, String>();
        body.put("error", error.kind().name());
        body.put("message", error.message());
        out.println(objectMapper.writeValueAsString(body));
        return 1;
    }

    /**
     * {@code path/File.java:12:5} is a position; anything else is a qualified name. Only the last two segments are
     * taken as line and column, so paths containing ':' still work.
     */
    static StartRef parseStart(String raw) {
        var parts = Splitter.on(':').trimResults().splitToList(raw);
        if (parts.size() >= 3 && isNumber(parts.get(parts.size() - 2)) && isNumber(parts.get(parts.size() - 1))) {
            var file = Joiner.on(':').join(parts.subList(0, parts.size() - 2));
            return StartRef.at(
                    file,
                    Integer.parseInt(parts.get(parts.size() - 2)),
                    Integer.parseInt(parts.get(parts.size() - 1)));
        }
        return StartRef.named(raw.trim());
    }

    private static boolean isNumber(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit) && s.length() < 10;
    }
}
