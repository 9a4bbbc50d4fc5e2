package ai.codenav.analyzer.model;

/** The method a super-method query started from. */
public record MethodInfo(
        String name, String signature, String containingClass, String file, int line, String language) {}
