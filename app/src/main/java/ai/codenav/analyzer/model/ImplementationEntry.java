package ai.codenav.analyzer.model;

import ai.codenav.analyzer.ElementKind;

/** A concrete overriding method or an inheriting type. */
public record ImplementationEntry(String name, String file, int line, ElementKind kind, String language) {}
