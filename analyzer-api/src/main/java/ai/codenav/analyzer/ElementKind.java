package ai.codenav.analyzer;

/** What kind of thing an {@link ElementHandle} denotes. */
public enum ElementKind {
    CLASS,
    INTERFACE,
    ABSTRACT_CLASS,
    ENUM,
    ANNOTATION,
    RECORD,
    STRUCT,
    TRAIT,
    PROTOCOL,
    OBJECT,
    METHOD,
    CONSTRUCTOR,
    FUNCTION,
    FIELD,
    VARIABLE,
    REFERENCE,
    CALL,
    FILE,
    OTHER;

    public boolean isType() {
        return switch (this) {
            case CLASS, INTERFACE, ABSTRACT_CLASS, ENUM, ANNOTATION, RECORD, STRUCT, TRAIT, PROTOCOL, OBJECT -> true;
            default -> false;
        };
    }

    public boolean isCallable() {
        return this == METHOD || this == CONSTRUCTOR || this == FUNCTION;
    }

    public boolean isVariable() {
        return this == FIELD || this == VARIABLE;
    }

    /** The declaration category this kind is enumerated under; {@link SymbolCategory#NONE} for non-declarations. */
    public SymbolCategory category() {
        if (isType()) return SymbolCategory.TYPE;
        if (isCallable()) return SymbolCategory.CALLABLE;
        if (isVariable()) return SymbolCategory.VARIABLE;
        return SymbolCategory.NONE;
    }
}
