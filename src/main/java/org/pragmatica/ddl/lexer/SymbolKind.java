package org.pragmatica.ddl.lexer;

/**
 * Lexical symbol kinds, each owning its default pattern.
 */
public enum SymbolKind {
    KEYWORD("KEYWORD", "\\b(alter table|drop column)\\b"),
    IDENTIFIER("ID", "[A-Za-z][A-Za-z0-9._]*"),
    NUMBER("NUM", "[0-9]+"),
    OPERATOR("OPERATOR", "[=()*,]"),
    STRING_LITERAL("STRING", "'[^']*'"),
    WHITESPACE("SPACE", "\\s+");

    private final String display;
    private final String defaultPattern;

    SymbolKind(String display, String defaultPattern) {
        this.display = display;
        this.defaultPattern = defaultPattern;
    }

    public String display() {
        return display;
    }

    public String defaultPattern() {
        return defaultPattern;
    }

    /**
     * Whitespace advances the scan position but is never emitted.
     */
    public boolean isSkipped() {
        return this == WHITESPACE;
    }
}
