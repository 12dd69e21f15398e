package org.pragmatica.ddl.lexer;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A symbol kind paired with the pattern recognizing it.
 */
public record PatternRule(SymbolKind kind, Pattern pattern) {

    public PatternRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(pattern, "pattern");
    }

    /**
     * Compile a case-insensitive rule.
     */
    public static PatternRule of(SymbolKind kind, String regex) {
        return new PatternRule(kind, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public static PatternRule defaultFor(SymbolKind kind) {
        return of(kind, kind.defaultPattern());
    }

    @Override
    public String toString() {
        return kind + " <- " + pattern.pattern();
    }
}
