package org.pragmatica.ddl.lexer;

import java.util.Objects;

/**
 * A matched piece of source text.
 *
 * @param kind        Kind of the rule that matched
 * @param text        Matched text
 * @param startOffset Offset of the first character in the source (0-based)
 */
public record LexicalSymbol(SymbolKind kind, String text, int startOffset) {

    public LexicalSymbol {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public int length() {
        return text.length();
    }

    /**
     * Offset right after this symbol, where the next scan begins.
     */
    public int endOffset() {
        return startOffset + text.length();
    }

    /**
     * Table row: kind, lexeme, start and length in padded columns.
     */
    public String describe() {
        return String.format("%-10s %-20s %-8d%-8d", kind.display(), text, startOffset, length());
    }
}
