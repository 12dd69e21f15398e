package org.pragmatica.ddl.error;

import org.pragmatica.ddl.lexer.SymbolKind;

/**
 * Failure projecting lexical symbols onto parser terminals.
 */
public sealed interface MappingError extends RecognitionError {
    int offset();

    /**
     * Keyword text without a terminal in the keyword dictionary.
     */
    record UnmappedKeyword(String text, int offset) implements MappingError {
        @Override
        public String message() {
            return "Unmapped keyword '" + text + "' at offset " + offset;
        }
    }

    /**
     * Symbol kind the grammar does not use.
     */
    record UnsupportedSymbolKind(SymbolKind kind, String text, int offset) implements MappingError {
        @Override
        public String message() {
            return "Unsupported symbol kind " + kind + " ('" + text + "') at offset " + offset;
        }
    }
}
