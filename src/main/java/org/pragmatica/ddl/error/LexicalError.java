package org.pragmatica.ddl.error;

/**
 * Tokenization failure.
 */
public sealed interface LexicalError extends RecognitionError {
    int offset();

    /**
     * No pattern matches the remaining text.
     */
    record NoLexicalMatch(int offset, String remaining) implements LexicalError {
        private static final int EXCERPT_LENGTH = 20;

        @Override
        public String message() {
            return "No lexical match at offset " + offset + ": '" + excerpt() + "'";
        }

        private String excerpt() {
            return remaining.length() > EXCERPT_LENGTH
                   ? remaining.substring(0, EXCERPT_LENGTH) + "..."
                   : remaining;
        }
    }
}
