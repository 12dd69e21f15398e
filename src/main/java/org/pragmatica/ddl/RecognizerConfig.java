package org.pragmatica.ddl;

import org.pragmatica.ddl.lexer.Tokenizer;

/**
 * Recognizer configuration options.
 *
 * @param traceEnabled   record and log automaton configurations; never affects the outcome
 * @param maxInputLength longest source text accepted by the tokenizer
 */
public record RecognizerConfig(
    boolean traceEnabled,
    int maxInputLength
) {
    public static final RecognizerConfig DEFAULT = new RecognizerConfig(
        true,
        Tokenizer.DEFAULT_MAX_INPUT_LENGTH
    );
}
