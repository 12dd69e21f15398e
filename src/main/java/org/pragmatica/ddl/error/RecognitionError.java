package org.pragmatica.ddl.error;

/**
 * Failure of one recognition phase, carrying enough context to explain the cause.
 */
public sealed interface RecognitionError permits LexicalError, MappingError, ParseError {

    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * Wrap this error into an exception suitable for raising.
     */
    default RecognitionException toException() {
        return new RecognitionException(this);
    }
}
