package org.pragmatica.ddl.error;

import org.pragmatica.ddl.automaton.ParseTrace;

import java.util.Objects;

/**
 * Raised when tokenization, mapping or parsing rejects its input.
 * {@link #error()} exposes the typed cause; for parse-phase rejections
 * {@link #trace()} holds the automaton configurations recorded before the failure.
 */
public final class RecognitionException extends RuntimeException {
    private final RecognitionError error;
    private final ParseTrace trace;

    public RecognitionException(RecognitionError error) {
        this(error, ParseTrace.EMPTY);
    }

    public RecognitionException(RecognitionError error, ParseTrace trace) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
        this.trace = Objects.requireNonNull(trace, "trace");
    }

    public RecognitionError error() {
        return error;
    }

    /**
     * Configurations up to the failing step. Empty for lexical and mapping
     * errors, and when tracing is disabled.
     */
    public ParseTrace trace() {
        return trace;
    }

    public RecognitionException withTrace(ParseTrace trace) {
        var exception = new RecognitionException(error, trace);
        exception.setStackTrace(getStackTrace());
        return exception;
    }
}
