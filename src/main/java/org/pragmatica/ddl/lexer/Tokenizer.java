package org.pragmatica.ddl.lexer;

import org.pragmatica.ddl.error.LexicalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits source text into lexical symbols by trying the pattern rules, in
 * priority order, anchored at the current scan position.
 *
 * <p>Instances are immutable and may be shared; each call keeps its own cursor.
 */
public final class Tokenizer {
    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    public static final int DEFAULT_MAX_INPUT_LENGTH = 1_000_000;

    private final PatternTable patterns;
    private final int maxInputLength;

    private Tokenizer(PatternTable patterns, int maxInputLength) {
        this.patterns = patterns;
        this.maxInputLength = maxInputLength;
    }

    public static Tokenizer create() {
        return create(PatternTable.DEFAULT);
    }

    public static Tokenizer create(PatternTable patterns) {
        return create(patterns, DEFAULT_MAX_INPUT_LENGTH);
    }

    public static Tokenizer create(PatternTable patterns, int maxInputLength) {
        Objects.requireNonNull(patterns, "patterns");
        if (maxInputLength < 0) {
            throw new IllegalArgumentException("Negative maximum input length: " + maxInputLength);
        }
        return new Tokenizer(patterns, maxInputLength);
    }

    public PatternTable patterns() {
        return patterns;
    }

    /**
     * Tokenize source text, dropping whitespace.
     *
     * @throws org.pragmatica.ddl.error.RecognitionException with {@link LexicalError.NoLexicalMatch}
     *         when no rule matches at some offset
     */
    public List<LexicalSymbol> tokenize(String source) {
        var symbols = scan(source).stream()
                                  .filter(symbol -> !symbol.kind().isSkipped())
                                  .toList();
        log.debug("Tokenized {} characters into {} symbols", source.length(), symbols.size());
        if (log.isTraceEnabled()) {
            log.trace("Symbol table:\n{}", formatTable(symbols));
        }
        return symbols;
    }

    /**
     * Scan source text, keeping whitespace symbols. Concatenating the texts of
     * the result reproduces the source.
     */
    public List<LexicalSymbol> scan(String source) {
        Objects.requireNonNull(source, "source");
        if (source.length() > maxInputLength) {
            throw new IllegalArgumentException(
                "Input exceeds maximum size of " + maxInputLength + " characters");
        }
        var symbols = new ArrayList<LexicalSymbol>();
        int offset = 0;
        while (offset < source.length()) {
            var symbol = nextSymbol(source, offset);
            if (symbol.isEmpty()) {
                throw new LexicalError.NoLexicalMatch(offset, source.substring(offset)).toException();
            }
            symbols.add(symbol.get());
            offset = symbol.get().endOffset();
        }
        return symbols;
    }

    /**
     * Match the first rule, in priority order, that matches exactly at the offset.
     */
    public Optional<LexicalSymbol> nextSymbol(String source, int offset) {
        for (var rule : patterns.rules()) {
            var matcher = rule.pattern().matcher(source);
            // Transparent bounds let \b see the character before the region
            matcher.region(offset, source.length())
                   .useTransparentBounds(true);
            if (!matcher.lookingAt()) {
                continue;
            }
            if (matcher.end() == offset) {
                throw new IllegalStateException(
                    "Pattern for " + rule.kind() + " matched empty text at offset " + offset);
            }
            return Optional.of(new LexicalSymbol(rule.kind(), matcher.group(), offset));
        }
        return Optional.empty();
    }

    /**
     * Render symbols as a table with a header row.
     */
    public static String formatTable(List<LexicalSymbol> symbols) {
        var sb = new StringBuilder();
        sb.append(String.format("%-10s %-20s %-8s%-8s", "Token", "Lexeme", "Start", "Length"));
        for (var symbol : symbols) {
            sb.append("\n").append(symbol.describe());
        }
        return sb.toString();
    }
}
