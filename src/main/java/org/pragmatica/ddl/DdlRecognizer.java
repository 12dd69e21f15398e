package org.pragmatica.ddl;

import org.pragmatica.ddl.automaton.ParseTrace;
import org.pragmatica.ddl.automaton.StackAutomaton;
import org.pragmatica.ddl.error.RecognitionException;
import org.pragmatica.ddl.grammar.DdlGrammar;
import org.pragmatica.ddl.grammar.ParseTable;
import org.pragmatica.ddl.grammar.Terminal;
import org.pragmatica.ddl.lexer.LexicalSymbol;
import org.pragmatica.ddl.lexer.PatternTable;
import org.pragmatica.ddl.lexer.Tokenizer;
import org.pragmatica.ddl.mapper.TerminalMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point for recognizing {@code ALTER TABLE <id> DROP COLUMN <id>} statements.
 *
 * <p>Example usage:
 * <pre>{@code
 * var recognizer = DdlRecognizer.create();
 *
 * var trace = recognizer.recognize("ALTER TABLE Table1 DROP COLUMN Email");
 * }</pre>
 *
 * <p>Every phase is also available on its own. Instances are immutable and
 * may be shared between threads.
 */
public final class DdlRecognizer {
    private static final Logger log = LoggerFactory.getLogger(DdlRecognizer.class);

    private final Tokenizer tokenizer;
    private final TerminalMapper mapper;
    private final StackAutomaton automaton;

    private DdlRecognizer(Tokenizer tokenizer, TerminalMapper mapper, StackAutomaton automaton) {
        this.tokenizer = tokenizer;
        this.mapper = mapper;
        this.automaton = automaton;
    }

    /**
     * Create a recognizer with the bundled DDL tables.
     */
    public static DdlRecognizer create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Split source text into lexical symbols, whitespace excluded.
     */
    public List<LexicalSymbol> tokenize(String source) {
        return tokenizer.tokenize(source);
    }

    /**
     * Project lexical symbols onto parser terminals.
     */
    public List<Terminal> mapTerminals(List<LexicalSymbol> symbols) {
        return mapper.mapTerminals(symbols);
    }

    /**
     * Run the stack automaton over a terminal word.
     */
    public ParseTrace analyze(List<Terminal> terminals) {
        return automaton.analyze(terminals);
    }

    /**
     * Tokenize, map and analyze a statement.
     *
     * @throws RecognitionException carrying the error of the first phase that rejects
     */
    public ParseTrace recognize(String source) {
        log.debug("Recognizing '{}'", source);
        return analyze(mapTerminals(tokenize(source)));
    }

    /**
     * Check whether a statement is recognized.
     */
    public boolean accepts(String source) {
        try {
            recognize(source);
            return true;
        } catch (RecognitionException e) {
            log.debug("Statement rejected: {}", e.getMessage());
            return false;
        }
    }

    public static final class Builder {
        private PatternTable patterns = PatternTable.DEFAULT;
        private Map<String, Terminal> keywords = DdlGrammar.keywords();
        private ParseTable parseTable = DdlGrammar.parseTable();
        private boolean traceEnabled = RecognizerConfig.DEFAULT.traceEnabled();
        private int maxInputLength = RecognizerConfig.DEFAULT.maxInputLength();

        private Builder() {}

        public Builder patterns(PatternTable patterns) {
            this.patterns = patterns;
            return this;
        }

        public Builder keywords(Map<String, Terminal> keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder parseTable(ParseTable parseTable) {
            this.parseTable = parseTable;
            return this;
        }

        public Builder trace(boolean enabled) {
            this.traceEnabled = enabled;
            return this;
        }

        public Builder maxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
            return this;
        }

        public Builder config(RecognizerConfig config) {
            this.traceEnabled = config.traceEnabled();
            this.maxInputLength = config.maxInputLength();
            return this;
        }

        public DdlRecognizer build() {
            return new DdlRecognizer(Tokenizer.create(patterns, maxInputLength),
                                     TerminalMapper.create(keywords),
                                     StackAutomaton.create(parseTable, traceEnabled));
        }
    }
}
