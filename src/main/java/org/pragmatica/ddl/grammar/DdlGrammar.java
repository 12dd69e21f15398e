package org.pragmatica.ddl.grammar;

import java.util.Map;

import static org.pragmatica.ddl.grammar.StackSymbol.empty;
import static org.pragmatica.ddl.grammar.StackSymbol.terminal;

/**
 * Bundled grammar for {@code ALTER TABLE <identifier> DROP COLUMN <identifier>}.
 *
 * <p>The {@code CLAUSE_TAIL} and {@code IDENTIFIER_TAIL} entries are never reached
 * by the single production.
 */
public final class DdlGrammar {
    public static final String ALTER_TABLE_LITERAL = "ALTER TABLE";
    public static final String DROP_COLUMN_LITERAL = "DROP COLUMN";

    private static final Map<String, Terminal> KEYWORDS = Map.of(
        ALTER_TABLE_LITERAL, Terminal.ALTER_TABLE,
        DROP_COLUMN_LITERAL, Terminal.DROP_COLUMN);

    private static final StackSymbol[] DROP_COLUMN_STATEMENT = {
        terminal(Terminal.ALTER_TABLE),
        terminal(Terminal.IDENTIFIER),
        terminal(Terminal.DROP_COLUMN),
        terminal(Terminal.IDENTIFIER)
    };

    private static final ParseTable PARSE_TABLE = ParseTable.builder(ParserState.START)
        .entry(ParserState.START, Terminal.ALTER_TABLE, DROP_COLUMN_STATEMENT)
        .fallback(ParserState.START, DROP_COLUMN_STATEMENT)
        .entry(ParserState.CLAUSE_TAIL, Terminal.END_MARKER, empty())
        .entry(ParserState.IDENTIFIER_TAIL, Terminal.IDENTIFIER, empty())
        .build();

    private DdlGrammar() {}

    /**
     * Keyword literal to terminal dictionary, matched case-sensitively.
     */
    public static Map<String, Terminal> keywords() {
        return KEYWORDS;
    }

    public static ParseTable parseTable() {
        return PARSE_TABLE;
    }
}
