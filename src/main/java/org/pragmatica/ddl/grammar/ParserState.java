package org.pragmatica.ddl.grammar;

/**
 * Non-terminal obligations the automaton expands through the {@link ParseTable}.
 */
public enum ParserState {
    START("<S>"),
    CLAUSE_TAIL("<ALT>"),
    IDENTIFIER_TAIL("<EMP>");

    private final String display;

    ParserState(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    @Override
    public String toString() {
        return display;
    }
}
