package org.pragmatica.ddl.grammar;

/**
 * Input alphabet of the stack automaton.
 */
public enum Terminal {
    ALTER_TABLE("<ALTER TABLE>"),
    DROP_COLUMN("<DROP COLUMN>"),
    IDENTIFIER("<id>"),
    /**
     * End of the terminal word. Never produced by the mapper; the automaton
     * reads it once the cursor passes the last terminal.
     */
    END_MARKER("$");

    private final String display;

    Terminal(String display) {
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
