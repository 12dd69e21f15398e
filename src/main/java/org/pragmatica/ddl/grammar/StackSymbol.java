package org.pragmatica.ddl.grammar;

import java.util.Objects;

/**
 * Symbol held on the automaton stack: a terminal to match, a state to expand,
 * or the empty right-hand side of an epsilon production.
 */
public sealed interface StackSymbol {

    String display();

    static StackSymbol terminal(Terminal terminal) {
        return new TerminalSymbol(terminal);
    }

    static StackSymbol state(ParserState state) {
        return new StateSymbol(state);
    }

    static StackSymbol empty() {
        return Empty.INSTANCE;
    }

    /**
     * Terminal that must match the current lookahead.
     */
    record TerminalSymbol(Terminal terminal) implements StackSymbol {
        public TerminalSymbol {
            Objects.requireNonNull(terminal, "terminal");
        }

        @Override
        public String display() {
            return terminal.display();
        }
    }

    /**
     * State expanded through the parse table.
     */
    record StateSymbol(ParserState state) implements StackSymbol {
        public StateSymbol {
            Objects.requireNonNull(state, "state");
        }

        @Override
        public String display() {
            return state.display();
        }
    }

    /**
     * Epsilon marker; popping it consumes nothing.
     */
    record Empty() implements StackSymbol {
        private static final Empty INSTANCE = new Empty();

        @Override
        public String display() {
            return "";
        }
    }
}
