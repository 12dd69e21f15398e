package org.pragmatica.ddl.error;

import org.pragmatica.ddl.grammar.ParserState;
import org.pragmatica.ddl.grammar.StackSymbol;
import org.pragmatica.ddl.grammar.Terminal;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Rejection by the stack automaton.
 */
public sealed interface ParseError extends RecognitionError {

    /**
     * Stacked terminal differs from the lookahead.
     */
    record UnexpectedTerminal(Terminal expected, Terminal found) implements ParseError {
        @Override
        public String message() {
            return "Expected " + expected + " but found " + found;
        }
    }

    /**
     * The table has no production for the state under the lookahead.
     */
    record NoTableEntry(ParserState state, Terminal lookahead) implements ParseError {
        @Override
        public String message() {
            return "No table entry for state " + state + " with lookahead " + lookahead;
        }
    }

    /**
     * Input ended while non-empty symbols remain on the stack.
     *
     * @param remainingStack leftover symbols, top first
     */
    record UnconsumedObligations(List<StackSymbol> remainingStack) implements ParseError {
        public UnconsumedObligations {
            remainingStack = List.copyOf(remainingStack);
        }

        @Override
        public String message() {
            return "Input ended with unmatched obligations: " + remainingStack.stream()
                                                                              .map(StackSymbol::display)
                                                                              .collect(Collectors.joining(" "));
        }
    }

    /**
     * Stack exhausted while terminals remain.
     */
    record UnconsumedInput(List<Terminal> remainingInput) implements ParseError {
        public UnconsumedInput {
            remainingInput = List.copyOf(remainingInput);
        }

        @Override
        public String message() {
            return "Unconsumed input: " + remainingInput.stream()
                                                        .map(Terminal::display)
                                                        .collect(Collectors.joining(" "));
        }
    }
}
