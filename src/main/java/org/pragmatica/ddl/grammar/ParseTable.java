package org.pragmatica.ddl.grammar;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Predictive parse table: maps (state, lookahead) to the right-hand side pushed
 * in place of the state.
 *
 * <p>A state may also own a fallback production, used when no entry exists for
 * the lookahead. Right-hand sides are listed in matching order; the automaton
 * reverses them when pushing.
 *
 * <p>Example:
 * <pre>{@code
 * var table = ParseTable.builder(ParserState.START)
 *     .entry(ParserState.START, Terminal.ALTER_TABLE,
 *            StackSymbol.terminal(Terminal.ALTER_TABLE),
 *            StackSymbol.terminal(Terminal.IDENTIFIER))
 *     .build();
 * }</pre>
 */
public record ParseTable(
    ParserState startState,
    Map<Key, List<StackSymbol>> entries,
    Map<ParserState, List<StackSymbol>> fallbacks) {

    public ParseTable {
        Objects.requireNonNull(startState, "startState");
        entries = Map.copyOf(entries);
        fallbacks = Map.copyOf(fallbacks);
    }

    /**
     * Table lookup key.
     */
    public record Key(ParserState state, Terminal lookahead) {
        public Key {
            Objects.requireNonNull(state, "state");
            Objects.requireNonNull(lookahead, "lookahead");
        }

        @Override
        public String toString() {
            return "(" + state + ", " + lookahead + ")";
        }
    }

    /**
     * Get the production for a state under the given lookahead, falling back to
     * the state's default production.
     */
    public Optional<List<StackSymbol>> production(ParserState state, Terminal lookahead) {
        var entry = entries.get(new Key(state, lookahead));
        if (entry != null) {
            return Optional.of(entry);
        }
        return Optional.ofNullable(fallbacks.get(state));
    }

    public boolean hasEntry(ParserState state, Terminal lookahead) {
        return entries.containsKey(new Key(state, lookahead));
    }

    public int size() {
        return entries.size() + fallbacks.size();
    }

    public static Builder builder(ParserState startState) {
        return new Builder(startState);
    }

    public static final class Builder {
        private final ParserState startState;
        private final Map<Key, List<StackSymbol>> entries = new HashMap<>();
        private final Map<ParserState, List<StackSymbol>> fallbacks = new EnumMap<>(ParserState.class);

        private Builder(ParserState startState) {
            this.startState = startState;
        }

        public Builder entry(ParserState state, Terminal lookahead, StackSymbol... symbols) {
            var key = new Key(state, lookahead);
            if (entries.containsKey(key)) {
                throw new IllegalStateException("Duplicate parse table entry " + key);
            }
            entries.put(key, rightHandSide(symbols));
            return this;
        }

        public Builder fallback(ParserState state, StackSymbol... symbols) {
            Objects.requireNonNull(state, "state");
            if (fallbacks.containsKey(state)) {
                throw new IllegalStateException("Duplicate fallback production for " + state);
            }
            fallbacks.put(state, rightHandSide(symbols));
            return this;
        }

        public ParseTable build() {
            return new ParseTable(startState, entries, fallbacks);
        }

        // An empty right-hand side is written as Empty so every expansion pushes something
        private static List<StackSymbol> rightHandSide(StackSymbol... symbols) {
            if (symbols.length == 0) {
                return List.of(StackSymbol.empty());
            }
            return List.copyOf(Arrays.asList(symbols));
        }
    }
}
