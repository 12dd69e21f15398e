package org.pragmatica.ddl.automaton;

import org.pragmatica.ddl.grammar.StackSymbol;
import org.pragmatica.ddl.grammar.Terminal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Mutable state of one analysis: the symbol stack and the cursor over the
 * terminal word. Created per {@code analyze} call and discarded afterwards.
 */
final class AutomatonContext {
    private final List<Terminal> input;
    private final Deque<StackSymbol> stack;

    private int cursor;
    private boolean endConsumed;

    private AutomatonContext(List<Terminal> input) {
        this.input = input;
        this.stack = new ArrayDeque<>();
        this.cursor = 0;
        this.endConsumed = false;
    }

    static AutomatonContext create(List<Terminal> input, StackSymbol start) {
        var context = new AutomatonContext(withoutEndMarker(input));
        context.stack.push(StackSymbol.terminal(Terminal.END_MARKER));
        context.stack.push(start);
        return context;
    }

    // A single trailing end marker is tolerated; the automaton supplies its own
    private static List<Terminal> withoutEndMarker(List<Terminal> input) {
        var word = input;
        if (!word.isEmpty() && word.get(word.size() - 1) == Terminal.END_MARKER) {
            word = word.subList(0, word.size() - 1);
        }
        if (word.contains(Terminal.END_MARKER)) {
            throw new IllegalArgumentException("End marker inside the terminal word: " + input);
        }
        return List.copyOf(word);
    }

    // === Input ===

    Terminal lookahead() {
        return cursor < input.size()
               ? input.get(cursor)
               : Terminal.END_MARKER;
    }

    boolean hasRemainingInput() {
        return cursor < input.size();
    }

    List<Terminal> remainingInput() {
        return input.subList(cursor, input.size());
    }

    void consume() {
        if (cursor < input.size()) {
            cursor++;
        } else {
            endConsumed = true;
        }
    }

    boolean isEndConsumed() {
        return endConsumed;
    }

    // === Stack ===

    boolean isStackEmpty() {
        return stack.isEmpty();
    }

    StackSymbol pop() {
        return stack.pop();
    }

    /**
     * Push a right-hand side so that its first symbol ends up on top.
     */
    void push(List<StackSymbol> production) {
        for (int i = production.size() - 1; i >= 0; i--) {
            stack.push(production.get(i));
        }
    }

    /**
     * Stack contents, top first.
     */
    List<StackSymbol> stackTopFirst() {
        return List.copyOf(stack);
    }

    boolean onlyEmptyRemains() {
        return stack.stream()
                    .allMatch(symbol -> symbol instanceof StackSymbol.Empty);
    }

    TraceRecord snapshot() {
        var bottomFirst = new ArrayList<>(stack);
        Collections.reverse(bottomFirst);
        return new TraceRecord(bottomFirst, remainingInput());
    }
}
