package org.pragmatica.ddl.automaton;

import org.pragmatica.ddl.grammar.StackSymbol;
import org.pragmatica.ddl.grammar.Terminal;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Automaton configuration after one step.
 *
 * @param stack          stack contents, bottom first
 * @param remainingInput terminals not yet consumed
 */
public record TraceRecord(List<StackSymbol> stack, List<Terminal> remainingInput) {
    private static final int STACK_COLUMN_WIDTH = 20;

    public TraceRecord {
        stack = List.copyOf(stack);
        remainingInput = List.copyOf(remainingInput);
    }

    /**
     * Render as the stack column padded to 20 characters, a tab, and the remaining input.
     */
    public String render() {
        var stackText = stack.stream()
                             .map(StackSymbol::display)
                             .collect(Collectors.joining());
        var inputText = remainingInput.stream()
                                      .map(Terminal::display)
                                      .collect(Collectors.joining());
        return String.format("%-" + STACK_COLUMN_WIDTH + "s \t %s", stackText, inputText);
    }

    @Override
    public String toString() {
        return render();
    }
}
