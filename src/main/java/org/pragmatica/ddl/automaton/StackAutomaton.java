package org.pragmatica.ddl.automaton;

import org.pragmatica.ddl.error.ParseError;
import org.pragmatica.ddl.error.RecognitionException;
import org.pragmatica.ddl.grammar.ParseTable;
import org.pragmatica.ddl.grammar.ParserState;
import org.pragmatica.ddl.grammar.StackSymbol;
import org.pragmatica.ddl.grammar.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table-driven predictive (LL) recognizer using an explicit symbol stack.
 *
 * <p>The stack starts as {@code [END_MARKER, start state]}. Each step pops one
 * symbol: a state is replaced by the table production selected by the
 * lookahead, a terminal must equal the lookahead and consumes it, and
 * {@code Empty} does nothing. The analysis ends when the stacked end marker
 * meets the end of input; it accepts if only {@code Empty} symbols remain.
 * Any other obligation popped after the input is exhausted rejects the word
 * with {@link ParseError.UnconsumedObligations}.
 *
 * <p>The automaton knows nothing about the grammar beyond its {@link ParseTable}.
 */
public final class StackAutomaton {
    private static final Logger log = LoggerFactory.getLogger(StackAutomaton.class);

    private final ParseTable table;
    private final boolean traceEnabled;

    private StackAutomaton(ParseTable table, boolean traceEnabled) {
        this.table = table;
        this.traceEnabled = traceEnabled;
    }

    public static StackAutomaton create(ParseTable table) {
        return create(table, true);
    }

    public static StackAutomaton create(ParseTable table, boolean traceEnabled) {
        return new StackAutomaton(Objects.requireNonNull(table, "table"), traceEnabled);
    }

    public ParseTable table() {
        return table;
    }

    /**
     * Analyze a terminal word.
     *
     * @return the trace of automaton configurations, empty if tracing is disabled
     * @throws RecognitionException with a {@link ParseError} when the word is rejected;
     *                              its {@link RecognitionException#trace()} holds the
     *                              configurations up to the failing step
     */
    public ParseTrace analyze(List<Terminal> terminals) {
        Objects.requireNonNull(terminals, "terminals");
        var ctx = AutomatonContext.create(terminals, StackSymbol.state(table.startState()));
        var trace = new ArrayList<TraceRecord>();
        recordStep(ctx, trace);
        try {
            run(ctx, trace);
        } catch (RecognitionException e) {
            log.debug("Rejected {} terminals: {}", terminals.size(), e.getMessage());
            throw e.withTrace(new ParseTrace(trace));
        }
        log.debug("Accepted {} terminals", terminals.size());
        return new ParseTrace(trace);
    }

    private void run(AutomatonContext ctx, List<TraceRecord> trace) {
        while (!ctx.isEndConsumed()) {
            if (ctx.isStackEmpty()) {
                throw new ParseError.UnconsumedInput(ctx.remainingInput()).toException();
            }
            step(ctx);
            recordStep(ctx, trace);
        }
        if (!ctx.onlyEmptyRemains()) {
            throw new ParseError.UnconsumedObligations(ctx.stackTopFirst()).toException();
        }
    }

    private void step(AutomatonContext ctx) {
        var top = ctx.pop();
        if (top instanceof StackSymbol.TerminalSymbol terminal) {
            match(ctx, terminal.terminal());
        } else if (top instanceof StackSymbol.StateSymbol state) {
            expand(ctx, state.state());
        }
        // Empty: epsilon, nothing to do
    }

    private void match(AutomatonContext ctx, Terminal expected) {
        if (expected == Terminal.END_MARKER && ctx.hasRemainingInput()) {
            throw new ParseError.UnconsumedInput(ctx.remainingInput()).toException();
        }
        if (expected != Terminal.END_MARKER && !ctx.hasRemainingInput()) {
            throw unconsumedObligations(ctx, StackSymbol.terminal(expected));
        }
        var lookahead = ctx.lookahead();
        if (expected != lookahead) {
            throw new ParseError.UnexpectedTerminal(expected, lookahead).toException();
        }
        ctx.consume();
    }

    private void expand(AutomatonContext ctx, ParserState state) {
        var lookahead = ctx.lookahead();
        var production = table.production(state, lookahead);
        if (production.isEmpty() && !ctx.hasRemainingInput()) {
            throw unconsumedObligations(ctx, StackSymbol.state(state));
        }
        ctx.push(production.orElseThrow(() -> new ParseError.NoTableEntry(state, lookahead).toException()));
    }

    // popped symbol first, then the rest of the stack
    private static RecognitionException unconsumedObligations(AutomatonContext ctx, StackSymbol popped) {
        var remaining = new ArrayList<StackSymbol>();
        remaining.add(popped);
        remaining.addAll(ctx.stackTopFirst());
        return new ParseError.UnconsumedObligations(remaining).toException();
    }

    private void recordStep(AutomatonContext ctx, List<TraceRecord> trace) {
        if (!traceEnabled) {
            return;
        }
        var snapshot = ctx.snapshot();
        trace.add(snapshot);
        log.debug("{}", snapshot.render());
    }
}
