package org.pragmatica.ddl.automaton;

import org.junit.jupiter.api.Test;
import org.pragmatica.ddl.error.ParseError;
import org.pragmatica.ddl.error.RecognitionError;
import org.pragmatica.ddl.error.RecognitionException;
import org.pragmatica.ddl.grammar.DdlGrammar;
import org.pragmatica.ddl.grammar.ParseTable;
import org.pragmatica.ddl.grammar.ParserState;
import org.pragmatica.ddl.grammar.Terminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.pragmatica.ddl.grammar.StackSymbol.empty;
import static org.pragmatica.ddl.grammar.StackSymbol.state;
import static org.pragmatica.ddl.grammar.StackSymbol.terminal;
import static org.pragmatica.ddl.grammar.Terminal.ALTER_TABLE;
import static org.pragmatica.ddl.grammar.Terminal.DROP_COLUMN;
import static org.pragmatica.ddl.grammar.Terminal.END_MARKER;
import static org.pragmatica.ddl.grammar.Terminal.IDENTIFIER;

class StackAutomatonTest {

    private static final List<Terminal> STATEMENT = List.of(ALTER_TABLE, IDENTIFIER, DROP_COLUMN, IDENTIFIER);

    private final StackAutomaton automaton = StackAutomaton.create(DdlGrammar.parseTable());

    /**
     * Statement with an optional DROP COLUMN clause:
     * S -> ALTER_TABLE id ALT; ALT -> DROP_COLUMN id | epsilon.
     */
    private static ParseTable optionalClauseTable() {
        return ParseTable.builder(ParserState.START)
                         .entry(ParserState.START, ALTER_TABLE,
                                terminal(ALTER_TABLE), terminal(IDENTIFIER), state(ParserState.CLAUSE_TAIL))
                         .entry(ParserState.CLAUSE_TAIL, DROP_COLUMN, terminal(DROP_COLUMN), terminal(IDENTIFIER))
                         .entry(ParserState.CLAUSE_TAIL, END_MARKER, empty())
                         .build();
    }

    private static RecognitionError rejection(StackAutomaton automaton, List<Terminal> word) {
        return assertThrows(RecognitionException.class, () -> automaton.analyze(word)).error();
    }

    @Test
    void analyze_dropColumnStatement_accepts() {
        var trace = automaton.analyze(STATEMENT);

        assertThat(trace.isEmpty()).isFalse();
    }

    @Test
    void analyze_dropColumnStatement_traceFollowsEveryStep() {
        var trace = automaton.analyze(STATEMENT);

        // initial, expand START, four matches, end marker
        assertThat(trace.size()).isEqualTo(7);
        assertThat(trace.records().get(0).stack()).containsExactly(terminal(END_MARKER), state(ParserState.START));
        assertThat(trace.records().get(0).remainingInput()).isEqualTo(STATEMENT);
        assertThat(trace.records().get(1).stack()).containsExactly(terminal(END_MARKER),
                                                                   terminal(IDENTIFIER),
                                                                   terminal(DROP_COLUMN),
                                                                   terminal(IDENTIFIER),
                                                                   terminal(ALTER_TABLE));
        assertThat(trace.records().get(6).stack()).isEmpty();
        assertThat(trace.records().get(6).remainingInput()).isEmpty();
    }

    @Test
    void analyze_traceRender_showsStackAndRemainingInput() {
        var trace = automaton.analyze(STATEMENT);

        assertThat(trace.records().get(0).render())
            .isEqualTo("$<S>                 \t <ALTER TABLE><id><DROP COLUMN><id>");
        assertThat(trace.render().split("\n")).hasSize(7);
    }

    @Test
    void analyze_missingAlterTable_failsOnTerminalMismatch() {
        var error = rejection(automaton, List.of(DROP_COLUMN, IDENTIFIER));

        assertThat(error).isEqualTo(new ParseError.UnexpectedTerminal(ALTER_TABLE, DROP_COLUMN));
    }

    @Test
    void analyze_trailingIdentifier_failsWithUnconsumedInput() {
        var error = rejection(automaton, List.of(ALTER_TABLE, IDENTIFIER, DROP_COLUMN, IDENTIFIER, IDENTIFIER));

        assertThat(error).isEqualTo(new ParseError.UnconsumedInput(List.of(IDENTIFIER)));
    }

    @Test
    void analyze_truncatedStatement_failsWithUnconsumedObligations() {
        var error = rejection(automaton, List.of(ALTER_TABLE, IDENTIFIER, DROP_COLUMN));

        assertThat(error).isEqualTo(new ParseError.UnconsumedObligations(List.of(terminal(IDENTIFIER),
                                                                                 terminal(END_MARKER))));
    }

    @Test
    void analyze_statementMissingClause_reportsEveryPendingObligation() {
        var error = rejection(automaton, List.of(ALTER_TABLE, IDENTIFIER));

        assertThat(error).isEqualTo(new ParseError.UnconsumedObligations(List.of(terminal(DROP_COLUMN),
                                                                                 terminal(IDENTIFIER),
                                                                                 terminal(END_MARKER))));
        assertThat(error.message())
            .isEqualTo("Input ended with unmatched obligations: <DROP COLUMN> <id> $");
    }

    @Test
    void analyze_emptyWord_failsWithWholeStatementPending() {
        var error = rejection(automaton, List.of());

        assertThat(error).isEqualTo(new ParseError.UnconsumedObligations(List.of(terminal(ALTER_TABLE),
                                                                                 terminal(IDENTIFIER),
                                                                                 terminal(DROP_COLUMN),
                                                                                 terminal(IDENTIFIER),
                                                                                 terminal(END_MARKER))));
    }

    @Test
    void analyze_stateWithoutEntryAtEndOfInput_failsWithUnconsumedObligations() {
        var table = ParseTable.builder(ParserState.START)
                              .entry(ParserState.START, ALTER_TABLE,
                                     terminal(ALTER_TABLE), state(ParserState.CLAUSE_TAIL))
                              .entry(ParserState.CLAUSE_TAIL, DROP_COLUMN, terminal(DROP_COLUMN))
                              .build();

        var error = rejection(StackAutomaton.create(table), List.of(ALTER_TABLE));

        assertThat(error).isEqualTo(new ParseError.UnconsumedObligations(List.of(state(ParserState.CLAUSE_TAIL),
                                                                                 terminal(END_MARKER))));
    }

    @Test
    void analyze_rejectedWord_exposesTraceUpToFailingStep() {
        var exception = assertThrows(RecognitionException.class,
                                     () -> automaton.analyze(List.of(DROP_COLUMN, IDENTIFIER)));

        var trace = exception.trace();
        assertThat(trace.size()).isEqualTo(2);
        var last = trace.records().get(trace.size() - 1);
        assertThat(last.stack()).containsExactly(terminal(END_MARKER),
                                                 terminal(IDENTIFIER),
                                                 terminal(DROP_COLUMN),
                                                 terminal(IDENTIFIER),
                                                 terminal(ALTER_TABLE));
        assertThat(last.remainingInput()).containsExactly(DROP_COLUMN, IDENTIFIER);
    }

    @Test
    void analyze_rejectedWordWithTracingDisabled_exposesEmptyTrace() {
        var quiet = StackAutomaton.create(DdlGrammar.parseTable(), false);

        var exception = assertThrows(RecognitionException.class, () -> quiet.analyze(List.of(DROP_COLUMN)));

        assertThat(exception.trace().isEmpty()).isTrue();
    }

    @Test
    void analyze_stateWithoutEntryOrFallback_failsWithNoTableEntry() {
        var strict = StackAutomaton.create(ParseTable.builder(ParserState.START)
                                                     .entry(ParserState.START, ALTER_TABLE, terminal(ALTER_TABLE))
                                                     .build());

        var error = rejection(strict, List.of(DROP_COLUMN));

        assertThat(error).isEqualTo(new ParseError.NoTableEntry(ParserState.START, DROP_COLUMN));
    }

    @Test
    void analyze_endMarkerMidProduction_failsWithUnconsumedObligations() {
        var table = ParseTable.builder(ParserState.START)
                              .entry(ParserState.START, ALTER_TABLE,
                                     terminal(ALTER_TABLE), terminal(END_MARKER), terminal(IDENTIFIER))
                              .build();

        var error = rejection(StackAutomaton.create(table), List.of(ALTER_TABLE));

        assertThat(error).isInstanceOf(ParseError.UnconsumedObligations.class);
        assertThat(((ParseError.UnconsumedObligations) error).remainingStack())
            .containsExactly(terminal(IDENTIFIER), terminal(END_MARKER));
    }

    @Test
    void analyze_optionalClauseTable_acceptsWithAndWithoutClause() {
        var optional = StackAutomaton.create(optionalClauseTable());

        optional.analyze(List.of(ALTER_TABLE, IDENTIFIER));
        optional.analyze(STATEMENT);

        var error = rejection(optional, List.of(ALTER_TABLE, IDENTIFIER, IDENTIFIER));
        assertThat(error).isEqualTo(new ParseError.NoTableEntry(ParserState.CLAUSE_TAIL, IDENTIFIER));
    }

    @Test
    void analyze_epsilonExpansion_popsEmptyAsSeparateStep() {
        var trace = StackAutomaton.create(optionalClauseTable()).analyze(List.of(ALTER_TABLE, IDENTIFIER));

        // initial, expand START, two matches, expand ALT, pop Empty, end marker
        assertThat(trace.size()).isEqualTo(7);
        assertThat(trace.records().get(4).stack()).containsExactly(terminal(END_MARKER), empty());
        assertThat(trace.records().get(5).stack()).containsExactly(terminal(END_MARKER));
    }

    @Test
    void analyze_repeatedCalls_identicalOutcomeAndTraceLength() {
        var first = automaton.analyze(STATEMENT);
        var second = automaton.analyze(STATEMENT);

        assertThat(second).isEqualTo(first);
        assertThat(rejection(automaton, List.of(DROP_COLUMN))).isEqualTo(rejection(automaton, List.of(DROP_COLUMN)));
    }

    @Test
    void analyze_explicitTrailingEndMarker_tolerated() {
        var withMarker = new ArrayList<>(STATEMENT);
        withMarker.add(END_MARKER);

        assertThat(automaton.analyze(withMarker)).isEqualTo(automaton.analyze(STATEMENT));
    }

    @Test
    void analyze_endMarkerInsideWord_rejectedAsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                     () -> automaton.analyze(List.of(ALTER_TABLE, END_MARKER, IDENTIFIER)));
    }

    @Test
    void analyze_tracingDisabled_returnsEmptyTraceSameOutcome() {
        var quiet = StackAutomaton.create(DdlGrammar.parseTable(), false);

        assertThat(quiet.analyze(STATEMENT).isEmpty()).isTrue();
        assertThat(rejection(quiet, List.of(DROP_COLUMN, IDENTIFIER)))
            .isEqualTo(new ParseError.UnexpectedTerminal(ALTER_TABLE, DROP_COLUMN));
    }

    @Test
    void analyze_longWord_doesNotOverflowCallStack() {
        var table = ParseTable.builder(ParserState.START)
                              .entry(ParserState.START, IDENTIFIER, terminal(IDENTIFIER), state(ParserState.START))
                              .entry(ParserState.START, END_MARKER, empty())
                              .build();
        var word = Collections.nCopies(200_000, IDENTIFIER);

        var trace = StackAutomaton.create(table, false).analyze(word);

        assertThat(trace.isEmpty()).isTrue();
    }
}
