package org.pragmatica.ddl.automaton;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered automaton configurations of an analysis, starting with the initial
 * stack. For a rejected word it ends at the configuration in which the failing
 * step was attempted. Empty when tracing is disabled.
 */
public record ParseTrace(List<TraceRecord> records) {
    public static final ParseTrace EMPTY = new ParseTrace(List.of());

    public ParseTrace {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public String render() {
        return records.stream()
                      .map(TraceRecord::render)
                      .collect(Collectors.joining("\n"));
    }
}
