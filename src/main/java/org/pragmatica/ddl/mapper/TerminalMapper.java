package org.pragmatica.ddl.mapper;

import org.pragmatica.ddl.error.MappingError;
import org.pragmatica.ddl.grammar.DdlGrammar;
import org.pragmatica.ddl.grammar.Terminal;
import org.pragmatica.ddl.lexer.LexicalSymbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projects lexical symbols onto the parser's terminal alphabet.
 *
 * <p>Keywords map through an exact-text dictionary, identifiers map to
 * {@link Terminal#IDENTIFIER} regardless of their text, and every other kind is
 * rejected. The end marker is not appended; the automaton supplies it.
 */
public final class TerminalMapper {
    private final Map<String, Terminal> keywords;

    private TerminalMapper(Map<String, Terminal> keywords) {
        this.keywords = keywords;
    }

    public static TerminalMapper create() {
        return create(DdlGrammar.keywords());
    }

    public static TerminalMapper create(Map<String, Terminal> keywords) {
        var copy = Map.copyOf(keywords);
        if (copy.containsValue(Terminal.END_MARKER)) {
            throw new IllegalArgumentException("Keywords cannot map to the end marker");
        }
        return new TerminalMapper(copy);
    }

    public Map<String, Terminal> keywords() {
        return keywords;
    }

    /**
     * Map symbols to terminals, preserving order.
     *
     * @throws org.pragmatica.ddl.error.RecognitionException with a {@link MappingError}
     *         for the first symbol that cannot be mapped
     */
    public List<Terminal> mapTerminals(List<LexicalSymbol> symbols) {
        Objects.requireNonNull(symbols, "symbols");
        var terminals = new ArrayList<Terminal>(symbols.size());
        for (var symbol : symbols) {
            terminals.add(map(symbol));
        }
        return List.copyOf(terminals);
    }

    private Terminal map(LexicalSymbol symbol) {
        return switch (symbol.kind()) {
            case KEYWORD -> keyword(symbol);
            case IDENTIFIER -> Terminal.IDENTIFIER;
            default -> throw new MappingError.UnsupportedSymbolKind(symbol.kind(),
                                                                    symbol.text(),
                                                                    symbol.startOffset()).toException();
        };
    }

    private Terminal keyword(LexicalSymbol symbol) {
        var terminal = keywords.get(symbol.text());
        if (terminal == null) {
            throw new MappingError.UnmappedKeyword(symbol.text(), symbol.startOffset()).toException();
        }
        return terminal;
    }
}
