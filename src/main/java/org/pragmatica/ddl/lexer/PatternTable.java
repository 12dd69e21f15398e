package org.pragmatica.ddl.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered pattern rules. The first rule matching at the scan position
 * wins, so keyword rules must precede the identifier rule.
 */
public record PatternTable(List<PatternRule> rules) {

    public static final PatternTable DEFAULT = new PatternTable(
        Arrays.stream(SymbolKind.values())
              .map(PatternRule::defaultFor)
              .toList());

    public PatternTable {
        rules = List.copyOf(rules);
    }

    /**
     * Get the rule for a kind.
     */
    public Optional<PatternRule> rule(SymbolKind kind) {
        return rules.stream()
                    .filter(r -> r.kind() == kind)
                    .findFirst();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<PatternRule> rules = new ArrayList<>();

        private Builder() {}

        public Builder rule(SymbolKind kind, String regex) {
            return rule(PatternRule.of(kind, regex));
        }

        public Builder rule(PatternRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder defaultRule(SymbolKind kind) {
            return rule(PatternRule.defaultFor(kind));
        }

        public PatternTable build() {
            return new PatternTable(rules);
        }
    }
}
