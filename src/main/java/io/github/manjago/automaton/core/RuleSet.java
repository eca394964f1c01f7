package io.github.manjago.automaton.core;

import java.util.List;

/**
 * Output of {@link RuleParser}: rules in source order plus the largest state id
 * mentioned anywhere (as source or target).
 */
public record RuleSet(List<RawRule> rules, int maxId) {

    public RuleSet {
        rules = List.copyOf(rules);
    }

    public int size() {
        return rules.size();
    }
}
