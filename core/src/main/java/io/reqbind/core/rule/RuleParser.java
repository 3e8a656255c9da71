package io.reqbind.core.rule;

import io.reqbind.core.model.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses the rule DSL ({@code required,min=3,max=50}) into an ordered rule list. Parsing happens
 * once, when an endpoint is compiled.
 *
 * <p>Rules are separated by {@code ,}. A token that is not a known rule name continues the
 * parameter of the preceding parameterized rule, so {@code in=tech,sports,politics} is a single
 * {@code in} rule with parameter {@code tech,sports,politics}. A consequence is that a member of
 * such a list can never be spelled like a known rule.
 */
public final class RuleParser {

    private final Set<String> knownNames;

    /**
     * @param knownNames every name that starts a new rule: registered checks, structural rules
     *     and group markers
     */
    public RuleParser(Set<String> knownNames) {
        this.knownNames = Set.copyOf(Objects.requireNonNull(knownNames, "knownNames must not be null"));
    }

    /**
     * Parses a DSL string. {@code null} or blank input yields no rules.
     *
     * @throws IllegalArgumentException on an empty token or an unknown rule name
     */
    public List<Rule> parse(String dsl) {
        if (dsl == null || dsl.isBlank()) {
            return List.of();
        }
        List<Rule> rules = new ArrayList<>();
        for (String token : dsl.split(",", -1)) {
            String trimmed = token.trim();
            int eq = trimmed.indexOf('=');
            String name = eq >= 0 ? trimmed.substring(0, eq).trim() : trimmed;

            if (!name.isEmpty() && knownNames.contains(name)) {
                rules.add(eq >= 0 ? Rule.of(name, trimmed.substring(eq + 1).trim()) : Rule.of(name));
                continue;
            }

            Rule previous = rules.isEmpty() ? null : rules.get(rules.size() - 1);
            if (previous != null && previous.hasParam() && !trimmed.isEmpty()) {
                rules.set(rules.size() - 1, Rule.of(previous.name(), previous.param() + "," + trimmed));
                continue;
            }

            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("Empty rule in '" + dsl + "'");
            }
            throw new IllegalArgumentException("Unknown rule '" + name + "' in '" + dsl + "'");
        }
        return List.copyOf(rules);
    }
}
