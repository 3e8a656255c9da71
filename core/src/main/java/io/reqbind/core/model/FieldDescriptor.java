package io.reqbind.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Static description of one logical field of an endpoint: where it is read from, whether it must
 * be present, the literal used when it is absent, and its ordered rule list. Built once at
 * configuration time; the rule DSL has already been parsed.
 *
 * @param name         logical field name, a key of the endpoint's record schema
 * @param source       where the raw value is read from
 * @param required     whether absence is an error
 * @param defaultValue literal coerced in place of an absent value, or {@code null}
 * @param rules        validation rules in evaluation order
 */
public record FieldDescriptor(
        String name, SourceKind source, boolean required, String defaultValue, List<Rule> rules) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /** The rules in DSL form, e.g. {@code required,min=3}. */
    public String rulesText() {
        return rules.stream().map(Rule::toString).collect(Collectors.joining(","));
    }
}
