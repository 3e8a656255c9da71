package io.reqbind.core.rule;

import io.reqbind.core.model.FieldDescriptor;
import io.reqbind.core.model.Rule;
import io.reqbind.core.model.TypedRecord;
import io.reqbind.core.model.ValidationError;
import io.reqbind.core.model.ValueKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule engine applied to a fully decoded {@link TypedRecord}.
 *
 * <p>Evaluation follows descriptor order. Within one field the rules run in declaration order
 * and stop at the first failure; across fields evaluation always continues, so one call reports
 * every failing field. After {@code dive} the remaining rules apply to each element
 * independently, and every failing element is reported as {@code Field[i]}.
 *
 * <p>Group markers ({@code create}, {@code update} unless configured otherwise) gate a whole
 * field: a field whose rules name one or more groups is only validated when {@link
 * #validate(TypedRecord, List, String)} runs under one of them.
 *
 * <p>Constructed once via {@link #builder()}; immutable and thread-safe afterwards.
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final Map<String, RuleCheck> checks;
    private final Set<String> groups;
    private final MessageCatalog messages;
    private final RuleParser parser;

    private Validator(Map<String, RuleCheck> checks, Set<String> groups, MessageCatalog messages) {
        this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        this.groups = Collections.unmodifiableSet(new LinkedHashSet<>(groups));
        this.messages = messages;

        Set<String> known = new HashSet<>(checks.keySet());
        known.add(BuiltinRules.OMITEMPTY);
        known.add(BuiltinRules.DIVE);
        known.addAll(groups);
        this.parser = new RuleParser(known);
    }

    /** A validator with the built-in rules, default groups and default messages. */
    public static Validator standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a rule DSL string against this validator's vocabulary.
     *
     * @throws IllegalArgumentException on an unknown rule or an empty token
     */
    public List<Rule> parseRules(String dsl) {
        return parser.parse(dsl);
    }

    /** True if the name is a registered check, a structural rule or a group marker. */
    public boolean isKnown(String ruleName) {
        return checks.containsKey(ruleName)
                || BuiltinRules.OMITEMPTY.equals(ruleName)
                || BuiltinRules.DIVE.equals(ruleName)
                || groups.contains(ruleName);
    }

    public boolean isGroup(String ruleName) {
        return groups.contains(ruleName);
    }

    public Set<String> groups() {
        return groups;
    }

    public MessageCatalog messages() {
        return messages;
    }

    /**
     * Validates a record.
     *
     * @param record      the decoded record; must contain every descriptor's field
     * @param descriptors the endpoint's fields, in declaration order
     * @param group       the validation group, or {@code null}
     * @return every violation, in field declaration order; empty means valid
     */
    public List<ValidationError> validate(TypedRecord record, List<FieldDescriptor> descriptors, String group) {
        List<ValidationError> errors = new ArrayList<>();
        for (FieldDescriptor descriptor : descriptors) {
            ValueKind kind = record.kindOf(descriptor.name());
            if (kind == null) {
                throw new IllegalArgumentException("Record has no field '" + descriptor.name() + "'");
            }
            if (!groupActive(descriptor.rules(), group)) {
                LOG.trace("Skipping field {} outside group {}", descriptor.name(), group);
                continue;
            }
            evaluate(descriptor.name(), record.get(descriptor.name()), kind, descriptor.rules(), errors, false);
        }
        return List.copyOf(errors);
    }

    private boolean groupActive(List<Rule> rules, String group) {
        boolean scoped = false;
        for (Rule rule : rules) {
            if (groups.contains(rule.name())) {
                if (rule.name().equals(group)) {
                    return true;
                }
                scoped = true;
            }
        }
        return !scoped;
    }

    private void evaluate(
            String field,
            Object value,
            ValueKind kind,
            List<Rule> rules,
            List<ValidationError> out,
            boolean element) {
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            String name = rule.name();

            if (BuiltinRules.OMITEMPTY.equals(name)) {
                if (kind.isZero(value)) {
                    return;
                }
                continue;
            }
            if (groups.contains(name)) {
                continue;
            }
            if (BuiltinRules.DIVE.equals(name)) {
                if (!kind.isCollection()) {
                    throw new IllegalStateException("dive on non-collection field '" + field + "'");
                }
                List<Rule> remaining = rules.subList(i + 1, rules.size());
                List<?> elements = (List<?>) value;
                for (int index = 0; index < elements.size(); index++) {
                    evaluate(field + "[" + index + "]", elements.get(index), kind.elementKind(), remaining, out, true);
                }
                return;
            }

            if (!passes(rule, value, kind, field)) {
                String message = messages.render(rule, kind, field);
                out.add(new ValidationError(field, element ? messages.renderElement(message) : message, kind.render(value)));
                return;
            }
        }
    }

    private boolean passes(Rule rule, Object value, ValueKind kind, String field) {
        RuleCheck check = checks.get(rule.name());
        if (check == null) {
            throw new IllegalStateException("No check registered for rule '" + rule.name() + "'");
        }
        try {
            return check.test(value, kind, rule.param());
        } catch (RuntimeException e) {
            LOG.warn("Rule '{}' failed with an exception on field {}; reporting it as violated", rule, field, e);
            return false;
        }
    }

    /**
     * Builder for {@link Validator}. Starts with {@link BuiltinRules}, the default groups and the
     * default message catalogue.
     */
    public static final class Builder {

        private final Map<String, RuleCheck> checks = new LinkedHashMap<>(BuiltinRules.checks());
        private final Set<String> groups = new LinkedHashSet<>(BuiltinRules.DEFAULT_GROUPS);
        private MessageCatalog messages = MessageCatalog.defaults();

        private Builder() {}

        /**
         * Registers or replaces a rule.
         *
         * @throws IllegalArgumentException if the name is blank, contains {@code ,} or {@code =},
         *     or is a structural rule
         */
        public Builder rule(String name, RuleCheck check) {
            Objects.requireNonNull(check, "check must not be null");
            if (name == null || name.isBlank() || name.contains(",") || name.contains("=")) {
                throw new IllegalArgumentException("Invalid rule name: '" + name + "'");
            }
            if (BuiltinRules.OMITEMPTY.equals(name) || BuiltinRules.DIVE.equals(name)) {
                throw new IllegalArgumentException("'" + name + "' is a structural rule and cannot be replaced");
            }
            checks.put(name, check);
            return this;
        }

        /** Replaces the set of group markers. */
        public Builder groups(Collection<String> groupNames) {
            groups.clear();
            groupNames.forEach(group -> {
                if (group == null || group.isBlank()) {
                    throw new IllegalArgumentException("Group names must not be blank");
                }
                groups.add(group.trim());
            });
            return this;
        }

        public Builder messages(MessageCatalog catalog) {
            this.messages = Objects.requireNonNull(catalog, "catalog must not be null");
            return this;
        }

        /** Overrides individual templates on top of the current catalogue. */
        public Builder messageOverrides(Map<String, String> overrides) {
            this.messages = messages.withOverrides(overrides);
            return this;
        }

        /**
         * Builds the validator.
         *
         * @throws IllegalArgumentException if a group marker collides with a rule name
         */
        public Validator build() {
            for (String group : groups) {
                if (checks.containsKey(group)) {
                    throw new IllegalArgumentException("Group '" + group + "' collides with a rule of the same name");
                }
            }
            return new Validator(checks, groups, messages);
        }
    }
}
