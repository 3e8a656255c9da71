package io.reqbind.core.rule;

import io.reqbind.core.model.ValueKind;

/**
 * Predicate behind a named rule. Registered with {@link Validator.Builder#rule(String,
 * RuleCheck)}.
 *
 * <p>Implementations MUST be stateless and thread-safe. They receive values that already passed
 * coercion, in the representation documented on {@link ValueKind}.
 */
@FunctionalInterface
public interface RuleCheck {

    /**
     * Tests a value.
     *
     * @param value the coerced value, never null
     * @param kind  the value's kind (the element kind after {@code dive})
     * @param param the rule parameter, or {@code null}
     * @return {@code true} if the value satisfies the rule
     */
    boolean test(Object value, ValueKind kind, String param);
}
