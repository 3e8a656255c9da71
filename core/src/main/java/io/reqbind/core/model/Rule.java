package io.reqbind.core.model;

import java.util.Objects;

/**
 * One parsed validation directive, e.g. {@code min} with param {@code "3"} or {@code in} with
 * param {@code "tech,sports,politics"}.
 *
 * @param name  the registered rule name
 * @param param the parameter text, or {@code null} for parameterless rules
 */
public record Rule(String name, String param) {

    public Rule {
        Objects.requireNonNull(name, "name must not be null");
    }

    /** Creates a parameterless rule. */
    public static Rule of(String name) {
        return new Rule(name, null);
    }

    public static Rule of(String name, String param) {
        return new Rule(name, param);
    }

    public boolean hasParam() {
        return param != null;
    }

    public boolean is(String ruleName) {
        return name.equals(ruleName);
    }

    @Override
    public String toString() {
        return param != null ? name + "=" + param : name;
    }
}
