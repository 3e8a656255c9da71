package io.reqbind.core.rule;

import io.reqbind.core.model.Rule;
import io.reqbind.core.model.ValueKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * User-facing message templates keyed by rule name.
 *
 * <p>Bound rules have one template per value shape, keyed {@code <rule>.string}, {@code
 * <rule>.number} and {@code <rule>.collection}; the plain {@code <rule>} key is the fallback.
 * Rules without any template use {@link #DEFAULT_KEY}.
 *
 * <p>Placeholders:
 *
 * <ul>
 *   <li>{@code {param}}: the rule parameter as written.
 *   <li>{@code {values}}: the parameter split on {@code ,} and joined with {@code ", "}.
 *   <li>{@code {field}}: the logical field name.
 *   <li>{@code {rule}}: the rule name.
 *   <li>{@code {message}}: the inner message (only in the {@code dive} template).
 * </ul>
 *
 * <p>Immutable and thread-safe.
 */
public final class MessageCatalog {

    /** Template for rules without their own template. */
    public static final String DEFAULT_KEY = "default";

    private static final MessageCatalog DEFAULTS = new MessageCatalog(defaultTemplates());

    private final Map<String, String> templates;

    private MessageCatalog(Map<String, String> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /** The built-in catalogue. */
    public static MessageCatalog defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a catalogue with some templates replaced or added. Keys not mentioned keep their
     * built-in template.
     */
    public MessageCatalog withOverrides(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(templates);
        overrides.forEach((key, template) -> merged.put(
                Objects.requireNonNull(key, "template key must not be null"),
                Objects.requireNonNull(template, "template must not be null for key " + key)));
        return new MessageCatalog(merged);
    }

    /**
     * Renders the message for a failed rule.
     *
     * @param rule  the rule that failed
     * @param kind  the kind of the value it failed on
     * @param field the logical field name
     */
    public String render(Rule rule, ValueKind kind, String field) {
        String template = templates.get(rule.name() + "." + kind.category().name().toLowerCase(Locale.ROOT));
        if (template == null) {
            template = templates.get(rule.name());
        }
        if (template == null) {
            template = templates.get(DEFAULT_KEY);
        }
        String param = rule.param() != null ? rule.param() : "";
        return template.replace("{param}", param)
                .replace("{values}", param.replace(",", ", "))
                .replace("{field}", field)
                .replace("{rule}", rule.name());
    }

    /** Wraps the message of a failed element inside a {@code dive}. */
    public String renderElement(String innerMessage) {
        return templates.get(BuiltinRules.DIVE).replace("{message}", innerMessage);
    }

    /** The template for a key, or {@code null}. */
    public String template(String key) {
        return templates.get(key);
    }

    private static Map<String, String> defaultTemplates() {
        Map<String, String> t = new LinkedHashMap<>();
        t.put(BuiltinRules.REQUIRED, "This field is required");
        t.put("min.string", "Minimum {param} characters required");
        t.put("min.collection", "At least {param} items required");
        t.put("min.number", "Minimum value is {param}");
        t.put("max.string", "Maximum {param} characters allowed");
        t.put("max.collection", "Maximum {param} items allowed");
        t.put("max.number", "Maximum value is {param}");
        t.put(BuiltinRules.IN, "Must be one of: {values}");
        t.put(BuiltinRules.UNIQUE, "Contains duplicate values");
        t.put(BuiltinRules.DIVE, "Invalid element: {message}");
        t.put(BuiltinRules.EMAIL, "Invalid email format");
        t.put(DEFAULT_KEY, "Field validation for '{field}' failed on the '{rule}' tag");
        return t;
    }
}
