package io.reqbind.core.engine;

import io.reqbind.core.coerce.ValueCoercer;
import io.reqbind.core.error.CoercionException;
import io.reqbind.core.error.EndpointConfigException;
import io.reqbind.core.model.FieldDescriptor;
import io.reqbind.core.model.FieldSpec;
import io.reqbind.core.model.RecordSchema;
import io.reqbind.core.model.Rule;
import io.reqbind.core.model.SourceKind;
import io.reqbind.core.model.ValueKind;
import io.reqbind.core.rule.BuiltinRules;
import io.reqbind.core.rule.Validator;
import io.reqbind.core.spec.EndpointDefinition;
import io.reqbind.core.spec.FieldDefinition;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns parsed endpoint definitions into {@link Endpoint}s and rejects every inconsistency that
 * would otherwise only show up per request.
 *
 * <p>Checks, in order, for each field:
 *
 * <ul>
 *   <li>the name exists in the {@link RecordSchema} and is declared once;
 *   <li>the source is known;
 *   <li>the rule DSL parses against the validator's vocabulary;
 *   <li>parameterized rules carry a parameter, bound parameters are numbers;
 *   <li>{@code dive} and {@code unique} appear only on collection kinds, bound rules never on
 *       {@code bool};
 *   <li>the default literal coerces to the field's kind.
 * </ul>
 *
 * Also checks that the group, when set, is a group the validator knows. Any violation raises
 * {@link EndpointConfigException}.
 */
public final class EndpointCompiler {

    private final RecordSchema schema;
    private final Validator validator;

    public EndpointCompiler(RecordSchema schema, Validator validator) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Compiles one definition.
     *
     * @throws EndpointConfigException if the definition is inconsistent
     */
    public Endpoint compile(EndpointDefinition definition) {
        String id = definition.id();
        String source = definition.source();

        if (definition.group() != null && !validator.isGroup(definition.group())) {
            throw new EndpointConfigException(
                    "Unknown validation group '" + definition.group() + "'; known groups are " + validator.groups(),
                    id,
                    source);
        }
        if (definition.successStatus() != 200 && definition.successStatus() != 201) {
            throw new EndpointConfigException(
                    "success-status must be 200 or 201, got " + definition.successStatus(), id, source);
        }

        List<FieldDescriptor> descriptors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (FieldDefinition field : definition.fields()) {
            if (!seen.add(field.name())) {
                throw new EndpointConfigException("Field '" + field.name() + "' is declared twice", id, source);
            }
            descriptors.add(compileField(field, id, source));
        }

        return new Endpoint(
                id,
                definition.method(),
                definition.path(),
                definition.group(),
                definition.successStatus(),
                descriptors,
                schema,
                source);
    }

    // --- Private helpers ---

    private FieldDescriptor compileField(FieldDefinition field, String id, String source) {
        String name = field.name();
        FieldSpec spec = schema.find(name)
                .orElseThrow(() -> new EndpointConfigException(
                        "Field '" + name + "' is not part of " + schema, id, source));

        SourceKind sourceKind;
        List<Rule> rules;
        try {
            sourceKind = SourceKind.fromName(field.source());
            rules = validator.parseRules(field.rules());
        } catch (IllegalArgumentException e) {
            throw new EndpointConfigException("Field '" + name + "': " + e.getMessage(), e, id, source);
        }

        checkRules(name, spec.kind(), rules, id, source);

        if (field.defaultValue() != null) {
            try {
                ValueCoercer.coerce(field.defaultValue(), spec.kind());
            } catch (CoercionException e) {
                throw new EndpointConfigException(
                        "Field '" + name + "': default '" + field.defaultValue() + "' " + e.getMessage(),
                        e,
                        id,
                        source);
            }
        }

        return new FieldDescriptor(name, sourceKind, field.required(), field.defaultValue(), rules);
    }

    private void checkRules(String field, ValueKind kind, List<Rule> rules, String id, String source) {
        ValueKind current = kind;
        for (Rule rule : rules) {
            String name = rule.name();
            if (BuiltinRules.PARAM_RULES.contains(name) && (!rule.hasParam() || rule.param().isBlank())) {
                throw new EndpointConfigException(
                        "Field '" + field + "': rule '" + name + "' requires a parameter", id, source);
            }
            if (BuiltinRules.NUMERIC_PARAM_RULES.contains(name)) {
                checkNumeric(field, rule, id, source);
                if (current == ValueKind.BOOLEAN) {
                    throw new EndpointConfigException(
                            "Field '" + field + "': rule '" + name + "' cannot apply to a bool value", id, source);
                }
            }
            if (BuiltinRules.COLLECTION_RULES.contains(name) && !current.isCollection()) {
                throw new EndpointConfigException(
                        "Field '" + field + "': rule '" + name + "' requires a list field, '" + field + "' is "
                                + current.typeName(),
                        id,
                        source);
            }
            if (BuiltinRules.DIVE.equals(name)) {
                current = current.elementKind();
            }
        }
    }

    private static void checkNumeric(String field, Rule rule, String id, String source) {
        try {
            new BigDecimal(rule.param().trim());
        } catch (NumberFormatException e) {
            throw new EndpointConfigException(
                    "Field '" + field + "': rule '" + rule.name() + "' needs a numeric parameter, got '"
                            + rule.param() + "'",
                    e,
                    id,
                    source);
        }
    }
}
