package io.reqbind.core.rule;

import io.reqbind.core.model.ValueKind;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * The rules every {@link Validator} starts with.
 *
 * <p>Structural rules ({@link #OMITEMPTY}, {@link #DIVE}) and group markers are interpreted by the
 * validator itself and have no {@link RuleCheck}.
 */
public final class BuiltinRules {

    public static final String OMITEMPTY = "omitempty";
    public static final String DIVE = "dive";
    public static final String REQUIRED = "required";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String LEN = "len";
    public static final String EQ = "eq";
    public static final String NE = "ne";
    public static final String GT = "gt";
    public static final String GTE = "gte";
    public static final String LT = "lt";
    public static final String LTE = "lte";
    public static final String IN = "in";
    public static final String ONEOF = "oneof";
    public static final String UNIQUE = "unique";
    public static final String EMAIL = "email";
    public static final String URL = "url";
    public static final String UUID = "uuid";
    public static final String ALPHA = "alpha";
    public static final String ALPHANUM = "alphanum";
    public static final String NUMERIC = "numeric";

    /** Rules whose parameter must be a number, checked when an endpoint is compiled. */
    public static final Set<String> NUMERIC_PARAM_RULES = Set.of(MIN, MAX, LEN, EQ, NE, GT, GTE, LT, LTE);

    /** Rules that need a parameter. */
    public static final Set<String> PARAM_RULES = Set.of(MIN, MAX, LEN, EQ, NE, GT, GTE, LT, LTE, IN, ONEOF);

    /** Rules that only make sense on collections. */
    public static final Set<String> COLLECTION_RULES = Set.of(UNIQUE, DIVE);

    /** Group markers a validator knows unless configured otherwise. */
    public static final Set<String> DEFAULT_GROUPS = Set.of("create", "update");

    // Dot-atom local part, dot-separated DNS labels, a TLD of at least two letters.
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(?:\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
                    + "@(?:[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\.)+[A-Za-z]{2,}$");
    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern ALPHA_PATTERN = Pattern.compile("^[A-Za-z]+$");
    private static final Pattern ALPHANUM_PATTERN = Pattern.compile("^[A-Za-z0-9]+$");
    private static final Pattern NUMERIC_PATTERN = Pattern.compile("^[-+]?[0-9]+(?:\\.[0-9]+)?$");

    private BuiltinRules() {
        // utility class
    }

    /** Name-to-check table of the built-in rules, in a stable order. */
    static Map<String, RuleCheck> checks() {
        Map<String, RuleCheck> checks = new LinkedHashMap<>();
        checks.put(REQUIRED, (value, kind, param) -> !kind.isZero(value));
        checks.put(MIN, bound(cmp -> cmp >= 0));
        checks.put(MAX, bound(cmp -> cmp <= 0));
        checks.put(LEN, bound(cmp -> cmp == 0));
        checks.put(EQ, bound(cmp -> cmp == 0));
        checks.put(NE, bound(cmp -> cmp != 0));
        checks.put(GT, bound(cmp -> cmp > 0));
        checks.put(GTE, bound(cmp -> cmp >= 0));
        checks.put(LT, bound(cmp -> cmp < 0));
        checks.put(LTE, bound(cmp -> cmp <= 0));
        checks.put(IN, (value, kind, param) -> Arrays.asList(param.split(",", -1))
                .contains(kind.render(value)));
        checks.put(ONEOF, (value, kind, param) -> Arrays.asList(param.trim().split("\\s+"))
                .contains(kind.render(value)));
        checks.put(UNIQUE, BuiltinRules::unique);
        checks.put(EMAIL, matches(EMAIL_PATTERN));
        checks.put(URL, (value, kind, param) -> isUrl(kind.render(value)));
        checks.put(UUID, matches(UUID_PATTERN));
        checks.put(ALPHA, matches(ALPHA_PATTERN));
        checks.put(ALPHANUM, matches(ALPHANUM_PATTERN));
        checks.put(NUMERIC, matches(NUMERIC_PATTERN));
        return checks;
    }

    /** Compares the value's measure with the numeric parameter. */
    private static RuleCheck bound(IntPredicate accept) {
        return (value, kind, param) -> accept.test(kind.measure(value).compareTo(new BigDecimal(param.trim())));
    }

    private static RuleCheck matches(Pattern pattern) {
        return (value, kind, param) -> pattern.matcher(kind.render(value)).matches();
    }

    private static boolean unique(Object value, ValueKind kind, String param) {
        if (!kind.isCollection()) {
            return true;
        }
        List<?> elements = (List<?>) value;
        Set<String> seen = new HashSet<>();
        for (Object element : elements) {
            if (!seen.add(kind.elementKind().render(element))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isUrl(String text) {
        try {
            URI uri = new URI(text);
            return uri.isAbsolute() && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
