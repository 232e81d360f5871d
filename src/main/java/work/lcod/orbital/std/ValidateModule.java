package work.lcod.orbital.std;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.runtime.OperatorRegistry;
import work.lcod.orbital.runtime.Values;

/**
 * {@code validate/*}: predicates over single values and {@code check}, which applies named rules
 * to the fields of an object.
 */
public final class ValidateModule {
    private static final Logger LOG = LoggerFactory.getLogger(ValidateModule.class);
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern UUID = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s\\-().]{10,}$");

    @FunctionalInterface
    interface Rule {
        boolean test(Object value, List<Object> params);
    }

    private static final Map<String, Rule> RULES = new LinkedHashMap<>();

    static {
        RULES.put("required", (v, p) -> required(v));
        RULES.put("string", (v, p) -> v instanceof String);
        RULES.put("number", (v, p) -> v instanceof Number n && !Double.isNaN(n.doubleValue()));
        RULES.put("boolean", (v, p) -> v instanceof Boolean);
        RULES.put("array", (v, p) -> v instanceof List<?>);
        RULES.put("object", (v, p) -> v instanceof Map<?, ?>);
        RULES.put("email", (v, p) -> v instanceof String s && EMAIL.matcher(s).matches());
        RULES.put("url", (v, p) -> v instanceof String s && url(s));
        RULES.put("uuid", (v, p) -> v instanceof String s && UUID.matcher(s).matches());
        RULES.put("phone", (v, p) -> v instanceof String s && phone(s));
        RULES.put("creditCard", (v, p) -> v instanceof String s && luhn(s));
        RULES.put("date", (v, p) -> date(v));
        RULES.put("minLength", (v, p) -> length(v) >= 0 && length(v) >= param(p, 0));
        RULES.put("maxLength", (v, p) -> length(v) >= 0 && length(v) <= param(p, 0));
        RULES.put("length", (v, p) -> length(v) >= 0 && length(v) == param(p, 0));
        RULES.put("min", (v, p) -> v instanceof Number n && n.doubleValue() >= param(p, 0));
        RULES.put("max", (v, p) -> v instanceof Number n && n.doubleValue() <= param(p, 0));
        RULES.put("range", (v, p) -> v instanceof Number n && n.doubleValue() >= param(p, 0) && n.doubleValue() <= param(p, 1));
        RULES.put("pattern", (v, p) -> v instanceof String s && pattern(s, p.isEmpty() ? null : p.get(0)));
        RULES.put("oneOf", (v, p) -> !p.isEmpty() && ArrayModule.indexOf(Values.toList(p.get(0)), v) >= 0);
        RULES.put("noneOf", (v, p) -> p.isEmpty() || ArrayModule.indexOf(Values.toList(p.get(0)), v) < 0);
        RULES.put("equals", (v, p) -> Values.deepEquals(v, p.isEmpty() ? null : p.get(0)));
    }

    private ValidateModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        var module = new ModuleDefinition(registry, "validate");
        RULES.forEach((name, rule) -> {
            int params = switch (name) {
                case "range" -> 2;
                case "minLength", "maxLength", "length", "min", "max", "pattern", "oneOf", "noneOf", "equals" -> 1;
                default -> 0;
            };
            module.define(name, 1 + params, 1 + params, "boolean", "Validates " + name,
                a -> rule.test(a.get(0), a.all().subList(1, a.size())));
        });
        module.define("check", 2, 2, "object", "Apply {field: [[rule, ...params]]} rules; returns {valid, errors}",
            a -> check(a.map(0), a.map(1)));
        return registry;
    }

    static Map<String, Object> check(Map<String, Object> value, Map<String, Object> rules) {
        var errors = new ArrayList<Object>();
        for (var field : rules.entrySet()) {
            var fieldValue = value.get(field.getKey());
            for (var raw : Values.toList(field.getValue())) {
                var rule = Values.toList(raw);
                if (rule.isEmpty() || rule.get(0) == null) {
                    continue;
                }
                var name = Values.stringify(rule.get(0));
                var predicate = RULES.get(name);
                if (predicate == null) {
                    LOG.debug("Unknown validation rule {} on field {}", name, field.getKey());
                    continue;
                }
                if (!predicate.test(fieldValue, rule.subList(1, rule.size()))) {
                    errors.add(field.getKey() + ": " + name + " validation failed");
                }
            }
        }
        var result = new LinkedHashMap<String, Object>();
        result.put("valid", errors.isEmpty());
        result.put("errors", errors);
        return result;
    }

    static boolean required(Object value) {
        return value != null && !"".equals(value);
    }

    private static double param(List<Object> params, int index) {
        return index < params.size() ? Values.toNumber(params.get(index)) : Double.NaN;
    }

    // -1 for values without a length.
    private static int length(Object value) {
        if (value instanceof String str) {
            return str.length();
        }
        if (value instanceof List<?> list) {
            return list.size();
        }
        return -1;
    }

    static boolean url(String value) {
        try {
            var uri = new URI(value);
            return uri.isAbsolute();
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    static boolean phone(String value) {
        return PHONE.matcher(value).matches() && value.replaceAll("\\D", "").length() >= 10;
    }

    static boolean luhn(String value) {
        var digits = value.replaceAll("\\D", "");
        if (digits.length() < 13 || digits.length() > 19) {
            return false;
        }
        int sum = 0;
        boolean doubled = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubled) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }

    static boolean date(Object value) {
        if (value instanceof Number number) {
            return !Double.isNaN(number.doubleValue());
        }
        if (value instanceof String str) {
            return TimeModule.parseInstant(str) != null;
        }
        return false;
    }

    private static boolean pattern(String value, Object regex) {
        if (regex == null) {
            return false;
        }
        try {
            return Pattern.compile(Values.stringify(regex)).matcher(value).find();
        } catch (PatternSyntaxException ex) {
            LOG.debug("Invalid validation pattern {}", regex, ex);
            return false;
        }
    }
}
