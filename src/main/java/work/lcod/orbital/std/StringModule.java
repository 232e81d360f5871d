package work.lcod.orbital.std;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.orbital.runtime.OperatorRegistry;
import work.lcod.orbital.runtime.Values;

/**
 * {@code str/*}: string helpers. Null inputs behave like the empty string.
 */
public final class StringModule {
    private static final Pattern TEMPLATE_KEY = Pattern.compile("\\{(\\w+)}");
    private static final Pattern WORD = Pattern.compile("\\w\\S*");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");

    private StringModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        new ModuleDefinition(registry, "str")
            .define("len", 1, 1, "number", "Length of the string", a -> (double) a.string(0).length())
            .define("upper", 1, 1, "string", "Upper case", a -> a.string(0).toUpperCase(Locale.ROOT))
            .define("lower", 1, 1, "string", "Lower case", a -> a.string(0).toLowerCase(Locale.ROOT))
            .define("trim", 1, 1, "string", "Strip surrounding whitespace", a -> a.string(0).strip())
            .define("trimStart", 1, 1, "string", "Strip leading whitespace", a -> a.string(0).stripLeading())
            .define("trimEnd", 1, 1, "string", "Strip trailing whitespace", a -> a.string(0).stripTrailing())
            .define("split", 2, 2, "array", "Split on a literal separator", a -> split(a.string(0), a.string(1)))
            .define("join", 1, 2, "string", "Join list items with a separator", a -> join(a.list(0), a.string(1, ",")))
            .define("slice", 2, 3, "string", "Substring with negative indexes counted from the end", StringModule::slice)
            .define("replace", 3, 3, "string", "Replace the first occurrence", a -> replaceFirst(a.string(0), a.string(1), a.string(2)))
            .define("replaceAll", 3, 3, "string", "Replace every occurrence", a -> replaceAll(a.string(0), a.string(1), a.string(2)))
            .define("includes", 2, 2, "boolean", "Whether the string contains the search", a -> a.string(0).contains(a.string(1)))
            .define("startsWith", 2, 2, "boolean", "Prefix test", a -> a.string(0).startsWith(a.string(1)))
            .define("endsWith", 2, 2, "boolean", "Suffix test", a -> a.string(0).endsWith(a.string(1)))
            .define("padStart", 2, 3, "string", "Pad on the left to a length",
                a -> pad(a.string(0), a.integer(1, 0), a.string(2, " "), true))
            .define("padEnd", 2, 3, "string", "Pad on the right to a length",
                a -> pad(a.string(0), a.integer(1, 0), a.string(2, " "), false))
            .define("repeat", 2, 2, "string", "Repeat n times", a -> a.string(0).repeat(Math.max(0, a.integer(1, 0))))
            .define("reverse", 1, 1, "string", "Reverse the characters", a -> new StringBuilder(a.string(0)).reverse().toString())
            .define("capitalize", 1, 1, "string", "Upper-case the first character", a -> capitalize(a.string(0)))
            .define("titleCase", 1, 1, "string", "Capitalize every word", a -> titleCase(a.string(0)))
            .define("camelCase", 1, 1, "string", "camelCase form", a -> camelCase(a.string(0)))
            .define("kebabCase", 1, 1, "string", "kebab-case form", a -> joinWords(a.string(0), "-"))
            .define("snakeCase", 1, 1, "string", "snake_case form", a -> joinWords(a.string(0), "_"))
            .define("default", 2, 2, "string", "Fallback when the value is null or empty", StringModule::defaultValue)
            .define("template", 1, 2, "string", "Replace {key} placeholders from a map", a -> template(a.string(0), a.map(1)))
            .define("concat", 0, VARIADIC, "string", "Concatenate the string forms of all arguments", StringModule::concat)
            .define("truncate", 2, 3, "string", "Cut to a length, ending with a suffix",
                a -> truncate(a.string(0), a.integer(1, 0), a.string(2, "...")));
        return registry;
    }

    static List<Object> split(String value, String separator) {
        var parts = new ArrayList<Object>();
        if (separator.isEmpty()) {
            value.codePoints().forEach(cp -> parts.add(new String(Character.toChars(cp))));
            return parts;
        }
        int from = 0;
        int index;
        while ((index = value.indexOf(separator, from)) >= 0) {
            parts.add(value.substring(from, index));
            from = index + separator.length();
        }
        parts.add(value.substring(from));
        return parts;
    }

    static String join(List<Object> items, String separator) {
        var out = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            var item = items.get(i);
            out.append(item == null ? "" : Values.stringify(item));
        }
        return out.toString();
    }

    private static Object slice(Args a) {
        var value = a.string(0);
        int length = value.length();
        int start = relativeIndex(a.integer(1, 0), length);
        int end = a.has(2) ? relativeIndex(a.integer(2, length), length) : length;
        return start >= end ? "" : value.substring(start, end);
    }

    static int relativeIndex(int index, int length) {
        if (index < 0) {
            return Math.max(0, length + index);
        }
        return Math.min(index, length);
    }

    static String replaceFirst(String value, String search, String replacement) {
        int index = value.indexOf(search);
        if (index < 0) {
            return value;
        }
        return value.substring(0, index) + replacement + value.substring(index + search.length());
    }

    static String replaceAll(String value, String search, String replacement) {
        if (search.isEmpty()) {
            return value;
        }
        return value.replace(search, replacement);
    }

    static String pad(String value, int length, String fill, boolean start) {
        if (value.length() >= length || fill.isEmpty()) {
            return value;
        }
        var padding = new StringBuilder();
        while (padding.length() < length - value.length()) {
            padding.append(fill);
        }
        padding.setLength(length - value.length());
        return start ? padding + value : value + padding;
    }

    static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    static String titleCase(String value) {
        Matcher matcher = WORD.matcher(value);
        var out = new StringBuilder();
        while (matcher.find()) {
            var word = matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(
                word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String camelCase(String value) {
        var words = words(value);
        var out = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            var word = words.get(i);
            out.append(i == 0 ? word.toLowerCase(Locale.ROOT) : capitalize(word));
        }
        return out.toString();
    }

    static String joinWords(String value, String separator) {
        var words = words(value);
        var out = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            out.append(words.get(i).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }

    // Words split on whitespace, '-', '_' and lower-to-upper case boundaries.
    static List<String> words(String value) {
        var spaced = CAMEL_BOUNDARY.matcher(value).replaceAll("$1 $2");
        var words = new ArrayList<String>();
        for (var part : spaced.split("[\\s_\\-]+")) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        return words;
    }

    private static Object defaultValue(Args a) {
        var value = a.get(0);
        if (value == null || "".equals(value)) {
            return a.get(1);
        }
        return value;
    }

    static String template(String template, Map<String, Object> vars) {
        Matcher matcher = TEMPLATE_KEY.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            var value = vars.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : Values.stringify(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Object concat(Args a) {
        var out = new StringBuilder();
        for (var value : a.all()) {
            if (value != null) {
                out.append(Values.stringify(value));
            }
        }
        return out.toString();
    }

    static String truncate(String value, int length, String suffix) {
        if (value.length() <= length) {
            return value;
        }
        int keep = Math.max(0, length - suffix.length());
        return value.substring(0, keep) + suffix;
    }
}
