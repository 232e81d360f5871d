package work.lcod.orbital.std;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.OperatorRegistry;
import work.lcod.orbital.runtime.Values;

/**
 * {@code format/*}: display formatting. Locale-sensitive operators default to {@code en-US}.
 */
public final class FormatModule {
    private static final Locale DEFAULT_LOCALE = Locale.forLanguageTag("en-US");
    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB", "PB"};

    private FormatModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        new ModuleDefinition(registry, "format")
            .define("number", 1, 2, "string", "Grouped number; options {decimals, locale}", FormatModule::number)
            .define("currency", 2, 3, "string", "Amount in an ISO 4217 currency", FormatModule::currency)
            .define("percent", 1, 2, "string", "Ratio as a percentage with fixed decimals", FormatModule::percent)
            .define("bytes", 1, 1, "string", "Binary size such as 1.5 KB", a -> bytes(a.number(0)))
            .define("ordinal", 1, 1, "string", "1st, 2nd, 3rd, 4th", a -> ordinal(a.number(0)))
            .define("plural", 3, 3, "string", "Count followed by the singular or plural noun", FormatModule::plural)
            .define("list", 1, 2, "string", "Human list joined with and/or", a -> list(a.list(0), a.string(1, "and")))
            .define("phone", 1, 2, "string", "Phone number layout, US by default", a -> phone(a.string(0), a.string(1, "US")))
            .define("creditCard", 1, 1, "string", "Card number masked except the last four digits", a -> creditCard(a.string(0)));
        return registry;
    }

    private static Locale locale(Object tag) {
        return tag == null ? DEFAULT_LOCALE : Locale.forLanguageTag(Values.stringify(tag));
    }

    private static Object number(Args a) {
        var options = a.map(1);
        var format = NumberFormat.getNumberInstance(locale(options.get("locale")));
        if (options.get("decimals") != null) {
            int decimals = (int) Values.toNumber(options.get("decimals"));
            format.setMinimumFractionDigits(decimals);
            format.setMaximumFractionDigits(decimals);
        }
        return format.format(a.number(0));
    }

    private static Object currency(Args a) {
        var format = NumberFormat.getCurrencyInstance(locale(a.get(2)));
        try {
            format.setCurrency(Currency.getInstance(a.string(1).toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            throw ExpressionException.invalidArgument(a.operator(), 2, "unknown currency " + a.string(1));
        }
        return format.format(a.number(0));
    }

    private static Object percent(Args a) {
        var format = NumberFormat.getPercentInstance(DEFAULT_LOCALE);
        int decimals = a.integer(1, 0);
        format.setMinimumFractionDigits(decimals);
        format.setMaximumFractionDigits(decimals);
        return format.format(a.number(0));
    }

    static String bytes(double bytes) {
        if (bytes <= 0) {
            return Values.formatNumber(bytes) + " B";
        }
        int unit = Math.min(BYTE_UNITS.length - 1, (int) Math.floor(Math.log(bytes) / Math.log(1024)));
        if (unit <= 0) {
            return Values.formatNumber(bytes) + " B";
        }
        double value = bytes / Math.pow(1024, unit);
        String formatted;
        if (value >= 10) {
            formatted = Values.formatNumber(Math.round(value));
        } else if (value == Math.rint(value)) {
            formatted = Values.formatNumber(value);
        } else {
            formatted = String.format(Locale.ROOT, "%.1f", value);
        }
        return formatted + " " + BYTE_UNITS[unit];
    }

    static String ordinal(double n) {
        long abs = Math.abs((long) n);
        long lastTwo = abs % 100;
        long last = abs % 10;
        String suffix;
        if (lastTwo >= 11 && lastTwo <= 13) {
            suffix = "th";
        } else if (last == 1) {
            suffix = "st";
        } else if (last == 2) {
            suffix = "nd";
        } else if (last == 3) {
            suffix = "rd";
        } else {
            suffix = "th";
        }
        return Values.formatNumber(n) + suffix;
    }

    private static Object plural(Args a) {
        double n = a.number(0);
        return Values.formatNumber(n) + " " + (Math.abs(n) == 1 ? a.string(1) : a.string(2));
    }

    static String list(List<Object> items, String conjunction) {
        var parts = new ArrayList<String>(items.size());
        for (var item : items) {
            parts.add(item == null ? "" : Values.stringify(item));
        }
        return switch (parts.size()) {
            case 0 -> "";
            case 1 -> parts.get(0);
            case 2 -> parts.get(0) + " " + conjunction + " " + parts.get(1);
            default -> String.join(", ", parts.subList(0, parts.size() - 1)) + ", " + conjunction + " " + parts.get(parts.size() - 1);
        };
    }

    static String phone(String value, String region) {
        var digits = value.replaceAll("\\D", "");
        boolean us = "US".equals(region);
        if (us && digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (us && digits.length() == 11 && digits.charAt(0) == '1') {
            return "+1 (" + digits.substring(1, 4) + ") " + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        if (digits.length() >= 10) {
            return digits.substring(0, 3) + "-" + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        return value;
    }

    static String creditCard(String value) {
        var digits = value.replaceAll("\\D", "");
        if (digits.length() < 4) {
            return value;
        }
        var combined = "•".repeat(digits.length() - 4) + digits.substring(digits.length() - 4);
        var groups = new ArrayList<String>();
        for (int i = 0; i < combined.length(); i += 4) {
            groups.add(combined.substring(i, Math.min(combined.length(), i + 4)));
        }
        return String.join(" ", groups);
    }
}
