package tech.syncbridge.transform.function;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Implementations of the built-in functions.
 */
final class StringFunctions {

    private StringFunctions() {
    }

    static String normalizeEmail(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * 10 digits format as {@code (xxx) xxx-xxxx}, 11 digits with a leading 1 as
     * {@code +1 (xxx) xxx-xxxx}, anything else collapses to its digits.
     */
    static String normalizePhone(String value) {
        String digits = value.replaceAll("\\D", "");
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return "+1 (" + digits.substring(1, 4) + ") " + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        return digits;
    }

    static String snakeCase(String value) {
        return words(value).stream()
            .map(w -> w.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining("_"));
    }

    static String camelCase(String value) {
        List<String> words = words(value);
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i).toLowerCase(Locale.ROOT);
            if (i == 0) {
                result.append(word);
            } else {
                result.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return result.toString();
    }

    static String extractDomain(String value) {
        String trimmed = value.strip();
        int at = trimmed.lastIndexOf('@');
        if (at >= 0) {
            return trimmed.substring(at + 1).toLowerCase(Locale.ROOT);
        }
        String candidate = trimmed.contains("://") ? trimmed : "http://" + trimmed;
        try {
            String host = URI.create(candidate).getHost();
            if (host == null) {
                throw new FunctionException("No domain in '" + value + "'");
            }
            String domain = host.toLowerCase(Locale.ROOT);
            return domain.startsWith("www.") ? domain.substring(4) : domain;
        } catch (IllegalArgumentException e) {
            throw new FunctionException("No domain in '" + value + "'", e);
        }
    }

    static String firstName(String value) {
        String[] parts = value.strip().split("\\s+");
        return parts[0].isEmpty() ? null : parts[0];
    }

    static String lastName(String value) {
        String[] parts = value.strip().split("\\s+");
        return parts.length < 2 ? null : String.join(" ", List.of(parts).subList(1, parts.length));
    }

    static Object formatCurrency(Object value, Map<String, Object> args) {
        BigDecimal amount;
        try {
            amount = value instanceof BigDecimal d ? d : new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new FunctionException("Not an amount: '" + value + "'", e);
        }
        String symbol = String.valueOf(args.getOrDefault("symbol", "$"));
        int decimals = intArg(args, "decimals", 2);
        DecimalFormat format = new DecimalFormat("#,##0" + (decimals > 0 ? "." + "0".repeat(decimals) : ""),
            DecimalFormatSymbols.getInstance(Locale.US));
        String formatted = format.format(amount.abs().setScale(decimals, RoundingMode.HALF_UP));
        return (amount.signum() < 0 ? "-" : "") + symbol + formatted;
    }

    static Object truncate(Object value, Map<String, Object> args) {
        String text = value.toString();
        int length = intArg(args, "length", 255);
        String suffix = String.valueOf(args.getOrDefault("suffix", ""));
        if (text.length() <= length) {
            return text;
        }
        int keep = Math.max(0, length - suffix.length());
        return text.substring(0, keep) + suffix;
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static Object split(Object value, Map<String, Object> args) {
        String delimiter = String.valueOf(args.getOrDefault("delimiter", ","));
        List<Object> parts = new ArrayList<>();
        for (String part : value.toString().split(java.util.regex.Pattern.quote(delimiter))) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    static Object join(Object value, Map<String, Object> args) {
        String delimiter = String.valueOf(args.getOrDefault("delimiter", ", "));
        if (value instanceof Collection<?> items) {
            return items.stream()
                .filter(java.util.Objects::nonNull)
                .map(Object::toString)
                .collect(Collectors.joining(delimiter));
        }
        return value.toString();
    }

    private static int intArg(Map<String, Object> args, String name, int fallback) {
        Object raw = args.get(name);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(raw.toString());
        } catch (NumberFormatException e) {
            throw new FunctionException("Argument '" + name + "' must be a number", e);
        }
    }

    // Splits on separators and camelCase boundaries
    private static List<String> words(String value) {
        String spaced = value.strip()
            .replaceAll("([a-z0-9])([A-Z])", "$1 $2")
            .replaceAll("[^A-Za-z0-9]+", " ")
            .strip();
        List<String> words = new ArrayList<>();
        if (!spaced.isEmpty()) {
            words.addAll(List.of(spaced.split(" ")));
        }
        return words;
    }
}
