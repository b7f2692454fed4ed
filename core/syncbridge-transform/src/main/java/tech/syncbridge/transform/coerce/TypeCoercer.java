package tech.syncbridge.transform.coerce;

import tech.syncbridge.transform.mapping.DataType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts values to a {@link DataType}.
 *
 * <p>Dates and datetimes are emitted as ISO-8601 strings ({@code 2024-01-15},
 * {@code 2024-01-15T10:30:00Z}) so output records stay JSON friendly. Numbers
 * parsed from strings become {@link BigDecimal}; numbers that are already numeric
 * are kept as they are.</p>
 */
public final class TypeCoercer {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "n", "0", "off");
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern HAS_OFFSET = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    private TypeCoercer() {
    }

    /**
     * Coerce {@code value} to {@code type}. A null type returns the value unchanged.
     *
     * @throws TypeCoercionException if the value cannot be represented as the type
     */
    public static Object coerce(Object value, DataType type) {
        if (value == null || type == null) {
            return value;
        }
        return switch (type) {
            case STRING -> toStringValue(value);
            case NUMBER -> toNumber(value);
            case INTEGER -> toInteger(value);
            case BOOLEAN -> toBoolean(value);
            case DATE -> toDate(value);
            case DATETIME -> toDateTime(value);
            case LIST -> toList(value);
            case OBJECT -> toObject(value);
        };
    }

    private static String toStringValue(Object value) {
        if (value instanceof Map || value instanceof Collection) {
            throw new TypeCoercionException(DataType.STRING, value);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                throw new TypeCoercionException(DataType.NUMBER, value);
            }
        }
        throw new TypeCoercionException(DataType.NUMBER, value);
    }

    private static Long toInteger(Object value) {
        try {
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).longValueExact();
            }
            if (value instanceof String text) {
                return new BigDecimal(text.trim()).longValueExact();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new TypeCoercionException(DataType.INTEGER, value);
        }
        throw new TypeCoercionException(DataType.INTEGER, value);
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == 1d) return true;
            if (d == 0d) return false;
            throw new TypeCoercionException(DataType.BOOLEAN, value);
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(normalized)) return true;
            if (FALSE_VALUES.contains(normalized)) return false;
        }
        throw new TypeCoercionException(DataType.BOOLEAN, value);
    }

    private static String toDate(Object value) {
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue()).atOffset(ZoneOffset.UTC).toLocalDate().toString();
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            try {
                if (DATE_ONLY.matcher(trimmed).matches()) {
                    return LocalDate.parse(trimmed).toString();
                }
                return parseInstant(trimmed).atOffset(ZoneOffset.UTC).toLocalDate().toString();
            } catch (DateTimeParseException e) {
                throw new TypeCoercionException(DataType.DATE, value);
            }
        }
        throw new TypeCoercionException(DataType.DATE, value);
    }

    private static String toDateTime(Object value) {
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue()).toString();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            try {
                if (DATE_ONLY.matcher(trimmed).matches()) {
                    return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC).toString();
                }
                return parseInstant(trimmed).toString();
            } catch (DateTimeParseException e) {
                throw new TypeCoercionException(DataType.DATETIME, value);
            }
        }
        throw new TypeCoercionException(DataType.DATETIME, value);
    }

    private static List<Object> toList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        if (value instanceof Map) {
            throw new TypeCoercionException(DataType.LIST, value);
        }
        if (value instanceof String text) {
            List<Object> parts = new ArrayList<>();
            for (String part : text.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    parts.add(trimmed);
                }
            }
            return parts;
        }
        List<Object> single = new ArrayList<>();
        single.add(value);
        return single;
    }

    private static Map<?, ?> toObject(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new TypeCoercionException(DataType.OBJECT, value);
    }

    // Datetimes without an offset are read as UTC
    private static Instant parseInstant(String text) {
        if (HAS_OFFSET.matcher(text).find()) {
            return OffsetDateTime.parse(text).toInstant();
        }
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    }
}
