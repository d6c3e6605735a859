package com.bastion.normalization;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Type-checked view over one loosely-typed vendor record.
 *
 * Every accessor takes the known spellings of a field in priority order and
 * resolves them independently of the other fields, so a single record may mix
 * PascalCase, camelCase and snake_case keys.
 */
final class RawRecord {

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final Map<String, Object> fields;

    RawRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * First alias whose value is a non-empty string.
     */
    String text(String... aliases) {
        for (String alias : aliases) {
            Object value = fields.get(alias);
            if (value instanceof String && !((String) value).isEmpty()) {
                return (String) value;
            }
        }
        return null;
    }

    /**
     * First alias whose value is present and not an empty string, untyped.
     */
    Object value(String... aliases) {
        for (String alias : aliases) {
            Object value = fields.get(alias);
            if (value == null) {
                continue;
            }
            if (value instanceof String && ((String) value).isEmpty()) {
                continue;
            }
            return value;
        }
        return null;
    }

    /**
     * First alias whose value coerces to an integral number.
     */
    Long number(String... aliases) {
        for (String alias : aliases) {
            Long number = toLong(fields.get(alias));
            if (number != null) {
                return number;
            }
        }
        return null;
    }

    /**
     * Primary match of a possibly multi-valued field.
     *
     * The first list alias holding a non-empty list decides the outcome: its
     * first element is used if it is a non-empty string, and no other alias is
     * consulted. Only when no list variant is present do the scalar aliases apply.
     */
    String primaryMatch(String[] listAliases, String... scalarAliases) {
        for (String alias : listAliases) {
            Object value = fields.get(alias);
            if (value instanceof List && !((List<?>) value).isEmpty()) {
                Object first = ((List<?>) value).get(0);
                return first instanceof String && !((String) first).isEmpty() ? (String) first : null;
            }
        }
        return text(scalarAliases);
    }

    /**
     * Coerce a number or numeric string to a long, truncating any fraction.
     *
     * @return the value, or null when it is absent or not numeric
     */
    static Long toLong(Object value) {
        if (value instanceof Number) {
            double asDouble = ((Number) value).doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return null;
            }
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            String trimmed = ((String) value).trim();
            if (!NUMERIC.matcher(trimmed).matches()) {
                return null;
            }
            return new BigDecimal(trimmed).longValue();
        }
        return null;
    }

    static boolean isNumericText(String value) {
        return value != null && NUMERIC.matcher(value.trim()).matches();
    }
}
