package org.broadinstitute.lincer.utils.codecs.gtf;

import org.broadinstitute.lincer.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value pairs of the ninth GTF column, e.g. {@code gene_id "XLOC_000001"; transcript_id "TCONS_00000001"; cov "5.2";}.
 * <p>
 * The text is split on {@code ;} outside double quotes. In each piece the first whitespace separated token is the key
 * and the rest is the value, with enclosing double quotes removed. Keys may come in any order; when a key is repeated
 * only its first value is kept. A missing trailing {@code ;} and unquoted values are accepted.
 * </p>
 */
public final class GtfAttributes {

    public static final char ATTRIBUTE_DELIMITER = ';';
    public static final char VALUE_QUOTE = '"';

    public static final GtfAttributes EMPTY = new GtfAttributes(Collections.emptyMap());

    private final Map<String, String> attributes;

    private GtfAttributes(final Map<String, String> attributes) {
        this.attributes = attributes;
    }

    /**
     * Parses the attribute column.
     *
     * @param text the attribute column; never {@code null}.
     * @throws IllegalArgumentException if a double quote is left open.
     */
    public static GtfAttributes parse(final String text) {
        Utils.nonNull(text, "attribute text");
        final Map<String, String> result = new LinkedHashMap<>();
        final StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == VALUE_QUOTE) {
                inQuotes = !inQuotes;
                current.append(c);
            } else if (c == ATTRIBUTE_DELIMITER && !inQuotes) {
                addPair(current.toString(), result);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (inQuotes) {
            throw new IllegalArgumentException("unbalanced quotes in attributes: " + text);
        }
        addPair(current.toString(), result);
        return new GtfAttributes(Collections.unmodifiableMap(result));
    }

    private static void addPair(final String pair, final Map<String, String> result) {
        final String trimmed = pair.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        int keyEnd = 0;
        while (keyEnd < trimmed.length() && !Character.isWhitespace(trimmed.charAt(keyEnd))) {
            keyEnd++;
        }
        final String key = trimmed.substring(0, keyEnd);
        result.putIfAbsent(key, unquote(trimmed.substring(keyEnd).trim()));
    }

    private static String unquote(final String value) {
        if (value.length() >= 2 && value.charAt(0) == VALUE_QUOTE && value.charAt(value.length() - 1) == VALUE_QUOTE) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    /**
     * @return the value of {@code key}, or {@code null} if the key is not present.
     */
    public String get(final String key) {
        return attributes.get(key);
    }

    public boolean contains(final String key) {
        return attributes.containsKey(key);
    }

    /**
     * @return all pairs, in the order of their first occurrence.
     */
    public Map<String, String> asMap() {
        return attributes;
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
