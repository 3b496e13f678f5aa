package org.broadinstitute.lincer.utils;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Argument checks and small helpers shared across lincer.
 */
public final class Utils {

    private Utils() {}

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.LONG);

    /**
     * @return {@code nCopies} copies of {@code c}
     */
    public static String dupChar(final char c, final int nCopies) {
        final char[] chars = new char[nCopies];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    /**
     * @throws IllegalArgumentException if {@code object} is null
     */
    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * @param message the exception message, or the name of the checked value
     * @throws IllegalArgumentException if {@code object} is null
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is null or empty
     */
    public static <E, C extends Collection<E>> C nonEmpty(final C collection, final String message) {
        nonNull(collection, "The collection is null: " + message);
        if (collection.isEmpty()) {
            throw new IllegalArgumentException("The collection is empty: " + message);
        }
        return collection;
    }

    /**
     * @throws IllegalArgumentException if {@code string} is null or empty
     */
    public static String nonEmpty(final String string, final String message) {
        nonNull(string, "The string is null: " + message);
        if (string.isEmpty()) {
            throw new IllegalArgumentException("The string is empty: " + message);
        }
        return string;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is null or holds a null element
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        if (collection.stream().anyMatch(e -> e == null)) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * @return {@code index}
     * @throws IndexOutOfBoundsException unless {@code 0 <= index < length}
     */
    public static int validIndex(final int index, final int length) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " is out of bounds for length " + length);
        }
        return index;
    }

    public static void validateArg(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Like {@link #validateArg(boolean, String)}, building the message only on failure.
     */
    public static void validateArg(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalArgumentException(message.get());
        }
    }

    /**
     * @throws IllegalStateException if {@code condition} is false
     */
    public static void validate(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    public static <T> Stream<T> stream(final Iterable<T> iterable) {
        return StreamSupport.stream(iterable.spliterator(), false);
    }

    public static String getDateTimeForDisplay(final ZonedDateTime dateTime) {
        return dateTime.format(DISPLAY_FORMAT);
    }

    /**
     * Makes number formatting independent of the host locale.
     */
    public static void forceJVMLocaleToUSEnglish() {
        Locale.setDefault(Locale.US);
    }
}
