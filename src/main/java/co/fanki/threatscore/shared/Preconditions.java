package co.fanki.threatscore.shared;

/**
 * Argument validation helpers shared by the suspect and scoring packages.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a number is positive.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is not positive
     */
    public static int requirePositive(final int value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a number is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that an int lies within a closed range.
     *
     * @param value the number to check
     * @param min the lowest accepted value
     * @param max the highest accepted value
     * @param message the exception message if out of range
     * @return the number
     * @throws IllegalArgumentException if value is outside [min, max]
     */
    public static int requireBetween(final int value, final int min,
            final int max, final String message) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a double is finite and lies within a closed range.
     *
     * <p>NaN never passes.</p>
     *
     * @param value the number to check
     * @param min the lowest accepted value
     * @param max the highest accepted value
     * @param message the exception message if out of range
     * @return the number
     * @throws IllegalArgumentException if value is NaN or outside [min, max]
     */
    public static double requireBetween(final double value, final double min,
            final double max, final String message) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
