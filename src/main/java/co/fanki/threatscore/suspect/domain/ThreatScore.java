package co.fanki.threatscore.suspect.domain;

import co.fanki.threatscore.shared.Preconditions;
import co.fanki.threatscore.shared.ValueObject;

/**
 * Value object holding a bounded threat score and the level it maps to.
 *
 * <p>The level is always derived from the value, so a score of 70 can
 * never be labelled medium.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ThreatScore implements ValueObject, Comparable<ThreatScore> {

    private static final long serialVersionUID = 1L;

    /** Lowest valid score. */
    public static final int MIN = 0;

    /** Highest valid score. */
    public static final int MAX = 100;

    private final int value;

    private final ThreatLevel level;

    private ThreatScore(final int theValue) {
        this.value = Preconditions.requireBetween(theValue, MIN, MAX,
                "Threat score must be between 0 and 100: " + theValue);
        this.level = ThreatLevel.fromScore(theValue);
    }

    /**
     * Creates a threat score.
     *
     * @param value the score, 0 to 100
     * @return the threat score
     * @throws IllegalArgumentException if value is out of range
     */
    public static ThreatScore of(final int value) {
        return new ThreatScore(value);
    }

    /**
     * Creates a threat score clamping the given value into range.
     *
     * @param value any integer score
     * @return the clamped threat score
     */
    public static ThreatScore clamped(final long value) {
        return new ThreatScore((int) Math.min(Math.max(value, MIN), MAX));
    }

    public int value() {
        return value;
    }

    public ThreatLevel level() {
        return level;
    }

    @Override
    public int compareTo(final ThreatScore other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ThreatScore that = (ThreatScore) obj;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return value + " (" + level.value() + ")";
    }

}
