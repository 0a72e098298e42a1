package co.fanki.threatscore.suspect.domain;

import co.fanki.threatscore.shared.Preconditions;

import java.util.Locale;

/**
 * Discrete threat classification derived from a threat score.
 *
 * <p>Stored lowercase ({@code high}, {@code medium}, {@code low}) in the
 * {@code suspects.threat_level} column.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ThreatLevel {

    /**
     * Score of 70 or more.
     */
    HIGH,

    /**
     * Score between 40 and 69.
     */
    MEDIUM,

    /**
     * Score below 40.
     */
    LOW;

    /** Lowest score classified as {@link #HIGH}. */
    public static final int HIGH_THRESHOLD = 70;

    /** Lowest score classified as {@link #MEDIUM}. */
    public static final int MEDIUM_THRESHOLD = 40;

    /**
     * Maps a score to its level using the fixed thresholds.
     *
     * @param score the threat score, 0 to 100
     * @return the level for the score
     */
    public static ThreatLevel fromScore(final int score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Parses the persisted representation.
     *
     * @param value the column value, case insensitive
     * @return the level
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static ThreatLevel fromValue(final String value) {
        Preconditions.requireNonBlank(value, "Threat level value is required");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the persisted representation.
     *
     * @return the lowercase level name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

}
