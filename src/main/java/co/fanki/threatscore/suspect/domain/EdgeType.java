package co.fanki.threatscore.suspect.domain;

import co.fanki.threatscore.shared.Preconditions;

import java.util.Locale;

/**
 * Kind of relationship an edge records.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeType {

    /**
     * A phone call between the endpoints.
     */
    CALL,

    /**
     * A money transfer between the endpoints.
     */
    TRANSACTION,

    /**
     * Both endpoints used the same handset.
     */
    SHARED_DEVICE,

    /**
     * Both endpoints connected from the same IP address.
     */
    SHARED_IP;

    /**
     * Parses the persisted representation.
     *
     * @param value the column value, case insensitive
     * @return the edge type
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static EdgeType fromValue(final String value) {
        Preconditions.requireNonBlank(value, "Edge type value is required");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the persisted representation.
     *
     * @return the lowercase type name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

}
