package co.fanki.threatscore.suspect.domain;

import co.fanki.threatscore.shared.Preconditions;

import java.util.Locale;

/**
 * Type of an endpoint in a relationship edge.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EntityType {

    SUSPECT,

    SIM,

    DEVICE,

    ACCOUNT,

    IP;

    /**
     * Parses the persisted representation.
     *
     * @param value the column value, case insensitive
     * @return the entity type
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static EntityType fromValue(final String value) {
        Preconditions.requireNonBlank(value, "Entity type value is required");
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
