package co.fanki.threatscore.suspect.domain;

import co.fanki.threatscore.shared.Preconditions;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A person under investigation, as read from the case store.
 *
 * <p>Instances are immutable snapshots. A scoring run reads every suspect
 * once and keeps that snapshot as the "prior" state: the threat level seen
 * here is the one assigned by the previous run, never a level being
 * computed in the current one. New scores are written back through
 * {@link SuspectRepository#updateThreatScore}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Suspect {

    private final String id;
    private final String name;
    private final String alias;
    private final String location;
    private final BigDecimal fraudAmount;
    private final Integer threatScore;
    private final ThreatLevel threatLevel;
    private final Instant lastActive;
    private final String notes;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Suspect(
            final String theId,
            final String theName,
            final String theAlias,
            final String theLocation,
            final BigDecimal theFraudAmount,
            final Integer theThreatScore,
            final ThreatLevel theThreatLevel,
            final Instant theLastActive,
            final String theNotes,
            final Instant theCreatedAt,
            final Instant theUpdatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Suspect ID is required");
        this.name = Preconditions.requireNonNull(theName,
                "Suspect name is required");
        this.alias = theAlias;
        this.location = theLocation;
        this.fraudAmount = theFraudAmount != null
                ? theFraudAmount : BigDecimal.ZERO;
        this.threatScore = theThreatScore;
        this.threatLevel = theThreatLevel;
        this.lastActive = theLastActive;
        this.notes = theNotes;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
    }

    /**
     * Creates a new, not yet scored suspect.
     *
     * @param name the suspect name
     * @param alias the known alias, may be null
     * @param location the last known location, may be null
     * @param fraudAmount the attributed fraud amount, null means zero
     * @return a new Suspect
     */
    public static Suspect create(final String name, final String alias,
            final String location, final BigDecimal fraudAmount) {
        Preconditions.requireNonBlank(name, "Suspect name is required");
        final Instant now = Instant.now();
        return new Suspect(UUID.randomUUID().toString(), name, alias,
                location, fraudAmount, null, null, null, null, now, now);
    }

    /**
     * Reconstitutes a suspect from persistence.
     *
     * <p>Imported rows may carry an empty name; it is kept as stored.</p>
     *
     * @param id the suspect ID
     * @param name the name, never null
     * @param alias the alias, may be null
     * @param location the location, may be null
     * @param fraudAmount the fraud amount, may be null
     * @param threatScore the stored score, null if never scored
     * @param threatLevel the stored level, null if never scored
     * @param lastActive when the suspect was last seen active, may be null
     * @param notes free text notes, may be null
     * @param createdAt when created
     * @param updatedAt when last updated
     * @return the reconstituted Suspect
     */
    public static Suspect reconstitute(
            final String id,
            final String name,
            final String alias,
            final String location,
            final BigDecimal fraudAmount,
            final Integer threatScore,
            final ThreatLevel threatLevel,
            final Instant lastActive,
            final String notes,
            final Instant createdAt,
            final Instant updatedAt) {
        return new Suspect(id, name, alias, location, fraudAmount,
                threatScore, threatLevel, lastActive, notes, createdAt,
                updatedAt);
    }

    /**
     * Checks whether the previous scoring run labelled this suspect high.
     *
     * @return true if the stored level is {@link ThreatLevel#HIGH}
     */
    public boolean isHighThreat() {
        return threatLevel == ThreatLevel.HIGH;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String alias() {
        return alias;
    }

    public String location() {
        return location;
    }

    /**
     * Returns the attributed fraud amount.
     *
     * @return the amount, zero when the store holds none
     */
    public BigDecimal fraudAmount() {
        return fraudAmount;
    }

    public Integer threatScore() {
        return threatScore;
    }

    public ThreatLevel threatLevel() {
        return threatLevel;
    }

    public Instant lastActive() {
        return lastActive;
    }

    public String notes() {
        return notes;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
