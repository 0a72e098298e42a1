package co.fanki.threatscore.scoring.domain;

import co.fanki.threatscore.shared.Preconditions;
import co.fanki.threatscore.suspect.domain.ThreatLevel;
import co.fanki.threatscore.suspect.domain.ThreatScore;

/**
 * New threat score computed for one suspect, waiting to be written.
 *
 * @param suspectId the suspect ID
 * @param score the new score
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScoreUpdate(String suspectId, ThreatScore score) {

    /**
     * Validates the components.
     */
    public ScoreUpdate {
        Preconditions.requireNonBlank(suspectId, "Suspect ID is required");
        Preconditions.requireNonNull(score, "Score is required");
    }

    /** Returns the numeric score. */
    public int threatScore() {
        return score.value();
    }

    /** Returns the level derived from the score. */
    public ThreatLevel threatLevel() {
        return score.level();
    }

}
