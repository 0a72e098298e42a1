package co.fanki.threatscore.scoring.application;

import co.fanki.threatscore.scoring.application.ThreatScoringService.ThreatScoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically recalculates every threat score.
 *
 * <p>Opt-in via {@code threat-scoring.schedule.enabled=true}. Disabled by
 * default, runs are otherwise triggered after data imports.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "threat-scoring.schedule.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class ThreatScoringScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            ThreatScoringScheduler.class);

    private final ThreatScoringService threatScoringService;

    /**
     * Creates a new ThreatScoringScheduler.
     *
     * @param theThreatScoringService the threat scoring service
     */
    public ThreatScoringScheduler(
            final ThreatScoringService theThreatScoringService) {
        this.threatScoringService = theThreatScoringService;
    }

    /**
     * Runs a recalculation with the configured parameters.
     */
    @Scheduled(cron = "${threat-scoring.schedule.cron:0 0 * * * *}")
    public void recalculateThreatScores() {
        LOG.info("Starting scheduled threat score recalculation");

        try {
            final ThreatScoringResult result =
                    threatScoringService.recalculate();

            if (result.success()) {
                LOG.info("Scheduled recalculation done: processed={},"
                                + " updated={}, failed={}",
                        result.processed(), result.updated(), result.failed());
            } else {
                LOG.warn("Scheduled recalculation failed: {}",
                        result.message());
            }
        } catch (final Exception e) {
            LOG.error("Unexpected error in scheduled recalculation: {}",
                    e.getMessage(), e);
        }
    }

}
