package co.fanki.threatscore.scoring.application;

import co.fanki.threatscore.scoring.application.ThreatScoringService.ThreatScoringResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller triggering a threat score recalculation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/threat-scores")
@Tag(name = "Threat Scoring", description = "Recalculate suspect threat scores from the relationship graph")
public class ThreatScoringController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ThreatScoringController.class);

    private final ThreatScoringService threatScoringService;

    /**
     * Creates a new ThreatScoringController.
     *
     * @param theThreatScoringService the threat scoring service
     */
    public ThreatScoringController(
            final ThreatScoringService theThreatScoringService) {
        this.threatScoringService = theThreatScoringService;
    }

    /**
     * Recalculates the threat score of every suspect.
     *
     * @param iterations the centrality iteration override
     * @param dampingFactor the centrality damping override
     * @param topN the kingpin summary size override
     * @return the run result
     */
    @Operation(
            summary = "Recalculate threat scores",
            description = "Rebuilds the suspect graph, runs the centrality iteration, "
                    + "scores every suspect and writes the new scores and levels back. "
                    + "Returns the top kingpins of the run."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scores recalculated",
                    content = @Content(schema = @Schema(
                            implementation = ThreatScoringResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid override"),
            @ApiResponse(responseCode = "500", description = "Suspects or edges could not be read")
    })
    @PostMapping("/recalculate")
    public ResponseEntity<ThreatScoringResult> recalculate(
            @Parameter(description = "Centrality iterations (default 20)")
            @RequestParam(value = "iterations", required = false)
            final Integer iterations,
            @Parameter(description = "Damping factor between 0 and 1 (default 0.85)")
            @RequestParam(value = "dampingFactor", required = false)
            final Double dampingFactor,
            @Parameter(description = "Number of kingpins to return (default 5)")
            @RequestParam(value = "topN", required = false)
            final Integer topN) {

        LOG.info("Received threat score recalculation request");

        try {
            final ThreatScoringResult result = threatScoringService
                    .recalculate(iterations, dampingFactor, topN);

            if (!result.success()) {
                return ResponseEntity.internalServerError().body(result);
            }
            return ResponseEntity.ok(result);

        } catch (final IllegalArgumentException e) {
            LOG.warn("Rejected recalculation request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(ThreatScoringResult.failure(e.getMessage()));
        } catch (final Exception e) {
            LOG.error("Unexpected error during threat score recalculation", e);
            return ResponseEntity.internalServerError()
                    .body(ThreatScoringResult.failure(
                            "Internal error: " + e.getMessage()));
        }
    }

}
