package co.fanki.threatscore.suspect.application;

import co.fanki.threatscore.shared.DomainException;
import co.fanki.threatscore.suspect.application.SuspectService.SuspectSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing stored suspect scores.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/suspects")
@Tag(name = "Suspects", description = "Read stored threat scores")
public class SuspectController {

    private static final Logger LOG = LoggerFactory.getLogger(
            SuspectController.class);

    private final SuspectService suspectService;

    /**
     * Creates a new SuspectController.
     *
     * @param theSuspectService the suspect service
     */
    public SuspectController(final SuspectService theSuspectService) {
        this.suspectService = theSuspectService;
    }

    /**
     * Lists the suspects with the highest stored threat score.
     *
     * @param limit how many suspects to return
     * @return the ranking, or 400 for an out of range limit
     */
    @Operation(summary = "List kingpins",
            description = "Suspects ranked by their last computed threat score")
    @GetMapping("/kingpins")
    public ResponseEntity<KingpinListResponse> listKingpins(
            @RequestParam(value = "limit", defaultValue = "10") final int limit) {

        LOG.debug("Listing kingpins, limit {}", limit);

        try {
            return ResponseEntity.ok(new KingpinListResponse(
                    suspectService.listKingpins(limit)));
        } catch (final IllegalArgumentException e) {
            LOG.debug("Rejected kingpin listing: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    /**
     * Returns one suspect with its stored score.
     *
     * @param suspectId the suspect ID
     * @return the suspect, or 404
     */
    @Operation(summary = "Get suspect score")
    @GetMapping("/{id}")
    public ResponseEntity<SuspectSummary> getSuspect(
            @PathVariable("id") final String suspectId) {
        try {
            return ResponseEntity.ok(suspectService.getById(suspectId));
        } catch (final DomainException e) {
            LOG.debug("Suspect lookup failed: {}", e.getMessage());
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Response containing a suspect ranking.
     */
    public record KingpinListResponse(
            List<SuspectSummary> kingpins
    ) {}

}
