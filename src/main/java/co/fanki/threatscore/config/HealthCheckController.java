package co.fanki.threatscore.config;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness probes.
 *
 * <p>{@code /ready} only reports ready when the case store answers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthCheckController.class);

    private final Jdbi jdbi;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theJdbi the JDBI instance used to ping the database
     */
    public HealthCheckController(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return "ok"
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness probe endpoint.
     *
     * @return 200 with status "ready" when the database answers, 503
     *     otherwise
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = isDatabaseReachable();

        final Map<String, Object> status = Map.of(
                "status", databaseHealthy ? "ready" : "not_ready",
                "database", databaseHealthy ? "connected" : "disconnected");

        if (databaseHealthy) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

    private boolean isDatabaseReachable() {
        try {
            return jdbi.withHandle(handle -> handle
                    .createQuery("SELECT 1")
                    .mapTo(Integer.class)
                    .one()) == 1;
        } catch (final Exception e) {
            LOG.warn("Database readiness check failed: {}", e.getMessage());
            return false;
        }
    }

}
