package co.fanki.threatscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Threat Score Engine Application.
 *
 * <p>Scores suspects of fraud investigations by how central they are in
 * the network of calls, transactions and shared devices linking them,
 * combined with their attributed fraud amount. Runs are triggered over
 * REST, as an MCP tool, or on a schedule.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class ThreatScoreEngineApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ThreatScoreEngineApplication.class, args);
    }

}
