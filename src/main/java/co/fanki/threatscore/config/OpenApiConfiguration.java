package co.fanki.threatscore.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Threat Score Engine.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Threat Score Engine API")
                        .description("""
                                Threat Score Engine - ranks fraud suspects by how central they are
                                in the network linking them.

                                ## Scoring
                                - **Centrality** (up to 40 points): PageRank over calls, transactions
                                  and shared devices or IPs between suspects
                                - **Connections** (up to 25 points): 2 points per link
                                - **Fraud amount** (up to 25 points): 5 points per order of magnitude
                                - **High threat neighbor** (10 points)

                                Levels: high from 70, medium from 40, low below.

                                ## MCP Tools
                                - `recalculate_threat_scores` - Recalculate every suspect score
                                - `list_kingpins` - List the highest stored scores
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
