package co.fanki.threatscore.config;

import co.fanki.threatscore.scoring.application.ThreatScoringService;
import co.fanki.threatscore.suspect.application.SuspectService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Exposes threat scoring as MCP tools over stdio.
 *
 * <p>When {@code mcp.server.stdio} is {@code true}, an MCP server speaking
 * JSON-RPC on stdin/stdout is started next to the REST endpoints.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final int DEFAULT_KINGPIN_LIMIT = 10;

    private static final String RECALCULATE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "iterations": {
                  "type": "integer",
                  "description": "Centrality iterations (defaults to 20)"
                },
                "dampingFactor": {
                  "type": "number",
                  "description": "Damping factor between 0 and 1 (defaults to 0.85)"
                },
                "topN": {
                  "type": "integer",
                  "description": "Number of kingpins to return (defaults to 5)"
                }
              }
            }
            """;

    private static final String LIST_KINGPINS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "limit": {
                  "type": "integer",
                  "description": "Number of suspects to return (defaults to 10)"
                }
              }
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates the MCP synchronous server with the scoring tools.
     *
     * @param transportProvider the stdio transport provider
     * @param threatScoringService the service running recalculations
     * @param suspectService the service reading stored rankings
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ThreatScoringService threatScoringService,
            final SuspectService suspectService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("threat-score-engine", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(recalculateThreatScoresTool(threatScoringService,
                objectMapper));
        server.addTool(listKingpinsTool(suspectService, objectMapper));

        LOG.info("MCP stdio server initialized with 2 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    McpServerFeatures.SyncToolSpecification recalculateThreatScoresTool(
            final ThreatScoringService threatScoringService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("recalculate_threat_scores",
                        "Recalculate the threat score and level of every"
                                + " suspect from the relationship graph and"
                                + " return the top kingpins. Run this after"
                                + " importing new suspects or edges.",
                        RECALCULATE_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final var result = threatScoringService.recalculate(
                                intArgument(arguments, "iterations"),
                                doubleArgument(arguments, "dampingFactor"),
                                intArgument(arguments, "topN"));
                        return toCallToolResult(objectMapper, result,
                                !result.success());
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    McpServerFeatures.SyncToolSpecification listKingpinsTool(
            final SuspectService suspectService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("list_kingpins",
                        "List the suspects with the highest stored threat"
                                + " score, as computed by the last"
                                + " recalculation.",
                        LIST_KINGPINS_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final Integer limit = intArgument(arguments, "limit");
                        final var result = suspectService.listKingpins(
                                limit != null ? limit : DEFAULT_KINGPIN_LIMIT);
                        return toCallToolResult(objectMapper, result, false);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private static Integer intArgument(final Map<String, Object> arguments,
            final String name) {
        return arguments != null && arguments.get(name) instanceof Number n
                ? n.intValue() : null;
    }

    private static Double doubleArgument(final Map<String, Object> arguments,
            final String name) {
        return arguments != null && arguments.get(name) instanceof Number n
                ? n.doubleValue() : null;
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result, final boolean isError) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), isError);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
