package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Connection settings for the Neo4j system of record.
 *
 * <pre>
 * app:
 *   neo4j:
 *     uri: bolt://localhost:7687
 *     username: neo4j
 *     password: ${NEO4J_PASSWORD}
 *     database: neo4j
 * </pre>
 */
@Data
public class Neo4jProperties {

    @NotBlank
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "password";

    /**
     * Target database; blank uses the server default.
     */
    private String database = "neo4j";

    @Min(1)
    private int maxConnectionPoolSize = 50;

    @Min(1)
    private long connectionAcquisitionTimeoutMs = 60_000;
}
