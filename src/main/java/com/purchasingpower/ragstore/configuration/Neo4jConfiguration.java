package com.purchasingpower.ragstore.configuration;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Creates the process-wide Neo4j {@link Driver}.
 *
 * <p>The driver owns the connection pool; it is opened once at startup and
 * closed by the container at shutdown. Sessions are cheap and opened per
 * operation by the store.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jConfiguration {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(AppProperties props) {
        Neo4jProperties neo4j = props.getNeo4j();
        log.info("Initializing Neo4j driver at: {}", neo4j.getUri());

        Config config = Config.builder()
            .withMaxConnectionPoolSize(neo4j.getMaxConnectionPoolSize())
            .withConnectionAcquisitionTimeout(neo4j.getConnectionAcquisitionTimeoutMs(), TimeUnit.MILLISECONDS)
            .build();

        return GraphDatabase.driver(neo4j.getUri(),
            AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()), config);
    }
}
