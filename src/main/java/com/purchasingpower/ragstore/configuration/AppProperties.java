package com.purchasingpower.ragstore.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StoreProperties store = new StoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4jProperties neo4j = new Neo4jProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SearchProperties search = new SearchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IndexProperties index = new IndexProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExecutorProperties executor = new ExecutorProperties();
}
