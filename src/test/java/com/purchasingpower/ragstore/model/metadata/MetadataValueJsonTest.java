package com.purchasingpower.ragstore.model.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Metadata variant JSON mapping")
class MetadataValueJsonTest {

    private static final TypeReference<LinkedHashMap<String, MetadataValue>> METADATA =
        new TypeReference<>() {
        };

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Nested metadata is written back exactly as received")
    void nestedMetadata_survivesRoundTrip() throws Exception {
        // Given
        String json = """
            {"source":"alpha","page":3,"score":0.25,"draft":false,"reviewer":null,
             "tags":["risk",{"level":2}],"owner":{"team":"core","ids":[1,2]}}
            """;

        // When
        Map<String, MetadataValue> metadata = objectMapper.readValue(json, METADATA);
        String written = objectMapper.writeValueAsString(metadata);

        // Then
        assertThat(objectMapper.readTree(written)).isEqualTo(objectMapper.readTree(json));
        assertThat(metadata.get("source").getKind()).isEqualTo(MetadataValue.Kind.STRING);
        assertThat(metadata.get("page").getKind()).isEqualTo(MetadataValue.Kind.NUMBER);
        assertThat(metadata.get("draft").getKind()).isEqualTo(MetadataValue.Kind.BOOLEAN);
        assertThat(metadata.get("reviewer").getKind()).isEqualTo(MetadataValue.Kind.NULL);
        assertThat(metadata.get("tags").getKind()).isEqualTo(MetadataValue.Kind.ARRAY);
        assertThat(metadata.get("owner").getKind()).isEqualTo(MetadataValue.Kind.OBJECT);
    }

    @Test
    @DisplayName("Integers stay integers after a round trip")
    void integralNumbers_keepTheirShape() throws Exception {
        Map<String, MetadataValue> metadata = Map.of("chunk_index", MetadataValue.of(7L));

        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(metadata));

        assertThat(node.get("chunk_index").isIntegralNumber()).isTrue();
        assertThat(node.get("chunk_index").longValue()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Searchable text covers scalar leaves but not object keys")
    void textOf_collectsScalarLeaves() {
        Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        metadata.put("source", MetadataValue.of("Quarterly Report"));
        metadata.put("year", MetadataValue.of(2024L));
        metadata.put("nested", MetadataValue.object(Map.of("secretKey", MetadataValue.of(true))));
        metadata.put("list", MetadataValue.array(List.of(MetadataValue.of("roadmap"))));

        String text = MetadataValue.textOf(metadata);

        assertThat(text).contains("Quarterly Report", "2024", "true", "roadmap");
        assertThat(text).doesNotContain("secretKey");
    }

    @Test
    @DisplayName("Equal trees compare equal")
    void equality_isStructural() {
        MetadataValue first = MetadataValue.object(Map.of("a", MetadataValue.array(List.of(MetadataValue.of("x")))));
        MetadataValue second = MetadataValue.object(Map.of("a", MetadataValue.array(List.of(MetadataValue.of("x")))));

        assertThat(first).isEqualTo(second);
        assertThat(MetadataValue.of((String) null)).isSameAs(MetadataValue.nullValue());
    }
}
