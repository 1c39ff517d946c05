package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.model.DocumentDraft;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * New chunk. Omit {@code embedding} to have the content embedded server-side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRequest {

    @NotNull
    private String content;

    private Map<String, MetadataValue> metadata;

    private List<Double> embedding;

    public DocumentDraft toDraft() {
        return DocumentDraft.builder()
            .content(content)
            .metadata(metadata != null ? metadata : Map.of())
            .embedding(embedding)
            .build();
    }
}
