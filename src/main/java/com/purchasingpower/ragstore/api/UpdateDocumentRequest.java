package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.model.DocumentPatch;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial chunk update; absent fields keep their stored values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateDocumentRequest {

    private String content;
    private Map<String, MetadataValue> metadata;
    private List<Double> embedding;

    public DocumentPatch toPatch() {
        return DocumentPatch.builder()
            .content(content)
            .metadata(metadata)
            .embedding(embedding)
            .build();
    }
}
