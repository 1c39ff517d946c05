package com.purchasingpower.ragstore.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.ragstore.document.BatchIngestResult;
import com.purchasingpower.ragstore.document.BatchItemResult;
import com.purchasingpower.ragstore.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch ingestion outcome. {@code error} is {@code PARTIAL_FAILURE} when at
 * least one item failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchDocumentResponse {

    private ErrorCode error;
    private long created;
    private long failed;

    @Builder.Default
    private List<Item> items = new ArrayList<>();

    public static BatchDocumentResponse from(BatchIngestResult result) {
        List<Item> items = new ArrayList<>();
        for (BatchItemResult item : result.getItems()) {
            items.add(Item.builder()
                .position(item.getPosition())
                .document(item.getDocument() != null ? DocumentResponse.from(item.getDocument()) : null)
                .error(item.getError())
                .detail(item.getDetail())
                .build());
        }
        long created = result.getCreatedCount();
        return BatchDocumentResponse.builder()
            .error(result.isFullSuccess() ? null : ErrorCode.PARTIAL_FAILURE)
            .created(created)
            .failed(items.size() - created)
            .items(items)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        private int position;
        private DocumentResponse document;
        private ErrorCode error;
        private String detail;
    }
}
