package com.purchasingpower.ragstore.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipRequest {

    @NotBlank
    private String sourceDocId;

    @NotBlank
    private String targetDocId;

    @NotBlank
    private String relType;

    private String reason;
}
