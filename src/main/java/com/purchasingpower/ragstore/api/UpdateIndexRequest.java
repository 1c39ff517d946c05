package com.purchasingpower.ragstore.api;

import jakarta.validation.constraints.Null;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateIndexRequest {

    @Size(max = 500)
    private String description;

    /**
     * Accepted on the wire only to be refused; dimension is fixed at creation.
     */
    @Null(message = "is immutable")
    private Integer dimension;
}
