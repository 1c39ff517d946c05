package com.purchasingpower.ragstore.model;

import lombok.Builder;
import lombok.Value;

/**
 * Mutable index fields. Name and dimension are fixed at creation.
 */
@Value
@Builder
public class IndexPatch {
    String description;
}
