package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Selects the backing store ({@code app.store.backend}).
 */
@Data
public class StoreProperties {

    public enum Backend {
        NEO4J,
        MEMORY
    }

    @NotNull
    private Backend backend = Backend.NEO4J;
}
