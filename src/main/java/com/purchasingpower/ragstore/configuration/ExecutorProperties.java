package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExecutorProperties {

    @Min(1)
    private int storePoolSize = 8;

    @Min(0)
    private int storeQueueCapacity = 500;
}
