package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body: {@code {"error": "NOT_FOUND", "detail": "..."}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private ErrorCode error;
    private String detail;
}
