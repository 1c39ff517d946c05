package com.purchasingpower.ragstore.util;

import com.purchasingpower.ragstore.model.CallContext;
import com.purchasingpower.ragstore.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging utility for external service calls (Neo4j, embedding endpoint).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
