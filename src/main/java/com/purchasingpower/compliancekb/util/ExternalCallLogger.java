package com.purchasingpower.compliancekb.util;

import com.purchasingpower.compliancekb.model.CallContext;
import com.purchasingpower.compliancekb.model.ServiceType;
import org.slf4j.Logger;

/**
 * Entry point for structured logging of OpenAI, iTop and pgvector calls.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Shortens free text (questions, ticket bodies) before it goes into a log line.
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
