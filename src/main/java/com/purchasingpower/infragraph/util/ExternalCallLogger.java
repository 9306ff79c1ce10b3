package com.purchasingpower.infragraph.util;

import com.purchasingpower.infragraph.model.CallContext;
import com.purchasingpower.infragraph.model.ServiceType;
import org.slf4j.Logger;

import java.util.Collection;

/**
 * Unified logging utility for store transactions and notifier deliveries.
 * Provides consistent, structured request/response logging.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (payload JSON can be big)
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

    /**
     * Format a collection for logging
     */
    public static String formatCollection(Collection<?> items) {
        if (items == null || items.isEmpty()) {
            return "[]";
        }
        if (items.size() <= 5) {
            return items.toString();
        }
        return "[" + items.size() + " items]";
    }
}
