package uk.gegc.billingrecon.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for webhook processing. Handlers fill it in as they parse, and
 * the MDC is only populated for the duration of a single log call.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String provider;
    private String eventId;
    private String eventType;
    private String reference;
    private String subscriptionCode;
    private UUID userId;

    public void setMDC() {
        if (provider != null) MDC.put("provider", provider);
        if (eventId != null) MDC.put("event_id", eventId);
        if (eventType != null) MDC.put("event_type", eventType);
        if (reference != null) MDC.put("reference", reference);
        if (subscriptionCode != null) MDC.put("subscription_code", subscriptionCode);
        if (userId != null) MDC.put("user_id", userId.toString());
    }

    public static void clearMDC() {
        MDC.remove("provider");
        MDC.remove("event_id");
        MDC.remove("event_type");
        MDC.remove("reference");
        MDC.remove("subscription_code");
        MDC.remove("user_id");
    }

    public String eventTypeOrUnknown() {
        return eventType != null && !eventType.isBlank() ? eventType : "unknown";
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Throwable throwable) {
        setMDC();
        try {
            logger.error(message, throwable);
        } finally {
            clearMDC();
        }
    }
}
