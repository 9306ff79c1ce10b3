package com.purchasingpower.infragraph.model;

import com.purchasingpower.infragraph.exception.ErrorKind;
import org.slf4j.Logger;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * One bracketed unit of work against the store or the subscriber list.
 *
 * <p>Every line carries the same short call id, so the begin and outcome of a
 * transaction (or a delivery round) can be matched when several interleave.
 *
 * @see com.purchasingpower.infragraph.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final long startNanos;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startNanos = System.nanoTime();
        this.logger = logger;
    }

    /**
     * @param mode e.g. "read-only", "read-write" or the event type being delivered
     */
    public void begin(String mode) {
        logger.debug("{} {} → {} [{}] {}", service.getEmoji(), service.getName(), operation, callId, mode);
    }

    public void completed(String outcome) {
        logger.info("{} {} ← {} [{}] ({}ms) {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), outcome);
    }

    /**
     * Expected failures are logged at WARN without a stack trace.
     */
    public void rejected(ErrorKind kind, String reason) {
        logger.warn("{} {} ✖ {} [{}] ({}ms) {}: {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), kind, reason);
    }

    public void failed(String reason, Throwable cause) {
        logger.error("{} {} ✖ {} [{}] ({}ms) {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), reason, cause);
    }

    public String getCallId() {
        return callId;
    }

    public String getOperation() {
        return operation;
    }

    public long getElapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
