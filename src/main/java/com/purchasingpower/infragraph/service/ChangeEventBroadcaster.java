package com.purchasingpower.infragraph.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.infragraph.model.CallContext;
import com.purchasingpower.infragraph.model.ServiceType;
import com.purchasingpower.infragraph.model.event.ChangeEvent;
import com.purchasingpower.infragraph.storage.PayloadCodec;
import com.purchasingpower.infragraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers committed change events to in-process subscribers.
 *
 * Usage:
 * 1. A live view calls subscribe(workspaceId, subscriber) and keeps the Subscription
 * 2. Store and lifecycle services publish ChangeEvents through the ChangeNotifier
 * 3. After the surrounding transaction commits, every subscriber of the event's
 *    workspace receives it, in publication order
 * 4. The view closes the Subscription when it goes away
 *
 * A rolled back transaction delivers nothing. A subscriber that throws is logged
 * and skipped; the others still receive the event. Each subscriber gets its own
 * payload instance, decoded from the JSON captured when the row was written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeEventBroadcaster {

    private final PayloadCodec payloadCodec;

    /**
     * Map of workspaceId -> subscribers.
     */
    private final Map<String, List<ChangeSubscriber>> subscribers = new ConcurrentHashMap<>();

    public Subscription subscribe(String workspaceId, ChangeSubscriber subscriber) {
        Preconditions.checkArgument(workspaceId != null && !workspaceId.isBlank(), "workspaceId is required");
        Preconditions.checkNotNull(subscriber, "subscriber is required");

        subscribers.computeIfAbsent(workspaceId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        log.info("📡 Subscribed to changes in workspace {} ({} subscribers)",
                workspaceId, getSubscriberCount(workspaceId));
        return new Subscription(workspaceId, subscriber);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCommittedChange(ChangeEvent event) {
        List<ChangeSubscriber> targets = subscribers.get(event.getWorkspaceId());
        if (targets == null || targets.isEmpty()) {
            return;
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.SUBSCRIBERS, "deliver", log);
        ctx.begin(event.getEventType() + " " + event.getObjectId());
        int failures = 0;
        for (ChangeSubscriber subscriber : targets) {
            try {
                subscriber.onChange(copyFor(event));
            } catch (RuntimeException e) {
                failures++;
                ctx.failed("subscriber failed on " + event.getEventType() + " in workspace " + event.getWorkspaceId(), e);
            }
        }
        log.debug("📤 Delivered {} for {} to {} subscribers ({} failed) [{}]",
                event.getEventType(), event.getObjectId(), targets.size(), failures, ctx.getCallId());
    }

    private ChangeEvent copyFor(ChangeEvent event) {
        if (event.getPayloadJson() == null) {
            return event;
        }
        return event.withPayload(payloadCodec.decode(event.getObjectId(), event.getPayloadJson()));
    }

    private void unsubscribe(String workspaceId, ChangeSubscriber subscriber) {
        subscribers.computeIfPresent(workspaceId, (k, list) -> {
            list.remove(subscriber);
            return list.isEmpty() ? null : list;
        });
        log.debug("🗑️ Removed subscriber from workspace {}", workspaceId);
    }

    /**
     * Get count of subscribers for a workspace (for monitoring).
     */
    public int getSubscriberCount(String workspaceId) {
        List<ChangeSubscriber> list = subscribers.get(workspaceId);
        return list == null ? 0 : list.size();
    }

    /**
     * Handle returned by {@link #subscribe}; closing it stops delivery.
     */
    public final class Subscription implements AutoCloseable {

        private final String workspaceId;
        private final ChangeSubscriber subscriber;

        private Subscription(String workspaceId, ChangeSubscriber subscriber) {
            this.workspaceId = workspaceId;
            this.subscriber = subscriber;
        }

        @Override
        public void close() {
            unsubscribe(workspaceId, subscriber);
        }
    }
}
