package com.purchasingpower.infragraph.service.impl;

import com.purchasingpower.infragraph.configuration.VersioningProperties;
import com.purchasingpower.infragraph.model.event.ChangeEvent;
import com.purchasingpower.infragraph.service.ChangeNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Hands change events to Spring's event bus. Delivery to subscribers is deferred to
 * after commit by {@link com.purchasingpower.infragraph.service.ChangeEventBroadcaster}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpringChangeNotifier implements ChangeNotifier {

    private final ApplicationEventPublisher eventPublisher;
    private final VersioningProperties properties;

    @Override
    public void publish(ChangeEvent event) {
        if (!properties.getNotifications().isEnabled()) {
            log.trace("Notifications disabled, dropping {}", event.getEventType());
            return;
        }
        log.debug("📦 Queued {} for {} at {}", event.getEventType(), event.getObjectId(), event.getTierKey());
        eventPublisher.publishEvent(event);
    }
}
