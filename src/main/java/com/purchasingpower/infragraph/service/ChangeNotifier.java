package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.event.ChangeEvent;

/**
 * Outbound notification boundary. Implementations must not deliver an event
 * before the transaction that produced it commits, and must drop it if that
 * transaction rolls back.
 */
public interface ChangeNotifier {

    void publish(ChangeEvent event);
}
