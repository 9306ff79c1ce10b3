package com.purchasingpower.infragraph.service;

import com.purchasingpower.infragraph.model.event.ChangeEvent;

/**
 * In-process listener for committed changes of one workspace.
 */
@FunctionalInterface
public interface ChangeSubscriber {

    void onChange(ChangeEvent event);
}
