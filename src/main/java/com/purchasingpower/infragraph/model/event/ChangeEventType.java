package com.purchasingpower.infragraph.model.event;

/**
 * What happened. Record events describe one row; lifecycle events describe a
 * change set or edit session transition.
 */
public enum ChangeEventType {
    RECORD_WRITTEN,
    RECORD_DELETED,
    CHANGE_SET_CREATED,
    CHANGE_SET_APPLIED,
    CHANGE_SET_ABANDONED,
    CHANGE_SET_WRITTEN,
    EDIT_SESSION_CREATED,
    EDIT_SESSION_SAVED,
    EDIT_SESSION_CANCELED;

    public boolean isRecordEvent() {
        return this == RECORD_WRITTEN || this == RECORD_DELETED;
    }
}
