package com.purchasingpower.infragraph.model;

/**
 * Where a logged call goes: the relational store holding every tier, or the
 * in-process subscribers of committed change events.
 */
public enum ServiceType {
    STORE("🟠", "Store"),
    SUBSCRIBERS("🔔", "Subscribers");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
