package com.purchasingpower.infragraph.model.graph;

import com.google.common.base.Preconditions;

/**
 * Tier discriminator of a stored row: the tier plus the id of the change set or
 * edit session that owns it. Head rows all share the id {@value #HEAD_ID}.
 */
public record TierKey(Tier tier, String tierId) {

    public static final String HEAD_ID = "head";

    public static final TierKey HEAD = new TierKey(Tier.HEAD, HEAD_ID);

    public TierKey {
        Preconditions.checkNotNull(tier, "tier is required");
        Preconditions.checkArgument(tierId != null && !tierId.isBlank(), "tierId is required");
        Preconditions.checkArgument(tier != Tier.HEAD || HEAD_ID.equals(tierId),
                "Head tier id must be '%s'", HEAD_ID);
    }

    public static TierKey changeSet(String changeSetId) {
        return new TierKey(Tier.CHANGE_SET, changeSetId);
    }

    public static TierKey editSession(String editSessionId) {
        return new TierKey(Tier.EDIT_SESSION, editSessionId);
    }

    public boolean isHead() {
        return tier == Tier.HEAD;
    }

    /**
     * Stable textual form used in logs and change events, e.g. {@code change_set:42}.
     */
    public String discriminator() {
        return isHead() ? HEAD_ID : tier.name().toLowerCase() + ":" + tierId;
    }

    @Override
    public String toString() {
        return discriminator();
    }
}
