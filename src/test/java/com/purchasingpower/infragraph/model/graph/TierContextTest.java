package com.purchasingpower.infragraph.model.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Tier Context Tests")
class TierContextTest {

    @Test
    @DisplayName("Resolution order should run from edit session to Head")
    void resolutionOrder() {
        assertThat(TierContext.editSession("ws", "cs", "es").resolutionOrder())
                .containsExactly(TierKey.editSession("es"), TierKey.changeSet("cs"), TierKey.HEAD);
        assertThat(TierContext.changeSet("ws", "cs").resolutionOrder())
                .containsExactly(TierKey.changeSet("cs"), TierKey.HEAD);
        assertThat(TierContext.head("ws").resolutionOrder()).containsExactly(TierKey.HEAD);
        assertThat(TierContext.editSession("ws", "cs", "es").withoutEditSession())
                .isEqualTo(TierContext.changeSet("ws", "cs"));
    }

    @Test
    @DisplayName("Malformed contexts should be rejected")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> new TierContext("ws", null, "es"));
        assertThrows(IllegalArgumentException.class, () -> TierContext.head(" "));
        assertThrows(IllegalArgumentException.class, () -> new TierKey(Tier.HEAD, "cs-1"));
        assertThat(TierKey.changeSet("42").discriminator()).isEqualTo("change_set:42");
    }
}
