package com.purchasingpower.infragraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.transaction.annotation.Isolation;

@Data
public class TransactionProperties {

    /**
     * Isolation of every write transaction. Lifecycle transitions also
     * compare-and-set the status column, so READ_COMMITTED stays safe for
     * apply and save on stores without serializable support.
     */
    @NotNull
    private Isolation isolation = Isolation.SERIALIZABLE;

    /**
     * Seconds before a tier transaction is rolled back; 0 means no limit.
     */
    @Min(0)
    private int timeoutSeconds = 0;
}
