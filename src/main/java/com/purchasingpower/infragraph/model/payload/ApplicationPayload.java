package com.purchasingpower.infragraph.model.payload;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * An application: the root that systems and services are grouped under.
 */
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ApplicationPayload extends EntityPayload {

    public static final String KIND = "application";

    public ApplicationPayload(String name) {
        super(name);
    }

    @Override
    public String kindTag() {
        return KIND;
    }
}
