package com.purchasingpower.infragraph.model.payload;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A system (environment) such as "production" that includes applications.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class SystemPayload extends EntityPayload {

    public static final String KIND = "system";

    private String environment;

    public SystemPayload(String name) {
        super(name);
    }

    @Override
    public String kindTag() {
        return KIND;
    }
}
