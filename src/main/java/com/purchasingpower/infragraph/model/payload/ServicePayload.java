package com.purchasingpower.infragraph.model.payload;

import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A deployable service belonging to an application.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ServicePayload extends EntityPayload {

    public static final String KIND = "service";

    private String implementation;

    @Min(value = 0, message = "Replica count cannot be negative")
    private Integer replicas;

    public ServicePayload(String name) {
        super(name);
    }

    @Override
    public String kindTag() {
        return KIND;
    }
}
