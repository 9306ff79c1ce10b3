package com.purchasingpower.infragraph.model.payload;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open extension map shared by all payloads.
 */
@ToString
@EqualsAndHashCode
public abstract class ExtensibleFields {

    private final Map<String, Object> extensions = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    @JsonAnySetter
    public void putExtension(String key, Object value) {
        extensions.put(key, value);
    }
}
