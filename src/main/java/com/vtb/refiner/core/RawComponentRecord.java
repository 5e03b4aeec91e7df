package com.vtb.refiner.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Запись инвентаря компонентов до валидации
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawComponentRecord {

    @JsonAlias({"canonical_name", "name"})
    private String canonicalName;

    @JsonAlias({"component_type", "kind"})
    private String type;

    private String description;

    @JsonAlias({"data_classification", "classification"})
    private String dataClassification;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }
}
