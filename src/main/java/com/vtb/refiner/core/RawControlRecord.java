package com.vtb.refiner.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.StrideCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Запись о контроле до валидации. coverage и appliesTo принимают строку или список.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawControlRecord {

    @JsonAlias({"control", "control_name"})
    private String name;

    private String category;

    @JsonAlias({"stride", "covers", "stride_categories"})
    private Object coverage;

    @JsonAlias({"applies_to", "components", "scope"})
    private Object appliesTo;

    private String strength;

    /**
     * Обратное преобразование для контролей, уже собранных в коде (старый формат флагов)
     */
    public static RawControlRecord from(Control control) {
        List<String> coverage = new ArrayList<>();
        for (StrideCategory category : control.getCoverage()) {
            coverage.add(category.name());
        }
        return RawControlRecord.builder()
            .name(control.getName())
            .category(control.getCategory())
            .coverage(coverage)
            .appliesTo(new ArrayList<>(control.getAppliesTo()))
            .strength(control.getStrength().name())
            .build();
    }
}
