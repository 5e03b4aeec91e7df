package com.vtb.refiner.models;

import lombok.Builder;
import lombok.Value;

/**
 * Элемент инвентаря (DFD). Только для чтения на время прогона.
 */
@Value
@Builder
public class Component {
    String canonicalName;
    ComponentType type;
    String description;
    DataClassification dataClassification;
}
