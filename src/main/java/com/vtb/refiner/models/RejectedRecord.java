package com.vtb.refiner.models;

import lombok.Builder;
import lombok.Value;

/**
 * Входная запись, исключённая из прогона при валидации
 */
@Value
@Builder
public class RejectedRecord {
    public enum Kind { THREAT, COMPONENT, CONTROL }

    Kind kind;
    /** id записи или позиция в пакете, если id нет */
    String reference;
    String reason;
}
