package com.vtb.refiner.models;

/**
 * Зрелость существующих мер защиты относительно угрозы
 */
public enum MitigationMaturity {
    /** Ни один контроль не покрывает категорию STRIDE */
    NONE,
    /** Покрыто только глобальным контролем */
    PARTIAL,
    /** Покрыто контролем, привязанным к компоненту */
    STRONG
}
