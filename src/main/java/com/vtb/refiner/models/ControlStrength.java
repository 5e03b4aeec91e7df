package com.vtb.refiner.models;

/**
 * FULL контроль может подавить угрозу, PARTIAL только повышает зрелость защиты.
 */
public enum ControlStrength {
    FULL,
    PARTIAL
}
