package com.vtb.refiner.models;

public enum Exploitability {
    LOW,
    MEDIUM,
    HIGH
}
