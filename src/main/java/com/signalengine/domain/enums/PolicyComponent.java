package com.signalengine.domain.enums;

/** Indicator components a strategy policy can enable. */
public enum PolicyComponent {
    FMACD,
    SMACD,
    BARS_MT,
    STRUCTURE_3M2,
    MOMENTUM
}
