package com.signalengine.domain.enums;

public enum StrategyType {
    MACD_ZONE,
    TRINITY,
    MOMENTUM,
    STRUCTURE,
    CUSTOM
}
