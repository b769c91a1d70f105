package com.signalengine.domain.enums;

public enum SignalType {
    BUY,
    SELL,
    HOLD
}
