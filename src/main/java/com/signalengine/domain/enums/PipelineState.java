package com.signalengine.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single-instrument pipeline run.
 *
 * <p>The happy path is strictly linear:
 * {@code FETCHING -> COMPUTING -> CLASSIFYING -> AGGREGATING -> EMITTING -> DONE}.
 * FAILED is reachable from every non-terminal state. DONE and FAILED are terminal.
 */
public enum PipelineState {
    FETCHING,
    COMPUTING,
    CLASSIFYING,
    AGGREGATING,
    EMITTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public Set<PipelineState> allowedTransitions() {
        return switch (this) {
            case FETCHING -> EnumSet.of(COMPUTING, FAILED);
            case COMPUTING -> EnumSet.of(CLASSIFYING, FAILED);
            case CLASSIFYING -> EnumSet.of(AGGREGATING, FAILED);
            case AGGREGATING -> EnumSet.of(EMITTING, FAILED);
            case EMITTING -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(PipelineState.class);
        };
    }

    public boolean canTransitionTo(PipelineState target) {
        return allowedTransitions().contains(target);
    }
}
