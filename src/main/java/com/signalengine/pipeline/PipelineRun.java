package com.signalengine.pipeline;

import com.signalengine.domain.enums.PipelineState;
import java.util.ArrayList;
import java.util.List;

/**
 * State tracker of one instrument's run. Starts in FETCHING and records every state visited.
 */
class PipelineRun {

    private final String instrumentKey;
    private final List<PipelineState> trail = new ArrayList<>();
    private PipelineState state;

    PipelineRun(String instrumentKey) {
        this.instrumentKey = instrumentKey;
        this.state = PipelineState.FETCHING;
        this.trail.add(state);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    void transitionTo(PipelineState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal pipeline transition " + state + " -> " + target + " for " + instrumentKey);
        }
        state = target;
        trail.add(target);
    }

    /** Moves to FAILED unless already terminal. */
    void fail() {
        if (!state.isTerminal()) {
            transitionTo(PipelineState.FAILED);
        }
    }

    PipelineState state() {
        return state;
    }

    List<PipelineState> trail() {
        return List.copyOf(trail);
    }
}
