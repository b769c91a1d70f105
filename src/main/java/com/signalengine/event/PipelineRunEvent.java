package com.signalengine.event;

import com.signalengine.pipeline.RunSummary;
import org.springframework.context.ApplicationEvent;

/** Published once per finished pipeline run or batch, carrying its summary. */
public class PipelineRunEvent extends ApplicationEvent {

    private final RunSummary summary;

    public PipelineRunEvent(Object source, RunSummary summary) {
        super(source);
        this.summary = summary;
    }

    public RunSummary getSummary() {
        return summary;
    }
}
