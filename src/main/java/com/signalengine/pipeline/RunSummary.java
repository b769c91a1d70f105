package com.signalengine.pipeline;

import com.signalengine.domain.enums.PipelineMode;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a pipeline run over one or more instruments.
 *
 * <p>Partial success is explicit: {@code processed} counts instruments that ran (DONE or
 * FAILED), {@code failed} and {@code errors} the ones that failed, {@code skipped} the ones
 * never started (inactive, or the run was interrupted).
 */
@Value
@Builder
public class RunSummary {

    PipelineMode mode;

    int processed;

    /** Non-HOLD signals. */
    int signalsGenerated;

    int skipped;

    int failed;

    int emissionFailures;

    /** Instrument key → failure message. */
    Map<String, String> errors;

    List<InstrumentRunResult> results;

    Instant startedAt;

    Instant finishedAt;

    static RunSummary of(PipelineMode mode, List<InstrumentRunResult> results, Instant startedAt, Instant finishedAt) {
        int processed = 0;
        int signals = 0;
        int skipped = 0;
        int failed = 0;
        int emissionFailures = 0;
        Map<String, String> errors = new LinkedHashMap<>();

        for (InstrumentRunResult result : results) {
            if (result.isSkipped()) {
                skipped++;
                continue;
            }
            processed++;
            if (result.isFailed()) {
                failed++;
                errors.put(result.getInstrumentKey(), result.getError());
            }
            if (result.isSignalGenerated()) {
                signals++;
            }
            if (result.isEmissionFailed()) {
                emissionFailures++;
            }
        }

        return RunSummary.builder()
                .mode(mode)
                .processed(processed)
                .signalsGenerated(signals)
                .skipped(skipped)
                .failed(failed)
                .emissionFailures(emissionFailures)
                .errors(Collections.unmodifiableMap(errors))
                .results(List.copyOf(results))
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }
}
