package com.signalengine.api.controller;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.api.dto.request.EvaluateRequest;
import com.signalengine.domain.model.Instrument;
import com.signalengine.exception.ResourceNotFoundException;
import com.signalengine.pipeline.PipelineExecutor;
import com.signalengine.pipeline.RunSummary;
import com.signalengine.policy.ConfigRegistry;
import com.signalengine.repository.redis.SignalRedisRepository;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for aggregated signals.
 *
 * <ul>
 *   <li>GET /api/signals -- latest signal of every instrument</li>
 *   <li>GET /api/signals/{venue}/{ticker} -- latest signal of one instrument</li>
 *   <li>POST /api/signals/evaluate -- run the pipeline for one instrument now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/signals")
public class SignalController {

    private static final Logger log = LoggerFactory.getLogger(SignalController.class);

    private final SignalRedisRepository signalRedisRepository;
    private final ConfigRegistry configRegistry;
    private final PipelineExecutor pipelineExecutor;

    public SignalController(
            SignalRedisRepository signalRedisRepository,
            ConfigRegistry configRegistry,
            PipelineExecutor pipelineExecutor) {
        this.signalRedisRepository = signalRedisRepository;
        this.configRegistry = configRegistry;
        this.pipelineExecutor = pipelineExecutor;
    }

    @GetMapping
    public ResponseEntity<List<AggregatedSignal>> getAll() {
        return ResponseEntity.ok(signalRedisRepository.findAll());
    }

    @GetMapping("/{venue}/{ticker}")
    public ResponseEntity<AggregatedSignal> getLatest(@PathVariable String venue, @PathVariable String ticker) {
        Instrument instrument = resolve(venue, ticker);
        return signalRedisRepository.findByInstrument(instrument.key())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ResourceNotFoundException.signal(instrument.key()));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<RunSummary> evaluate(@Valid @RequestBody EvaluateRequest request) {
        Instrument instrument = resolve(request.getVenue(), request.getTicker());
        log.info("On-demand {} evaluation of {}", request.getMode(), instrument.key());
        return ResponseEntity.ok(pipelineExecutor.run(instrument, request.getMode()));
    }

    private Instrument resolve(String venue, String ticker) {
        return configRegistry.findInstrument(venue, ticker)
                .orElseThrow(() -> ResourceNotFoundException.instrument(venue, ticker));
    }
}
