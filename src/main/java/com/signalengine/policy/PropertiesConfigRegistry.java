package com.signalengine.policy;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.Market;
import com.signalengine.domain.model.Instrument;
import com.signalengine.exception.ConfigurationException;
import com.signalengine.timeseries.Timeframe;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ConfigRegistry} built once from {@code signalengine.*} properties.
 *
 * <p>Every venue, policy, threshold and instrument is validated in the constructor; the first
 * invalid entry throws {@link ConfigurationException} and the application context fails to
 * start. Nothing is defaulted silently except per-timeframe thresholds, which fall back to
 * {@code signalengine.default-thresholds} when an instrument does not override them.
 */
@Component
public class PropertiesConfigRegistry implements ConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(PropertiesConfigRegistry.class);

    private final Map<String, Set<Timeframe>> venueTimeframes;
    private final Map<String, StrategyPolicy> policies;
    private final Map<String, Instrument> instruments;
    private final Map<String, Map<Timeframe, ThresholdSet>> thresholds;

    public PropertiesConfigRegistry(SignalEngineProperties properties) {
        this.venueTimeframes = loadVenues(properties.getVenues());
        this.policies = loadPolicies(properties.getPolicies());
        Map<Timeframe, ThresholdSet> defaults = loadThresholds("default-thresholds", toThresholdEntries(
                properties.getDefaultThresholds()));

        Map<String, Instrument> loadedInstruments = new LinkedHashMap<>();
        Map<String, Map<Timeframe, ThresholdSet>> loadedThresholds = new LinkedHashMap<>();
        for (SignalEngineProperties.InstrumentEntry entry : properties.getInstruments()) {
            Instrument instrument = loadInstrument(entry);
            if (loadedInstruments.putIfAbsent(instrument.key(), instrument) != null) {
                throw new ConfigurationException("Duplicate instrument " + instrument.key());
            }
            Map<Timeframe, ThresholdSet> merged = new EnumMap<>(Timeframe.class);
            merged.putAll(defaults);
            merged.putAll(loadThresholds(instrument.key(), entry.getThresholds()));
            loadedThresholds.put(instrument.key(), Collections.unmodifiableMap(merged));
        }
        this.instruments = Collections.unmodifiableMap(loadedInstruments);
        this.thresholds = Collections.unmodifiableMap(loadedThresholds);

        log.info(
                "Config registry loaded: {} venues, {} policies, {} instruments",
                venueTimeframes.size(),
                policies.size(),
                instruments.size());
    }

    @Override
    public StrategyPolicy resolvePolicy(String policyId) {
        StrategyPolicy policy = policies.get(policyId);
        if (policy == null) {
            throw new ConfigurationException("Unknown strategy policy: " + policyId);
        }
        return policy;
    }

    @Override
    public Optional<ThresholdSet> resolveThresholds(Instrument instrument, Timeframe timeframe) {
        Map<Timeframe, ThresholdSet> byTimeframe = thresholds.get(instrument.key());
        return byTimeframe == null ? Optional.empty() : Optional.ofNullable(byTimeframe.get(timeframe));
    }

    @Override
    public Collection<Instrument> instruments() {
        return instruments.values();
    }

    @Override
    public Set<Timeframe> knownTimeframes(String venue) {
        Set<Timeframe> timeframes = venueTimeframes.get(normalize(venue));
        if (timeframes == null) {
            throw new ConfigurationException("Venue not configured: " + venue);
        }
        return timeframes;
    }

    @Override
    public Optional<Instrument> findInstrument(String venue, String ticker) {
        return Optional.ofNullable(instruments.get(normalize(venue) + ":" + normalize(ticker)));
    }

    public Collection<StrategyPolicy> policies() {
        return policies.values();
    }

    private Map<String, Set<Timeframe>> loadVenues(Map<String, SignalEngineProperties.Venue> venues) {
        Map<String, Set<Timeframe>> loaded = new LinkedHashMap<>();
        venues.forEach((code, venue) -> {
            String venueCode = normalize(code);
            Market.forVenue(venueCode);
            if (venue.getTimeframes().isEmpty()) {
                throw new ConfigurationException("Venue " + venueCode + " has no timeframes");
            }
            Set<Timeframe> timeframes = EnumSet.noneOf(Timeframe.class);
            for (String label : venue.getTimeframes()) {
                timeframes.add(parseTimeframe("venue " + venueCode, label));
            }
            loaded.put(venueCode, Collections.unmodifiableSet(timeframes));
        });
        return Collections.unmodifiableMap(loaded);
    }

    private Map<String, StrategyPolicy> loadPolicies(Map<String, SignalEngineProperties.Policy> definitions) {
        Map<String, StrategyPolicy> loaded = new LinkedHashMap<>();
        definitions.forEach((id, definition) -> {
            String context = "policy " + id;
            Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
            definition.getWeights().forEach((label, weight) -> weights.put(parseTimeframe(context, label), weight));

            StrategyPolicy policy = StrategyPolicy.builder()
                    .id(id)
                    .name(definition.getName())
                    .type(definition.getType())
                    .description(definition.getDescription())
                    .components(Set.copyOf(definition.getComponents()))
                    .weights(weights)
                    .consensusMinimum(definition.getConsensusMinimum())
                    .requireSynchronization(definition.isRequireSynchronization())
                    .syncTimeframes(parseTimeframes(context, definition.getSyncTimeframes()))
                    .parameters(definition.getParameters())
                    .build();
            loaded.put(id, policy);
            log.debug("Loaded {}", policy);
        });
        return Collections.unmodifiableMap(loaded);
    }

    private Instrument loadInstrument(SignalEngineProperties.InstrumentEntry entry) {
        if (entry.getTicker() == null || entry.getTicker().isBlank()) {
            throw new ConfigurationException("Instrument without ticker");
        }
        if (entry.getVenue() == null || entry.getVenue().isBlank()) {
            throw new ConfigurationException("Instrument " + entry.getTicker() + " has no venue");
        }
        Instrument instrument = new Instrument(entry.getTicker(), entry.getVenue(), entry.isActive(), entry.getPolicyId());
        Set<Timeframe> known = knownTimeframes(instrument.venue());

        if (entry.getPolicyId() == null) {
            throw new ConfigurationException("Instrument " + instrument.key() + " has no policy-id");
        }
        StrategyPolicy policy = resolvePolicy(entry.getPolicyId());
        // Re-validates the policy against this venue's timeframes
        policy.toBuilder().knownTimeframes(known).build();
        return instrument;
    }

    private Map<Timeframe, ThresholdSet> loadThresholds(
            String owner, Map<String, SignalEngineProperties.Threshold> entries) {
        Map<Timeframe, ThresholdSet> loaded = new EnumMap<>(Timeframe.class);
        entries.forEach((label, threshold) -> {
            Timeframe timeframe = parseTimeframe(owner, label);
            if (threshold == null || threshold.getFast() == null) {
                throw new ConfigurationException("Threshold " + label + " of " + owner + " has no fast value");
            }
            double fast = threshold.getFast();
            double signal = threshold.getSignal() != null ? threshold.getSignal() : fast;
            try {
                loaded.put(timeframe, new ThresholdSet(fast, signal));
            } catch (ConfigurationException e) {
                throw new ConfigurationException("Threshold " + label + " of " + owner + ": " + e.getMessage(), e);
            }
        });
        return loaded;
    }

    private static Map<String, SignalEngineProperties.Threshold> toThresholdEntries(Map<String, Double> values) {
        Map<String, SignalEngineProperties.Threshold> entries = new LinkedHashMap<>();
        values.forEach((label, value) -> {
            SignalEngineProperties.Threshold threshold = new SignalEngineProperties.Threshold();
            threshold.setFast(value);
            entries.put(label, threshold);
        });
        return entries;
    }

    private static Set<Timeframe> parseTimeframes(String context, List<String> labels) {
        return labels.stream().map(label -> parseTimeframe(context, label)).collect(Collectors.toSet());
    }

    private static Timeframe parseTimeframe(String context, String label) {
        try {
            return Timeframe.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown timeframe '" + label + "' in " + context, e);
        }
    }

    private static String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
