package com.signalengine.policy;

import com.signalengine.domain.enums.PolicyComponent;
import com.signalengine.domain.enums.StrategyType;
import com.signalengine.exception.ConfigurationException;
import com.signalengine.timeseries.Timeframe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolved aggregation policy: which timeframes count, how much, and how many must agree.
 *
 * <p>Instances are immutable and only created through {@link Builder#build()}, which rejects
 * any invalid combination with a {@link ConfigurationException}. To change a policy, build a
 * new one with {@link #toBuilder()}.
 */
public final class StrategyPolicy {

    private final String id;
    private final String name;
    private final StrategyType type;
    private final String description;
    private final Set<PolicyComponent> components;
    private final Map<Timeframe, Double> weights;
    private final int consensusMinimum;
    private final boolean requireSynchronization;
    private final Set<Timeframe> syncTimeframes;
    private final Map<String, String> parameters;

    private StrategyPolicy(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = builder.type;
        this.description = builder.description;
        this.components = Collections.unmodifiableSet(copyOf(builder.components, PolicyComponent.class));
        this.weights = Collections.unmodifiableMap(new EnumMap<>(builder.weights));
        this.consensusMinimum = builder.consensusMinimum;
        this.requireSynchronization = builder.requireSynchronization;
        this.syncTimeframes = Collections.unmodifiableSet(copyOf(builder.syncTimeframes, Timeframe.class));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .description(description)
                .components(components)
                .weights(weights)
                .consensusMinimum(consensusMinimum)
                .requireSynchronization(requireSynchronization)
                .syncTimeframes(syncTimeframes)
                .parameters(parameters);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public StrategyType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public Set<PolicyComponent> getComponents() {
        return components;
    }

    /** Timeframe → weight. Only these timeframes take part in aggregation. */
    public Map<Timeframe, Double> getWeights() {
        return weights;
    }

    public int getConsensusMinimum() {
        return consensusMinimum;
    }

    public boolean isRequireSynchronization() {
        return requireSynchronization;
    }

    public Set<Timeframe> getSyncTimeframes() {
        return syncTimeframes;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "StrategyPolicy[" + id + ", " + type + ", weights=" + weights + ", consensus=" + consensusMinimum
                + (requireSynchronization ? ", sync=" + syncTimeframes : "") + "]";
    }

    private static <E extends Enum<E>> EnumSet<E> copyOf(Set<E> source, Class<E> type) {
        return source.isEmpty() ? EnumSet.noneOf(type) : EnumSet.copyOf(source);
    }

    /**
     * Validating builder. {@link #knownTimeframes(Set)} defaults to every {@link Timeframe};
     * pass the venue's set to check the policy against that venue.
     */
    public static final class Builder {

        private String id;
        private String name;
        private StrategyType type = StrategyType.CUSTOM;
        private String description;
        private Set<PolicyComponent> components = EnumSet.noneOf(PolicyComponent.class);
        private Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
        private int consensusMinimum;
        private boolean requireSynchronization;
        private Set<Timeframe> syncTimeframes = EnumSet.noneOf(Timeframe.class);
        private Map<String, String> parameters = new LinkedHashMap<>();
        private Set<Timeframe> knownTimeframes = EnumSet.allOf(Timeframe.class);

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(StrategyType type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder components(Set<PolicyComponent> components) {
            this.components = EnumSet.noneOf(PolicyComponent.class);
            this.components.addAll(components);
            return this;
        }

        public Builder weights(Map<Timeframe, Double> weights) {
            this.weights = new EnumMap<>(Timeframe.class);
            this.weights.putAll(weights);
            return this;
        }

        public Builder weight(Timeframe timeframe, double weight) {
            this.weights.put(timeframe, weight);
            return this;
        }

        public Builder consensusMinimum(int consensusMinimum) {
            this.consensusMinimum = consensusMinimum;
            return this;
        }

        public Builder requireSynchronization(boolean requireSynchronization) {
            this.requireSynchronization = requireSynchronization;
            return this;
        }

        public Builder syncTimeframes(Set<Timeframe> syncTimeframes) {
            this.syncTimeframes = EnumSet.noneOf(Timeframe.class);
            this.syncTimeframes.addAll(syncTimeframes);
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = new LinkedHashMap<>(parameters);
            return this;
        }

        public Builder knownTimeframes(Set<Timeframe> knownTimeframes) {
            this.knownTimeframes = EnumSet.noneOf(Timeframe.class);
            this.knownTimeframes.addAll(knownTimeframes);
            return this;
        }

        /**
         * @throws ConfigurationException listing every violated rule
         */
        public StrategyPolicy build() {
            List<String> violations = new ArrayList<>();

            if (id == null || id.isBlank()) {
                violations.add("id must not be blank");
            }
            if (type == null) {
                violations.add("type must be set");
            }
            if (weights.isEmpty()) {
                violations.add("weights must not be empty");
            }
            weights.forEach((timeframe, weight) -> {
                if (weight == null || !Double.isFinite(weight) || weight <= 0) {
                    violations.add("weight of " + timeframe + " must be a finite number > 0, got " + weight);
                }
                if (!knownTimeframes.contains(timeframe)) {
                    violations.add("weight timeframe " + timeframe + " is not a known timeframe " + knownTimeframes);
                }
            });
            if (consensusMinimum < 0 || consensusMinimum > components.size()) {
                violations.add("consensusMinimum " + consensusMinimum + " must be between 0 and the "
                        + components.size() + " enabled components");
            }
            for (Timeframe timeframe : syncTimeframes) {
                if (!knownTimeframes.contains(timeframe)) {
                    violations.add("sync timeframe " + timeframe + " is not a known timeframe " + knownTimeframes);
                } else if (!weights.containsKey(timeframe)) {
                    violations.add("sync timeframe " + timeframe + " has no weight");
                }
            }
            if (requireSynchronization && syncTimeframes.isEmpty()) {
                violations.add("requireSynchronization needs at least one sync timeframe");
            }

            if (!violations.isEmpty()) {
                throw new ConfigurationException("Invalid strategy policy '" + id + "': " + String.join("; ", violations));
            }
            return new StrategyPolicy(this);
        }
    }
}
