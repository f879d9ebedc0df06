package lorekeeper.domain.extraction;

import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maps each origin and record kind to the strategy that extracts it. Strategies for an origin are returned in the
 * order they were first registered; registering a kind again replaces the strategy but keeps its position.
 */
public class StrategyRegistry {
    private final Map<OriginKind, Map<SemanticKind, ExtractionStrategy>> strategies = new EnumMap<>(OriginKind.class);

    public synchronized StrategyRegistry register(final ExtractionStrategy strategy) {
        checkNotNull(strategy, "strategy must not be null");
        return register(strategy.kind(), strategy);
    }

    public synchronized StrategyRegistry register(final SemanticKind kind, final ExtractionStrategy strategy) {
        checkNotNull(kind, "kind must not be null");
        checkNotNull(strategy, "strategy must not be null");

        strategies.computeIfAbsent(strategy.origin(), origin -> new LinkedHashMap<>())
                .put(kind, strategy);
        return this;
    }

    public synchronized Optional<ExtractionStrategy> get(final OriginKind origin, final SemanticKind kind) {
        return Optional.ofNullable(strategies.getOrDefault(origin, Map.of()).get(kind));
    }

    public synchronized List<ExtractionStrategy> getStrategies(final OriginKind origin) {
        return List.copyOf(strategies.getOrDefault(origin, Map.of()).values());
    }
}
