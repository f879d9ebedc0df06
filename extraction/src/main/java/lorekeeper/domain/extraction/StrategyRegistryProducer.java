package lorekeeper.domain.extraction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import lorekeeper.domain.extraction.strategies.SectionGlossaryStrategy;
import lorekeeper.domain.extraction.strategies.SectionInsightStrategy;
import lorekeeper.domain.extraction.strategies.SectionInstructionStrategy;
import lorekeeper.domain.extraction.strategies.SectionReferenceStrategy;
import lorekeeper.domain.extraction.strategies.ThreadGlossaryStrategy;
import lorekeeper.domain.extraction.strategies.ThreadInsightStrategy;
import lorekeeper.domain.extraction.strategies.ThreadQnaStrategy;

/**
 * Registers the built-in strategies. The registration order is the order records are emitted in for each item.
 */
@ApplicationScoped
public class StrategyRegistryProducer {
    @Produces
    @ApplicationScoped
    public StrategyRegistry produceStrategyRegistry(final ThreadQnaStrategy threadQnaStrategy,
                                                    final ThreadInsightStrategy threadInsightStrategy,
                                                    final ThreadGlossaryStrategy threadGlossaryStrategy,
                                                    final SectionInsightStrategy sectionInsightStrategy,
                                                    final SectionInstructionStrategy sectionInstructionStrategy,
                                                    final SectionReferenceStrategy sectionReferenceStrategy,
                                                    final SectionGlossaryStrategy sectionGlossaryStrategy) {
        return new StrategyRegistry()
                .register(threadQnaStrategy)
                .register(threadInsightStrategy)
                .register(threadGlossaryStrategy)
                .register(sectionInsightStrategy)
                .register(sectionInstructionStrategy)
                .register(sectionReferenceStrategy)
                .register(sectionGlossaryStrategy);
    }
}
