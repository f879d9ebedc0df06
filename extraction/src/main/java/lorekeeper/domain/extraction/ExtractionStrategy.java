package lorekeeper.domain.extraction;

import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.RawItem;

import java.util.List;

/**
 * Turns one raw item into semantic records of one kind, using the generative text service.
 * <p>
 * Implementations have no side effects beyond the returned list, so processing an item again is always safe. A
 * failed call or a response that makes no sense results in an empty list, not an exception.
 */
public interface ExtractionStrategy {
    /**
     * The kind of raw item this strategy reads.
     */
    OriginKind origin();

    /**
     * The kind of record this strategy is registered for. Some strategies also emit related kinds, e.g. the thread
     * insight strategy emits feedback and references.
     */
    SemanticKind kind();

    List<SemanticRecord> process(RawItem item);
}
