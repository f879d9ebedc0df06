package lorekeeper.domain.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ExtractionConfig;
import lorekeeper.domain.enhancement.GlossaryEnhancer;
import lorekeeper.domain.extraction.ExtractionCancellation;
import lorekeeper.domain.extraction.ExtractionOrchestrator;
import lorekeeper.domain.extraction.ProgressCallback;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.RawItem;
import lorekeeper.domain.store.SemanticStore;
import lorekeeper.domain.validate.SemanticRecordValidator;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Extracts records from raw items, reviews the uncertain glossary terms and saves the result.
 * Store failures are not caught here.
 */
@ApplicationScoped
public class ExtractionPipeline {
    @Inject
    private ExtractionOrchestrator extractionOrchestrator;

    @Inject
    private GlossaryEnhancer glossaryEnhancer;

    @Inject
    private SemanticRecordValidator semanticRecordValidator;

    @Inject
    private SemanticStore semanticStore;

    @Inject
    private ExtractionConfig extractionConfig;

    @Inject
    private Logger logger;

    public List<SemanticRecord> run(final List<? extends RawItem> items, @Nullable final ProgressCallback callback) {
        return run(items, callback, ExtractionCancellation.none());
    }

    /**
     * @return The records as they were stored, with their ids and creation times
     */
    public List<SemanticRecord> run(final List<? extends RawItem> items,
                                    @Nullable final ProgressCallback callback,
                                    final ExtractionCancellation cancellation) {
        checkNotNull(items, "items must not be null");

        final List<SemanticRecord> extracted = semanticRecordValidator.filterValid(
                extractionOrchestrator.extract(items, callback, cancellation));

        final List<SemanticRecord> glossary = extracted.stream()
                .filter(record -> record.kind() == SemanticKind.GLOSSARY)
                .toList();

        final List<SemanticRecord> records = new ArrayList<>(extracted.stream()
                .filter(record -> record.kind() != SemanticKind.GLOSSARY)
                .toList());

        if (CollectionUtils.isNotEmpty(glossary)) {
            records.addAll(glossaryEnhancer.enhance(glossary, buildContext(items)));
        }

        final List<SemanticRecord> valid = semanticRecordValidator.filterValid(records);
        if (valid.isEmpty()) {
            logger.info("No records to store");
            return List.of();
        }

        final List<SemanticRecord> stored = semanticStore.store(valid);
        logger.info("Stored " + stored.size() + " records");
        return stored;
    }

    private String buildContext(final List<? extends RawItem> items) {
        final String context = items.stream()
                .filter(Objects::nonNull)
                .map(RawItem::text)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.joining("\n\n"));

        return StringUtils.left(context, extractionConfig.getMaxContextLength());
    }
}
