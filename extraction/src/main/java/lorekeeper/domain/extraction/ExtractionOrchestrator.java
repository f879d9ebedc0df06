package lorekeeper.domain.extraction;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ExtractionConfig;
import lorekeeper.domain.exceptionhandling.ExceptionHandler;
import lorekeeper.domain.exceptions.Timeout;
import lorekeeper.domain.injection.Preferred;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.RawItem;
import lorekeeper.domain.timeout.TimeoutService;
import lorekeeper.infrastructure.llm.LlmClient;
import lorekeeper.infrastructure.llm.LlmConnection;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs every strategy registered for an item's origin over a batch of raw items.
 * <p>
 * Records come back in item order, and within an item in strategy registration order. An item contributes either
 * everything its strategies returned or, if it ran out of time, nothing. A failing strategy or item is logged and
 * skipped; it never aborts the batch.
 */
@ApplicationScoped
public class ExtractionOrchestrator {
    @Inject
    private StrategyRegistry strategyRegistry;

    @Inject
    @Preferred
    private LlmClient llmClient;

    @Inject
    private TimeoutService timeoutService;

    @Inject
    private ExtractionConfig extractionConfig;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    public List<SemanticRecord> extract(final List<? extends RawItem> items, @Nullable final ProgressCallback callback) {
        return extract(items, callback, ExtractionCancellation.none());
    }

    /**
     * Extract records from the items.
     *
     * @param items        The raw items
     * @param callback     Called with (index, total) before each item and with (total, total) once at the end
     * @param cancellation Checked before each item. A cancelled run returns what was extracted so far and does not
     *                     report completion. An interrupted calling thread is treated the same way, and the
     *                     interrupt flag is left set.
     * @return The extracted records
     */
    public List<SemanticRecord> extract(final List<? extends RawItem> items,
                                        @Nullable final ProgressCallback callback,
                                        final ExtractionCancellation cancellation) {
        checkNotNull(items, "items must not be null");
        checkNotNull(cancellation, "cancellation must not be null");

        final int total = items.size();
        final List<SemanticRecord> records = new ArrayList<>();

        try (LlmConnection ignored = llmClient.connect()) {
            for (int i = 0; i < total; ++i) {
                if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                    logger.info("Extraction stopped after " + i + " of " + total + " items");
                    return records;
                }

                reportProgress(callback, i, total);
                records.addAll(processItem(items.get(i), i));
            }
        }

        reportProgress(callback, total, total);
        logger.info("Extracted " + records.size() + " records from " + total + " items");

        return records;
    }

    private List<SemanticRecord> processItem(final RawItem item, final int index) {
        if (item == null) {
            logger.warning("Skipping empty item " + index);
            return List.of();
        }

        final long timeout = extractionConfig.getItemTimeoutSeconds();

        return Try.of(() -> timeoutService.executeWithTimeout(
                        () -> runStrategies(item),
                        () -> {
                            throw new Timeout("Item " + index + " was not processed within " + timeout + " seconds");
                        },
                        timeout))
                .onFailure(ex -> logger.warning("Item " + index + " contributed no records: "
                        + exceptionHandler.getExceptionMessage(ex)))
                .getOrElse(List::of);
    }

    private List<SemanticRecord> runStrategies(final RawItem item) {
        final List<SemanticRecord> itemRecords = new ArrayList<>();

        for (final ExtractionStrategy strategy : strategyRegistry.getStrategies(item.originKind())) {
            Try.of(() -> strategy.process(item))
                    .map(result -> Objects.requireNonNullElse(result, List.<SemanticRecord>of()))
                    .onSuccess(itemRecords::addAll)
                    .onFailure(ex -> logger.warning(strategy.getClass().getSimpleName() + " failed: "
                            + exceptionHandler.getExceptionMessage(ex)));
        }

        return itemRecords;
    }

    private void reportProgress(@Nullable final ProgressCallback callback, final int current, final int total) {
        if (callback == null) {
            return;
        }

        Try.run(() -> callback.onProgress(current, total))
                .onFailure(ex -> logger.warning("Progress callback failed: " + exceptionHandler.getExceptionMessage(ex)));
    }
}
