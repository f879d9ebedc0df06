package lorekeeper.domain.extraction.strategies;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ModelConfig;
import lorekeeper.domain.exceptionhandling.ExceptionHandler;
import lorekeeper.domain.exceptionhandling.ExceptionMapping;
import lorekeeper.domain.exceptions.ExternalFailure;
import lorekeeper.domain.extraction.ExtractionStrategy;
import lorekeeper.domain.injection.Preferred;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.RawItem;
import lorekeeper.domain.validate.SemanticRecordValidator;
import lorekeeper.infrastructure.llm.LlmClient;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The shared flow of every strategy: check the item is worth a call, build a prompt, ask for a JSON response, convert
 * it to records and drop any that are invalid. Service failures are logged and contribute no records.
 *
 * @param <T> The raw item type
 * @param <R> The response type the model is asked to fill in
 */
public abstract class AbstractExtractionStrategy<T extends RawItem, R> implements ExtractionStrategy {
    @Inject
    @Preferred
    private LlmClient llmClient;

    @Inject
    private ModelConfig modelConfig;

    @Inject
    private SemanticRecordValidator semanticRecordValidator;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Override
    public List<SemanticRecord> process(final RawItem item) {
        checkNotNull(item, "item must not be null");

        if (!getItemType().isInstance(item)) {
            return List.of();
        }

        final T typedItem = getItemType().cast(item);

        if (!isApplicable(typedItem)) {
            logger.fine(getClass().getSimpleName() + " skipped an item that can't contain " + kind().getValue() + " records");
            return List.of();
        }

        return exceptionMapping.map(Try.of(() -> llmClient.generateStructured(
                                buildPrompt(typedItem),
                                modelConfig.getTemperature(),
                                getResponseType())))
                .map(response -> toRecords(typedItem, response))
                .map(semanticRecordValidator::filterValid)
                .onFailure(ExternalFailure.class, ex -> logger.warning(getClass().getSimpleName()
                        + " could not call the text service: " + exceptionHandler.getExceptionMessage(ex)))
                .recover(ExternalFailure.class, ex -> List.of())
                .get();
    }

    protected abstract Class<T> getItemType();

    protected abstract Class<R> getResponseType();

    /**
     * A cheap local check that the item could plausibly contain the target kind.
     */
    protected boolean isApplicable(final T item) {
        return true;
    }

    protected abstract String buildPrompt(T item);

    protected abstract List<SemanticRecord> toRecords(T item, R response);

    protected static List<String> cleanKeywords(@Nullable final List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }

        return keywords.stream()
                .filter(Objects::nonNull)
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .distinct()
                .toList();
    }
}
