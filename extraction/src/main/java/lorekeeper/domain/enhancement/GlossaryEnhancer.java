package lorekeeper.domain.enhancement;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ExtractionConfig;
import lorekeeper.domain.config.ModelConfig;
import lorekeeper.domain.exceptionhandling.ExceptionHandler;
import lorekeeper.domain.exceptionhandling.ExceptionMapping;
import lorekeeper.domain.exceptions.ExternalFailure;
import lorekeeper.domain.extraction.response.GlossaryResponse;
import lorekeeper.domain.extraction.response.GlossaryResponseItem;
import lorekeeper.domain.extraction.strategies.GlossaryRecords;
import lorekeeper.domain.injection.Preferred;
import lorekeeper.domain.model.Confidence;
import lorekeeper.domain.model.GlossaryPayload;
import lorekeeper.domain.model.Provenance;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.infrastructure.llm.LlmClient;
import org.apache.commons.lang3.StringUtils;
import org.jooq.lambda.Seq;
import org.jooq.lambda.tuple.Tuple2;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Asks the model to take a second look at glossary terms it was unsure about.
 * <p>
 * Terms at or below the confidence threshold, or already flagged for review, are sent in one prompt with some context.
 * A re-derived definition only replaces the original when its confidence is strictly higher; otherwise the original
 * is kept, flagged for review, with the new definition recorded as an alternative. Nothing is dropped: a term the model
 * says nothing about is kept and flagged. Terms the model adds that were not asked about are returned as new records.
 */
@ApplicationScoped
public class GlossaryEnhancer {
    private static final String DERIVED_DESCRIPTION = "Found while reviewing low confidence glossary terms";

    @Inject
    @Preferred
    private LlmClient llmClient;

    @Inject
    private ModelConfig modelConfig;

    @Inject
    private ExtractionConfig extractionConfig;

    @Inject
    private GlossaryRecords glossaryRecords;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    /**
     * Enhance with the default client and the configured threshold.
     */
    public List<SemanticRecord> enhance(final List<SemanticRecord> records, final String context) {
        return enhance(records, llmClient, context, extractionConfig.getEnhancementThreshold());
    }

    /**
     * Enhance the glossary records in the list. Records of other kinds are returned untouched.
     *
     * @param records   The records to enhance
     * @param client    The client used to re-derive definitions
     * @param context   Extra text the model can use to work out what the terms mean
     * @param threshold Glossary terms with this confidence or lower are reviewed
     * @return The trusted records, then the reviewed records, then any newly found terms
     */
    public List<SemanticRecord> enhance(final List<SemanticRecord> records,
                                        final LlmClient client,
                                        final String context,
                                        final Confidence threshold) {
        checkNotNull(records, "records must not be null");
        checkNotNull(client, "client must not be null");
        checkNotNull(threshold, "threshold must not be null");

        final Tuple2<Seq<SemanticRecord>, Seq<SemanticRecord>> partitioned = Seq.seq(records)
                .partition(record -> needsReview(record, threshold));

        final List<SemanticRecord> toReview = partitioned.v1().toList();
        final List<SemanticRecord> trusted = partitioned.v2().toList();

        if (toReview.isEmpty()) {
            return records;
        }

        logger.info("Reviewing " + toReview.size() + " glossary terms");

        final Try<GlossaryResponse> response = exceptionMapping.map(Try.of(() -> client.generateStructured(
                buildPrompt(toReview, StringUtils.defaultString(context)),
                modelConfig.getTemperature(),
                GlossaryResponse.class)));

        final Map<String, GlossaryResponseItem> candidates = response
                .onFailure(ExternalFailure.class, ex -> logger.warning("Glossary terms could not be reviewed: "
                        + exceptionHandler.getExceptionMessage(ex)))
                .map(GlossaryEnhancer::candidatesByTerm)
                .recover(ExternalFailure.class, ex -> Map.of())
                .get();

        final List<SemanticRecord> merged = toReview.stream()
                .map(record -> merge(record, candidates.get(termKey(termOf(record)))))
                .toList();

        final Set<String> knownTerms = records.stream()
                .filter(record -> record.kind() == SemanticKind.GLOSSARY)
                .map(record -> termKey(termOf(record)))
                .collect(Collectors.toSet());

        final List<SemanticRecord> discovered = candidates.entrySet()
                .stream()
                .filter(entry -> !knownTerms.contains(entry.getKey()))
                .map(entry -> glossaryRecords.toRecord(entry.getValue(), Provenance.derived(DERIVED_DESCRIPTION)))
                .toList();

        if (!discovered.isEmpty()) {
            logger.info("Review found " + discovered.size() + " new glossary terms");
        }

        final List<SemanticRecord> result = new ArrayList<>(trusted);
        result.addAll(merged);
        result.addAll(discovered);
        return result;
    }

    private boolean needsReview(final SemanticRecord record, final Confidence threshold) {
        if (record.kind() != SemanticKind.GLOSSARY) {
            return false;
        }

        final GlossaryPayload payload = record.payloadAs(GlossaryPayload.class);
        return payload.needsReview() || payload.confidence().isAtMost(threshold);
    }

    private SemanticRecord merge(final SemanticRecord original, @Nullable final GlossaryResponseItem candidateItem) {
        final GlossaryPayload originalPayload = original.payloadAs(GlossaryPayload.class);

        if (candidateItem == null) {
            return original.updatePayload(originalPayload.markForReview());
        }

        final GlossaryPayload candidate = candidateItem.toPayload();
        final Set<String> hints = new LinkedHashSet<>(originalPayload.domainHints());
        hints.addAll(candidate.domainHints());

        if (StringUtils.isNotBlank(candidate.definition())
                && candidate.confidence().isHigherThan(originalPayload.confidence())) {
            final List<String> alternatives = new ArrayList<>(originalPayload.alternativeDefinitions());
            addIfDifferent(alternatives, originalPayload.definition(), candidate.definition());
            alternatives.addAll(candidate.alternativeDefinitions());

            return original.updatePayload(new GlossaryPayload(
                    originalPayload.term(),
                    candidate.definition(),
                    candidate.termCategory(),
                    candidate.confidence(),
                    candidate.needsReview(),
                    alternatives,
                    hints));
        }

        final List<String> alternatives = new ArrayList<>(originalPayload.alternativeDefinitions());
        alternatives.addAll(candidate.alternativeDefinitions());
        addIfDifferent(alternatives, candidate.definition(), originalPayload.definition());

        return original.updatePayload(originalPayload
                .markForReview()
                .withAlternativeDefinitions(alternatives)
                .withDomainHints(hints));
    }

    private static void addIfDifferent(final List<String> alternatives, final String definition, final String current) {
        if (StringUtils.isNotBlank(definition) && !definition.equalsIgnoreCase(current)) {
            alternatives.add(definition);
        }
    }

    private String buildPrompt(final List<SemanticRecord> toReview, final String context) {
        final String terms = toReview.stream()
                .map(record -> record.payloadAs(GlossaryPayload.class))
                .map(payload -> "- " + payload.term() + " (" + payload.confidence().getValue() + " confidence): "
                        + StringUtils.defaultIfBlank(payload.definition(), "no definition yet"))
                .collect(Collectors.joining("\n"));

        final String text = terms + "\n\nContext:\n" + StringUtils.abbreviate(context, Math.max(4, extractionConfig.getMaxContextLength()));

        return glossaryRecords.buildPrompt(
                "Review these glossary terms. Use the context to give each term a better definition and an honest "
                        + "confidence. Also include any other organisation specific terms the context defines.",
                text);
    }

    /**
     * The first response item for each term, keyed by the normalised term.
     */
    private static Map<String, GlossaryResponseItem> candidatesByTerm(final GlossaryResponse response) {
        final Map<String, GlossaryResponseItem> candidates = new LinkedHashMap<>();
        for (final GlossaryResponseItem item : response.termList()) {
            if (item != null && StringUtils.isNotBlank(item.term())) {
                candidates.putIfAbsent(termKey(item.term()), item);
            }
        }
        return candidates;
    }

    private static String termOf(final SemanticRecord record) {
        return record.payloadAs(GlossaryPayload.class).term();
    }

    private static String termKey(final String term) {
        return StringUtils.trimToEmpty(term).toLowerCase(Locale.ROOT);
    }
}
