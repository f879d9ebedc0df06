package lorekeeper.domain.validate;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.exceptions.InvalidRecord;
import lorekeeper.domain.model.Confidence;
import lorekeeper.domain.model.ContentPayload;
import lorekeeper.domain.model.GlossaryPayload;
import lorekeeper.domain.model.QnaPayload;
import lorekeeper.domain.model.ReferencePayload;
import lorekeeper.domain.model.SemanticPayload;
import lorekeeper.domain.model.SemanticRecord;

import java.util.List;
import java.util.logging.Logger;

/**
 * Checks records against the rules every stored record must follow. Invalid records are dropped, never repaired.
 */
@ApplicationScoped
public class SemanticRecordValidator {
    @Inject
    private ValidateString validateString;

    @Inject
    private Logger logger;

    /**
     * @throws InvalidRecord if the record must not be stored
     */
    public SemanticRecord validate(final SemanticRecord record) {
        final SemanticPayload payload = record.payload();

        if (payload instanceof QnaPayload qna) {
            requireText(qna.question(), "A Q&A record needs a question");
            requireText(qna.answer(), "A Q&A record needs an answer");
        } else if (payload instanceof ContentPayload content) {
            requireText(content.content(), "A " + record.kind().getValue() + " record needs content");
        } else if (payload instanceof ReferencePayload reference) {
            requireText(reference.content(), "A reference record needs content");
        } else if (payload instanceof GlossaryPayload glossary) {
            requireText(glossary.term(), "A glossary record needs a term");
            if (glossary.confidence() == Confidence.LOW && !glossary.needsReview()) {
                throw new InvalidRecord("A low confidence glossary record must be marked for review");
            }
        }

        return record;
    }

    public boolean isValid(final SemanticRecord record) {
        return Try.of(() -> validate(record))
                .onFailure(InvalidRecord.class, ex -> logger.info("Dropping invalid record: " + ex.getMessage()))
                .isSuccess();
    }

    /**
     * Returns the valid records in their original order.
     */
    public List<SemanticRecord> filterValid(final List<SemanticRecord> records) {
        return records.stream()
                .filter(this::isValid)
                .toList();
    }

    private void requireText(final String value, final String message) {
        Try.of(() -> validateString.throwIfBlank(value))
                .getOrElseThrow(ex -> new InvalidRecord(message, ex));
    }
}
