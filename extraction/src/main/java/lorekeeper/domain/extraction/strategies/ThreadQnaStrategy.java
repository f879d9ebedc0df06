package lorekeeper.domain.extraction.strategies;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.extraction.response.QnaResponse;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.ThreadItem;
import lorekeeper.domain.raw.ThreadMessage;
import lorekeeper.domain.sanitize.SanitizeDocument;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Reads the first message of a thread as the question and the second as the answer. The model decides whether the
 * pair is worth documenting, and a pair it rejects is never emitted.
 */
@ApplicationScoped
public class ThreadQnaStrategy extends AbstractExtractionStrategy<ThreadItem, QnaResponse> {
    @Inject
    @Identifier("removeSlackMarkup")
    private SanitizeDocument removeSlackMarkup;

    @Override
    public OriginKind origin() {
        return OriginKind.THREAD;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.QNA;
    }

    @Override
    protected Class<ThreadItem> getItemType() {
        return ThreadItem.class;
    }

    @Override
    protected Class<QnaResponse> getResponseType() {
        return QnaResponse.class;
    }

    @Override
    protected boolean isApplicable(final ThreadItem item) {
        return item.messages().size() >= 2
                && StringUtils.isNotBlank(item.messages().get(0).text())
                && StringUtils.isNotBlank(item.messages().get(1).text());
    }

    @Override
    protected String buildPrompt(final ThreadItem item) {
        return """
                Decide whether this question and answer from a chat thread is worth documenting, and clean them up.
                
                Question: %s
                Answer: %s
                
                Respond with a single JSON object in this format:
                {
                    "is_valuable": true,
                    "question": "the cleaned up question",
                    "answer": "the cleaned up answer",
                    "keywords": ["keyword1", "keyword2"]
                }
                Set is_valuable to false if the answer does not actually answer the question or is not useful to others.
                Respond with JSON only.
                """.formatted(
                removeSlackMarkup.sanitize(item.messages().get(0).text()),
                removeSlackMarkup.sanitize(item.messages().get(1).text()));
    }

    @Override
    protected List<SemanticRecord> toRecords(final ThreadItem item, final QnaResponse response) {
        if (!response.valuable()) {
            return List.of();
        }

        final List<ThreadMessage> pair = item.messages().subList(0, 2);

        return List.of(SemanticRecord.qna(
                StringUtils.defaultString(response.question()),
                StringUtils.defaultString(response.answer()),
                cleanKeywords(response.keywordList()),
                item.provenance(pair)));
    }
}
