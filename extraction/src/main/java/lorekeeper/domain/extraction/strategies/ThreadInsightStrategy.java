package lorekeeper.domain.extraction.strategies;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.extraction.response.InsightsResponse;
import lorekeeper.domain.extraction.response.InsightsResponseItem;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.ThreadItem;
import lorekeeper.domain.sanitize.SanitizeDocument;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Extracts insights, feedback and references from a whole thread.
 */
@ApplicationScoped
public class ThreadInsightStrategy extends AbstractExtractionStrategy<ThreadItem, InsightsResponse> {
    @Inject
    @Identifier("removeSlackMarkup")
    private SanitizeDocument removeSlackMarkup;

    @Override
    public OriginKind origin() {
        return OriginKind.THREAD;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.INSIGHT;
    }

    @Override
    protected Class<ThreadItem> getItemType() {
        return ThreadItem.class;
    }

    @Override
    protected Class<InsightsResponse> getResponseType() {
        return InsightsResponse.class;
    }

    @Override
    protected boolean isApplicable(final ThreadItem item) {
        return StringUtils.isNotBlank(item.text());
    }

    @Override
    protected String buildPrompt(final ThreadItem item) {
        final String conversation = item.messages().stream()
                .filter(message -> StringUtils.isNotBlank(message.text()))
                .map(message -> message.author() + ": " + removeSlackMarkup.sanitize(message.text()))
                .collect(Collectors.joining("\n"));

        return """
                Extract insights from this chat thread.
                
                Conversation:
                %s
                
                Respond with a single JSON object in this format:
                {
                    "insights": [
                        {
                            "type": "insight",
                            "content": "the insight",
                            "keywords": ["keyword1", "keyword2"],
                            "reference_type": "link"
                        }
                    ]
                }
                The type is one of "insight", "feedback" or "reference". Only set reference_type for references,
                e.g. link, code or doc. Return an empty array if there are no insights. Respond with JSON only.
                """.formatted(conversation);
    }

    @Override
    protected List<SemanticRecord> toRecords(final ThreadItem item, final InsightsResponse response) {
        return response.insightList()
                .stream()
                .map(insight -> toRecord(item, insight))
                .toList();
    }

    private SemanticRecord toRecord(final ThreadItem item, final InsightsResponseItem insight) {
        final String type = StringUtils.defaultString(insight.type()).trim().toLowerCase(Locale.ROOT);
        final String content = StringUtils.defaultString(insight.content());
        final List<String> keywords = cleanKeywords(insight.keywordList());

        if (type.equals("reference")) {
            return SemanticRecord.reference(content, insight.referenceType(), keywords, item.provenance());
        }

        if (type.equals("feedback")) {
            return SemanticRecord.content(SemanticKind.FEEDBACK, content, keywords, item.provenance());
        }

        return SemanticRecord.content(SemanticKind.INSIGHT, content, keywords, item.provenance());
    }
}
