package lorekeeper.domain.extraction.strategies;

import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.extraction.response.InsightsResponse;
import lorekeeper.domain.extraction.response.InsightsResponseItem;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.DocumentSectionItem;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Extracts insights and feedback from a document section. References in documents are handled by
 * {@link SectionReferenceStrategy}, so any other type is read as an insight.
 */
@ApplicationScoped
public class SectionInsightStrategy extends AbstractExtractionStrategy<DocumentSectionItem, InsightsResponse> {
    @Override
    public OriginKind origin() {
        return OriginKind.DOCUMENT_SECTION;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.INSIGHT;
    }

    @Override
    protected Class<DocumentSectionItem> getItemType() {
        return DocumentSectionItem.class;
    }

    @Override
    protected Class<InsightsResponse> getResponseType() {
        return InsightsResponse.class;
    }

    @Override
    protected boolean isApplicable(final DocumentSectionItem item) {
        return StringUtils.isNotBlank(item.text());
    }

    @Override
    protected String buildPrompt(final DocumentSectionItem item) {
        return """
                Extract insights from this document section.
                
                Title: %s
                Content:
                %s
                
                Respond with a single JSON object in this format:
                {
                    "insights": [
                        {
                            "type": "insight",
                            "content": "the insight",
                            "keywords": ["keyword1", "keyword2"]
                        }
                    ]
                }
                The type is either "insight" or "feedback". Return an empty array if there are no insights.
                Respond with JSON only.
                """.formatted(item.sectionTitle(), item.text());
    }

    @Override
    protected List<SemanticRecord> toRecords(final DocumentSectionItem item, final InsightsResponse response) {
        return response.insightList()
                .stream()
                .map(insight -> toRecord(item, insight))
                .toList();
    }

    private SemanticRecord toRecord(final DocumentSectionItem item, final InsightsResponseItem insight) {
        final SemanticKind kind = "feedback".equalsIgnoreCase(StringUtils.trim(insight.type()))
                ? SemanticKind.FEEDBACK
                : SemanticKind.INSIGHT;

        return SemanticRecord.content(
                kind,
                StringUtils.defaultString(insight.content()),
                cleanKeywords(insight.keywordList()),
                item.provenance());
    }
}
