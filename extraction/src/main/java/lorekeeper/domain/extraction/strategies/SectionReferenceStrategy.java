package lorekeeper.domain.extraction.strategies;

import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.extraction.response.ReferencesResponse;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.DocumentSectionItem;

import java.util.List;

/**
 * Extracts links, API references, code snippets and documents. Sections with no url and no words that point
 * elsewhere are skipped.
 */
@ApplicationScoped
public class SectionReferenceStrategy extends AbstractExtractionStrategy<DocumentSectionItem, ReferencesResponse> {
    @Override
    public OriginKind origin() {
        return OriginKind.DOCUMENT_SECTION;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.REFERENCE;
    }

    @Override
    protected Class<DocumentSectionItem> getItemType() {
        return DocumentSectionItem.class;
    }

    @Override
    protected Class<ReferencesResponse> getResponseType() {
        return ReferencesResponse.class;
    }

    @Override
    protected boolean isApplicable(final DocumentSectionItem item) {
        return TextMarkers.containsUrl(item.text())
                || TextMarkers.containsAny(item.text(), TextMarkers.REFERENCE);
    }

    @Override
    protected String buildPrompt(final DocumentSectionItem item) {
        return """
                Extract references from this document section, such as links, API references, code snippets and documents.
                
                Title: %s
                Content:
                %s
                
                Respond with a single JSON object in this format:
                {
                    "references": [
                        {
                            "content": "the reference and what it is for",
                            "reference_type": "link, api, code or doc",
                            "keywords": ["keyword1", "keyword2"]
                        }
                    ]
                }
                Return an empty array if there are no references. Respond with JSON only.
                """.formatted(item.sectionTitle(), item.text());
    }

    @Override
    protected List<SemanticRecord> toRecords(final DocumentSectionItem item, final ReferencesResponse response) {
        return response.referenceList()
                .stream()
                .map(reference -> SemanticRecord.reference(
                        reference.fullContent(),
                        reference.referenceType(),
                        cleanKeywords(reference.keywordList()),
                        item.provenance()))
                .toList();
    }
}
