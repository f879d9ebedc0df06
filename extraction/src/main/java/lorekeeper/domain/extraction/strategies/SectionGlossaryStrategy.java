package lorekeeper.domain.extraction.strategies;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ExtractionConfig;
import lorekeeper.domain.extraction.response.GlossaryResponse;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.DocumentSectionItem;

import java.util.List;

/**
 * Extracts glossary terms from a document section. Short sections with no glossary markers are skipped.
 */
@ApplicationScoped
public class SectionGlossaryStrategy extends AbstractExtractionStrategy<DocumentSectionItem, GlossaryResponse> {
    @Inject
    private GlossaryRecords glossaryRecords;

    @Inject
    private ExtractionConfig extractionConfig;

    @Override
    public OriginKind origin() {
        return OriginKind.DOCUMENT_SECTION;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.GLOSSARY;
    }

    @Override
    protected Class<DocumentSectionItem> getItemType() {
        return DocumentSectionItem.class;
    }

    @Override
    protected Class<GlossaryResponse> getResponseType() {
        return GlossaryResponse.class;
    }

    @Override
    protected boolean isApplicable(final DocumentSectionItem item) {
        final String text = item.sectionTitle() + "\n" + item.text();
        return item.text().trim().length() >= extractionConfig.getGlossaryMinimumLength()
                || TextMarkers.containsAny(text, TextMarkers.GLOSSARY);
    }

    @Override
    protected String buildPrompt(final DocumentSectionItem item) {
        return glossaryRecords.buildPrompt(
                "Extract glossary terms from this document section.",
                item.sectionTitle() + "\n" + item.text());
    }

    @Override
    protected List<SemanticRecord> toRecords(final DocumentSectionItem item, final GlossaryResponse response) {
        return glossaryRecords.toRecords(response, item.provenance());
    }
}
