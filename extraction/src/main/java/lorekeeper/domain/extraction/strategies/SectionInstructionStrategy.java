package lorekeeper.domain.extraction.strategies;

import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.extraction.response.InstructionsResponse;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.DocumentSectionItem;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Extracts step by step instructions. Only sections whose title reads like a guide are sent to the model.
 */
@ApplicationScoped
public class SectionInstructionStrategy extends AbstractExtractionStrategy<DocumentSectionItem, InstructionsResponse> {
    @Override
    public OriginKind origin() {
        return OriginKind.DOCUMENT_SECTION;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.INSTRUCTION;
    }

    @Override
    protected Class<DocumentSectionItem> getItemType() {
        return DocumentSectionItem.class;
    }

    @Override
    protected Class<InstructionsResponse> getResponseType() {
        return InstructionsResponse.class;
    }

    @Override
    protected boolean isApplicable(final DocumentSectionItem item) {
        return StringUtils.isNotBlank(item.text())
                && (TextMarkers.containsAny(item.sectionTitle(), TextMarkers.INSTRUCTION)
                || TextMarkers.containsAny(item.documentTitle(), TextMarkers.INSTRUCTION));
    }

    @Override
    protected String buildPrompt(final DocumentSectionItem item) {
        return """
                Extract instructions from this document section. Instructions are procedures or step by step guides.
                
                Title: %s
                Content:
                %s
                
                Respond with a single JSON object in this format:
                {
                    "instructions": [
                        {
                            "title": "what the instructions achieve",
                            "steps": ["first step", "second step"],
                            "keywords": ["keyword1", "keyword2"]
                        }
                    ]
                }
                Return an empty array if there are no instructions. Respond with JSON only.
                """.formatted(item.sectionTitle(), item.text());
    }

    @Override
    protected List<SemanticRecord> toRecords(final DocumentSectionItem item, final InstructionsResponse response) {
        return response.instructionList()
                .stream()
                .map(instruction -> SemanticRecord.content(
                        SemanticKind.INSTRUCTION,
                        instruction.fullContent(),
                        cleanKeywords(instruction.keywordList()),
                        item.provenance()))
                .toList();
    }
}
