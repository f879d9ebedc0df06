package lorekeeper.domain.extraction.strategies;

import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.extraction.response.GlossaryResponse;
import lorekeeper.domain.extraction.response.GlossaryResponseItem;
import lorekeeper.domain.model.GlossaryPayload;
import lorekeeper.domain.model.Provenance;
import lorekeeper.domain.model.SemanticRecord;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The glossary prompt and response handling shared by the thread and document strategies.
 */
@ApplicationScoped
public class GlossaryRecords {
    public String buildPrompt(final String instruction, final String text) {
        return instruction + "\n" + """
                
                Text:
                %s
                
                Respond with a single JSON object in this format:
                {
                    "terms": [
                        {
                            "term": "the term or abbreviation",
                            "definition": "what it means in this organisation",
                            "category": "service, development, design, marketing or general",
                            "confidence": "high, medium or low",
                            "needs_review": false,
                            "alternative_definitions": ["another possible meaning"],
                            "domain_hints": ["the team or product area the term belongs to"]
                        }
                    ]
                }
                Only include terms that are specific to the organisation or its products. Use low confidence when the
                text only hints at the meaning. Return an empty array if there are no terms. Respond with JSON only.
                """.formatted(text);
    }

    /**
     * Records keyed by the term and any extra keywords the model supplied.
     */
    public List<SemanticRecord> toRecords(final GlossaryResponse response, final Provenance provenance) {
        return response.termList()
                .stream()
                .map(term -> toRecord(term, provenance))
                .toList();
    }

    public SemanticRecord toRecord(final GlossaryResponseItem item, final Provenance provenance) {
        final GlossaryPayload payload = item.toPayload();

        final List<String> keywords = new ArrayList<>();
        if (StringUtils.isNotBlank(payload.term())) {
            keywords.add(payload.term().toLowerCase(Locale.ROOT));
        }
        keywords.addAll(AbstractExtractionStrategy.cleanKeywords(item.keywordList()));

        return SemanticRecord.glossary(payload, keywords, provenance);
    }
}
