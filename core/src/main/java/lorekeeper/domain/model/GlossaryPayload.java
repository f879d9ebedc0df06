package lorekeeper.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A glossary entry. A LOW confidence entry always needs review; the constructor enforces this so no code path can
 * produce one that doesn't.
 */
public record GlossaryPayload(String term,
                              String definition,
                              String termCategory,
                              Confidence confidence,
                              boolean needsReview,
                              List<String> alternativeDefinitions,
                              Set<String> domainHints) implements SemanticPayload {
    public static final String DEFAULT_CATEGORY = "general";

    @JsonCreator
    public GlossaryPayload {
        term = StringUtils.trimToEmpty(term);
        definition = StringUtils.trimToEmpty(definition);
        termCategory = StringUtils.defaultIfBlank(StringUtils.trim(termCategory), DEFAULT_CATEGORY).toLowerCase(Locale.ROOT);
        confidence = Objects.requireNonNullElse(confidence, Confidence.LOW);
        needsReview = needsReview || confidence == Confidence.LOW;
        alternativeDefinitions = cleanList(alternativeDefinitions);
        domainHints = cleanSet(domainHints);
    }

    public GlossaryPayload(final String term, final String definition, final String termCategory, final Confidence confidence) {
        this(term, definition, termCategory, confidence, false, List.of(), Set.of());
    }

    public GlossaryPayload markForReview() {
        return new GlossaryPayload(term, definition, termCategory, confidence, true, alternativeDefinitions, domainHints);
    }

    public GlossaryPayload withAlternativeDefinitions(final List<String> alternatives) {
        return new GlossaryPayload(term, definition, termCategory, confidence, needsReview, alternatives, domainHints);
    }

    public GlossaryPayload withDomainHints(final Set<String> hints) {
        return new GlossaryPayload(term, definition, termCategory, confidence, needsReview, alternativeDefinitions, hints);
    }

    @Override
    public Map<String, String> metadata() {
        return Map.of(
                "term", term,
                "term_category", termCategory,
                "confidence", confidence.getValue(),
                "needs_review", Boolean.toString(needsReview));
    }

    private static List<String> cleanList(@Nullable final List<String> values) {
        if (values == null) {
            return List.of();
        }

        final List<String> cleaned = new ArrayList<>();
        for (final String value : values) {
            if (StringUtils.isNotBlank(value) && !cleaned.contains(value.trim())) {
                cleaned.add(value.trim());
            }
        }
        return Collections.unmodifiableList(cleaned);
    }

    private static Set<String> cleanSet(@Nullable final Set<String> values) {
        if (values == null) {
            return Set.of();
        }

        final Set<String> cleaned = new LinkedHashSet<>();
        for (final String value : values) {
            if (StringUtils.isNotBlank(value)) {
                cleaned.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(cleaned);
    }
}
