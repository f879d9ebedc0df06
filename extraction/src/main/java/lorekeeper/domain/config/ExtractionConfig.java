package lorekeeper.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.model.Confidence;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Settings for extraction and glossary enhancement. Values that can't be parsed fall back to their defaults.
 */
@ApplicationScoped
public class ExtractionConfig {
    private static final int DEFAULT_ITEM_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_GLOSSARY_MINIMUM_LENGTH = 200;
    private static final int DEFAULT_MAX_CONTEXT_LENGTH = 8000;

    @Inject
    @ConfigProperty(name = "lk.extraction.itemtimeoutseconds", defaultValue = "300")
    private String itemTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "lk.extraction.glossary.minimumlength", defaultValue = "200")
    private String glossaryMinimumLength;

    @Inject
    @ConfigProperty(name = "lk.enhancement.threshold", defaultValue = "low")
    private String enhancementThreshold;

    @Inject
    @ConfigProperty(name = "lk.enhancement.maxcontextlength", defaultValue = "8000")
    private String maxContextLength;

    public long getItemTimeoutSeconds() {
        final int value = NumberUtils.toInt(itemTimeoutSeconds, DEFAULT_ITEM_TIMEOUT_SECONDS);
        return value > 0 ? value : DEFAULT_ITEM_TIMEOUT_SECONDS;
    }

    /**
     * Document sections shorter than this, with no glossary markers, are not sent to the model for glossary terms.
     */
    public int getGlossaryMinimumLength() {
        return Math.max(0, NumberUtils.toInt(glossaryMinimumLength, DEFAULT_GLOSSARY_MINIMUM_LENGTH));
    }

    /**
     * Glossary terms with this confidence or lower are reviewed by the enhancement pass.
     */
    public Confidence getEnhancementThreshold() {
        return Confidence.fromValue(enhancementThreshold);
    }

    public int getMaxContextLength() {
        final int value = NumberUtils.toInt(maxContextLength, DEFAULT_MAX_CONTEXT_LENGTH);
        return value > 0 ? value : DEFAULT_MAX_CONTEXT_LENGTH;
    }
}
