package lorekeeper.domain.extraction.strategies;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.extraction.response.GlossaryResponse;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.ThreadItem;
import lorekeeper.domain.sanitize.SanitizeDocument;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

@ApplicationScoped
public class ThreadGlossaryStrategy extends AbstractExtractionStrategy<ThreadItem, GlossaryResponse> {
    @Inject
    @Identifier("removeSlackMarkup")
    private SanitizeDocument removeSlackMarkup;

    @Inject
    private GlossaryRecords glossaryRecords;

    @Override
    public OriginKind origin() {
        return OriginKind.THREAD;
    }

    @Override
    public SemanticKind kind() {
        return SemanticKind.GLOSSARY;
    }

    @Override
    protected Class<ThreadItem> getItemType() {
        return ThreadItem.class;
    }

    @Override
    protected Class<GlossaryResponse> getResponseType() {
        return GlossaryResponse.class;
    }

    @Override
    protected boolean isApplicable(final ThreadItem item) {
        return StringUtils.isNotBlank(item.text());
    }

    @Override
    protected String buildPrompt(final ThreadItem item) {
        final String conversation = item.messages().stream()
                .map(message -> removeSlackMarkup.sanitize(message.text()))
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.joining("\n"));

        return glossaryRecords.buildPrompt("Extract glossary terms from this chat thread.", conversation);
    }

    @Override
    protected List<SemanticRecord> toRecords(final ThreadItem item, final GlossaryResponse response) {
        return glossaryRecords.toRecords(response, item.provenance());
    }
}
