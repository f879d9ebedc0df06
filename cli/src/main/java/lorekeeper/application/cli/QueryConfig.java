package lorekeeper.application.cli;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticQuery;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Builds the query run by the query command. Times are ISO instants, or dates that cover the whole day in UTC.
 */
@ApplicationScoped
public class QueryConfig {
    @Inject
    @ConfigProperty(name = "lk.query.kind")
    private Optional<String> kind;

    @Inject
    @ConfigProperty(name = "lk.query.keywords")
    private Optional<String> keywords;

    @Inject
    @ConfigProperty(name = "lk.query.origin")
    private Optional<String> origin;

    @Inject
    @ConfigProperty(name = "lk.query.from")
    private Optional<String> from;

    @Inject
    @ConfigProperty(name = "lk.query.to")
    private Optional<String> to;

    public SemanticQuery getQuery() {
        return SemanticQuery.all()
                .withKind(kind.filter(StringUtils::isNotBlank).map(SemanticKind::fromValue).orElse(null))
                .withOriginKind(origin.filter(StringUtils::isNotBlank).map(OriginKind::fromValue).orElse(null))
                .withKeywords(getKeywords())
                .withCreatedBetween(
                        parseTime(from.orElse(null), false),
                        parseTime(to.orElse(null), true));
    }

    private List<String> getKeywords() {
        return keywords
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(StringUtils::isNotBlank)
                        .toList())
                .orElse(List.of());
    }

    @Nullable
    private static Instant parseTime(@Nullable final String value, final boolean endOfDay) {
        if (StringUtils.isBlank(value)) {
            return null;
        }

        return Try.of(() -> Instant.parse(value.trim()))
                .recoverWith(ex -> Try.of(() -> LocalDate.parse(value.trim()))
                        .map(date -> endOfDay
                                ? date.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC)
                                : date.atStartOfDay().toInstant(ZoneOffset.UTC)))
                .getOrElseThrow(ex -> new IllegalArgumentException("Invalid time: " + value, ex));
    }
}
