package lorekeeper.domain.store;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.exceptionhandling.ExceptionHandler;
import lorekeeper.domain.exceptions.SemanticStoreFailure;
import lorekeeper.domain.json.JsonDeserializer;
import lorekeeper.domain.model.Provenance;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticPayload;
import lorekeeper.domain.model.SemanticQuery;
import lorekeeper.domain.model.SemanticRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stores semantic records in an embedded H2 file database.
 * <p>
 * A connection is opened for each operation and closed when it is done. Writes are serialized, and every record is
 * committed in its own transaction together with its keyword index entries, so a reader never sees half a record.
 */
@ApplicationScoped
public class H2SemanticStore implements SemanticStore {
    private static final int DELAY = 500;
    private static final String DATABASE_NAME = "semanticstore";

    @Inject
    @ConfigProperty(name = "lk.store.path", defaultValue = "./data")
    private String path;

    @Inject
    @ConfigProperty(name = "lk.store.connectionretries", defaultValue = "5")
    private String connectionRetries;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Nullable
    private Instant lastCreatedAt;

    @Override
    public List<SemanticRecord> store(final List<SemanticRecord> records) {
        checkNotNull(records, "records must not be null");

        if (records.isEmpty()) {
            return List.of();
        }

        synchronized (H2SemanticStore.class) {
            return Try.withResources(this::getConnection)
                    .of(connection -> {
                        connection.setAutoCommit(false);
                        final List<SemanticRecord> stored = new ArrayList<>();
                        for (final SemanticRecord record : records) {
                            stored.add(storeRecord(connection, record));
                        }
                        logger.info("Stored " + stored.size() + " semantic records");
                        return Collections.unmodifiableList(stored);
                    })
                    .getOrElseThrow(ex -> toStoreFailure("Failed to store semantic records", ex));
        }
    }

    @Override
    public List<SemanticRecord> retrieve(final SemanticQuery query) {
        checkNotNull(query, "query must not be null");

        final List<Object> parameters = new ArrayList<>();
        final String sql = buildQuery(query, parameters);

        logger.fine(sql);

        return Try.withResources(this::getConnection)
                .of(connection -> Try.withResources(() -> connection.prepareStatement(sql))
                        .of(statement -> {
                            for (int i = 0; i < parameters.size(); ++i) {
                                statement.setObject(i + 1, parameters.get(i));
                            }
                            return readRecords(statement);
                        })
                        .get())
                .map(results -> results.stream()
                        .filter(record -> query.originKind() == null
                                || record.provenance().originKind() == query.originKind())
                        .toList())
                .getOrElseThrow(ex -> toStoreFailure("Failed to retrieve semantic records", ex));
    }

    private SemanticRecord storeRecord(final Connection connection, final SemanticRecord record) {
        final Instant createdAt = nextCreatedAt(connection);

        return Try.of(() -> {
                    final long id = insertRecord(connection, record, createdAt);
                    insertKeywords(connection, id, record.keywords());
                    connection.commit();
                    return record.stored(id, createdAt);
                })
                .onFailure(ex -> Try.run(connection::rollback)
                        .onFailure(rollbackEx -> logger.warning(exceptionHandler.getExceptionMessage(rollbackEx))))
                .getOrElseThrow(ex -> new SemanticStoreFailure("Failed to store a " + record.kind().getValue() + " record", ex));
    }

    private long insertRecord(final Connection connection, final SemanticRecord record, final Instant createdAt) {
        return Try.withResources(() -> connection.prepareStatement("""
                        INSERT INTO SEMANTIC_RECORDS
                        (kind, content_json, metadata_json, keywords_json, source_json, created_at)
                        VALUES (?, ?, ?, ?, ?, ?)""".stripIndent(), Statement.RETURN_GENERATED_KEYS))
                .of(statement -> {
                    statement.setString(1, record.kind().getValue());
                    statement.setString(2, jsonDeserializer.serialize(record.payload()));
                    statement.setString(3, jsonDeserializer.serialize(record.payload().metadata()));
                    statement.setString(4, jsonDeserializer.serialize(record.keywords()));
                    statement.setString(5, jsonDeserializer.serialize(record.provenance()));
                    statement.setObject(6, OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));
                    statement.executeUpdate();

                    return Try.withResources(statement::getGeneratedKeys)
                            .of(keys -> {
                                if (!keys.next()) {
                                    throw new SemanticStoreFailure("No id was generated for the record");
                                }
                                return keys.getLong(1);
                            })
                            .get();
                })
                .get();
    }

    private void insertKeywords(final Connection connection, final long id, final Set<String> keywords) {
        final Set<String> indexed = new LinkedHashSet<>();
        for (final String keyword : keywords) {
            indexed.add(keyword.toLowerCase(Locale.ROOT));
        }

        if (indexed.isEmpty()) {
            return;
        }

        Try.withResources(() -> connection.prepareStatement("INSERT INTO KEYWORD_INDEX (keyword, record_id) VALUES (?, ?)"))
                .of(statement -> {
                    for (final String keyword : indexed) {
                        statement.setString(1, keyword);
                        statement.setLong(2, id);
                        statement.addBatch();
                    }
                    return statement.executeBatch();
                })
                .get();
    }

    /**
     * Creation times never go backwards for this store, even if the clock does.
     */
    private Instant nextCreatedAt(final Connection connection) {
        if (lastCreatedAt == null) {
            lastCreatedAt = getLatestCreatedAt(connection);
        }

        final Instant now = Instant.now();
        lastCreatedAt = lastCreatedAt == null || now.isAfter(lastCreatedAt) ? now : lastCreatedAt;
        return lastCreatedAt;
    }

    @Nullable
    private Instant getLatestCreatedAt(final Connection connection) {
        return Try.withResources(() -> connection.prepareStatement("SELECT MAX(created_at) FROM SEMANTIC_RECORDS"))
                .of(statement -> Try.withResources(statement::executeQuery)
                        .of(resultSet -> resultSet.next() ? resultSet.getObject(1, OffsetDateTime.class) : null)
                        .get())
                .map(latest -> latest == null ? null : latest.toInstant())
                .get();
    }

    private String buildQuery(final SemanticQuery query, final List<Object> parameters) {
        final StringBuilder sql = new StringBuilder("""
                SELECT id, kind, content_json, keywords_json, source_json, created_at
                FROM SEMANTIC_RECORDS
                WHERE 1 = 1""".stripIndent());

        if (query.kind() != null) {
            sql.append(" AND kind = ?");
            parameters.add(query.kind().getValue());
        }

        if (query.createdFrom() != null) {
            sql.append(" AND created_at >= ?");
            parameters.add(OffsetDateTime.ofInstant(query.createdFrom(), ZoneOffset.UTC));
        }

        if (query.createdTo() != null) {
            sql.append(" AND created_at <= ?");
            parameters.add(OffsetDateTime.ofInstant(query.createdTo(), ZoneOffset.UTC));
        }

        final List<String> keywords = query.keywords().stream()
                .filter(StringUtils::isNotBlank)
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();

        if (!keywords.isEmpty()) {
            sql.append(" AND id IN (SELECT record_id FROM KEYWORD_INDEX WHERE keyword IN (")
                    .append(String.join(", ", Collections.nCopies(keywords.size(), "?")))
                    .append("))");
            parameters.addAll(keywords);
        }

        sql.append(" ORDER BY created_at DESC, id DESC");

        return sql.toString();
    }

    private List<SemanticRecord> readRecords(final PreparedStatement statement) throws SQLException {
        return Try.withResources(statement::executeQuery)
                .of(resultSet -> {
                    final List<SemanticRecord> records = new ArrayList<>();
                    while (resultSet.next()) {
                        records.add(readRecord(resultSet));
                    }
                    return records;
                })
                .get();
    }

    private SemanticRecord readRecord(final ResultSet resultSet) throws SQLException {
        final SemanticKind kind = SemanticKind.fromValue(resultSet.getString("kind"));
        final SemanticPayload payload = jsonDeserializer.deserialize(resultSet.getString("content_json"), kind.getPayloadType());
        final List<String> keywords = jsonDeserializer.deserializeCollection(resultSet.getString("keywords_json"), String.class);
        final Provenance provenance = jsonDeserializer.deserialize(resultSet.getString("source_json"), Provenance.class);

        return new SemanticRecord(
                resultSet.getLong("id"),
                kind,
                payload,
                new LinkedHashSet<>(keywords),
                provenance,
                resultSet.getObject("created_at", OffsetDateTime.class).toInstant());
    }

    private Connection getConnection() {
        return getConnection(0);
    }

    private Connection getConnection(final int count) {
        final int maxRetries = NumberUtils.toInt(connectionRetries, 5);

        if (count > 0) {
            logger.info("Retrying connection to the semantic store " + count + " of " + maxRetries);
            // Sleep with some jitter
            try {
                Thread.sleep(DELAY + (int) (Math.random() * DELAY));
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SemanticStoreFailure("Interrupted while waiting to reconnect to the semantic store", e);
            }
        }

        return Try.of(() -> DriverManager.getConnection(getConnectionString()))
                .recover(ex -> {
                    logger.warning(exceptionHandler.getExceptionMessage(ex));

                    if (count < maxRetries) {
                        return getConnection(count + 1);
                    }

                    throw new SemanticStoreFailure("Failed to get a connection after " + maxRetries + " attempts", ex);
                })
                .get();
    }

    private String getDatabasePath() {
        return Paths.get(StringUtils.defaultIfBlank(path, "./data"), DATABASE_NAME).toAbsolutePath().toString();
    }

    private String getConnectionString() {
        return "jdbc:h2:file:" + getDatabasePath() + ";" + """
                INIT=CREATE TABLE IF NOT EXISTS SEMANTIC_RECORDS
                (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                kind VARCHAR(32) NOT NULL,
                content_json CLOB NOT NULL,
                metadata_json CLOB NOT NULL,
                keywords_json CLOB NOT NULL,
                source_json CLOB NOT NULL,
                created_at TIMESTAMP(9) WITH TIME ZONE NOT NULL)\\;
                CREATE TABLE IF NOT EXISTS KEYWORD_INDEX
                (keyword VARCHAR NOT NULL,
                record_id BIGINT NOT NULL,
                PRIMARY KEY (keyword, record_id),
                FOREIGN KEY (record_id) REFERENCES SEMANTIC_RECORDS(id))\\;
                CREATE INDEX IF NOT EXISTS idx_kind ON SEMANTIC_RECORDS(kind)\\;
                CREATE INDEX IF NOT EXISTS idx_created_at ON SEMANTIC_RECORDS(created_at)""".stripIndent().replaceAll("\n", " ");
    }

    private static SemanticStoreFailure toStoreFailure(final String message, final Throwable ex) {
        return ex instanceof SemanticStoreFailure failure ? failure : new SemanticStoreFailure(message, ex);
    }
}
