package lorekeeper.domain.store;

import lorekeeper.domain.model.SemanticQuery;
import lorekeeper.domain.model.SemanticRecord;

import java.util.List;

/**
 * Durable, append-only storage for semantic records.
 * <p>
 * Failures are thrown as {@link lorekeeper.domain.exceptions.SemanticStoreFailure}.
 */
public interface SemanticStore {
    /**
     * Persist the records. Each record and its keyword index entries are written as one unit.
     *
     * @param records The records to save. Any id or creation time they carry is ignored.
     * @return The stored copies, with their assigned ids and creation times, in the order given
     */
    List<SemanticRecord> store(List<SemanticRecord> records);

    /**
     * Find the records matching the query, newest first.
     */
    List<SemanticRecord> retrieve(SemanticQuery query);

    default List<SemanticRecord> retrieveAll() {
        return retrieve(SemanticQuery.all());
    }
}
