package lorekeeper.infrastructure.llm;

/**
 * A lease on the connection held by an {@link LlmClient}. The connection stays open until every lease is closed.
 */
public interface LlmConnection extends AutoCloseable {
    @Override
    void close();
}
