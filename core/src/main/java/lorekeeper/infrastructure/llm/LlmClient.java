package lorekeeper.infrastructure.llm;

/**
 * A client for a generative text service.
 * <p>
 * Calls can be made without opening a connection first, in which case each call manages its own. Callers making
 * many calls in a row should open a connection with try-with-resources so it is reused:
 * <pre>
 * try (LlmConnection connection = llmClient.connect()) {
 *     items.forEach(item -&gt; llmClient.generate(prompt(item), 0.3));
 * }
 * </pre>
 */
public interface LlmClient {
    LlmConnection connect();

    /**
     * Generate free text.
     *
     * @throws RuntimeException An ExternalException when the service could not be called
     */
    String generate(String prompt, double temperature);

    /**
     * Generate a single JSON object and map it onto the given type. A response that can not be parsed is returned as
     * the mapping of an empty JSON object, so callers must handle missing fields.
     *
     * @throws RuntimeException An ExternalException when the service could not be called
     */
    <T> T generateStructured(String prompt, double temperature, Class<T> clazz);
}
