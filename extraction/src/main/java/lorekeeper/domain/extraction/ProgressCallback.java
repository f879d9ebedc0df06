package lorekeeper.domain.extraction;

/**
 * Told how far through a batch the orchestrator is. Called synchronously on whatever thread runs the extraction.
 */
@FunctionalInterface
public interface ProgressCallback {
    void onProgress(int current, int total);
}
