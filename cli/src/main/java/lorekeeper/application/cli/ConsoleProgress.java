package lorekeeper.application.cli;

import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.extraction.ProgressCallback;

/**
 * Prints extraction progress to stderr, leaving stdout for the records.
 */
@ApplicationScoped
public class ConsoleProgress implements ProgressCallback {
    @Override
    public void onProgress(final int current, final int total) {
        if (current >= total) {
            System.err.println("Processed " + total + " items");
        } else {
            System.err.println("Processing item " + (current + 1) + " of " + total);
        }
    }
}
