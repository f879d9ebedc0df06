package lorekeeper.domain.extraction;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets another thread stop a running extraction. The orchestrator checks it before starting each item, so an item is
 * either processed completely or not at all.
 */
public class ExtractionCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static ExtractionCancellation none() {
        return new ExtractionCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
