package lorekeeper.domain.logging;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Keeps the console quiet so only the JSON output and progress reach the terminal. The log file still gets everything.
 */
public class LogConfig {
    public static void init() {
        final Logger rootLogger = LogManager.getLogManager().getLogger("");
        rootLogger.setLevel(Level.WARNING);
        for (final Handler h : rootLogger.getHandlers()) {
            h.setLevel(Level.WARNING);
        }
    }
}
