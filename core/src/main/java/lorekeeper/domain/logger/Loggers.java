package lorekeeper.domain.logger;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;
import org.jspecify.annotations.Nullable;

import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Produces a java.util.logging Logger for each injection point, all sharing one log file.
 */
@ApplicationScoped
public class Loggers {
    private static final String LOG_FILE = "Lorekeeper.log";

    @Nullable
    private FileHandler fileHandler;

    @PostConstruct
    private void init() {
        System.setProperty("java.util.logging.SimpleFormatter.format", "%1$tF %1$tT %4$s %3$s: %5$s%6$s%n");
        final SimpleFormatter formatter = new SimpleFormatter();
        this.fileHandler = Try.of(() -> new FileHandler(LOG_FILE, true))
                .onSuccess(handler -> handler.setFormatter(formatter))
                .getOrNull();
    }

    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Logger logger = Logger.getLogger(
                injectionPoint.getMember().getDeclaringClass().getName());

        if (fileHandler != null && !hasHandler(logger)) {
            logger.addHandler(fileHandler);
        }

        return logger;
    }

    private boolean hasHandler(final Logger logger) {
        for (final var handler : logger.getHandlers()) {
            if (handler == fileHandler) {
                return true;
            }
        }
        return false;
    }
}
