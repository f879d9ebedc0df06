package lorekeeper.domain.config;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Represents the common configuration of the generative text model.
 */
@ApplicationScoped
public class ModelConfig {
    private static final double DEFAULT_TEMPERATURE = 0.3;

    @Inject
    @ConfigProperty(name = "lk.llm.model", defaultValue = "llama3.2")
    private String model;

    @Inject
    @ConfigProperty(name = "lk.llm.temperature", defaultValue = "0.3")
    private String temperature;

    @Inject
    @ConfigProperty(name = "lk.llm.contextwindow")
    private Optional<String> contextWindow;

    public String getModel() {
        return model;
    }

    /**
     * The temperature used by extraction prompts. Invalid values fall back to the default rather than failing.
     */
    public double getTemperature() {
        return Try.of(() -> Double.parseDouble(temperature))
                .filter(value -> value >= 0 && value <= 2)
                .getOrElse(DEFAULT_TEMPERATURE);
    }

    @Nullable
    public Integer getContextWindow() {
        return contextWindow
                .filter(NumberUtils::isDigits)
                .map(Integer::parseInt)
                .orElse(null);
    }
}
