package lorekeeper.infrastructure.ollama.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaResponse(String model,
                             String created_at,
                             String done,
                             String done_reason,
                             String total_duration,
                             String eval_count,
                             String response) {
}
