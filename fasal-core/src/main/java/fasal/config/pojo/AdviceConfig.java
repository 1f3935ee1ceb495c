package fasal.config.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * External text generation used for the optional personalised narrative.
 */
@Data
public class AdviceConfig {

    @JsonProperty("enable")
    private boolean enable = false;

    /**
     * OpenAI compatible chat completions endpoint.
     */
    @JsonProperty("api_address")
    private String apiAddress;

    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("model")
    private String model;

    @JsonProperty("timeout_millis")
    private int timeoutMillis = 8000;

    @JsonProperty("max_tokens")
    private int maxTokens = 800;

    @JsonProperty("temperature")
    private double temperature = 0;

    /**
     * Outbound requests per second, 0 disables throttling.
     */
    @JsonProperty("requests_per_second")
    private double requestsPerSecond = 0.5;

    @JsonProperty("cache_size")
    private int cacheSize = 200;

    @JsonProperty("prompt_template")
    private String promptTemplate = "/prompts/disease_advice.md";
}
