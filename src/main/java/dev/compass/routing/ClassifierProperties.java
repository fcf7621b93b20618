package dev.compass.routing;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the LLM-backed classifier, bound from {@code compass.classifier.*}. A blank {@code
 * apiKey} disables the LLM client and leaves only the keyword heuristic.
 */
@ConfigurationProperties(prefix = "compass.classifier")
public record ClassifierProperties(
    String apiKey,
    @DefaultValue("gpt-4o-mini") String model,
    @DefaultValue("0.0") double temperature,
    @DefaultValue("20s") Duration timeout) {}
