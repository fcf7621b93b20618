package dev.compass.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/** Activates {@code @Retryable} / {@code @Recover} processing for the search provider clients. */
@Configuration
@EnableRetry
public class RetryConfig {}
