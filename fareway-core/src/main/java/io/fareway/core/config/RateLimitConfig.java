package io.fareway.core.config;

import java.time.Duration;

public record RateLimitConfig(Duration window, int maxRequests) {
}
