package io.fareway.core.config;

public enum RuntimeEnvironment {
    DEVELOPMENT,
    PRODUCTION,
    TEST
}
