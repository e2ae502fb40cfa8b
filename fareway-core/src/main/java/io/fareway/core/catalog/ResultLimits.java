package io.fareway.core.catalog;

import io.fareway.core.tool.ToolArguments;

final class ResultLimits {
    static final int MAX = 100;

    private ResultLimits() {
    }

    /**
     * Clamps the validated {@code limit} argument to 1..{@value #MAX}.
     */
    static int of(ToolArguments args) {
        long requested = args.longValue("limit");
        return (int) Math.max(1, Math.min(MAX, requested));
    }
}
