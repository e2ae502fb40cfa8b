package io.fareway.core.store;

public enum FilterOp {
    EQ,
    ILIKE,
    GTE,
    LTE
}
