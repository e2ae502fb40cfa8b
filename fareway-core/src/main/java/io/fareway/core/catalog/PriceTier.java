package io.fareway.core.catalog;

import io.fareway.core.store.Query;
import java.util.Locale;

/**
 * Green-fee brackets for recommendations, in minor currency units. Where two brackets share an
 * edge the lower one owns it: 15000 is budget, 35000 is standard.
 */
public enum PriceTier {
    BUDGET(null, 15_000L),
    STANDARD(15_001L, 35_000L),
    LUXURY(35_001L, null);

    private final Long minInclusive;
    private final Long maxInclusive;

    PriceTier(Long minInclusive, Long maxInclusive) {
        this.minInclusive = minInclusive;
        this.maxInclusive = maxInclusive;
    }

    public static PriceTier fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean contains(long priceCents) {
        return (minInclusive == null || priceCents >= minInclusive)
            && (maxInclusive == null || priceCents <= maxInclusive);
    }

    Query.Builder applyTo(Query.Builder query, String field) {
        if (minInclusive != null) {
            query.gte(field, minInclusive);
        }
        if (maxInclusive != null) {
            query.lte(field, maxInclusive);
        }
        return query;
    }

    static String[] wireNames() {
        PriceTier[] tiers = values();
        String[] names = new String[tiers.length];
        for (int i = 0; i < tiers.length; i++) {
            names[i] = tiers[i].wireName();
        }
        return names;
    }
}
