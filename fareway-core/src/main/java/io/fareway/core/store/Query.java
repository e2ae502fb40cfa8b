package io.fareway.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record Query(
    String table,
    List<String> columns,
    List<Filter> filters,
    String orderBy,
    boolean descending,
    Integer limit
) {
    public Query {
        Objects.requireNonNull(table, "table must not be null");
        columns = columns == null ? List.of() : List.copyOf(columns);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static Builder from(String table) {
        return new Builder(table);
    }

    public static final class Builder {
        private final String table;
        private final List<String> columns = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();
        private String orderBy;
        private boolean descending;
        private Integer limit;

        private Builder(String table) {
            this.table = table;
        }

        public Builder columns(String... names) {
            columns.addAll(List.of(names));
            return this;
        }

        public Builder eq(String field, Object value) {
            filters.add(new Filter(field, FilterOp.EQ, value));
            return this;
        }

        public Builder ilike(String field, String pattern) {
            filters.add(new Filter(field, FilterOp.ILIKE, pattern));
            return this;
        }

        /**
         * Case-insensitive substring match. LIKE metacharacters in {@code fragment} are escaped,
         * so {@code "_"} only matches a literal underscore.
         */
        public Builder containsIgnoreCase(String field, String fragment) {
            return ilike(field, "%" + escapeLike(fragment) + "%");
        }

        public Builder gte(String field, Object value) {
            filters.add(new Filter(field, FilterOp.GTE, value));
            return this;
        }

        public Builder lte(String field, Object value) {
            filters.add(new Filter(field, FilterOp.LTE, value));
            return this;
        }

        public Builder orderBy(String field, boolean desc) {
            this.orderBy = field;
            this.descending = desc;
            return this;
        }

        public Builder limit(int max) {
            this.limit = max;
            return this;
        }

        static String escapeLike(String fragment) {
            StringBuilder out = new StringBuilder(fragment.length());
            for (char c : fragment.toCharArray()) {
                if (c == Filter.LIKE_ESCAPE || c == '%' || c == '_') {
                    out.append(Filter.LIKE_ESCAPE);
                }
                out.append(c);
            }
            return out.toString();
        }

        public Query build() {
            return new Query(table, columns, filters, orderBy, descending, limit);
        }
    }
}
