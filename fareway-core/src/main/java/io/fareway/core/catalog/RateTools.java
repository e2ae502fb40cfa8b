package io.fareway.core.catalog;

import io.fareway.core.store.Query;
import io.fareway.core.store.RecordStore;
import io.fareway.core.store.RecordStoreException;
import io.fareway.core.tool.CachePolicy;
import io.fareway.core.tool.ToolArguments;
import io.fareway.core.tool.ToolContext;
import io.fareway.core.tool.ToolDefinition;
import io.fareway.core.tool.ToolOutput;
import io.fareway.core.tool.schema.InputSchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RateTools {
    static final String TABLE = "operator_supplier_rates";
    private static final long RATES_TTL_SECONDS = 600;

    private final RecordStore store;

    public RateTools(RecordStore store) {
        this.store = store;
    }

    public List<ToolDefinition> definitions() {
        return List.of(
            new ToolDefinition(
                "get_supplier_rates",
                "Get tour operator's negotiated rates with suppliers (courses, hotels, etc). Always check this for cost savings!",
                InputSchema.builder()
                    .requiredUuid("operator_id", "UUID of the tour operator")
                    .optionalEnum("supplier_type", "Supplier category", "golf_course", "accommodation", "transport", "any")
                    .build(),
                this::supplierRates,
                CachePolicy.withTtl("rates", RATES_TTL_SECONDS)
            ),
            new ToolDefinition(
                "has_negotiated_rate",
                "Quick check if operator has a special negotiated rate with a specific supplier.",
                InputSchema.builder()
                    .requiredUuid("operator_id", "UUID of the tour operator")
                    .requiredUuid("supplier_id", "UUID of course or hotel")
                    .build(),
                this::hasNegotiatedRate,
                CachePolicy.none()
            ),
            new ToolDefinition(
                "get_operator_suppliers",
                "List all of an operator's supplier relationships and negotiated rates.",
                InputSchema.builder()
                    .requiredUuid("operator_id", "UUID of the tour operator")
                    .build(),
                this::operatorSuppliers,
                CachePolicy.withTtl("suppliers", RATES_TTL_SECONDS)
            )
        );
    }

    private ToolOutput supplierRates(ToolArguments args, ToolContext context) throws RecordStoreException {
        Query.Builder query = Query.from(TABLE)
            .columns(
                "id", "operator_id", "supplier_id", "supplier_type", "rate_cents",
                "discount_percentage", "valid_from", "valid_until", "notes"
            )
            .eq("operator_id", args.string("operator_id"));
        args.optionalString("supplier_type")
            .filter(type -> !"any".equals(type))
            .ifPresent(type -> query.eq("supplier_type", type));
        return ToolOutput.of(store.select(query.build(), context.deadline()));
    }

    private ToolOutput hasNegotiatedRate(ToolArguments args, ToolContext context) throws RecordStoreException {
        Query query = Query.from(TABLE)
            .columns("id", "rate_cents", "discount_percentage")
            .eq("operator_id", args.string("operator_id"))
            .eq("supplier_id", args.string("supplier_id"))
            .limit(1)
            .build();
        List<Map<String, Object>> rows = store.select(query, context.deadline());
        Map<String, Object> answer = new LinkedHashMap<>();
        if (rows.isEmpty()) {
            answer.put("has_rate", false);
            return ToolOutput.of(answer);
        }
        Map<String, Object> rate = rows.get(0);
        answer.put("has_rate", true);
        answer.put("rate_cents", rate.get("rate_cents"));
        answer.put("discount_percentage", rate.get("discount_percentage"));
        return ToolOutput.of(answer);
    }

    private ToolOutput operatorSuppliers(ToolArguments args, ToolContext context) throws RecordStoreException {
        Query query = Query.from(TABLE)
            .columns("supplier_id", "supplier_type", "rate_cents", "discount_percentage")
            .eq("operator_id", args.string("operator_id"))
            .build();
        return ToolOutput.of(store.select(query, context.deadline()));
    }
}
