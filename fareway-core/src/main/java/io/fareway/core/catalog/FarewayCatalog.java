package io.fareway.core.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.store.RecordStore;
import io.fareway.core.tool.ToolDefinition;
import java.util.ArrayList;
import java.util.List;

public final class FarewayCatalog {
    private FarewayCatalog() {
    }

    /**
     * All tools served by the gateway, in advertised order: courses, accommodations, rates.
     */
    public static List<ToolDefinition> definitions(RecordStore store, ObjectMapper mapper) {
        List<ToolDefinition> all = new ArrayList<>();
        all.addAll(new CourseTools(store).definitions());
        all.addAll(new AccommodationTools(store, mapper).definitions());
        all.addAll(new RateTools(store).definitions());
        return List.copyOf(all);
    }
}
