package com.cdflow.engine.model;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Who and what triggered a run, as resolved by the source-control layer.
 *
 * The engine treats every field as opaque text: it only turns them into
 * searchable run tags. All fields are optional.
 */
public record TriggerContext(
        String branch,
        String hash,
        String repository,
        String author,
        String triggeredBy,
        Map<String, String> extra
) {
    // Compact constructor: never hand out a null map; entries without a key or value are dropped.
    public TriggerContext {
        extra = extra == null ? Map.of() : extra.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static TriggerContext manual(String triggeredBy) {
        return new TriggerContext(null, null, null, null, triggeredBy, Map.of());
    }
}
