package io.jobs4j.core;

import java.util.List;

/**
 * Outcome of reconciling configured jobs against persisted definitions.
 */
public record InitializationReport(
        List<String> created,
        List<String> updated,
        List<String> reenabled,
        List<String> disabled,
        List<String> unchanged
) {

    public InitializationReport {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        reenabled = List.copyOf(reenabled);
        disabled = List.copyOf(disabled);
        unchanged = List.copyOf(unchanged);
    }
}
