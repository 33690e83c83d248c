package com.specgate.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An acceptance scenario. Clauses keep their text without the marker keyword.
 *
 * @param name    scenario name, or the raw item text for a compact one-line scenario
 * @param given   GIVEN clauses
 * @param when    WHEN clauses
 * @param then    THEN clauses
 * @param and     AND clauses
 * @param line    1-based source line
 */
public record ScenarioBlock(
    String name,
    List<String> given,
    List<String> when,
    List<String> then,
    List<String> and,
    int line
) implements Serializable {

    public boolean hasWhenAndThen() {
        return !when.isEmpty() && !then.isEmpty();
    }
}
