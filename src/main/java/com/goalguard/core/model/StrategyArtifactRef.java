package com.goalguard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reference to a strategy artifact produced by the strategy generator.
 *
 * @param id         artifact identifier in the external artifact store
 * @param digest     content hash of the generated strategy definition
 * @param parameters parameters the strategy was generated with
 */
public record StrategyArtifactRef(
    String id,
    String digest,
    Map<String, Double> parameters
) implements Serializable {

    public StrategyArtifactRef {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(parameters));
    }
}
